package org.lokray.autopar.dto;

import java.util.ArrayList;
import java.util.List;

public class ReportDTO
{
	public String inputFile;
	public String outputFile; // null in check-only runs
	public int totalLoops;
	public int parallelizedLoops;
	public List<LoopDTO> loops = new ArrayList<>();
	public List<String> warnings = new ArrayList<>();
}
