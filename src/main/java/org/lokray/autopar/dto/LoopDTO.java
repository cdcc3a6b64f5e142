package org.lokray.autopar.dto;

import java.util.ArrayList;
import java.util.List;

public class LoopDTO
{
	public int index;
	public String functionName;

	// 1-based, as shown to users
	public int startLine;
	public int endLine;

	public String loopVariable;
	public boolean parallelizable;
	public boolean alreadyAnnotated;
	public String directive; // null when none was inserted
	public List<String> reductions = new ArrayList<>();
	public List<String> findings = new ArrayList<>();
}
