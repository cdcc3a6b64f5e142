package org.lokray.autopar.dto;

import java.util.List;

public class PatchListDTO
{
	public String name;

	// Required; left null by Gson when the file has no "patches" key
	public List<PatchDTO> patches;
}
