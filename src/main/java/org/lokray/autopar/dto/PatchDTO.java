package org.lokray.autopar.dto;

import java.util.ArrayList;
import java.util.List;

public class PatchDTO
{
	public String description;

	// Every string must occur in a line for the patch to touch it
	public List<String> whenLineContains = new ArrayList<>();

	public String find;
	public String replaceWith;

	// A whole line (without terminator) inserted after each patched line
	public String insertAfter;

	public boolean stopAfterFirst = false;
}
