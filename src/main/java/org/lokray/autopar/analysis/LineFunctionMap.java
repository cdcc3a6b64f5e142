package org.lokray.autopar.analysis;

import java.util.Arrays;
import java.util.List;

/**
 * Total, read-only mapping from every line index to the name of the innermost function
 * containing it ("" outside of any function).
 */
public final class LineFunctionMap
{
	private final String[] names;
	private final List<FunctionScope> scopes;

	LineFunctionMap(int lineCount, List<FunctionScope> scopes)
	{
		this.names = new String[lineCount];
		this.scopes = List.copyOf(scopes);
		Arrays.fill(names, "");

		// Scopes are ordered by where they open, so nested ones overwrite their parents
		for (FunctionScope scope : this.scopes)
		{
			int last = Math.min(scope.endLine(), lineCount - 1);
			for (int line = Math.max(scope.startLine(), 0); line <= last; line++)
			{
				names[line] = scope.name();
			}
		}
	}

	public String functionAt(int line)
	{
		if (line < 0 || line >= names.length)
		{
			return "";
		}
		return names[line];
	}

	public int size()
	{
		return names.length;
	}

	public List<FunctionScope> getScopes()
	{
		return scopes;
	}
}
