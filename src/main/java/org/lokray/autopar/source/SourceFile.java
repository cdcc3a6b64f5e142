package org.lokray.autopar.source;

import org.lokray.autopar.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * An in-memory source buffer. Lines keep their terminators so that untouched lines
 * are emitted byte for byte.
 */
public final class SourceFile
{
	private final String name;
	private final String text;
	private final List<String> lines;
	private final String lineSeparator;

	private SourceFile(String name, String text)
	{
		this.name = name;
		this.text = text;
		this.lines = List.copyOf(FileUtils.splitLines(text));
		this.lineSeparator = detectLineSeparator(lines);
	}

	public static SourceFile fromText(String name, String text)
	{
		return new SourceFile(name, text);
	}

	public static SourceFile load(Path path) throws IOException
	{
		return new SourceFile(path.toString(), FileUtils.load(path));
	}

	private static String detectLineSeparator(List<String> lines)
	{
		for (String line : lines)
		{
			if (line.endsWith("\r\n"))
			{
				return "\r\n";
			}
			if (line.endsWith("\n"))
			{
				return "\n";
			}
		}
		return "\n";
	}

	public String getName()
	{
		return name;
	}

	public String getText()
	{
		return text;
	}

	public List<String> getLines()
	{
		return lines;
	}

	public int getLineCount()
	{
		return lines.size();
	}

	public String getLineSeparator()
	{
		return lineSeparator;
	}

	/**
	 * @return the leading spaces and tabs of the given line, verbatim.
	 */
	public String indentOf(int lineIndex)
	{
		String line = lines.get(lineIndex);
		int end = 0;
		while (end < line.length() && (line.charAt(end) == ' ' || line.charAt(end) == '\t'))
		{
			end++;
		}
		return line.substring(0, end);
	}
}
