package org.lokray.autopar.codegen;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * An ordered set of line insertions, all expressed against the original line numbers.
 * Edits can be added in any order; {@link #applyTo(List, String)} resolves them in a single pass,
 * so no edit ever shifts the position of another.
 */
public class EditPlan
{
	private final List<SourceEdit> edits = new ArrayList<>();

	public EditPlan insertBefore(int line, String text)
	{
		if (line < 0)
		{
			throw new IllegalArgumentException("Negative insertion line: " + line);
		}
		edits.add(new SourceEdit(line, edits.size(), text));
		return this;
	}

	public List<SourceEdit> getEdits()
	{
		return edits.stream()
				.sorted(Comparator.comparingInt(SourceEdit::line).thenComparingInt(SourceEdit::sequence))
				.toList();
	}

	public boolean isEmpty()
	{
		return edits.isEmpty();
	}

	/**
	 * @param lines         original lines, each with its terminator
	 * @param lineSeparator terminator added to an unterminated last line before appending after it
	 * @return a new list with every edit applied
	 */
	public List<String> applyTo(List<String> lines, String lineSeparator)
	{
		List<SourceEdit> sorted = getEdits();
		if (!sorted.isEmpty() && sorted.get(sorted.size() - 1).line() > lines.size())
		{
			throw new IllegalArgumentException("Edit past the end of the source: line " + sorted.get(sorted.size() - 1).line());
		}

		List<String> output = new ArrayList<>(lines.size() + sorted.size());
		int next = 0;
		for (int line = 0; line <= lines.size(); line++)
		{
			while (next < sorted.size() && sorted.get(next).line() == line)
			{
				if (line == lines.size() && !output.isEmpty() && !endsWithNewline(output.get(output.size() - 1)))
				{
					output.set(output.size() - 1, output.get(output.size() - 1) + lineSeparator);
				}
				output.add(sorted.get(next).text());
				next++;
			}
			if (line < lines.size())
			{
				output.add(lines.get(line));
			}
		}
		return output;
	}

	private static boolean endsWithNewline(String line)
	{
		return line.endsWith("\n");
	}
}
