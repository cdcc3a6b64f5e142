package org.lokray.autopar;

import org.lokray.autopar.analysis.LoopRecord;
import org.lokray.autopar.codegen.LoopDirective;

import java.util.List;

/**
 * Everything one run produces before emission.
 *
 * @param loops       every located loop, in source order
 * @param directives  the directives inserted, in source order
 * @param outputLines the rewritten source, each line with its terminator
 * @param warnings    non-fatal problems met while scanning
 */
public record ParallelizationResult(
		List<LoopRecord> loops,
		List<LoopDirective> directives,
		List<String> outputLines,
		List<String> warnings
)
{
	public ParallelizationResult
	{
		loops = List.copyOf(loops);
		directives = List.copyOf(directives);
		outputLines = List.copyOf(outputLines);
		warnings = List.copyOf(warnings);
	}

	public long parallelizedCount()
	{
		return loops.stream().filter(LoopRecord::parallelizable).count();
	}

	public String outputText()
	{
		return String.join("", outputLines);
	}
}
