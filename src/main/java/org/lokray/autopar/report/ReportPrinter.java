package org.lokray.autopar.report;

import org.lokray.autopar.ParallelizationResult;
import org.lokray.autopar.analysis.LoopRecord;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Prints the human-readable summary of a run.
 */
public class ReportPrinter
{
	private static final String RULE = "=".repeat(50);

	private final PrintStream out;
	private final boolean verbose;

	public ReportPrinter(PrintStream out, boolean verbose)
	{
		this.out = out;
		this.verbose = verbose;
	}

	/**
	 * @param outputFile null when nothing was written
	 */
	public void print(Path inputFile, Path outputFile, ParallelizationResult result)
	{
		List<LoopRecord> loops = result.loops();

		out.println("Auto-Parallelization Report");
		out.println(RULE);
		out.println("Input file: " + inputFile);
		out.println("Output file: " + (outputFile != null ? outputFile : "(none, check only)"));
		out.println();
		out.println("Parallelized " + result.parallelizedCount() + " out of " + loops.size() + " loops:");
		out.println();

		for (int i = 0; i < loops.size(); i++)
		{
			LoopRecord loop = loops.get(i);
			String where = "Loop " + (i + 1) + " in function '" + loop.functionName() + "' (line " + (loop.startLine() + 1) + ")";
			if (loop.parallelizable())
			{
				out.println("✓ " + where + (loop.alreadyAnnotated() ? " - already annotated" : ""));
				if (!loop.reductionVariables().isEmpty())
				{
					out.println("  - Reduction operations: " + loop.reductionVariables());
				}
				if (!loop.privateVariables().isEmpty())
				{
					out.println("  - Private variables: " + loop.privateVariables());
				}
			}
			else
			{
				out.println("✗ " + where + " - Not parallelizable");
				if (verbose)
				{
					loop.findings().forEach(finding -> out.println("  - " + finding));
				}
			}
		}

		if (!result.warnings().isEmpty())
		{
			out.println();
			out.println(result.warnings().size() + " warning(s) while scanning the source.");
		}

		out.println();
		out.println(RULE);
		out.println(outputFile != null ? "Parallel code generated successfully!" : "Analysis complete, no output written.");
	}
}
