package org.lokray.autopar.codegen;

import org.lokray.autopar.analysis.LoopRecord;
import org.lokray.autopar.analysis.Reduction;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the {@code #pragma omp parallel for} line for a parallelizable loop.
 */
public class PragmaSynthesizer
{
	public static final String DIRECTIVE = "#pragma omp parallel for";

	/**
	 * @return the directive line, indented like the loop header, without a line terminator
	 */
	public String synthesize(LoopRecord loop)
	{
		List<String> clauses = new ArrayList<>();

		for (Reduction reduction : loop.reductionVariables())
		{
			clauses.add(reduction.clause());
		}

		// The induction variable is private already; private and reduction never mix
		List<String> privateVariables = loop.privateVariables().stream()
				.filter(v -> !v.equals(loop.loopVariable()))
				.toList();
		if (!privateVariables.isEmpty() && loop.reductionVariables().isEmpty())
		{
			clauses.add("private(" + String.join(",", privateVariables) + ")");
		}

		if (clauses.isEmpty())
		{
			return loop.indent() + DIRECTIVE;
		}
		return loop.indent() + DIRECTIVE + " " + String.join(" ", clauses);
	}
}
