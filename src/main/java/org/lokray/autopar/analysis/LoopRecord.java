package org.lokray.autopar.analysis;

import java.util.List;

/**
 * One detected top-level counting loop and its verdict. Immutable once built.
 *
 * @param startLine          0-based line of the {@code for} keyword
 * @param endLine            0-based line where the body closes, {@code >= startLine}
 * @param privateVariables   always empty: variables declared in the body are already private
 *                           under {@code parallel for}
 * @param functionName       enclosing function at {@code startLine}, "" when unresolved
 * @param indent             leading whitespace of the header line, reused for the directive
 * @param alreadyAnnotated   an {@code #pragma omp} directive already sits on the line above
 */
public record LoopRecord(
		int startLine,
		int endLine,
		String loopVariable,
		boolean parallelizable,
		List<Reduction> reductionVariables,
		List<String> privateVariables,
		String functionName,
		String indent,
		boolean alreadyAnnotated,
		List<String> findings
)
{
	public LoopRecord
	{
		if (endLine < startLine)
		{
			throw new IllegalArgumentException("Loop ends (" + endLine + ") before it starts (" + startLine + ")");
		}
		reductionVariables = List.copyOf(reductionVariables);
		privateVariables = List.copyOf(privateVariables);
		findings = List.copyOf(findings);
	}

	public static LoopRecord of(LocatedLoop loop, DependencyReport report)
	{
		return new LoopRecord(
				loop.startLine(),
				loop.endLine(),
				loop.loopVariable(),
				report.isParallelizable(),
				report.reductions(),
				report.privateVariables(),
				loop.functionName(),
				loop.indent(),
				loop.alreadyAnnotated(),
				report.findings());
	}

	/**
	 * True when the rewriter should insert a directive for this loop.
	 */
	public boolean needsDirective()
	{
		return parallelizable && !alreadyAnnotated;
	}
}
