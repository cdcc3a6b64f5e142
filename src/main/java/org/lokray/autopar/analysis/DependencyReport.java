package org.lokray.autopar.analysis;

import java.util.List;

/**
 * Signals computed by {@link DependencyAnalyzer} for one loop body.
 *
 * @param findings human-readable reasons the body is not parallelizable, empty otherwise
 */
public record DependencyReport(
		boolean simpleArrayAccess,
		boolean hasIo,
		boolean hasBreakContinue,
		boolean hasEarlyExit,
		boolean hasDependencies,
		List<Reduction> reductions,
		List<String> privateVariables,
		List<String> findings
)
{
	public DependencyReport
	{
		reductions = List.copyOf(reductions);
		privateVariables = List.copyOf(privateVariables);
		findings = List.copyOf(findings);
	}

	public boolean isParallelizable()
	{
		return simpleArrayAccess && !hasIo && !hasBreakContinue && !hasEarlyExit && !hasDependencies;
	}
}
