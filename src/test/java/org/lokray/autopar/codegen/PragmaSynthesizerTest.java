package org.lokray.autopar.codegen;

import org.junit.jupiter.api.Test;
import org.lokray.autopar.analysis.LoopRecord;
import org.lokray.autopar.analysis.Reduction;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PragmaSynthesizerTest
{
	private final PragmaSynthesizer synthesizer = new PragmaSynthesizer();

	private static LoopRecord loop(String indent, List<Reduction> reductions, List<String> privateVariables)
	{
		return new LoopRecord(3, 5, "i", true, reductions, privateVariables, "f", indent, false, List.of());
	}

	@Test
	void bareDirectiveKeepsIndent()
	{
		assertEquals("    #pragma omp parallel for", synthesizer.synthesize(loop("    ", List.of(), List.of())));
	}

	@Test
	void oneClausePerReduction()
	{
		LoopRecord record = loop("\t", List.of(new Reduction("sum", "+"), new Reduction("mask", "|")), List.of());

		assertEquals("\t#pragma omp parallel for reduction(+:sum) reduction(|:mask)", synthesizer.synthesize(record));
	}

	@Test
	void privateClauseLeavesOutTheInductionVariable()
	{
		assertEquals("#pragma omp parallel for private(tmp,row)",
				synthesizer.synthesize(loop("", List.of(), List.of("i", "tmp", "row"))));
		assertEquals("#pragma omp parallel for",
				synthesizer.synthesize(loop("", List.of(), List.of("i"))));
	}

	@Test
	void privateClauseIsDroppedAlongsideReductions()
	{
		LoopRecord record = loop("", List.of(new Reduction("sum", "+")), List.of("tmp"));

		assertEquals("#pragma omp parallel for reduction(+:sum)", synthesizer.synthesize(record));
	}
}
