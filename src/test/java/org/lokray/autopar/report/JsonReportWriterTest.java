package org.lokray.autopar.report;

import org.junit.jupiter.api.Test;
import org.lokray.autopar.dto.LoopDTO;
import org.lokray.autopar.dto.ReportDTO;

import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportWriterTest
{
	private final JsonReportWriter writer = new JsonReportWriter();

	@Test
	void loopsAreNumberedFromOneWithOneBasedLines()
	{
		ReportDTO report = writer.toDTO(Paths.get("in.cpp"), Paths.get("out.cpp"), ReportPrinterTest.result());

		assertEquals(2, report.totalLoops);
		assertEquals(1, report.parallelizedLoops);
		assertEquals(List.of("[Lexical Warning] x"), report.warnings);

		LoopDTO total = report.loops.get(0);
		assertEquals(1, total.index);
		assertEquals(27, total.startLine);
		assertEquals(29, total.endLine);
		assertEquals("#pragma omp parallel for reduction(+:sum)", total.directive);
		assertEquals(List.of("+:sum"), total.reductions);

		LoopDTO dump = report.loops.get(1);
		assertEquals(2, dump.index);
		assertNull(dump.directive);
		assertEquals(List.of("performs I/O (cout)"), dump.findings);
	}

	@Test
	void nullsAreSerialized()
	{
		String json = writer.toJson(writer.toDTO(Paths.get("in.cpp"), null, ReportPrinterTest.result()));

		assertTrue(json.contains("\"outputFile\": null"));
		assertTrue(json.contains("\"directive\": null"));
	}
}
