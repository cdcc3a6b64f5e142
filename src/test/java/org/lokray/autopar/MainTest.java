package org.lokray.autopar;

import com.google.gson.Gson;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lokray.autopar.dto.ReportDTO;
import org.lokray.autopar.util.Debug;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class MainTest
{
	@TempDir
	Path tempDir;

	@AfterEach
	void resetDebug()
	{
		Debug.ENABLE_DEBUG = false;
	}

	private Path copySample() throws Exception
	{
		Path sample = Paths.get(MainTest.class.getResource("/samples/image_benchmark.cpp").toURI());
		return Files.copy(sample, tempDir.resolve("image_benchmark.cpp"));
	}

	@Test
	void writesParallelOutputAndJsonReport() throws Exception
	{
		Path input = copySample();
		Path output = tempDir.resolve("out/image_parallel.cpp");
		Path json = tempDir.resolve("report.json");

		int code = Main.run(new String[]{input.toString(), output.toString(), "-r", json.toString()});

		assertEquals(Main.EXIT_OK, code);
		String written = Files.readString(output, StandardCharsets.UTF_8);
		assertTrue(written.contains("#include <omp.h>\n"));
		assertTrue(written.contains("    #pragma omp parallel for reduction(+:sum)\n"));

		ReportDTO report = new Gson().fromJson(Files.readString(json, StandardCharsets.UTF_8), ReportDTO.class);
		assertEquals(input.toString(), report.inputFile);
		assertEquals(output.toString(), report.outputFile);
		assertEquals(4, report.totalLoops);
		assertEquals(2, report.parallelizedLoops);
		assertEquals("total", report.loops.get(1).functionName);
		assertEquals(27, report.loops.get(1).startLine);
		assertEquals("#pragma omp parallel for reduction(+:sum)", report.loops.get(1).directive);
		assertEquals(1, report.loops.get(1).reductions.size());
		assertEquals("+:sum", report.loops.get(1).reductions.get(0));
		assertNull(report.loops.get(2).directive);
	}

	@Test
	void checkOnlyWritesNothing() throws Exception
	{
		Path input = copySample();
		Path output = tempDir.resolve("never.cpp");

		assertEquals(Main.EXIT_OK, Main.run(new String[]{"-k", input.toString(), "-o", output.toString()}));
		assertFalse(Files.exists(output));
	}

	@Test
	void verboseRunSucceeds() throws Exception
	{
		Path input = copySample();
		Path output = tempDir.resolve("verbose.cpp");

		assertEquals(Main.EXIT_OK, Main.run(new String[]{"--verbose", input.toString(), output.toString()}));
		assertTrue(Debug.ENABLE_DEBUG);
		assertTrue(Files.exists(output));
	}

	@Test
	void missingInputIsAnIoFailure()
	{
		Path output = tempDir.resolve("out.cpp");

		assertEquals(Main.EXIT_IO, Main.run(new String[]{tempDir.resolve("missing.cpp").toString(), output.toString()}));
		assertFalse(Files.exists(output));
	}

	@Test
	void failedWriteLeavesNoPartialFile() throws Exception
	{
		Path input = copySample();
		Path blocked = Files.createDirectory(tempDir.resolve("blocked"));
		Files.writeString(blocked.resolve("keep.txt"), "keep");

		assertEquals(Main.EXIT_IO, Main.run(new String[]{input.toString(), blocked.toString()}));
		assertTrue(Files.isDirectory(blocked));
		try (Stream<Path> files = Files.list(tempDir))
		{
			assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
		}
	}

	@Test
	void failedReportWriteLeavesNoOutput() throws Exception
	{
		Path input = copySample();
		Path output = tempDir.resolve("out.cpp");
		Path reportDir = Files.createDirectory(tempDir.resolve("reportdir"));
		Files.writeString(reportDir.resolve("keep.txt"), "keep");

		assertEquals(Main.EXIT_IO, Main.run(new String[]{input.toString(), output.toString(), "-r", reportDir.toString()}));
		assertFalse(Files.exists(output));
		assertTrue(Files.isDirectory(reportDir));
	}

	@Test
	void malformedPatchListIsAUsageError() throws Exception
	{
		Path input = copySample();
		Path patches = tempDir.resolve("patches.json");
		Files.writeString(patches, "{ \"patches\": [ { \"replaceWith\": \"x\" } ] }");
		Path output = tempDir.resolve("out.cpp");

		assertEquals(Main.EXIT_USAGE, Main.run(new String[]{input.toString(), output.toString(), "-p", patches.toString()}));
		assertFalse(Files.exists(output));
	}

	@Test
	void usageErrors()
	{
		assertEquals(Main.EXIT_USAGE, Main.run(new String[]{}));
		assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"--frobnicate", "in.cpp"}));
		assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"in.cpp", "-o"}));
	}

	@Test
	void helpAndVersion()
	{
		assertEquals(Main.EXIT_OK, Main.run(new String[]{"--help"}));
		assertEquals(Main.EXIT_OK, Main.run(new String[]{"--version"}));
	}
}
