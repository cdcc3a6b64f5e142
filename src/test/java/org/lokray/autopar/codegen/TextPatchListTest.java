package org.lokray.autopar.codegen;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextPatchListTest
{
	@TempDir
	Path tempDir;

	private static Path resource(String name) throws Exception
	{
		return Paths.get(TextPatchListTest.class.getResource(name).toURI());
	}

	private Path write(String json) throws Exception
	{
		Path file = tempDir.resolve("patches.json");
		Files.writeString(file, json, StandardCharsets.UTF_8);
		return file;
	}

	@Test
	void loadsAndAppliesPatches() throws Exception
	{
		TextPatchList patches = TextPatchList.load(resource("/patches/benchmark-title.json"));

		List<String> output = patches.applyTo(List.of(
				"    cout << \"=== Sequential Image Benchmark ===\" << endl;\n",
				"    cout << \"Total: \" << t << endl << endl;\n",
				"    cout << \"Total: \" << u << endl << endl;\n"), "\n");

		assertEquals("benchmark-title", patches.getName());
		assertEquals(2, patches.size());
		assertEquals(List.of(
				"    cout << \"=== Parallel Image Benchmark (OpenMP) ===\" << endl;\n",
				"    cout << \"Total: \" << t << endl;\n",
				"    cout << \"Threads: \" << omp_get_max_threads() << endl << endl;\n",
				"    cout << \"Total: \" << u << endl << endl;\n"), output);
	}

	@Test
	void replacesOnEveryMatchingLineByDefault() throws Exception
	{
		TextPatchList patches = TextPatchList.load(write(
				"{ \"patches\": [ { \"find\": \"serial\", \"replaceWith\": \"parallel\" } ] }"));

		assertEquals("patches.json", patches.getName());
		assertEquals(List.of("parallel a\n", "b\n", "parallel c"),
				patches.applyTo(List.of("serial a\n", "b\n", "serial c"), "\n"));
	}

	@Test
	void insertAfterAnUnterminatedLastLine() throws Exception
	{
		TextPatchList patches = TextPatchList.load(write(
				"{ \"patches\": [ { \"whenLineContains\": [\"end\"], \"insertAfter\": \"// done\" } ] }"));

		assertEquals(List.of("end\r\n", "// done\r\n"), patches.applyTo(List.of("end"), "\r\n"));
	}

	@Test
	void emptyListChangesNothing()
	{
		List<String> lines = List.of("a\n", "b\n");

		assertEquals(lines, TextPatchList.empty().applyTo(lines, "\n"));
	}

	@Test
	void rejectsMalformedLists() throws Exception
	{
		Path notAnObject = write("[1, 2");
		assertThrows(IllegalArgumentException.class, () -> TextPatchList.load(notAnObject));

		Path noPatches = write("{ \"name\": \"x\" }");
		assertThrows(IllegalArgumentException.class, () -> TextPatchList.load(noPatches));

		Path matchesNothing = write("{ \"patches\": [ { \"replaceWith\": \"y\" } ] }");
		assertThrows(IllegalArgumentException.class, () -> TextPatchList.load(matchesNothing));

		Path findsWithoutAction = write("{ \"patches\": [ { \"find\": \"x\" } ] }");
		assertThrows(IllegalArgumentException.class, () -> TextPatchList.load(findsWithoutAction));
	}
}
