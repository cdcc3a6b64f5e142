package org.lokray.autopar.codegen;

import org.junit.jupiter.api.Test;
import org.lokray.autopar.analysis.LoopRecord;
import org.lokray.autopar.source.SourceFile;
import org.lokray.autopar.source.TokenizedSource;
import org.lokray.autopar.util.ErrorHandler;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RewriterTest
{
	private final Rewriter rewriter = new Rewriter(TextPatchList.empty());

	private List<String> rewrite(String text, List<LoopDirective> directives)
	{
		SourceFile source = SourceFile.fromText("test.cpp", text);
		return rewriter.rewrite(source, TokenizedSource.tokenize(source, new ErrorHandler()), directives);
	}

	private static int headerLine(String text)
	{
		return new Rewriter(TextPatchList.empty()).runtimeHeaderLine(TokenizedSource.tokenize(text, new ErrorHandler()));
	}

	private static LoopDirective directive(int line, String text)
	{
		LoopRecord loop = new LoopRecord(line, line, "i", true, List.of(), List.of(), "", "", false, List.of());
		return new LoopDirective(loop, text);
	}

	@Test
	void headerGoesAfterTheLastInclude()
	{
		assertEquals(List.of(
				"#include <stdio.h>\n",
				"#include \"grid.h\"\n",
				"#include <omp.h>\n",
				"int x;\n"), rewrite("#include <stdio.h>\n#include \"grid.h\"\nint x;\n", List.of()));
	}

	@Test
	void headerGoesFirstWithoutIncludes()
	{
		assertEquals(0, headerLine("int x;\n"));
		assertEquals(0, headerLine("// #include <stdio.h>\nint x;\n"));
		assertEquals(List.of("#include <omp.h>\n", "int x;\n"), rewrite("int x;\n", List.of()));
	}

	@Test
	void existingRuntimeHeaderIsNotDuplicated()
	{
		assertEquals(-1, headerLine("#include <omp.h>\nint x;\n"));
		assertEquals(-1, headerLine("#include <vector>\n#  include \"omp.h\"\n"));
		assertEquals(List.of("#include <omp.h>\n", "int x;\n"), rewrite("#include <omp.h>\nint x;\n", List.of()));
	}

	@Test
	void headerFollowsAMultiLineInclude()
	{
		assertEquals(2, headerLine("#include \\\n  <stdio.h>\nint x;\n"));
	}

	@Test
	void directivesGoRightAboveTheirLoops()
	{
		String text = "#include <a.h>\n"
				+ "for (int i = 0; i < n; i++) a[i] = 0;\n"
				+ "x = 1;\n"
				+ "for (int i = 0; i < n; i++) b[i] = 0;\n";

		List<String> output = rewrite(text, List.of(directive(3, "#pragma B"), directive(1, "#pragma A")));

		assertEquals(List.of(
				"#include <a.h>\n",
				"#include <omp.h>\n",
				"#pragma A\n",
				"for (int i = 0; i < n; i++) a[i] = 0;\n",
				"x = 1;\n",
				"#pragma B\n",
				"for (int i = 0; i < n; i++) b[i] = 0;\n"), output);
	}

	@Test
	void headerPrecedesADirectiveOnTheSameLine()
	{
		List<String> output = rewrite("for (int i = 0; i < n; i++) a[i] = 0;\n", List.of(directive(0, "#pragma A")));

		assertEquals(List.of(
				"#include <omp.h>\n",
				"#pragma A\n",
				"for (int i = 0; i < n; i++) a[i] = 0;\n"), output);
	}

	@Test
	void insertedLinesUseTheSourceLineSeparator()
	{
		assertEquals(List.of("#include <a.h>\r\n", "#include <omp.h>\r\n", "int x;\r\n"),
				rewrite("#include <a.h>\r\nint x;\r\n", List.of()));
	}
}
