package org.lokray.autopar.analysis;

import org.junit.jupiter.api.Test;
import org.lokray.autopar.source.SourceFile;
import org.lokray.autopar.source.TokenizedSource;
import org.lokray.autopar.util.ErrorHandler;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FunctionContextTrackerTest
{
	private static LineFunctionMap index(String text)
	{
		SourceFile source = SourceFile.fromText("test.cpp", text);
		return new FunctionContextTracker().index(source, TokenizedSource.tokenize(source, new ErrorHandler()));
	}

	@Test
	void mapsEveryLineToItsEnclosingFunction()
	{
		LineFunctionMap functions = index(
				"#include <cstdio>\n"          // 0
						+ "int helper(int x);\n"       // 1
						+ "struct Point {\n"           // 2
						+ "    Point(int a) : x(a) {\n" // 3
						+ "    }\n"                    // 4
						+ "    int x;\n"               // 5
						+ "};\n"                       // 6
						+ "namespace geo {\n"          // 7
						+ "double area(double r)\n"    // 8
						+ "{\n"                        // 9
						+ "    return r * r;\n"        // 10
						+ "}\n"                        // 11
						+ "}\n"                        // 12
						+ "int global = compute(3);\n" // 13
						+ "int Point::get() const {\n" // 14
						+ "    return x;\n"            // 15
						+ "}\n");                      // 16

		assertEquals(17, functions.size());
		assertEquals("", functions.functionAt(0));
		assertEquals("", functions.functionAt(1));
		assertEquals("Point", functions.functionAt(3));
		assertEquals("Point", functions.functionAt(4));
		assertEquals("", functions.functionAt(5));
		assertEquals("area", functions.functionAt(8));
		assertEquals("area", functions.functionAt(10));
		assertEquals("area", functions.functionAt(11));
		assertEquals("", functions.functionAt(12));
		assertEquals("", functions.functionAt(13));
		assertEquals("Point::get", functions.functionAt(14));
		assertEquals("Point::get", functions.functionAt(16));
	}

	@Test
	void recordsScopesInSourceOrderWithNestingDepth()
	{
		List<FunctionScope> scopes = index(
				"namespace a {\n"
						+ "void f() {\n"
						+ "}\n"
						+ "}\n"
						+ "void g() { if (x) { y(); } }\n").getScopes();

		assertEquals(List.of(new FunctionScope("f", 1, 2, 1), new FunctionScope("g", 4, 4, 0)), scopes);
	}

	@Test
	void linesAfterAClosedFunctionAreOutsideIt()
	{
		LineFunctionMap functions = index(
				"void f() {\n"
						+ "    for (;;) { }\n"
						+ "}\n"
						+ "int trailing;\n");

		assertEquals("f", functions.functionAt(1));
		assertEquals("", functions.functionAt(3));
	}

	@Test
	void unterminatedFunctionRunsToEndOfFile()
	{
		LineFunctionMap functions = index("void f() {\n    int a;\n");

		assertEquals("f", functions.functionAt(1));
		assertEquals("", functions.functionAt(7));
	}

	@Test
	void destructorsAndOperatorsAreNamed()
	{
		LineFunctionMap functions = index(
				"Grid::~Grid() {\n"
						+ "}\n"
						+ "bool operator==(const Grid& o) const {\n"
						+ "}\n");

		assertEquals("Grid::~Grid", functions.functionAt(0));
		assertEquals("operator==", functions.functionAt(2));
	}

	@Test
	void braceInitializedMembersAreSkippedToTheConstructorBody()
	{
		LineFunctionMap functions = index(
				"struct Grid {\n"                             // 0
						+ "    int n;\n"                             // 1
						+ "    std::vector<int> v;\n"                // 2
						+ "    Grid(int size) : n{size}, v(size) {\n" // 3
						+ "        for (int i = 0; i < n; i++) {\n"  // 4
						+ "            v[i] = i;\n"                  // 5
						+ "        }\n"                              // 6
						+ "    }\n"                                  // 7
						+ "};\n");                                   // 8

		assertEquals("Grid", functions.functionAt(3));
		assertEquals("Grid", functions.functionAt(4));
		assertEquals("Grid", functions.functionAt(7));
		assertEquals("", functions.functionAt(8));
		assertEquals(List.of(new FunctionScope("Grid", 3, 7, 1)), functions.getScopes());
	}
}
