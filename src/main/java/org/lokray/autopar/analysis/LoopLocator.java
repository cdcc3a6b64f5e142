package org.lokray.autopar.analysis;

import org.antlr.v4.runtime.Token;
import org.lokray.autopar.parser.CSourceLexer;
import org.lokray.autopar.source.SourceFile;
import org.lokray.autopar.source.StatementScanner;
import org.lokray.autopar.source.TokenizedSource;
import org.lokray.autopar.util.Debug;
import org.lokray.autopar.util.ErrorHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Finds ascending unit-step counting loops:
 * <pre>
 *   for (int v = init; v &lt; bound; v++)
 * </pre>
 * All three clauses must name the same variable. Other loop forms are ignored. Once a
 * loop is recorded, scanning resumes on the line after its extent, so loops nested in it
 * are never located on their own.
 */
public class LoopLocator
{
	static final Set<String> INTEGER_TYPES = Set.of(
			"int", "long", "short", "unsigned", "signed", "size_t", "ptrdiff_t",
			"int32_t", "int64_t", "uint32_t", "uint64_t");

	private final ErrorHandler errorHandler;

	public LoopLocator(ErrorHandler errorHandler)
	{
		this.errorHandler = errorHandler;
	}

	private record LoopHeader(String variable, int closeParen)
	{
	}

	public List<LocatedLoop> locate(SourceFile source, TokenizedSource tokens, LineFunctionMap functions)
	{
		List<Token> code = tokens.getCode();
		StatementScanner scanner = new StatementScanner(code);
		List<LocatedLoop> loops = new ArrayList<>();

		int k = 0;
		while (k < code.size())
		{
			LoopHeader header = null;
			if (code.get(k).getType() == CSourceLexer.FOR && tokens.isFirstOnLine(k))
			{
				header = parseHeader(code, scanner, k);
			}
			if (header == null)
			{
				k++;
				continue;
			}

			Token forToken = code.get(k);
			int startLine = TokenizedSource.lineOf(forToken);
			String functionName = functions.functionAt(startLine);

			int endLine = startLine;
			List<Token> body = List.of();
			int bodyStart = header.closeParen() + 1;
			int bodyEnd = scanner.statementEnd(bodyStart);

			if (bodyEnd == StatementScanner.NO_END)
			{
				errorHandler.logWarning(forToken, "loop body is not terminated, treating it as empty", functionName);
			}
			else
			{
				endLine = TokenizedSource.lineOf(code.get(bodyEnd));
				body = scanner.type(bodyStart) == CSourceLexer.LBRACE
						? code.subList(bodyStart + 1, bodyEnd)
						: code.subList(bodyStart, bodyEnd + 1);
			}

			LocatedLoop loop = new LocatedLoop(
					startLine,
					endLine,
					header.variable(),
					source.indentOf(startLine),
					functionName,
					body,
					tokens.hasOmpPragmaBefore(startLine));
			loops.add(loop);
			Debug.logDebug("Loop over '" + loop.loopVariable() + "' at lines " + (startLine + 1) + "-" + (endLine + 1));

			k = tokens.firstTokenAfterLine(endLine, k + 1);
		}
		return loops;
	}

	/**
	 * @return the parsed header, or null when the tokens after {@code for} are not a
	 * canonical counting-loop header.
	 */
	private static LoopHeader parseHeader(List<Token> code, StatementScanner scanner, int forIndex)
	{
		int j = forIndex + 1;
		if (scanner.type(j++) != CSourceLexer.LPAREN)
		{
			return null;
		}

		// 1. Declaration: one or more integer type words, then the variable
		int typeWords = 0;
		while (true)
		{
			if (isIdentifier(code, scanner, j, "std") && scanner.type(j + 1) == CSourceLexer.SCOPE)
			{
				j += 2;
			}
			else if (scanner.type(j) == CSourceLexer.IDENTIFIER
					&& INTEGER_TYPES.contains(code.get(j).getText())
					&& scanner.type(j + 1) == CSourceLexer.IDENTIFIER)
			{
				typeWords++;
				j++;
			}
			else
			{
				break;
			}
		}
		if (typeWords == 0 || scanner.type(j) != CSourceLexer.IDENTIFIER)
		{
			return null;
		}
		String variable = code.get(j++).getText();
		if (scanner.type(j++) != CSourceLexer.ASSIGN)
		{
			return null;
		}
		int initEnd = clauseEnd(scanner, j);
		if (initEnd <= j)
		{
			return null;
		}

		// 2. Condition: v < bound
		j = initEnd + 1;
		if (!isIdentifier(code, scanner, j, variable) || scanner.type(j + 1) != CSourceLexer.LT)
		{
			return null;
		}
		j += 2;
		int conditionEnd = clauseEnd(scanner, j);
		if (conditionEnd <= j)
		{
			return null;
		}

		// 3. Increment: v++
		j = conditionEnd + 1;
		if (!isIdentifier(code, scanner, j, variable)
				|| scanner.type(j + 1) != CSourceLexer.INC
				|| scanner.type(j + 2) != CSourceLexer.RPAREN)
		{
			return null;
		}
		return new LoopHeader(variable, j + 2);
	}

	/**
	 * @return index of the ';' ending a header clause, or -1 if the header closes first
	 */
	private static int clauseEnd(StatementScanner scanner, int start)
	{
		int depth = 0;
		for (int i = start; scanner.type(i) != Token.EOF; i++)
		{
			switch (scanner.type(i))
			{
				case CSourceLexer.LPAREN, CSourceLexer.LBRACKET, CSourceLexer.LBRACE -> depth++;
				case CSourceLexer.RPAREN, CSourceLexer.RBRACKET, CSourceLexer.RBRACE ->
				{
					if (--depth < 0)
					{
						return -1;
					}
				}
				case CSourceLexer.SEMI ->
				{
					if (depth == 0)
					{
						return i;
					}
				}
				default ->
				{
				}
			}
		}
		return -1;
	}

	private static boolean isIdentifier(List<Token> code, StatementScanner scanner, int index, String text)
	{
		return scanner.type(index) == CSourceLexer.IDENTIFIER && code.get(index).getText().equals(text);
	}
}
