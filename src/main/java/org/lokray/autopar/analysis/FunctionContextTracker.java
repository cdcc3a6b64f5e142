package org.lokray.autopar.analysis;

import org.antlr.v4.runtime.Token;
import org.lokray.autopar.parser.CSourceLexer;
import org.lokray.autopar.source.SourceFile;
import org.lokray.autopar.source.StatementScanner;
import org.lokray.autopar.source.TokenizedSource;
import org.lokray.autopar.util.Debug;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Builds the line to function-name mapping with an explicit scope stack.
 * <p>
 * A scope is pushed for every '{' and popped at its '}'. While the stack holds no
 * function, an identifier followed by a balanced parameter list and then a '{' (before
 * any ';') opens a function scope. Lines stop belonging to a function at its closing
 * brace.
 */
public class FunctionContextTracker
{
	// Identifiers that take a parenthesized argument but never name a function definition
	private static final Set<String> NOT_FUNCTION_NAMES = Set.of(
			"sizeof", "alignof", "alignas", "decltype", "typeof", "static_assert", "catch",
			"noexcept", "throw", "requires", "defined", "__attribute__", "__declspec");

	private enum ScopeKind
	{
		DECLARATION, // file level, namespace, class or struct body
		FUNCTION,
		BLOCK // any brace nested in a function
	}

	private record ScopeFrame(ScopeKind kind, String name, int startLine, int startIndex, int depth)
	{
	}

	private record ClosedFunction(FunctionScope scope, int startIndex)
	{
	}

	public LineFunctionMap index(SourceFile source, TokenizedSource tokens)
	{
		List<Token> code = tokens.getCode();
		StatementScanner scanner = new StatementScanner(code);
		Deque<ScopeFrame> stack = new ArrayDeque<>();
		List<ClosedFunction> functions = new ArrayList<>();

		int k = 0;
		while (k < code.size())
		{
			Token token = code.get(k);
			int type = token.getType();

			if (type == CSourceLexer.IDENTIFIER && !insideFunction(stack))
			{
				int paramsOpen = parameterListStart(code, scanner, k);
				int bodyOpen = paramsOpen < 0 ? -1 : definitionBodyStart(scanner, paramsOpen);
				if (bodyOpen >= 0)
				{
					String name = qualifiedName(code, scanner, k, paramsOpen);
					int line = TokenizedSource.lineOf(token);
					Debug.logDebug("Function '" + name + "' opens at line " + (line + 1));
					stack.push(new ScopeFrame(ScopeKind.FUNCTION, name, line, k, stack.size()));
					k = bodyOpen + 1;
					continue;
				}
			}

			if (type == CSourceLexer.LBRACE)
			{
				ScopeKind kind = insideFunction(stack) ? ScopeKind.BLOCK : ScopeKind.DECLARATION;
				stack.push(new ScopeFrame(kind, "", TokenizedSource.lineOf(token), k, stack.size()));
			}
			else if (type == CSourceLexer.RBRACE && !stack.isEmpty())
			{
				ScopeFrame frame = stack.pop();
				if (frame.kind() == ScopeKind.FUNCTION)
				{
					functions.add(close(frame, TokenizedSource.lineOf(token)));
				}
			}
			k++;
		}

		// Unterminated bodies run to the end of the file
		int lastLine = Math.max(source.getLineCount() - 1, 0);
		while (!stack.isEmpty())
		{
			ScopeFrame frame = stack.pop();
			if (frame.kind() == ScopeKind.FUNCTION)
			{
				functions.add(close(frame, lastLine));
			}
		}

		List<FunctionScope> scopes = functions.stream()
				.sorted(Comparator.comparingInt(ClosedFunction::startIndex))
				.map(ClosedFunction::scope)
				.toList();
		return new LineFunctionMap(source.getLineCount(), scopes);
	}

	private static ClosedFunction close(ScopeFrame frame, int endLine)
	{
		return new ClosedFunction(new FunctionScope(frame.name(), frame.startLine(), endLine, frame.depth()), frame.startIndex());
	}

	private static boolean insideFunction(Deque<ScopeFrame> stack)
	{
		for (ScopeFrame frame : stack)
		{
			if (frame.kind() != ScopeKind.DECLARATION)
			{
				return true;
			}
		}
		return false;
	}

	/**
	 * @return index of the '(' opening the parameter list that belongs to the name at
	 * {@code nameIndex}, or -1 if the name is not followed by one.
	 */
	private static int parameterListStart(List<Token> code, StatementScanner scanner, int nameIndex)
	{
		String name = code.get(nameIndex).getText();
		if (NOT_FUNCTION_NAMES.contains(name))
		{
			return -1;
		}
		int previous = scanner.type(nameIndex - 1);
		if (previous == CSourceLexer.DOT || previous == CSourceLexer.ARROW)
		{
			return -1;
		}

		if (name.equals("operator"))
		{
			// operator()(...) or operator<sym>(...)
			int j = nameIndex + 1;
			if (scanner.type(j) == CSourceLexer.LPAREN && scanner.type(j + 1) == CSourceLexer.RPAREN)
			{
				j += 2;
			}
			while (j < code.size() && j <= nameIndex + 3 && scanner.type(j) != CSourceLexer.LPAREN)
			{
				j++;
			}
			return scanner.type(j) == CSourceLexer.LPAREN ? j : -1;
		}

		return scanner.type(nameIndex + 1) == CSourceLexer.LPAREN ? nameIndex + 1 : -1;
	}

	/**
	 * @return index of the '{' opening the body, or -1 when the signature turns out to be a
	 * prototype, a call or a variable initialisation.
	 */
	private static int definitionBodyStart(StatementScanner scanner, int paramsOpen)
	{
		int paramsClose = scanner.matchingClose(paramsOpen);
		if (paramsClose == StatementScanner.NO_END)
		{
			return -1;
		}

		// qualifiers, trailing return types and constructor initializer lists may follow
		int j = paramsClose + 1;
		boolean initializerList = false;
		while (true)
		{
			switch (scanner.type(j))
			{
				case CSourceLexer.COLON:
					initializerList = true;
					j++;
					break;
				case CSourceLexer.LBRACE:
				{
					// member{value} and Base<T>{value} in an initializer list
					int previous = scanner.type(j - 1);
					if (!initializerList || (previous != CSourceLexer.IDENTIFIER && previous != CSourceLexer.GT))
					{
						return j;
					}
					int close = scanner.matchingClose(j);
					if (close == StatementScanner.NO_END)
					{
						return -1;
					}
					j = close + 1;
					break;
				}
				case CSourceLexer.LPAREN:
				{
					int close = scanner.matchingClose(j);
					if (close == StatementScanner.NO_END)
					{
						return -1;
					}
					j = close + 1;
					break;
				}
				case CSourceLexer.SEMI:
				case CSourceLexer.RBRACE:
				case CSourceLexer.ASSIGN:
				case Token.EOF:
					return -1;
				default:
					j++;
			}
		}
	}

	private static String qualifiedName(List<Token> code, StatementScanner scanner, int nameIndex, int paramsOpen)
	{
		StringBuilder name = new StringBuilder();
		for (int i = nameIndex; i < paramsOpen; i++)
		{
			name.append(code.get(i).getText());
		}

		int j = nameIndex;
		if (scanner.type(j - 1) == CSourceLexer.TILDE)
		{
			name.insert(0, '~');
			j--;
		}
		while (scanner.type(j - 1) == CSourceLexer.SCOPE && scanner.type(j - 2) == CSourceLexer.IDENTIFIER)
		{
			name.insert(0, code.get(j - 2).getText() + "::");
			j -= 2;
		}
		return name.toString();
	}
}
