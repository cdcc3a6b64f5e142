package org.lokray.autopar.source;

import org.antlr.v4.runtime.Token;
import org.lokray.autopar.parser.CSourceLexer;

import java.util.List;

/**
 * A small recursive-descent scanner over code tokens. It does not build expressions;
 * it only finds where brackets close and where statements end.
 * Every lookup returns -1 when the construct runs off the end of the token list.
 */
public class StatementScanner
{
	public static final int NO_END = -1;

	private final List<Token> tokens;

	public StatementScanner(List<Token> tokens)
	{
		this.tokens = tokens;
	}

	public int type(int index)
	{
		return index >= 0 && index < tokens.size() ? tokens.get(index).getType() : Token.EOF;
	}

	/**
	 * @param openIndex index of a '(', '[' or '{' token
	 * @return index of the bracket closing it, or {@link #NO_END}
	 */
	public int matchingClose(int openIndex)
	{
		int open = type(openIndex);
		int close;
		switch (open)
		{
			case CSourceLexer.LPAREN -> close = CSourceLexer.RPAREN;
			case CSourceLexer.LBRACKET -> close = CSourceLexer.RBRACKET;
			case CSourceLexer.LBRACE -> close = CSourceLexer.RBRACE;
			default -> throw new IllegalArgumentException("Not an opening bracket at token " + openIndex);
		}

		int depth = 0;
		for (int i = openIndex; i < tokens.size(); i++)
		{
			int t = tokens.get(i).getType();
			if (t == open)
			{
				depth++;
			}
			else if (t == close)
			{
				depth--;
				if (depth == 0)
				{
					return i;
				}
			}
		}
		return NO_END;
	}

	/**
	 * @param start index of the first token of a statement
	 * @return index of the statement's last token, or {@link #NO_END}
	 */
	public int statementEnd(int start)
	{
		switch (type(start))
		{
			case Token.EOF:
				return NO_END;
			case CSourceLexer.LBRACE:
				return matchingClose(start);
			case CSourceLexer.SEMI:
				return start;
			case CSourceLexer.FOR:
			case CSourceLexer.WHILE:
			case CSourceLexer.SWITCH:
			{
				if (type(start + 1) != CSourceLexer.LPAREN)
				{
					return expressionStatementEnd(start);
				}
				int close = matchingClose(start + 1);
				return close == NO_END ? NO_END : statementEnd(close + 1);
			}
			case CSourceLexer.IF:
			{
				if (type(start + 1) != CSourceLexer.LPAREN)
				{
					return expressionStatementEnd(start);
				}
				int close = matchingClose(start + 1);
				if (close == NO_END)
				{
					return NO_END;
				}
				int thenEnd = statementEnd(close + 1);
				if (thenEnd != NO_END && type(thenEnd + 1) == CSourceLexer.ELSE)
				{
					return statementEnd(thenEnd + 2);
				}
				return thenEnd;
			}
			case CSourceLexer.DO:
			{
				int bodyEnd = statementEnd(start + 1);
				if (bodyEnd == NO_END || type(bodyEnd + 1) != CSourceLexer.WHILE || type(bodyEnd + 2) != CSourceLexer.LPAREN)
				{
					return NO_END;
				}
				int close = matchingClose(bodyEnd + 2);
				if (close == NO_END)
				{
					return NO_END;
				}
				return type(close + 1) == CSourceLexer.SEMI ? close + 1 : close;
			}
			default:
				return expressionStatementEnd(start);
		}
	}

	/**
	 * Scans to the ';' that ends an expression or declaration statement. Brackets are
	 * skipped as units, so lambdas and brace initializers do not end it early.
	 */
	private int expressionStatementEnd(int start)
	{
		int depth = 0;
		for (int i = start; i < tokens.size(); i++)
		{
			switch (tokens.get(i).getType())
			{
				case CSourceLexer.LPAREN, CSourceLexer.LBRACKET, CSourceLexer.LBRACE -> depth++;
				case CSourceLexer.RPAREN, CSourceLexer.RBRACKET, CSourceLexer.RBRACE ->
				{
					depth--;
					if (depth < 0)
					{
						// closes the enclosing construct: the statement never ended
						return NO_END;
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
		return NO_END;
	}
}
