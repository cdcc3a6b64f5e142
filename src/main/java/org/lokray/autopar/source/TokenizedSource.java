package org.lokray.autopar.source;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;
import org.lokray.autopar.parser.CSourceLexer;
import org.lokray.autopar.util.ErrorHandler;
import org.lokray.autopar.util.SyntaxErrorListener;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * The token view of a source buffer, split by lexer channel.
 * Code tokens drive every scanner; preprocessor directives are kept aside for the
 * header and pragma checks; comments are dropped.
 */
public class TokenizedSource
{
	private static final Pattern PRAGMA_OMP = Pattern.compile("^#\\s*pragma\\s+omp\\b.*", Pattern.DOTALL);

	private final List<Token> code;
	private final List<Token> directives;

	private TokenizedSource(List<Token> code, List<Token> directives)
	{
		this.code = List.copyOf(code);
		this.directives = List.copyOf(directives);
	}

	public static TokenizedSource tokenize(String text, ErrorHandler errorHandler)
	{
		CSourceLexer lexer = new CSourceLexer(CharStreams.fromString(text));

		// Remove default error listeners to use our own
		lexer.removeErrorListeners();
		lexer.addErrorListener(new SyntaxErrorListener(errorHandler));

		List<Token> code = new ArrayList<>();
		List<Token> directives = new ArrayList<>();
		for (Token token : lexer.getAllTokens())
		{
			if (token.getChannel() == Token.DEFAULT_CHANNEL)
			{
				code.add(token);
			}
			else if (token.getChannel() == CSourceLexer.DIRECTIVES)
			{
				directives.add(token);
			}
		}
		return new TokenizedSource(code, directives);
	}

	public static TokenizedSource tokenize(SourceFile source, ErrorHandler errorHandler)
	{
		return tokenize(source.getText(), errorHandler);
	}

	public List<Token> getCode()
	{
		return code;
	}

	public List<Token> getDirectives()
	{
		return directives;
	}

	/**
	 * @return the 0-based line index a token starts on.
	 */
	public static int lineOf(Token token)
	{
		return token.getLine() - 1;
	}

	/**
	 * @return the 0-based line index a token ends on; directives may span continuation lines.
	 */
	public static int lastLineOf(Token token)
	{
		String text = token.getText();
		int line = lineOf(token);
		for (int i = 0; i < text.length(); i++)
		{
			if (text.charAt(i) == '\n')
			{
				line++;
			}
		}
		return line;
	}

	/**
	 * True when no other code token precedes {@code code.get(index)} on its line.
	 */
	public boolean isFirstOnLine(int index)
	{
		return index == 0 || code.get(index - 1).getLine() < code.get(index).getLine();
	}

	/**
	 * @return the index of the first code token that starts after {@code lineIndex}, or
	 * the token count when there is none.
	 */
	public int firstTokenAfterLine(int lineIndex, int fromIndex)
	{
		int k = fromIndex;
		while (k < code.size() && lineOf(code.get(k)) <= lineIndex)
		{
			k++;
		}
		return k;
	}

	/**
	 * True when an {@code #pragma omp} directive ends on the line right above {@code lineIndex}.
	 */
	public boolean hasOmpPragmaBefore(int lineIndex)
	{
		for (Token directive : directives)
		{
			if (lastLineOf(directive) == lineIndex - 1 && PRAGMA_OMP.matcher(directive.getText()).matches())
			{
				return true;
			}
		}
		return false;
	}
}
