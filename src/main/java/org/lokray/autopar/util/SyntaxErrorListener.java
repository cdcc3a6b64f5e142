package org.lokray.autopar.util;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Routes token recognition errors from the C source lexer into the {@link ErrorHandler}.
 * The lexer skips the offending character and carries on, so these are warnings only.
 */
public class SyntaxErrorListener extends BaseErrorListener
{
	private final ErrorHandler errorHandler;

	public SyntaxErrorListener(ErrorHandler errorHandler)
	{
		this.errorHandler = errorHandler;
	}

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e)
	{
		errorHandler.logLexicalWarning(line, charPositionInLine, msg);
	}
}
