package org.lokray.autopar.util;

import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the non-fatal problems found while scanning a source file.
 * Nothing recorded here aborts a run: lexical garbage is skipped and unterminated
 * loop bodies degrade to empty ones.
 */
public class ErrorHandler
{
	private final List<String> warnings = new ArrayList<>();

	public void logWarning(Token token, String msg, String functionName)
	{
		logWarning(token.getLine(), token.getCharPositionInLine(), msg, functionName);
	}

	public void logWarning(int line, int charPositionInLine, String msg, String functionName)
	{
		String context = functionName == null || functionName.isEmpty() ? "<global>" : functionName;
		String warning = String.format("[Analysis Warning] %s - line %d:%d - %s",
				context, line, charPositionInLine + 1, msg);
		Debug.logWarning(warning);
		warnings.add(warning);
	}

	public void logLexicalWarning(int line, int charPositionInLine, String msg)
	{
		String warning = String.format("[Lexical Warning] line %d:%d - %s", line, charPositionInLine + 1, msg);
		Debug.logDebug(warning);
		warnings.add(warning);
	}

	public int getWarningCount()
	{
		return warnings.size();
	}

	public List<String> getWarnings()
	{
		return Collections.unmodifiableList(warnings);
	}
}
