package org.lokray.autopar.analysis;

import org.antlr.v4.runtime.Token;

import java.util.List;

/**
 * A canonical counting loop as found by {@link LoopLocator}, before its body is classified.
 * Lines are 0-based; the body holds the code tokens between the braces (or the single
 * body statement) and is empty when the extent could not be closed.
 */
public record LocatedLoop(
		int startLine,
		int endLine,
		String loopVariable,
		String indent,
		String functionName,
		List<Token> body,
		boolean alreadyAnnotated
)
{
	public LocatedLoop
	{
		body = List.copyOf(body);
	}
}
