package org.lokray.autopar.analysis;

/**
 * A function definition found by {@link FunctionContextTracker}.
 * Lines are 0-based and inclusive: from the line holding the function name to the
 * line of its closing brace.
 */
public record FunctionScope(
		String name,
		int startLine,
		int endLine,
		int depth // enclosing namespace and class scopes, 0 at file level
)
{
}
