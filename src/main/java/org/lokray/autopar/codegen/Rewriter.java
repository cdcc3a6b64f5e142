package org.lokray.autopar.codegen;

import org.antlr.v4.runtime.Token;
import org.lokray.autopar.source.SourceFile;
import org.lokray.autopar.source.TokenizedSource;
import org.lokray.autopar.util.Debug;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Produces the output lines: the OpenMP runtime include, one directive per parallelized
 * loop, then the optional text patches.
 */
public class Rewriter
{
	public static final String RUNTIME_INCLUDE = "#include <omp.h>";

	private static final Pattern INCLUDE = Pattern.compile("^#\\s*include\\b.*", Pattern.DOTALL);
	private static final Pattern RUNTIME_HEADER = Pattern.compile("^#\\s*include\\s*[<\"]omp\\.h[>\"].*", Pattern.DOTALL);

	private final TextPatchList patches;

	public Rewriter(TextPatchList patches)
	{
		this.patches = patches;
	}

	public List<String> rewrite(SourceFile source, TokenizedSource tokens, List<LoopDirective> directives)
	{
		String separator = source.getLineSeparator();
		EditPlan plan = new EditPlan();

		// 1. Runtime header, always the first edit so it precedes a directive on the same line
		int headerLine = runtimeHeaderLine(tokens);
		if (headerLine >= 0)
		{
			Debug.logDebug("Inserting " + RUNTIME_INCLUDE + " before line " + (headerLine + 1));
			plan.insertBefore(headerLine, RUNTIME_INCLUDE + separator);
		}

		// 2. Directives, each against its loop's original header line
		for (LoopDirective directive : directives)
		{
			plan.insertBefore(directive.loop().startLine(), directive.directive() + separator);
		}

		List<String> lines = plan.applyTo(source.getLines(), separator);

		// 3. Cosmetic substitutions
		return patches.applyTo(lines, separator);
	}

	/**
	 * @return the original line the runtime include should be inserted before, or -1 when
	 * the source already includes it
	 */
	int runtimeHeaderLine(TokenizedSource tokens)
	{
		int afterLastInclude = 0;
		for (Token directive : tokens.getDirectives())
		{
			String text = directive.getText();
			if (RUNTIME_HEADER.matcher(text).matches())
			{
				return -1;
			}
			if (INCLUDE.matcher(text).matches())
			{
				afterLastInclude = TokenizedSource.lastLineOf(directive) + 1;
			}
		}
		return afterLastInclude;
	}
}
