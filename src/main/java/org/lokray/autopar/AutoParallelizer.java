package org.lokray.autopar;

import org.lokray.autopar.analysis.DependencyAnalyzer;
import org.lokray.autopar.analysis.DependencyReport;
import org.lokray.autopar.analysis.FunctionContextTracker;
import org.lokray.autopar.analysis.LineFunctionMap;
import org.lokray.autopar.analysis.LocatedLoop;
import org.lokray.autopar.analysis.LoopLocator;
import org.lokray.autopar.analysis.LoopRecord;
import org.lokray.autopar.codegen.LoopDirective;
import org.lokray.autopar.codegen.PragmaSynthesizer;
import org.lokray.autopar.codegen.Rewriter;
import org.lokray.autopar.codegen.TextPatchList;
import org.lokray.autopar.source.SourceFile;
import org.lokray.autopar.source.TokenizedSource;
import org.lokray.autopar.util.Debug;
import org.lokray.autopar.util.ErrorHandler;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the analysis and rewrite phases over one source buffer.
 * Each phase consumes the complete output of the one before; the rewrite needs the
 * final loop list. Loading and emission are left to the caller.
 */
public class AutoParallelizer
{
	private final TextPatchList patches;

	public AutoParallelizer()
	{
		this(TextPatchList.empty());
	}

	public AutoParallelizer(TextPatchList patches)
	{
		this.patches = patches;
	}

	public ParallelizationResult parallelize(SourceFile source)
	{
		ErrorHandler errorHandler = new ErrorHandler();
		TokenizedSource tokens = TokenizedSource.tokenize(source, errorHandler);

		// --- Function index ---
		enter(Phase.INDEX_FUNCTIONS);
		LineFunctionMap functions = new FunctionContextTracker().index(source, tokens);
		Debug.logDebug("Found " + functions.getScopes().size() + " function definition(s).");

		// --- Loop location ---
		enter(Phase.LOCATE_LOOPS);
		List<LocatedLoop> located = new LoopLocator(errorHandler).locate(source, tokens, functions);
		Debug.logDebug("Found " + located.size() + " counting loop(s).");

		// --- Body classification ---
		enter(Phase.ANALYZE_EACH_LOOP);
		DependencyAnalyzer analyzer = new DependencyAnalyzer();
		List<LoopRecord> loops = new ArrayList<>();
		for (LocatedLoop loop : located)
		{
			DependencyReport report = analyzer.analyze(loop.body(), loop.loopVariable());
			LoopRecord record = LoopRecord.of(loop, report);
			loops.add(record);
			if (!record.parallelizable())
			{
				Debug.logDebug("Line " + (record.startLine() + 1) + ": " + String.join("; ", record.findings()));
			}
		}

		// --- Directives ---
		enter(Phase.SYNTHESIZE_DIRECTIVES);
		PragmaSynthesizer synthesizer = new PragmaSynthesizer();
		List<LoopDirective> directives = new ArrayList<>();
		for (LoopRecord loop : loops)
		{
			if (loop.needsDirective())
			{
				directives.add(new LoopDirective(loop, synthesizer.synthesize(loop)));
			}
			else if (loop.alreadyAnnotated())
			{
				Debug.logDebug("Line " + (loop.startLine() + 1) + " already carries an OpenMP directive, leaving it alone.");
			}
		}

		// --- Rewrite ---
		enter(Phase.REWRITE);
		List<String> output = new Rewriter(patches).rewrite(source, tokens, directives);

		return new ParallelizationResult(loops, directives, output, errorHandler.getWarnings());
	}

	static void enter(Phase phase)
	{
		Debug.logDebug("PHASE " + (phase.ordinal() + 1) + ": " + phase);
	}
}
