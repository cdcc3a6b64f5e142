package org.lokray.autopar;

import org.lokray.autopar.codegen.TextPatchList;
import org.lokray.autopar.report.JsonReportWriter;
import org.lokray.autopar.report.ReportPrinter;
import org.lokray.autopar.source.SourceFile;
import org.lokray.autopar.util.Debug;
import org.lokray.autopar.util.FileUtils;
import org.lokray.autopar.util.ParallelizerArguments;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point: parses arguments, loads the source, runs the
 * {@link AutoParallelizer}, writes the output and prints the report.
 */
public class Main
{
	public static final String VERSION = "0.1.0-alpha";

	public static final int EXIT_OK = 0;
	public static final int EXIT_USAGE = 1;
	public static final int EXIT_IO = 2;

	private static final List<String> SOURCE_EXTENSIONS = List.of(".c", ".cc", ".cpp", ".cxx", ".h", ".hh", ".hpp", ".hxx");

	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	public static int run(String[] args)
	{
		ParallelizerArguments arguments;
		try
		{
			arguments = ParallelizerArguments.parse(args);
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			ParallelizerArguments.printUsage();
			return EXIT_USAGE;
		}

		if (arguments.isHelpFlag())
		{
			ParallelizerArguments.printUsage();
			return EXIT_OK;
		}
		if (arguments.isVersionFlag())
		{
			System.out.println("autopar (OpenMP auto-parallelizer) version " + VERSION);
			return EXIT_OK;
		}
		if (arguments.getInputFile() == null)
		{
			Debug.logError("No input file provided.");
			ParallelizerArguments.printUsage();
			return EXIT_USAGE;
		}

		try
		{
			return parallelizeFile(arguments);
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError("Invalid configuration: " + e.getMessage());
			return EXIT_USAGE;
		}
		catch (IOException e)
		{
			Debug.logError("I/O failure: " + e.getMessage());
			return EXIT_IO;
		}
	}

	private static int parallelizeFile(ParallelizerArguments args) throws IOException
	{
		Path input = args.getInputFile();
		Path output = args.isCheckOnly() ? null : args.getOutputPath();

		// --- Load ---
		AutoParallelizer.enter(Phase.LOAD);
		if (!Files.isRegularFile(input) || !Files.isReadable(input))
		{
			throw new IOException("Cannot read input file: " + input);
		}
		String extension = FileUtils.getFileExtension(input);
		if (extension == null || !SOURCE_EXTENSIONS.contains(extension.toLowerCase()))
		{
			Debug.logWarning("The file doesn't seem to be a C or C++ source file: " + input);
		}
		SourceFile source = SourceFile.load(input);
		TextPatchList patches = args.getPatchFile() != null ? TextPatchList.load(args.getPatchFile()) : TextPatchList.empty();

		ParallelizationResult result = new AutoParallelizer(patches).parallelize(source);

		// --- Emit ---
		AutoParallelizer.enter(Phase.EMIT);

		// The report goes first: a failed report write must not leave a fresh output behind
		if (args.getJsonReportPath() != null)
		{
			new JsonReportWriter().write(args.getJsonReportPath(), input, output, result);
		}
		if (output != null)
		{
			FileUtils.writeAtomically(output, result.outputLines());
			Debug.logDebug("Wrote " + result.outputLines().size() + " lines to " + output);
		}
		new ReportPrinter(System.out, args.isVerboseFlag()).print(input, output, result);
		return EXIT_OK;
	}
}
