package org.lokray.autopar.util;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parses and holds all command-line arguments for the auto-parallelizer.
 */
public class ParallelizerArguments
{
	public static final Path DEFAULT_OUTPUT = Paths.get("output_parallel.cpp");

	private Path inputFile = null;
	private Path outputPath = null;
	private Path patchFile = null;
	private Path jsonReportPath = null;
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private boolean checkOnly = false;

	// Private constructor, use parse()
	private ParallelizerArguments()
	{
	}

	/**
	 * Parses the command line. Unlike a help request, a malformed command line is
	 * reported to the caller as an {@link IllegalArgumentException}.
	 */
	public static ParallelizerArguments parse(String[] args)
	{
		ParallelizerArguments parsedArgs = new ParallelizerArguments();

		for (int i = 0; i < args.length; i++)
		{
			String arg = args[i];

			// --- Flags with no argument ---
			if (arg.equals("-h") || arg.equals("--help"))
			{
				parsedArgs.helpFlag = true;
				return parsedArgs; // Help flag overrides all else
			}
			if (arg.equals("--version"))
			{
				parsedArgs.versionFlag = true;
				return parsedArgs;
			}
			if (arg.equals("-v") || arg.equals("--verbose"))
			{
				parsedArgs.verboseFlag = true;
				Debug.ENABLE_DEBUG = true; // Set debug flag immediately
				continue;
			}
			if (arg.equals("-k") || arg.equals("--check"))
			{
				parsedArgs.checkOnly = true;
				continue;
			}

			// --- Flags with one argument ---
			if (arg.equals("-o") || arg.equals("--output"))
			{
				parsedArgs.outputPath = Paths.get(getNextArg(args, ++i, arg));
				continue;
			}
			if (arg.equals("-p") || arg.equals("--patches"))
			{
				parsedArgs.patchFile = Paths.get(getNextArg(args, ++i, arg));
				continue;
			}
			if (arg.equals("-r") || arg.equals("--report-json"))
			{
				parsedArgs.jsonReportPath = Paths.get(getNextArg(args, ++i, arg));
				continue;
			}

			if (arg.startsWith("-") && arg.length() > 1)
			{
				throw new IllegalArgumentException("Unknown option: " + arg);
			}

			// --- Positional: <input> [output] ---
			if (parsedArgs.inputFile == null)
			{
				parsedArgs.inputFile = Paths.get(arg);
			}
			else if (parsedArgs.outputPath == null)
			{
				parsedArgs.outputPath = Paths.get(arg);
			}
			else
			{
				throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		return parsedArgs;
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	public static void printUsage()
	{
		System.out.println("OVERVIEW: Inserts OpenMP parallel-for directives into C/C++ counting loops.");
		System.out.println("\nUSAGE: autopar [options] <input_file> [output_file]");
		System.out.println("\nEXAMPLE:");
		System.out.println("  autopar codebase.cpp codebase_parallel.cpp");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                Show this help message and exit.");
		System.out.println("  --version                 Show version and exit.");
		System.out.println("  -v, --verbose             Enable debug logging and per-loop findings.");
		System.out.println("  -o, --output <file>       Output file (default: " + DEFAULT_OUTPUT + ").");
		System.out.println("  -p, --patches <file>      Apply the text patches listed in a JSON file.");
		System.out.println("  -r, --report-json <file>  Also write the report as JSON.");
		System.out.println("  -k, --check               Analyze and report only; do not write output.");
	}

	// --- Getters ---

	public Path getInputFile()
	{
		return inputFile;
	}

	/**
	 * @return the explicit output path, or {@link #DEFAULT_OUTPUT} when none was given.
	 */
	public Path getOutputPath()
	{
		return outputPath != null ? outputPath : DEFAULT_OUTPUT;
	}

	public Path getPatchFile()
	{
		return patchFile;
	}

	public Path getJsonReportPath()
	{
		return jsonReportPath;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public boolean isCheckOnly()
	{
		return checkOnly;
	}
}
