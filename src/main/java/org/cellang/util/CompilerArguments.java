package org.cellang.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses and holds all command-line arguments of the rule compiler.
 */
public class CompilerArguments
{
	private final List<Path> inputFiles = new ArrayList<>();
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private Path outputPath = null;
	private Path errorTablePath = null;
	private boolean checkOnly = false;
	private boolean run = false;

	// Private constructor, use parse()
	private CompilerArguments()
	{
	}

	public static CompilerArguments parse(String[] args)
	{
		CompilerArguments parsedArgs = new CompilerArguments();

		if (args.length < 1)
		{
			parsedArgs.helpFlag = true; // No args, show help
			return parsedArgs;
		}

		try
		{
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
				if (arg.equals("--run"))
				{
					parsedArgs.run = true;
					continue;
				}

				// --- Flags with one argument ---
				if (arg.equals("-o") || arg.equals("--output"))
				{
					parsedArgs.outputPath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}
				if (arg.equals("--error-table"))
				{
					parsedArgs.errorTablePath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}

				if (arg.startsWith("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}

				// If it's not a flag, it's an input file
				parsedArgs.inputFiles.add(Paths.get(arg));
			}

			if (parsedArgs.inputFiles.size() > 1)
			{
				throw new IllegalArgumentException("Expected exactly one rule file, got " + parsedArgs.inputFiles.size());
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			parsedArgs.helpFlag = true; // Show help on bad parse
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
		System.out.println("OVERVIEW: Compiler for cellular-automaton transition rules.");
		System.out.println("\nUSAGE: cellc [options] file.cell");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                Show this help message and exit.");
		System.out.println("  --version                 Show compiler version and exit.");
		System.out.println("  -v, --verbose             Enable verbose debug logging.");
		System.out.println("  -o, --output <file>       Write LLVM IR to <file> (default: <file>.ll).");
		System.out.println("  -k, --check               Build the ASTs only; do not generate output.");
		System.out.println("  --run                     JIT-compile and run the transition function.");
		System.out.println("  --error-table <file>      Write the error-point table to <file> (default: <file>.errors.json).");
	}

	// --- Getters ---

	public List<Path> getInputFiles()
	{
		return inputFiles;
	}

	public Path getInputFile()
	{
		return inputFiles.isEmpty() ? null : inputFiles.get(0);
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

	public Path getOutputPath()
	{
		return outputPath;
	}

	public Path getErrorTablePath()
	{
		return errorTablePath;
	}

	public boolean isCheckOnly()
	{
		return checkOnly;
	}

	public boolean isRun()
	{
		return run;
	}
}
