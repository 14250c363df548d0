package org.cellang;

import org.cellang.ast.Rule;
import org.cellang.codegen.CodeGenerator;
import org.cellang.codegen.ExecutionResult;
import org.cellang.codegen.JitExecutor;
import org.cellang.codegen.RuleCompiler;
import org.cellang.error.LangException;
import org.cellang.parser.SourceParser;
import org.cellang.syntax.SyntaxRule;
import org.cellang.util.CompilerArguments;
import org.cellang.util.Debug;
import org.cellang.util.ErrorHandler;
import org.cellang.util.ErrorTableConverter;
import org.cellang.util.LineIndex;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Main compiler orchestration class: parse, build the ASTs, generate LLVM IR and
 * optionally run the transition function.
 */
public class Main
{
	public static final String VERSION = "0.1.0-alpha";

	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	/**
	 * Runs the compiler and returns the process exit code.
	 */
	public static int run(String[] args)
	{
		try
		{
			CompilerArguments arguments = CompilerArguments.parse(args);

			if (arguments.isHelpFlag())
			{
				CompilerArguments.printUsage();
				return 0;
			}
			if (arguments.isVersionFlag())
			{
				System.out.println("cellc (Cellang Compiler) version " + VERSION);
				return 0;
			}

			Path inputFile = arguments.getInputFile();
			if (inputFile == null)
			{
				throw new IllegalArgumentException("No input file provided. Use -h for help.");
			}
			if (!Files.exists(inputFile))
			{
				Debug.logError("Input file not found: " + inputFile);
				return 1;
			}

			String source = Files.readString(inputFile);
			ErrorHandler errorHandler = new ErrorHandler(new LineIndex(source));
			return compile(arguments, inputFile, source, errorHandler);
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError("Compiler initialization failed: " + e.getMessage());
		}
		catch (IOException e)
		{
			Debug.logError("Error reading or writing file: " + e.getMessage());
		}
		catch (Exception e)
		{
			Debug.logError("An unexpected error occurred: " + e.getMessage());
			e.printStackTrace();
		}
		return 1;
	}

	private static int compile(CompilerArguments args, Path inputFile, String source, ErrorHandler errorHandler) throws IOException
	{
		Debug.logDebug("\nCompiling " + inputFile + "...");

		// --- Parsing ---
		SyntaxRule syntaxRule;
		try
		{
			syntaxRule = SourceParser.parse(source);
		}
		catch (LangException e)
		{
			errorHandler.logError("Syntax", e.getError());
			Debug.logError("Compilation failed due to syntax errors in " + inputFile);
			return 1;
		}

		// --- AST building ---
		Rule rule;
		try
		{
			rule = Rule.build(syntaxRule);
		}
		catch (LangException e)
		{
			errorHandler.logError("Semantic", e.getError());
			Debug.logError("Compilation failed due to semantic errors.");
			return 1;
		}

		if (args.isCheckOnly())
		{
			Debug.logInfo("Semantic check passed. No output generated (-k flag).");
			return 0;
		}

		// --- Code generation (LLVM IR) ---
		Path llvmIrPath = args.getOutputPath() != null ? args.getOutputPath() : withExtension(inputFile, ".ll");
		Path errorTablePath = args.getErrorTablePath() != null ? args.getErrorTablePath() : withExtension(inputFile, ".errors.json");

		try (CodeGenerator generator = RuleCompiler.generate(rule, baseName(inputFile)))
		{
			generator.writeModuleToFile(llvmIrPath);
			ErrorTableConverter.write(ErrorTableConverter.toErrorTable(inputFile.getFileName().toString(), rule, new LineIndex(source)), errorTablePath);
			Debug.logInfo("LLVM IR written to: " + llvmIrPath);

			if (args.isRun())
			{
				return runTransition(generator, rule, errorHandler);
			}
		}
		catch (LangException e)
		{
			errorHandler.logError("Codegen", e.getError());
			return 1;
		}

		Debug.logInfo("Compilation successful.");
		return 0;
	}

	private static int runTransition(CodeGenerator generator, Rule rule, ErrorHandler errorHandler) throws LangException
	{
		try (JitExecutor executor = JitExecutor.create(generator))
		{
			ExecutionResult result = executor.call(RuleCompiler.TRANSITION_FUNCTION_NAME, rule.getTransitionFunction());
			if (result.isError())
			{
				errorHandler.logError("Runtime", result.error());
				return 2;
			}
			Debug.log("transition() = " + result.value());
			return 0;
		}
	}

	private static String baseName(Path file)
	{
		return file.getFileName().toString().replaceFirst("[.][^.]+$", "");
	}

	/**
	 * Derives an output path next to the input file.
	 */
	private static Path withExtension(Path inputFile, String newExtension)
	{
		return inputFile.resolveSibling(baseName(inputFile) + newExtension);
	}
}
