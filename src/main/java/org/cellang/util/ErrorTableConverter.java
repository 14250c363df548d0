package org.cellang.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.cellang.ast.ErrorPointRef;
import org.cellang.ast.Rule;
import org.cellang.ast.UserFunction;
import org.cellang.codegen.RuleCompiler;
import org.cellang.dto.ErrorPointDTO;
import org.cellang.dto.ErrorTableDTO;
import org.cellang.dto.FunctionErrorsDTO;
import org.cellang.error.LangError;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;

/**
 * Converts the error-point tables of a rule into DTOs and writes them as JSON.
 */
public class ErrorTableConverter
{
	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

	public static ErrorTableDTO toErrorTable(String sourceName, Rule rule, LineIndex lineIndex)
	{
		ErrorTableDTO table = new ErrorTableDTO();
		table.source = sourceName;
		table.stateCount = rule.getMeta().stateCount();
		table.ndim = rule.getMeta().ndim();
		table.neighborhood = rule.getMeta().neighborhood().getKeyword();
		table.functions.add(functionToDTO(RuleCompiler.TRANSITION_FUNCTION_NAME, rule.getTransitionFunction(), lineIndex));
		for (Map.Entry<String, UserFunction> helper : rule.getHelperFunctions().entrySet())
		{
			table.functions.add(functionToDTO(RuleCompiler.helperFunctionName(helper.getKey()), helper.getValue(), lineIndex));
		}
		return table;
	}

	private static FunctionErrorsDTO functionToDTO(String name, UserFunction function, LineIndex lineIndex)
	{
		FunctionErrorsDTO dto = new FunctionErrorsDTO();
		dto.function = name;
		dto.returnType = function.getReturnType().getName();
		for (ErrorPointRef errorPoint : function.getErrorPoints())
		{
			dto.errorPoints.add(errorPointToDTO(errorPoint, lineIndex));
		}
		return dto;
	}

	private static ErrorPointDTO errorPointToDTO(ErrorPointRef errorPoint, LineIndex lineIndex)
	{
		LangError error = errorPoint.error();
		ErrorPointDTO dto = new ErrorPointDTO();
		dto.index = errorPoint.index();
		dto.kind = error.getKind().name();
		dto.message = error.getMessage();
		if (error.hasSpan())
		{
			dto.start = error.getSpan().start();
			dto.end = error.getSpan().end();
			if (lineIndex != null)
			{
				dto.line = lineIndex.lineOf(dto.start);
				dto.column = lineIndex.columnOf(dto.start);
			}
		}
		return dto;
	}

	public static String toJson(ErrorTableDTO table)
	{
		return GSON.toJson(table);
	}

	public static ErrorTableDTO fromJson(String json)
	{
		return GSON.fromJson(json, ErrorTableDTO.class);
	}

	/**
	 * Writes the error table to {@code outPath}, replacing any previous file.
	 */
	public static void write(ErrorTableDTO table, Path outPath) throws IOException
	{
		if (outPath.getParent() != null)
		{
			Files.createDirectories(outPath.getParent());
		}
		Files.writeString(outPath, toJson(table), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logInfo("Wrote error table to: " + outPath);
	}
}
