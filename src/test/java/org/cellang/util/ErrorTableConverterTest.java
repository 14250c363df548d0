package org.cellang.util;

import org.cellang.ast.Rule;
import org.cellang.dto.ErrorPointDTO;
import org.cellang.dto.ErrorTableDTO;
import org.cellang.dto.FunctionErrorsDTO;
import org.cellang.error.LangException;
import org.cellang.parser.SourceParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ErrorTableConverterTest
{
	private static final String SOURCE = "@states 3\n@function int half() { x = 8\n return x / 2 }\n@transition {\n become #1 }";

	@Test
	void toErrorTable_shouldListErrorPointsPerFunction() throws LangException
	{
		// Arrange
		Rule rule = Rule.build(SourceParser.parse(SOURCE));

		// Act
		ErrorTableDTO table = ErrorTableConverter.toErrorTable("life.cell", rule, new LineIndex(SOURCE));

		// Assert
		assertThat(table.source).isEqualTo("life.cell");
		assertThat(table.stateCount).isEqualTo(3);
		assertThat(table.neighborhood).isEqualTo("moore");
		assertThat(table.functions).extracting(f -> f.function).containsExactly("transition", "helper_half");

		FunctionErrorsDTO transition = table.functions.get(0);
		assertThat(transition.returnType).isEqualTo("cell");
		assertThat(transition.errorPoints).extracting(p -> p.kind).containsExactly("CELL_STATE_OUT_OF_RANGE");
		ErrorPointDTO cellError = transition.errorPoints.get(0);
		assertThat(cellError.line).isEqualTo(5);
		assertThat(cellError.column).isEqualTo(9);

		FunctionErrorsDTO half = table.functions.get(1);
		assertThat(half.errorPoints).extracting(p -> p.index).containsExactly(0, 1);
		assertThat(half.errorPoints).extracting(p -> p.kind).containsExactly("DIVIDE_BY_ZERO", "INTEGER_OVERFLOW");
		assertThat(half.errorPoints.get(0).line).isEqualTo(3);
	}

	@Test
	void write_shouldProduceJsonThatReadsBack(@TempDir Path tempDir) throws LangException, IOException
	{
		// Arrange
		Rule rule = Rule.build(SourceParser.parse(SOURCE));
		ErrorTableDTO table = ErrorTableConverter.toErrorTable("life.cell", rule, new LineIndex(SOURCE));
		Path out = tempDir.resolve("life.errors.json");

		// Act
		ErrorTableConverter.write(table, out);

		// Assert
		ErrorTableDTO readBack = ErrorTableConverter.fromJson(Files.readString(out));
		assertThat(readBack.functions).hasSize(2);
		assertThat(readBack.functions.get(1).errorPoints.get(0).message).isEqualTo("Divide by zero");
		assertThat(readBack.functions.get(1).errorPoints.get(0).start).isEqualTo(table.functions.get(1).errorPoints.get(0).start);
	}
}
