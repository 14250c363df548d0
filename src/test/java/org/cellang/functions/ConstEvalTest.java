package org.cellang.functions;

import org.cellang.ast.ExprRef;
import org.cellang.ast.RuleMeta;
import org.cellang.ast.UserFunction;
import org.cellang.error.LangErrorKind;
import org.cellang.error.LangException;
import org.cellang.parser.SourceParser;
import org.cellang.syntax.SyntaxExpr;
import org.cellang.syntax.SyntaxStatement;
import org.cellang.type.ConstValue;
import org.cellang.type.Type;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Constant folding must agree with what the generated code computes, including where it
 * traps.
 */
@Tag("unit")
class ConstEvalTest
{
	private UserFunction function;

	@BeforeEach
	void setUp()
	{
		function = UserFunction.newHelperFunction(RuleMeta.defaults(), Type.INT);
	}

	private ConstValue eval(String expr) throws LangException
	{
		SyntaxStatement.Become become = (SyntaxStatement.Become) SourceParser.parse("@transition { become " + expr + " }").transition().get(0);
		SyntaxExpr syntax = become.retExpr();
		ExprRef ref = function.buildExpressionAst(syntax);
		return function.constEvalExpr(ref);
	}

	@ParameterizedTest(name = "{0} = {1}")
	@CsvSource(delimiter = ';', value = {
			"2 + 3 * 4; 14",
			"7 / -2; -3",
			"-7 % 3; -1",
			"2 ** 10; 1024",
			"0 ** 0; 1",
			"(-2) ** 31; -2147483648",
			"-2 ** 2; -4",
			"1 << 31; -2147483648",
			"-8 >> 1; -4",
			"-8 >>> 28; 15",
			"6 & 3; 2",
			"6 | 3; 7",
			"-2147483647 - 1; -2147483648",
			"1 < 2 < 3; 1",
			"1 < 3 < 2; 0",
			"3 == 3 != 4; 1"
	})
	void constEval_shouldComputeIntegerResults(String expr, int expected) throws LangException
	{
		assertThat(eval(expr)).isEqualTo(new ConstValue.Int(expected));
	}

	@Test
	void constEval_shouldConvertIdsToCellStates() throws LangException
	{
		assertThat(eval("#1")).isEqualTo(new ConstValue.CellState(1));
		assertThat(eval("#1 == #1")).isEqualTo(new ConstValue.Int(1));
	}

	@ParameterizedTest(name = "{0} traps with {1}")
	@CsvSource(delimiter = ';', value = {
			"2147483647 + 1; INTEGER_OVERFLOW",
			"-2147483647 - 2; INTEGER_OVERFLOW",
			"65536 * 65536; INTEGER_OVERFLOW",
			"-(-2147483647 - 1); INTEGER_OVERFLOW",
			"(-2147483647 - 1) / -1; INTEGER_OVERFLOW",
			"1 / 0; DIVIDE_BY_ZERO",
			"1 % 0; DIVIDE_BY_ZERO",
			"2 ** 31; INTEGER_OVERFLOW",
			"2 ** -1; NEGATIVE_EXPONENT",
			"1 << 32; BITSHIFT_OUT_OF_RANGE",
			"1 >> -1; BITSHIFT_OUT_OF_RANGE",
			"#2; CELL_STATE_OUT_OF_RANGE",
			"#(-1); CELL_STATE_OUT_OF_RANGE"
	})
	void constEval_shouldSurfaceRuntimeErrors(String expr, LangErrorKind expected)
	{
		assertThatThrownBy(() -> eval(expr))
				.isInstanceOf(LangException.class)
				.satisfies(e -> assertThat(((LangException) e).getKind()).isEqualTo(expected));
	}

	@Test
	@DisplayName("Variable reads depend on runtime values and cannot be folded")
	void constEval_shouldRefuseVariables()
	{
		function.getOrCreateVar("x", Type.INT);

		assertThatThrownBy(() -> eval("x + 1"))
				.isInstanceOf(LangException.class)
				.satisfies(e -> assertThat(((LangException) e).getKind()).isEqualTo(LangErrorKind.CANNOT_EVAL_AS_CONST));
	}
}
