package org.cellang.codegen;

import org.cellang.ast.Rule;
import org.cellang.error.LangErrorKind;
import org.cellang.error.LangException;
import org.cellang.parser.SourceParser;
import org.cellang.type.ConstValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs generated code natively and checks the decoded results. Operands are routed through
 * variables so that overflow and division checks happen at runtime.
 */
@Tag("integration")
class JitExecutionTest
{
	private static ExecutionResult runTransition(String body) throws LangException
	{
		Rule rule = Rule.build(SourceParser.parse("@states 4\n@transition {\n" + body + "\n}"));
		try (CodeGenerator generator = RuleCompiler.generate(rule, "test");
			 JitExecutor executor = JitExecutor.create(generator))
		{
			return executor.call(RuleCompiler.TRANSITION_FUNCTION_NAME, rule.getTransitionFunction());
		}
	}

	private static ExecutionResult runHelper(String body) throws LangException
	{
		Rule rule = Rule.build(SourceParser.parse("@function int f() {\n" + body + "\n}\n@transition { }"));
		try (CodeGenerator generator = RuleCompiler.generate(rule, "test");
			 JitExecutor executor = JitExecutor.create(generator))
		{
			return executor.call(RuleCompiler.helperFunctionName("f"), rule.getHelperFunction("f"));
		}
	}

	private static void assertInt(ExecutionResult result, int expected)
	{
		assertThat(result.isError()).as("%s", result).isFalse();
		assertThat(result.value()).isEqualTo(new ConstValue.Int(expected));
	}

	private static void assertTrap(ExecutionResult result, LangErrorKind expected)
	{
		assertThat(result.isError()).as("%s", result).isTrue();
		assertThat(result.error().getKind()).isEqualTo(expected);
	}

	@Test
	void transition_shouldBecomeCellState() throws LangException
	{
		ExecutionResult result = runTransition("become #3");

		assertThat(result.isError()).isFalse();
		assertThat(result.value()).isEqualTo(new ConstValue.CellState(3));
	}

	@Test
	@DisplayName("Only the taken arm of a conditional runs")
	void conditional_shouldRunTakenArmOnly() throws LangException
	{
		assertThat(runTransition("x = 2\nif x == 2 { become #3 } else { become #1 }").value()).isEqualTo(new ConstValue.CellState(3));
		assertThat(runTransition("x = 5\nif x == 2 { become #3 } else { become #1 }").value()).isEqualTo(new ConstValue.CellState(1));
	}

	@Test
	@DisplayName("A cell state is a valid condition: #0 is false")
	void conditional_shouldAcceptCellStateConditions() throws LangException
	{
		assertThat(runTransition("c = #0\nif c { become #2 } else { become #1 }").value()).isEqualTo(new ConstValue.CellState(1));
	}

	@Test
	@DisplayName("Falling off the end returns the default value")
	void transition_shouldReturnDefaultWithoutBecome() throws LangException
	{
		assertThat(runTransition("x = 1\nif x == 2 { become #3 }").value()).isEqualTo(new ConstValue.CellState(0));
		assertInt(runHelper("x = 4"), 0);
	}

	@Test
	@DisplayName("Only the writes of the taken arm are visible afterwards")
	void conditional_shouldOnlyApplyTakenArmSideEffects() throws LangException
	{
		assertInt(runHelper("c = 1\nx = 1\nif c { x = 2 } else { x = 3 }\nreturn x"), 2);
		assertInt(runHelper("c = 0\nx = 1\nif c { x = 2 } else { x = 3 }\nreturn x"), 3);
	}

	@ParameterizedTest(name = "x {0}= 3")
	@CsvSource({"+", "-", "*", "/", "%", "**", "<<", ">>", ">>>", "&", "|"})
	@DisplayName("Compound assignment behaves like the spelled-out assignment")
	void compoundAssignment_shouldMatchExplicitForm(String op) throws LangException
	{
		ExecutionResult compound = runHelper("x = -7\nx " + op + "= 3\nreturn x");
		ExecutionResult explicit = runHelper("x = -7\nx = x " + op + " 3\nreturn x");

		assertThat(compound.isError()).isEqualTo(explicit.isError());
		assertThat(compound.value()).isEqualTo(explicit.value());
	}

	@Test
	void unreachableStatements_shouldNotRun() throws LangException
	{
		assertThat(runTransition("become #1\nbecome #2").value()).isEqualTo(new ConstValue.CellState(1));
	}

	@Test
	@DisplayName("Variables assigned in an arm that did not run keep their default value")
	void variables_shouldStartAtDefaultValue() throws LangException
	{
		assertInt(runHelper("if 0 { y = 5 }\nreturn y"), 0);
	}

	@Test
	void maxIntPlusOne_shouldTrapWithOverflow() throws LangException
	{
		assertTrap(runHelper("x = 2147483647\nreturn x + 1"), LangErrorKind.INTEGER_OVERFLOW);
	}

	@Test
	@DisplayName("The trapping error point is the one registered for the failing operator")
	void trap_shouldIdentifyFailingErrorPoint() throws LangException
	{
		ExecutionResult result = runHelper("x = 0\ny = 1 + 1\nreturn y / x");

		assertTrap(result, LangErrorKind.DIVIDE_BY_ZERO);
		// '+' registered index 0, '/' registered 1 (divide by zero) and 2 (overflow)
		assertThat(result.errorIndex()).isEqualTo(1);
	}

	@Test
	void minIntDividedByMinusOne_shouldTrapWithOverflow() throws LangException
	{
		assertTrap(runHelper("x = -2147483647 - 1\ny = -1\nreturn x / y"), LangErrorKind.INTEGER_OVERFLOW);
		assertTrap(runHelper("x = -2147483647 - 1\ny = -1\nreturn x % y"), LangErrorKind.INTEGER_OVERFLOW);
	}

	@Test
	void negatingMinInt_shouldTrapWithOverflow() throws LangException
	{
		assertTrap(runHelper("x = -2147483647 - 1\nreturn -x"), LangErrorKind.INTEGER_OVERFLOW);
	}

	@ParameterizedTest(name = "{0} = {1}")
	@CsvSource(delimiter = ';', value = {
			"x = 10\\ny = 3\\nreturn x / y; 3",
			"x = -7\\ny = 2\\nreturn x / y; -3",
			"x = -7\\ny = 3\\nreturn x % y; -1",
			"x = 3\\nreturn x ** 4; 81",
			"x = 2\\nreturn x ** 30; 1073741824",
			"x = -2\\nreturn x ** 31; -2147483648",
			"x = 0\\nreturn x ** 0; 1",
			"x = 1\\nreturn x << 31; -2147483648",
			"x = -8\\nreturn x >> 1; -4",
			"x = -8\\nreturn x >>> 28; 15",
			"x = 12\\nreturn x & 10 | 1; 9",
			"x = 5\\nx *= 3\\nx -= 1\\nreturn x; 14",
			"x = 2\\nreturn 1 < x < 3; 1",
			"x = 2\\nreturn 1 < x < 2; 0",
			"x = 2\\nreturn x != 3 == 3; 1"
	})
	void arithmetic_shouldMatchIntegerSemantics(String body, int expected) throws LangException
	{
		assertInt(runHelper(body.replace("\\n", "\n")), expected);
	}

	@ParameterizedTest(name = "{0} traps with {1}")
	@CsvSource(delimiter = ';', value = {
			"x = 0\\nreturn 10 % x; DIVIDE_BY_ZERO",
			"x = 65536\\nreturn x * x; INTEGER_OVERFLOW",
			"x = -2147483647\\nreturn x - 2; INTEGER_OVERFLOW",
			"x = 2\\nreturn x ** 31; INTEGER_OVERFLOW",
			"x = -1\\nreturn 2 ** x; NEGATIVE_EXPONENT",
			"x = 32\\nreturn 1 << x; BITSHIFT_OUT_OF_RANGE",
			"x = -1\\nreturn 1 >>> x; BITSHIFT_OUT_OF_RANGE"
	})
	void arithmetic_shouldTrapOnRuntimeErrors(String body, LangErrorKind expected) throws LangException
	{
		assertTrap(runHelper(body.replace("\\n", "\n")), expected);
	}

	@Test
	@DisplayName("A large base whose square is never needed does not overflow")
	void pow_shouldNotTrapOnUnusedSquare() throws LangException
	{
		assertInt(runHelper("x = 100000\nreturn x ** 1"), 100000);
	}

	@Test
	void intToCellState_shouldTrapOutsideStateCount() throws LangException
	{
		assertTrap(runTransition("x = 4\nbecome #x"), LangErrorKind.CELL_STATE_OUT_OF_RANGE);
		assertTrap(runTransition("x = -1\nbecome #x"), LangErrorKind.CELL_STATE_OUT_OF_RANGE);
		assertThat(runTransition("x = 3\nbecome #x").value()).isEqualTo(new ConstValue.CellState(3));
	}

	@Test
	void cellStateComparison_shouldCompareStates() throws LangException
	{
		assertInt(runHelper("a = #1\nb = #1\nreturn a == b"), 1);
		assertInt(runHelper("a = #1\nb = #0\nreturn a == b"), 0);
	}
}
