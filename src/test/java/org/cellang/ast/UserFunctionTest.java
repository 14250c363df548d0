package org.cellang.ast;

import org.cellang.error.LangErrorKind;
import org.cellang.error.LangException;
import org.cellang.functions.BinaryIntOp;
import org.cellang.functions.GetVar;
import org.cellang.functions.IntLiteral;
import org.cellang.parser.SourceParser;
import org.cellang.syntax.OperatorToken;
import org.cellang.type.Type;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests the AST builder: arenas, variable environment, statement legality and
 * expression resolution.
 */
@Tag("unit")
class UserFunctionTest
{
	private static UserFunction buildTransition(String body) throws LangException
	{
		return Rule.build(SourceParser.parse("@states 4 @transition { " + body + " }")).getTransitionFunction();
	}

	private static void assertBuildFails(String source, LangErrorKind expected)
	{
		assertThatThrownBy(() -> Rule.build(SourceParser.parse(source)))
				.as(source)
				.isInstanceOf(LangException.class)
				.satisfies(e -> assertThat(((LangException) e).getKind()).isEqualTo(expected));
	}

	private static void assertTransitionFails(String body, LangErrorKind expected)
	{
		assertBuildFails("@states 4 @transition { " + body + " }", expected);
	}

	@Test
	@DisplayName("The first assignment fixes a variable's type")
	void getOrCreateVar_shouldKeepFirstType()
	{
		UserFunction function = UserFunction.newTransitionFunction(RuleMeta.defaults());

		assertThat(function.getOrCreateVar("x", Type.INT)).isEqualTo(Type.INT);
		assertThat(function.getOrCreateVar("x", Type.CELL_STATE)).isEqualTo(Type.INT);
		assertThat(function.getVariables()).containsOnlyKeys("x");
	}

	@Test
	void newFunctions_shouldHaveTheirKindAndReturnType()
	{
		UserFunction transition = UserFunction.newTransitionFunction(RuleMeta.defaults());
		UserFunction helper = UserFunction.newHelperFunction(RuleMeta.defaults(), Type.INT);

		assertThat(transition.isTransitionFunction()).isTrue();
		assertThat(transition.getReturnType()).isEqualTo(Type.CELL_STATE);
		assertThat(helper.isTransitionFunction()).isFalse();
		assertThat(helper.getReturnType()).isEqualTo(Type.INT);
	}

	@Test
	void build_shouldRejectReturnInTransitionFunction()
	{
		assertTransitionFails("return #1", LangErrorKind.RETURN_IN_TRANSITION_FUNCTION);
	}

	@Test
	void build_shouldRejectBecomeInHelperFunction()
	{
		assertBuildFails("@function int f() { become 1 } @transition { }", LangErrorKind.BECOME_IN_HELPER_FUNCTION);
	}

	@Test
	@DisplayName("x += e builds the same expression tree as x = x + e")
	void build_shouldDesugarCompoundAssignment() throws LangException
	{
		UserFunction compound = buildTransition("x = 1 x += 2");
		UserFunction explicit = buildTransition("x = 1 x = x + 2");

		assertThat(compound.getExpressionCount()).isEqualTo(explicit.getExpressionCount());
		assertThat(compound.getErrorPoints()).hasSameSizeAs(explicit.getErrorPoints());

		SetVarStatement second = (SetVarStatement) compound.getStatement(compound.getBody().get(1));
		Expr value = compound.getExpr(second.getValueExpr());
		assertThat(value.getFunction()).isInstanceOf(BinaryIntOp.class);
		assertThat(((BinaryIntOp) value.getFunction()).getOp()).isEqualTo(OperatorToken.PLUS);
		List<ExprRef> args = value.getArgs();
		assertThat(compound.getExpr(args.get(0)).getFunction()).isInstanceOf(GetVar.class);
		assertThat(((GetVar) compound.getExpr(args.get(0)).getFunction()).getVarName()).isEqualTo("x");
		assertThat(((IntLiteral) compound.getExpr(args.get(1)).getFunction()).getValue()).isEqualTo(2L);
	}

	@Test
	void build_shouldRequireIdentifierAsAssignmentTarget()
	{
		assertTransitionFails("1 = 2", LangErrorKind.EXPECTED);
		assertTransitionFails("x = 1 (x) = 2", LangErrorKind.EXPECTED);
	}

	@Test
	void build_shouldRejectBareLists()
	{
		assertTransitionFails("x = (1, 2)", LangErrorKind.EXPECTED_GOT);
	}

	@Test
	void build_shouldReportUnimplementedConstructs()
	{
		assertTransitionFails("x = [1, 2]", LangErrorKind.UNIMPLEMENTED);
		assertTransitionFails("x = a.b", LangErrorKind.UNIMPLEMENTED);
		assertTransitionFails("x = 1 .. 3", LangErrorKind.UNIMPLEMENTED);
	}

	@Test
	@DisplayName("Parentheses do not create expression nodes of their own")
	void build_shouldUnwrapParentheses() throws LangException
	{
		UserFunction function = buildTransition("x = (((5)))");

		assertThat(function.getExpressionCount()).isEqualTo(1);
	}

	@Test
	void build_shouldRejectUninitializedVariables()
	{
		assertTransitionFails("become y", LangErrorKind.USE_OF_UNINITIALIZED_VARIABLE);
		assertTransitionFails("y += 1", LangErrorKind.USE_OF_UNINITIALIZED_VARIABLE);
	}

	@Test
	void build_shouldRejectTypeErrors()
	{
		assertTransitionFails("x = 1 x = #1", LangErrorKind.TYPE_ERROR);
		assertTransitionFails("become 1", LangErrorKind.TYPE_ERROR);
		assertTransitionFails("x = #1 + 1", LangErrorKind.TYPE_ERROR);
		assertTransitionFails("x = ##1", LangErrorKind.TYPE_ERROR);
		assertTransitionFails("x = #1 == 1", LangErrorKind.TYPE_ERROR);
		assertBuildFails("@function int f() { return #1 } @transition { }", LangErrorKind.TYPE_ERROR);
	}

	@Test
	@DisplayName("Cell states only support equality comparisons")
	void build_shouldRejectOrderingOfCellStates()
	{
		assertTransitionFails("x = #1 < #2", LangErrorKind.INVALID_COMPARISON);
	}

	@Test
	void build_shouldRejectIntLiteralsOutsideIntRange()
	{
		assertTransitionFails("x = 2147483648", LangErrorKind.INTEGER_OVERFLOW);
		assertTransitionFails("x = -2147483648", LangErrorKind.INTEGER_OVERFLOW);
	}

	@Test
	void build_shouldRejectReturnTypesWithoutRoomForErrorFlag()
	{
		assertBuildFails("@function vec[2] f() { } @transition { }", LangErrorKind.RETURN_TYPE_TOO_WIDE);
	}

	@Test
	@DisplayName("Error points are numbered in the order operators are built, operands first")
	void build_shouldRegisterErrorPointsInBuildOrder() throws LangException
	{
		UserFunction function = buildTransition("x = 1 / 2 + 3");

		assertThat(function.getErrorPoints())
				.extracting(p -> p.error().getKind())
				.containsExactly(LangErrorKind.DIVIDE_BY_ZERO, LangErrorKind.INTEGER_OVERFLOW, LangErrorKind.INTEGER_OVERFLOW);
		for (int i = 0; i < function.getErrorPoints().size(); i++)
		{
			assertThat(function.getErrorPoint(i).index()).isEqualTo(i);
		}
	}

	@Test
	void build_shouldBuildBothArmsOfConditionals() throws LangException
	{
		UserFunction function = buildTransition("if 1 { } y = 2 if y == 2 { x = #1 } else { x = #2 }");

		assertThat(function.getBody()).hasSize(3);
		IfStatement second = (IfStatement) function.getStatement(function.getBody().get(2));
		assertThat(second.getIfTrue()).hasSize(1);
		assertThat(second.getIfFalse()).hasSize(1);
		assertThat(function.getVariables()).containsEntry("x", Type.CELL_STATE).containsEntry("y", Type.INT);
	}

	@Test
	@DisplayName("A built function is frozen")
	void buildBody_shouldFreezeTheFunction() throws LangException
	{
		UserFunction function = buildTransition("become #1");

		assertThat(function.isBuilt()).isTrue();
		assertThrowsIllegalState(() -> function.buildBody(List.of()));
		assertThrowsIllegalState(() -> function.addErrorPoint(null));
		assertThatThrownBy(() -> function.getBody().add(new StatementRef(0))).isInstanceOf(UnsupportedOperationException.class);
	}

	private static void assertThrowsIllegalState(Executable executable)
	{
		assertThatThrownBy(executable::execute).isInstanceOf(IllegalStateException.class);
	}
}
