package org.cellang.ast;

import org.cellang.codegen.CodeGenerator;
import org.cellang.codegen.Value;
import org.cellang.error.LangError;
import org.cellang.error.LangErrorKind;
import org.cellang.error.LangException;
import org.cellang.functions.BinaryIntOp;
import org.cellang.functions.BuiltinFunction;
import org.cellang.functions.ChainedComparison;
import org.cellang.functions.GetVar;
import org.cellang.functions.IntLiteral;
import org.cellang.functions.IntToCellState;
import org.cellang.functions.NegInt;
import org.cellang.syntax.OperatorToken;
import org.cellang.syntax.Span;
import org.cellang.syntax.SyntaxExpr;
import org.cellang.syntax.SyntaxStatement;
import org.cellang.type.ConstValue;
import org.cellang.type.Type;
import org.cellang.util.Debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A user-defined function: the unit handed from the AST builder to the code generator.
 * <p>
 * Statements, expressions and error points live in append-only arenas owned by this
 * function and are addressed by {@link StatementRef}, {@link ExprRef} and
 * {@link ErrorPointRef}. Refs are only meaningful for the function that produced them.
 * Variable types are inferred from the first assignment and never change afterwards.
 * <p>
 * Once {@link #buildBody(List)} returns, the function is frozen and only read from.
 */
public class UserFunction
{
	private final RuleMeta ruleMeta;
	private final Type returnType;
	// Transition functions exit with 'become', helper functions with 'return'
	private final boolean transitionFunction;

	private final List<Statement> statements = new ArrayList<>();
	private final List<Expr> expressions = new ArrayList<>();
	private final List<ErrorPointRef> errorPoints = new ArrayList<>();
	private final Map<String, Type> variables = new LinkedHashMap<>();

	private List<StatementRef> body = null;

	private UserFunction(RuleMeta ruleMeta, Type returnType, boolean transitionFunction)
	{
		this.ruleMeta = ruleMeta;
		this.returnType = returnType;
		this.transitionFunction = transitionFunction;
	}

	/**
	 * Constructs a new, empty transition function. Transition functions return a cell state.
	 */
	public static UserFunction newTransitionFunction(RuleMeta ruleMeta)
	{
		return new UserFunction(ruleMeta, Type.CELL_STATE, true);
	}

	/**
	 * Constructs a new, empty helper function that returns the given type.
	 */
	public static UserFunction newHelperFunction(RuleMeta ruleMeta, Type returnType)
	{
		return new UserFunction(ruleMeta, returnType, false);
	}

	public RuleMeta getRuleMeta()
	{
		return ruleMeta;
	}

	public Type getReturnType()
	{
		return returnType;
	}

	public boolean isTransitionFunction()
	{
		return transitionFunction;
	}

	/**
	 * Returns the type of an existing variable, or throws USE_OF_UNINITIALIZED_VARIABLE.
	 */
	public Type tryGetVar(Span span, String varName) throws LangException
	{
		Type type = variables.get(varName);
		if (type == null)
		{
			throw LangException.of(LangErrorKind.USE_OF_UNINITIALIZED_VARIABLE, span);
		}
		return type;
	}

	/**
	 * Returns the type of the variable with the given name, creating it with
	 * {@code newType} if it does not exist yet. An existing variable keeps its type.
	 */
	public Type getOrCreateVar(String varName, Type newType)
	{
		Type existing = variables.get(varName);
		if (existing != null)
		{
			return existing;
		}
		ensureBuilding();
		variables.put(varName, newType);
		return newType;
	}

	/**
	 * Builds the top-level statement block of this function and freezes it.
	 */
	public List<StatementRef> buildBody(List<SyntaxStatement> block) throws LangException
	{
		ensureBuilding();
		if (!returnType.fitsInReturnValue())
		{
			Span span = block.isEmpty() ? null : block.get(0).span();
			throw new LangException(span == null
					? LangError.withoutSpan(LangErrorKind.RETURN_TYPE_TOO_WIDE, returnType)
					: LangError.of(LangErrorKind.RETURN_TYPE_TOO_WIDE, span, returnType));
		}
		List<StatementRef> built = buildStatementBlockAst(block);
		body = Collections.unmodifiableList(built);
		Debug.logDebug("AST: Built " + (transitionFunction ? "transition" : "helper") + " function with "
				+ statements.size() + " statement(s), " + expressions.size() + " expression(s), "
				+ errorPoints.size() + " error point(s).");
		return body;
	}

	/**
	 * Constructs statement nodes for a block of the syntax tree, in order.
	 */
	public List<StatementRef> buildStatementBlockAst(List<SyntaxStatement> block) throws LangException
	{
		ensureBuilding();
		List<StatementRef> result = new ArrayList<>(block.size());
		for (SyntaxStatement syntaxStatement : block)
		{
			result.add(addStatement(buildStatementAst(syntaxStatement)));
		}
		return result;
	}

	private Statement buildStatementAst(SyntaxStatement syntaxStatement) throws LangException
	{
		Span span = syntaxStatement.span();

		if (syntaxStatement instanceof SyntaxStatement.SetVar setVar)
		{
			if (!(setVar.varExpr() instanceof SyntaxExpr.Ident ident))
			{
				throw LangException.of(LangErrorKind.EXPECTED, span, "variable name");
			}
			// Compound assignment 'x op= e' is built as 'x = x op e'
			SyntaxExpr valueSyntax = setVar.valueExpr();
			if (setVar.assignOp().op().isPresent())
			{
				valueSyntax = new SyntaxExpr.BinaryOp(
						span,
						new SyntaxExpr.Ident(ident.span(), ident.name()),
						setVar.assignOp().op().get(),
						setVar.valueExpr()
				);
			}
			ExprRef valueExpr = buildExpressionAst(valueSyntax);
			return SetVarStatement.tryNew(span, this, ident.name(), valueExpr);
		}
		if (syntaxStatement instanceof SyntaxStatement.If ifStatement)
		{
			ExprRef condExpr = buildExpressionAst(ifStatement.condExpr());
			List<StatementRef> ifTrue = buildStatementBlockAst(ifStatement.ifTrue());
			List<StatementRef> ifFalse = buildStatementBlockAst(ifStatement.ifFalse());
			return IfStatement.tryNew(span, this, condExpr, ifTrue, ifFalse);
		}
		if (syntaxStatement instanceof SyntaxStatement.Become become)
		{
			if (!transitionFunction)
			{
				throw LangException.of(LangErrorKind.BECOME_IN_HELPER_FUNCTION, span);
			}
			return ReturnStatement.tryNew(span, this, buildExpressionAst(become.retExpr()));
		}
		if (syntaxStatement instanceof SyntaxStatement.Return ret)
		{
			if (transitionFunction)
			{
				throw LangException.of(LangErrorKind.RETURN_IN_TRANSITION_FUNCTION, span);
			}
			return ReturnStatement.tryNew(span, this, buildExpressionAst(ret.retExpr()));
		}
		throw LangError.internal(span, "Unknown statement " + syntaxStatement.getClass().getSimpleName()).toException();
	}

	/**
	 * Constructs the expression node (and all of its operands) for an expression of the
	 * syntax tree and returns a reference to it.
	 */
	public ExprRef buildExpressionAst(SyntaxExpr syntaxExpr) throws LangException
	{
		ensureBuilding();
		Span span = syntaxExpr.span();
		List<ExprRef> args;
		BuiltinFunction function;

		if (syntaxExpr instanceof SyntaxExpr.Int literal)
		{
			args = List.of();
			function = new IntLiteral(literal.value());
		}
		else if (syntaxExpr instanceof SyntaxExpr.Ident ident)
		{
			args = List.of();
			function = GetVar.tryNew(this, span, ident.name());
		}
		else if (syntaxExpr instanceof SyntaxExpr.Group group)
		{
			switch (group.startToken())
			{
				case LPAREN:
					return buildExpressionAst(group.inner());
				case LBRACKET:
					throw LangException.of(LangErrorKind.UNIMPLEMENTED, span, "Vector construction");
				default:
					throw LangError.internal(span, "Invalid group").toException();
			}
		}
		else if (syntaxExpr instanceof SyntaxExpr.ListExpr)
		{
			throw LangException.of(LangErrorKind.EXPECTED_GOT, span, "expression", "comma-separated list");
		}
		else if (syntaxExpr instanceof SyntaxExpr.UnaryOp unary)
		{
			switch (unary.op())
			{
				case MINUS:
					args = List.of(buildExpressionAst(unary.operand()));
					function = NegInt.tryNew(this, span);
					break;
				case TAG:
					args = List.of(buildExpressionAst(unary.operand()));
					function = IntToCellState.tryNew(this, span);
					break;
				default:
					throw LangError.internal(span, "Invalid unary operator '" + unary.op() + "'").toException();
			}
		}
		else if (syntaxExpr instanceof SyntaxExpr.BinaryOp binary)
		{
			OperatorToken op = binary.op();
			if (op == OperatorToken.DOT)
			{
				throw LangException.of(LangErrorKind.UNIMPLEMENTED, span, "Method call");
			}
			if (op == OperatorToken.DOT_DOT)
			{
				throw LangException.of(LangErrorKind.UNIMPLEMENTED, span, "Range");
			}
			if (!BinaryIntOp.supports(op))
			{
				throw LangError.internal(span, "Invalid binary operator '" + op + "'").toException();
			}
			ExprRef lhs = buildExpressionAst(binary.lhs());
			ExprRef rhs = buildExpressionAst(binary.rhs());
			args = List.of(lhs, rhs);
			function = BinaryIntOp.tryNew(this, span, op);
		}
		else if (syntaxExpr instanceof SyntaxExpr.Cmp cmp)
		{
			List<ExprRef> operands = new ArrayList<>(cmp.exprs().size());
			for (SyntaxExpr operand : cmp.exprs())
			{
				operands.add(buildExpressionAst(operand));
			}
			args = operands;
			function = ChainedComparison.tryNew(this, span, args, cmp.cmps());
		}
		else
		{
			throw LangError.internal(span, "Unknown expression " + syntaxExpr.getClass().getSimpleName()).toException();
		}

		Expr expr = Expr.tryNew(span, this, function, args);
		return addExpr(expr);
	}

	/**
	 * Registers a possible runtime error and returns a reference to it.
	 */
	public ErrorPointRef addErrorPoint(LangError error)
	{
		ensureBuilding();
		ErrorPointRef ref = new ErrorPointRef(errorPoints.size(), error);
		errorPoints.add(ref);
		return ref;
	}

	private StatementRef addStatement(Statement statement)
	{
		statements.add(statement);
		return new StatementRef(statements.size() - 1);
	}

	private ExprRef addExpr(Expr expr)
	{
		expressions.add(expr);
		return new ExprRef(expressions.size() - 1);
	}

	private void ensureBuilding()
	{
		if (body != null)
		{
			throw new IllegalStateException("User function has already been built");
		}
	}

	public boolean isBuilt()
	{
		return body != null;
	}

	/**
	 * Returns the top-level block built by {@link #buildBody(List)}.
	 */
	public List<StatementRef> getBody()
	{
		if (body == null)
		{
			throw new IllegalStateException("User function has not been built yet");
		}
		return body;
	}

	public Expr getExpr(ExprRef ref)
	{
		return expressions.get(ref.index());
	}

	public Statement getStatement(StatementRef ref)
	{
		return statements.get(ref.index());
	}

	public ErrorPointRef getErrorPoint(int index)
	{
		return errorPoints.get(index);
	}

	public List<ErrorPointRef> getErrorPoints()
	{
		return Collections.unmodifiableList(errorPoints);
	}

	/**
	 * Returns every variable and its type, in order of first assignment.
	 */
	public Map<String, Type> getVariables()
	{
		return Collections.unmodifiableMap(variables);
	}

	public int getExpressionCount()
	{
		return expressions.size();
	}

	public int getStatementCount()
	{
		return statements.size();
	}

	public void compileStatement(CodeGenerator generator, StatementRef statement) throws LangException
	{
		getStatement(statement).compile(generator, this);
	}

	/**
	 * Compiles a block in order. Statements after one that terminates the current basic
	 * block are unreachable and not emitted.
	 */
	public void compileBlock(CodeGenerator generator, List<StatementRef> block) throws LangException
	{
		for (StatementRef statement : block)
		{
			if (!generator.needsTerminator())
			{
				Debug.logDebug("IR: Skipping unreachable statement at " + getStatement(statement).getSpan());
				break;
			}
			compileStatement(generator, statement);
		}
	}

	public Value compileExpr(CodeGenerator generator, ExprRef expr) throws LangException
	{
		return getExpr(expr).compile(generator, this);
	}

	/**
	 * Evaluates an expression at compile time, or throws CANNOT_EVAL_AS_CONST if it
	 * depends on runtime values.
	 */
	public ConstValue constEvalExpr(ExprRef expr) throws LangException
	{
		return getExpr(expr).constEval(this);
	}
}
