package org.cellang.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.cellang.ast.Neighborhood;
import org.cellang.ast.RuleMeta;
import org.cellang.error.LangErrorKind;
import org.cellang.error.LangException;
import org.cellang.syntax.AssignOp;
import org.cellang.syntax.ComparisonToken;
import org.cellang.syntax.OperatorToken;
import org.cellang.syntax.PunctuationToken;
import org.cellang.syntax.Span;
import org.cellang.syntax.SyntaxExpr;
import org.cellang.syntax.SyntaxRule;
import org.cellang.syntax.SyntaxStatement;
import org.cellang.type.Type;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts an ANTLR parse tree of a rule file into the {@code syntax} records the AST
 * builder consumes. Spans are character offsets into the source.
 * <p>
 * Expressions go through the generated visitor; directives and statements are converted
 * by plain methods so that directive errors can be thrown as {@link LangException}.
 */
public class SyntaxTreeBuilder extends CellangBaseVisitor<SyntaxExpr>
{
	private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

	public SyntaxRule buildRule(CellangParser.ProgramContext program) throws LangException
	{
		Integer stateCount = null;
		Integer ndim = null;
		String neighborhood = null;
		List<SyntaxStatement> transition = null;
		List<SyntaxRule.HelperFunction> helpers = new ArrayList<>();
		Set<String> helperNames = new HashSet<>();

		for (CellangParser.DirectiveContext directive : program.directive())
		{
			Span span = spanOf(directive);
			if (directive instanceof CellangParser.StatesDirectiveContext states)
			{
				ensureUnset(stateCount, span, "@states");
				stateCount = parseDirectiveInt(states.INTEGER_LITERAL(), span, "@states", 1, RuleMeta.MAX_STATE_COUNT);
			}
			else if (directive instanceof CellangParser.NdimDirectiveContext ndimCtx)
			{
				ensureUnset(ndim, span, "@ndim");
				ndim = parseDirectiveInt(ndimCtx.INTEGER_LITERAL(), span, "@ndim", 1, RuleMeta.MAX_NDIM);
			}
			else if (directive instanceof CellangParser.NeighborhoodDirectiveContext nbhd)
			{
				ensureUnset(neighborhood, span, "@neighborhood");
				neighborhood = nbhd.IDENTIFIER().getText();
				if (Neighborhood.fromKeyword(neighborhood) == null)
				{
					throw LangException.of(LangErrorKind.INVALID_DIRECTIVE, span, "unknown neighborhood '" + neighborhood + "'");
				}
			}
			else if (directive instanceof CellangParser.TransitionDirectiveContext transitionCtx)
			{
				ensureUnset(transition, span, "@transition");
				transition = buildBlock(transitionCtx.block());
			}
			else if (directive instanceof CellangParser.FunctionDirectiveContext function)
			{
				String name = function.IDENTIFIER().getText();
				if (!helperNames.add(name))
				{
					throw LangException.of(LangErrorKind.INVALID_DIRECTIVE, span, "duplicate helper function '" + name + "'");
				}
				Type returnType = buildType(function.typeName());
				helpers.add(new SyntaxRule.HelperFunction(span, name, returnType, buildBlock(function.block())));
			}
			else
			{
				throw LangException.of(LangErrorKind.INTERNAL_ERROR, span, "Unknown directive " + directive.getText());
			}
		}

		if (transition == null)
		{
			int end = program.getStop() == null ? 0 : Math.max(program.getStop().getStartIndex(), 0);
			throw LangException.of(LangErrorKind.INVALID_DIRECTIVE, new Span(end, end), "missing @transition");
		}

		return new SyntaxRule(
				ndim == null ? RuleMeta.DEFAULT_NDIM : ndim,
				neighborhood == null ? Neighborhood.MOORE.getKeyword() : neighborhood,
				stateCount == null ? RuleMeta.DEFAULT_STATE_COUNT : stateCount,
				transition,
				helpers);
	}

	private static void ensureUnset(Object current, Span span, String directiveName) throws LangException
	{
		if (current != null)
		{
			throw LangException.of(LangErrorKind.INVALID_DIRECTIVE, span, "duplicate " + directiveName);
		}
	}

	private static int parseDirectiveInt(TerminalNode literal, Span span, String directiveName, int min, int max) throws LangException
	{
		BigInteger value = new BigInteger(literal.getText());
		if (value.compareTo(BigInteger.valueOf(min)) < 0 || value.compareTo(BigInteger.valueOf(max)) > 0)
		{
			throw LangException.of(LangErrorKind.INVALID_DIRECTIVE, span,
					directiveName + " must be between " + min + " and " + max + ", got " + value);
		}
		return value.intValueExact();
	}

	private Type buildType(CellangParser.TypeNameContext typeName) throws LangException
	{
		if (typeName instanceof CellangParser.IntTypeNameContext)
		{
			return Type.INT;
		}
		if (typeName instanceof CellangParser.CellTypeNameContext)
		{
			return Type.CELL_STATE;
		}
		if (typeName instanceof CellangParser.VectorTypeNameContext vec)
		{
			int length = parseDirectiveInt(vec.INTEGER_LITERAL(), spanOf(vec), "Vector length", 1, Type.MAX_VECTOR_LEN);
			return Type.vector(length);
		}
		throw LangException.of(LangErrorKind.INTERNAL_ERROR, spanOf(typeName), "Unknown type " + typeName.getText());
	}

	// ---------- Statements ----------

	public List<SyntaxStatement> buildBlock(CellangParser.BlockContext block)
	{
		List<SyntaxStatement> statements = new ArrayList<>();
		for (CellangParser.StatementContext statement : block.statement())
		{
			statements.add(buildStatement(statement));
		}
		return statements;
	}

	private SyntaxStatement buildStatement(CellangParser.StatementContext ctx)
	{
		Span span = spanOf(ctx);
		if (ctx instanceof CellangParser.IfStmtContext ifStmt)
		{
			return buildIf(ifStmt.ifStatement());
		}
		if (ctx instanceof CellangParser.BecomeStmtContext become)
		{
			return new SyntaxStatement.Become(span, visit(become.expr()));
		}
		if (ctx instanceof CellangParser.ReturnStmtContext ret)
		{
			return new SyntaxStatement.Return(span, visit(ret.expr()));
		}
		if (ctx instanceof CellangParser.AssignStmtContext assign)
		{
			AssignOp assignOp = AssignOp.fromSymbol(assign.assignOp().getText());
			return new SyntaxStatement.SetVar(span, visit(assign.expr(0)), assignOp, visit(assign.expr(1)));
		}
		throw new IllegalStateException("Unknown statement " + ctx.getText());
	}

	private SyntaxStatement.If buildIf(CellangParser.IfStatementContext ctx)
	{
		SyntaxExpr cond = visit(ctx.expr());
		List<SyntaxStatement> ifTrue = buildBlock(ctx.block(0));
		List<SyntaxStatement> ifFalse;
		if (ctx.ifStatement() != null)
		{
			ifFalse = List.of(buildIf(ctx.ifStatement()));
		}
		else if (ctx.block().size() > 1)
		{
			ifFalse = buildBlock(ctx.block(1));
		}
		else
		{
			ifFalse = List.of();
		}
		return new SyntaxStatement.If(spanOf(ctx), cond, ifTrue, ifFalse);
	}

	// ---------- Expressions ----------

	@Override
	public SyntaxExpr visitExpr(CellangParser.ExprContext ctx)
	{
		if (ctx.cmpOp().isEmpty())
		{
			return visit(ctx.arith(0));
		}
		List<SyntaxExpr> exprs = new ArrayList<>();
		for (CellangParser.ArithContext arith : ctx.arith())
		{
			exprs.add(visit(arith));
		}
		List<ComparisonToken> cmps = new ArrayList<>();
		for (CellangParser.CmpOpContext cmp : ctx.cmpOp())
		{
			cmps.add(ComparisonToken.fromSymbol(cmp.getText()));
		}
		return new SyntaxExpr.Cmp(spanOf(ctx), exprs, cmps);
	}

	@Override
	public SyntaxExpr visitMethodCallExpr(CellangParser.MethodCallExprContext ctx)
	{
		return new SyntaxExpr.BinaryOp(spanOf(ctx), visit(ctx.arith()), OperatorToken.DOT, visit(ctx.primary()));
	}

	@Override
	public SyntaxExpr visitPowExpr(CellangParser.PowExprContext ctx)
	{
		return binary(ctx, ctx.arith(0), OperatorToken.DOUBLE_ASTERISK, ctx.arith(1));
	}

	@Override
	public SyntaxExpr visitUnaryExpr(CellangParser.UnaryExprContext ctx)
	{
		return new SyntaxExpr.UnaryOp(spanOf(ctx), operatorOf(ctx.op), visit(ctx.arith()));
	}

	@Override
	public SyntaxExpr visitMulExpr(CellangParser.MulExprContext ctx)
	{
		return binary(ctx, ctx.arith(0), operatorOf(ctx.op), ctx.arith(1));
	}

	@Override
	public SyntaxExpr visitAddExpr(CellangParser.AddExprContext ctx)
	{
		return binary(ctx, ctx.arith(0), operatorOf(ctx.op), ctx.arith(1));
	}

	@Override
	public SyntaxExpr visitShiftExpr(CellangParser.ShiftExprContext ctx)
	{
		return binary(ctx, ctx.arith(0), operatorOf(ctx.op), ctx.arith(1));
	}

	@Override
	public SyntaxExpr visitBitAndExpr(CellangParser.BitAndExprContext ctx)
	{
		return binary(ctx, ctx.arith(0), OperatorToken.AMPERSAND, ctx.arith(1));
	}

	@Override
	public SyntaxExpr visitBitOrExpr(CellangParser.BitOrExprContext ctx)
	{
		return binary(ctx, ctx.arith(0), OperatorToken.PIPE, ctx.arith(1));
	}

	@Override
	public SyntaxExpr visitRangeExpr(CellangParser.RangeExprContext ctx)
	{
		return binary(ctx, ctx.arith(0), OperatorToken.DOT_DOT, ctx.arith(1));
	}

	@Override
	public SyntaxExpr visitPrimaryExpr(CellangParser.PrimaryExprContext ctx)
	{
		return visit(ctx.primary());
	}

	@Override
	public SyntaxExpr visitIntLiteral(CellangParser.IntLiteralContext ctx)
	{
		BigInteger value = new BigInteger(ctx.getText());
		// Anything beyond the long range is out of the int range as well, which the AST builder reports
		return new SyntaxExpr.Int(spanOf(ctx), value.min(LONG_MAX).longValue());
	}

	@Override
	public SyntaxExpr visitIdentifier(CellangParser.IdentifierContext ctx)
	{
		return new SyntaxExpr.Ident(spanOf(ctx), ctx.getText());
	}

	@Override
	public SyntaxExpr visitParenGroup(CellangParser.ParenGroupContext ctx)
	{
		return new SyntaxExpr.Group(spanOf(ctx), PunctuationToken.LPAREN, buildGroupContents(ctx.exprList(), spanOf(ctx)));
	}

	@Override
	public SyntaxExpr visitBracketGroup(CellangParser.BracketGroupContext ctx)
	{
		return new SyntaxExpr.Group(spanOf(ctx), PunctuationToken.LBRACKET, buildGroupContents(ctx.exprList(), spanOf(ctx)));
	}

	/**
	 * A single expression stays as it is; zero or several become a list.
	 */
	private SyntaxExpr buildGroupContents(CellangParser.ExprListContext exprList, Span groupSpan)
	{
		if (exprList == null)
		{
			return new SyntaxExpr.ListExpr(new Span(groupSpan.start() + 1, groupSpan.start() + 1), List.of());
		}
		List<CellangParser.ExprContext> exprs = exprList.expr();
		if (exprs.size() == 1)
		{
			return visit(exprs.get(0));
		}
		List<SyntaxExpr> items = new ArrayList<>();
		for (CellangParser.ExprContext expr : exprs)
		{
			items.add(visit(expr));
		}
		return new SyntaxExpr.ListExpr(spanOf(exprList), items);
	}

	private SyntaxExpr binary(ParserRuleContext ctx, CellangParser.ArithContext lhs, OperatorToken op, CellangParser.ArithContext rhs)
	{
		return new SyntaxExpr.BinaryOp(spanOf(ctx), visit(lhs), op, visit(rhs));
	}

	private static OperatorToken operatorOf(Token token)
	{
		return OperatorToken.fromSymbol(token.getText());
	}

	static Span spanOf(ParserRuleContext ctx)
	{
		int start = Math.max(ctx.getStart().getStartIndex(), 0);
		Token stop = ctx.getStop();
		int end = stop == null || stop.getStopIndex() < start ? start : stop.getStopIndex() + 1;
		return new Span(start, end);
	}
}
