package org.cellang.ast;

import org.cellang.codegen.CodeGenerator;
import org.cellang.codegen.Value;
import org.cellang.error.LangErrorKind;
import org.cellang.error.LangException;
import org.cellang.syntax.Span;
import org.cellang.type.Type;

import java.util.List;

/**
 * Two-armed conditional. Both blocks always exist; an absent {@code else} is empty.
 */
public final class IfStatement implements Statement
{
	private final Span span;
	private final ExprRef condExpr;
	private final List<StatementRef> ifTrue;
	private final List<StatementRef> ifFalse;

	private IfStatement(Span span, ExprRef condExpr, List<StatementRef> ifTrue, List<StatementRef> ifFalse)
	{
		this.span = span;
		this.condExpr = condExpr;
		this.ifTrue = List.copyOf(ifTrue);
		this.ifFalse = List.copyOf(ifFalse);
	}

	public static IfStatement tryNew(Span span, UserFunction userFunction, ExprRef condExpr, List<StatementRef> ifTrue, List<StatementRef> ifFalse) throws LangException
	{
		Expr cond = userFunction.getExpr(condExpr);
		if (cond.getReturnType().isVector())
		{
			throw LangException.of(LangErrorKind.TYPE_ERROR, cond.getSpan(), Type.INT, cond.getReturnType());
		}
		return new IfStatement(span, condExpr, ifTrue, ifFalse);
	}

	@Override
	public void compile(CodeGenerator generator, UserFunction userFunction) throws LangException
	{
		Value condition = userFunction.compileExpr(generator, condExpr);
		generator.buildConditional(
				condition.ref(),
				g -> userFunction.compileBlock(g, ifTrue),
				g -> userFunction.compileBlock(g, ifFalse)
		);
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public ExprRef getCondExpr()
	{
		return condExpr;
	}

	public List<StatementRef> getIfTrue()
	{
		return ifTrue;
	}

	public List<StatementRef> getIfFalse()
	{
		return ifFalse;
	}
}
