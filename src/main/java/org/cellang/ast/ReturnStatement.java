package org.cellang.ast;

import org.cellang.codegen.CodeGenerator;
import org.cellang.codegen.Value;
import org.cellang.error.LangErrorKind;
import org.cellang.error.LangException;
import org.cellang.syntax.Span;
import org.cellang.type.Type;

/**
 * Exit statement: {@code become} in a transition function, {@code return} in a helper.
 * The builder decides which keyword is legal; both produce this node.
 */
public final class ReturnStatement implements Statement
{
	private final Span span;
	private final ExprRef retExpr;

	private ReturnStatement(Span span, ExprRef retExpr)
	{
		this.span = span;
		this.retExpr = retExpr;
	}

	public static ReturnStatement tryNew(Span span, UserFunction userFunction, ExprRef retExpr) throws LangException
	{
		Type expected = userFunction.getReturnType();
		Type got = userFunction.getExpr(retExpr).getReturnType();
		if (!expected.equals(got))
		{
			throw LangException.of(LangErrorKind.TYPE_ERROR, userFunction.getExpr(retExpr).getSpan(), expected, got);
		}
		return new ReturnStatement(span, retExpr);
	}

	@Override
	public void compile(CodeGenerator generator, UserFunction userFunction) throws LangException
	{
		Value value = userFunction.compileExpr(generator, retExpr);
		generator.buildReturnValue(value);
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public ExprRef getRetExpr()
	{
		return retExpr;
	}
}
