package org.cellang.functions;

import org.cellang.ast.Expr;
import org.cellang.ast.ExprRef;
import org.cellang.ast.UserFunction;
import org.cellang.error.LangError;
import org.cellang.error.LangErrorKind;
import org.cellang.error.LangException;
import org.cellang.syntax.Span;
import org.cellang.type.ConstValue;
import org.cellang.type.Type;

import java.util.List;

/**
 * Argument checks shared by the built-in functions.
 */
final class Typecheck
{
	private Typecheck()
	{
	}

	static void expectArgCount(Span span, String functionName, List<ExprRef> args, int expected) throws LangException
	{
		if (args.size() != expected)
		{
			throw LangError.internal(span, functionName + " expects " + expected + " argument(s), got " + args.size()).toException();
		}
	}

	static void expectType(UserFunction userFunction, ExprRef arg, Type expected) throws LangException
	{
		Expr expr = userFunction.getExpr(arg);
		if (!expr.getReturnType().equals(expected))
		{
			throw LangException.of(LangErrorKind.TYPE_ERROR, expr.getSpan(), expected, expr.getReturnType());
		}
	}

	static int constInt(UserFunction userFunction, ExprRef arg) throws LangException
	{
		ConstValue value = userFunction.constEvalExpr(arg);
		if (!(value instanceof ConstValue.Int i))
		{
			Expr expr = userFunction.getExpr(arg);
			throw LangException.of(LangErrorKind.TYPE_ERROR, expr.getSpan(), Type.INT, value.getType());
		}
		return i.value();
	}
}
