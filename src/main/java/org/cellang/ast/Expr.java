package org.cellang.ast;

import org.cellang.codegen.CodeGenerator;
import org.cellang.codegen.Value;
import org.cellang.error.LangError;
import org.cellang.error.LangException;
import org.cellang.functions.BuiltinFunction;
import org.cellang.syntax.Span;
import org.cellang.type.ConstValue;
import org.cellang.type.Type;

import java.util.List;

/**
 * Expression node: a built-in function applied to other expressions of the same
 * {@link UserFunction}. Immutable once constructed.
 */
public final class Expr
{
	private final Span span;
	private final BuiltinFunction function;
	private final List<ExprRef> args;
	private final Type returnType;

	private Expr(Span span, BuiltinFunction function, List<ExprRef> args, Type returnType)
	{
		this.span = span;
		this.function = function;
		this.args = args;
		this.returnType = returnType;
	}

	/**
	 * Lets {@code function} validate its arguments and constructs the node with the
	 * resulting type.
	 */
	public static Expr tryNew(Span span, UserFunction userFunction, BuiltinFunction function, List<ExprRef> args) throws LangException
	{
		List<ExprRef> argsCopy = List.copyOf(args);
		Type returnType = function.returnType(span, userFunction, argsCopy);
		return new Expr(span, function, argsCopy, returnType);
	}

	public Value compile(CodeGenerator generator, UserFunction userFunction) throws LangException
	{
		Value value = function.compile(generator, userFunction, args);
		if (!value.type().equals(returnType))
		{
			throw LangError.internal(span, function.name() + " produced " + value.type() + " instead of " + returnType).toException();
		}
		return value;
	}

	public ConstValue constEval(UserFunction userFunction) throws LangException
	{
		return function.constEval(span, userFunction, args);
	}

	public Span getSpan()
	{
		return span;
	}

	public BuiltinFunction getFunction()
	{
		return function;
	}

	public List<ExprRef> getArgs()
	{
		return args;
	}

	public Type getReturnType()
	{
		return returnType;
	}

	@Override
	public String toString()
	{
		return function.name() + args + " : " + returnType;
	}
}
