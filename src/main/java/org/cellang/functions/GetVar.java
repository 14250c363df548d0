package org.cellang.functions;

import org.cellang.ast.ExprRef;
import org.cellang.ast.UserFunction;
import org.cellang.codegen.CodeGenerator;
import org.cellang.codegen.Value;
import org.cellang.error.LangException;
import org.cellang.syntax.Span;
import org.cellang.type.Type;

import java.util.List;

/**
 * Reads the current value of a variable.
 */
public class GetVar implements BuiltinFunction
{
	private final String varName;
	private final Type varType;

	private GetVar(String varName, Type varType)
	{
		this.varName = varName;
		this.varType = varType;
	}

	/**
	 * Looks the variable up; fails with USE_OF_UNINITIALIZED_VARIABLE if it has never been
	 * assigned.
	 */
	public static GetVar tryNew(UserFunction userFunction, Span span, String varName) throws LangException
	{
		return new GetVar(varName, userFunction.tryGetVar(span, varName));
	}

	public String getVarName()
	{
		return varName;
	}

	@Override
	public String name()
	{
		return "GetVar(" + varName + ")";
	}

	@Override
	public Type returnType(Span span, UserFunction userFunction, List<ExprRef> args) throws LangException
	{
		Typecheck.expectArgCount(span, name(), args, 0);
		return varType;
	}

	@Override
	public Value compile(CodeGenerator generator, UserFunction userFunction, List<ExprRef> args) throws LangException
	{
		return generator.buildLoadVar(varName, varType);
	}
}
