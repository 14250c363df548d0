package org.cellang.ast;

import org.cellang.codegen.CodeGenerator;
import org.cellang.codegen.Value;
import org.cellang.error.LangErrorKind;
import org.cellang.error.LangException;
import org.cellang.syntax.Span;
import org.cellang.type.Type;

/**
 * Assignment of an expression to a variable.
 */
public final class SetVarStatement implements Statement
{
	private final Span span;
	private final String varName;
	private final ExprRef valueExpr;

	private SetVarStatement(Span span, String varName, ExprRef valueExpr)
	{
		this.span = span;
		this.varName = varName;
		this.valueExpr = valueExpr;
	}

	/**
	 * Declares the variable on first assignment. Once a variable has a type, assigning a
	 * value of any other type is rejected.
	 */
	public static SetVarStatement tryNew(Span span, UserFunction userFunction, String varName, ExprRef valueExpr) throws LangException
	{
		Type valueType = userFunction.getExpr(valueExpr).getReturnType();
		Type varType = userFunction.getOrCreateVar(varName, valueType);
		if (!varType.equals(valueType))
		{
			throw LangException.of(LangErrorKind.TYPE_ERROR, span, varType, valueType);
		}
		return new SetVarStatement(span, varName, valueExpr);
	}

	@Override
	public void compile(CodeGenerator generator, UserFunction userFunction) throws LangException
	{
		Value value = userFunction.compileExpr(generator, valueExpr);
		generator.buildStoreVar(varName, value);
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public String getVarName()
	{
		return varName;
	}

	public ExprRef getValueExpr()
	{
		return valueExpr;
	}
}
