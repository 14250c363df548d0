package org.cellang.functions;

import org.cellang.ast.ExprRef;
import org.cellang.ast.UserFunction;
import org.cellang.codegen.CodeGenerator;
import org.cellang.codegen.Value;
import org.cellang.error.LangErrorKind;
import org.cellang.error.LangException;
import org.cellang.syntax.Span;
import org.cellang.type.ConstValue;
import org.cellang.type.Type;

import java.util.List;

/**
 * Integer literal. Literals outside the signed 32-bit range are rejected when the
 * expression is built.
 */
public class IntLiteral implements BuiltinFunction
{
	private final long value;

	public IntLiteral(long value)
	{
		this.value = value;
	}

	public long getValue()
	{
		return value;
	}

	@Override
	public String name()
	{
		return "Int(" + value + ")";
	}

	@Override
	public Type returnType(Span span, UserFunction userFunction, List<ExprRef> args) throws LangException
	{
		Typecheck.expectArgCount(span, name(), args, 0);
		if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE)
		{
			throw LangException.of(LangErrorKind.INTEGER_OVERFLOW, span);
		}
		return Type.INT;
	}

	@Override
	public Value compile(CodeGenerator generator, UserFunction userFunction, List<ExprRef> args)
	{
		return new Value(Type.INT, generator.types().toLLVMConst(new ConstValue.Int((int) value)));
	}

	@Override
	public ConstValue constEval(Span span, UserFunction userFunction, List<ExprRef> args)
	{
		return new ConstValue.Int((int) value);
	}
}
