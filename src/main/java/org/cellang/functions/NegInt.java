package org.cellang.functions;

import org.bytedeco.llvm.LLVM.LLVMValueRef;
import org.cellang.ast.ErrorPointRef;
import org.cellang.ast.ExprRef;
import org.cellang.ast.UserFunction;
import org.cellang.codegen.CodeGenerator;
import org.cellang.codegen.Value;
import org.cellang.error.LangError;
import org.cellang.error.LangErrorKind;
import org.cellang.error.LangException;
import org.cellang.syntax.Span;
import org.cellang.type.ConstValue;
import org.cellang.type.Type;

import java.util.List;

import static org.bytedeco.llvm.global.LLVM.LLVMConstNull;

/**
 * Integer negation, computed as a checked {@code 0 - x}. Negating the minimum integer
 * overflows.
 */
public class NegInt implements BuiltinFunction
{
	private final ErrorPointRef overflowError;

	private NegInt(ErrorPointRef overflowError)
	{
		this.overflowError = overflowError;
	}

	public static NegInt tryNew(UserFunction userFunction, Span span)
	{
		return new NegInt(userFunction.addErrorPoint(LangError.of(LangErrorKind.INTEGER_OVERFLOW, span)));
	}

	@Override
	public String name()
	{
		return "NegInt";
	}

	@Override
	public Type returnType(Span span, UserFunction userFunction, List<ExprRef> args) throws LangException
	{
		Typecheck.expectArgCount(span, name(), args, 1);
		Typecheck.expectType(userFunction, args.get(0), Type.INT);
		return Type.INT;
	}

	@Override
	public Value compile(CodeGenerator generator, UserFunction userFunction, List<ExprRef> args) throws LangException
	{
		LLVMValueRef operand = userFunction.compileExpr(generator, args.get(0)).ref();
		LLVMValueRef zero = LLVMConstNull(generator.intType());
		LLVMValueRef result = generator.buildCheckedIntArithmetic(zero, operand, "ssub", overflowError::compile);
		return new Value(Type.INT, result);
	}

	@Override
	public ConstValue constEval(Span span, UserFunction userFunction, List<ExprRef> args) throws LangException
	{
		int operand = Typecheck.constInt(userFunction, args.get(0));
		try
		{
			return new ConstValue.Int(Math.negateExact(operand));
		}
		catch (ArithmeticException e)
		{
			throw overflowError.toException();
		}
	}
}
