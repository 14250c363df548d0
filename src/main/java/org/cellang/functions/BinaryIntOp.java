package org.cellang.functions;

import org.bytedeco.llvm.LLVM.LLVMBasicBlockRef;
import org.bytedeco.llvm.LLVM.LLVMBuilderRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;
import org.cellang.ast.ErrorPointRef;
import org.cellang.ast.ExprRef;
import org.cellang.ast.UserFunction;
import org.cellang.codegen.CodeGenerator;
import org.cellang.codegen.Value;
import org.cellang.error.LangError;
import org.cellang.error.LangErrorKind;
import org.cellang.error.LangException;
import org.cellang.syntax.OperatorToken;
import org.cellang.syntax.Span;
import org.cellang.type.ConstValue;
import org.cellang.type.Type;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * Binary operation on two integers. Every operator that can fail at runtime registers
 * its error points when it is constructed, so that their indices are fixed before any
 * code is generated.
 */
public class BinaryIntOp implements BuiltinFunction
{
	private static final Set<OperatorToken> SUPPORTED = EnumSet.of(
			OperatorToken.PLUS,
			OperatorToken.MINUS,
			OperatorToken.ASTERISK,
			OperatorToken.SLASH,
			OperatorToken.PERCENT,
			OperatorToken.DOUBLE_ASTERISK,
			OperatorToken.DOUBLE_LESS_THAN,
			OperatorToken.DOUBLE_GREATER_THAN,
			OperatorToken.TRIPLE_GREATER_THAN,
			OperatorToken.AMPERSAND,
			OperatorToken.PIPE);

	private final OperatorToken op;
	private final ErrorPointRef overflowError;
	private final ErrorPointRef divByZeroError;
	private final ErrorPointRef negativeExponentError;
	private final ErrorPointRef shiftOutOfRangeError;

	private BinaryIntOp(OperatorToken op, ErrorPointRef overflowError, ErrorPointRef divByZeroError,
						ErrorPointRef negativeExponentError, ErrorPointRef shiftOutOfRangeError)
	{
		this.op = op;
		this.overflowError = overflowError;
		this.divByZeroError = divByZeroError;
		this.negativeExponentError = negativeExponentError;
		this.shiftOutOfRangeError = shiftOutOfRangeError;
	}

	public static boolean supports(OperatorToken op)
	{
		return SUPPORTED.contains(op);
	}

	public static BinaryIntOp tryNew(UserFunction userFunction, Span span, OperatorToken op) throws LangException
	{
		if (!supports(op))
		{
			throw LangError.internal(span, "'" + op.getSymbol() + "' is not a binary integer operator").toException();
		}

		ErrorPointRef overflow = null;
		ErrorPointRef divByZero = null;
		ErrorPointRef negativeExponent = null;
		ErrorPointRef shiftOutOfRange = null;
		switch (op)
		{
			case PLUS:
			case MINUS:
			case ASTERISK:
				overflow = userFunction.addErrorPoint(LangError.of(LangErrorKind.INTEGER_OVERFLOW, span));
				break;
			case SLASH:
			case PERCENT:
				divByZero = userFunction.addErrorPoint(LangError.of(LangErrorKind.DIVIDE_BY_ZERO, span));
				overflow = userFunction.addErrorPoint(LangError.of(LangErrorKind.INTEGER_OVERFLOW, span));
				break;
			case DOUBLE_ASTERISK:
				negativeExponent = userFunction.addErrorPoint(LangError.of(LangErrorKind.NEGATIVE_EXPONENT, span));
				overflow = userFunction.addErrorPoint(LangError.of(LangErrorKind.INTEGER_OVERFLOW, span));
				break;
			case DOUBLE_LESS_THAN:
			case DOUBLE_GREATER_THAN:
			case TRIPLE_GREATER_THAN:
				shiftOutOfRange = userFunction.addErrorPoint(LangError.of(LangErrorKind.BITSHIFT_OUT_OF_RANGE, span));
				break;
			default:
				break;
		}
		return new BinaryIntOp(op, overflow, divByZero, negativeExponent, shiftOutOfRange);
	}

	public OperatorToken getOp()
	{
		return op;
	}

	@Override
	public String name()
	{
		return "BinaryIntOp(" + op.getSymbol() + ")";
	}

	@Override
	public Type returnType(Span span, UserFunction userFunction, List<ExprRef> args) throws LangException
	{
		Typecheck.expectArgCount(span, name(), args, 2);
		Typecheck.expectType(userFunction, args.get(0), Type.INT);
		Typecheck.expectType(userFunction, args.get(1), Type.INT);
		return Type.INT;
	}

	@Override
	public Value compile(CodeGenerator generator, UserFunction userFunction, List<ExprRef> args) throws LangException
	{
		LLVMValueRef lhs = userFunction.compileExpr(generator, args.get(0)).ref();
		LLVMValueRef rhs = userFunction.compileExpr(generator, args.get(1)).ref();
		LLVMBuilderRef builder = generator.builder();

		LLVMValueRef result;
		switch (op)
		{
			case PLUS:
				result = generator.buildCheckedIntArithmetic(lhs, rhs, "sadd", overflowError::compile);
				break;
			case MINUS:
				result = generator.buildCheckedIntArithmetic(lhs, rhs, "ssub", overflowError::compile);
				break;
			case ASTERISK:
				result = generator.buildCheckedIntArithmetic(lhs, rhs, "smul", overflowError::compile);
				break;
			case SLASH:
				generator.buildDivCheck(lhs, rhs, overflowError::compile, divByZeroError::compile);
				result = LLVMBuildSDiv(builder, lhs, rhs, "quotient");
				break;
			case PERCENT:
				generator.buildDivCheck(lhs, rhs, overflowError::compile, divByZeroError::compile);
				result = LLVMBuildSRem(builder, lhs, rhs, "remainder");
				break;
			case DOUBLE_ASTERISK:
				result = buildPow(generator, lhs, rhs);
				break;
			case DOUBLE_LESS_THAN:
				buildShiftCheck(generator, rhs);
				result = LLVMBuildShl(builder, lhs, rhs, "shl");
				break;
			case DOUBLE_GREATER_THAN:
				buildShiftCheck(generator, rhs);
				result = LLVMBuildAShr(builder, lhs, rhs, "ashr");
				break;
			case TRIPLE_GREATER_THAN:
				buildShiftCheck(generator, rhs);
				result = LLVMBuildLShr(builder, lhs, rhs, "lshr");
				break;
			case AMPERSAND:
				result = LLVMBuildAnd(builder, lhs, rhs, "and");
				break;
			case PIPE:
				result = LLVMBuildOr(builder, lhs, rhs, "or");
				break;
			default:
				throw LangError.internal(null, "Cannot compile " + name()).toException();
		}
		return new Value(Type.INT, result);
	}

	private void buildShiftCheck(CodeGenerator generator, LLVMValueRef amount) throws LangException
	{
		// Unsigned comparison also catches negative amounts
		LLVMValueRef limit = LLVMConstInt(generator.intType(), Type.INT_BITS, 0);
		LLVMValueRef isOutOfRange = LLVMBuildICmp(generator.builder(), LLVMIntUGE, amount, limit, "isShiftOutOfRange");
		generator.buildConditional(isOutOfRange, shiftOutOfRangeError::compile, g ->
		{
		});
	}

	/**
	 * Exponentiation by squaring. The running values live in stack slots so the loop needs
	 * no phi nodes.
	 */
	private LLVMValueRef buildPow(CodeGenerator generator, LLVMValueRef base, LLVMValueRef exponent) throws LangException
	{
		LLVMBuilderRef builder = generator.builder();
		LLVMValueRef zero = LLVMConstNull(generator.intType());
		LLVMValueRef one = LLVMConstInt(generator.intType(), 1, 0);

		LLVMValueRef isNegative = LLVMBuildICmp(builder, LLVMIntSLT, exponent, zero, "isNegativeExponent");
		generator.buildConditional(isNegative, negativeExponentError::compile, g ->
		{
		});

		LLVMValueRef resultSlot = generator.buildEntryBlockAlloca(generator.intType(), "powResult");
		LLVMValueRef baseSlot = generator.buildEntryBlockAlloca(generator.intType(), "powBase");
		LLVMValueRef expSlot = generator.buildEntryBlockAlloca(generator.intType(), "powExp");
		LLVMBuildStore(builder, one, resultSlot);
		LLVMBuildStore(builder, base, baseSlot);
		LLVMBuildStore(builder, exponent, expSlot);

		LLVMBasicBlockRef headerBlock = generator.appendBasicBlock("powLoop");
		LLVMBasicBlockRef bodyBlock = generator.appendBasicBlock("powBody");
		LLVMBasicBlockRef exitBlock = generator.appendBasicBlock("powExit");
		LLVMBuildBr(builder, headerBlock);

		LLVMPositionBuilderAtEnd(builder, headerBlock);
		LLVMValueRef exp = LLVMBuildLoad2(builder, generator.intType(), expSlot, "exp");
		LLVMValueRef isDone = LLVMBuildICmp(builder, LLVMIntEQ, exp, zero, "isDone");
		LLVMBuildCondBr(builder, isDone, exitBlock, bodyBlock);

		LLVMPositionBuilderAtEnd(builder, bodyBlock);
		LLVMValueRef lowBit = LLVMBuildAnd(builder, exp, one, "lowBit");
		generator.buildConditional(lowBit, g ->
		{
			LLVMValueRef acc = LLVMBuildLoad2(g.builder(), g.intType(), resultSlot, "acc");
			LLVMValueRef factor = LLVMBuildLoad2(g.builder(), g.intType(), baseSlot, "factor");
			LLVMValueRef product = g.buildCheckedIntArithmetic(acc, factor, "smul", overflowError::compile);
			LLVMBuildStore(g.builder(), product, resultSlot);
		}, g ->
		{
		});

		LLVMValueRef nextExp = LLVMBuildLShr(builder, exp, one, "nextExp");
		LLVMBuildStore(builder, nextExp, expSlot);

		// The last square is never used, so it must not trap
		LLVMValueRef hasMoreBits = LLVMBuildICmp(builder, LLVMIntNE, nextExp, zero, "hasMoreBits");
		generator.buildConditional(hasMoreBits, g ->
		{
			LLVMValueRef current = LLVMBuildLoad2(g.builder(), g.intType(), baseSlot, "base");
			LLVMValueRef squared = g.buildCheckedIntArithmetic(current, current, "smul", overflowError::compile);
			LLVMBuildStore(g.builder(), squared, baseSlot);
		}, g ->
		{
		});
		LLVMBuildBr(builder, headerBlock);

		LLVMPositionBuilderAtEnd(builder, exitBlock);
		return LLVMBuildLoad2(builder, generator.intType(), resultSlot, "pow");
	}

	@Override
	public ConstValue constEval(Span span, UserFunction userFunction, List<ExprRef> args) throws LangException
	{
		int lhs = Typecheck.constInt(userFunction, args.get(0));
		int rhs = Typecheck.constInt(userFunction, args.get(1));
		return new ConstValue.Int(evaluate(lhs, rhs));
	}

	private int evaluate(int lhs, int rhs) throws LangException
	{
		try
		{
			switch (op)
			{
				case PLUS:
					return Math.addExact(lhs, rhs);
				case MINUS:
					return Math.subtractExact(lhs, rhs);
				case ASTERISK:
					return Math.multiplyExact(lhs, rhs);
				case SLASH:
				case PERCENT:
					if (rhs == 0)
					{
						throw divByZeroError.toException();
					}
					if (lhs == Integer.MIN_VALUE && rhs == -1)
					{
						throw overflowError.toException();
					}
					return op == OperatorToken.SLASH ? lhs / rhs : lhs % rhs;
				case DOUBLE_ASTERISK:
					return pow(lhs, rhs);
				case DOUBLE_LESS_THAN:
					checkShiftAmount(rhs);
					return lhs << rhs;
				case DOUBLE_GREATER_THAN:
					checkShiftAmount(rhs);
					return lhs >> rhs;
				case TRIPLE_GREATER_THAN:
					checkShiftAmount(rhs);
					return lhs >>> rhs;
				case AMPERSAND:
					return lhs & rhs;
				case PIPE:
					return lhs | rhs;
				default:
					throw LangError.internal(null, "Cannot evaluate " + name()).toException();
			}
		}
		catch (ArithmeticException e)
		{
			throw overflowError.toException();
		}
	}

	private int pow(int base, int exponent) throws LangException
	{
		if (exponent < 0)
		{
			throw negativeExponentError.toException();
		}
		int result = 1;
		while (exponent != 0)
		{
			if ((exponent & 1) != 0)
			{
				result = Math.multiplyExact(result, base);
			}
			exponent >>>= 1;
			if (exponent != 0)
			{
				base = Math.multiplyExact(base, base);
			}
		}
		return result;
	}

	private void checkShiftAmount(int amount) throws LangException
	{
		if (amount < 0 || amount >= Type.INT_BITS)
		{
			throw shiftOutOfRangeError.toException();
		}
	}
}
