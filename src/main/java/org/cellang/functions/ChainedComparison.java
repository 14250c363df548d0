package org.cellang.functions;

import org.bytedeco.llvm.LLVM.LLVMValueRef;
import org.cellang.ast.Expr;
import org.cellang.ast.ExprRef;
import org.cellang.ast.UserFunction;
import org.cellang.codegen.CodeGenerator;
import org.cellang.codegen.Value;
import org.cellang.error.LangError;
import org.cellang.error.LangErrorKind;
import org.cellang.error.LangException;
import org.cellang.syntax.ComparisonToken;
import org.cellang.syntax.Span;
import org.cellang.type.ConstValue;
import org.cellang.type.Type;

import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * A chain such as {@code a < b <= c}, true when every adjacent pair compares true. All
 * operands are evaluated, left to right, and the result is an integer 1 or 0.
 */
public class ChainedComparison implements BuiltinFunction
{
	private final List<ComparisonToken> cmps;
	private final Type operandType;

	private ChainedComparison(List<ComparisonToken> cmps, Type operandType)
	{
		this.cmps = List.copyOf(cmps);
		this.operandType = operandType;
	}

	/**
	 * Checks that the operands share one type and that each comparator is defined for it.
	 * Integers support every comparator; cell states only {@code ==} and {@code !=}.
	 */
	public static ChainedComparison tryNew(UserFunction userFunction, Span span, List<ExprRef> args, List<ComparisonToken> cmps) throws LangException
	{
		if (args.size() != cmps.size() + 1 || cmps.isEmpty())
		{
			throw LangError.internal(span, "Comparison with " + args.size() + " operands and " + cmps.size() + " comparators").toException();
		}

		for (int i = 0; i < cmps.size(); i++)
		{
			Expr lhs = userFunction.getExpr(args.get(i));
			Expr rhs = userFunction.getExpr(args.get(i + 1));
			Type lhsType = lhs.getReturnType();
			Type rhsType = rhs.getReturnType();
			ComparisonToken cmp = cmps.get(i);

			if (!lhsType.equals(rhsType))
			{
				throw LangException.of(LangErrorKind.TYPE_ERROR, rhs.getSpan(), lhsType, rhsType);
			}
			boolean allowed = lhsType.equals(Type.INT) || (lhsType.equals(Type.CELL_STATE) && cmp.isEquality());
			if (!allowed)
			{
				throw LangException.of(LangErrorKind.INVALID_COMPARISON, lhs.getSpan().merge(rhs.getSpan()), lhsType, rhsType, cmp.getSymbol());
			}
		}
		return new ChainedComparison(cmps, userFunction.getExpr(args.get(0)).getReturnType());
	}

	public List<ComparisonToken> getCmps()
	{
		return cmps;
	}

	@Override
	public String name()
	{
		StringBuilder sb = new StringBuilder("Compare(");
		for (int i = 0; i < cmps.size(); i++)
		{
			sb.append(i == 0 ? "" : " ").append(cmps.get(i).getSymbol());
		}
		return sb.append(')').toString();
	}

	@Override
	public Type returnType(Span span, UserFunction userFunction, List<ExprRef> args) throws LangException
	{
		Typecheck.expectArgCount(span, name(), args, cmps.size() + 1);
		for (ExprRef arg : args)
		{
			Typecheck.expectType(userFunction, arg, operandType);
		}
		return Type.INT;
	}

	@Override
	public Value compile(CodeGenerator generator, UserFunction userFunction, List<ExprRef> args) throws LangException
	{
		List<LLVMValueRef> operands = new ArrayList<>(args.size());
		for (ExprRef arg : args)
		{
			operands.add(userFunction.compileExpr(generator, arg).ref());
		}

		LLVMValueRef allTrue = LLVMConstInt(generator.types().boolType(), 1, 0);
		for (int i = 0; i < cmps.size(); i++)
		{
			LLVMValueRef pairResult = LLVMBuildICmp(generator.builder(), toPredicate(cmps.get(i)), operands.get(i), operands.get(i + 1), "cmp");
			allTrue = LLVMBuildAnd(generator.builder(), allTrue, pairResult, "allTrue");
		}
		LLVMValueRef result = LLVMBuildZExt(generator.builder(), allTrue, generator.intType(), "cmpResult");
		return new Value(Type.INT, result);
	}

	private int toPredicate(ComparisonToken cmp)
	{
		switch (cmp)
		{
			case EQ:
				return LLVMIntEQ;
			case NE:
				return LLVMIntNE;
			case LT:
				return LLVMIntSLT;
			case GT:
				return LLVMIntSGT;
			case LE:
				return LLVMIntSLE;
			case GE:
				return LLVMIntSGE;
			default:
				throw new IllegalArgumentException("Unknown comparison " + cmp);
		}
	}

	@Override
	public ConstValue constEval(Span span, UserFunction userFunction, List<ExprRef> args) throws LangException
	{
		List<Long> values = new ArrayList<>(args.size());
		for (ExprRef arg : args)
		{
			ConstValue value = userFunction.constEvalExpr(arg);
			if (value instanceof ConstValue.Int i)
			{
				values.add((long) i.value());
			}
			else if (value instanceof ConstValue.CellState c)
			{
				values.add((long) c.state());
			}
			else
			{
				throw LangException.of(LangErrorKind.CANNOT_EVAL_AS_CONST, span);
			}
		}

		boolean allTrue = true;
		for (int i = 0; i < cmps.size(); i++)
		{
			allTrue &= cmps.get(i).evaluate(values.get(i), values.get(i + 1));
		}
		return new ConstValue.Int(allTrue ? 1 : 0);
	}
}
