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

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * The {@code #} operator: turns an integer ID into a cell state. IDs outside
 * {@code [0, stateCount)} of the rule trap.
 */
public class IntToCellState implements BuiltinFunction
{
	private final int stateCount;
	private final ErrorPointRef outOfRangeError;

	private IntToCellState(int stateCount, ErrorPointRef outOfRangeError)
	{
		this.stateCount = stateCount;
		this.outOfRangeError = outOfRangeError;
	}

	public static IntToCellState tryNew(UserFunction userFunction, Span span)
	{
		ErrorPointRef error = userFunction.addErrorPoint(LangError.of(LangErrorKind.CELL_STATE_OUT_OF_RANGE, span));
		return new IntToCellState(userFunction.getRuleMeta().stateCount(), error);
	}

	@Override
	public String name()
	{
		return "IntToCellState";
	}

	@Override
	public Type returnType(Span span, UserFunction userFunction, List<ExprRef> args) throws LangException
	{
		Typecheck.expectArgCount(span, name(), args, 1);
		Typecheck.expectType(userFunction, args.get(0), Type.INT);
		return Type.CELL_STATE;
	}

	@Override
	public Value compile(CodeGenerator generator, UserFunction userFunction, List<ExprRef> args) throws LangException
	{
		LLVMValueRef id = userFunction.compileExpr(generator, args.get(0)).ref();

		// Unsigned comparison also catches negative IDs
		LLVMValueRef limit = LLVMConstInt(generator.intType(), stateCount, 0);
		LLVMValueRef isOutOfRange = LLVMBuildICmp(generator.builder(), LLVMIntUGE, id, limit, "isCellStateOutOfRange");
		generator.buildConditional(isOutOfRange, outOfRangeError::compile, g ->
		{
		});

		LLVMValueRef state = LLVMBuildTrunc(generator.builder(), id, generator.cellStateType(), "cellState");
		return new Value(Type.CELL_STATE, state);
	}

	@Override
	public ConstValue constEval(Span span, UserFunction userFunction, List<ExprRef> args) throws LangException
	{
		int id = Typecheck.constInt(userFunction, args.get(0));
		if (id < 0 || id >= stateCount)
		{
			throw outOfRangeError.toException();
		}
		return new ConstValue.CellState(id);
	}
}
