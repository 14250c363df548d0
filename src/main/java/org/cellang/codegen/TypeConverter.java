package org.cellang.codegen;

import org.bytedeco.javacpp.PointerPointer;
import org.bytedeco.llvm.LLVM.LLVMContextRef;
import org.bytedeco.llvm.LLVM.LLVMTypeRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;
import org.cellang.type.CellStateType;
import org.cellang.type.ConstValue;
import org.cellang.type.IntType;
import org.cellang.type.Type;
import org.cellang.type.VectorType;

import java.util.List;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * Maps language types and constants onto LLVM types and constants of one context.
 */
public class TypeConverter
{
	private final LLVMContextRef context;

	public TypeConverter(LLVMContextRef context)
	{
		this.context = context;
	}

	/**
	 * The wide integer every generated function returns: bit 63 flags an error.
	 */
	public LLVMTypeRef returnType()
	{
		return LLVMInt64TypeInContext(context);
	}

	public LLVMTypeRef intType()
	{
		return LLVMIntTypeInContext(context, Type.INT_BITS);
	}

	public LLVMTypeRef cellStateType()
	{
		return LLVMIntTypeInContext(context, Type.CELL_STATE_BITS);
	}

	public LLVMTypeRef boolType()
	{
		return LLVMInt1TypeInContext(context);
	}

	/**
	 * Integer type exactly as wide as {@code type}, used to pack values into the return value.
	 */
	public LLVMTypeRef packedType(Type type)
	{
		return LLVMIntTypeInContext(context, type.bits());
	}

	public LLVMTypeRef toLLVMType(Type type)
	{
		if (type instanceof IntType)
		{
			return intType();
		}
		if (type instanceof CellStateType)
		{
			return cellStateType();
		}
		VectorType vec = (VectorType) type;
		return LLVMVectorType(intType(), vec.length());
	}

	public LLVMValueRef toLLVMConst(ConstValue value)
	{
		if (value instanceof ConstValue.Int i)
		{
			return LLVMConstInt(intType(), i.value(), 1);
		}
		if (value instanceof ConstValue.CellState c)
		{
			return LLVMConstInt(cellStateType(), c.state(), 0);
		}
		List<Integer> lanes = ((ConstValue.Vector) value).values();
		LLVMValueRef[] elems = new LLVMValueRef[lanes.size()];
		for (int i = 0; i < elems.length; i++)
		{
			elems[i] = LLVMConstInt(intType(), lanes.get(i), 1);
		}
		return LLVMConstVector(new PointerPointer<>(elems), elems.length);
	}
}
