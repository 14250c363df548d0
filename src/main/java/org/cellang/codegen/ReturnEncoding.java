package org.cellang.codegen;

import org.cellang.type.CellStateType;
import org.cellang.type.ConstValue;
import org.cellang.type.IntType;
import org.cellang.type.Type;
import org.cellang.type.VectorType;

import java.util.ArrayList;
import java.util.List;

/**
 * Encoding of the single 64-bit value a generated function returns to its host.
 * <p>
 * Bit 63 set means a runtime error and the low bits hold the index of the error point.
 * Bit 63 clear means success and the low bits hold the result, zero-extended from the
 * width of the function's return type.
 */
public final class ReturnEncoding
{
	public static final long ERROR_FLAG = 1L << 63;

	private ReturnEncoding()
	{
	}

	public static long encodeError(int errorIndex)
	{
		if (errorIndex < 0)
		{
			throw new IllegalArgumentException("Error index must not be negative: " + errorIndex);
		}
		return ERROR_FLAG | errorIndex;
	}

	public static long encodeValue(ConstValue value)
	{
		Type type = value.getType();
		if (!type.fitsInReturnValue())
		{
			throw new IllegalArgumentException("Type " + type + " does not fit in a return value");
		}
		if (value instanceof ConstValue.Int i)
		{
			return Integer.toUnsignedLong(i.value());
		}
		if (value instanceof ConstValue.CellState c)
		{
			return c.state();
		}
		long packed = 0;
		List<Integer> lanes = ((ConstValue.Vector) value).values();
		for (int i = lanes.size() - 1; i >= 0; i--)
		{
			packed = (packed << Type.INT_BITS) | Integer.toUnsignedLong(lanes.get(i));
		}
		return packed;
	}

	public static DecodedReturn decode(long raw)
	{
		return new DecodedReturn((raw & ERROR_FLAG) != 0, raw & ~ERROR_FLAG);
	}

	/**
	 * Reinterprets a success payload as a value of {@code type}.
	 */
	public static ConstValue decodeValue(long payload, Type type)
	{
		if (type instanceof IntType)
		{
			return new ConstValue.Int((int) payload);
		}
		if (type instanceof CellStateType)
		{
			return new ConstValue.CellState((int) (payload & ((1 << Type.CELL_STATE_BITS) - 1)));
		}
		VectorType vec = (VectorType) type;
		List<Integer> lanes = new ArrayList<>(vec.length());
		for (int i = 0; i < vec.length(); i++)
		{
			lanes.add((int) (payload >>> (i * Type.INT_BITS)));
		}
		return new ConstValue.Vector(lanes);
	}
}
