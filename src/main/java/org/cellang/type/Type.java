package org.cellang.type;

/**
 * The closed set of value types of the rule language. Equality is structural, so two
 * vectors of the same length are the same type.
 */
public sealed interface Type permits IntType, CellStateType, VectorType
{
	/** Width of the signed integer type. */
	int INT_BITS = 32;
	/** Width of a cell state. */
	int CELL_STATE_BITS = 8;
	int MAX_VECTOR_LEN = 256;

	Type INT = new IntType();
	Type CELL_STATE = new CellStateType();

	static VectorType vector(int length)
	{
		return new VectorType(length);
	}

	/**
	 * Returns the number of bits needed to hold a value of this type.
	 */
	int bits();

	/**
	 * Returns the name of this type as it is written in source code.
	 */
	String getName();

	default boolean isInteger()
	{
		return false;
	}

	default boolean isVector()
	{
		return false;
	}

	/**
	 * Whether a value of this type can be returned through the 64-bit return value
	 * without touching the error flag in bit 63.
	 */
	default boolean fitsInReturnValue()
	{
		return bits() < 64;
	}
}
