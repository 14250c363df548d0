package org.cellang.type;

import java.util.Collections;
import java.util.List;

/**
 * A value known at compile time.
 */
public sealed interface ConstValue
{
	Type getType();

	static ConstValue defaultFor(Type type)
	{
		if (type instanceof VectorType vec)
		{
			return new Vector(Collections.nCopies(vec.length(), 0));
		}
		if (type instanceof CellStateType)
		{
			return new CellState(0);
		}
		return new Int(0);
	}

	record Int(int value) implements ConstValue
	{
		@Override
		public Type getType()
		{
			return Type.INT;
		}

		@Override
		public String toString()
		{
			return Integer.toString(value);
		}
	}

	/**
	 * A cell state, stored unsigned in the low {@link Type#CELL_STATE_BITS} bits.
	 */
	record CellState(int state) implements ConstValue
	{
		public CellState
		{
			if (state < 0 || state >= 1 << Type.CELL_STATE_BITS)
			{
				throw new IllegalArgumentException("Cell state out of range: " + state);
			}
		}

		@Override
		public Type getType()
		{
			return Type.CELL_STATE;
		}

		@Override
		public String toString()
		{
			return "#" + state;
		}
	}

	record Vector(List<Integer> values) implements ConstValue
	{
		public Vector
		{
			values = List.copyOf(values);
		}

		@Override
		public Type getType()
		{
			return Type.vector(values.size());
		}

		@Override
		public String toString()
		{
			return values.toString();
		}
	}
}
