package org.cellang.type;

/**
 * Fixed-length vector of integers.
 */
public record VectorType(int length) implements Type
{
	public VectorType
	{
		if (length < 1 || length > MAX_VECTOR_LEN)
		{
			throw new IllegalArgumentException("Vector length must be between 1 and " + MAX_VECTOR_LEN + ", got " + length);
		}
	}

	@Override
	public int bits()
	{
		return INT_BITS * length;
	}

	@Override
	public String getName()
	{
		return "vec[" + length + "]";
	}

	@Override
	public boolean isVector()
	{
		return true;
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
