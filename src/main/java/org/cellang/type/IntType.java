package org.cellang.type;

public record IntType() implements Type
{
	@Override
	public int bits()
	{
		return INT_BITS;
	}

	@Override
	public String getName()
	{
		return "int";
	}

	@Override
	public boolean isInteger()
	{
		return true;
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
