package org.cellang.type;

public record CellStateType() implements Type
{
	@Override
	public int bits()
	{
		return CELL_STATE_BITS;
	}

	@Override
	public String getName()
	{
		return "cell";
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
