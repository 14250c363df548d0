package org.cellang.ast;

import org.cellang.type.Type;

/**
 * Metadata of an automaton rule, shared read-only by every function of that rule.
 */
public record RuleMeta(int ndim, Neighborhood neighborhood, int stateCount)
{
	public static final int DEFAULT_NDIM = 2;
	public static final int MAX_NDIM = 6;
	public static final int DEFAULT_STATE_COUNT = 2;
	public static final int MAX_STATE_COUNT = 1 << Type.CELL_STATE_BITS;

	public RuleMeta
	{
		if (ndim < 1 || ndim > MAX_NDIM)
		{
			throw new IllegalArgumentException("Number of dimensions must be between 1 and " + MAX_NDIM + ", got " + ndim);
		}
		if (stateCount < 1 || stateCount > MAX_STATE_COUNT)
		{
			throw new IllegalArgumentException("State count must be between 1 and " + MAX_STATE_COUNT + ", got " + stateCount);
		}
		if (neighborhood == null)
		{
			throw new IllegalArgumentException("Neighborhood must not be null");
		}
	}

	public static RuleMeta defaults()
	{
		return new RuleMeta(DEFAULT_NDIM, Neighborhood.MOORE, DEFAULT_STATE_COUNT);
	}
}
