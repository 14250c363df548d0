package org.cellang.ast;

/**
 * Index of a statement node in the arena of the {@link UserFunction} that created it.
 */
public record StatementRef(int index)
{
	@Override
	public String toString()
	{
		return "stmt#" + index;
	}
}
