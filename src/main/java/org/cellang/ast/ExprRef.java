package org.cellang.ast;

/**
 * Index of an expression node in the arena of the {@link UserFunction} that created it.
 */
public record ExprRef(int index)
{
	@Override
	public String toString()
	{
		return "expr#" + index;
	}
}
