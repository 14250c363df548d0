package org.cellang.syntax;

public enum ComparisonToken
{
	EQ("=="),
	NE("!="),
	LT("<"),
	GT(">"),
	LE("<="),
	GE(">=");

	private final String symbol;

	ComparisonToken(String symbol)
	{
		this.symbol = symbol;
	}

	public String getSymbol()
	{
		return symbol;
	}

	/**
	 * Whether this comparator is defined for unordered values such as cell states.
	 */
	public boolean isEquality()
	{
		return this == EQ || this == NE;
	}

	public boolean evaluate(long lhs, long rhs)
	{
		return switch (this)
		{
			case EQ -> lhs == rhs;
			case NE -> lhs != rhs;
			case LT -> lhs < rhs;
			case GT -> lhs > rhs;
			case LE -> lhs <= rhs;
			case GE -> lhs >= rhs;
		};
	}

	public static ComparisonToken fromSymbol(String symbol)
	{
		for (ComparisonToken cmp : values())
		{
			if (cmp.symbol.equals(symbol))
			{
				return cmp;
			}
		}
		throw new IllegalArgumentException("Unknown comparison operator: " + symbol);
	}

	@Override
	public String toString()
	{
		return symbol;
	}
}
