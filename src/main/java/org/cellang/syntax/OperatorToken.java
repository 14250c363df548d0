package org.cellang.syntax;

/**
 * Unary and binary operators the lexer can produce.
 */
public enum OperatorToken
{
	PLUS("+"),
	MINUS("-"),
	ASTERISK("*"),
	SLASH("/"),
	PERCENT("%"),
	DOUBLE_ASTERISK("**"),
	DOUBLE_LESS_THAN("<<"),
	DOUBLE_GREATER_THAN(">>"),
	TRIPLE_GREATER_THAN(">>>"),
	AMPERSAND("&"),
	PIPE("|"),
	TAG("#"),
	DOT("."),
	DOT_DOT("..");

	private final String symbol;

	OperatorToken(String symbol)
	{
		this.symbol = symbol;
	}

	public String getSymbol()
	{
		return symbol;
	}

	public static OperatorToken fromSymbol(String symbol)
	{
		for (OperatorToken op : values())
		{
			if (op.symbol.equals(symbol))
			{
				return op;
			}
		}
		throw new IllegalArgumentException("Unknown operator: " + symbol);
	}

	@Override
	public String toString()
	{
		return symbol;
	}
}
