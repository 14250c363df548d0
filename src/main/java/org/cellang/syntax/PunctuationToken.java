package org.cellang.syntax;

/**
 * Tokens that open a group expression.
 */
public enum PunctuationToken
{
	LPAREN("("),
	LBRACKET("["),
	LBRACE("{");

	private final String symbol;

	PunctuationToken(String symbol)
	{
		this.symbol = symbol;
	}

	public String getSymbol()
	{
		return symbol;
	}
}
