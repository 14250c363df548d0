package org.cellang.syntax;

import java.util.Optional;

/**
 * Plain assignment ({@code =}) or a compound assignment such as {@code +=}.
 */
public enum AssignOp
{
	ASSIGN("=", null),
	ADD("+=", OperatorToken.PLUS),
	SUBTRACT("-=", OperatorToken.MINUS),
	MULTIPLY("*=", OperatorToken.ASTERISK),
	DIVIDE("/=", OperatorToken.SLASH),
	MODULO("%=", OperatorToken.PERCENT),
	POWER("**=", OperatorToken.DOUBLE_ASTERISK),
	SHIFT_LEFT("<<=", OperatorToken.DOUBLE_LESS_THAN),
	SHIFT_RIGHT(">>=", OperatorToken.DOUBLE_GREATER_THAN),
	SHIFT_RIGHT_UNSIGNED(">>>=", OperatorToken.TRIPLE_GREATER_THAN),
	BITWISE_AND("&=", OperatorToken.AMPERSAND),
	BITWISE_OR("|=", OperatorToken.PIPE);

	private final String symbol;
	private final OperatorToken op;

	AssignOp(String symbol, OperatorToken op)
	{
		this.symbol = symbol;
		this.op = op;
	}

	/**
	 * Returns the binary operator a compound assignment applies, or empty for plain {@code =}.
	 */
	public Optional<OperatorToken> op()
	{
		return Optional.ofNullable(op);
	}

	public String getSymbol()
	{
		return symbol;
	}

	public static AssignOp fromSymbol(String symbol)
	{
		for (AssignOp assignOp : values())
		{
			if (assignOp.symbol.equals(symbol))
			{
				return assignOp;
			}
		}
		throw new IllegalArgumentException("Unknown assignment operator: " + symbol);
	}
}
