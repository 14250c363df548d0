package org.cellang.syntax;

import java.util.List;

/**
 * Expression node of the syntax tree handed over by the parser.
 */
public sealed interface SyntaxExpr
{
	Span span();

	/** Integer literal. */
	record Int(Span span, long value) implements SyntaxExpr
	{
	}

	/** Bare identifier, i.e. a variable name. */
	record Ident(Span span, String name) implements SyntaxExpr
	{
	}

	/** Parenthesized or bracketed group. */
	record Group(Span span, PunctuationToken startToken, SyntaxExpr inner) implements SyntaxExpr
	{
	}

	/** Comma-separated list. */
	record ListExpr(Span span, List<SyntaxExpr> items) implements SyntaxExpr
	{
		public ListExpr
		{
			items = List.copyOf(items);
		}
	}

	record UnaryOp(Span span, OperatorToken op, SyntaxExpr operand) implements SyntaxExpr
	{
	}

	record BinaryOp(Span span, SyntaxExpr lhs, OperatorToken op, SyntaxExpr rhs) implements SyntaxExpr
	{
	}

	/**
	 * Chain of comparisons such as {@code a < b <= c}: {@code exprs} has exactly one more
	 * element than {@code cmps}.
	 */
	record Cmp(Span span, List<SyntaxExpr> exprs, List<ComparisonToken> cmps) implements SyntaxExpr
	{
		public Cmp
		{
			exprs = List.copyOf(exprs);
			cmps = List.copyOf(cmps);
			if (exprs.size() != cmps.size() + 1)
			{
				throw new IllegalArgumentException("Comparison chain needs exactly one more operand than comparators");
			}
		}
	}
}
