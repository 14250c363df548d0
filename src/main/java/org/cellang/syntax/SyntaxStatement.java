package org.cellang.syntax;

import java.util.List;

/**
 * Statement node of the syntax tree handed over by the parser.
 */
public sealed interface SyntaxStatement
{
	Span span();

	record SetVar(Span span, SyntaxExpr varExpr, AssignOp assignOp, SyntaxExpr valueExpr) implements SyntaxStatement
	{
	}

	record If(Span span, SyntaxExpr condExpr, List<SyntaxStatement> ifTrue, List<SyntaxStatement> ifFalse) implements SyntaxStatement
	{
		public If
		{
			ifTrue = List.copyOf(ifTrue);
			ifFalse = List.copyOf(ifFalse);
		}
	}

	record Become(Span span, SyntaxExpr retExpr) implements SyntaxStatement
	{
	}

	record Return(Span span, SyntaxExpr retExpr) implements SyntaxStatement
	{
	}
}
