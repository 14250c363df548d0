package org.cellang.syntax;

import org.cellang.type.Type;

import java.util.List;

/**
 * A whole parsed rule file: its directives, the transition function body and every
 * helper function.
 */
public record SyntaxRule(
		int ndim,
		String neighborhood,
		int stateCount,
		List<SyntaxStatement> transition,
		List<HelperFunction> helpers
)
{
	public SyntaxRule
	{
		transition = List.copyOf(transition);
		helpers = List.copyOf(helpers);
	}

	public record HelperFunction(Span span, String name, Type returnType, List<SyntaxStatement> body)
	{
		public HelperFunction
		{
			body = List.copyOf(body);
		}
	}
}
