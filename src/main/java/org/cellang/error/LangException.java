package org.cellang.error;

import org.cellang.syntax.Span;

/**
 * Checked exception carrying a {@link LangError}. Building and code generation stop at the
 * first one thrown.
 */
public class LangException extends Exception
{
	private final LangError error;

	public LangException(LangError error)
	{
		super(error.getMessage());
		this.error = error;
	}

	public static LangException of(LangErrorKind kind, Span span, Object... args)
	{
		return new LangException(LangError.of(kind, span, args));
	}

	public LangError getError()
	{
		return error;
	}

	public LangErrorKind getKind()
	{
		return error.getKind();
	}

	public Span getSpan()
	{
		return error.getSpan();
	}
}
