package org.cellang.error;

import org.cellang.syntax.Span;

import java.util.Objects;

/**
 * An immutable description of one compiler or runtime error: what went wrong and where.
 * <p>
 * Build-time errors are thrown wrapped in a {@link LangException}; runtime errors are
 * stored in a function's error-point table and only materialize when generated code traps.
 */
public final class LangError
{
	private final LangErrorKind kind;
	private final Span span; // null for errors without a source location
	private final String message;

	private LangError(LangErrorKind kind, Span span, String message)
	{
		this.kind = Objects.requireNonNull(kind);
		this.span = span;
		this.message = message;
	}

	public static LangError of(LangErrorKind kind, Span span, Object... args)
	{
		return new LangError(kind, span, kind.format(args));
	}

	public static LangError withoutSpan(LangErrorKind kind, Object... args)
	{
		return new LangError(kind, null, kind.format(args));
	}

	public static LangError internal(Span span, String detail)
	{
		return of(LangErrorKind.INTERNAL_ERROR, span, detail);
	}

	public LangErrorKind getKind()
	{
		return kind;
	}

	public Span getSpan()
	{
		return span;
	}

	public boolean hasSpan()
	{
		return span != null;
	}

	public String getMessage()
	{
		return message;
	}

	/**
	 * Returns a copy of this error located at {@code newSpan}.
	 */
	public LangError withSpan(Span newSpan)
	{
		return new LangError(kind, newSpan, message);
	}

	public LangException toException()
	{
		return new LangException(this);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof LangError other))
		{
			return false;
		}
		return kind == other.kind && Objects.equals(span, other.span) && message.equals(other.message);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(kind, span, message);
	}

	@Override
	public String toString()
	{
		return span == null ? message : message + " @ " + span;
	}
}
