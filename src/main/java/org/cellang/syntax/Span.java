package org.cellang.syntax;

/**
 * A half-open range of character offsets {@code [start, end)} into the source text.
 */
public record Span(int start, int end)
{
	public Span
	{
		if (start < 0 || end < start)
		{
			throw new IllegalArgumentException("Invalid span: " + start + ".." + end);
		}
	}

	/**
	 * Returns the smallest span that covers both this span and {@code other}.
	 */
	public Span merge(Span other)
	{
		return new Span(Math.min(start, other.start), Math.max(end, other.end));
	}

	public int length()
	{
		return end - start;
	}

	@Override
	public String toString()
	{
		return start + ".." + end;
	}
}
