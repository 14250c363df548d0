package org.cellang.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps character offsets of a source text to 1-based line and column numbers and back.
 */
public class LineIndex
{
	private final List<Integer> lineStarts = new ArrayList<>();
	private final int length;

	public LineIndex(String source)
	{
		this.length = source.length();
		lineStarts.add(0);
		for (int i = 0; i < source.length(); i++)
		{
			if (source.charAt(i) == '\n')
			{
				lineStarts.add(i + 1);
			}
		}
	}

	public int lineCount()
	{
		return lineStarts.size();
	}

	/**
	 * Returns the 1-based line containing {@code offset}.
	 */
	public int lineOf(int offset)
	{
		checkOffset(offset);
		int lo = 0;
		int hi = lineStarts.size() - 1;
		while (lo < hi)
		{
			int mid = (lo + hi + 1) >>> 1;
			if (lineStarts.get(mid) <= offset)
			{
				lo = mid;
			}
			else
			{
				hi = mid - 1;
			}
		}
		return lo + 1;
	}

	/**
	 * Returns the 1-based column of {@code offset} within its line.
	 */
	public int columnOf(int offset)
	{
		return offset - lineStarts.get(lineOf(offset) - 1) + 1;
	}

	/**
	 * Returns the offset of a 1-based line and a 0-based position in that line, as ANTLR
	 * reports them. Positions past the end are clamped to the end of the text.
	 */
	public int offsetOf(int line, int charPositionInLine)
	{
		if (line < 1 || line > lineStarts.size())
		{
			return length;
		}
		return Math.min(lineStarts.get(line - 1) + Math.max(charPositionInLine, 0), length);
	}

	private void checkOffset(int offset)
	{
		if (offset < 0 || offset > length)
		{
			throw new IndexOutOfBoundsException("Offset " + offset + " outside of source of length " + length);
		}
	}
}
