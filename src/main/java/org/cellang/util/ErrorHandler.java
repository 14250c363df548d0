package org.cellang.util;

import org.cellang.error.LangError;

/**
 * Formats errors against the source they came from and remembers whether any were reported.
 */
public class ErrorHandler
{
	private final LineIndex lineIndex;
	private boolean hasErrors = false;

	public ErrorHandler(LineIndex lineIndex)
	{
		this.lineIndex = lineIndex;
	}

	/**
	 * Logs {@code error} as {@code [<phase> Error] line L:C - message}.
	 */
	public void logError(String phase, LangError error)
	{
		Debug.logError(format(phase, error));
		hasErrors = true;
	}

	public String format(String phase, LangError error)
	{
		if (!error.hasSpan())
		{
			return String.format("[%s Error] %s", phase, error.getMessage());
		}
		int offset = error.getSpan().start();
		return String.format("[%s Error] line %d:%d - %s",
				phase, lineIndex.lineOf(offset), lineIndex.columnOf(offset), error.getMessage());
	}

	public boolean hasErrors()
	{
		return hasErrors;
	}
}
