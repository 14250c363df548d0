package org.cellang.util;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.cellang.error.LangError;
import org.cellang.error.LangErrorKind;
import org.cellang.syntax.Span;

/**
 * A custom error listener for the ANTLR lexer and parser. Keeps the first syntax error so
 * that the caller can abort with it, and routes every error through the Debug log.
 */
public class SyntaxErrorListener extends BaseErrorListener
{
	private final LineIndex lineIndex;
	private LangError firstError = null;
	private int errorCount = 0;

	public SyntaxErrorListener(LineIndex lineIndex)
	{
		this.lineIndex = lineIndex;
	}

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e)
	{
		Debug.logDebug(String.format("[Syntax Error] line %d:%d - %s", line, charPositionInLine + 1, msg));
		errorCount++;
		if (firstError == null)
		{
			firstError = LangError.of(LangErrorKind.SYNTAX_ERROR, spanOf(offendingSymbol, line, charPositionInLine), msg);
		}
	}

	private Span spanOf(Object offendingSymbol, int line, int charPositionInLine)
	{
		if (offendingSymbol instanceof Token token && token.getStartIndex() >= 0 && token.getStopIndex() >= token.getStartIndex())
		{
			return new Span(token.getStartIndex(), token.getStopIndex() + 1);
		}
		int offset = lineIndex.offsetOf(line, charPositionInLine);
		return new Span(offset, offset);
	}

	public boolean hasErrors()
	{
		return firstError != null;
	}

	public LangError getFirstError()
	{
		return firstError;
	}

	public int getErrorCount()
	{
		return errorCount;
	}
}
