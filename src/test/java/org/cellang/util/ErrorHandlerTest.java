package org.cellang.util;

import org.cellang.error.LangError;
import org.cellang.error.LangErrorKind;
import org.cellang.syntax.Span;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ErrorHandlerTest
{
	@Test
	void format_shouldPrefixPhaseAndPosition()
	{
		ErrorHandler handler = new ErrorHandler(new LineIndex("x = 1\nbecome y\n"));
		LangError error = LangError.of(LangErrorKind.USE_OF_UNINITIALIZED_VARIABLE, new Span(13, 14));

		assertThat(handler.format("Semantic", error)).isEqualTo("[Semantic Error] line 2:8 - Use of uninitialized variable");
	}

	@Test
	void format_shouldOmitPositionWithoutSpan()
	{
		ErrorHandler handler = new ErrorHandler(new LineIndex(""));
		LangError error = LangError.withoutSpan(LangErrorKind.INVALID_DIRECTIVE, "missing @transition");

		assertThat(handler.format("Semantic", error)).isEqualTo("[Semantic Error] Invalid directive: missing @transition");
	}

	@Test
	void logError_shouldRememberErrors()
	{
		ErrorHandler handler = new ErrorHandler(new LineIndex("become"));
		assertThat(handler.hasErrors()).isFalse();

		handler.logError("Syntax", LangError.of(LangErrorKind.SYNTAX_ERROR, new Span(0, 6), "missing expression"));

		assertThat(handler.hasErrors()).isTrue();
	}
}
