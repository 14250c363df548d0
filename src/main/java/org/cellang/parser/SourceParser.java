package org.cellang.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.cellang.error.LangException;
import org.cellang.syntax.SyntaxRule;
import org.cellang.util.Debug;
import org.cellang.util.LineIndex;
import org.cellang.util.SyntaxErrorListener;

/**
 * Entry point of the front end: source text in, syntax tree out.
 */
public final class SourceParser
{
	private SourceParser()
	{
	}

	/**
	 * Lexes and parses a whole rule file. The first syntax error aborts with a
	 * {@code SYNTAX_ERROR}; directive problems abort with {@code INVALID_DIRECTIVE}.
	 */
	public static SyntaxRule parse(String source) throws LangException
	{
		SyntaxErrorListener errorListener = new SyntaxErrorListener(new LineIndex(source));

		CellangLexer lexer = new CellangLexer(CharStreams.fromString(source));
		lexer.removeErrorListeners();
		lexer.addErrorListener(errorListener);

		CommonTokenStream tokens = new CommonTokenStream(lexer);
		CellangParser parser = new CellangParser(tokens);

		// Remove default error listeners to use our own
		parser.removeErrorListeners();
		parser.addErrorListener(errorListener);

		CellangParser.ProgramContext program = parser.program();
		if (errorListener.hasErrors())
		{
			Debug.logDebug("Parsing failed with " + errorListener.getErrorCount() + " syntax error(s)");
			throw errorListener.getFirstError().toException();
		}

		SyntaxRule rule = new SyntaxTreeBuilder().buildRule(program);
		Debug.logDebug("Parsed rule: " + rule.helpers().size() + " helper function(s), "
				+ rule.transition().size() + " top-level transition statement(s)");
		return rule;
	}
}
