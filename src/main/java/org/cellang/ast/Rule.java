package org.cellang.ast;

import org.cellang.error.LangError;
import org.cellang.error.LangErrorKind;
import org.cellang.error.LangException;
import org.cellang.syntax.SyntaxRule;
import org.cellang.util.Debug;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A fully built automaton rule: its metadata, the transition function and the helper
 * functions, all sharing the same {@link RuleMeta}.
 */
public class Rule
{
	private final RuleMeta meta;
	private final UserFunction transitionFunction;
	private final Map<String, UserFunction> helperFunctions;

	private Rule(RuleMeta meta, UserFunction transitionFunction, Map<String, UserFunction> helperFunctions)
	{
		this.meta = meta;
		this.transitionFunction = transitionFunction;
		this.helperFunctions = Collections.unmodifiableMap(helperFunctions);
	}

	/**
	 * Builds the AST of every function of {@code syntaxRule}, stopping at the first error.
	 */
	public static Rule build(SyntaxRule syntaxRule) throws LangException
	{
		RuleMeta meta = buildMeta(syntaxRule);

		UserFunction transition = UserFunction.newTransitionFunction(meta);
		transition.buildBody(syntaxRule.transition());

		Map<String, UserFunction> helpers = new LinkedHashMap<>();
		for (SyntaxRule.HelperFunction helper : syntaxRule.helpers())
		{
			if (helpers.containsKey(helper.name()))
			{
				throw LangException.of(LangErrorKind.INVALID_DIRECTIVE, helper.span(), "duplicate helper function '" + helper.name() + "'");
			}
			UserFunction function = UserFunction.newHelperFunction(meta, helper.returnType());
			try
			{
				function.buildBody(helper.body());
			}
			catch (LangException e)
			{
				if (e.getError().hasSpan())
				{
					throw e;
				}
				throw e.getError().withSpan(helper.span()).toException();
			}
			helpers.put(helper.name(), function);
		}

		Debug.logDebug("AST: Built rule with " + helpers.size() + " helper function(s) (" + meta + ")");
		return new Rule(meta, transition, helpers);
	}

	private static RuleMeta buildMeta(SyntaxRule syntaxRule) throws LangException
	{
		Neighborhood neighborhood = Neighborhood.fromKeyword(syntaxRule.neighborhood());
		if (neighborhood == null)
		{
			throw new LangException(LangError.withoutSpan(LangErrorKind.INVALID_DIRECTIVE,
					"unknown neighborhood '" + syntaxRule.neighborhood() + "'"));
		}
		try
		{
			return new RuleMeta(syntaxRule.ndim(), neighborhood, syntaxRule.stateCount());
		}
		catch (IllegalArgumentException e)
		{
			throw new LangException(LangError.withoutSpan(LangErrorKind.INVALID_DIRECTIVE, e.getMessage()));
		}
	}

	public RuleMeta getMeta()
	{
		return meta;
	}

	public UserFunction getTransitionFunction()
	{
		return transitionFunction;
	}

	public Map<String, UserFunction> getHelperFunctions()
	{
		return helperFunctions;
	}

	public UserFunction getHelperFunction(String name)
	{
		return helperFunctions.get(name);
	}
}
