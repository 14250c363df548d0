package org.cellang.codegen;

import org.cellang.ast.Rule;
import org.cellang.ast.UserFunction;
import org.cellang.error.LangException;
import org.cellang.util.Debug;

import java.util.Map;

/**
 * Generates one LLVM module holding every function of a {@link Rule}.
 */
public final class RuleCompiler
{
	public static final String TRANSITION_FUNCTION_NAME = "transition";
	private static final String HELPER_FUNCTION_PREFIX = "helper_";

	private RuleCompiler()
	{
	}

	public static String helperFunctionName(String name)
	{
		return HELPER_FUNCTION_PREFIX + name;
	}

	/**
	 * Returns a generator whose module contains {@code transition} and one
	 * {@code helper_<name>} per helper function. The caller owns (and closes) the generator.
	 */
	public static CodeGenerator generate(Rule rule, String moduleName) throws LangException
	{
		CodeGenerator generator = new CodeGenerator(moduleName);
		try
		{
			generator.compileFunction(TRANSITION_FUNCTION_NAME, rule.getTransitionFunction());
			for (Map.Entry<String, UserFunction> helper : rule.getHelperFunctions().entrySet())
			{
				generator.compileFunction(helperFunctionName(helper.getKey()), helper.getValue());
			}
			generator.verifyModule();
		}
		catch (LangException | RuntimeException e)
		{
			generator.close();
			throw e;
		}
		Debug.logDebug("IR: Generated module '" + moduleName + "' with " + (1 + rule.getHelperFunctions().size()) + " function(s).");
		return generator;
	}
}
