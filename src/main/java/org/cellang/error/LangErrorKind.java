package org.cellang.error;

/**
 * Every kind of error the compiler can report, at build time or from generated code.
 */
public enum LangErrorKind
{
	// Build-time errors
	SYNTAX_ERROR("Syntax error: %s", false),
	INVALID_DIRECTIVE("Invalid directive: %s", false),
	EXPECTED("Expected %s", false),
	EXPECTED_GOT("Expected %s, got %s", false),
	USE_OF_UNINITIALIZED_VARIABLE("Use of uninitialized variable", false),
	BECOME_IN_HELPER_FUNCTION("'become' is only allowed in the transition function; use 'return' instead", false),
	RETURN_IN_TRANSITION_FUNCTION("'return' is not allowed in the transition function; use 'become' instead", false),
	TYPE_ERROR("Type error: expected %s, got %s", false),
	INVALID_COMPARISON("Cannot compare %s and %s using '%s'", false),
	RETURN_TYPE_TOO_WIDE("Return type %s does not fit in a 63-bit return value", false),
	UNIMPLEMENTED("%s is not implemented", false),
	CANNOT_EVAL_AS_CONST("Cannot evaluate expression as a constant", false),
	INTERNAL_ERROR("Internal compiler error: %s", false),

	// Runtime errors, registered as error points and trapped by generated code
	INTEGER_OVERFLOW("Integer overflow", true),
	DIVIDE_BY_ZERO("Divide by zero", true),
	CELL_STATE_OUT_OF_RANGE("Cell state out of range", true),
	BITSHIFT_OUT_OF_RANGE("Bitshift amount out of range", true),
	NEGATIVE_EXPONENT("Negative exponent", true);

	private final String template;
	private final boolean runtime;

	LangErrorKind(String template, boolean runtime)
	{
		this.template = template;
		this.runtime = runtime;
	}

	public String format(Object... args)
	{
		return args.length == 0 ? template : String.format(template, args);
	}

	/**
	 * Whether this kind of error can only be detected while the generated code runs.
	 */
	public boolean isRuntime()
	{
		return runtime;
	}
}
