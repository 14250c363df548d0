package org.cellang.ast;

import org.cellang.codegen.CodeGenerator;
import org.cellang.error.LangError;
import org.cellang.error.LangException;

/**
 * A registered runtime error of a {@link UserFunction}. The index is what generated code
 * places in the low bits of a trapping return value.
 */
public record ErrorPointRef(int index, LangError error)
{
	/**
	 * Emits a return of this error at the generator's current position.
	 */
	public void compile(CodeGenerator generator)
	{
		generator.buildReturnError(index);
	}

	/**
	 * Returns this error as an exception, for constant folding that hits the same condition.
	 */
	public LangException toException()
	{
		return error.toException();
	}

	@Override
	public boolean equals(Object o)
	{
		return o instanceof ErrorPointRef other && index == other.index;
	}

	@Override
	public int hashCode()
	{
		return Integer.hashCode(index);
	}
}
