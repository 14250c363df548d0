package org.cellang.codegen;

import org.cellang.ast.UserFunction;
import org.cellang.error.LangError;
import org.cellang.type.ConstValue;

/**
 * What a call into generated code produced: either a value of the function's return
 * type or the runtime error it trapped on.
 */
public record ExecutionResult(ConstValue value, int errorIndex, LangError error)
{
	public static ExecutionResult decode(long raw, UserFunction userFunction)
	{
		DecodedReturn decoded = ReturnEncoding.decode(raw);
		if (decoded.isError())
		{
			int index = decoded.errorIndex();
			return new ExecutionResult(null, index, userFunction.getErrorPoint(index).error());
		}
		return new ExecutionResult(ReturnEncoding.decodeValue(decoded.payload(), userFunction.getReturnType()), -1, null);
	}

	public boolean isError()
	{
		return error != null;
	}

	@Override
	public String toString()
	{
		return isError() ? "error #" + errorIndex + ": " + error : String.valueOf(value);
	}
}
