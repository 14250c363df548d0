package org.cellang.codegen;

/**
 * The two halves of a generated function's return value.
 *
 * @param isError whether bit 63 was set
 * @param payload the remaining 63 bits: an error-point index or the packed result
 */
public record DecodedReturn(boolean isError, long payload)
{
	public int errorIndex()
	{
		if (!isError)
		{
			throw new IllegalStateException("Return value does not encode an error");
		}
		return Math.toIntExact(payload);
	}
}
