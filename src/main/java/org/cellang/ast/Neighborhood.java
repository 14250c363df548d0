package org.cellang.ast;

public enum Neighborhood
{
	MOORE("moore"),
	VON_NEUMANN("vonneumann");

	private final String keyword;

	Neighborhood(String keyword)
	{
		this.keyword = keyword;
	}

	public String getKeyword()
	{
		return keyword;
	}

	/**
	 * Looks up a neighborhood by its directive keyword, or returns null if there is none.
	 */
	public static Neighborhood fromKeyword(String keyword)
	{
		for (Neighborhood n : values())
		{
			if (n.keyword.equalsIgnoreCase(keyword))
			{
				return n;
			}
		}
		return null;
	}
}
