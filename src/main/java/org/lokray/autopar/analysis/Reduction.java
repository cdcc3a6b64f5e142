package org.lokray.autopar.analysis;

/**
 * A variable combined across iterations, e.g. ("sum", "+").
 */
public record Reduction(String variable, String operator)
{
	/**
	 * @return the clause form, e.g. {@code reduction(+:sum)}
	 */
	public String clause()
	{
		return "reduction(" + operator + ":" + variable + ")";
	}

	@Override
	public String toString()
	{
		return "(" + variable + ", " + operator + ")";
	}
}
