package org.lokray.scad.query;

/**
 * A query string that does not compile.
 */
public class QueryException extends RuntimeException
{
	private final int offset;

	public QueryException(String message, int offset)
	{
		super(message + " at offset " + offset);
		this.offset = offset;
	}

	public int getOffset()
	{
		return offset;
	}
}
