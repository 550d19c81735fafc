package org.lokray.scad.ast;

import java.util.Objects;

/**
 * A point in the session text: zero-based line and column plus the character offset.
 */
public class Position
{
	private final int line;
	private final int column;
	private final int offset;

	public Position(int line, int column, int offset)
	{
		this.line = line;
		this.column = column;
		this.offset = offset;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public int getOffset()
	{
		return offset;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof Position other))
		{
			return false;
		}
		return line == other.line && column == other.column && offset == other.offset;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(line, column, offset);
	}

	@Override
	public String toString()
	{
		return (line + 1) + ":" + (column + 1);
	}
}
