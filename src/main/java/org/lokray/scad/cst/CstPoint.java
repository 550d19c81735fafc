package org.lokray.scad.cst;

import java.util.Objects;

/**
 * A zero-based row/column pair inside the parsed text.
 */
public class CstPoint
{
	private final int row;
	private final int column;

	public CstPoint(int row, int column)
	{
		this.row = row;
		this.column = column;
	}

	public int getRow()
	{
		return row;
	}

	public int getColumn()
	{
		return column;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof CstPoint other))
		{
			return false;
		}
		return row == other.row && column == other.column;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(row, column);
	}

	@Override
	public String toString()
	{
		return row + ":" + column;
	}
}
