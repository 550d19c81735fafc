package org.lokray.scad.ast;

import java.util.Objects;

public class SourceLocation
{
	private final Position start;
	private final Position end;

	public SourceLocation(Position start, Position end)
	{
		this.start = start;
		this.end = end;
	}

	public Position getStart()
	{
		return start;
	}

	public Position getEnd()
	{
		return end;
	}

	public int length()
	{
		return end.getOffset() - start.getOffset();
	}

	/**
	 * Inclusive of the end offset, so a cursor placed right after an identifier still hits it.
	 */
	public boolean contains(int offset)
	{
		return start.getOffset() <= offset && offset <= end.getOffset();
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof SourceLocation other))
		{
			return false;
		}
		return start.equals(other.start) && end.equals(other.end);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(start, end);
	}

	@Override
	public String toString()
	{
		return start + "-" + end;
	}
}
