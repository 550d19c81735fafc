package org.lokray.scad.semantic.rename;

import org.lokray.scad.ast.SourceLocation;

import java.util.Objects;

public class TextEdit
{
	private final SourceLocation range;
	private final String newText;

	public TextEdit(SourceLocation range, String newText)
	{
		this.range = range;
		this.newText = newText;
	}

	public SourceLocation getRange()
	{
		return range;
	}

	public String getNewText()
	{
		return newText;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof TextEdit other))
		{
			return false;
		}
		return range.equals(other.range) && newText.equals(other.newText);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(range, newText);
	}

	@Override
	public String toString()
	{
		return range + " -> " + newText;
	}
}
