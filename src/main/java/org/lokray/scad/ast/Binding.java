package org.lokray.scad.ast;

import org.lokray.scad.ast.expression.ExpressionNode;

import java.util.Objects;

/**
 * {@code name = value} as it appears in for headers and let clauses.
 */
public class Binding
{
	private final String name;
	private final SourceLocation nameLocation;
	private final ExpressionNode value;

	public Binding(String name, SourceLocation nameLocation, ExpressionNode value)
	{
		this.name = name;
		this.nameLocation = nameLocation;
		this.value = value;
	}

	public String getName()
	{
		return name;
	}

	public SourceLocation getNameLocation()
	{
		return nameLocation;
	}

	public ExpressionNode getValue()
	{
		return value;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof Binding other))
		{
			return false;
		}
		return name.equals(other.name) && Objects.equals(nameLocation, other.nameLocation) && Objects.equals(value, other.value);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(name, nameLocation, value);
	}

	@Override
	public String toString()
	{
		return name + " = " + value;
	}
}
