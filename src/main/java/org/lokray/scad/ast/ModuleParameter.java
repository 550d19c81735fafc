package org.lokray.scad.ast;

import org.lokray.scad.ast.expression.ExpressionNode;
import org.lokray.scad.evaluation.EvaluationResult;

import java.util.Objects;
import java.util.Optional;

/**
 * A declared parameter of a module or function, with its default if any.
 */
public class ModuleParameter
{
	private final String name;
	private final SourceLocation location;
	private final EvaluationResult defaultValue;
	private final ExpressionNode defaultExpression;

	public ModuleParameter(String name, SourceLocation location, EvaluationResult defaultValue, ExpressionNode defaultExpression)
	{
		this.name = name;
		this.location = location;
		this.defaultValue = defaultValue;
		this.defaultExpression = defaultExpression;
	}

	public String getName()
	{
		return name;
	}

	public SourceLocation getLocation()
	{
		return location;
	}

	public Optional<EvaluationResult> getDefaultValue()
	{
		return Optional.ofNullable(defaultValue);
	}

	public Optional<ExpressionNode> getDefaultExpression()
	{
		return Optional.ofNullable(defaultExpression);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof ModuleParameter other))
		{
			return false;
		}
		return name.equals(other.name) && Objects.equals(location, other.location)
				&& Objects.equals(defaultValue, other.defaultValue) && Objects.equals(defaultExpression, other.defaultExpression);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(name, location, defaultValue, defaultExpression);
	}

	@Override
	public String toString()
	{
		return defaultExpression == null ? name : name + " = " + defaultExpression;
	}
}
