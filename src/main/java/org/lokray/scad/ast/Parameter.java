package org.lokray.scad.ast;

import org.lokray.scad.ast.expression.ExpressionNode;
import org.lokray.scad.evaluation.EvaluationResult;

import java.util.Objects;
import java.util.Optional;

/**
 * One argument of a call. {@code name} is null for positional arguments. {@code value} is present when the
 * argument folds to a constant; the expression is always kept.
 */
public class Parameter
{
	private final String name;
	private final EvaluationResult value;
	private final ExpressionNode expression;
	private final SourceLocation location;

	public Parameter(String name, EvaluationResult value, ExpressionNode expression, SourceLocation location)
	{
		this.name = name;
		this.value = value;
		this.expression = expression;
		this.location = location;
	}

	public String getName()
	{
		return name;
	}

	public boolean isPositional()
	{
		return name == null;
	}

	public boolean isSpecialVariable()
	{
		return name != null && name.startsWith("$");
	}

	public Optional<EvaluationResult> getValue()
	{
		return Optional.ofNullable(value);
	}

	public ExpressionNode getExpression()
	{
		return expression;
	}

	public SourceLocation getLocation()
	{
		return location;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof Parameter other))
		{
			return false;
		}
		return Objects.equals(name, other.name) && Objects.equals(value, other.value)
				&& Objects.equals(expression, other.expression) && Objects.equals(location, other.location);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(name, value, expression, location);
	}

	@Override
	public String toString()
	{
		String shown = value != null ? value.toString() : String.valueOf(expression);
		return name == null ? shown : name + "=" + shown;
	}
}
