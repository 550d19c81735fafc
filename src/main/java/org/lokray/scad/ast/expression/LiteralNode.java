package org.lokray.scad.ast.expression;

import org.lokray.scad.ast.NodeKind;
import org.lokray.scad.ast.SourceLocation;
import org.lokray.scad.evaluation.EvaluationResult;

import java.util.List;

public class LiteralNode extends ExpressionNode
{
	private final EvaluationResult value;

	public LiteralNode(SourceLocation location, EvaluationResult value)
	{
		super(NodeKind.LITERAL, location);
		this.value = value;
	}

	public static LiteralNode undef(SourceLocation location)
	{
		return new LiteralNode(location, EvaluationResult.undef());
	}

	public EvaluationResult getValue()
	{
		return value;
	}

	@Override
	protected List<Object> structure()
	{
		return values(value);
	}

	@Override
	public String toString()
	{
		return value.isString() ? "\"" + value + "\"" : value.toString();
	}
}
