package org.lokray.scad.ast.expression;

import org.lokray.scad.ast.AstNode;
import org.lokray.scad.ast.NodeKind;
import org.lokray.scad.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class RangeExpressionNode extends ExpressionNode
{
	private final ExpressionNode start;
	private final ExpressionNode step;
	private final ExpressionNode end;

	public RangeExpressionNode(SourceLocation location, ExpressionNode start, ExpressionNode step, ExpressionNode end)
	{
		super(NodeKind.RANGE_EXPRESSION, location);
		this.start = start;
		this.step = step;
		this.end = end;
	}

	public ExpressionNode getStart()
	{
		return start;
	}

	/**
	 * Empty for {@code [start:end]}.
	 */
	public Optional<ExpressionNode> getStep()
	{
		return Optional.ofNullable(step);
	}

	public ExpressionNode getEnd()
	{
		return end;
	}

	@Override
	public List<AstNode> getSubNodes()
	{
		List<AstNode> nodes = new ArrayList<>();
		nodes.add(start);
		if (step != null)
		{
			nodes.add(step);
		}
		nodes.add(end);
		return nodes;
	}

	@Override
	protected List<Object> structure()
	{
		return values(start, step, end);
	}
}
