package org.lokray.scad.ast.expression;

import org.lokray.scad.ast.AstNode;
import org.lokray.scad.ast.NodeKind;
import org.lokray.scad.ast.SourceLocation;

import java.util.List;

public class ConditionalExpressionNode extends ExpressionNode
{
	private final ExpressionNode condition;
	private final ExpressionNode consequence;
	private final ExpressionNode alternative;

	public ConditionalExpressionNode(SourceLocation location, ExpressionNode condition, ExpressionNode consequence,
									 ExpressionNode alternative)
	{
		super(NodeKind.CONDITIONAL_EXPRESSION, location);
		this.condition = condition;
		this.consequence = consequence;
		this.alternative = alternative;
	}

	public ExpressionNode getCondition()
	{
		return condition;
	}

	public ExpressionNode getConsequence()
	{
		return consequence;
	}

	public ExpressionNode getAlternative()
	{
		return alternative;
	}

	@Override
	public List<AstNode> getSubNodes()
	{
		return List.of(condition, consequence, alternative);
	}

	@Override
	protected List<Object> structure()
	{
		return values(condition, consequence, alternative);
	}
}
