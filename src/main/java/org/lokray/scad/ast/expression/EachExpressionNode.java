package org.lokray.scad.ast.expression;

import org.lokray.scad.ast.AstNode;
import org.lokray.scad.ast.NodeKind;
import org.lokray.scad.ast.SourceLocation;

import java.util.List;

/**
 * {@code each v}: splices the elements of {@code v} into the enclosing vector.
 */
public class EachExpressionNode extends ExpressionNode
{
	private final ExpressionNode value;

	public EachExpressionNode(SourceLocation location, ExpressionNode value)
	{
		super(NodeKind.EACH_EXPRESSION, location);
		this.value = value;
	}

	public ExpressionNode getValue()
	{
		return value;
	}

	@Override
	public List<AstNode> getSubNodes()
	{
		return List.of(value);
	}

	@Override
	protected List<Object> structure()
	{
		return values(value);
	}
}
