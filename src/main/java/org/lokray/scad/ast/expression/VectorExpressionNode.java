package org.lokray.scad.ast.expression;

import org.lokray.scad.ast.AstNode;
import org.lokray.scad.ast.NodeKind;
import org.lokray.scad.ast.SourceLocation;

import java.util.List;

/**
 * {@code [a, b, c]}. Elements may be comprehensions, which expand in place.
 */
public class VectorExpressionNode extends ExpressionNode
{
	private final List<ExpressionNode> elements;

	public VectorExpressionNode(SourceLocation location, List<ExpressionNode> elements)
	{
		super(NodeKind.VECTOR_EXPRESSION, location);
		this.elements = List.copyOf(elements);
	}

	public List<ExpressionNode> getElements()
	{
		return elements;
	}

	@Override
	public List<AstNode> getSubNodes()
	{
		return List.copyOf(elements);
	}

	@Override
	protected List<Object> structure()
	{
		return values(elements);
	}
}
