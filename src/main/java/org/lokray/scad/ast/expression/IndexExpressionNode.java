package org.lokray.scad.ast.expression;

import org.lokray.scad.ast.AstNode;
import org.lokray.scad.ast.NodeKind;
import org.lokray.scad.ast.SourceLocation;

import java.util.List;

public class IndexExpressionNode extends ExpressionNode
{
	private final ExpressionNode array;
	private final ExpressionNode index;

	public IndexExpressionNode(SourceLocation location, ExpressionNode array, ExpressionNode index)
	{
		super(NodeKind.INDEX_EXPRESSION, location);
		this.array = array;
		this.index = index;
	}

	public ExpressionNode getArray()
	{
		return array;
	}

	public ExpressionNode getIndex()
	{
		return index;
	}

	@Override
	public List<AstNode> getSubNodes()
	{
		return List.of(array, index);
	}

	@Override
	protected List<Object> structure()
	{
		return values(array, index);
	}
}
