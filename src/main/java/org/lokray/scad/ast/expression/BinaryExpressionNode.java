package org.lokray.scad.ast.expression;

import org.lokray.scad.ast.AstNode;
import org.lokray.scad.ast.NodeKind;
import org.lokray.scad.ast.SourceLocation;

import java.util.List;

public class BinaryExpressionNode extends ExpressionNode
{
	private final String operator;
	private final ExpressionNode left;
	private final ExpressionNode right;

	public BinaryExpressionNode(SourceLocation location, String operator, ExpressionNode left, ExpressionNode right)
	{
		super(NodeKind.BINARY_EXPRESSION, location);
		this.operator = operator;
		this.left = left;
		this.right = right;
	}

	public String getOperator()
	{
		return operator;
	}

	public ExpressionNode getLeft()
	{
		return left;
	}

	public ExpressionNode getRight()
	{
		return right;
	}

	@Override
	public List<AstNode> getSubNodes()
	{
		return List.of(left, right);
	}

	@Override
	protected List<Object> structure()
	{
		return values(operator, left, right);
	}

	@Override
	public String toString()
	{
		return "(" + left + " " + operator + " " + right + ")";
	}
}
