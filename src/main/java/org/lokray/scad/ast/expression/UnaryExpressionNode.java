package org.lokray.scad.ast.expression;

import org.lokray.scad.ast.AstNode;
import org.lokray.scad.ast.NodeKind;
import org.lokray.scad.ast.SourceLocation;

import java.util.List;

public class UnaryExpressionNode extends ExpressionNode
{
	private final String operator;
	private final ExpressionNode operand;

	public UnaryExpressionNode(SourceLocation location, String operator, ExpressionNode operand)
	{
		super(NodeKind.UNARY_EXPRESSION, location);
		this.operator = operator;
		this.operand = operand;
	}

	public String getOperator()
	{
		return operator;
	}

	public ExpressionNode getOperand()
	{
		return operand;
	}

	@Override
	public List<AstNode> getSubNodes()
	{
		return List.of(operand);
	}

	@Override
	protected List<Object> structure()
	{
		return values(operator, operand);
	}

	@Override
	public String toString()
	{
		return operator + operand;
	}
}
