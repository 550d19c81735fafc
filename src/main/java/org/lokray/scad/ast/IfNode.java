package org.lokray.scad.ast;

import org.lokray.scad.ast.expression.ExpressionNode;

import java.util.ArrayList;
import java.util.List;

public class IfNode extends AstNode
{
	private final ExpressionNode condition;
	private final List<AstNode> thenBranch;
	private final List<AstNode> elseBranch;

	public IfNode(SourceLocation location, ExpressionNode condition, List<AstNode> thenBranch, List<AstNode> elseBranch)
	{
		super(NodeKind.IF, location);
		this.condition = condition;
		this.thenBranch = List.copyOf(thenBranch);
		this.elseBranch = List.copyOf(elseBranch);
	}

	public ExpressionNode getCondition()
	{
		return condition;
	}

	public List<AstNode> getThenBranch()
	{
		return thenBranch;
	}

	/**
	 * Empty when there is no else.
	 */
	public List<AstNode> getElseBranch()
	{
		return elseBranch;
	}

	@Override
	public List<AstNode> getChildren()
	{
		List<AstNode> nodes = new ArrayList<>(thenBranch);
		nodes.addAll(elseBranch);
		return nodes;
	}

	@Override
	public List<AstNode> getSubNodes()
	{
		List<AstNode> nodes = new ArrayList<>();
		nodes.add(condition);
		nodes.addAll(getChildren());
		return nodes;
	}

	@Override
	protected List<Object> structure()
	{
		return values(condition, thenBranch, elseBranch);
	}
}
