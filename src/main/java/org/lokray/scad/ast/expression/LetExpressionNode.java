package org.lokray.scad.ast.expression;

import org.lokray.scad.ast.AstNode;
import org.lokray.scad.ast.Binding;
import org.lokray.scad.ast.NodeKind;
import org.lokray.scad.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

public class LetExpressionNode extends ExpressionNode
{
	private final List<Binding> bindings;
	private final ExpressionNode body;

	public LetExpressionNode(SourceLocation location, List<Binding> bindings, ExpressionNode body)
	{
		super(NodeKind.LET_EXPRESSION, location);
		this.bindings = List.copyOf(bindings);
		this.body = body;
	}

	public List<Binding> getBindings()
	{
		return bindings;
	}

	public ExpressionNode getBody()
	{
		return body;
	}

	@Override
	public List<AstNode> getSubNodes()
	{
		List<AstNode> nodes = new ArrayList<>();
		bindings.forEach(b -> nodes.add(b.getValue()));
		nodes.add(body);
		return nodes;
	}

	@Override
	protected List<Object> structure()
	{
		return values(bindings, body);
	}
}
