package org.lokray.scad.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code for (i = [0:3]) ...}. Several bindings iterate as nested loops.
 */
public class ForLoopNode extends AstNode
{
	private final List<Binding> bindings;
	private final List<AstNode> body;

	public ForLoopNode(SourceLocation location, List<Binding> bindings, List<AstNode> body)
	{
		super(NodeKind.FOR_LOOP, location);
		this.bindings = List.copyOf(bindings);
		this.body = List.copyOf(body);
	}

	public List<Binding> getBindings()
	{
		return bindings;
	}

	public List<AstNode> getBody()
	{
		return body;
	}

	@Override
	public List<AstNode> getChildren()
	{
		return body;
	}

	@Override
	public List<AstNode> getSubNodes()
	{
		List<AstNode> nodes = new ArrayList<>();
		bindings.forEach(b -> nodes.add(b.getValue()));
		nodes.addAll(body);
		return nodes;
	}

	@Override
	protected List<Object> structure()
	{
		return values(bindings, body);
	}
}
