package org.lokray.scad.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code let (a = 1) ...} as a statement.
 */
public class LetNode extends AstNode
{
	private final List<Binding> bindings;
	private final List<AstNode> body;

	public LetNode(SourceLocation location, List<Binding> bindings, List<AstNode> body)
	{
		super(NodeKind.LET, location);
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
