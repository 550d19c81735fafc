package org.lokray.scad.ast;

import java.util.ArrayList;
import java.util.List;

public class ModuleDefinitionNode extends AstNode
{
	private final String name;
	private final SourceLocation nameLocation;
	private final List<ModuleParameter> parameters;
	private final List<AstNode> body;

	public ModuleDefinitionNode(SourceLocation location, String name, SourceLocation nameLocation,
								List<ModuleParameter> parameters, List<AstNode> body)
	{
		super(NodeKind.MODULE_DEFINITION, location);
		this.name = name;
		this.nameLocation = nameLocation;
		this.parameters = List.copyOf(parameters);
		this.body = List.copyOf(body);
	}

	public String getName()
	{
		return name;
	}

	public SourceLocation getNameLocation()
	{
		return nameLocation;
	}

	public List<ModuleParameter> getParameters()
	{
		return parameters;
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
		parameters.forEach(p -> p.getDefaultExpression().ifPresent(nodes::add));
		nodes.addAll(body);
		return nodes;
	}

	@Override
	protected List<Object> structure()
	{
		return values(name, nameLocation, parameters, body);
	}
}
