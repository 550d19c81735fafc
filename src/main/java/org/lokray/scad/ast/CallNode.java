package org.lokray.scad.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shared shape of every node built from a module instantiation: the called name, the modifier
 * characters in front of it, the raw argument list and the child statements.
 */
public abstract class CallNode extends AstNode
{
	private final String name;
	private final SourceLocation nameLocation;
	private final String modifier;
	private final List<Parameter> parameters;
	private final List<AstNode> children;

	protected CallNode(NodeKind kind, SourceLocation location, String name, SourceLocation nameLocation, String modifier,
					   List<Parameter> parameters, List<AstNode> children)
	{
		super(kind, location);
		this.name = name;
		this.nameLocation = nameLocation;
		this.modifier = modifier == null ? "" : modifier;
		this.parameters = List.copyOf(parameters);
		this.children = List.copyOf(children);
	}

	public String getName()
	{
		return name;
	}

	public SourceLocation getNameLocation()
	{
		return nameLocation;
	}

	/**
	 * Modifier characters ({@code #}, {@code !}, {@code %}, {@code *}) in source order, empty when none.
	 */
	public String getModifier()
	{
		return modifier;
	}

	public List<Parameter> getParameters()
	{
		return parameters;
	}

	/**
	 * The argument named {@code name}, or else the positional argument at {@code position}.
	 */
	public Optional<Parameter> getParameter(String name, int position)
	{
		int positional = 0;
		Parameter byPosition = null;
		for (Parameter parameter : parameters)
		{
			if (name.equals(parameter.getName()))
			{
				return Optional.of(parameter);
			}
			if (parameter.isPositional())
			{
				if (positional == position)
				{
					byPosition = parameter;
				}
				positional++;
			}
		}
		return Optional.ofNullable(byPosition);
	}

	@Override
	public List<AstNode> getChildren()
	{
		return children;
	}

	@Override
	public List<AstNode> getSubNodes()
	{
		List<AstNode> nodes = new ArrayList<>();
		parameters.forEach(p -> nodes.add(p.getExpression()));
		nodes.addAll(children);
		return nodes;
	}

	@Override
	protected List<Object> structure()
	{
		return values(name, modifier, parameters, children);
	}
}
