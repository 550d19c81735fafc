package org.lokray.scad.ast;

import org.lokray.scad.ast.expression.ExpressionNode;

import java.util.ArrayList;
import java.util.List;

public class FunctionDefinitionNode extends AstNode
{
	private final String name;
	private final SourceLocation nameLocation;
	private final List<ModuleParameter> parameters;
	private final ExpressionNode expression;

	public FunctionDefinitionNode(SourceLocation location, String name, SourceLocation nameLocation,
								  List<ModuleParameter> parameters, ExpressionNode expression)
	{
		super(NodeKind.FUNCTION_DEFINITION, location);
		this.name = name;
		this.nameLocation = nameLocation;
		this.parameters = List.copyOf(parameters);
		this.expression = expression;
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

	public ExpressionNode getExpression()
	{
		return expression;
	}

	@Override
	public List<AstNode> getSubNodes()
	{
		List<AstNode> nodes = new ArrayList<>();
		parameters.forEach(p -> p.getDefaultExpression().ifPresent(nodes::add));
		nodes.add(expression);
		return nodes;
	}

	@Override
	protected List<Object> structure()
	{
		return values(name, nameLocation, parameters, expression);
	}
}
