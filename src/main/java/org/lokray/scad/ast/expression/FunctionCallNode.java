package org.lokray.scad.ast.expression;

import org.lokray.scad.ast.AstNode;
import org.lokray.scad.ast.NodeKind;
import org.lokray.scad.ast.Parameter;
import org.lokray.scad.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

public class FunctionCallNode extends ExpressionNode
{
	private final ExpressionNode callee;
	private final List<Parameter> arguments;

	public FunctionCallNode(SourceLocation location, ExpressionNode callee, List<Parameter> arguments)
	{
		super(NodeKind.FUNCTION_CALL, location);
		this.callee = callee;
		this.arguments = List.copyOf(arguments);
	}

	public ExpressionNode getCallee()
	{
		return callee;
	}

	/**
	 * The called function's name, or null when the callee is not a plain identifier.
	 */
	public String getFunctionName()
	{
		return callee instanceof IdentifierNode identifier ? identifier.getName() : null;
	}

	public List<Parameter> getArguments()
	{
		return arguments;
	}

	@Override
	public List<AstNode> getSubNodes()
	{
		List<AstNode> nodes = new ArrayList<>();
		nodes.add(callee);
		arguments.forEach(a -> nodes.add(a.getExpression()));
		return nodes;
	}

	@Override
	protected List<Object> structure()
	{
		return values(callee, arguments);
	}
}
