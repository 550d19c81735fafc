package org.lokray.scad.ast.expression;

import org.lokray.scad.ast.AstNode;
import org.lokray.scad.ast.NodeKind;
import org.lokray.scad.ast.SourceLocation;

import java.util.List;

/**
 * {@code v.x}, {@code v.y}, {@code v.z}.
 */
public class MemberExpressionNode extends ExpressionNode
{
	private final ExpressionNode object;
	private final String property;

	public MemberExpressionNode(SourceLocation location, ExpressionNode object, String property)
	{
		super(NodeKind.MEMBER_EXPRESSION, location);
		this.object = object;
		this.property = property;
	}

	public ExpressionNode getObject()
	{
		return object;
	}

	public String getProperty()
	{
		return property;
	}

	@Override
	public List<AstNode> getSubNodes()
	{
		return List.of(object);
	}

	@Override
	protected List<Object> structure()
	{
		return values(object, property);
	}
}
