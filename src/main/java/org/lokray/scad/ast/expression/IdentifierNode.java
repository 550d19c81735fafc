package org.lokray.scad.ast.expression;

import org.lokray.scad.ast.NodeKind;
import org.lokray.scad.ast.SourceLocation;

import java.util.List;

public class IdentifierNode extends ExpressionNode
{
	private final String name;

	public IdentifierNode(SourceLocation location, String name)
	{
		super(NodeKind.IDENTIFIER, location);
		this.name = name;
	}

	public String getName()
	{
		return name;
	}

	/**
	 * {@code $fn}, {@code $t} and friends.
	 */
	public boolean isSpecialVariable()
	{
		return name.startsWith("$");
	}

	@Override
	protected List<Object> structure()
	{
		return values(name);
	}

	@Override
	public String toString()
	{
		return name;
	}
}
