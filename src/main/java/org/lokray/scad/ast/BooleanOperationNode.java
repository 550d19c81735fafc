package org.lokray.scad.ast;

import java.util.List;

/**
 * union, difference, intersection, hull and minkowski over the child objects.
 */
public class BooleanOperationNode extends CallNode
{
	public BooleanOperationNode(NodeKind kind, SourceLocation location, SourceLocation nameLocation, String modifier,
								List<Parameter> parameters, List<AstNode> children)
	{
		super(kind, location, kind.getKey(), nameLocation, modifier, parameters, children);
	}
}
