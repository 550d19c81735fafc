package org.lokray.scad.ast;

import java.util.List;

/**
 * 2D primitives, polyhedra, text and imported geometry. Arguments are kept as given.
 */
public class PrimitiveNode extends CallNode
{
	public PrimitiveNode(NodeKind kind, SourceLocation location, SourceLocation nameLocation, String modifier,
						 List<Parameter> parameters, List<AstNode> children)
	{
		super(kind, location, kind.getKey(), nameLocation, modifier, parameters, children);
	}
}
