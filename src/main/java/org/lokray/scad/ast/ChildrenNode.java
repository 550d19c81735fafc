package org.lokray.scad.ast;

import java.util.List;

/**
 * {@code children()} inside a module body, optionally selecting by index.
 */
public class ChildrenNode extends CallNode
{
	public ChildrenNode(SourceLocation location, SourceLocation nameLocation, String modifier, List<Parameter> parameters,
			List<AstNode> children)
	{
		super(NodeKind.CHILDREN, location, "children", nameLocation, modifier, parameters, children);
	}
}
