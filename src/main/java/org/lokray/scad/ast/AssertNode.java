package org.lokray.scad.ast;

import java.util.List;

public class AssertNode extends CallNode
{
	public AssertNode(SourceLocation location, SourceLocation nameLocation, String modifier, List<Parameter> parameters,
			List<AstNode> children)
	{
		super(NodeKind.ASSERT, location, "assert", nameLocation, modifier, parameters, children);
	}
}
