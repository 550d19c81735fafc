package org.lokray.scad.ast;

import java.util.List;

public class EchoNode extends CallNode
{
	public EchoNode(SourceLocation location, SourceLocation nameLocation, String modifier, List<Parameter> parameters,
			List<AstNode> children)
	{
		super(NodeKind.ECHO, location, "echo", nameLocation, modifier, parameters, children);
	}
}
