package org.lokray.scad.ast;

import java.util.List;

/**
 * A call of a user module, or of any module name the builder does not know.
 */
public class ModuleInstantiationNode extends CallNode
{
	public ModuleInstantiationNode(SourceLocation location, String name, SourceLocation nameLocation, String modifier,
								   List<Parameter> parameters, List<AstNode> children)
	{
		super(NodeKind.MODULE_INSTANTIATION, location, name, nameLocation, modifier, parameters, children);
	}
}
