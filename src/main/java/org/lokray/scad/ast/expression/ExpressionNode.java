package org.lokray.scad.ast.expression;

import org.lokray.scad.ast.AstNode;
import org.lokray.scad.ast.NodeKind;
import org.lokray.scad.ast.SourceLocation;

/**
 * Base of the expression nodes. Expressions have no geometry children, only operands.
 */
public abstract class ExpressionNode extends AstNode
{
	protected ExpressionNode(NodeKind kind, SourceLocation location)
	{
		super(kind, location);
	}
}
