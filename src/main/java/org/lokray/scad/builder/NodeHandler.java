package org.lokray.scad.builder;

import org.lokray.scad.ast.AstNode;
import org.lokray.scad.cst.CstNode;

/**
 * Builds the AST node for one CST statement. Returning {@code null} drops the statement.
 */
@FunctionalInterface
public interface NodeHandler
{
	AstNode handle(CstNode node, BuildContext context);
}
