package org.lokray.scad.builder;

import org.lokray.scad.ast.AstNode;
import org.lokray.scad.cst.CstNode;

import java.util.List;

/**
 * The AST nodes produced from one top-level CST child. Separators and skipped input produce none.
 */
public class BuiltStatement
{
	private final CstNode cst;
	private final List<AstNode> nodes;

	public BuiltStatement(CstNode cst, List<AstNode> nodes)
	{
		this.cst = cst;
		this.nodes = List.copyOf(nodes);
	}

	public CstNode getCst()
	{
		return cst;
	}

	public List<AstNode> getNodes()
	{
		return nodes;
	}
}
