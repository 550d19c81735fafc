package org.lokray.scad.incremental;

import org.lokray.scad.ast.AstNode;
import org.lokray.scad.builder.AstBuilder;
import org.lokray.scad.builder.BuiltStatement;
import org.lokray.scad.cst.CstParseResult;

import java.util.List;

/**
 * A CST together with the AST built from it, kept per top-level node so the next edit can reuse
 * the untouched part.
 */
public class ParseSnapshot
{
	private final CstParseResult cst;
	private final List<BuiltStatement> statements;
	private final List<AstNode> ast;
	private final int reusedStatements;

	public ParseSnapshot(CstParseResult cst, List<BuiltStatement> statements, int reusedStatements)
	{
		this.cst = cst;
		this.statements = List.copyOf(statements);
		this.ast = List.copyOf(AstBuilder.flatten(statements));
		this.reusedStatements = reusedStatements;
	}

	public CstParseResult getCst()
	{
		return cst;
	}

	public String getSource()
	{
		return cst.getSource();
	}

	public List<BuiltStatement> getStatements()
	{
		return statements;
	}

	public List<AstNode> getAst()
	{
		return ast;
	}

	/**
	 * How many top-level nodes were carried over from the previous snapshot; 0 after a full parse.
	 */
	public int getReusedStatements()
	{
		return reusedStatements;
	}

	/**
	 * False when the build was cancelled before reaching the end of the file.
	 */
	public boolean isComplete()
	{
		return cst.getRoot() != null && statements.size() == cst.getRoot().getChildCount();
	}
}
