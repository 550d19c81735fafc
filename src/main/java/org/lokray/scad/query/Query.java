package org.lokray.scad.query;

import org.lokray.scad.cst.CstNode;

import java.util.ArrayList;
import java.util.List;

/**
 * A compiled query: one or more patterns tried against every node of a tree.
 */
public class Query
{
	private final String source;
	private final List<QueryPattern> patterns;

	public Query(String source, List<QueryPattern> patterns)
	{
		this.source = source;
		this.patterns = List.copyOf(patterns);
	}

	public String getSource()
	{
		return source;
	}

	public List<QueryPattern> getPatterns()
	{
		return patterns;
	}

	/**
	 * All captures below and including {@code root}, in pre-order of the matched nodes.
	 */
	public List<QueryCapture> captures(CstNode root)
	{
		List<QueryCapture> out = new ArrayList<>();
		visit(root, out);
		return out;
	}

	private void visit(CstNode node, List<QueryCapture> out)
	{
		for (int i = 0; i < patterns.size(); i++)
		{
			patterns.get(i).match(node, i, out);
		}
		for (CstNode child : node.getChildren())
		{
			visit(child, out);
		}
	}
}
