package org.lokray.scad.query;

import org.lokray.scad.cst.CstNode;

public class QueryCapture
{
	private final String name;
	private final CstNode node;
	private final int patternIndex;

	public QueryCapture(String name, CstNode node, int patternIndex)
	{
		this.name = name;
		this.node = node;
		this.patternIndex = patternIndex;
	}

	public String getName()
	{
		return name;
	}

	public CstNode getNode()
	{
		return node;
	}

	/**
	 * Which top-level pattern of the query produced the capture.
	 */
	public int getPatternIndex()
	{
		return patternIndex;
	}

	@Override
	public String toString()
	{
		return "@" + name + "=" + node;
	}
}
