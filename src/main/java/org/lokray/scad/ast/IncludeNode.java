package org.lokray.scad.ast;

import java.util.List;

/**
 * {@code include <file>} or {@code use <file>}; the kind tells which.
 */
public class IncludeNode extends AstNode
{
	private final String path;

	public IncludeNode(NodeKind kind, SourceLocation location, String path)
	{
		super(kind, location);
		this.path = path;
	}

	/**
	 * The path between the angle brackets.
	 */
	public String getPath()
	{
		return path;
	}

	public boolean isUse()
	{
		return getKind() == NodeKind.USE;
	}

	@Override
	protected List<Object> structure()
	{
		return values(path);
	}
}
