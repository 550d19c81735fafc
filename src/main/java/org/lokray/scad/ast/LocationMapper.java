package org.lokray.scad.ast;

import org.lokray.scad.cst.CstNode;
import org.lokray.scad.cst.CstPoint;
import org.lokray.scad.cst.LineIndex;

/**
 * Turns CST spans into the {@link SourceLocation}s carried by AST nodes and diagnostics.
 */
public final class LocationMapper
{
	private LocationMapper()
	{
	}

	public static SourceLocation map(CstNode node)
	{
		return new SourceLocation(
				toPosition(node.getStartPosition(), node.getStartIndex()),
				toPosition(node.getEndPosition(), node.getEndIndex()));
	}

	/**
	 * Location spanning from the start of {@code first} to the end of {@code last}.
	 */
	public static SourceLocation span(CstNode first, CstNode last)
	{
		return new SourceLocation(
				toPosition(first.getStartPosition(), first.getStartIndex()),
				toPosition(last.getEndPosition(), last.getEndIndex()));
	}

	public static Position toPosition(CstPoint point, int offset)
	{
		return new Position(point.getRow(), point.getColumn(), offset);
	}

	public static Position positionAt(LineIndex index, int offset)
	{
		return toPosition(index.pointAt(offset), offset);
	}

	public static int offsetOf(LineIndex index, Position position)
	{
		return index.offsetOf(position.getLine(), position.getColumn());
	}

	public static boolean contains(SourceLocation location, int offset)
	{
		return location != null && location.contains(offset);
	}
}
