package org.lokray.scad.incremental;

import org.lokray.scad.ast.Position;

/**
 * A tracked edit together with its line/column points in the new text. {@code version} increases by
 * one per tracked change.
 */
public class Change
{
	private final long version;
	private final InputEdit edit;
	private final Position startPosition;
	private final Position oldEndPosition;
	private final Position newEndPosition;

	public Change(long version, InputEdit edit, Position startPosition, Position oldEndPosition, Position newEndPosition)
	{
		this.version = version;
		this.edit = edit;
		this.startPosition = startPosition;
		this.oldEndPosition = oldEndPosition;
		this.newEndPosition = newEndPosition;
	}

	public long getVersion()
	{
		return version;
	}

	public InputEdit getEdit()
	{
		return edit;
	}

	public Position getStartPosition()
	{
		return startPosition;
	}

	public Position getOldEndPosition()
	{
		return oldEndPosition;
	}

	public Position getNewEndPosition()
	{
		return newEndPosition;
	}

	@Override
	public String toString()
	{
		return "Change#" + version + " " + edit;
	}
}
