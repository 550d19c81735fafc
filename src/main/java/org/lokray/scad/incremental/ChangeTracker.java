package org.lokray.scad.incremental;

import org.lokray.scad.ast.LocationMapper;
import org.lokray.scad.cst.CstNode;
import org.lokray.scad.cst.LineIndex;

import java.util.ArrayList;
import java.util.List;

public class ChangeTracker
{
	private final List<Change> changes = new ArrayList<>();
	private long lastVersion;

	/**
	 * Records {@code edit}, computing its points against the new {@code text}. The old end point is
	 * clamped to the new text when the edit removed the tail.
	 *
	 * @throws IllegalArgumentException when the start or new end lies outside {@code text}
	 */
	public Change trackChange(InputEdit edit, String text)
	{
		if (edit.getStartIndex() < 0 || edit.getNewEndIndex() > text.length() || edit.getStartIndex() > edit.getNewEndIndex())
		{
			throw new IllegalArgumentException("Edit " + edit + " is out of bounds for text of length " + text.length());
		}
		LineIndex index = new LineIndex(text);
		Change change = new Change(++lastVersion, edit,
				LocationMapper.positionAt(index, edit.getStartIndex()),
				LocationMapper.positionAt(index, Math.min(edit.getOldEndIndex(), text.length())),
				LocationMapper.positionAt(index, edit.getNewEndIndex()));
		changes.add(change);
		return change;
	}

	public List<Change> getChanges()
	{
		return List.copyOf(changes);
	}

	public List<Change> getChangesSince(long version)
	{
		return changes.stream().filter(c -> c.getVersion() > version).toList();
	}

	public long getLastVersion()
	{
		return lastVersion;
	}

	public boolean isNodeAffected(CstNode node)
	{
		return isNodeAffected(node.getStartIndex(), node.getEndIndex(), 0);
	}

	/**
	 * True when a change after {@code sinceVersion} overlaps {@code [startIndex, endIndex]}; a change
	 * touching either boundary counts.
	 */
	public boolean isNodeAffected(int startIndex, int endIndex, long sinceVersion)
	{
		for (Change change : getChangesSince(sinceVersion))
		{
			InputEdit edit = change.getEdit();
			int changeEnd = Math.max(edit.getOldEndIndex(), edit.getNewEndIndex());
			if (edit.getStartIndex() <= endIndex && changeEnd >= startIndex)
			{
				return true;
			}
		}
		return false;
	}

	public void clear()
	{
		changes.clear();
	}
}
