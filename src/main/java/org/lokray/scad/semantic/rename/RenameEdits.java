package org.lokray.scad.semantic.rename;

import java.util.List;

/**
 * All edits of one rename, ordered by offset. They are meant to be applied together.
 */
public class RenameEdits
{
	private final List<TextEdit> edits;

	public RenameEdits(List<TextEdit> edits)
	{
		this.edits = List.copyOf(edits);
	}

	public List<TextEdit> getEdits()
	{
		return edits;
	}

	public int size()
	{
		return edits.size();
	}

	/**
	 * Applies the edits to {@code text}, back to front so earlier offsets stay valid.
	 */
	public String applyTo(String text)
	{
		StringBuilder sb = new StringBuilder(text);
		for (int i = edits.size() - 1; i >= 0; i--)
		{
			TextEdit edit = edits.get(i);
			sb.replace(edit.getRange().getStart().getOffset(), edit.getRange().getEnd().getOffset(), edit.getNewText());
		}
		return sb.toString();
	}
}
