package org.lokray.scad.semantic.rename;

import org.lokray.scad.ast.SourceLocation;

/**
 * The range the editor should highlight for renaming and the name currently there.
 */
public class PrepareRenameResult
{
	private final SourceLocation range;
	private final String text;

	public PrepareRenameResult(SourceLocation range, String text)
	{
		this.range = range;
		this.text = text;
	}

	public SourceLocation getRange()
	{
		return range;
	}

	public String getText()
	{
		return text;
	}

	@Override
	public String toString()
	{
		return text + " @" + range;
	}
}
