package org.lokray.scad.cst;

import org.lokray.scad.error.SyntaxError;

import java.util.List;

public class CstParseResult
{
	private final String source;
	private final CstNode root;
	private final List<SyntaxError> syntaxErrors;
	private final LineIndex lineIndex;

	public CstParseResult(String source, CstNode root, List<SyntaxError> syntaxErrors, LineIndex lineIndex)
	{
		this.source = source;
		this.root = root;
		this.syntaxErrors = List.copyOf(syntaxErrors);
		this.lineIndex = lineIndex;
	}

	public String getSource()
	{
		return source;
	}

	public CstNode getRoot()
	{
		return root;
	}

	public List<SyntaxError> getSyntaxErrors()
	{
		return syntaxErrors;
	}

	public boolean hasErrors()
	{
		return !syntaxErrors.isEmpty();
	}

	public LineIndex getLineIndex()
	{
		return lineIndex;
	}
}
