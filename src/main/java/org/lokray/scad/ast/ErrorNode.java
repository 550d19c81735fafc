package org.lokray.scad.ast;

import org.lokray.scad.error.ErrorCode;

import java.util.List;

/**
 * Placeholder for source the builder could not turn into a node.
 */
public class ErrorNode extends AstNode
{
	private final ErrorCode code;
	private final String message;
	private final String sourceText;

	public ErrorNode(SourceLocation location, ErrorCode code, String message, String sourceText)
	{
		super(NodeKind.ERROR, location);
		this.code = code;
		this.message = message;
		this.sourceText = sourceText;
	}

	public ErrorCode getCode()
	{
		return code;
	}

	public String getMessage()
	{
		return message;
	}

	public String getSourceText()
	{
		return sourceText;
	}

	@Override
	protected List<Object> structure()
	{
		return values(code, message, sourceText);
	}
}
