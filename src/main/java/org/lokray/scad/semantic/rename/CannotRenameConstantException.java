package org.lokray.scad.semantic.rename;

public class CannotRenameConstantException extends RuntimeException
{
	private final String symbolName;

	public CannotRenameConstantException(String symbolName)
	{
		super("Cannot rename builtin constant '" + symbolName + "'");
		this.symbolName = symbolName;
	}

	public String getSymbolName()
	{
		return symbolName;
	}
}
