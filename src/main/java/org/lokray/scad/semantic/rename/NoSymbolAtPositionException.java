package org.lokray.scad.semantic.rename;

public class NoSymbolAtPositionException extends RuntimeException
{
	private final int offset;

	public NoSymbolAtPositionException(int offset)
	{
		super("No renameable symbol at offset " + offset);
		this.offset = offset;
	}

	public int getOffset()
	{
		return offset;
	}
}
