package org.lokray.scad.evaluation;

public enum ValueType
{
	NUMBER("number"),
	STRING("string"),
	BOOLEAN("boolean"),
	VECTOR("vector"),
	UNDEF("undef");

	private final String displayName;

	ValueType(String displayName)
	{
		this.displayName = displayName;
	}

	public String getDisplayName()
	{
		return displayName;
	}

	@Override
	public String toString()
	{
		return displayName;
	}
}
