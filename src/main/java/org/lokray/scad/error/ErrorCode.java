package org.lokray.scad.error;

/**
 * Stable error codes. The hundreds digit gives the family: 1 syntax, 2 type, 3 reference,
 * 4 validation, 9 internal.
 */
public enum ErrorCode
{
	SYNTAX_ERROR("E100"),
	UNEXPECTED_TOKEN("E101"),
	MISSING_SEMICOLON("E102"),
	UNCLOSED_BRACKET("E103"),
	UNCLOSED_BRACE("E104"),
	UNCLOSED_PAREN("E105"),
	INVALID_CHARACTER("E106"),
	UNEXPECTED_EOF("E108"),
	MISSING_TOKEN("E111"),

	TYPE_MISMATCH("E201"),

	UNDEFINED_VARIABLE("E301"),

	INVALID_ARGUMENTS("E401"),
	MISSING_REQUIRED_PARAMETER("E403"),

	INTERNAL_ERROR("E900");

	private final String code;

	ErrorCode(String code)
	{
		this.code = code;
	}

	public String getCode()
	{
		return code;
	}

	public boolean isSyntax()
	{
		return code.startsWith("E1");
	}

	@Override
	public String toString()
	{
		return code;
	}
}
