package org.lokray.scad.error;

import java.util.Objects;
import java.util.Optional;

public class ErrorSuggestion
{
	private final String message;
	private final String replacement;

	public ErrorSuggestion(String message)
	{
		this(message, null);
	}

	public ErrorSuggestion(String message, String replacement)
	{
		this.message = message;
		this.replacement = replacement;
	}

	public String getMessage()
	{
		return message;
	}

	public Optional<String> getReplacement()
	{
		return Optional.ofNullable(replacement);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof ErrorSuggestion other))
		{
			return false;
		}
		return message.equals(other.message) && Objects.equals(replacement, other.replacement);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(message, replacement);
	}

	@Override
	public String toString()
	{
		return replacement == null ? message : message + " (" + replacement + ")";
	}
}
