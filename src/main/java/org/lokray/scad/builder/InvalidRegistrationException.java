package org.lokray.scad.builder;

public class InvalidRegistrationException extends RuntimeException
{
	public InvalidRegistrationException(String message)
	{
		super(message);
	}
}
