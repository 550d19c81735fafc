package org.lokray.scad.error;

public enum Severity
{
	DEBUG,
	INFO,
	WARNING,
	ERROR,
	FATAL;

	public boolean isAtLeast(Severity other)
	{
		return compareTo(other) >= 0;
	}
}
