package org.lokray.scad.util;

import java.io.PrintStream;

/**
 * Console logging for the parser. Warnings and errors go to stderr so they do not mix with AST dumps on stdout.
 */
public class Debug
{
	public static final String ANSI_RESET = "\u001B[0m";
	public static final String ANSI_YELLOW = "\u001B[33m";
	public static final String ANSI_RED = "\u001B[31m";
	public static final String ANSI_GREEN = "\u001B[32m";

	private static final String PREFIX = "[scad] ";

	// ParserConfig switches this on when "debug" is set
	public static boolean ENABLE_DEBUG = false;

	private enum Level
	{
		DEBUG(null), INFO(ANSI_GREEN), WARNING(ANSI_YELLOW), ERROR(ANSI_RED);

		private final String color;

		Level(String color)
		{
			this.color = color;
		}
	}

	public static void logInfo(String log)
	{
		print(Level.INFO, log);
	}

	public static void logDebug(String log)
	{
		if (ENABLE_DEBUG)
		{
			print(Level.DEBUG, log);
		}
	}

	public static void logWarning(String log)
	{
		print(Level.WARNING, log);
	}

	public static void logError(String log)
	{
		print(Level.ERROR, log);
	}

	private static void print(Level level, String log)
	{
		PrintStream out = level == Level.WARNING || level == Level.ERROR ? System.err : System.out;
		String line = PREFIX + level.name() + ": " + log;
		out.println(level.color == null ? line : level.color + line + ANSI_RESET);
	}
}
