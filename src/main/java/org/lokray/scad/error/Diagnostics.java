package org.lokray.scad.error;

import org.lokray.scad.ast.Position;
import org.lokray.scad.util.Debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered errors, warnings and infos of one parse run. Cleared by the session before every run.
 */
public class Diagnostics
{
	private final List<String> errors = new ArrayList<>();
	private final List<String> warnings = new ArrayList<>();
	private final List<String> infos = new ArrayList<>();
	private final List<ParserError> problems = new ArrayList<>();

	public void report(ParserError error)
	{
		problems.add(error);
		String entry = format(error.getCode(), error.getPosition(), error.getBaseMessage());
		switch (error.getSeverity())
		{
			case ERROR, FATAL ->
			{
				errors.add(entry);
				// The grammar's error listener already printed syntax errors
				if (!(error instanceof SyntaxError))
				{
					Debug.logError("[Semantic Error] " + entry);
				}
			}
			case WARNING ->
			{
				warnings.add(entry);
				Debug.logWarning("[Semantic Warning] " + entry);
			}
			default ->
			{
				infos.add(entry);
				Debug.logDebug("[Info] " + entry);
			}
		}
	}

	public void reportAll(List<? extends ParserError> errors)
	{
		errors.forEach(this::report);
	}

	public void addError(String message)
	{
		errors.add(message);
		Debug.logError(message);
	}

	public void addWarning(String message)
	{
		warnings.add(message);
		Debug.logWarning(message);
	}

	public void addInfo(String message)
	{
		infos.add(message);
		Debug.logDebug(message);
	}

	public List<String> getErrors()
	{
		return Collections.unmodifiableList(errors);
	}

	public List<String> getWarnings()
	{
		return Collections.unmodifiableList(warnings);
	}

	public List<String> getInfos()
	{
		return Collections.unmodifiableList(infos);
	}

	/**
	 * Every typed error reported so far, in report order.
	 */
	public List<ParserError> getProblems()
	{
		return Collections.unmodifiableList(problems);
	}

	public <T extends ParserError> List<T> getProblems(Class<T> type)
	{
		return problems.stream().filter(type::isInstance).map(type::cast).toList();
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}

	public boolean hasWarnings()
	{
		return !warnings.isEmpty();
	}

	public void clear()
	{
		errors.clear();
		warnings.clear();
		infos.clear();
		problems.clear();
	}

	private static String format(ErrorCode code, Position position, String message)
	{
		return String.format("[%s] line %d:%d - %s", code.getCode(), position.getLine() + 1, position.getColumn() + 1, message);
	}
}
