package org.lokray.scad.error;

import org.lokray.scad.ast.Position;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A problem found while turning source text into an AST. Errors are normally collected into
 * {@link Diagnostics}; they extend {@link RuntimeException} so callers that prefer to fail fast can throw them.
 */
public class ParserError extends RuntimeException
{
	private final String baseMessage;
	private final ErrorCode code;
	private final Severity severity;
	private final String source;
	private final Position position;
	private final List<ErrorSuggestion> suggestions;
	private final Map<String, String> context;

	public ParserError(String message, ErrorCode code, Severity severity, String source, Position position,
					   List<ErrorSuggestion> suggestions)
	{
		this(message, code, severity, source, position, suggestions, Map.of(), null);
	}

	public ParserError(String message, ErrorCode code, Severity severity, String source, Position position,
					   List<ErrorSuggestion> suggestions, Map<String, String> context, Throwable cause)
	{
		super(String.format("%s at line %d, column %d", message, position.getLine() + 1, position.getColumn() + 1), cause);
		this.baseMessage = message;
		this.code = code;
		this.severity = severity;
		this.source = source == null ? "" : source;
		this.position = position;
		this.suggestions = List.copyOf(suggestions);
		this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
	}

	/**
	 * The message without the position suffix, e.g. {@code Missing semicolon}.
	 */
	public String getBaseMessage()
	{
		return baseMessage;
	}

	public ErrorCode getCode()
	{
		return code;
	}

	public Severity getSeverity()
	{
		return severity;
	}

	public String getSource()
	{
		return source;
	}

	public Position getPosition()
	{
		return position;
	}

	public List<ErrorSuggestion> getSuggestions()
	{
		return suggestions;
	}

	public Map<String, String> getContext()
	{
		return context;
	}

	public String getSourceLine()
	{
		String[] lines = source.split("\n", -1);
		if (position.getLine() < 0 || position.getLine() >= lines.length)
		{
			return "";
		}
		String line = lines[position.getLine()];
		return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
	}

	public String getSourceSnippet()
	{
		return getSourceLine();
	}

	public String getFormattedMessage()
	{
		StringBuilder sb = new StringBuilder();
		sb.append(getMessage()).append("\n\n");
		sb.append(getSourceLine()).append('\n');
		sb.append(" ".repeat(Math.max(0, position.getColumn()))).append("^\n\n");

		if (!suggestions.isEmpty())
		{
			sb.append("Suggestions:\n");
			for (int i = 0; i < suggestions.size(); i++)
			{
				ErrorSuggestion suggestion = suggestions.get(i);
				sb.append(i + 1).append(". ").append(suggestion.getMessage()).append('\n');
				suggestion.getReplacement().ifPresent(r -> sb.append("   Try: ").append(r).append('\n'));
			}
		}
		return sb.toString();
	}
}
