package org.lokray.scad.query;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles S-expression queries such as
 * <pre>
 * (module_instantiation name: (identifier) @name) @call
 * (function_definition) @fn
 * </pre>
 * {@code _} matches any node, {@code (_)} any named node, a quoted string an anonymous token, and
 * {@code ;} starts a comment.
 */
public class QueryCompiler
{
	private String text;
	private int pos;

	public Query compile(String query)
	{
		this.text = query;
		this.pos = 0;
		List<QueryPattern> patterns = new ArrayList<>();
		skipSpace();
		while (pos < text.length())
		{
			patterns.add(pattern());
			skipSpace();
		}
		if (patterns.isEmpty())
		{
			throw new QueryException("Empty query", 0);
		}
		return new Query(query, patterns);
	}

	private QueryPattern pattern()
	{
		skipSpace();
		if (pos >= text.length())
		{
			throw new QueryException("Expected a pattern", pos);
		}
		char c = text.charAt(pos);
		QueryPattern.Test test;
		String type = null;
		List<QueryPattern> children = new ArrayList<>();
		Map<String, QueryPattern> fields = new LinkedHashMap<>();

		if (c == '(')
		{
			pos++;
			skipSpace();
			String head = name();
			if (head.isEmpty())
			{
				throw new QueryException("Expected a node type after '('", pos);
			}
			test = head.equals("_") ? QueryPattern.Test.ANY_NAMED : QueryPattern.Test.NAMED_TYPE;
			type = head.equals("_") ? null : head;
			skipSpace();
			while (pos < text.length() && text.charAt(pos) != ')')
			{
				int start = pos;
				String word = isNameChar(text.charAt(pos)) ? name() : "";
				skipSpace();
				if (!word.isEmpty() && pos < text.length() && text.charAt(pos) == ':')
				{
					pos++;
					if (fields.put(word, pattern()) != null)
					{
						throw new QueryException("Field '" + word + "' given twice", start);
					}
				}
				else
				{
					pos = start;
					children.add(pattern());
				}
				skipSpace();
			}
			if (pos >= text.length())
			{
				throw new QueryException("Unclosed '('", pos);
			}
			pos++;
		}
		else if (c == '"')
		{
			test = QueryPattern.Test.TOKEN;
			type = string();
		}
		else if (c == '_' && (pos + 1 >= text.length() || !isNameChar(text.charAt(pos + 1))))
		{
			test = QueryPattern.Test.ANY;
			pos++;
		}
		else
		{
			throw new QueryException("Unexpected '" + c + "'", pos);
		}

		List<String> captures = new ArrayList<>();
		skipSpace();
		while (pos < text.length() && text.charAt(pos) == '@')
		{
			pos++;
			String capture = name();
			if (capture.isEmpty())
			{
				throw new QueryException("Expected a capture name after '@'", pos);
			}
			captures.add(capture);
			skipSpace();
		}
		return new QueryPattern(test, type, children, fields, captures);
	}

	private String name()
	{
		int start = pos;
		while (pos < text.length() && isNameChar(text.charAt(pos)))
		{
			pos++;
		}
		return text.substring(start, pos);
	}

	private String string()
	{
		int start = pos++;
		StringBuilder sb = new StringBuilder();
		while (pos < text.length() && text.charAt(pos) != '"')
		{
			char c = text.charAt(pos++);
			if (c == '\\' && pos < text.length())
			{
				c = text.charAt(pos++);
			}
			sb.append(c);
		}
		if (pos >= text.length())
		{
			throw new QueryException("Unterminated string", start);
		}
		pos++;
		return sb.toString();
	}

	private void skipSpace()
	{
		while (pos < text.length())
		{
			char c = text.charAt(pos);
			if (c == ';')
			{
				while (pos < text.length() && text.charAt(pos) != '\n')
				{
					pos++;
				}
			}
			else if (Character.isWhitespace(c))
			{
				pos++;
			}
			else
			{
				return;
			}
		}
	}

	private static boolean isNameChar(char c)
	{
		return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' || c == '$';
	}
}
