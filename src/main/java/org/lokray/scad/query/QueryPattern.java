package org.lokray.scad.query;

import org.lokray.scad.cst.CstNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One compiled pattern: a node test plus child and field sub-patterns and capture names.
 */
public class QueryPattern
{
	public enum Test
	{
		/**
		 * {@code (type ...)}: a named node of that type.
		 */
		NAMED_TYPE,
		/**
		 * {@code (_ ...)}: any named node.
		 */
		ANY_NAMED,
		/**
		 * {@code _}: any node at all.
		 */
		ANY,
		/**
		 * {@code "text"}: an anonymous token.
		 */
		TOKEN
	}

	private final Test test;
	private final String type;
	private final List<QueryPattern> children;
	private final Map<String, QueryPattern> fields;
	private final List<String> captures;

	public QueryPattern(Test test, String type, List<QueryPattern> children, Map<String, QueryPattern> fields, List<String> captures)
	{
		this.test = test;
		this.type = type;
		this.children = List.copyOf(children);
		this.fields = new LinkedHashMap<>(fields);
		this.captures = List.copyOf(captures);
	}

	public Test getTest()
	{
		return test;
	}

	public String getType()
	{
		return type;
	}

	public List<QueryPattern> getChildren()
	{
		return children;
	}

	public Map<String, QueryPattern> getFields()
	{
		return fields;
	}

	public List<String> getCaptures()
	{
		return captures;
	}

	private boolean accepts(CstNode node)
	{
		return switch (test)
		{
			case NAMED_TYPE -> node.isNamed() && type.equals(node.getType());
			case ANY_NAMED -> node.isNamed();
			case ANY -> true;
			case TOKEN -> !node.isNamed() && type.equals(node.getType());
		};
	}

	/**
	 * Matches {@code node}, appending captures to {@code out}. On failure {@code out} is left as it was.
	 */
	public boolean match(CstNode node, int patternIndex, List<QueryCapture> out)
	{
		int mark = out.size();
		if (!accepts(node) || !matchFields(node, patternIndex, out) || !matchChildren(node.getChildren(), 0, 0, patternIndex, out))
		{
			truncate(out, mark);
			return false;
		}
		// Outer captures come first, as in document order
		List<QueryCapture> own = new ArrayList<>();
		for (String capture : captures)
		{
			own.add(new QueryCapture(capture, node, patternIndex));
		}
		out.addAll(mark, own);
		return true;
	}

	private boolean matchFields(CstNode node, int patternIndex, List<QueryCapture> out)
	{
		for (Map.Entry<String, QueryPattern> field : fields.entrySet())
		{
			CstNode child = node.getChildForFieldName(field.getKey());
			if (child == null || !field.getValue().match(child, patternIndex, out))
			{
				return false;
			}
		}
		return true;
	}

	/**
	 * Child patterns match an ordered, not necessarily adjacent, subsequence of the children.
	 */
	private boolean matchChildren(List<CstNode> nodes, int patternAt, int nodeAt, int patternIndex, List<QueryCapture> out)
	{
		if (patternAt == children.size())
		{
			return true;
		}
		QueryPattern pattern = children.get(patternAt);
		for (int i = nodeAt; i < nodes.size(); i++)
		{
			int mark = out.size();
			if (pattern.match(nodes.get(i), patternIndex, out)
					&& matchChildren(nodes, patternAt + 1, i + 1, patternIndex, out))
			{
				return true;
			}
			truncate(out, mark);
		}
		return false;
	}

	private static void truncate(List<QueryCapture> list, int size)
	{
		while (list.size() > size)
		{
			list.remove(list.size() - 1);
		}
	}

	@Override
	public String toString()
	{
		String head = switch (test)
		{
			case NAMED_TYPE -> "(" + type;
			case ANY_NAMED -> "(_";
			case ANY -> "_";
			case TOKEN -> "\"" + type + "\"";
		};
		StringBuilder sb = new StringBuilder(head);
		fields.forEach((name, pattern) -> sb.append(' ').append(name).append(": ").append(pattern));
		children.forEach(pattern -> sb.append(' ').append(pattern));
		if (test == Test.NAMED_TYPE || test == Test.ANY_NAMED)
		{
			sb.append(')');
		}
		captures.forEach(capture -> sb.append(" @").append(capture));
		return sb.toString();
	}
}
