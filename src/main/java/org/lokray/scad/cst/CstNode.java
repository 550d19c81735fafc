package org.lokray.scad.cst;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * A node of the concrete syntax tree. Nodes keep every token of the source, named fields
 * for the interesting children and the error markers the grammar left behind.
 * Navigation methods return {@code null} where there is nothing to return.
 */
public class CstNode
{
	public static final String ERROR = "ERROR";

	private final String type;
	private final boolean named;
	private final String source;
	private final int startIndex;
	private final int endIndex;
	private final CstPoint startPosition;
	private final CstPoint endPosition;
	private final boolean missing;
	private boolean incomplete;

	private final List<CstNode> children = new ArrayList<>();
	private final List<String> fieldNames = new ArrayList<>();
	private CstNode parent;
	private int indexInParent = -1;

	public CstNode(String type, boolean named, String source, int startIndex, int endIndex,
				   CstPoint startPosition, CstPoint endPosition, boolean missing)
	{
		this.type = type;
		this.named = named;
		this.source = source;
		this.startIndex = startIndex;
		this.endIndex = endIndex;
		this.startPosition = startPosition;
		this.endPosition = endPosition;
		this.missing = missing;
	}

	/**
	 * Creates a detached node over {@code source[startIndex, endIndex)}, computing its points.
	 */
	public static CstNode create(String type, String source, int startIndex, int endIndex)
	{
		LineIndex index = new LineIndex(source);
		boolean named = !type.isEmpty() && (Character.isLetter(type.charAt(0)) || type.charAt(0) == '_') && !type.equals(ERROR);
		return new CstNode(type, named, source, startIndex, endIndex, index.pointAt(startIndex), index.pointAt(endIndex), false);
	}

	public CstNode appendChild(CstNode child)
	{
		return appendChild(null, child);
	}

	/**
	 * Appends {@code child} under the given field name (may be null) and adopts it.
	 */
	public CstNode appendChild(String fieldName, CstNode child)
	{
		child.parent = this;
		child.indexInParent = children.size();
		children.add(child);
		fieldNames.add(fieldName);
		return this;
	}

	void markIncomplete()
	{
		this.incomplete = true;
	}

	boolean isIncomplete()
	{
		return incomplete;
	}

	public String getType()
	{
		return type;
	}

	public boolean isNamed()
	{
		return named;
	}

	public String getText()
	{
		if (missing)
		{
			return "";
		}
		return source.substring(startIndex, endIndex);
	}

	public String getSource()
	{
		return source;
	}

	public int getStartIndex()
	{
		return startIndex;
	}

	public int getEndIndex()
	{
		return endIndex;
	}

	public CstPoint getStartPosition()
	{
		return startPosition;
	}

	public CstPoint getEndPosition()
	{
		return endPosition;
	}

	public int getChildCount()
	{
		return children.size();
	}

	public CstNode getChild(int index)
	{
		if (index < 0 || index >= children.size())
		{
			return null;
		}
		return children.get(index);
	}

	public List<CstNode> getChildren()
	{
		return Collections.unmodifiableList(children);
	}

	public List<CstNode> getNamedChildren()
	{
		return children.stream().filter(CstNode::isNamed).toList();
	}

	public CstNode getChildForFieldName(String fieldName)
	{
		for (int i = 0; i < children.size(); i++)
		{
			if (fieldName.equals(fieldNames.get(i)))
			{
				return children.get(i);
			}
		}
		return null;
	}

	public List<CstNode> getChildrenForFieldName(String fieldName)
	{
		List<CstNode> result = new ArrayList<>();
		for (int i = 0; i < children.size(); i++)
		{
			if (fieldName.equals(fieldNames.get(i)))
			{
				result.add(children.get(i));
			}
		}
		return result;
	}

	public String getFieldNameForChild(int index)
	{
		if (index < 0 || index >= fieldNames.size())
		{
			return null;
		}
		return fieldNames.get(index);
	}

	public CstNode getParent()
	{
		return parent;
	}

	public CstNode getNextSibling()
	{
		return parent == null ? null : parent.getChild(indexInParent + 1);
	}

	public CstNode getPreviousSibling()
	{
		return parent == null ? null : parent.getChild(indexInParent - 1);
	}

	public CstNode getNextNamedSibling()
	{
		CstNode sibling = getNextSibling();
		while (sibling != null && !sibling.isNamed())
		{
			sibling = sibling.getNextSibling();
		}
		return sibling;
	}

	public boolean isError()
	{
		return ERROR.equals(type);
	}

	public boolean isMissing()
	{
		return missing;
	}

	/**
	 * True when this node or anything below it is an error, a missing token or an unfinished rule.
	 */
	public boolean hasError()
	{
		Deque<CstNode> pending = new ArrayDeque<>();
		pending.push(this);
		while (!pending.isEmpty())
		{
			CstNode node = pending.pop();
			if (node.isError() || node.missing || node.incomplete)
			{
				return true;
			}
			node.children.forEach(pending::push);
		}
		return false;
	}

	/**
	 * The deepest node whose span contains {@code offset}.
	 */
	public CstNode descendantForIndex(int offset)
	{
		for (CstNode child : children)
		{
			if (child.startIndex <= offset && offset < child.endIndex)
			{
				return child.descendantForIndex(offset);
			}
		}
		return this;
	}

	public String toSExpression()
	{
		StringBuilder sb = new StringBuilder();
		appendSExpression(sb);
		return sb.toString();
	}

	private void appendSExpression(StringBuilder sb)
	{
		if (missing)
		{
			sb.append("(MISSING \"").append(type).append("\")");
			return;
		}
		sb.append('(').append(type);
		for (int i = 0; i < children.size(); i++)
		{
			CstNode child = children.get(i);
			if (!child.isNamed() && !child.isError() && !child.isMissing())
			{
				continue;
			}
			sb.append(' ');
			if (fieldNames.get(i) != null)
			{
				sb.append(fieldNames.get(i)).append(": ");
			}
			child.appendSExpression(sb);
		}
		sb.append(')');
	}

	@Override
	public String toString()
	{
		return type + " [" + startPosition + " - " + endPosition + "]";
	}
}
