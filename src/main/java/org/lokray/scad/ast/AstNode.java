package org.lokray.scad.ast;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Base of every AST node. Nodes are immutable and never point at their parent.
 * Two nodes are equal when their kinds, locations and {@link #structure()} are equal.
 */
public abstract class AstNode
{
	private final NodeKind kind;
	private final SourceLocation location;

	protected AstNode(NodeKind kind, SourceLocation location)
	{
		this.kind = Objects.requireNonNull(kind);
		this.location = location;
	}

	public NodeKind getKind()
	{
		return kind;
	}

	public SourceLocation getLocation()
	{
		return location;
	}

	/**
	 * Geometry or statement nesting, e.g. the objects a {@code translate} applies to.
	 */
	public List<AstNode> getChildren()
	{
		return List.of();
	}

	/**
	 * Every node this node owns, in source order: expressions, parameters' expressions and children.
	 */
	public List<AstNode> getSubNodes()
	{
		return getChildren();
	}

	/**
	 * The values that make up this node besides kind and location.
	 */
	protected abstract List<Object> structure();

	protected static List<Object> values(Object... values)
	{
		return Arrays.asList(values);
	}

	@Override
	public final boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		AstNode other = (AstNode) o;
		return kind == other.kind && Objects.equals(location, other.location) && structure().equals(other.structure());
	}

	@Override
	public final int hashCode()
	{
		return Objects.hash(kind, location, structure());
	}

	@Override
	public String toString()
	{
		return kind.getKey() + " " + location;
	}
}
