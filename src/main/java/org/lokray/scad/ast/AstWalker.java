package org.lokray.scad.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Pre-order traversal over {@link AstNode#getSubNodes()}.
 */
public final class AstWalker
{
	private AstWalker()
	{
	}

	public static void walk(List<? extends AstNode> nodes, Consumer<AstNode> visitor)
	{
		for (AstNode node : nodes)
		{
			walk(node, visitor);
		}
	}

	public static void walk(AstNode node, Consumer<AstNode> visitor)
	{
		if (node == null)
		{
			return;
		}
		visitor.accept(node);
		for (AstNode sub : node.getSubNodes())
		{
			walk(sub, visitor);
		}
	}

	public static <T extends AstNode> List<T> collect(List<? extends AstNode> nodes, Class<T> type)
	{
		List<T> result = new ArrayList<>();
		walk(nodes, node ->
		{
			if (type.isInstance(node))
			{
				result.add(type.cast(node));
			}
		});
		return result;
	}
}
