package org.lokray.scad.error.recovery;

import org.lokray.scad.cst.CstNode;
import org.lokray.scad.error.ParserError;

import java.util.Optional;
import java.util.Set;

/**
 * Gives up on the statement holding the error and resumes at the next statement after it.
 */
public class SkipToNextStatementStrategy implements RecoveryStrategy
{
	static final Set<String> STATEMENT_TYPES = Set.of(
			"statement", "module_instantiation", "module_definition", "function_definition", "assignment_statement",
			"if_statement", "for_statement", "let_statement", "include_statement", "use_statement");

	@Override
	public Optional<CstNode> recover(CstNode errorNode, ParserError error)
	{
		// Start from the enclosing statement so its own children are not candidates
		CstNode current = enclosingStatement(errorNode);

		while (current != null)
		{
			for (CstNode sibling = current.getNextSibling(); sibling != null; sibling = sibling.getNextSibling())
			{
				CstNode statement = findStatement(sibling);
				if (statement != null)
				{
					return Optional.of(statement);
				}
			}
			current = current.getParent();
		}
		return Optional.empty();
	}

	@Override
	public String getName()
	{
		return "SkipToNextStatement";
	}

	public static boolean isStatement(CstNode node)
	{
		return STATEMENT_TYPES.contains(node.getType());
	}

	private static CstNode enclosingStatement(CstNode errorNode)
	{
		for (CstNode node = errorNode; node != null; node = node.getParent())
		{
			if (isStatement(node))
			{
				return node;
			}
		}
		return errorNode;
	}

	/**
	 * {@code node} itself when it is a clean statement, else the first clean statement below it.
	 */
	private static CstNode findStatement(CstNode node)
	{
		if (isStatement(node) && !node.hasError())
		{
			return node;
		}
		for (CstNode child : node.getChildren())
		{
			CstNode found = findStatement(child);
			if (found != null)
			{
				return found;
			}
		}
		return null;
	}
}
