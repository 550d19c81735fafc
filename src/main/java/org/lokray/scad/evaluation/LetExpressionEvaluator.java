package org.lokray.scad.evaluation;

import org.lokray.scad.cst.CstNode;

import java.util.Set;

/**
 * {@code let (a = 1, b = a + 1) body}. Assignments are sequential, so later ones see earlier ones.
 */
public class LetExpressionEvaluator implements ExpressionEvaluator
{
	private static final Set<String> TYPES = Set.of("let_expression");

	private final ExpressionEvaluatorRegistry registry;

	public LetExpressionEvaluator(ExpressionEvaluatorRegistry registry)
	{
		this.registry = registry;
	}

	@Override
	public Set<String> getSupportedTypes()
	{
		return TYPES;
	}

	@Override
	public EvaluationResult evaluate(CstNode node, EvaluationContext context)
	{
		context.pushScope();
		try
		{
			bindAssignments(registry, node.getChildForFieldName("assignments"), context);
			return registry.evaluate(node.getChildForFieldName("body"), context);
		}
		finally
		{
			context.popScope();
		}
	}

	/**
	 * Binds every {@code let_assignment} below {@code assignments} in the current scope.
	 */
	static void bindAssignments(ExpressionEvaluatorRegistry registry, CstNode assignments, EvaluationContext context)
	{
		if (assignments == null)
		{
			return;
		}
		for (CstNode assignment : assignments.getNamedChildren())
		{
			CstNode name = assignment.getChildForFieldName("name");
			if (!"let_assignment".equals(assignment.getType()) || name == null)
			{
				continue;
			}
			context.setVariable(name.getText(), registry.evaluate(assignment.getChildForFieldName("value"), context));
		}
	}

	@Override
	public int getPriority()
	{
		return 80;
	}
}
