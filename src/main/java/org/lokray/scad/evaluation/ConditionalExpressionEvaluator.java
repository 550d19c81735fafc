package org.lokray.scad.evaluation;

import org.lokray.scad.cst.CstNode;

import java.util.Set;

/**
 * {@code cond ? a : b}. Only the selected branch is evaluated.
 */
public class ConditionalExpressionEvaluator implements ExpressionEvaluator
{
	private static final Set<String> TYPES = Set.of("conditional_expression");

	private final ExpressionEvaluatorRegistry registry;

	public ConditionalExpressionEvaluator(ExpressionEvaluatorRegistry registry)
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
		EvaluationResult condition = registry.evaluate(node.getChildForFieldName("condition"), context);
		String branch = Coercions.toBoolean(condition) ? "consequence" : "alternative";
		return registry.evaluate(node.getChildForFieldName(branch), context);
	}

	@Override
	public int getPriority()
	{
		return 80;
	}
}
