package org.lokray.scad.evaluation;

import org.lokray.scad.cst.CstNode;

import java.util.Set;

public class ParenthesizedExpressionEvaluator implements ExpressionEvaluator
{
	private static final Set<String> TYPES = Set.of("parenthesized_expression");

	private final ExpressionEvaluatorRegistry registry;

	public ParenthesizedExpressionEvaluator(ExpressionEvaluatorRegistry registry)
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
		return registry.evaluate(node.getChildForFieldName("expression"), context);
	}

	@Override
	public int getPriority()
	{
		return 80;
	}
}
