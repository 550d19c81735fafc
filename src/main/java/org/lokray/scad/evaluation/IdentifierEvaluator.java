package org.lokray.scad.evaluation;

import org.lokray.scad.cst.CstNode;

import java.util.Set;

public class IdentifierEvaluator implements ExpressionEvaluator
{
	private static final Set<String> TYPES = Set.of("identifier", "special_variable");

	@Override
	public Set<String> getSupportedTypes()
	{
		return TYPES;
	}

	@Override
	public EvaluationResult evaluate(CstNode node, EvaluationContext context)
	{
		String name = node.getText();
		return context.getVariable(name).orElseGet(() ->
		{
			context.addWarning("Undefined variable '" + name + "'");
			return EvaluationResult.undef();
		});
	}

	@Override
	public int getPriority()
	{
		return 90;
	}
}
