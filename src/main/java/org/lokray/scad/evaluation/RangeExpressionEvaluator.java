package org.lokray.scad.evaluation;

import org.lokray.scad.cst.CstNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Expands {@code [start:end]} and {@code [start:step:end]} into a vector of numbers.
 */
public class RangeExpressionEvaluator implements ExpressionEvaluator
{
	private static final Set<String> TYPES = Set.of("range_expression");

	private final ExpressionEvaluatorRegistry registry;

	public RangeExpressionEvaluator(ExpressionEvaluatorRegistry registry)
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
		EvaluationResult start = registry.evaluate(node.getChildForFieldName("start"), context);
		CstNode stepNode = node.getChildForFieldName("step");
		EvaluationResult step = stepNode == null ? EvaluationResult.number(1) : registry.evaluate(stepNode, context);
		EvaluationResult end = registry.evaluate(node.getChildForFieldName("end"), context);
		return expand(start, step, end, context);
	}

	/**
	 * Shared with the bracket-literal fallback. A zero step or a result above
	 * {@code maxRangeElements} yields undef; a step pointing away from {@code end} yields an empty vector.
	 */
	public static EvaluationResult expand(EvaluationResult start, EvaluationResult step, EvaluationResult end, EvaluationContext context)
	{
		if (!start.isNumber() || !step.isNumber() || !end.isNumber())
		{
			context.addWarning("Range bounds must be numbers");
			return EvaluationResult.undef();
		}
		double from = Coercions.toNumber(start);
		double by = Coercions.toNumber(step);
		double to = Coercions.toNumber(end);
		if (by == 0 || Double.isNaN(by) || Double.isNaN(from) || Double.isNaN(to))
		{
			context.addWarning("Range step must be a non-zero number");
			return EvaluationResult.undef();
		}

		double count = Math.floor((to - from) / by) + 1;
		if (count <= 0)
		{
			return EvaluationResult.vector(List.of());
		}
		int limit = context.getConfig().getMaxRangeElements();
		if (count > limit)
		{
			context.addWarning("Range [" + Coercions.formatNumber(from) + ":" + Coercions.formatNumber(by) + ":"
					+ Coercions.formatNumber(to) + "] exceeds " + limit + " elements");
			return EvaluationResult.undef();
		}

		List<EvaluationResult> values = new ArrayList<>((int) count);
		for (int i = 0; i < (int) count; i++)
		{
			values.add(EvaluationResult.number(from + i * by));
		}
		return EvaluationResult.vector(values);
	}

	@Override
	public int getPriority()
	{
		return 70;
	}
}
