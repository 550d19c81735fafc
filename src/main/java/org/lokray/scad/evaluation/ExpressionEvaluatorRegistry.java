package org.lokray.scad.evaluation;

import org.lokray.scad.cst.CstNode;
import org.lokray.scad.cst.CstParser;
import org.lokray.scad.util.Debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Priority-ordered set of evaluators. Every nested evaluation goes back through {@link #evaluate},
 * which owns the memo lookup and the recursion guard, and never throws.
 */
public class ExpressionEvaluatorRegistry
{
	private final List<ExpressionEvaluator> evaluators = new ArrayList<>();
	private final Map<String, List<ExpressionEvaluator>> candidatesByType = new HashMap<>();

	public static ExpressionEvaluatorRegistry createDefault()
	{
		ExpressionEvaluatorRegistry registry = new ExpressionEvaluatorRegistry();
		registry.register(new LiteralEvaluator());
		registry.register(new IdentifierEvaluator());
		registry.register(new RangeLiteralShimEvaluator(registry, new CstParser()));
		registry.register(new BinaryExpressionEvaluator(registry));
		registry.register(new UnaryExpressionEvaluator(registry));
		registry.register(new ParenthesizedExpressionEvaluator(registry));
		registry.register(new ConditionalExpressionEvaluator(registry));
		registry.register(new AccessorExpressionEvaluator(registry));
		registry.register(new LetExpressionEvaluator(registry));
		registry.register(new VectorExpressionEvaluator(registry));
		registry.register(new RangeExpressionEvaluator(registry));
		registry.register(new FunctionCallEvaluator(registry));
		return registry;
	}

	public void register(ExpressionEvaluator evaluator)
	{
		evaluators.add(evaluator);
		// Stable sort keeps registration order among equal priorities
		evaluators.sort(Comparator.comparingInt(ExpressionEvaluator::getPriority).reversed());
		candidatesByType.clear();
	}

	public List<ExpressionEvaluator> getEvaluators()
	{
		return Collections.unmodifiableList(evaluators);
	}

	public Optional<ExpressionEvaluator> findEvaluator(CstNode node)
	{
		List<ExpressionEvaluator> candidates = candidatesByType.computeIfAbsent(node.getType(),
				type -> evaluators.stream().filter(e -> e.getSupportedTypes().contains(type)).toList());
		for (ExpressionEvaluator evaluator : candidates)
		{
			if (evaluator.canEvaluate(node))
			{
				return Optional.of(evaluator);
			}
		}
		return Optional.empty();
	}

	public EvaluationResult evaluate(CstNode node, EvaluationContext context)
	{
		if (node == null)
		{
			return EvaluationResult.undef();
		}
		if (!context.enter())
		{
			String warning = "Maximum recursion depth " + context.getConfig().getMaxRecursionDepth()
					+ " exceeded while evaluating " + node.getType();
			Debug.logWarning(warning);
			context.addWarning(warning);
			return EvaluationResult.undef();
		}

		try
		{
			String key = EvaluationContext.cacheKey(node);
			Optional<EvaluationResult> cached = context.getCached(key);
			if (cached.isPresent())
			{
				return cached.get();
			}

			Optional<ExpressionEvaluator> evaluator = findEvaluator(node);
			if (evaluator.isEmpty())
			{
				String warning = "No evaluator for node type '" + node.getType() + "'";
				Debug.logWarning(warning);
				context.addWarning(warning);
				return EvaluationResult.undef();
			}

			EvaluationResult result = evaluator.get().evaluate(node, context);
			if (result == null)
			{
				result = EvaluationResult.undef();
			}
			context.cache(key, result);
			return result;
		}
		catch (RuntimeException e)
		{
			String warning = "Evaluation of '" + node.getType() + "' failed: " + e.getMessage();
			Debug.logWarning(warning);
			context.addWarning(warning);
			return EvaluationResult.undef();
		}
		finally
		{
			context.exit();
		}
	}
}
