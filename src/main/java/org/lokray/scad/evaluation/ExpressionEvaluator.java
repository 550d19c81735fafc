package org.lokray.scad.evaluation;

import org.lokray.scad.cst.CstNode;

import java.util.Set;

/**
 * Evaluates one family of CST expression nodes. Evaluators are stateless; anything that changes
 * during an evaluation pass lives in the {@link EvaluationContext}.
 */
public interface ExpressionEvaluator
{
	/**
	 * CST node types this evaluator may be asked about.
	 */
	Set<String> getSupportedTypes();

	default boolean canEvaluate(CstNode node)
	{
		return getSupportedTypes().contains(node.getType());
	}

	EvaluationResult evaluate(CstNode node, EvaluationContext context);

	/**
	 * Higher wins when several evaluators accept the same node.
	 */
	int getPriority();
}
