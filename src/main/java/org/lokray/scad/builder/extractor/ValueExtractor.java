package org.lokray.scad.builder.extractor;

import org.lokray.scad.ast.Parameter;
import org.lokray.scad.builder.BuildContext;
import org.lokray.scad.cst.CstNode;
import org.lokray.scad.evaluation.EvaluationContext;
import org.lokray.scad.evaluation.EvaluationResult;

import java.util.Optional;

/**
 * Folds expressions to native values where that needs nothing but literals and builtins.
 * Anything touching a variable or a user function stays an expression.
 */
public final class ValueExtractor
{
	private ValueExtractor()
	{
	}

	public static Optional<EvaluationResult> extract(CstNode node, BuildContext context)
	{
		if (node == null || node.hasError())
		{
			return Optional.empty();
		}
		// A fresh context per expression keeps folding independent of surrounding statements
		EvaluationContext evaluation = new EvaluationContext(context.getConfig());
		EvaluationResult result = context.getEvaluators().evaluate(node, evaluation);
		return evaluation.getWarnings().isEmpty() ? Optional.of(result) : Optional.empty();
	}

	public static Optional<Double> number(Parameter parameter)
	{
		return parameter == null ? Optional.empty() : parameter.getValue().flatMap(EvaluationResult::asNumber);
	}

	public static Optional<Boolean> bool(Parameter parameter)
	{
		return parameter == null ? Optional.empty() : parameter.getValue().flatMap(EvaluationResult::asBoolean);
	}

	public static Optional<String> string(Parameter parameter)
	{
		return parameter == null ? Optional.empty() : parameter.getValue().flatMap(EvaluationResult::asString);
	}

	public static Optional<double[]> numberVector(Parameter parameter)
	{
		return parameter == null ? Optional.empty() : parameter.getValue().flatMap(EvaluationResult::asNumberVector);
	}
}
