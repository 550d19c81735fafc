package org.lokray.scad.evaluation;

import org.lokray.scad.cst.CstNode;

import java.util.Set;

public class UnaryExpressionEvaluator implements ExpressionEvaluator
{
	private static final Set<String> TYPES = Set.of("unary_expression");

	private final ExpressionEvaluatorRegistry registry;

	public UnaryExpressionEvaluator(ExpressionEvaluatorRegistry registry)
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
		CstNode operatorNode = node.getChildForFieldName("operator");
		EvaluationResult operand = registry.evaluate(node.getChildForFieldName("operand"), context);
		if (operatorNode == null || operand.isUndef())
		{
			return EvaluationResult.undef();
		}
		return switch (operatorNode.getText())
		{
			case "-" -> negate(operand);
			case "+" -> operand.isVector() ? operand : EvaluationResult.number(Coercions.toNumber(operand));
			case "!" -> EvaluationResult.bool(!Coercions.toBoolean(operand));
			default ->
			{
				context.addWarning("Unknown unary operator '" + operatorNode.getText() + "'");
				yield EvaluationResult.undef();
			}
		};
	}

	private static EvaluationResult negate(EvaluationResult value)
	{
		if (value.isVector())
		{
			return EvaluationResult.vector(value.asVector().stream().map(UnaryExpressionEvaluator::negate).toList());
		}
		if (value.isUndef())
		{
			return value;
		}
		return EvaluationResult.number(-Coercions.toNumber(value));
	}

	@Override
	public int getPriority()
	{
		return 80;
	}
}
