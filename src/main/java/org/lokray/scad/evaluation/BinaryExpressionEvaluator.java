package org.lokray.scad.evaluation;

import org.lokray.scad.cst.CstNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.DoubleBinaryOperator;

/**
 * Arithmetic, comparison and logical operators. Operands are evaluated through the registry,
 * so any expression kind may appear on either side.
 */
public class BinaryExpressionEvaluator implements ExpressionEvaluator
{
	private static final Set<String> TYPES = Set.of("binary_expression");

	private final ExpressionEvaluatorRegistry registry;

	public BinaryExpressionEvaluator(ExpressionEvaluatorRegistry registry)
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
		CstNode leftNode = node.getChildForFieldName("left");
		CstNode rightNode = node.getChildForFieldName("right");
		if (operatorNode == null || leftNode == null || rightNode == null)
		{
			context.addWarning("Incomplete binary expression '" + node.getText() + "'");
			return EvaluationResult.undef();
		}
		String operator = operatorNode.getText();

		EvaluationResult left = registry.evaluate(leftNode, context);
		if (left.isUndef())
		{
			return EvaluationResult.undef();
		}

		// && and || short-circuit like OpenSCAD does
		if ("&&".equals(operator) && !Coercions.toBoolean(left))
		{
			return EvaluationResult.bool(false);
		}
		if ("||".equals(operator) && Coercions.toBoolean(left))
		{
			return EvaluationResult.bool(true);
		}

		EvaluationResult right = registry.evaluate(rightNode, context);
		if (right.isUndef())
		{
			return EvaluationResult.undef();
		}
		return apply(operator, left, right, context);
	}

	public static EvaluationResult apply(String operator, EvaluationResult left, EvaluationResult right, EvaluationContext context)
	{
		return switch (operator)
		{
			case "+" -> add(left, right);
			case "-" -> arithmetic(left, right, (a, b) -> a - b);
			case "*" -> multiply(left, right);
			case "/" -> arithmetic(left, right, (a, b) -> a / b);
			case "%" -> arithmetic(left, right, (a, b) -> a % b);
			case "^" -> EvaluationResult.number(Math.pow(Coercions.toNumber(left), Coercions.toNumber(right)));
			case "==" -> EvaluationResult.bool(Coercions.valuesEqual(left, right));
			case "!=" -> EvaluationResult.bool(!Coercions.valuesEqual(left, right));
			case "<" -> EvaluationResult.bool(Coercions.toNumber(left) < Coercions.toNumber(right));
			case "<=" -> EvaluationResult.bool(Coercions.toNumber(left) <= Coercions.toNumber(right));
			case ">" -> EvaluationResult.bool(Coercions.toNumber(left) > Coercions.toNumber(right));
			case ">=" -> EvaluationResult.bool(Coercions.toNumber(left) >= Coercions.toNumber(right));
			case "&&" -> EvaluationResult.bool(Coercions.toBoolean(left) && Coercions.toBoolean(right));
			case "||" -> EvaluationResult.bool(Coercions.toBoolean(left) || Coercions.toBoolean(right));
			default ->
			{
				context.addWarning("Unknown binary operator '" + operator + "'");
				yield EvaluationResult.undef();
			}
		};
	}

	private static EvaluationResult add(EvaluationResult left, EvaluationResult right)
	{
		if (left.isString() || right.isString())
		{
			return EvaluationResult.string(Coercions.toDisplayString(left) + Coercions.toDisplayString(right));
		}
		return arithmetic(left, right, Double::sum);
	}

	private static EvaluationResult multiply(EvaluationResult left, EvaluationResult right)
	{
		if (left.isVector() && right.isNumber())
		{
			return scale(left, Coercions.toNumber(right));
		}
		if (left.isNumber() && right.isVector())
		{
			return scale(right, Coercions.toNumber(left));
		}
		return arithmetic(left, right, (a, b) -> a * b);
	}

	/**
	 * Vectors of equal length combine element-wise; a vector mixed with a scalar is undef.
	 */
	private static EvaluationResult arithmetic(EvaluationResult left, EvaluationResult right, DoubleBinaryOperator op)
	{
		if (left.isVector() || right.isVector())
		{
			if (!left.isVector() || !right.isVector() || left.asVector().size() != right.asVector().size())
			{
				return EvaluationResult.undef();
			}
			List<EvaluationResult> a = left.asVector();
			List<EvaluationResult> b = right.asVector();
			List<EvaluationResult> result = new ArrayList<>(a.size());
			for (int i = 0; i < a.size(); i++)
			{
				result.add(arithmetic(a.get(i), b.get(i), op));
			}
			return EvaluationResult.vector(result);
		}
		if (left.isUndef() || right.isUndef())
		{
			return EvaluationResult.undef();
		}
		return EvaluationResult.number(op.applyAsDouble(Coercions.toNumber(left), Coercions.toNumber(right)));
	}

	private static EvaluationResult scale(EvaluationResult vector, double factor)
	{
		List<EvaluationResult> result = new ArrayList<>();
		for (EvaluationResult element : vector.asVector())
		{
			result.add(element.isVector() ? scale(element, factor) : arithmetic(element, EvaluationResult.number(factor), (a, b) -> a * b));
		}
		return EvaluationResult.vector(result);
	}

	@Override
	public int getPriority()
	{
		return 80;
	}
}
