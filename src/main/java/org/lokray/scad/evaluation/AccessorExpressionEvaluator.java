package org.lokray.scad.evaluation;

import org.lokray.scad.cst.CstNode;

import java.util.List;
import java.util.Set;

/**
 * Vector and string indexing ({@code v[i]}) and the {@code .x}, {@code .y}, {@code .z} swizzles.
 * Anything out of range is undef.
 */
public class AccessorExpressionEvaluator implements ExpressionEvaluator
{
	private static final Set<String> TYPES = Set.of("index_expression", "member_expression");

	private final ExpressionEvaluatorRegistry registry;

	public AccessorExpressionEvaluator(ExpressionEvaluatorRegistry registry)
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
		if ("member_expression".equals(node.getType()))
		{
			EvaluationResult object = registry.evaluate(node.getChildForFieldName("object"), context);
			CstNode property = node.getChildForFieldName("property");
			if (property == null)
			{
				return EvaluationResult.undef();
			}
			int index = switch (property.getText())
			{
				case "x" -> 0;
				case "y" -> 1;
				case "z" -> 2;
				default -> -1;
			};
			return elementAt(object, index);
		}

		EvaluationResult array = registry.evaluate(node.getChildForFieldName("array"), context);
		EvaluationResult index = registry.evaluate(node.getChildForFieldName("index"), context);
		if (!index.isNumber())
		{
			return EvaluationResult.undef();
		}
		return elementAt(array, (int) Math.floor(Coercions.toNumber(index)));
	}

	private static EvaluationResult elementAt(EvaluationResult value, int index)
	{
		if (index < 0)
		{
			return EvaluationResult.undef();
		}
		if (value.isVector())
		{
			List<EvaluationResult> elements = value.asVector();
			return index < elements.size() ? elements.get(index) : EvaluationResult.undef();
		}
		if (value.isString())
		{
			String text = value.asString().orElse("");
			return index < text.length() ? EvaluationResult.string(String.valueOf(text.charAt(index))) : EvaluationResult.undef();
		}
		return EvaluationResult.undef();
	}

	@Override
	public int getPriority()
	{
		return 80;
	}
}
