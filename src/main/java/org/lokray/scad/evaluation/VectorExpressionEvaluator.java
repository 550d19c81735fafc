package org.lokray.scad.evaluation;

import org.lokray.scad.cst.CstNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Vector literals and list comprehensions. Comprehension elements ({@code for}, {@code if},
 * {@code each}, {@code let}) may contribute zero or more values to the enclosing vector.
 */
public class VectorExpressionEvaluator implements ExpressionEvaluator
{
	private static final Set<String> TYPES = Set.of("vector_expression", "list_comprehension");

	private final ExpressionEvaluatorRegistry registry;

	public VectorExpressionEvaluator(ExpressionEvaluatorRegistry registry)
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
		List<EvaluationResult> values = new ArrayList<>();
		for (CstNode element : node.getNamedChildren())
		{
			collect(element, context, values);
		}
		return EvaluationResult.vector(values);
	}

	private void collect(CstNode element, EvaluationContext context, List<EvaluationResult> out)
	{
		switch (element.getType())
		{
			case "list_comprehension_for" -> collectFor(element, element.getChildrenForFieldName("header"), 0, context, out);
			case "list_comprehension_if" ->
			{
				EvaluationResult condition = registry.evaluate(element.getChildForFieldName("condition"), context);
				CstNode branch = element.getChildForFieldName(Coercions.toBoolean(condition) ? "consequence" : "alternative");
				if (branch != null)
				{
					collect(branch, context, out);
				}
			}
			case "each_expression" ->
			{
				EvaluationResult value = registry.evaluate(element.getChildForFieldName("value"), context);
				if (value.isVector())
				{
					out.addAll(value.asVector());
				}
				else
				{
					out.add(value);
				}
			}
			case "let_comprehension" ->
			{
				context.pushScope();
				try
				{
					LetExpressionEvaluator.bindAssignments(registry, element.getChildForFieldName("assignments"), context);
					collect(element.getChildForFieldName("body"), context, out);
				}
				finally
				{
					context.popScope();
				}
			}
			case CstNode.ERROR -> context.addWarning("Skipping malformed vector element '" + element.getText() + "'");
			default -> out.add(registry.evaluate(element, context));
		}
	}

	private void collectFor(CstNode element, List<CstNode> headers, int index, EvaluationContext context, List<EvaluationResult> out)
	{
		if (index == headers.size())
		{
			CstNode body = element.getChildForFieldName("body");
			if (body != null)
			{
				collect(body, context, out);
			}
			return;
		}
		CstNode header = headers.get(index);
		CstNode iterator = header.getChildForFieldName("iterator");
		EvaluationResult range = registry.evaluate(header.getChildForFieldName("range"), context);
		if (iterator == null || range.isUndef())
		{
			return;
		}
		List<EvaluationResult> items = range.isVector() ? range.asVector() : List.of(range);
		for (EvaluationResult item : items)
		{
			context.pushScope();
			try
			{
				context.setVariable(iterator.getText(), item);
				collectFor(element, headers, index + 1, context, out);
			}
			finally
			{
				context.popScope();
			}
		}
	}

	@Override
	public int getPriority()
	{
		return 70;
	}
}
