package org.lokray.scad.evaluation;

import org.lokray.scad.cst.CstNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Calls to builtin functions. Named arguments are passed positionally in source order;
 * user-defined functions are not evaluated and yield undef.
 */
public class FunctionCallEvaluator implements ExpressionEvaluator
{
	private static final Set<String> TYPES = Set.of("call_expression");

	private final ExpressionEvaluatorRegistry registry;

	public FunctionCallEvaluator(ExpressionEvaluatorRegistry registry)
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
		CstNode function = node.getChildForFieldName("function");
		if (function == null || !"identifier".equals(function.getType()))
		{
			context.addWarning("Unsupported call target in '" + node.getText() + "'");
			return EvaluationResult.undef();
		}
		String name = function.getText();
		var builtin = context.getFunction(name);
		if (builtin.isEmpty())
		{
			context.addWarning("Unknown function '" + name + "'");
			return EvaluationResult.undef();
		}

		List<EvaluationResult> arguments = new ArrayList<>();
		for (CstNode argument : argumentNodes(node.getChildForFieldName("arguments")))
		{
			arguments.add(registry.evaluate(argument.getChildForFieldName("value"), context));
		}
		return builtin.get().apply(arguments);
	}

	/**
	 * The {@code argument} nodes of an {@code argument_list}, in order.
	 */
	public static List<CstNode> argumentNodes(CstNode argumentList)
	{
		if (argumentList == null)
		{
			return List.of();
		}
		List<CstNode> result = new ArrayList<>();
		for (CstNode child : argumentList.getNamedChildren())
		{
			if ("arguments".equals(child.getType()))
			{
				child.getNamedChildren().stream().filter(a -> "argument".equals(a.getType())).forEach(result::add);
			}
			else if ("argument".equals(child.getType()))
			{
				result.add(child);
			}
		}
		return result;
	}

	@Override
	public int getPriority()
	{
		return 60;
	}
}
