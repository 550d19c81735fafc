package org.lokray.scad.builder.extractor;

import org.lokray.scad.ast.LocationMapper;
import org.lokray.scad.ast.Parameter;
import org.lokray.scad.ast.expression.ExpressionNode;
import org.lokray.scad.builder.BuildContext;
import org.lokray.scad.cst.CstNode;
import org.lokray.scad.evaluation.FunctionCallEvaluator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the arguments of a call in source order.
 */
public final class ArgumentExtractor
{
	private ArgumentExtractor()
	{
	}

	public static List<Parameter> extract(CstNode argumentList, BuildContext context)
	{
		List<Parameter> parameters = new ArrayList<>();
		for (CstNode argument : FunctionCallEvaluator.argumentNodes(argumentList))
		{
			CstNode nameNode = argument.getChildForFieldName("name");
			CstNode valueNode = argument.getChildForFieldName("value");
			String name = nameNode == null || nameNode.isMissing() ? null : nameNode.getText();
			ExpressionNode expression = context.getExpressions().build(valueNode, argument);
			parameters.add(new Parameter(name, ValueExtractor.extract(valueNode, context).orElse(null), expression,
					LocationMapper.map(argument)));
		}
		return parameters;
	}

	/**
	 * Matches arguments to declared parameter names: named ones by name, positional ones in declaration
	 * order to whichever names are still free. Special variables pass through under their own name.
	 * Positional arguments beyond the declared names are dropped.
	 */
	public static Map<String, Parameter> resolve(List<Parameter> parameters, List<String> declaredOrder)
	{
		Map<String, Parameter> resolved = new LinkedHashMap<>();
		for (Parameter parameter : parameters)
		{
			if (!parameter.isPositional())
			{
				resolved.put(parameter.getName(), parameter);
			}
		}
		int next = 0;
		for (Parameter parameter : parameters)
		{
			if (!parameter.isPositional())
			{
				continue;
			}
			while (next < declaredOrder.size() && resolved.containsKey(declaredOrder.get(next)))
			{
				next++;
			}
			if (next >= declaredOrder.size())
			{
				break;
			}
			resolved.put(declaredOrder.get(next++), parameter);
		}
		return resolved;
	}
}
