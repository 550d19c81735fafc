package org.lokray.scad.evaluation;

import org.lokray.scad.cst.CstNode;
import org.lokray.scad.cst.CstParseResult;
import org.lokray.scad.cst.CstParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Handles bracket literals that reached the evaluator as a {@code vector_expression} although their text
 * is really a range, e.g. trees assembled after error recovery. Each colon-separated segment is
 * reparsed as an expression and evaluated normally, so {@code [a+1:b*2:c]} works like a range.
 */
public class RangeLiteralShimEvaluator implements ExpressionEvaluator
{
	private static final Set<String> TYPES = Set.of("vector_expression");

	private final ExpressionEvaluatorRegistry registry;
	private final CstParser parser;

	public RangeLiteralShimEvaluator(ExpressionEvaluatorRegistry registry, CstParser parser)
	{
		this.registry = registry;
		this.parser = parser;
	}

	@Override
	public Set<String> getSupportedTypes()
	{
		return TYPES;
	}

	@Override
	public boolean canEvaluate(CstNode node)
	{
		String text = node.getText().trim();
		if (!TYPES.contains(node.getType()) || !text.startsWith("[") || !text.endsWith("]"))
		{
			return false;
		}
		int segments = splitTopLevel(text.substring(1, text.length() - 1)).size();
		return segments == 2 || segments == 3;
	}

	@Override
	public EvaluationResult evaluate(CstNode node, EvaluationContext context)
	{
		String text = node.getText().trim();
		List<String> segments = splitTopLevel(text.substring(1, text.length() - 1));
		List<EvaluationResult> values = new ArrayList<>();
		for (String segment : segments)
		{
			CstParseResult parsed = parser.parseExpression(segment.trim());
			if (parsed.hasErrors() || parsed.getRoot() == null)
			{
				context.addWarning("Cannot parse range segment '" + segment.trim() + "'");
				return EvaluationResult.undef();
			}
			values.add(registry.evaluate(parsed.getRoot(), context));
		}

		if (values.size() == 2)
		{
			return RangeExpressionEvaluator.expand(values.get(0), EvaluationResult.number(1), values.get(1), context);
		}
		return RangeExpressionEvaluator.expand(values.get(0), values.get(1), values.get(2), context);
	}

	/**
	 * Splits on colons that are outside strings, brackets and the {@code ?:} of a conditional.
	 */
	static List<String> splitTopLevel(String text)
	{
		List<String> parts = new ArrayList<>();
		int depth = 0;
		int pendingTernaries = 0;
		boolean inString = false;
		int segmentStart = 0;
		for (int i = 0; i < text.length(); i++)
		{
			char c = text.charAt(i);
			if (inString)
			{
				if (c == '\\')
				{
					i++;
				}
				else if (c == '"')
				{
					inString = false;
				}
				continue;
			}
			switch (c)
			{
				case '"' -> inString = true;
				case '(', '[', '{' -> depth++;
				case ')', ']', '}' -> depth--;
				case '?' ->
				{
					if (depth == 0)
					{
						pendingTernaries++;
					}
				}
				case ':' ->
				{
					if (depth == 0)
					{
						if (pendingTernaries > 0)
						{
							pendingTernaries--;
						}
						else
						{
							parts.add(text.substring(segmentStart, i));
							segmentStart = i + 1;
						}
					}
				}
				default ->
				{
				}
			}
		}
		parts.add(text.substring(segmentStart));
		return parts;
	}

	@Override
	public int getPriority()
	{
		return 85;
	}
}
