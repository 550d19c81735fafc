package org.lokray.scad.evaluation;

import org.lokray.scad.cst.CstNode;

import java.util.Set;

public class LiteralEvaluator implements ExpressionEvaluator
{
	private static final Set<String> TYPES = Set.of("number", "string", "boolean", "true", "false", "undef");

	@Override
	public Set<String> getSupportedTypes()
	{
		return TYPES;
	}

	@Override
	public boolean canEvaluate(CstNode node)
	{
		return TYPES.contains(node.getType()) && !node.isMissing();
	}

	@Override
	public EvaluationResult evaluate(CstNode node, EvaluationContext context)
	{
		return valueOf(node);
	}

	/**
	 * The value of a literal; anything that is not a literal reads as undef. A literal the parser
	 * had to repair keeps the value of its surviving token.
	 */
	public static EvaluationResult valueOf(CstNode node)
	{
		CstNode token = literalToken(node);
		if (token == null)
		{
			return EvaluationResult.undef();
		}
		String text = token.getText();
		return switch (node.getType())
		{
			case "number" -> EvaluationResult.number(Coercions.parseFloat(text));
			case "string" -> EvaluationResult.string(unescape(text));
			case "boolean", "true", "false" -> EvaluationResult.bool("true".equals(text));
			default -> EvaluationResult.undef();
		};
	}

	private static CstNode literalToken(CstNode node)
	{
		if (node.isError() || node.isMissing())
		{
			return null;
		}
		if (node.getChildCount() == 0)
		{
			return node;
		}
		for (CstNode child : node.getChildren())
		{
			CstNode token = literalToken(child);
			if (token != null)
			{
				return token;
			}
		}
		return null;
	}

	@Override
	public int getPriority()
	{
		return 100;
	}

	/**
	 * Strips the quotes of a string token and resolves its escapes.
	 */
	public static String unescape(String token)
	{
		String body = token.length() >= 2 && token.startsWith("\"") && token.endsWith("\"")
				? token.substring(1, token.length() - 1)
				: token;
		StringBuilder sb = new StringBuilder(body.length());
		for (int i = 0; i < body.length(); i++)
		{
			char c = body.charAt(i);
			if (c != '\\' || i + 1 >= body.length())
			{
				sb.append(c);
				continue;
			}
			char next = body.charAt(++i);
			switch (next)
			{
				case 'n' -> sb.append('\n');
				case 't' -> sb.append('\t');
				case 'r' -> sb.append('\r');
				case '"' -> sb.append('"');
				case '\\' -> sb.append('\\');
				default -> sb.append('\\').append(next);
			}
		}
		return sb.toString();
	}
}
