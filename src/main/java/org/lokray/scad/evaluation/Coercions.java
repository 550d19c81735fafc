package org.lokray.scad.evaluation;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversions between OpenSCAD value types used by the operators and builtin functions.
 */
public final class Coercions
{
	private static final Pattern LEADING_NUMBER = Pattern.compile("[+-]?(Infinity|(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?)");

	private Coercions()
	{
	}

	/**
	 * booleans become 0/1, numeric strings are parsed, anything else is 0.
	 */
	public static double toNumber(EvaluationResult result)
	{
		return switch (result.getType())
		{
			case NUMBER -> (Double) result.getValue();
			case BOOLEAN -> (Boolean) result.getValue() ? 1 : 0;
			case STRING -> parseFloat((String) result.getValue());
			default -> 0;
		};
	}

	/**
	 * numbers are true when non-zero, strings and vectors when non-empty, undef is false.
	 */
	public static boolean toBoolean(EvaluationResult result)
	{
		return switch (result.getType())
		{
			case BOOLEAN -> (Boolean) result.getValue();
			case NUMBER -> (Double) result.getValue() != 0;
			case STRING -> !((String) result.getValue()).isEmpty();
			case VECTOR -> !result.asVector().isEmpty();
			case UNDEF -> false;
		};
	}

	public static boolean valuesEqual(EvaluationResult left, EvaluationResult right)
	{
		if (left.getType() != right.getType())
		{
			return false;
		}
		if (left.isNumber())
		{
			return toNumber(left) == toNumber(right);
		}
		if (left.isVector())
		{
			List<EvaluationResult> a = left.asVector();
			List<EvaluationResult> b = right.asVector();
			if (a.size() != b.size())
			{
				return false;
			}
			for (int i = 0; i < a.size(); i++)
			{
				if (!valuesEqual(a.get(i), b.get(i)))
				{
					return false;
				}
			}
			return true;
		}
		return left.equals(right);
	}

	public static String toDisplayString(EvaluationResult result)
	{
		return switch (result.getType())
		{
			case NUMBER -> formatNumber((Double) result.getValue());
			case STRING -> (String) result.getValue();
			case BOOLEAN -> result.getValue().toString();
			case UNDEF -> "undef";
			case VECTOR -> vectorToString(result.asVector());
		};
	}

	public static String formatNumber(double value)
	{
		if (Double.isNaN(value))
		{
			return "nan";
		}
		if (Double.isInfinite(value))
		{
			return value > 0 ? "inf" : "-inf";
		}
		if (value == Math.rint(value) && Math.abs(value) < 1e15)
		{
			return Long.toString((long) value);
		}
		return Double.toString(value);
	}

	private static String vectorToString(List<EvaluationResult> elements)
	{
		StringBuilder sb = new StringBuilder("[");
		for (int i = 0; i < elements.size(); i++)
		{
			if (i > 0)
			{
				sb.append(", ");
			}
			EvaluationResult element = elements.get(i);
			if (element.isString())
			{
				sb.append('"').append(element.getValue()).append('"');
			}
			else
			{
				sb.append(toDisplayString(element));
			}
		}
		return sb.append(']').toString();
	}

	/**
	 * Reads the longest leading decimal number of {@code text} after any leading whitespace, the way
	 * script engines coerce strings. No leading number gives 0.
	 */
	public static double parseFloat(String text)
	{
		Matcher m = LEADING_NUMBER.matcher(text.stripLeading());
		return m.lookingAt() ? Double.parseDouble(m.group()) : 0;
	}
}
