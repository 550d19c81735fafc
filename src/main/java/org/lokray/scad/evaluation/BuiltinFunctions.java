package org.lokray.scad.evaluation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * The math and vector functions OpenSCAD provides out of the box. Trigonometry works in degrees.
 */
public final class BuiltinFunctions
{
	private static final Map<String, BuiltinFunction> DEFAULTS = createDefaults();

	private BuiltinFunctions()
	{
	}

	public static Map<String, BuiltinFunction> defaults()
	{
		return DEFAULTS;
	}

	private static Map<String, BuiltinFunction> createDefaults()
	{
		Map<String, BuiltinFunction> functions = new HashMap<>();
		functions.put("abs", unary(Math::abs));
		functions.put("sign", unary(Math::signum));
		functions.put("floor", unary(Math::floor));
		functions.put("ceil", unary(Math::ceil));
		functions.put("round", unary(v -> v < 0 ? -Math.round(-v) : Math.round(v)));
		functions.put("sqrt", unary(Math::sqrt));
		functions.put("exp", unary(Math::exp));
		functions.put("ln", unary(Math::log));
		functions.put("log", args -> args.size() == 2
				? binaryNumbers(args, (base, x) -> Math.log(x) / Math.log(base))
				: unary(Math::log10).apply(args));
		functions.put("pow", args -> binaryNumbers(args, Math::pow));
		functions.put("sin", unary(v -> Math.sin(Math.toRadians(v))));
		functions.put("cos", unary(v -> Math.cos(Math.toRadians(v))));
		functions.put("tan", unary(v -> Math.tan(Math.toRadians(v))));
		functions.put("asin", unary(v -> Math.toDegrees(Math.asin(v))));
		functions.put("acos", unary(v -> Math.toDegrees(Math.acos(v))));
		functions.put("atan", unary(v -> Math.toDegrees(Math.atan(v))));
		functions.put("atan2", args -> binaryNumbers(args, (y, x) -> Math.toDegrees(Math.atan2(y, x))));
		functions.put("min", args -> extreme(args, true));
		functions.put("max", args -> extreme(args, false));
		functions.put("len", BuiltinFunctions::len);
		functions.put("str", BuiltinFunctions::str);
		functions.put("concat", BuiltinFunctions::concat);
		return Map.copyOf(functions);
	}

	private static BuiltinFunction unary(DoubleUnaryOperator op)
	{
		return args ->
		{
			if (args.size() != 1 || !args.get(0).isNumber())
			{
				return EvaluationResult.undef();
			}
			return EvaluationResult.number(op.applyAsDouble(Coercions.toNumber(args.get(0))));
		};
	}

	private static EvaluationResult binaryNumbers(List<EvaluationResult> args, DoubleBinaryOperator op)
	{
		if (args.size() != 2 || !args.get(0).isNumber() || !args.get(1).isNumber())
		{
			return EvaluationResult.undef();
		}
		return EvaluationResult.number(op.applyAsDouble(Coercions.toNumber(args.get(0)), Coercions.toNumber(args.get(1))));
	}

	/**
	 * min/max accept either several numbers or a single vector of numbers.
	 */
	private static EvaluationResult extreme(List<EvaluationResult> args, boolean min)
	{
		List<EvaluationResult> values = args.size() == 1 && args.get(0).isVector() ? args.get(0).asVector() : args;
		if (values.isEmpty())
		{
			return EvaluationResult.undef();
		}
		double best = min ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
		for (EvaluationResult value : values)
		{
			if (!value.isNumber())
			{
				return EvaluationResult.undef();
			}
			double v = Coercions.toNumber(value);
			best = min ? Math.min(best, v) : Math.max(best, v);
		}
		return EvaluationResult.number(best);
	}

	private static EvaluationResult len(List<EvaluationResult> args)
	{
		if (args.size() != 1)
		{
			return EvaluationResult.undef();
		}
		EvaluationResult value = args.get(0);
		if (value.isVector())
		{
			return EvaluationResult.number(value.asVector().size());
		}
		return value.asString()
				.map(s -> EvaluationResult.number(s.length()))
				.orElse(EvaluationResult.undef());
	}

	private static EvaluationResult str(List<EvaluationResult> args)
	{
		StringBuilder sb = new StringBuilder();
		args.forEach(arg -> sb.append(Coercions.toDisplayString(arg)));
		return EvaluationResult.string(sb.toString());
	}

	private static EvaluationResult concat(List<EvaluationResult> args)
	{
		List<EvaluationResult> elements = new ArrayList<>();
		for (EvaluationResult arg : args)
		{
			if (arg.isVector())
			{
				elements.addAll(arg.asVector());
			}
			else
			{
				elements.add(arg);
			}
		}
		return EvaluationResult.vector(elements);
	}
}
