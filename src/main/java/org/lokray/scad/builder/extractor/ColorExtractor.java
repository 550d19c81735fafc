package org.lokray.scad.builder.extractor;

import org.lokray.scad.ast.AstNode;
import org.lokray.scad.ast.ColorNode;
import org.lokray.scad.ast.Parameter;
import org.lokray.scad.evaluation.EvaluationResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@code color(c, alpha)} where {@code c} is a name or an RGB/RGBA vector. RGB gets alpha 1;
 * anything unreadable keeps the default {@code "red"}.
 */
public final class ColorExtractor
{
	private static final List<String> PARAMETERS = List.of("c", "alpha");
	private static final EvaluationResult DEFAULT_COLOR = EvaluationResult.string("red");

	private ColorExtractor()
	{
	}

	public static ColorNode extract(CallSite call, List<AstNode> children)
	{
		Map<String, Parameter> arguments = ArgumentExtractor.resolve(call.getParameters(), PARAMETERS);
		EvaluationResult color = DEFAULT_COLOR;
		Double alpha = null;

		Parameter c = arguments.get("c");
		Optional<double[]> vector = ValueExtractor.numberVector(c);
		if (vector.isPresent() && vector.get().length == 3)
		{
			double[] rgb = vector.get();
			color = EvaluationResult.numbers(rgb[0], rgb[1], rgb[2], 1.0);
		}
		else if (vector.isPresent() && vector.get().length == 4)
		{
			color = EvaluationResult.numbers(vector.get());
			alpha = vector.get()[3];
		}
		else
		{
			Optional<String> name = ValueExtractor.string(c);
			if (name.isPresent())
			{
				color = EvaluationResult.string(name.get());
			}
		}

		Optional<Double> explicitAlpha = ValueExtractor.number(arguments.get("alpha"));
		if (explicitAlpha.isPresent())
		{
			alpha = explicitAlpha.get();
		}
		return new ColorNode(call.getLocation(), call.getNameLocation(), call.getModifier(), call.getParameters(),
				children, color, alpha);
	}
}
