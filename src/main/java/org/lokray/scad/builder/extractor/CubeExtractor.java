package org.lokray.scad.builder.extractor;

import org.lokray.scad.ast.CubeNode;
import org.lokray.scad.ast.Parameter;
import org.lokray.scad.evaluation.EvaluationResult;

import java.util.List;
import java.util.Map;

/**
 * {@code cube(size = 1, center = false)}.
 */
public final class CubeExtractor
{
	private static final List<String> PARAMETERS = List.of("size", "center");

	private CubeExtractor()
	{
	}

	public static CubeNode extract(CallSite call)
	{
		Map<String, Parameter> arguments = ArgumentExtractor.resolve(call.getParameters(), PARAMETERS);
		Parameter sizeArgument = arguments.get("size");
		EvaluationResult size = sizeArgument == null
				? EvaluationResult.number(1)
				: sizeArgument.getValue().filter(v -> v.isNumber() || v.isVector()).orElse(EvaluationResult.undef());
		boolean center = ValueExtractor.bool(arguments.get("center")).orElse(false);
		return new CubeNode(call.getLocation(), call.getNameLocation(), call.getModifier(), call.getParameters(), size, center);
	}
}
