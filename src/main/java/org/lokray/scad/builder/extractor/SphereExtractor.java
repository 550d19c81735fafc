package org.lokray.scad.builder.extractor;

import org.lokray.scad.ast.Parameter;
import org.lokray.scad.ast.Resolution;
import org.lokray.scad.ast.SphereNode;

import java.util.List;
import java.util.Map;

/**
 * {@code sphere(r = 1)} or {@code sphere(d = 2)}; a diameter sets the radius to half of it.
 */
public final class SphereExtractor
{
	private static final List<String> PARAMETERS = List.of("r");

	private SphereExtractor()
	{
	}

	public static SphereNode extract(CallSite call)
	{
		Map<String, Parameter> arguments = ArgumentExtractor.resolve(call.getParameters(), PARAMETERS);
		Double d = ValueExtractor.number(arguments.get("d")).orElse(null);
		double r = ValueExtractor.number(arguments.get("r")).orElse(d != null ? d / 2 : 1.0);
		return new SphereNode(call.getLocation(), call.getNameLocation(), call.getModifier(), call.getParameters(),
				r, d, resolution(arguments));
	}

	static Resolution resolution(Map<String, Parameter> arguments)
	{
		return new Resolution(
				ValueExtractor.number(arguments.get("$fn")).orElse(null),
				ValueExtractor.number(arguments.get("$fa")).orElse(null),
				ValueExtractor.number(arguments.get("$fs")).orElse(null));
	}
}
