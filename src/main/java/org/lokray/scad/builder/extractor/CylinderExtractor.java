package org.lokray.scad.builder.extractor;

import org.lokray.scad.ast.CylinderNode;
import org.lokray.scad.ast.Parameter;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@code cylinder(h, r1, r2, center)} and its named forms. Radii are filled in from {@code r}, {@code d},
 * {@code d1} and {@code d2}; the height is never invented.
 */
public final class CylinderExtractor
{
	private CylinderExtractor()
	{
	}

	public static CylinderNode extract(CallSite call)
	{
		List<Parameter> parameters = call.getParameters();
		Map<String, Parameter> named = ArgumentExtractor.resolve(parameters, List.of());
		Double h = number(named, "h");
		Double r = number(named, "r");
		Double r1 = number(named, "r1");
		Double r2 = number(named, "r2");
		Double d = number(named, "d");
		Double d1 = number(named, "d1");
		Double d2 = number(named, "d2");
		Boolean center = ValueExtractor.bool(named.get("center")).orElse(null);

		List<Parameter> positional = parameters.stream().filter(Parameter::isPositional).toList();
		int index = 0;
		if (h == null && index < positional.size())
		{
			Optional<Double> value = ValueExtractor.number(positional.get(index));
			if (value.isPresent())
			{
				h = value.get();
				index++;
			}
		}
		if (r1 == null && r2 == null && r == null && index + 1 < positional.size())
		{
			Optional<Double> first = ValueExtractor.number(positional.get(index));
			Optional<Double> second = ValueExtractor.number(positional.get(index + 1));
			if (first.isPresent() && second.isPresent())
			{
				r1 = first.get();
				r2 = second.get();
				index += 2;
			}
		}
		if (r == null && r1 == null && index < positional.size())
		{
			Optional<Double> value = ValueExtractor.number(positional.get(index));
			if (value.isPresent())
			{
				r = value.get();
				index++;
			}
		}
		if (center == null && index < positional.size())
		{
			center = ValueExtractor.bool(positional.get(index)).orElse(null);
		}

		// Explicit radii win over derived ones
		if (r == null && d != null)
		{
			r = d / 2;
		}
		if (r1 == null && d1 != null)
		{
			r1 = d1 / 2;
		}
		if (r2 == null && d2 != null)
		{
			r2 = d2 / 2;
		}
		if (r != null)
		{
			r1 = r1 == null ? r : r1;
			r2 = r2 == null ? r : r2;
		}

		return new CylinderNode(call.getLocation(), call.getNameLocation(), call.getModifier(), parameters,
				h, r, r1, r2, d, d1, d2, center != null && center, SphereExtractor.resolution(named));
	}

	private static Double number(Map<String, Parameter> named, String name)
	{
		return ValueExtractor.number(named.get(name)).orElse(null);
	}
}
