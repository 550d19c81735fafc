package org.lokray.scad.builder.extractor;

import org.lokray.scad.ast.AstNode;
import org.lokray.scad.ast.OffsetNode;
import org.lokray.scad.ast.Parameter;

import java.util.List;
import java.util.Map;

/**
 * {@code offset(r = 0, delta = 0, chamfer = false)}.
 */
public final class OffsetExtractor
{
	private static final List<String> PARAMETERS = List.of("r", "delta", "chamfer");

	private OffsetExtractor()
	{
	}

	public static OffsetNode extract(CallSite call, List<AstNode> children)
	{
		Map<String, Parameter> arguments = ArgumentExtractor.resolve(call.getParameters(), PARAMETERS);
		return new OffsetNode(call.getLocation(), call.getNameLocation(), call.getModifier(), call.getParameters(), children,
				ValueExtractor.number(arguments.get("r")).orElse(0.0),
				ValueExtractor.number(arguments.get("delta")).orElse(0.0),
				ValueExtractor.bool(arguments.get("chamfer")).orElse(false));
	}
}
