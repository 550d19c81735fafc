package org.lokray.scad.ast;

import org.lokray.scad.evaluation.EvaluationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class ColorNode extends CallNode
{
	private final EvaluationResult color;
	private final Double alpha;

	public ColorNode(SourceLocation location, SourceLocation nameLocation, String modifier, List<Parameter> parameters,
					 List<AstNode> children, EvaluationResult color, Double alpha)
	{
		super(NodeKind.COLOR, location, "color", nameLocation, modifier, parameters, children);
		this.color = color;
		this.alpha = alpha;
	}

	/**
	 * A color name, or an RGBA vector (RGB input gets alpha 1).
	 */
	public EvaluationResult getColor()
	{
		return color;
	}

	public Optional<Double> getAlpha()
	{
		return Optional.ofNullable(alpha);
	}

	@Override
	protected List<Object> structure()
	{
		List<Object> values = new ArrayList<>(super.structure());
		values.addAll(values(color, alpha));
		return values;
	}
}
