package org.lokray.scad.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class SphereNode extends CallNode
{
	private final double r;
	private final Double d;
	private final Resolution resolution;

	public SphereNode(SourceLocation location, SourceLocation nameLocation, String modifier, List<Parameter> parameters,
					  double r, Double d, Resolution resolution)
	{
		super(NodeKind.SPHERE, location, "sphere", nameLocation, modifier, parameters, List.of());
		this.r = r;
		this.d = d;
		this.resolution = resolution;
	}

	public double getR()
	{
		return r;
	}

	public Optional<Double> getD()
	{
		return Optional.ofNullable(d);
	}

	public Resolution getResolution()
	{
		return resolution;
	}

	@Override
	protected List<Object> structure()
	{
		List<Object> values = new ArrayList<>(super.structure());
		values.addAll(values(r, d, resolution));
		return values;
	}
}
