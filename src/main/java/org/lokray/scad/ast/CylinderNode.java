package org.lokray.scad.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A cylinder or cone. Radii are derived from diameters where only those were given.
 * A missing height stays empty.
 */
public class CylinderNode extends CallNode
{
	private final Double h;
	private final Double r;
	private final Double r1;
	private final Double r2;
	private final Double d;
	private final Double d1;
	private final Double d2;
	private final boolean center;
	private final Resolution resolution;

	public CylinderNode(SourceLocation location, SourceLocation nameLocation, String modifier, List<Parameter> parameters,
						Double h, Double r, Double r1, Double r2, Double d, Double d1, Double d2, boolean center, Resolution resolution)
	{
		super(NodeKind.CYLINDER, location, "cylinder", nameLocation, modifier, parameters, List.of());
		this.h = h;
		this.r = r;
		this.r1 = r1;
		this.r2 = r2;
		this.d = d;
		this.d1 = d1;
		this.d2 = d2;
		this.center = center;
		this.resolution = resolution;
	}

	public Optional<Double> getH()
	{
		return Optional.ofNullable(h);
	}

	public Optional<Double> getR()
	{
		return Optional.ofNullable(r);
	}

	public Optional<Double> getR1()
	{
		return Optional.ofNullable(r1);
	}

	public Optional<Double> getR2()
	{
		return Optional.ofNullable(r2);
	}

	public Optional<Double> getD()
	{
		return Optional.ofNullable(d);
	}

	public Optional<Double> getD1()
	{
		return Optional.ofNullable(d1);
	}

	public Optional<Double> getD2()
	{
		return Optional.ofNullable(d2);
	}

	public boolean isCenter()
	{
		return center;
	}

	public Resolution getResolution()
	{
		return resolution;
	}

	@Override
	protected List<Object> structure()
	{
		List<Object> values = new ArrayList<>(super.structure());
		values.addAll(values(h, r, r1, r2, d, d1, d2, center, resolution));
		return values;
	}
}
