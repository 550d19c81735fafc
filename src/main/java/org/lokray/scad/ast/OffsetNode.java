package org.lokray.scad.ast;

import java.util.ArrayList;
import java.util.List;

public class OffsetNode extends CallNode
{
	private final double r;
	private final double delta;
	private final boolean chamfer;

	public OffsetNode(SourceLocation location, SourceLocation nameLocation, String modifier, List<Parameter> parameters,
					  List<AstNode> children, double r, double delta, boolean chamfer)
	{
		super(NodeKind.OFFSET, location, "offset", nameLocation, modifier, parameters, children);
		this.r = r;
		this.delta = delta;
		this.chamfer = chamfer;
	}

	public double getR()
	{
		return r;
	}

	public double getDelta()
	{
		return delta;
	}

	public boolean isChamfer()
	{
		return chamfer;
	}

	@Override
	protected List<Object> structure()
	{
		List<Object> values = new ArrayList<>(super.structure());
		values.addAll(values(r, delta, chamfer));
		return values;
	}
}
