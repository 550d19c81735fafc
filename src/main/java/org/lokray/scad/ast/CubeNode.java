package org.lokray.scad.ast;

import org.lokray.scad.evaluation.EvaluationResult;

import java.util.ArrayList;
import java.util.List;

public class CubeNode extends CallNode
{
	private final EvaluationResult size;
	private final boolean center;

	public CubeNode(SourceLocation location, SourceLocation nameLocation, String modifier, List<Parameter> parameters,
					EvaluationResult size, boolean center)
	{
		super(NodeKind.CUBE, location, "cube", nameLocation, modifier, parameters, List.of());
		this.size = size;
		this.center = center;
	}

	/**
	 * A number for a cube, a three element vector for a box, undef when not constant.
	 */
	public EvaluationResult getSize()
	{
		return size;
	}

	public boolean isCenter()
	{
		return center;
	}

	@Override
	protected List<Object> structure()
	{
		List<Object> values = new ArrayList<>(super.structure());
		values.add(size);
		values.add(center);
		return values;
	}
}
