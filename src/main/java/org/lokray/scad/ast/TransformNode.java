package org.lokray.scad.ast;

import org.lokray.scad.evaluation.EvaluationResult;

import java.util.List;
import java.util.Optional;

/**
 * translate, rotate, scale, mirror, resize, multmatrix, the extrusions and projection.
 */
public class TransformNode extends CallNode
{
	public TransformNode(NodeKind kind, SourceLocation location, SourceLocation nameLocation, String modifier,
						 List<Parameter> parameters, List<AstNode> children)
	{
		super(kind, location, kind.getKey(), nameLocation, modifier, parameters, children);
	}

	/**
	 * The constant value of the first argument, e.g. the offset of a translate.
	 */
	public Optional<EvaluationResult> getPrimaryValue()
	{
		return getParameters().isEmpty() ? Optional.empty() : getParameters().get(0).getValue();
	}
}
