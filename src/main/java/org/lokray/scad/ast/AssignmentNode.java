package org.lokray.scad.ast;

import org.lokray.scad.ast.expression.ExpressionNode;
import org.lokray.scad.evaluation.EvaluationResult;

import java.util.List;
import java.util.Optional;

/**
 * {@code name = value;}. The folded value is present only when the expression is a constant.
 */
public class AssignmentNode extends AstNode
{
	private final String name;
	private final SourceLocation nameLocation;
	private final ExpressionNode value;
	private final EvaluationResult constantValue;

	public AssignmentNode(SourceLocation location, String name, SourceLocation nameLocation, ExpressionNode value,
						  EvaluationResult constantValue)
	{
		super(NodeKind.ASSIGNMENT, location);
		this.name = name;
		this.nameLocation = nameLocation;
		this.value = value;
		this.constantValue = constantValue;
	}

	public String getName()
	{
		return name;
	}

	public SourceLocation getNameLocation()
	{
		return nameLocation;
	}

	public ExpressionNode getValue()
	{
		return value;
	}

	public Optional<EvaluationResult> getConstantValue()
	{
		return Optional.ofNullable(constantValue);
	}

	@Override
	public List<AstNode> getSubNodes()
	{
		return List.of(value);
	}

	@Override
	protected List<Object> structure()
	{
		return values(name, nameLocation, value, constantValue);
	}
}
