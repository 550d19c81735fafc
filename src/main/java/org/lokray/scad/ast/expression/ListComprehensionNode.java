package org.lokray.scad.ast.expression;

import org.lokray.scad.ast.AstNode;
import org.lokray.scad.ast.Binding;
import org.lokray.scad.ast.NodeKind;
import org.lokray.scad.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A comprehension element inside a vector: {@code for (...) body}, {@code if (c) body else alternative}
 * or {@code let (...) body}.
 */
public class ListComprehensionNode extends ExpressionNode
{
	public enum Form
	{
		FOR,
		IF,
		LET
	}

	private final Form form;
	private final List<Binding> bindings;
	private final ExpressionNode condition;
	private final ExpressionNode body;
	private final ExpressionNode alternative;

	public ListComprehensionNode(SourceLocation location, Form form, List<Binding> bindings, ExpressionNode condition,
								 ExpressionNode body, ExpressionNode alternative)
	{
		super(NodeKind.LIST_COMPREHENSION, location);
		this.form = form;
		this.bindings = List.copyOf(bindings);
		this.condition = condition;
		this.body = body;
		this.alternative = alternative;
	}

	public Form getForm()
	{
		return form;
	}

	/**
	 * Loop variables for {@code FOR}, assignments for {@code LET}, empty for {@code IF}.
	 */
	public List<Binding> getBindings()
	{
		return bindings;
	}

	public Optional<ExpressionNode> getCondition()
	{
		return Optional.ofNullable(condition);
	}

	public ExpressionNode getBody()
	{
		return body;
	}

	public Optional<ExpressionNode> getAlternative()
	{
		return Optional.ofNullable(alternative);
	}

	@Override
	public List<AstNode> getSubNodes()
	{
		List<AstNode> nodes = new ArrayList<>();
		bindings.forEach(b -> nodes.add(b.getValue()));
		if (condition != null)
		{
			nodes.add(condition);
		}
		nodes.add(body);
		if (alternative != null)
		{
			nodes.add(alternative);
		}
		return nodes;
	}

	@Override
	protected List<Object> structure()
	{
		return values(form, bindings, condition, body, alternative);
	}
}
