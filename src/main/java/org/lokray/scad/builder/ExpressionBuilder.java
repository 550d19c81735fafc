package org.lokray.scad.builder;

import org.lokray.scad.ast.Binding;
import org.lokray.scad.ast.LocationMapper;
import org.lokray.scad.ast.SourceLocation;
import org.lokray.scad.ast.expression.BinaryExpressionNode;
import org.lokray.scad.ast.expression.ConditionalExpressionNode;
import org.lokray.scad.ast.expression.EachExpressionNode;
import org.lokray.scad.ast.expression.ExpressionNode;
import org.lokray.scad.ast.expression.FunctionCallNode;
import org.lokray.scad.ast.expression.IdentifierNode;
import org.lokray.scad.ast.expression.IndexExpressionNode;
import org.lokray.scad.ast.expression.LetExpressionNode;
import org.lokray.scad.ast.expression.ListComprehensionNode;
import org.lokray.scad.ast.expression.LiteralNode;
import org.lokray.scad.ast.expression.MemberExpressionNode;
import org.lokray.scad.ast.expression.RangeExpressionNode;
import org.lokray.scad.ast.expression.UnaryExpressionNode;
import org.lokray.scad.ast.expression.VectorExpressionNode;
import org.lokray.scad.builder.extractor.ArgumentExtractor;
import org.lokray.scad.cst.CstNode;
import org.lokray.scad.error.ErrorCode;
import org.lokray.scad.error.ParserError;
import org.lokray.scad.error.Severity;
import org.lokray.scad.evaluation.LiteralEvaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts CST expressions into expression nodes. Malformed or missing operands become undef literals
 * so a partial tree is always produced. Nesting deeper than {@code maxRecursionDepth} is cut off the same way.
 */
public class ExpressionBuilder
{
	private final BuildContext context;
	private int depth;

	public ExpressionBuilder(BuildContext context)
	{
		this.context = context;
	}

	/**
	 * Builds {@code node}, or an undef literal located at {@code owner} when {@code node} is absent.
	 */
	public ExpressionNode build(CstNode node, CstNode owner)
	{
		if (node == null)
		{
			return LiteralNode.undef(owner == null ? null : LocationMapper.map(owner));
		}
		return build(node);
	}

	public ExpressionNode build(CstNode node)
	{
		SourceLocation location = LocationMapper.map(node);
		if (node.isMissing() || node.isError())
		{
			return LiteralNode.undef(location);
		}
		if (depth >= context.getConfig().getMaxRecursionDepth())
		{
			context.report(new ParserError("Expression nesting exceeds " + context.getConfig().getMaxRecursionDepth() + " levels",
					ErrorCode.INTERNAL_ERROR, Severity.ERROR, context.getSource(), location.getStart(), List.of(),
					Map.of("nodeType", node.getType()), null));
			return LiteralNode.undef(location);
		}

		depth++;
		try
		{
			return convert(node, location);
		}
		finally
		{
			depth--;
		}
	}

	private ExpressionNode convert(CstNode node, SourceLocation location)
	{
		return switch (node.getType())
		{
			case "number", "string", "boolean", "undef" -> new LiteralNode(location, LiteralEvaluator.valueOf(node));
			case "identifier", "special_variable" -> new IdentifierNode(location, node.getText());
			case "parenthesized_expression" -> build(node.getChildForFieldName("expression"), node);
			case "unary_expression" -> new UnaryExpressionNode(location, operator(node),
					build(node.getChildForFieldName("operand"), node));
			case "binary_expression" -> new BinaryExpressionNode(location, operator(node),
					build(node.getChildForFieldName("left"), node), build(node.getChildForFieldName("right"), node));
			case "conditional_expression" -> new ConditionalExpressionNode(location,
					build(node.getChildForFieldName("condition"), node),
					build(node.getChildForFieldName("consequence"), node),
					build(node.getChildForFieldName("alternative"), node));
			case "range_expression" ->
			{
				CstNode step = node.getChildForFieldName("step");
				yield new RangeExpressionNode(location, build(node.getChildForFieldName("start"), node),
						step == null ? null : build(step), build(node.getChildForFieldName("end"), node));
			}
			case "vector_expression" -> new VectorExpressionNode(location, buildAll(node.getNamedChildren()));
			case "list_comprehension" -> new VectorExpressionNode(location,
					List.of(build(node.getChildForFieldName("element"), node)));
			case "list_comprehension_for" -> new ListComprehensionNode(location, ListComprehensionNode.Form.FOR,
					forBindings(node.getChildrenForFieldName("header")), null,
					build(node.getChildForFieldName("body"), node), null);
			case "list_comprehension_if" ->
			{
				CstNode alternative = node.getChildForFieldName("alternative");
				yield new ListComprehensionNode(location, ListComprehensionNode.Form.IF, List.of(),
						build(node.getChildForFieldName("condition"), node),
						build(node.getChildForFieldName("consequence"), node),
						alternative == null ? null : build(alternative));
			}
			case "let_comprehension" -> new ListComprehensionNode(location, ListComprehensionNode.Form.LET,
					letBindings(node.getChildForFieldName("assignments")), null,
					build(node.getChildForFieldName("body"), node), null);
			case "each_expression" -> new EachExpressionNode(location, build(node.getChildForFieldName("value"), node));
			case "let_expression" -> new LetExpressionNode(location,
					letBindings(node.getChildForFieldName("assignments")), build(node.getChildForFieldName("body"), node));
			case "index_expression" -> new IndexExpressionNode(location,
					build(node.getChildForFieldName("array"), node), build(node.getChildForFieldName("index"), node));
			case "member_expression" ->
			{
				CstNode property = node.getChildForFieldName("property");
				yield new MemberExpressionNode(location, build(node.getChildForFieldName("object"), node),
						property == null ? "" : property.getText());
			}
			case "call_expression" -> new FunctionCallNode(location,
					build(node.getChildForFieldName("function"), node),
					ArgumentExtractor.extract(node.getChildForFieldName("arguments"), context));
			default -> LiteralNode.undef(location);
		};
	}

	private List<ExpressionNode> buildAll(List<CstNode> nodes)
	{
		List<ExpressionNode> result = new ArrayList<>();
		for (CstNode node : nodes)
		{
			result.add(build(node));
		}
		return result;
	}

	/**
	 * Bindings of {@code let_assignment} children, skipping any without a name.
	 */
	public List<Binding> letBindings(CstNode assignments)
	{
		List<Binding> bindings = new ArrayList<>();
		if (assignments == null)
		{
			return bindings;
		}
		for (CstNode assignment : assignments.getNamedChildren())
		{
			Binding binding = binding(assignment, "name", "value");
			if (binding != null)
			{
				bindings.add(binding);
			}
		}
		return bindings;
	}

	/**
	 * Bindings of {@code for_header} nodes.
	 */
	public List<Binding> forBindings(List<CstNode> headers)
	{
		List<Binding> bindings = new ArrayList<>();
		for (CstNode header : headers)
		{
			Binding binding = binding(header, "iterator", "range");
			if (binding != null)
			{
				bindings.add(binding);
			}
		}
		return bindings;
	}

	private Binding binding(CstNode node, String nameField, String valueField)
	{
		CstNode name = node.getChildForFieldName(nameField);
		if (name == null || name.isMissing())
		{
			return null;
		}
		return new Binding(name.getText(), LocationMapper.map(name), build(node.getChildForFieldName(valueField), node));
	}

	private static String operator(CstNode node)
	{
		CstNode operator = node.getChildForFieldName("operator");
		return operator == null ? "" : operator.getText();
	}
}
