package org.lokray.scad.builder;

import org.lokray.scad.ast.AssignmentNode;
import org.lokray.scad.ast.AssertNode;
import org.lokray.scad.ast.BooleanOperationNode;
import org.lokray.scad.ast.ChildrenNode;
import org.lokray.scad.ast.EchoNode;
import org.lokray.scad.ast.ErrorNode;
import org.lokray.scad.ast.ForLoopNode;
import org.lokray.scad.ast.FunctionDefinitionNode;
import org.lokray.scad.ast.IfNode;
import org.lokray.scad.ast.IncludeNode;
import org.lokray.scad.ast.LetNode;
import org.lokray.scad.ast.LocationMapper;
import org.lokray.scad.ast.ModuleDefinitionNode;
import org.lokray.scad.ast.ModuleInstantiationNode;
import org.lokray.scad.ast.NodeKind;
import org.lokray.scad.ast.PrimitiveNode;
import org.lokray.scad.ast.TransformNode;
import org.lokray.scad.builder.extractor.CallSite;
import org.lokray.scad.builder.extractor.ColorExtractor;
import org.lokray.scad.builder.extractor.CubeExtractor;
import org.lokray.scad.builder.extractor.CylinderExtractor;
import org.lokray.scad.builder.extractor.ModuleParameterExtractor;
import org.lokray.scad.builder.extractor.OffsetExtractor;
import org.lokray.scad.builder.extractor.SphereExtractor;
import org.lokray.scad.builder.extractor.ValueExtractor;
import org.lokray.scad.cst.CstNode;
import org.lokray.scad.error.ErrorCode;

import java.util.List;

/**
 * The handlers for every {@link NodeKind}. Adding a kind without a handler fails to compile.
 */
public final class BuiltinHandlers
{
	private BuiltinHandlers()
	{
	}

	public static void registerAll(NodeHandlerRegistry registry)
	{
		for (NodeKind kind : NodeKind.values())
		{
			NodeHandler handler = handlerFor(kind);
			for (String key : keysFor(kind))
			{
				registry.register(key, handler);
			}
		}
	}

	/**
	 * Registry keys of a kind. Literals and identifiers come from several CST leaf types.
	 */
	static List<String> keysFor(NodeKind kind)
	{
		return switch (kind)
		{
			case LITERAL -> List.of("number", "string", "boolean", "undef");
			case IDENTIFIER -> List.of("identifier", "special_variable");
			default -> List.of(kind.getKey());
		};
	}

	static NodeHandler handlerFor(NodeKind kind)
	{
		return switch (kind)
		{
			case CUBE -> (node, context) -> CubeExtractor.extract(CallSite.of(node, context));
			case SPHERE -> (node, context) -> SphereExtractor.extract(CallSite.of(node, context));
			case CYLINDER -> (node, context) -> CylinderExtractor.extract(CallSite.of(node, context));
			case CIRCLE, SQUARE, POLYGON, POLYHEDRON, TEXT, IMPORT, SURFACE -> (node, context) ->
			{
				CallSite call = CallSite.of(node, context);
				return new PrimitiveNode(kind, call.getLocation(), call.getNameLocation(), call.getModifier(),
						call.getParameters(), context.buildBody(call.getBody()));
			};
			case TRANSLATE, ROTATE, SCALE, MIRROR, RESIZE, MULTMATRIX, LINEAR_EXTRUDE, ROTATE_EXTRUDE, PROJECTION -> (node, context) ->
			{
				CallSite call = CallSite.of(node, context);
				return new TransformNode(kind, call.getLocation(), call.getNameLocation(), call.getModifier(),
						call.getParameters(), context.buildBody(call.getBody()));
			};
			case COLOR -> (node, context) ->
			{
				CallSite call = CallSite.of(node, context);
				return ColorExtractor.extract(call, context.buildBody(call.getBody()));
			};
			case OFFSET -> (node, context) ->
			{
				CallSite call = CallSite.of(node, context);
				return OffsetExtractor.extract(call, context.buildBody(call.getBody()));
			};
			case UNION, DIFFERENCE, INTERSECTION, HULL, MINKOWSKI -> (node, context) ->
			{
				CallSite call = CallSite.of(node, context);
				return new BooleanOperationNode(kind, call.getLocation(), call.getNameLocation(), call.getModifier(),
						call.getParameters(), context.buildBody(call.getBody()));
			};
			case MODULE_INSTANTIATION -> (node, context) ->
			{
				CallSite call = CallSite.of(node, context);
				return new ModuleInstantiationNode(call.getLocation(), call.getName(), call.getNameLocation(),
						call.getModifier(), call.getParameters(), context.buildBody(call.getBody()));
			};
			case ECHO -> (node, context) ->
			{
				CallSite call = CallSite.of(node, context);
				return new EchoNode(call.getLocation(), call.getNameLocation(), call.getModifier(), call.getParameters(),
						context.buildBody(call.getBody()));
			};
			case ASSERT -> (node, context) ->
			{
				CallSite call = CallSite.of(node, context);
				return new AssertNode(call.getLocation(), call.getNameLocation(), call.getModifier(), call.getParameters(),
						context.buildBody(call.getBody()));
			};
			case CHILDREN -> (node, context) ->
			{
				CallSite call = CallSite.of(node, context);
				return new ChildrenNode(call.getLocation(), call.getNameLocation(), call.getModifier(), call.getParameters(),
						context.buildBody(call.getBody()));
			};
			case MODULE_DEFINITION -> BuiltinHandlers::moduleDefinition;
			case FUNCTION_DEFINITION -> BuiltinHandlers::functionDefinition;
			case ASSIGNMENT -> BuiltinHandlers::assignment;
			case IF -> (node, context) -> new IfNode(LocationMapper.map(node),
					context.getExpressions().build(node.getChildForFieldName("condition"), node),
					context.buildBody(node.getChildForFieldName("consequence")),
					context.buildBody(node.getChildForFieldName("alternative")));
			case FOR_LOOP -> (node, context) -> new ForLoopNode(LocationMapper.map(node),
					context.getExpressions().forBindings(node.getChildrenForFieldName("header")),
					context.buildBody(node.getChildForFieldName("body")));
			case LET -> (node, context) -> new LetNode(LocationMapper.map(node),
					context.getExpressions().letBindings(node.getChildForFieldName("assignments")),
					context.buildBody(node.getChildForFieldName("body")));
			case INCLUDE, USE -> (node, context) -> new IncludeNode(kind, LocationMapper.map(node), includePath(node));
			case LITERAL, IDENTIFIER, UNARY_EXPRESSION, BINARY_EXPRESSION, CONDITIONAL_EXPRESSION, RANGE_EXPRESSION,
				 VECTOR_EXPRESSION, INDEX_EXPRESSION, MEMBER_EXPRESSION, FUNCTION_CALL, LIST_COMPREHENSION, LET_EXPRESSION,
				 EACH_EXPRESSION -> (node, context) -> context.getExpressions().build(node);
			case ERROR -> (node, context) -> new ErrorNode(LocationMapper.map(node), ErrorCode.SYNTAX_ERROR,
					"Unparsed input", node.getText());
		};
	}

	private static ModuleDefinitionNode moduleDefinition(CstNode node, BuildContext context)
	{
		CstNode name = node.getChildForFieldName("name");
		return new ModuleDefinitionNode(LocationMapper.map(node), textOf(name), name == null ? null : LocationMapper.map(name),
				ModuleParameterExtractor.extract(node.getChildForFieldName("parameters"), context),
				context.buildBody(node.getChildForFieldName("body")));
	}

	private static FunctionDefinitionNode functionDefinition(CstNode node, BuildContext context)
	{
		CstNode name = node.getChildForFieldName("name");
		return new FunctionDefinitionNode(LocationMapper.map(node), textOf(name), name == null ? null : LocationMapper.map(name),
				ModuleParameterExtractor.extract(node.getChildForFieldName("parameters"), context),
				context.getExpressions().build(node.getChildForFieldName("value"), node));
	}

	private static AssignmentNode assignment(CstNode node, BuildContext context)
	{
		CstNode name = node.getChildForFieldName("name");
		CstNode value = node.getChildForFieldName("value");
		return new AssignmentNode(LocationMapper.map(node), textOf(name), name == null ? null : LocationMapper.map(name),
				context.getExpressions().build(value, node), ValueExtractor.extract(value, context).orElse(null));
	}

	private static String includePath(CstNode node)
	{
		CstNode path = node.getChildForFieldName("path");
		if (path == null || path.isMissing())
		{
			return "";
		}
		String text = path.getText();
		return text.startsWith("<") && text.endsWith(">") ? text.substring(1, text.length() - 1) : text;
	}

	private static String textOf(CstNode node)
	{
		return node == null || node.isMissing() ? "" : node.getText();
	}
}
