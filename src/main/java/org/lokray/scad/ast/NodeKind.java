package org.lokray.scad.ast;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of AST node kinds. The key is the module name for call-shaped kinds
 * and the CST node type for statement and expression kinds.
 */
public enum NodeKind
{
	CUBE("cube", Category.PRIMITIVE),
	SPHERE("sphere", Category.PRIMITIVE),
	CYLINDER("cylinder", Category.PRIMITIVE),
	CIRCLE("circle", Category.PRIMITIVE),
	SQUARE("square", Category.PRIMITIVE),
	POLYGON("polygon", Category.PRIMITIVE),
	POLYHEDRON("polyhedron", Category.PRIMITIVE),
	TEXT("text", Category.PRIMITIVE),
	IMPORT("import", Category.PRIMITIVE),
	SURFACE("surface", Category.PRIMITIVE),

	TRANSLATE("translate", Category.TRANSFORM),
	ROTATE("rotate", Category.TRANSFORM),
	SCALE("scale", Category.TRANSFORM),
	MIRROR("mirror", Category.TRANSFORM),
	RESIZE("resize", Category.TRANSFORM),
	MULTMATRIX("multmatrix", Category.TRANSFORM),
	LINEAR_EXTRUDE("linear_extrude", Category.TRANSFORM),
	ROTATE_EXTRUDE("rotate_extrude", Category.TRANSFORM),
	PROJECTION("projection", Category.TRANSFORM),
	COLOR("color", Category.TRANSFORM),
	OFFSET("offset", Category.TRANSFORM),

	UNION("union", Category.BOOLEAN_OPERATION),
	DIFFERENCE("difference", Category.BOOLEAN_OPERATION),
	INTERSECTION("intersection", Category.BOOLEAN_OPERATION),
	HULL("hull", Category.BOOLEAN_OPERATION),
	MINKOWSKI("minkowski", Category.BOOLEAN_OPERATION),

	MODULE_DEFINITION("module_definition", Category.DECLARATION),
	FUNCTION_DEFINITION("function_definition", Category.DECLARATION),
	ASSIGNMENT("assignment_statement", Category.DECLARATION),

	IF("if_statement", Category.CONTROL_FLOW),
	FOR_LOOP("for_statement", Category.CONTROL_FLOW),
	LET("let_statement", Category.CONTROL_FLOW),

	MODULE_INSTANTIATION("module_instantiation", Category.STATEMENT),
	ECHO("echo", Category.STATEMENT),
	ASSERT("assert", Category.STATEMENT),
	CHILDREN("children", Category.STATEMENT),
	INCLUDE("include_statement", Category.STATEMENT),
	USE("use_statement", Category.STATEMENT),

	LITERAL("literal", Category.EXPRESSION),
	IDENTIFIER("identifier", Category.EXPRESSION),
	UNARY_EXPRESSION("unary_expression", Category.EXPRESSION),
	BINARY_EXPRESSION("binary_expression", Category.EXPRESSION),
	CONDITIONAL_EXPRESSION("conditional_expression", Category.EXPRESSION),
	RANGE_EXPRESSION("range_expression", Category.EXPRESSION),
	VECTOR_EXPRESSION("vector_expression", Category.EXPRESSION),
	INDEX_EXPRESSION("index_expression", Category.EXPRESSION),
	MEMBER_EXPRESSION("member_expression", Category.EXPRESSION),
	FUNCTION_CALL("call_expression", Category.EXPRESSION),
	LIST_COMPREHENSION("list_comprehension", Category.EXPRESSION),
	LET_EXPRESSION("let_expression", Category.EXPRESSION),
	EACH_EXPRESSION("each_expression", Category.EXPRESSION),

	ERROR("ERROR", Category.ERROR);

	public enum Category
	{
		PRIMITIVE,
		TRANSFORM,
		BOOLEAN_OPERATION,
		DECLARATION,
		CONTROL_FLOW,
		STATEMENT,
		EXPRESSION,
		ERROR
	}

	private static final Map<String, NodeKind> BY_KEY = Arrays.stream(values())
			.collect(Collectors.toUnmodifiableMap(NodeKind::getKey, Function.identity()));

	private final String key;
	private final Category category;

	NodeKind(String key, Category category)
	{
		this.key = key;
		this.category = category;
	}

	public String getKey()
	{
		return key;
	}

	public Category getCategory()
	{
		return category;
	}

	/**
	 * Kinds built from a {@code module_instantiation} whose name is {@link #getKey()}.
	 */
	public boolean isCallShaped()
	{
		return switch (category)
		{
			case PRIMITIVE, TRANSFORM, BOOLEAN_OPERATION -> true;
			case STATEMENT -> this == ECHO || this == ASSERT || this == CHILDREN || this == MODULE_INSTANTIATION;
			default -> false;
		};
	}

	public static Optional<NodeKind> fromKey(String key)
	{
		return Optional.ofNullable(BY_KEY.get(key));
	}
}
