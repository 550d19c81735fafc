package org.lokray.scad.cst;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.RuleNode;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.lokray.scad.parser.OpenScadLexer;
import org.lokray.scad.parser.OpenScadParser;
import org.lokray.scad.parser.OpenScadParserBaseVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts an ANTLR parse tree into {@link CstNode}s. Tokens consumed while ANTLR resynchronised
 * are grouped into {@code ERROR} nodes, tokens it conjured become zero-width missing nodes.
 */
public class CstTreeBuilder extends OpenScadParserBaseVisitor<CstNode>
{
	@FunctionalInterface
	private interface FieldResolver
	{
		String fieldFor(ParseTree child);
	}

	private static final FieldResolver NO_FIELDS = child -> null;

	private final String source;
	private final int baseOffset;
	private final LineIndex sourceIndex;
	private final LineIndex sliceIndex;

	public CstTreeBuilder(String source, int baseOffset, LineIndex sourceIndex, LineIndex sliceIndex)
	{
		this.source = source;
		this.baseOffset = baseOffset;
		this.sourceIndex = sourceIndex;
		this.sliceIndex = sliceIndex;
	}

	@Override
	public CstNode visitSourceFile(OpenScadParser.SourceFileContext ctx)
	{
		List<String> names = new ArrayList<>();
		List<CstNode> nodes = new ArrayList<>();
		collect(ctx, NO_FIELDS, names, nodes);
		CstNode root = new CstNode("source_file", true, source, baseOffset, source.length(),
				point(baseOffset), point(source.length()), false);
		for (int i = 0; i < nodes.size(); i++)
		{
			root.appendChild(names.get(i), nodes.get(i));
		}
		if (ctx.exception != null)
		{
			root.markIncomplete();
		}
		return root;
	}

	@Override
	public CstNode visitStandaloneExpression(OpenScadParser.StandaloneExpressionContext ctx)
	{
		boolean clean = ctx.exception == null && ctx.expression() != null
				&& ctx.children.stream().noneMatch(c -> c instanceof ErrorNode);
		if (clean)
		{
			return visit(ctx.expression());
		}
		return build(ctx, "standalone_expression", child -> child == ctx.expression() ? "value" : null);
	}

	@Override
	public CstNode visitStatement(OpenScadParser.StatementContext ctx)
	{
		return build(ctx, "statement", NO_FIELDS);
	}

	@Override
	public CstNode visitIncludeStatement(OpenScadParser.IncludeStatementContext ctx)
	{
		return build(ctx, "include_statement", child -> child == ctx.INCLUDE_PATH() ? "path" : null);
	}

	@Override
	public CstNode visitUseStatement(OpenScadParser.UseStatementContext ctx)
	{
		return build(ctx, "use_statement", child -> child == ctx.INCLUDE_PATH() ? "path" : null);
	}

	@Override
	public CstNode visitModuleDefinition(OpenScadParser.ModuleDefinitionContext ctx)
	{
		return build(ctx, "module_definition", child ->
		{
			if (child == ctx.IDENTIFIER())
			{
				return "name";
			}
			if (child == ctx.parameterList())
			{
				return "parameters";
			}
			return child == ctx.statement() ? "body" : null;
		});
	}

	@Override
	public CstNode visitFunctionDefinition(OpenScadParser.FunctionDefinitionContext ctx)
	{
		return build(ctx, "function_definition", child ->
		{
			if (child == ctx.IDENTIFIER())
			{
				return "name";
			}
			if (child == ctx.parameterList())
			{
				return "parameters";
			}
			return child == ctx.expression() ? "value" : null;
		});
	}

	@Override
	public CstNode visitParameterList(OpenScadParser.ParameterListContext ctx)
	{
		return build(ctx, "parameter_list", NO_FIELDS);
	}

	@Override
	public CstNode visitParameterDeclaration(OpenScadParser.ParameterDeclarationContext ctx)
	{
		return build(ctx, "parameter_declaration", child ->
		{
			if (child == ctx.IDENTIFIER() || child == ctx.SPECIAL_VARIABLE())
			{
				return "name";
			}
			return child == ctx.expression() ? "default" : null;
		});
	}

	@Override
	public CstNode visitAssignmentStatement(OpenScadParser.AssignmentStatementContext ctx)
	{
		return build(ctx, "assignment_statement", child ->
		{
			if (child == ctx.IDENTIFIER() || child == ctx.SPECIAL_VARIABLE())
			{
				return "name";
			}
			return child == ctx.expression() ? "value" : null;
		});
	}

	@Override
	public CstNode visitBlock(OpenScadParser.BlockContext ctx)
	{
		return build(ctx, "block", NO_FIELDS);
	}

	@Override
	public CstNode visitModuleInstantiation(OpenScadParser.ModuleInstantiationContext ctx)
	{
		return build(ctx, "module_instantiation", child ->
		{
			if (child == ctx.IDENTIFIER())
			{
				return "name";
			}
			if (child == ctx.argumentList())
			{
				return "arguments";
			}
			if (child instanceof OpenScadParser.ModifierContext)
			{
				return "modifier";
			}
			return child == ctx.statement() ? "body" : null;
		});
	}

	@Override
	public CstNode visitModifier(OpenScadParser.ModifierContext ctx)
	{
		return build(ctx, "modifier", NO_FIELDS);
	}

	@Override
	public CstNode visitArgumentList(OpenScadParser.ArgumentListContext ctx)
	{
		return build(ctx, "argument_list", NO_FIELDS);
	}

	@Override
	public CstNode visitArguments(OpenScadParser.ArgumentsContext ctx)
	{
		return build(ctx, "arguments", NO_FIELDS);
	}

	@Override
	public CstNode visitArgument(OpenScadParser.ArgumentContext ctx)
	{
		return build(ctx, "argument", child ->
		{
			if (child == ctx.IDENTIFIER() || child == ctx.SPECIAL_VARIABLE())
			{
				return "name";
			}
			return child == ctx.expression() ? "value" : null;
		});
	}

	@Override
	public CstNode visitIfStatement(OpenScadParser.IfStatementContext ctx)
	{
		return build(ctx, "if_statement", child ->
		{
			if (child == ctx.expression())
			{
				return "condition";
			}
			if (child instanceof OpenScadParser.StatementContext)
			{
				boolean afterElse = ctx.ELSE() != null && ctx.children.indexOf(child) > ctx.children.indexOf(ctx.ELSE());
				return afterElse ? "alternative" : "consequence";
			}
			return null;
		});
	}

	@Override
	public CstNode visitForStatement(OpenScadParser.ForStatementContext ctx)
	{
		return build(ctx, "for_statement", child ->
		{
			if (child instanceof OpenScadParser.ForBindingContext)
			{
				return "header";
			}
			return child == ctx.statement() ? "body" : null;
		});
	}

	@Override
	public CstNode visitForBinding(OpenScadParser.ForBindingContext ctx)
	{
		return build(ctx, "for_header", child ->
		{
			if (child == ctx.IDENTIFIER() || child == ctx.SPECIAL_VARIABLE())
			{
				return "iterator";
			}
			return child == ctx.expression() ? "range" : null;
		});
	}

	@Override
	public CstNode visitLetStatement(OpenScadParser.LetStatementContext ctx)
	{
		return build(ctx, "let_statement", child ->
		{
			if (child == ctx.letAssignments())
			{
				return "assignments";
			}
			return child == ctx.statement() ? "body" : null;
		});
	}

	@Override
	public CstNode visitLetAssignments(OpenScadParser.LetAssignmentsContext ctx)
	{
		return build(ctx, "let_assignments", NO_FIELDS);
	}

	@Override
	public CstNode visitLetAssignment(OpenScadParser.LetAssignmentContext ctx)
	{
		return build(ctx, "let_assignment", child ->
		{
			if (child == ctx.IDENTIFIER() || child == ctx.SPECIAL_VARIABLE())
			{
				return "name";
			}
			return child == ctx.expression() ? "value" : null;
		});
	}

	// Expressions

	@Override
	public CstNode visitCallExpression(OpenScadParser.CallExpressionContext ctx)
	{
		return build(ctx, "call_expression", child ->
		{
			if (child == ctx.expression())
			{
				return "function";
			}
			return child == ctx.argumentList() ? "arguments" : null;
		});
	}

	@Override
	public CstNode visitIndexExpression(OpenScadParser.IndexExpressionContext ctx)
	{
		return build(ctx, "index_expression", child ->
		{
			if (child == ctx.expression(0))
			{
				return "array";
			}
			return child == ctx.expression(1) ? "index" : null;
		});
	}

	@Override
	public CstNode visitMemberExpression(OpenScadParser.MemberExpressionContext ctx)
	{
		return build(ctx, "member_expression", child ->
		{
			if (child == ctx.expression())
			{
				return "object";
			}
			return child == ctx.IDENTIFIER() ? "property" : null;
		});
	}

	@Override
	public CstNode visitBinaryExpression(OpenScadParser.BinaryExpressionContext ctx)
	{
		return build(ctx, "binary_expression", child ->
		{
			if (child == ctx.expression(0))
			{
				return "left";
			}
			if (child == ctx.expression(1))
			{
				return "right";
			}
			return isToken(child, ctx.operator) ? "operator" : null;
		});
	}

	@Override
	public CstNode visitUnaryExpression(OpenScadParser.UnaryExpressionContext ctx)
	{
		return build(ctx, "unary_expression", child ->
		{
			if (child == ctx.expression())
			{
				return "operand";
			}
			return isToken(child, ctx.operator) ? "operator" : null;
		});
	}

	@Override
	public CstNode visitConditionalExpression(OpenScadParser.ConditionalExpressionContext ctx)
	{
		return build(ctx, "conditional_expression", child ->
		{
			if (child == ctx.expression(0))
			{
				return "condition";
			}
			if (child == ctx.expression(1))
			{
				return "consequence";
			}
			return child == ctx.expression(2) ? "alternative" : null;
		});
	}

	@Override
	public CstNode visitLetExpression(OpenScadParser.LetExpressionContext ctx)
	{
		return build(ctx, "let_expression", child ->
		{
			if (child == ctx.letAssignments())
			{
				return "assignments";
			}
			return child == ctx.expression() ? "body" : null;
		});
	}

	@Override
	public CstNode visitParenthesizedExpression(OpenScadParser.ParenthesizedExpressionContext ctx)
	{
		return build(ctx, "parenthesized_expression", child -> child == ctx.expression() ? "expression" : null);
	}

	@Override
	public CstNode visitRangeExpression(OpenScadParser.RangeExpressionContext ctx)
	{
		return build(ctx, "range_expression", child ->
		{
			if (child == ctx.rangeStart)
			{
				return "start";
			}
			if (child == ctx.rangeStep)
			{
				return "step";
			}
			return child == ctx.rangeEnd ? "end" : null;
		});
	}

	@Override
	public CstNode visitListComprehension(OpenScadParser.ListComprehensionContext ctx)
	{
		return build(ctx, "list_comprehension", child -> child == ctx.listComprehensionElement() ? "element" : null);
	}

	@Override
	public CstNode visitVectorExpression(OpenScadParser.VectorExpressionContext ctx)
	{
		return build(ctx, "vector_expression", NO_FIELDS);
	}

	@Override
	public CstNode visitNumberLiteral(OpenScadParser.NumberLiteralContext ctx)
	{
		return singleLeaf(ctx, "number");
	}

	@Override
	public CstNode visitStringLiteral(OpenScadParser.StringLiteralContext ctx)
	{
		return singleLeaf(ctx, "string");
	}

	@Override
	public CstNode visitBooleanLiteral(OpenScadParser.BooleanLiteralContext ctx)
	{
		return singleLeaf(ctx, "boolean");
	}

	@Override
	public CstNode visitUndefLiteral(OpenScadParser.UndefLiteralContext ctx)
	{
		return singleLeaf(ctx, "undef");
	}

	@Override
	public CstNode visitSpecialVariable(OpenScadParser.SpecialVariableContext ctx)
	{
		return singleLeaf(ctx, "special_variable");
	}

	@Override
	public CstNode visitIdentifier(OpenScadParser.IdentifierContext ctx)
	{
		return singleLeaf(ctx, "identifier");
	}

	@Override
	public CstNode visitVectorElement(OpenScadParser.VectorElementContext ctx)
	{
		if (ctx.exception == null && ctx.getChildCount() == 1 && !(ctx.getChild(0) instanceof TerminalNode))
		{
			return visit(ctx.getChild(0));
		}
		return build(ctx, "vector_element", NO_FIELDS);
	}

	@Override
	public CstNode visitForComprehension(OpenScadParser.ForComprehensionContext ctx)
	{
		return build(ctx, "list_comprehension_for", child ->
		{
			if (child instanceof OpenScadParser.ForBindingContext)
			{
				return "header";
			}
			return child == ctx.vectorElement() ? "body" : null;
		});
	}

	@Override
	public CstNode visitIfComprehension(OpenScadParser.IfComprehensionContext ctx)
	{
		return build(ctx, "list_comprehension_if", child ->
		{
			if (child == ctx.expression())
			{
				return "condition";
			}
			if (child == ctx.vectorElement(0))
			{
				return "consequence";
			}
			return child == ctx.vectorElement(1) ? "alternative" : null;
		});
	}

	@Override
	public CstNode visitEachComprehension(OpenScadParser.EachComprehensionContext ctx)
	{
		return build(ctx, "each_expression", child -> child == ctx.vectorElement() ? "value" : null);
	}

	@Override
	public CstNode visitLetComprehension(OpenScadParser.LetComprehensionContext ctx)
	{
		return build(ctx, "let_comprehension", child ->
		{
			if (child == ctx.letAssignments())
			{
				return "assignments";
			}
			return child == ctx.listComprehensionElement() ? "body" : null;
		});
	}

	/**
	 * Rule contexts ANTLR could not assign to an alternative end up here.
	 */
	@Override
	public CstNode visitChildren(RuleNode node)
	{
		ParserRuleContext ctx = (ParserRuleContext) node.getRuleContext();
		return build(ctx, toSnakeCase(OpenScadParser.ruleNames[ctx.getRuleIndex()]), NO_FIELDS);
	}

	private CstNode singleLeaf(ParserRuleContext ctx, String type)
	{
		if (ctx.exception == null && ctx.getChildCount() == 1 && ctx.getChild(0) instanceof TerminalNode terminal
				&& !(terminal instanceof ErrorNode))
		{
			return leaf(terminal.getSymbol());
		}
		return build(ctx, type, NO_FIELDS);
	}

	private CstNode build(ParserRuleContext ctx, String type, FieldResolver fields)
	{
		List<String> names = new ArrayList<>();
		List<CstNode> nodes = new ArrayList<>();
		collect(ctx, fields, names, nodes);

		int start;
		int end;
		if (nodes.isEmpty())
		{
			start = tokenStart(ctx.getStart());
			end = start;
		}
		else
		{
			start = nodes.stream().mapToInt(CstNode::getStartIndex).min().getAsInt();
			end = nodes.stream().mapToInt(CstNode::getEndIndex).max().getAsInt();
		}

		CstNode node = new CstNode(type, true, source, start, end, point(start), point(end), false);
		for (int i = 0; i < nodes.size(); i++)
		{
			node.appendChild(names.get(i), nodes.get(i));
		}
		if (ctx.exception != null)
		{
			node.markIncomplete();
		}
		return node;
	}

	private void collect(ParserRuleContext ctx, FieldResolver fields, List<String> names, List<CstNode> nodes)
	{
		if (ctx.children == null)
		{
			return;
		}
		List<CstNode> pendingErrors = new ArrayList<>();
		for (ParseTree child : ctx.children)
		{
			if (child instanceof ErrorNode errorNode)
			{
				Token token = errorNode.getSymbol();
				if (token.getStartIndex() < 0)
				{
					flushErrors(pendingErrors, names, nodes);
					names.add(fields.fieldFor(child));
					nodes.add(missingLeaf(token));
				}
				else if (token.getType() != Token.EOF)
				{
					pendingErrors.add(leaf(token));
				}
				continue;
			}

			flushErrors(pendingErrors, names, nodes);
			if (child instanceof TerminalNode terminal)
			{
				if (terminal.getSymbol().getType() == Token.EOF)
				{
					continue;
				}
				names.add(fields.fieldFor(child));
				nodes.add(leaf(terminal.getSymbol()));
			}
			else
			{
				CstNode converted = visit(child);
				if (converted != null)
				{
					names.add(fields.fieldFor(child));
					nodes.add(converted);
				}
			}
		}
		flushErrors(pendingErrors, names, nodes);
	}

	private void flushErrors(List<CstNode> pendingErrors, List<String> names, List<CstNode> nodes)
	{
		if (pendingErrors.isEmpty())
		{
			return;
		}
		int start = pendingErrors.get(0).getStartIndex();
		int end = pendingErrors.get(pendingErrors.size() - 1).getEndIndex();
		CstNode error = new CstNode(CstNode.ERROR, false, source, start, end, point(start), point(end), false);
		pendingErrors.forEach(error::appendChild);
		names.add(null);
		nodes.add(error);
		pendingErrors.clear();
	}

	private CstNode leaf(Token token)
	{
		int start = baseOffset + token.getStartIndex();
		int end = baseOffset + token.getStopIndex() + 1;
		return new CstNode(leafType(token.getType(), token.getText()), isNamedToken(token.getType()), source,
				start, end, point(start), point(end), false);
	}

	private CstNode missingLeaf(Token token)
	{
		int offset = baseOffset + sliceIndex.offsetOf(token.getLine() - 1, token.getCharPositionInLine());
		String literal = OpenScadLexer.VOCABULARY.getLiteralName(token.getType());
		String text = literal != null ? literal.substring(1, literal.length() - 1) : "";
		return new CstNode(leafType(token.getType(), text), isNamedToken(token.getType()), source,
				offset, offset, point(offset), point(offset), true);
	}

	private int tokenStart(Token token)
	{
		if (token == null)
		{
			return baseOffset;
		}
		if (token.getStartIndex() < 0)
		{
			return baseOffset + sliceIndex.offsetOf(token.getLine() - 1, token.getCharPositionInLine());
		}
		return Math.min(source.length(), baseOffset + token.getStartIndex());
	}

	private CstPoint point(int offset)
	{
		return sourceIndex.pointAt(offset);
	}

	private static boolean isToken(ParseTree child, Token token)
	{
		return token != null && child instanceof TerminalNode terminal && terminal.getSymbol() == token;
	}

	private static String leafType(int tokenType, String text)
	{
		return switch (tokenType)
		{
			case OpenScadLexer.IDENTIFIER -> "identifier";
			case OpenScadLexer.SPECIAL_VARIABLE -> "special_variable";
			case OpenScadLexer.NUMBER -> "number";
			case OpenScadLexer.STRING -> "string";
			case OpenScadLexer.TRUE, OpenScadLexer.FALSE -> "boolean";
			case OpenScadLexer.UNDEF -> "undef";
			case OpenScadLexer.INCLUDE_PATH -> "include_path";
			default -> text == null || text.isEmpty() ? OpenScadLexer.VOCABULARY.getDisplayName(tokenType) : text;
		};
	}

	private static boolean isNamedToken(int tokenType)
	{
		return switch (tokenType)
		{
			case OpenScadLexer.IDENTIFIER, OpenScadLexer.SPECIAL_VARIABLE, OpenScadLexer.NUMBER, OpenScadLexer.STRING,
					OpenScadLexer.TRUE, OpenScadLexer.FALSE, OpenScadLexer.UNDEF, OpenScadLexer.INCLUDE_PATH -> true;
			default -> false;
		};
	}

	private static String toSnakeCase(String ruleName)
	{
		StringBuilder sb = new StringBuilder();
		for (char c : ruleName.toCharArray())
		{
			if (Character.isUpperCase(c))
			{
				sb.append('_').append(Character.toLowerCase(c));
			}
			else
			{
				sb.append(c);
			}
		}
		return sb.toString();
	}
}
