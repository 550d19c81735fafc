package org.lokray.scad.builder;

import org.lokray.scad.ast.AstNode;
import org.lokray.scad.ast.ErrorNode;
import org.lokray.scad.ast.LocationMapper;
import org.lokray.scad.ast.NodeKind;
import org.lokray.scad.cst.CstNode;
import org.lokray.scad.cst.CstParseResult;
import org.lokray.scad.error.Diagnostics;
import org.lokray.scad.error.ErrorCode;
import org.lokray.scad.error.ErrorSuggestion;
import org.lokray.scad.error.ParserError;
import org.lokray.scad.error.Severity;
import org.lokray.scad.error.SyntaxError;
import org.lokray.scad.error.recovery.RecoveryStrategy;
import org.lokray.scad.error.recovery.RecoveryStrategyFactory;
import org.lokray.scad.evaluation.ExpressionEvaluatorRegistry;
import org.lokray.scad.util.CancellationToken;
import org.lokray.scad.util.Debug;
import org.lokray.scad.util.ParserConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a CST into AST nodes, one statement at a time. Every statement is built from its own CST
 * subtree only, so a statement always yields the same nodes wherever it is rebuilt.
 * <p>
 * Statements carrying error markers go through the recovery strategies: if building can resume inside
 * the statement it is built as far as possible, otherwise it becomes an {@link ErrorNode} and building
 * continues where the strategy points.
 */
public class AstBuilder
{
	private final ParserConfig config;
	private final NodeHandlerRegistry handlers;
	private final ExpressionEvaluatorRegistry evaluators;
	private final RecoveryStrategyFactory recovery;

	public AstBuilder(ParserConfig config)
	{
		this(config, NodeHandlerRegistry.createDefault(), ExpressionEvaluatorRegistry.createDefault(), new RecoveryStrategyFactory());
	}

	public AstBuilder(ParserConfig config, NodeHandlerRegistry handlers, ExpressionEvaluatorRegistry evaluators,
					  RecoveryStrategyFactory recovery)
	{
		this.config = config;
		this.handlers = handlers;
		this.evaluators = evaluators;
		this.recovery = recovery;
	}

	public NodeHandlerRegistry getHandlers()
	{
		return handlers;
	}

	public List<AstNode> build(CstParseResult parse, Diagnostics diagnostics, CancellationToken token)
	{
		return flatten(buildTopLevel(parse, diagnostics, token));
	}

	/**
	 * Builds the root's children, keeping track of which CST child produced which nodes.
	 * Stops early, returning what was built so far, once {@code token} is cancelled.
	 */
	public List<BuiltStatement> buildTopLevel(CstParseResult parse, Diagnostics diagnostics, CancellationToken token)
	{
		return buildTopLevel(parse, 0, diagnostics, token);
	}

	/**
	 * Builds the root's children from index {@code from} on; the ones before it were built earlier.
	 */
	public List<BuiltStatement> buildTopLevel(CstParseResult parse, int from, Diagnostics diagnostics, CancellationToken token)
	{
		BuildContext context = new BuildContext(this, parse, diagnostics, config, evaluators, token);
		if (parse.getRoot() == null)
		{
			return List.of();
		}
		List<CstNode> children = parse.getRoot().getChildren();
		return buildSequence(children.subList(from, children.size()), context);
	}

	List<AstNode> buildBody(CstNode body, BuildContext context)
	{
		if (body == null || body.isMissing())
		{
			return List.of();
		}
		return flatten(buildSequence(List.of(body), context));
	}

	private List<BuiltStatement> buildSequence(List<CstNode> children, BuildContext context)
	{
		List<BuiltStatement> result = new ArrayList<>();
		int i = 0;
		while (i < children.size())
		{
			if (context.getToken().isCancellationRequested())
			{
				Debug.logDebug("AST build cancelled after " + result.size() + " statement(s)");
				break;
			}

			CstNode child = children.get(i);
			if (!child.isNamed() && !child.isError())
			{
				result.add(new BuiltStatement(child, List.of()));
				i++;
				continue;
			}
			if (!child.hasError())
			{
				result.add(new BuiltStatement(child, buildStatement(child, context)));
				i++;
				continue;
			}

			CstNode marker = firstErrorMarker(child);
			ParserError error = errorFor(child, marker, context);
			Optional<RecoveryStrategy> strategy = recovery.createStrategy(error);
			Optional<CstNode> resume = strategy.flatMap(s -> s.recover(marker, error));
			Debug.logDebug("Recovery for " + error.getCode() + " at " + child + ": "
					+ strategy.map(RecoveryStrategy::getName).orElse("none") + " -> " + resume.map(CstNode::toString).orElse("no resume point"));

			if (resume.isPresent() && !child.isError() && isWithin(resume.get(), child))
			{
				result.add(new BuiltStatement(child, buildStatement(child, context)));
				i++;
				continue;
			}

			result.add(new BuiltStatement(child, List.of(new ErrorNode(LocationMapper.map(child), error.getCode(),
					error.getBaseMessage(), child.getText()))));
			int next = resume.map(node -> indexOf(children, node)).orElse(-1);
			if (next > i)
			{
				for (int skipped = i + 1; skipped < next; skipped++)
				{
					result.add(new BuiltStatement(children.get(skipped), List.of()));
				}
				i = next;
			}
			else
			{
				i++;
			}
		}
		return result;
	}

	private List<AstNode> buildStatement(CstNode node, BuildContext context)
	{
		return switch (node.getType())
		{
			case "statement" ->
			{
				List<AstNode> nodes = new ArrayList<>();
				for (CstNode child : node.getChildren())
				{
					if (child.isNamed())
					{
						nodes.addAll(buildStatement(child, context));
					}
				}
				yield nodes;
			}
			// Bare blocks do not open a node of their own
			case "block" -> flatten(buildSequence(node.getChildren(), context));
			default -> dispatch(node, context);
		};
	}

	private List<AstNode> dispatch(CstNode node, BuildContext context)
	{
		Optional<NodeHandler> handler = handlerFor(node);
		if (handler.isEmpty())
		{
			Debug.logWarning("No handler for node type '" + node.getType() + "'");
			return List.of(new ErrorNode(LocationMapper.map(node), ErrorCode.INTERNAL_ERROR,
					"No handler for node type '" + node.getType() + "'", node.getText()));
		}

		try
		{
			AstNode built = handler.get().handle(node, context);
			return built == null ? List.of() : List.of(built);
		}
		catch (RuntimeException e)
		{
			ParserError error = new ParserError("Failed to build " + node.getType() + ": " + e.getMessage(),
					ErrorCode.INTERNAL_ERROR, Severity.ERROR, context.getSource(), context.positionOf(node.getStartIndex()),
					List.of(), Map.of("nodeType", node.getType()), e);
			context.report(error);
			return List.of(new ErrorNode(LocationMapper.map(node), ErrorCode.INTERNAL_ERROR, error.getBaseMessage(), node.getText()));
		}
		catch (StackOverflowError e)
		{
			Debug.logWarning("Ran out of stack building " + node.getType() + " at offset " + node.getStartIndex());
			ParserError error = new ParserError("Failed to build " + node.getType() + ": nested too deeply",
					ErrorCode.INTERNAL_ERROR, Severity.ERROR, context.getSource(), context.positionOf(node.getStartIndex()),
					List.of(), Map.of("nodeType", node.getType()), null);
			context.report(error);
			return List.of(new ErrorNode(LocationMapper.map(node), ErrorCode.INTERNAL_ERROR, error.getBaseMessage(), node.getText()));
		}
	}

	/**
	 * Module calls look up the module name first and fall back to the generic instantiation handler.
	 */
	private Optional<NodeHandler> handlerFor(CstNode node)
	{
		if (NodeKind.MODULE_INSTANTIATION.getKey().equals(node.getType()))
		{
			CstNode name = node.getChildForFieldName("name");
			String moduleName = name == null ? "" : name.getText();
			boolean isModuleKey = NodeKind.fromKey(moduleName).map(NodeKind::isCallShaped).orElse(true);
			if (isModuleKey)
			{
				Optional<NodeHandler> byName = handlers.getHandler(moduleName);
				if (byName.isPresent())
				{
					return byName;
				}
			}
		}
		return handlers.getHandler(node.getType());
	}

	/**
	 * The syntax error reported between the start of {@code child} and the start of whatever follows it.
	 * Without one, an error is made up from the marker.
	 */
	private static ParserError errorFor(CstNode child, CstNode marker, BuildContext context)
	{
		CstNode next = child.getNextSibling();
		int limit = next != null ? next.getStartIndex() : context.getSource().length();
		for (SyntaxError error : context.getSyntaxErrors())
		{
			int offset = error.getPosition().getOffset();
			if (offset >= child.getStartIndex() && (offset < limit || offset == child.getEndIndex()))
			{
				return error;
			}
		}
		if (marker.isMissing())
		{
			return SyntaxError.missingToken(marker.getType(), context.getSource(), context.positionOf(marker.getStartIndex()));
		}
		String text = marker.getText().length() > 20 ? marker.getText().substring(0, 20) + "..." : marker.getText();
		return new SyntaxError("Syntax error near '" + text + "'", ErrorCode.SYNTAX_ERROR, context.getSource(),
				context.positionOf(marker.getStartIndex()), List.of(new ErrorSuggestion("Check the statement syntax")));
	}

	private static CstNode firstErrorMarker(CstNode node)
	{
		if (node.isError() || node.isMissing())
		{
			return node;
		}
		for (CstNode child : node.getChildren())
		{
			if (child.hasError())
			{
				return firstErrorMarker(child);
			}
		}
		// An unfinished rule without a marker below it
		return node;
	}

	private static boolean isWithin(CstNode node, CstNode ancestor)
	{
		for (CstNode current = node; current != null; current = current.getParent())
		{
			if (current == ancestor)
			{
				return true;
			}
		}
		return false;
	}

	/**
	 * Index of the element of {@code sequence} that is {@code node} or contains it, or -1.
	 */
	private static int indexOf(List<CstNode> sequence, CstNode node)
	{
		for (CstNode current = node; current != null; current = current.getParent())
		{
			for (int i = 0; i < sequence.size(); i++)
			{
				if (sequence.get(i) == current)
				{
					return i;
				}
			}
		}
		return -1;
	}

	public static List<AstNode> flatten(List<BuiltStatement> statements)
	{
		List<AstNode> nodes = new ArrayList<>();
		statements.forEach(s -> nodes.addAll(s.getNodes()));
		return nodes;
	}
}
