package org.lokray.scad.builder;

import org.lokray.scad.ast.AstNode;
import org.lokray.scad.ast.LocationMapper;
import org.lokray.scad.ast.Position;
import org.lokray.scad.cst.CstNode;
import org.lokray.scad.cst.CstParseResult;
import org.lokray.scad.error.Diagnostics;
import org.lokray.scad.error.ParserError;
import org.lokray.scad.error.SyntaxError;
import org.lokray.scad.evaluation.ExpressionEvaluatorRegistry;
import org.lokray.scad.util.CancellationToken;
import org.lokray.scad.util.ParserConfig;

import java.util.List;

/**
 * Everything a handler may need while one CST is turned into an AST.
 */
public class BuildContext
{
	private final AstBuilder builder;
	private final CstParseResult parse;
	private final Diagnostics diagnostics;
	private final ParserConfig config;
	private final ExpressionEvaluatorRegistry evaluators;
	private final ExpressionBuilder expressions;
	private final CancellationToken token;

	public BuildContext(AstBuilder builder, CstParseResult parse, Diagnostics diagnostics, ParserConfig config,
						ExpressionEvaluatorRegistry evaluators, CancellationToken token)
	{
		this.builder = builder;
		this.parse = parse;
		this.diagnostics = diagnostics;
		this.config = config;
		this.evaluators = evaluators;
		this.token = token;
		this.expressions = new ExpressionBuilder(this);
	}

	public String getSource()
	{
		return parse.getSource();
	}

	public List<SyntaxError> getSyntaxErrors()
	{
		return parse.getSyntaxErrors();
	}

	public Diagnostics getDiagnostics()
	{
		return diagnostics;
	}

	public ParserConfig getConfig()
	{
		return config;
	}

	public ExpressionEvaluatorRegistry getEvaluators()
	{
		return evaluators;
	}

	public ExpressionBuilder getExpressions()
	{
		return expressions;
	}

	public CancellationToken getToken()
	{
		return token;
	}

	public Position positionOf(int offset)
	{
		return LocationMapper.positionAt(parse.getLineIndex(), offset);
	}

	public void report(ParserError error)
	{
		diagnostics.report(error);
	}

	/**
	 * Builds the statements of a body: a block's contents, a single statement, or nothing for {@code ;}.
	 */
	public List<AstNode> buildBody(CstNode body)
	{
		return builder.buildBody(body, this);
	}
}
