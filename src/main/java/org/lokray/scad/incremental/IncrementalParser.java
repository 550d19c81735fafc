package org.lokray.scad.incremental;

import org.lokray.scad.builder.AstBuilder;
import org.lokray.scad.builder.BuiltStatement;
import org.lokray.scad.cst.CstNode;
import org.lokray.scad.cst.CstParseResult;
import org.lokray.scad.cst.CstParser;
import org.lokray.scad.error.Diagnostics;
import org.lokray.scad.error.SyntaxError;
import org.lokray.scad.util.CancellationToken;
import org.lokray.scad.util.Debug;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the CST and AST of the clean top-level statements in front of an edit and reparses the
 * rest. The statement right before the edit is always reparsed, since the edit may extend it.
 * The result equals what a full parse of the new text would produce.
 */
public class IncrementalParser
{
	private final CstParser parser;
	private final AstBuilder builder;

	public IncrementalParser(CstParser parser, AstBuilder builder)
	{
		this.parser = parser;
		this.builder = builder;
	}

	public ParseSnapshot parse(String text, Diagnostics diagnostics, CancellationToken token)
	{
		CstParseResult cst = parser.parse(text);
		diagnostics.reportAll(cst.getSyntaxErrors());
		return new ParseSnapshot(cst, builder.buildTopLevel(cst, diagnostics, token), 0);
	}

	/**
	 * Applies {@code edit} to {@code previous}. Falls back to a full parse when there is nothing to
	 * reuse or the edit does not describe the difference between the two texts.
	 */
	public ParseSnapshot reparse(ParseSnapshot previous, String newText, InputEdit edit, Diagnostics diagnostics,
								 CancellationToken token)
	{
		if (previous == null || !previous.isComplete())
		{
			return parse(newText, diagnostics, token);
		}
		if (!edit.isConsistentWith(previous.getSource(), newText))
		{
			Debug.logWarning("Edit " + edit + " does not match the text; parsing from scratch");
			return parse(newText, diagnostics, token);
		}

		int keep = reusablePrefix(previous, edit);
		if (keep == 0)
		{
			return parse(newText, diagnostics, token);
		}

		CstParseResult cst = parser.reparse(previous.getCst(), keep, newText);
		diagnostics.reportAll(cst.getSyntaxErrors());
		List<BuiltStatement> statements = new ArrayList<>(previous.getStatements().subList(0, keep));
		statements.addAll(builder.buildTopLevel(cst, keep, diagnostics, token));
		Debug.logDebug("Incremental reparse reused " + keep + " of " + previous.getStatements().size() + " top-level node(s)");
		return new ParseSnapshot(cst, statements, keep);
	}

	/**
	 * Number of leading root children that can be carried over: clean, ending before the edit and
	 * before any syntax error of the old parse, minus one for the statement the edit may extend.
	 */
	static int reusablePrefix(ParseSnapshot previous, InputEdit edit)
	{
		int limit = edit.getStartIndex();
		for (SyntaxError error : previous.getCst().getSyntaxErrors())
		{
			limit = Math.min(limit, error.getPosition().getOffset());
		}

		List<CstNode> children = previous.getCst().getRoot().getChildren();
		int keep = 0;
		while (keep < children.size())
		{
			CstNode child = children.get(keep);
			if (child.hasError() || child.getEndIndex() >= limit)
			{
				break;
			}
			keep++;
		}
		return Math.max(0, keep - 1);
	}
}
