package org.lokray.scad.cst;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.lokray.scad.ast.LocationMapper;
import org.lokray.scad.error.SyntaxError;
import org.lokray.scad.parser.OpenScadLexer;
import org.lokray.scad.parser.OpenScadParser;
import org.lokray.scad.util.Debug;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point to the grammar layer: runs the generated lexer and parser and hands back a CST.
 */
public class CstParser
{
	public CstParseResult parse(String text)
	{
		return parseFrom(text, 0);
	}

	/**
	 * Parses {@code text[offset..]} as a sequence of statements. Positions in the returned tree
	 * and errors are relative to the whole of {@code text}. {@code offset} must lie on a statement boundary.
	 */
	public CstParseResult parseFrom(String text, int offset)
	{
		LineIndex sourceIndex = new LineIndex(text);
		try
		{
			return parseRange(text, offset, text.length(), sourceIndex);
		}
		catch (StackOverflowError e)
		{
			Debug.logWarning("Input from offset " + offset + " nests too deeply to parse in one piece, parsing it statement by statement");
			return parseByStatement(text, offset, sourceIndex);
		}
	}

	private CstParseResult parseRange(String text, int start, int end, LineIndex sourceIndex)
	{
		String slice = text.substring(start, end);
		LineIndex sliceIndex = start == 0 && end == text.length() ? sourceIndex : new LineIndex(slice);

		SyntaxErrorListener errorListener = new SyntaxErrorListener(text, start, sourceIndex, sliceIndex);
		OpenScadParser parser = createParser(slice, errorListener);
		ParseTree tree = parser.sourceFile();

		CstNode root = new CstTreeBuilder(text, start, sourceIndex, sliceIndex).visit(tree);
		Debug.logDebug("Parsed " + (end - start) + " characters from offset " + start
				+ " with " + errorListener.getErrors().size() + " syntax error(s)");
		return new CstParseResult(text, root, errorListener.getErrors(), sourceIndex);
	}

	/**
	 * Parses each top-level statement on its own. A statement that still overflows the stack becomes
	 * an {@code ERROR} node with a syntax error; the statements around it are kept.
	 */
	private CstParseResult parseByStatement(String text, int offset, LineIndex sourceIndex)
	{
		List<String> fields = new ArrayList<>();
		List<CstNode> children = new ArrayList<>();
		List<SyntaxError> errors = new ArrayList<>();
		boolean incomplete = false;

		for (int[] range : statementRanges(text, offset))
		{
			try
			{
				CstParseResult piece = parseRange(text, range[0], range[1], sourceIndex);
				CstNode pieceRoot = piece.getRoot();
				for (int i = 0; i < pieceRoot.getChildCount(); i++)
				{
					fields.add(pieceRoot.getFieldNameForChild(i));
					children.add(pieceRoot.getChild(i));
				}
				errors.addAll(piece.getSyntaxErrors());
				incomplete |= pieceRoot.isIncomplete();
			}
			catch (StackOverflowError e)
			{
				int start = range[0];
				while (start < range[1] && Character.isWhitespace(text.charAt(start)))
				{
					start++;
				}
				Debug.logWarning("Statement at offset " + start + " nests too deeply to parse");
				fields.add(null);
				children.add(new CstNode(CstNode.ERROR, false, text, start, range[1],
						sourceIndex.pointAt(start), sourceIndex.pointAt(range[1]), false));
				errors.add(SyntaxError.nestingTooDeep(text, LocationMapper.positionAt(sourceIndex, start)));
			}
		}

		CstNode root = new CstNode("source_file", true, text, offset, text.length(),
				sourceIndex.pointAt(offset), sourceIndex.pointAt(text.length()), false);
		for (int i = 0; i < children.size(); i++)
		{
			root.appendChild(fields.get(i), children.get(i));
		}
		if (incomplete)
		{
			root.markIncomplete();
		}
		return new CstParseResult(text, root, errors, sourceIndex);
	}

	/**
	 * Splits {@code text[offset..]} at the ends of top-level statements using the lexer alone:
	 * a {@code ;} or a closing {@code }} back at bracket depth zero, or an include path, unless an
	 * {@code else} follows.
	 */
	static List<int[]> statementRanges(String text, int offset)
	{
		OpenScadLexer lexer = new OpenScadLexer(CharStreams.fromString(text.substring(offset)));
		lexer.removeErrorListeners();
		List<Token> tokens = new ArrayList<>();
		for (Token token = lexer.nextToken(); token.getType() != Token.EOF; token = lexer.nextToken())
		{
			if (token.getChannel() == Token.DEFAULT_CHANNEL)
			{
				tokens.add(token);
			}
		}

		List<int[]> ranges = new ArrayList<>();
		int depth = 0;
		int start = offset;
		for (int i = 0; i < tokens.size(); i++)
		{
			Token token = tokens.get(i);
			int next = i + 1 < tokens.size() ? tokens.get(i + 1).getType() : Token.EOF;
			boolean boundary = switch (token.getType())
			{
				case OpenScadLexer.LPAREN, OpenScadLexer.LBRACKET, OpenScadLexer.LBRACE ->
				{
					depth++;
					yield false;
				}
				case OpenScadLexer.RPAREN, OpenScadLexer.RBRACKET ->
				{
					depth = Math.max(0, depth - 1);
					yield false;
				}
				case OpenScadLexer.RBRACE ->
				{
					depth = Math.max(0, depth - 1);
					yield depth == 0 && next != OpenScadLexer.ELSE;
				}
				case OpenScadLexer.SEMI -> depth == 0 && next != OpenScadLexer.ELSE;
				case OpenScadLexer.INCLUDE_PATH -> depth == 0 && next != OpenScadLexer.SEMI;
				default -> false;
			};
			if (boundary)
			{
				int end = offset + token.getStopIndex() + 1;
				ranges.add(new int[]{start, end});
				start = end;
			}
		}
		if (start < text.length())
		{
			ranges.add(new int[]{start, text.length()});
		}
		return ranges;
	}

	/**
	 * Reparses {@code text} after the first {@code keep} children of the previous root and grafts those
	 * children in front of the freshly parsed ones. The kept children must end before the first
	 * difference between the old and new text. They are moved into the new tree, so the previous
	 * tree must not be used afterwards.
	 */
	public CstParseResult reparse(CstParseResult previous, int keep, String text)
	{
		CstNode oldRoot = previous.getRoot();
		int offset = keep == 0 ? 0 : oldRoot.getChild(keep - 1).getEndIndex();
		CstParseResult suffix = parseFrom(text, offset);
		if (keep == 0)
		{
			return suffix;
		}

		LineIndex index = suffix.getLineIndex();
		CstNode tail = suffix.getRoot();
		CstNode root = new CstNode("source_file", true, text, 0, text.length(), index.pointAt(0), index.pointAt(text.length()), false);
		List<String> fields = new ArrayList<>();
		List<CstNode> children = new ArrayList<>();
		for (int i = 0; i < keep; i++)
		{
			fields.add(oldRoot.getFieldNameForChild(i));
			children.add(oldRoot.getChild(i));
		}
		for (int i = 0; i < tail.getChildCount(); i++)
		{
			fields.add(tail.getFieldNameForChild(i));
			children.add(tail.getChild(i));
		}
		for (int i = 0; i < children.size(); i++)
		{
			root.appendChild(fields.get(i), children.get(i));
		}
		if (tail.isIncomplete())
		{
			root.markIncomplete();
		}
		Debug.logDebug("Reparse kept " + keep + " top-level node(s), reparsed from offset " + offset);
		return new CstParseResult(text, root, suffix.getSyntaxErrors(), index);
	}

	/**
	 * Parses a single expression, e.g. one segment of a range.
	 */
	public CstParseResult parseExpression(String text)
	{
		LineIndex index = new LineIndex(text);
		SyntaxErrorListener errorListener = new SyntaxErrorListener(text, 0, index, index);
		try
		{
			OpenScadParser parser = createParser(text, errorListener);
			ParseTree tree = parser.standaloneExpression();

			CstNode root = new CstTreeBuilder(text, 0, index, index).visit(tree);
			return new CstParseResult(text, root, errorListener.getErrors(), index);
		}
		catch (StackOverflowError e)
		{
			Debug.logWarning("Expression nests too deeply to parse");
			CstNode root = new CstNode(CstNode.ERROR, false, text, 0, text.length(), index.pointAt(0), index.pointAt(text.length()), false);
			return new CstParseResult(text, root, List.of(SyntaxError.nestingTooDeep(text, LocationMapper.positionAt(index, 0))), index);
		}
	}

	private static OpenScadParser createParser(String text, SyntaxErrorListener errorListener)
	{
		CharStream input = CharStreams.fromString(text);
		OpenScadLexer lexer = new OpenScadLexer(input);
		lexer.removeErrorListeners();
		lexer.addErrorListener(errorListener);

		CommonTokenStream tokens = new CommonTokenStream(lexer);
		OpenScadParser parser = new OpenScadParser(tokens);
		parser.removeErrorListeners();
		parser.addErrorListener(errorListener);
		return parser;
	}
}
