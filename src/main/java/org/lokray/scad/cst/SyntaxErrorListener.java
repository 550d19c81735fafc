package org.lokray.scad.cst;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.lokray.scad.ast.LocationMapper;
import org.lokray.scad.ast.Position;
import org.lokray.scad.error.ErrorCode;
import org.lokray.scad.error.SyntaxError;
import org.lokray.scad.parser.OpenScadLexer;
import org.lokray.scad.util.Debug;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects ANTLR's syntax reports as typed {@link SyntaxError}s and routes them
 * through the Debug.logError system.
 */
public class SyntaxErrorListener extends BaseErrorListener
{
	private static final Pattern MISSING = Pattern.compile("^missing (.+?) at (.+)$");
	private static final Pattern EXTRANEOUS = Pattern.compile("^extraneous input (.+?) expecting (.+)$");
	private static final Pattern MISMATCHED = Pattern.compile("^mismatched input (.+?) expecting (.+)$");
	private static final Pattern NO_VIABLE = Pattern.compile("^no viable alternative at input (.+)$");

	private static final List<String> CLOSING_TOKENS = List.of(";", ")", "]", "}", ",");
	private static final Map<String, String> OPENERS = Map.of("]", "[", ")", "(", "}", "{");

	private final String source;
	private final int baseOffset;
	private final LineIndex sourceIndex;
	private final LineIndex sliceIndex;
	private final List<SyntaxError> errors = new ArrayList<>();

	/**
	 * @param source      the complete session text
	 * @param baseOffset  offset in {@code source} where the lexed slice starts
	 * @param sourceIndex line index of {@code source}
	 * @param sliceIndex  line index of the lexed slice
	 */
	public SyntaxErrorListener(String source, int baseOffset, LineIndex sourceIndex, LineIndex sliceIndex)
	{
		this.source = source;
		this.baseOffset = baseOffset;
		this.sourceIndex = sourceIndex;
		this.sliceIndex = sliceIndex;
	}

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e)
	{
		int offset;
		if (offendingSymbol instanceof Token token && token.getStartIndex() >= 0)
		{
			offset = baseOffset + token.getStartIndex();
		}
		else
		{
			offset = baseOffset + sliceIndex.offsetOf(line - 1, charPositionInLine);
		}
		Position position = LocationMapper.positionAt(sourceIndex, offset);

		String err = String.format("[Syntax Error] line %d:%d - %s", position.getLine() + 1, position.getColumn() + 1, msg);
		Debug.logError(err);

		errors.add(classify(msg, offendingSymbol, position));
	}

	private SyntaxError classify(String msg, Object offendingSymbol, Position position)
	{
		Matcher m = MISSING.matcher(msg);
		if (m.matches())
		{
			String token = unquote(m.group(1));
			if (";".equals(token))
			{
				return SyntaxError.missingSemicolon(source, position);
			}
			if (OPENERS.containsKey(token))
			{
				return SyntaxError.unmatchedToken(OPENERS.get(token), token, source, position);
			}
			return SyntaxError.missingToken(token, source, position);
		}

		m = EXTRANEOUS.matcher(msg);
		if (!m.matches())
		{
			m = MISMATCHED.matcher(msg);
		}
		if (m.matches())
		{
			return unexpected(unquote(m.group(1)), expectedToken(m.group(2)), "an expression", offendingSymbol, position);
		}

		m = NO_VIABLE.matcher(msg);
		if (m.matches())
		{
			String found = offendingSymbol instanceof Token token ? token.getText() : m.group(1);
			return unexpected(found, null, "a statement", offendingSymbol, position);
		}

		return new SyntaxError(msg, ErrorCode.SYNTAX_ERROR, source, position, List.of());
	}

	/**
	 * @param expected    the token to offer as a fix, or null when no single token fits
	 * @param description what the parser wanted when {@code expected} is null
	 */
	private SyntaxError unexpected(String found, String expected, String description, Object offendingSymbol, Position position)
	{
		if (offendingSymbol instanceof Token token)
		{
			if (token.getType() == Token.EOF)
			{
				return expected != null
						? SyntaxError.unexpectedEndOfInput(expected, source, position)
						: SyntaxError.unexpectedEndOfInputExpecting(description, source, position);
			}
			if (token.getType() == OpenScadLexer.ERROR_CHAR)
			{
				return SyntaxError.invalidCharacter(token.getText(), source, position);
			}
		}
		return expected != null
				? SyntaxError.unexpectedToken(found, expected, source, position)
				: SyntaxError.unexpectedTokenExpecting(found, description, source, position);
	}

	/**
	 * ANTLR prints expected sets as {@code {';', '{'}} in vocabulary order, so keywords come first.
	 * A terminator or closing bracket in the set is the likely fix; any other set of several
	 * alternatives has no single token worth offering.
	 */
	static String expectedToken(String expected)
	{
		String trimmed = expected.trim();
		if (!(trimmed.startsWith("{") && trimmed.endsWith("}")))
		{
			return unquote(trimmed);
		}
		List<String> alternatives = new ArrayList<>();
		for (String alternative : trimmed.substring(1, trimmed.length() - 1).split(", "))
		{
			if (!alternative.isBlank())
			{
				alternatives.add(unquote(alternative));
			}
		}
		for (String closing : CLOSING_TOKENS)
		{
			if (alternatives.contains(closing))
			{
				return closing;
			}
		}
		return alternatives.size() == 1 ? alternatives.get(0) : null;
	}

	private static String unquote(String text)
	{
		String t = text.trim();
		if (t.length() >= 2 && t.startsWith("'") && t.endsWith("'"))
		{
			return t.substring(1, t.length() - 1);
		}
		return t;
	}

	public List<SyntaxError> getErrors()
	{
		return Collections.unmodifiableList(errors);
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}
}
