package org.lokray.scad.error;

import org.lokray.scad.ast.Position;

import java.util.List;

/**
 * Structural problems: missing, unexpected or unmatched tokens.
 */
public class SyntaxError extends ParserError
{
	public SyntaxError(String message, ErrorCode code, String source, Position position, List<ErrorSuggestion> suggestions)
	{
		super(message, code, Severity.ERROR, source, position, suggestions);
	}

	public static SyntaxError missingToken(String tokenName, String source, Position position)
	{
		return new SyntaxError("Missing " + tokenName, ErrorCode.MISSING_TOKEN, source, position,
				List.of(new ErrorSuggestion("Add the missing " + tokenName, tokenName)));
	}

	public static SyntaxError unexpectedToken(String foundToken, String expectedToken, String source, Position position)
	{
		return new SyntaxError(
				String.format("Unexpected token '%s', expected '%s'", foundToken, expectedToken),
				ErrorCode.UNEXPECTED_TOKEN, source, position,
				List.of(new ErrorSuggestion(String.format("Replace '%s' with '%s'", foundToken, expectedToken), expectedToken)));
	}

	public static SyntaxError unexpectedTokenExpecting(String foundToken, String description, String source, Position position)
	{
		return new SyntaxError(
				String.format("Unexpected token '%s', expected %s", foundToken, description),
				ErrorCode.UNEXPECTED_TOKEN, source, position,
				List.of(new ErrorSuggestion(String.format("Remove '%s'", foundToken))));
	}

	public static SyntaxError unmatchedToken(String openToken, String closeToken, String source, Position position)
	{
		ErrorCode code = switch (closeToken)
		{
			case "]" -> ErrorCode.UNCLOSED_BRACKET;
			case ")" -> ErrorCode.UNCLOSED_PAREN;
			case "}" -> ErrorCode.UNCLOSED_BRACE;
			default -> ErrorCode.SYNTAX_ERROR;
		};
		return new SyntaxError(
				String.format("Unmatched '%s', missing '%s'", openToken, closeToken),
				code, source, position,
				List.of(new ErrorSuggestion(String.format("Add the missing '%s'", closeToken), closeToken)));
	}

	public static SyntaxError missingSemicolon(String source, Position position)
	{
		return new SyntaxError("Missing semicolon", ErrorCode.MISSING_SEMICOLON, source, position,
				List.of(new ErrorSuggestion("Add a semicolon at the end of the statement", ";")));
	}

	public static SyntaxError invalidCharacter(String character, String source, Position position)
	{
		return new SyntaxError(String.format("Invalid character '%s'", character), ErrorCode.INVALID_CHARACTER, source, position,
				List.of(new ErrorSuggestion(String.format("Remove the character '%s'", character))));
	}

	public static SyntaxError unexpectedEndOfInput(String expectedToken, String source, Position position)
	{
		return new SyntaxError(String.format("Unexpected end of input, expected '%s'", expectedToken), ErrorCode.UNEXPECTED_EOF,
				source, position,
				List.of(new ErrorSuggestion(String.format("Complete the statement with '%s'", expectedToken), expectedToken)));
	}

	public static SyntaxError unexpectedEndOfInputExpecting(String description, String source, Position position)
	{
		return new SyntaxError("Unexpected end of input, expected " + description, ErrorCode.UNEXPECTED_EOF, source, position,
				List.of(new ErrorSuggestion("Complete the statement")));
	}

	public static SyntaxError nestingTooDeep(String source, Position position)
	{
		return new SyntaxError("Statement is nested too deeply to parse", ErrorCode.SYNTAX_ERROR, source, position,
				List.of(new ErrorSuggestion("Split the expression into smaller named parts")));
	}
}
