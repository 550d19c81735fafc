package org.lokray.scad.error.recovery;

import org.lokray.scad.error.ErrorSuggestion;
import org.lokray.scad.error.ParserError;

import java.util.Optional;

/**
 * Picks a recovery strategy from the error code. Semantic problems have none, the tree is intact.
 */
public class RecoveryStrategyFactory
{
	private final RecoveryStrategy skipToNextStatement = new SkipToNextStatementStrategy();
	private final RecoveryStrategy insertMissingToken = new InsertMissingTokenStrategy();
	private final RecoveryStrategy deleteExtraToken = new DeleteExtraTokenStrategy();

	public Optional<RecoveryStrategy> createStrategy(ParserError error)
	{
		return switch (error.getCode())
		{
			case MISSING_SEMICOLON, MISSING_TOKEN, UNCLOSED_BRACKET, UNCLOSED_BRACE, UNCLOSED_PAREN ->
					Optional.of(hasReplacement(error) ? insertMissingToken : skipToNextStatement);
			case UNEXPECTED_TOKEN, INVALID_CHARACTER -> Optional.of(deleteExtraToken);
			case SYNTAX_ERROR, UNEXPECTED_EOF -> Optional.of(skipToNextStatement);
			case TYPE_MISMATCH, UNDEFINED_VARIABLE, INVALID_ARGUMENTS, MISSING_REQUIRED_PARAMETER, INTERNAL_ERROR ->
					Optional.empty();
		};
	}

	private static boolean hasReplacement(ParserError error)
	{
		return error.getSuggestions().stream().map(ErrorSuggestion::getReplacement).anyMatch(Optional::isPresent);
	}
}
