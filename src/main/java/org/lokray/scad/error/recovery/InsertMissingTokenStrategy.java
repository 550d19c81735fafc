package org.lokray.scad.error.recovery;

import org.lokray.scad.cst.CstNode;
import org.lokray.scad.error.ErrorSuggestion;
import org.lokray.scad.error.ParserError;

import java.util.Optional;

/**
 * Carries on as if the suggested token were present: building resumes at the marker itself.
 */
public class InsertMissingTokenStrategy implements RecoveryStrategy
{
	@Override
	public Optional<CstNode> recover(CstNode errorNode, ParserError error)
	{
		boolean hasReplacement = error.getSuggestions().stream().map(ErrorSuggestion::getReplacement).anyMatch(Optional::isPresent);
		return hasReplacement ? Optional.of(errorNode) : Optional.empty();
	}

	@Override
	public String getName()
	{
		return "InsertMissingToken";
	}
}
