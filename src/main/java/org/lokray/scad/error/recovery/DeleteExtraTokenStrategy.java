package org.lokray.scad.error.recovery;

import org.lokray.scad.cst.CstNode;
import org.lokray.scad.error.ParserError;

import java.util.Optional;

/**
 * Drops the offending node and resumes at its next sibling.
 */
public class DeleteExtraTokenStrategy implements RecoveryStrategy
{
	@Override
	public Optional<CstNode> recover(CstNode errorNode, ParserError error)
	{
		return Optional.ofNullable(errorNode.getNextSibling());
	}

	@Override
	public String getName()
	{
		return "DeleteExtraToken";
	}
}
