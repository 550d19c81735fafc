package org.lokray.scad.error.recovery;

import org.lokray.scad.cst.CstNode;
import org.lokray.scad.error.ParserError;

import java.util.Optional;

/**
 * Decides where building resumes after an error marker in the CST. Strategies never touch the source
 * text; an empty result means there is no sensible place to resume from this marker.
 */
public interface RecoveryStrategy
{
	Optional<CstNode> recover(CstNode errorNode, ParserError error);

	String getName();
}
