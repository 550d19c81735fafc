package org.lokray.scad.semantic.rename;

import org.lokray.scad.semantic.SymbolTable;

/**
 * Whatever holds the current parse; rename asks it for a fresh table on every request.
 */
public interface SymbolTableSource
{
	boolean isReady();

	SymbolTable getSymbolTable();
}
