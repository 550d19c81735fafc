package org.lokray.scad.semantic.rename;

import org.lokray.scad.ast.SourceLocation;
import org.lokray.scad.semantic.Scope;
import org.lokray.scad.semantic.Symbol;
import org.lokray.scad.semantic.SymbolKind;
import org.lokray.scad.semantic.SymbolReference;
import org.lokray.scad.semantic.SymbolTable;
import org.lokray.scad.util.CancellationToken;
import org.lokray.scad.util.Debug;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class RenameService
{
	private final SymbolTableSource source;

	public RenameService(SymbolTableSource source)
	{
		this.source = source;
	}

	/**
	 * Checks that a rename can start at {@code offset}.
	 *
	 * @return the identifier range and its text, or null when cancelled or nothing is parsed yet
	 * @throws NoSymbolAtPositionException  when no declared name sits at {@code offset}
	 * @throws CannotRenameConstantException when the name is a builtin constant such as {@code PI}
	 */
	public PrepareRenameResult prepareRename(int offset, CancellationToken token)
	{
		if (token.isCancellationRequested() || !source.isReady())
		{
			return null;
		}
		SymbolReference reference = source.getSymbolTable().findReferenceAt(offset)
				.filter(SymbolReference::isResolved)
				.orElseThrow(() -> new NoSymbolAtPositionException(offset));
		if (reference.getSymbol().getKind() == SymbolKind.CONSTANT)
		{
			throw new CannotRenameConstantException(reference.getName());
		}
		return new PrepareRenameResult(reference.getLocation(), reference.getName());
	}

	/**
	 * Every occurrence of the symbol at {@code offset}, rewritten to {@code newName}, or null when the
	 * rename is not possible. Never throws.
	 */
	public RenameEdits provideRenameEdits(int offset, String newName, CancellationToken token)
	{
		if (token.isCancellationRequested() || !source.isReady())
		{
			return null;
		}
		try
		{
			SymbolTable table = source.getSymbolTable();
			Optional<SymbolReference> target = table.findReferenceAt(offset).filter(SymbolReference::isResolved);
			if (target.isEmpty())
			{
				Debug.logDebug("Rename: no symbol at offset " + offset);
				return null;
			}
			Symbol symbol = target.get().getSymbol();
			if (symbol.getKind() == SymbolKind.CONSTANT || symbol.isBuiltin())
			{
				return null;
			}
			if (!ReservedKeywords.isValidIdentifier(newName))
			{
				Debug.logDebug("Rename: '" + newName + "' is not a usable identifier");
				return null;
			}

			List<SymbolReference> references = table.findReferences(symbol);
			if (!newName.equals(symbol.getName()) && collides(table, symbol, references, newName))
			{
				Debug.logDebug("Rename: '" + newName + "' would clash with an existing declaration");
				return null;
			}
			if (token.isCancellationRequested())
			{
				return null;
			}

			List<TextEdit> edits = new ArrayList<>();
			for (SymbolReference reference : references)
			{
				SourceLocation location = reference.getLocation();
				edits.add(new TextEdit(location, newName));
			}
			return new RenameEdits(edits);
		}
		catch (RuntimeException e)
		{
			Debug.logWarning("Rename failed: " + e.getMessage());
			return null;
		}
	}

	/**
	 * True when {@code newName} is already declared next to the symbol, or when some occurrence would
	 * be captured by a declaration of {@code newName} sitting between it and the symbol's scope.
	 */
	private static boolean collides(SymbolTable table, Symbol symbol, List<SymbolReference> references, String newName)
	{
		Scope home = table.getScope(symbol.getScopeId()).orElseThrow();
		if (home.resolveLocally(symbol.getNamespace(), newName).isPresent())
		{
			return true;
		}
		for (SymbolReference reference : references)
		{
			for (Scope scope = reference.getScope(); scope != null && scope != home; scope = scope.getEnclosingScope())
			{
				if (scope.resolveLocally(symbol.getNamespace(), newName).isPresent())
				{
					return true;
				}
			}
		}
		return false;
	}
}
