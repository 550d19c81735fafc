package org.lokray.scad.semantic;

import java.util.ArrayList;
import java.util.List;

/**
 * Document outline: modules, functions and variables declared at file level, plus the parameters of
 * each module and function as its children.
 */
public class SymbolProvider
{
	public static class OutlineEntry
	{
		private final Symbol symbol;
		private final List<OutlineEntry> children;

		public OutlineEntry(Symbol symbol, List<OutlineEntry> children)
		{
			this.symbol = symbol;
			this.children = List.copyOf(children);
		}

		public Symbol getSymbol()
		{
			return symbol;
		}

		public String getName()
		{
			return symbol.getName();
		}

		public SymbolKind getKind()
		{
			return symbol.getKind();
		}

		public List<OutlineEntry> getChildren()
		{
			return children;
		}

		@Override
		public String toString()
		{
			return symbol.getKind().name().toLowerCase() + " " + symbol.getName() + (children.isEmpty() ? "" : " " + children);
		}
	}

	public List<OutlineEntry> outline(SymbolTable table)
	{
		List<Symbol> topLevel = new ArrayList<>(table.getGlobalScope().getSymbols());
		topLevel.sort((a, b) -> Integer.compare(a.getDeclarationLocation().getStart().getOffset(),
				b.getDeclarationLocation().getStart().getOffset()));

		List<OutlineEntry> entries = new ArrayList<>();
		for (Symbol symbol : topLevel)
		{
			entries.add(new OutlineEntry(symbol, parametersOf(symbol, table)));
		}
		return entries;
	}

	private List<OutlineEntry> parametersOf(Symbol owner, SymbolTable table)
	{
		if (owner.getKind() != SymbolKind.MODULE && owner.getKind() != SymbolKind.FUNCTION)
		{
			return List.of();
		}
		// Parameter scopes are named after the definition that opens them
		String description = owner.getKind().name().toLowerCase() + " " + owner.getName();
		List<OutlineEntry> parameters = new ArrayList<>();
		for (SymbolReference reference : table.getReferences())
		{
			Symbol symbol = reference.getSymbol();
			if (reference.isDeclaration() && symbol != null && symbol.getKind() == SymbolKind.PARAMETER)
			{
				Scope scope = reference.getScope();
				if (scope.getEnclosingScope() == table.getGlobalScope() && scope.getDescription().equals(description))
				{
					parameters.add(new OutlineEntry(symbol, List.of()));
				}
			}
		}
		return parameters;
	}
}
