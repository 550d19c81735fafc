package org.lokray.scad.semantic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Result of one symbol pass over an AST: the scopes that were opened and every name occurrence.
 * Tables are rebuilt after each edit and never updated in place.
 */
public class SymbolTable
{
	private final Scope builtinScope;
	private final Scope globalScope;
	private final List<Scope> scopes;
	private final List<SymbolReference> references;

	public SymbolTable(Scope builtinScope, Scope globalScope, List<Scope> scopes, List<SymbolReference> references)
	{
		this.builtinScope = builtinScope;
		this.globalScope = globalScope;
		this.scopes = List.copyOf(scopes);
		this.references = List.copyOf(references);
	}

	public Scope getBuiltinScope()
	{
		return builtinScope;
	}

	public Scope getGlobalScope()
	{
		return globalScope;
	}

	public Optional<Scope> getScope(int id)
	{
		return scopes.stream().filter(s -> s.getId() == id).findFirst();
	}

	public List<SymbolReference> getReferences()
	{
		return references;
	}

	/**
	 * The innermost occurrence covering {@code offset}.
	 */
	public Optional<SymbolReference> findReferenceAt(int offset)
	{
		return references.stream()
				.filter(r -> r.getLocation().contains(offset))
				.min(Comparator.comparingInt(r -> r.getLocation().length()));
	}

	/**
	 * Declarations and uses bound to {@code symbol}, ordered by offset.
	 */
	public List<SymbolReference> findReferences(Symbol symbol)
	{
		return references.stream()
				.filter(r -> r.getSymbol() == symbol)
				.sorted(Comparator.comparingInt(r -> r.getLocation().getStart().getOffset()))
				.toList();
	}

	/**
	 * Every symbol declared in the text, in scope order; builtins are not included.
	 */
	public List<Symbol> getSymbols()
	{
		List<Symbol> symbols = new ArrayList<>();
		for (Scope scope : scopes)
		{
			if (scope != builtinScope)
			{
				symbols.addAll(scope.getSymbols());
			}
		}
		return Collections.unmodifiableList(symbols);
	}

	public List<SymbolReference> getUnresolved()
	{
		return references.stream().filter(r -> !r.isResolved()).toList();
	}
}
