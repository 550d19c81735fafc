package org.lokray.scad.semantic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class Scope
{
	private final int id;
	private final String description;
	private final Scope enclosingScope;
	private final Map<Namespace, Map<String, Symbol>> symbols = new EnumMap<>(Namespace.class);

	public Scope(int id, String description, Scope enclosingScope)
	{
		this.id = id;
		this.description = description;
		this.enclosingScope = enclosingScope;
		for (Namespace namespace : Namespace.values())
		{
			symbols.put(namespace, new LinkedHashMap<>());
		}
	}

	public int getId()
	{
		return id;
	}

	public String getDescription()
	{
		return description;
	}

	public Scope getEnclosingScope()
	{
		return enclosingScope;
	}

	/**
	 * Defines {@code symbol} unless its name is already taken in the same namespace of this scope, in
	 * which case the existing symbol is kept and returned. OpenSCAD treats a reassignment as the same
	 * variable.
	 */
	public Symbol define(Symbol symbol)
	{
		return symbols.get(symbol.getNamespace()).computeIfAbsent(symbol.getName(), k -> symbol);
	}

	public Optional<Symbol> resolve(Namespace namespace, String name)
	{
		Optional<Symbol> local = resolveLocally(namespace, name);
		if (local.isPresent())
		{
			return local;
		}
		if (enclosingScope != null)
		{
			return enclosingScope.resolve(namespace, name);
		}
		return Optional.empty();
	}

	public Optional<Symbol> resolveLocally(Namespace namespace, String name)
	{
		return Optional.ofNullable(symbols.get(namespace).get(name));
	}

	public List<Symbol> getSymbols()
	{
		List<Symbol> all = new ArrayList<>();
		symbols.values().forEach(m -> all.addAll(m.values()));
		return Collections.unmodifiableList(all);
	}

	/**
	 * Every name of {@code namespace} visible from here, nearest scope first.
	 */
	public Set<String> visibleNames(Namespace namespace)
	{
		Set<String> names = new LinkedHashSet<>();
		for (Scope scope = this; scope != null; scope = scope.enclosingScope)
		{
			names.addAll(scope.symbols.get(namespace).keySet());
		}
		return names;
	}

	@Override
	public String toString()
	{
		return "Scope#" + id + "(" + description + ")";
	}
}
