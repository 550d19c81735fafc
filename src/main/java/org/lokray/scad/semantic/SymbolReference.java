package org.lokray.scad.semantic;

import org.lokray.scad.ast.SourceLocation;

/**
 * One occurrence of a name in the text. {@code symbol} is null for a use that did not resolve.
 */
public class SymbolReference
{
	private final String name;
	private final Namespace namespace;
	private final Symbol symbol;
	private final SourceLocation location;
	private final boolean declaration;
	private final Scope scope;

	public SymbolReference(String name, Namespace namespace, Symbol symbol, SourceLocation location, boolean declaration, Scope scope)
	{
		this.name = name;
		this.namespace = namespace;
		this.symbol = symbol;
		this.location = location;
		this.declaration = declaration;
		this.scope = scope;
	}

	public String getName()
	{
		return name;
	}

	public Namespace getNamespace()
	{
		return namespace;
	}

	public Symbol getSymbol()
	{
		return symbol;
	}

	public boolean isResolved()
	{
		return symbol != null;
	}

	public SourceLocation getLocation()
	{
		return location;
	}

	public boolean isDeclaration()
	{
		return declaration;
	}

	/**
	 * The scope the occurrence sits in.
	 */
	public Scope getScope()
	{
		return scope;
	}

	@Override
	public String toString()
	{
		return (declaration ? "decl " : "ref ") + name + " @" + location;
	}
}
