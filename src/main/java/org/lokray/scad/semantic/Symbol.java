package org.lokray.scad.semantic;

import org.lokray.scad.ast.SourceLocation;

/**
 * A declared name. Identity matters: two declarations with the same name in different scopes are
 * different symbols, so equality is left to {@link Object}.
 */
public class Symbol
{
	private final String name;
	private final SymbolKind kind;
	private final SourceLocation declarationLocation;
	private final int scopeId;

	public Symbol(String name, SymbolKind kind, SourceLocation declarationLocation, int scopeId)
	{
		this.name = name;
		this.kind = kind;
		this.declarationLocation = declarationLocation;
		this.scopeId = scopeId;
	}

	public String getName()
	{
		return name;
	}

	public SymbolKind getKind()
	{
		return kind;
	}

	public Namespace getNamespace()
	{
		return kind.getNamespace();
	}

	/**
	 * Null for builtins.
	 */
	public SourceLocation getDeclarationLocation()
	{
		return declarationLocation;
	}

	public int getScopeId()
	{
		return scopeId;
	}

	public boolean isBuiltin()
	{
		return declarationLocation == null;
	}

	@Override
	public String toString()
	{
		return kind.name().toLowerCase() + " " + name + (isBuiltin() ? " (builtin)" : " @" + declarationLocation);
	}
}
