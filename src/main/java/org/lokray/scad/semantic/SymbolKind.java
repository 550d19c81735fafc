package org.lokray.scad.semantic;

public enum SymbolKind
{
	VARIABLE(Namespace.VARIABLE),
	FUNCTION(Namespace.FUNCTION),
	MODULE(Namespace.MODULE),
	PARAMETER(Namespace.VARIABLE),
	CONSTANT(Namespace.VARIABLE);

	private final Namespace namespace;

	SymbolKind(Namespace namespace)
	{
		this.namespace = namespace;
	}

	public Namespace getNamespace()
	{
		return namespace;
	}
}
