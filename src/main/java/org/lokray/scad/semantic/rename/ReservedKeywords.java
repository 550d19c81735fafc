package org.lokray.scad.semantic.rename;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Words a symbol may never be renamed to: the language keywords plus the names of builtin modules.
 */
public final class ReservedKeywords
{
	private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

	private static final Set<String> KEYWORDS = Set.of(
			"module", "function", "if", "else", "for", "let", "each",
			"true", "false", "undef", "PI", "include", "use",
			"translate", "rotate", "scale", "mirror", "resize", "multmatrix", "color",
			"linear_extrude", "rotate_extrude", "projection",
			"cube", "sphere", "cylinder", "polyhedron", "polygon",
			"circle", "square", "text", "surface",
			"union", "difference", "intersection", "hull", "minkowski",
			"offset", "import", "echo", "assert", "children", "render");

	private ReservedKeywords()
	{
	}

	public static Set<String> all()
	{
		return KEYWORDS;
	}

	public static boolean isReserved(String word)
	{
		return KEYWORDS.contains(word);
	}

	public static boolean isValidIdentifier(String name)
	{
		return name != null && IDENTIFIER.matcher(name).matches() && !isReserved(name);
	}
}
