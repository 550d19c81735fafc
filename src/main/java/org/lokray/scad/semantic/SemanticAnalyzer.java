package org.lokray.scad.semantic;

import org.lokray.scad.ast.AstNode;
import org.lokray.scad.ast.AstWalker;
import org.lokray.scad.ast.CallNode;
import org.lokray.scad.ast.CylinderNode;
import org.lokray.scad.ast.NodeKind;
import org.lokray.scad.ast.Parameter;
import org.lokray.scad.error.Diagnostics;
import org.lokray.scad.error.SemanticError;
import org.lokray.scad.util.Debug;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Warnings that need more than the CST: names that resolve nowhere and primitive calls with bad
 * arguments. Nothing here stops the AST from being used.
 */
public class SemanticAnalyzer
{
	private static final int MAX_SUGGESTION_DISTANCE = 2;

	private static final Map<NodeKind, Set<String>> KNOWN_PARAMETERS = Map.of(
			NodeKind.CUBE, Set.of("size", "center"),
			NodeKind.SPHERE, Set.of("r", "d"),
			NodeKind.CYLINDER, Set.of("h", "r", "r1", "r2", "d", "d1", "d2", "center"));

	private final String source;
	private final Diagnostics diagnostics;

	public SemanticAnalyzer(String source, Diagnostics diagnostics)
	{
		this.source = source;
		this.diagnostics = diagnostics;
	}

	public void analyze(List<AstNode> ast, SymbolTable table)
	{
		int before = diagnostics.getProblems().size();
		checkUnresolved(table);
		AstWalker.walk(ast, node ->
		{
			if (node instanceof CallNode call && KNOWN_PARAMETERS.containsKey(call.getKind()))
			{
				checkArguments(call);
			}
		});
		Debug.logDebug("Semantic analysis reported " + (diagnostics.getProblems().size() - before) + " problem(s)");
	}

	private void checkUnresolved(SymbolTable table)
	{
		for (SymbolReference reference : table.getUnresolved())
		{
			if (reference.getNamespace() != Namespace.VARIABLE)
			{
				continue;
			}
			List<String> candidates = closest(reference.getName(), reference.getScope().visibleNames(Namespace.VARIABLE));
			diagnostics.report(SemanticError.undefinedVariable(reference.getName(), candidates, source,
					reference.getLocation().getStart()));
		}
	}

	private void checkArguments(CallNode call)
	{
		Set<String> known = KNOWN_PARAMETERS.get(call.getKind());
		for (Parameter parameter : call.getParameters())
		{
			if (!parameter.isPositional() && !parameter.isSpecialVariable() && !known.contains(parameter.getName()))
			{
				diagnostics.report(SemanticError.invalidParameter(parameter.getName(), call.getName(), source,
						parameter.getLocation().getStart()));
			}
		}
		// A height given as a non-constant expression still counts
		if (call instanceof CylinderNode cylinder && cylinder.getH().isEmpty() && cylinder.getParameter("h", 0).isEmpty())
		{
			diagnostics.report(SemanticError.missingRequiredParameter("h", call.getName(), source,
					call.getNameLocation().getStart()));
		}
	}

	static List<String> closest(String name, Iterable<String> candidates)
	{
		List<String> matches = new ArrayList<>();
		for (String candidate : candidates)
		{
			if (!candidate.equals(name) && levenshtein(name, candidate) <= MAX_SUGGESTION_DISTANCE)
			{
				matches.add(candidate);
			}
		}
		return matches;
	}

	static int levenshtein(String a, String b)
	{
		int[] previous = new int[b.length() + 1];
		int[] current = new int[b.length() + 1];
		for (int j = 0; j <= b.length(); j++)
		{
			previous[j] = j;
		}
		for (int i = 1; i <= a.length(); i++)
		{
			current[0] = i;
			for (int j = 1; j <= b.length(); j++)
			{
				int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
				current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
			}
			int[] swap = previous;
			previous = current;
			current = swap;
		}
		return previous[b.length()];
	}
}
