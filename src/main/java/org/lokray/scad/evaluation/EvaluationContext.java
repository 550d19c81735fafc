package org.lokray.scad.evaluation;

import org.lokray.scad.cst.CstNode;
import org.lokray.scad.util.Debug;
import org.lokray.scad.util.ParserConfig;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * State of one evaluation pass: variable scopes, builtin functions, the memo cache and the recursion counter.
 * The memo cache is dropped whenever a variable binding changes.
 */
public class EvaluationContext
{
	private static final Map<String, EvaluationResult> BUILTIN_CONSTANTS = Map.of("PI", EvaluationResult.number(Math.PI));

	private final ParserConfig config;
	private final Deque<Map<String, EvaluationResult>> scopes = new ArrayDeque<>();
	private final Map<String, BuiltinFunction> functions;
	private final Map<String, EvaluationResult> memo = new HashMap<>();
	private final List<String> warnings = new ArrayList<>();
	private int depth;

	public EvaluationContext()
	{
		this(ParserConfig.defaults());
	}

	public EvaluationContext(ParserConfig config)
	{
		this.config = config;
		this.functions = new HashMap<>(BuiltinFunctions.defaults());
		scopes.push(new HashMap<>());
	}

	public static String cacheKey(CstNode node)
	{
		return node.getType() + ":" + node.getText() + ":" + node.getStartIndex() + "-" + node.getEndIndex();
	}

	public ParserConfig getConfig()
	{
		return config;
	}

	public void pushScope()
	{
		scopes.push(new HashMap<>());
		memo.clear();
	}

	public void popScope()
	{
		if (scopes.size() > 1)
		{
			scopes.pop();
			memo.clear();
		}
	}

	public void setVariable(String name, EvaluationResult value)
	{
		scopes.peek().put(name, value);
		memo.clear();
	}

	public Optional<EvaluationResult> getVariable(String name)
	{
		for (Map<String, EvaluationResult> scope : scopes)
		{
			EvaluationResult value = scope.get(name);
			if (value != null)
			{
				return Optional.of(value);
			}
		}
		return Optional.ofNullable(BUILTIN_CONSTANTS.get(name));
	}

	public boolean hasVariable(String name)
	{
		return getVariable(name).isPresent();
	}

	public Optional<BuiltinFunction> getFunction(String name)
	{
		return Optional.ofNullable(functions.get(name));
	}

	public void registerFunction(String name, BuiltinFunction function)
	{
		functions.put(name, function);
		memo.clear();
	}

	/**
	 * @return false when entering would exceed the configured depth limit
	 */
	public boolean enter()
	{
		if (depth >= config.getMaxRecursionDepth())
		{
			return false;
		}
		depth++;
		return true;
	}

	public void exit()
	{
		depth--;
	}

	public int getDepth()
	{
		return depth;
	}

	public Optional<EvaluationResult> getCached(String key)
	{
		if (!config.isMemoizationEnabled())
		{
			return Optional.empty();
		}
		return Optional.ofNullable(memo.get(key));
	}

	public void cache(String key, EvaluationResult result)
	{
		if (config.isMemoizationEnabled())
		{
			memo.put(key, result);
		}
	}

	public int getCacheSize()
	{
		return memo.size();
	}

	public void addWarning(String warning)
	{
		warnings.add(warning);
		Debug.logDebug("[Evaluation] " + warning);
	}

	public List<String> getWarnings()
	{
		return Collections.unmodifiableList(warnings);
	}
}
