package org.lokray.scad.query;

import org.lokray.scad.cst.CstNode;
import org.lokray.scad.cst.CstParseResult;
import org.lokray.scad.util.Debug;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs queries against a CST, caching compiled queries by text and results by query and source.
 */
public class QueryManager
{
	private final LruQueryCache<List<CstNode>> cache;
	private final Map<String, Query> compiled = new HashMap<>();

	public QueryManager(int cacheSize)
	{
		this(new LruQueryCache<>(cacheSize));
	}

	public QueryManager(LruQueryCache<List<CstNode>> cache)
	{
		this.cache = cache;
	}

	/**
	 * Captured nodes of {@code query} over the whole tree.
	 *
	 * @throws QueryException when the query does not compile
	 */
	public List<CstNode> executeQuery(String query, CstParseResult tree)
	{
		return execute(query, query, tree.getRoot(), tree.getSource());
	}

	/**
	 * Like {@link #executeQuery} but below {@code node} only.
	 */
	public List<CstNode> executeQueryOnNode(String query, CstNode node, String source)
	{
		String key = query + ":" + node.getStartIndex() + "-" + node.getEndIndex();
		return execute(key, query, node, source);
	}

	public List<CstNode> findNodesByType(String type, CstParseResult tree)
	{
		return executeQuery("(" + type + ") @node", tree);
	}

	public List<CstNode> findNodesByTypes(List<String> types, CstParseResult tree)
	{
		return executeQuery(String.join("\n", types.stream().map(t -> "(" + t + ") @node").toList()), tree);
	}

	public CacheStats getCacheStats()
	{
		return cache.getStats();
	}

	public void clearCache()
	{
		cache.clear();
	}

	private List<CstNode> execute(String cacheKey, String query, CstNode root, String source)
	{
		Optional<List<CstNode>> cached = cache.get(cacheKey, source);
		if (cached.isPresent())
		{
			return cached.get();
		}
		Query compiledQuery = compiled.computeIfAbsent(query, q -> new QueryCompiler().compile(q));
		List<CstNode> results = root == null ? List.of()
				: compiledQuery.captures(root).stream().map(QueryCapture::getNode).toList();
		Debug.logDebug("Query " + query + " matched " + results.size() + " node(s)");
		cache.put(cacheKey, source, results);
		return results;
	}
}
