package org.lokray.scad.query;

import org.lokray.scad.util.Debug;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded query result cache. Reads count as use, so the entry evicted on overflow is the one least
 * recently read or written. Not thread-safe; a session owns its cache.
 */
public class LruQueryCache<V>
{
	private final int maxSize;
	private final Map<QueryKey, V> entries;
	private long hits;
	private long misses;

	public LruQueryCache(int maxSize)
	{
		if (maxSize <= 0)
		{
			throw new IllegalArgumentException("maxSize must be positive, got " + maxSize);
		}
		this.maxSize = maxSize;
		this.entries = new LinkedHashMap<>(16, 0.75f, true)
		{
			@Override
			protected boolean removeEldestEntry(Map.Entry<QueryKey, V> eldest)
			{
				boolean evict = size() > LruQueryCache.this.maxSize;
				if (evict)
				{
					Debug.logDebug("Query cache evicted " + eldest.getKey());
				}
				return evict;
			}
		};
	}

	public Optional<V> get(String query, String source)
	{
		V value = entries.get(QueryKey.of(query, source));
		if (value == null)
		{
			misses++;
			return Optional.empty();
		}
		hits++;
		return Optional.of(value);
	}

	public void put(String query, String source, V value)
	{
		entries.put(QueryKey.of(query, source), value);
	}

	public int size()
	{
		return entries.size();
	}

	/**
	 * Drops every entry and resets the counters.
	 */
	public void clear()
	{
		entries.clear();
		hits = 0;
		misses = 0;
	}

	public CacheStats getStats()
	{
		return new CacheStats(hits, misses, entries.size(), maxSize);
	}
}
