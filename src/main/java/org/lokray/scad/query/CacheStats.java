package org.lokray.scad.query;

public class CacheStats
{
	private final long hits;
	private final long misses;
	private final int size;
	private final int maxSize;

	public CacheStats(long hits, long misses, int size, int maxSize)
	{
		this.hits = hits;
		this.misses = misses;
		this.size = size;
		this.maxSize = maxSize;
	}

	public long getHits()
	{
		return hits;
	}

	public long getMisses()
	{
		return misses;
	}

	public int getSize()
	{
		return size;
	}

	public int getMaxSize()
	{
		return maxSize;
	}

	public double getHitRate()
	{
		long total = hits + misses;
		return total == 0 ? 0 : (double) hits / total;
	}

	@Override
	public String toString()
	{
		return "CacheStats[hits=" + hits + ", misses=" + misses + ", size=" + size + "/" + maxSize + "]";
	}
}
