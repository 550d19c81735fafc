package org.lokray.scad.query;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LruQueryCacheTest
{
	@Test
	void evictsTheLeastRecentlyUsedEntry()
	{
		LruQueryCache<String> cache = new LruQueryCache<>(2);
		cache.put("q1", "src", "one");
		cache.put("q2", "src", "two");

		assertThat(cache.get("q1", "src")).contains("one");
		cache.put("q3", "src", "three");

		assertThat(cache.get("q2", "src")).isEmpty();
		assertThat(cache.get("q1", "src")).contains("one");
		assertThat(cache.get("q3", "src")).contains("three");
		assertThat(cache.size()).isEqualTo(2);
	}

	@Test
	void sourceTextIsPartOfTheKey()
	{
		LruQueryCache<String> cache = new LruQueryCache<>(10);
		cache.put("(cube)", "cube(1);", "a");

		assertThat(cache.get("(cube)", "cube(2);")).isEmpty();
		assertThat(cache.get("(cube)", "cube(1);")).contains("a");
	}

	@Test
	void countsHitsAndMisses()
	{
		LruQueryCache<String> cache = new LruQueryCache<>(5);
		cache.get("q", "s");
		cache.put("q", "s", "v");
		cache.get("q", "s");
		cache.get("q", "s");

		CacheStats stats = cache.getStats();
		assertThat(stats.getHits()).isEqualTo(2);
		assertThat(stats.getMisses()).isEqualTo(1);
		assertThat(stats.getSize()).isEqualTo(1);
		assertThat(stats.getMaxSize()).isEqualTo(5);
		assertThat(stats.getHitRate()).isEqualTo(2.0 / 3);

		cache.clear();
		assertThat(cache.getStats().getHits()).isZero();
		assertThat(cache.size()).isZero();
	}

	@Test
	void keysCarryDigestAndLength()
	{
		QueryKey key = QueryKey.of("(x)", "abc");

		assertThat(key.getSourceHash()).hasSize(64);
		assertThat(key.getSourceLength()).isEqualTo(3);
		assertThat(key).isEqualTo(QueryKey.of("(x)", "abc"));
		assertThat(key).isNotEqualTo(QueryKey.of("(x)", "abd"));
	}

	@Test
	void sizeMustBePositive()
	{
		assertThatThrownBy(() -> new LruQueryCache<String>(0)).isInstanceOf(IllegalArgumentException.class);
	}
}
