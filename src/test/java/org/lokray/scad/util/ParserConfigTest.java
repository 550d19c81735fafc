package org.lokray.scad.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ParserConfigTest
{
	@Test
	void loadsValuesFromTheClasspath()
	{
		ParserConfig config = ParserConfig.load("scad-parser-test.json");

		assertThat(config.getMaxRecursionDepth()).isEqualTo(64);
		assertThat(config.getQueryCacheMaxSize()).isEqualTo(8);
		assertThat(config.getMaxRangeElements()).isEqualTo(500);
		assertThat(config.isMemoizationEnabled()).isFalse();
		assertThat(config.isDebug()).isFalse();
	}

	@Test
	void bundledConfigurationMatchesTheDefaults()
	{
		ParserConfig config = ParserConfig.load();

		assertThat(config.getMaxRecursionDepth()).isEqualTo(ParserConfig.DEFAULT_MAX_RECURSION_DEPTH);
		assertThat(config.getQueryCacheMaxSize()).isEqualTo(ParserConfig.DEFAULT_QUERY_CACHE_MAX_SIZE);
		assertThat(config.getMaxRangeElements()).isEqualTo(ParserConfig.DEFAULT_MAX_RANGE_ELEMENTS);
		assertThat(config.isMemoizationEnabled()).isTrue();
	}

	@Test
	void missingResourceFallsBackToDefaults()
	{
		ParserConfig config = ParserConfig.load("does-not-exist.json");

		assertThat(config.getMaxRecursionDepth()).isEqualTo(ParserConfig.DEFAULT_MAX_RECURSION_DEPTH);
		assertThat(config.getQueryCacheMaxSize()).isEqualTo(ParserConfig.DEFAULT_QUERY_CACHE_MAX_SIZE);
	}

	@Test
	void nonPositiveLimitsAreReplaced()
	{
		ParserConfig config = ParserConfig.load("scad-parser-invalid.json");

		assertThat(config.getMaxRecursionDepth()).isEqualTo(ParserConfig.DEFAULT_MAX_RECURSION_DEPTH);
		assertThat(config.getQueryCacheMaxSize()).isEqualTo(ParserConfig.DEFAULT_QUERY_CACHE_MAX_SIZE);
		assertThat(config.getMaxRangeElements()).isEqualTo(20);
	}

	@Test
	void malformedJsonFallsBackToDefaults()
	{
		ParserConfig config = ParserConfig.load("scad-parser-broken.json");

		assertThat(config.getMaxRecursionDepth()).isEqualTo(ParserConfig.DEFAULT_MAX_RECURSION_DEPTH);
	}

	@Test
	void settersChain()
	{
		ParserConfig config = ParserConfig.defaults().setMaxRecursionDepth(10).setMaxRangeElements(3).setQueryCacheMaxSize(2);

		assertThat(config.getMaxRecursionDepth()).isEqualTo(10);
		assertThat(config.getMaxRangeElements()).isEqualTo(3);
		assertThat(config.getQueryCacheMaxSize()).isEqualTo(2);
		assertThat(config.getReservedKeywords()).contains("module", "function", "for");
	}
}
