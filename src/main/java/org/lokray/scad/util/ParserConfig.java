package org.lokray.scad.util;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.lokray.scad.semantic.rename.ReservedKeywords;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Tunables of the parser pipeline. Values are read from the classpath resource
 * {@value #RESOURCE_NAME}; any field the resource leaves out keeps its default.
 */
public class ParserConfig
{
	public static final String RESOURCE_NAME = "scad-parser.json";

	public static final int DEFAULT_MAX_RECURSION_DEPTH = 1000;
	public static final int DEFAULT_QUERY_CACHE_MAX_SIZE = 100;
	public static final int DEFAULT_MAX_RANGE_ELEMENTS = 10000;

	private int maxRecursionDepth = DEFAULT_MAX_RECURSION_DEPTH;
	private int queryCacheMaxSize = DEFAULT_QUERY_CACHE_MAX_SIZE;
	private int maxRangeElements = DEFAULT_MAX_RANGE_ELEMENTS;
	private boolean enableMemoization = true;
	private boolean debug = false;

	public static ParserConfig defaults()
	{
		return new ParserConfig();
	}

	public static ParserConfig load()
	{
		return load(RESOURCE_NAME);
	}

	public static ParserConfig load(String resourceName)
	{
		InputStream in = ParserConfig.class.getClassLoader().getResourceAsStream(resourceName);
		if (in == null)
		{
			Debug.logDebug("No parser configuration '" + resourceName + "' on the classpath, using defaults.");
			return defaults();
		}

		try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8))
		{
			ParserConfig config = new Gson().fromJson(reader, ParserConfig.class);
			if (config == null)
			{
				return defaults();
			}
			config.sanitize();
			if (config.debug)
			{
				Debug.ENABLE_DEBUG = true;
			}
			return config;
		}
		catch (IOException | JsonParseException e)
		{
			Debug.logWarning("Failed to load parser configuration '" + resourceName + "' | Reason: " + e.getMessage());
			return defaults();
		}
	}

	private void sanitize()
	{
		if (maxRecursionDepth <= 0)
		{
			Debug.logWarning("maxRecursionDepth must be positive, falling back to " + DEFAULT_MAX_RECURSION_DEPTH);
			maxRecursionDepth = DEFAULT_MAX_RECURSION_DEPTH;
		}
		if (queryCacheMaxSize <= 0)
		{
			Debug.logWarning("queryCacheMaxSize must be positive, falling back to " + DEFAULT_QUERY_CACHE_MAX_SIZE);
			queryCacheMaxSize = DEFAULT_QUERY_CACHE_MAX_SIZE;
		}
		if (maxRangeElements <= 0)
		{
			Debug.logWarning("maxRangeElements must be positive, falling back to " + DEFAULT_MAX_RANGE_ELEMENTS);
			maxRangeElements = DEFAULT_MAX_RANGE_ELEMENTS;
		}
	}

	public int getMaxRecursionDepth()
	{
		return maxRecursionDepth;
	}

	public ParserConfig setMaxRecursionDepth(int maxRecursionDepth)
	{
		this.maxRecursionDepth = maxRecursionDepth;
		return this;
	}

	public int getQueryCacheMaxSize()
	{
		return queryCacheMaxSize;
	}

	public ParserConfig setQueryCacheMaxSize(int queryCacheMaxSize)
	{
		this.queryCacheMaxSize = queryCacheMaxSize;
		return this;
	}

	public int getMaxRangeElements()
	{
		return maxRangeElements;
	}

	public ParserConfig setMaxRangeElements(int maxRangeElements)
	{
		this.maxRangeElements = maxRangeElements;
		return this;
	}

	public boolean isMemoizationEnabled()
	{
		return enableMemoization;
	}

	public ParserConfig setMemoizationEnabled(boolean enableMemoization)
	{
		this.enableMemoization = enableMemoization;
		return this;
	}

	public boolean isDebug()
	{
		return debug;
	}

	/**
	 * The reserved words of the language. Fixed by the language, not by this file.
	 */
	public Set<String> getReservedKeywords()
	{
		return ReservedKeywords.all();
	}
}
