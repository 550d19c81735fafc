package org.lokray.scad.query;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Cache key for a query run against one source text. The text is kept only as its SHA-256 digest
 * and length.
 */
public class QueryKey
{
	private final String query;
	private final String sourceHash;
	private final int sourceLength;

	public QueryKey(String query, String sourceHash, int sourceLength)
	{
		this.query = query;
		this.sourceHash = sourceHash;
		this.sourceLength = sourceLength;
	}

	public static QueryKey of(String query, String source)
	{
		return new QueryKey(query, sha256(source), source.length());
	}

	static String sha256(String text)
	{
		try
		{
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
		}
		catch (NoSuchAlgorithmException e)
		{
			// Every JDK ships SHA-256
			throw new IllegalStateException(e);
		}
	}

	public String getQuery()
	{
		return query;
	}

	public String getSourceHash()
	{
		return sourceHash;
	}

	public int getSourceLength()
	{
		return sourceLength;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof QueryKey other))
		{
			return false;
		}
		return sourceLength == other.sourceLength && query.equals(other.query) && sourceHash.equals(other.sourceHash);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(query, sourceHash, sourceLength);
	}

	@Override
	public String toString()
	{
		return query + ":" + sourceHash.substring(0, 12) + "/" + sourceLength;
	}
}
