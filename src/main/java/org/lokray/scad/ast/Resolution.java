package org.lokray.scad.ast;

import java.util.Objects;
import java.util.Optional;

/**
 * The {@code $fn}, {@code $fa} and {@code $fs} arguments of a curved primitive, each optional.
 */
public class Resolution
{
	public static final Resolution NONE = new Resolution(null, null, null);

	private final Double fn;
	private final Double fa;
	private final Double fs;

	public Resolution(Double fn, Double fa, Double fs)
	{
		this.fn = fn;
		this.fa = fa;
		this.fs = fs;
	}

	public Optional<Double> getFn()
	{
		return Optional.ofNullable(fn);
	}

	public Optional<Double> getFa()
	{
		return Optional.ofNullable(fa);
	}

	public Optional<Double> getFs()
	{
		return Optional.ofNullable(fs);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof Resolution other))
		{
			return false;
		}
		return Objects.equals(fn, other.fn) && Objects.equals(fa, other.fa) && Objects.equals(fs, other.fs);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(fn, fa, fs);
	}
}
