package org.lokray.scad.incremental;

import java.util.Objects;

/**
 * One contiguous text change: {@code [startIndex, oldEndIndex)} of the old text was replaced by
 * {@code [startIndex, newEndIndex)} of the new one.
 */
public class InputEdit
{
	private final int startIndex;
	private final int oldEndIndex;
	private final int newEndIndex;

	public InputEdit(int startIndex, int oldEndIndex, int newEndIndex)
	{
		this.startIndex = startIndex;
		this.oldEndIndex = oldEndIndex;
		this.newEndIndex = newEndIndex;
	}

	/**
	 * The edit that turns {@code oldText} into {@code newText}, found by trimming their common prefix
	 * and suffix.
	 */
	public static InputEdit between(String oldText, String newText)
	{
		int prefix = 0;
		int max = Math.min(oldText.length(), newText.length());
		while (prefix < max && oldText.charAt(prefix) == newText.charAt(prefix))
		{
			prefix++;
		}
		int suffix = 0;
		while (suffix < max - prefix
				&& oldText.charAt(oldText.length() - 1 - suffix) == newText.charAt(newText.length() - 1 - suffix))
		{
			suffix++;
		}
		return new InputEdit(prefix, oldText.length() - suffix, newText.length() - suffix);
	}

	public int getStartIndex()
	{
		return startIndex;
	}

	public int getOldEndIndex()
	{
		return oldEndIndex;
	}

	public int getNewEndIndex()
	{
		return newEndIndex;
	}

	/**
	 * How far text after the edit moved.
	 */
	public int getDelta()
	{
		return newEndIndex - oldEndIndex;
	}

	/**
	 * True when applying this edit to {@code oldText} can produce {@code newText}: the bounds fit both
	 * texts and the untouched prefix and suffix agree.
	 */
	public boolean isConsistentWith(String oldText, String newText)
	{
		if (startIndex < 0 || oldEndIndex < startIndex || newEndIndex < startIndex
				|| oldEndIndex > oldText.length() || newEndIndex > newText.length())
		{
			return false;
		}
		int oldSuffix = oldText.length() - oldEndIndex;
		if (oldSuffix != newText.length() - newEndIndex)
		{
			return false;
		}
		return oldText.regionMatches(0, newText, 0, startIndex)
				&& oldText.regionMatches(oldEndIndex, newText, newEndIndex, oldSuffix);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (!(o instanceof InputEdit other))
		{
			return false;
		}
		return startIndex == other.startIndex && oldEndIndex == other.oldEndIndex && newEndIndex == other.newEndIndex;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(startIndex, oldEndIndex, newEndIndex);
	}

	@Override
	public String toString()
	{
		return "InputEdit[" + startIndex + ", " + oldEndIndex + " -> " + newEndIndex + "]";
	}
}
