package org.lokray.scad.cst;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps character offsets of a text to row/column points and back.
 */
public class LineIndex
{
	private final String text;
	private final int[] lineStarts;

	public LineIndex(String text)
	{
		this.text = text;
		List<Integer> starts = new ArrayList<>();
		starts.add(0);
		for (int i = 0; i < text.length(); i++)
		{
			if (text.charAt(i) == '\n')
			{
				starts.add(i + 1);
			}
		}
		this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
	}

	public int getLineCount()
	{
		return lineStarts.length;
	}

	public CstPoint pointAt(int offset)
	{
		int clamped = Math.max(0, Math.min(offset, text.length()));
		int low = 0;
		int high = lineStarts.length - 1;
		while (low < high)
		{
			int mid = (low + high + 1) >>> 1;
			if (lineStarts[mid] <= clamped)
			{
				low = mid;
			}
			else
			{
				high = mid - 1;
			}
		}
		return new CstPoint(low, clamped - lineStarts[low]);
	}

	/**
	 * Offset of the given row and column. Columns past the end of the line clamp to the line end.
	 */
	public int offsetOf(int row, int column)
	{
		if (row < 0)
		{
			return 0;
		}
		if (row >= lineStarts.length)
		{
			return text.length();
		}
		int lineEnd = row + 1 < lineStarts.length ? lineStarts[row + 1] - 1 : text.length();
		return Math.min(lineStarts[row] + Math.max(0, column), lineEnd);
	}

	public String lineText(int row)
	{
		if (row < 0 || row >= lineStarts.length)
		{
			return "";
		}
		int end = row + 1 < lineStarts.length ? lineStarts[row + 1] - 1 : text.length();
		String line = text.substring(lineStarts[row], end);
		return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
	}
}
