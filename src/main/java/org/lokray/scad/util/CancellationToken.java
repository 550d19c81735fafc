package org.lokray.scad.util;

/**
 * Cooperative cancellation flag handed in by the editor. Long operations poll it and
 * return an empty result once it is set.
 */
public class CancellationToken
{
	/**
	 * A token that is never cancelled.
	 */
	public static final CancellationToken NONE = new CancellationToken(false);

	private final boolean cancellable;
	private volatile boolean cancelled;

	public CancellationToken()
	{
		this(true);
	}

	private CancellationToken(boolean cancellable)
	{
		this.cancellable = cancellable;
	}

	public void cancel()
	{
		if (cancellable)
		{
			cancelled = true;
		}
	}

	public boolean isCancellationRequested()
	{
		return cancelled;
	}
}
