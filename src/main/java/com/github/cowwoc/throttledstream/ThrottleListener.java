package com.github.cowwoc.throttledstream;

/**
 * Listens for throttled stream events.
 * <p>
 * Listeners are invoked on the reading thread, so they must return promptly.
 */
public interface ThrottleListener
{
	/**
	 * Invoked before the reading thread blocks to wait for a quota.
	 *
	 * @param stream     the stream being read
	 * @param rateSource the source that the thread is about to wait on
	 */
	default void beforeQuotaWait(ThrottledInputStream stream, RateSource rateSource)
	{
	}

	/**
	 * Invoked once, after the wrapped stream reports the end of its data.
	 *
	 * @param stream the stream that was read to completion
	 */
	default void endOfStream(ThrottledInputStream stream)
	{
	}
}
