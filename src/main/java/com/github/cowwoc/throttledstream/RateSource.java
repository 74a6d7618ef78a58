package com.github.cowwoc.throttledstream;

import com.github.cowwoc.throttledstream.annotation.CheckReturnValue;

import java.util.OptionalLong;
import java.util.concurrent.BlockingQueue;

/**
 * A feed of token quotas. Each quota is the number of bytes that may be transferred before the next
 * quota must be obtained.
 * <p>
 * A rate source has a single producer and a single consumer.
 */
public interface RateSource extends AutoCloseable
{
	/**
	 * Returns a rate source that hands out the quotas that the caller adds to {@code quotas}. The caller
	 * controls the timing of quota delivery.
	 *
	 * @param quotas the queue that quotas are read from
	 * @return a rate source backed by {@code quotas}
	 * @throws NullPointerException if {@code quotas} is null
	 */
	static RateSource of(BlockingQueue<Long> quotas)
	{
		return new QueueRateSource(quotas);
	}

	/**
	 * Returns the next quota if one is immediately available.
	 *
	 * @return an empty value if no quota is available
	 * @throws IllegalArgumentException if the next quota is negative
	 */
	@CheckReturnValue
	OptionalLong poll();

	/**
	 * Blocks until the next quota is available.
	 *
	 * @return an empty value if the source was closed before a quota became available
	 * @throws IllegalArgumentException if the next quota is negative
	 * @throws InterruptedException     if the thread is interrupted while waiting for a quota
	 */
	OptionalLong take() throws InterruptedException;

	/**
	 * Stops producing quotas and wakes up any consumer blocked in {@link #take()}. Sources that do not
	 * own any resources may ignore this call.
	 */
	@Override
	default void close()
	{
	}
}
