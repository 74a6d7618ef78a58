package com.github.cowwoc.throttledstream;

import com.github.cowwoc.throttledstream.internal.ToStringBuilder;

import java.util.OptionalLong;
import java.util.concurrent.BlockingQueue;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * A rate source whose quotas are supplied by the caller through a queue.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
final class QueueRateSource implements RateSource
{
	private final BlockingQueue<Long> quotas;

	/**
	 * @param quotas the queue that quotas are read from
	 * @throws NullPointerException if {@code quotas} is null
	 */
	QueueRateSource(BlockingQueue<Long> quotas)
	{
		requireThat(quotas, "quotas").isNotNull();
		this.quotas = quotas;
	}

	@Override
	public OptionalLong poll()
	{
		Long quota = quotas.poll();
		if (quota == null)
			return OptionalLong.empty();
		return toQuota(quota);
	}

	@Override
	public OptionalLong take() throws InterruptedException
	{
		return toQuota(quotas.take());
	}

	/**
	 * @param quota a value removed from the queue
	 * @return the quota
	 * @throws IllegalArgumentException if {@code quota} is negative
	 */
	private static OptionalLong toQuota(long quota)
	{
		requireThat(quota, "quota").isNotNegative();
		return OptionalLong.of(quota);
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(QueueRateSource.class).
			add("pending", quotas.size()).
			toString();
	}
}
