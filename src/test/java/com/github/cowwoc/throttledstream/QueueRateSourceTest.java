package com.github.cowwoc.throttledstream;

import org.testng.annotations.Test;

import java.util.OptionalLong;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

public final class QueueRateSourceTest
{
	@Test
	public void pollEmptyQueue()
	{
		RateSource source = RateSource.of(new LinkedBlockingQueue<>());
		requireThat(source.poll().isPresent(), "source.poll().isPresent()").isFalse();
	}

	@Test
	public void quotasAreReturnedInOrder() throws InterruptedException
	{
		BlockingQueue<Long> quotas = new LinkedBlockingQueue<>();
		quotas.add(3L);
		quotas.add(7L);
		RateSource source = RateSource.of(quotas);
		OptionalLong first = source.poll();
		OptionalLong second = source.take();
		requireThat(first.getAsLong(), "first").isEqualTo(3L);
		requireThat(second.getAsLong(), "second").isEqualTo(7L);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void negativeQuota()
	{
		BlockingQueue<Long> quotas = new LinkedBlockingQueue<>();
		quotas.add(-1L);
		//noinspection ResultOfMethodCallIgnored
		RateSource.of(quotas).poll();
	}

	@Test(expectedExceptions = NullPointerException.class)
	public void nullQueue()
	{
		RateSource.of(null);
	}
}
