package com.github.cowwoc.throttledstream;

import com.github.cowwoc.throttledstream.internal.CloseableLock;
import com.github.cowwoc.throttledstream.internal.LockAsResource;
import com.github.cowwoc.throttledstream.internal.ToStringBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.OptionalLong;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * A rate source that releases a fixed quota at a fixed cadence.
 * <p>
 * At most one quota is pending at a time. If the consumer has not claimed the previous quota by the
 * time the next one is due, the new one is dropped, so an idle consumer cannot accumulate a burst.
 * <p>
 * The emitter runs on a dedicated daemon thread until the source is closed.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class ScheduledRateSource implements RateSource
{
	private static final AtomicLong THREAD_ID = new AtomicLong();
	/**
	 * The longest period that the emitter can be scheduled with. Longer periods are capped.
	 */
	private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);
	private final RateSchedule schedule;
	private final ScheduledExecutorService emitter;
	private final LockAsResource lock = new LockAsResource();
	/**
	 * Notifies the consumer that a quota was released or that the source was closed.
	 */
	private final Condition quotaUpdated = lock.newCondition();
	/**
	 * The quota waiting to be claimed. {@code 0} if none.
	 */
	private long pendingQuota;
	private long ticksDropped;
	private boolean closed;
	private final Logger log = LoggerFactory.getLogger(ScheduledRateSource.class);

	/**
	 * Creates a new source and starts its emitter. The first quota is released one period from now.
	 *
	 * @param schedule the schedule to follow
	 * @throws NullPointerException if {@code schedule} is null
	 */
	ScheduledRateSource(RateSchedule schedule)
	{
		requireThat(schedule, "schedule").isNotNull();
		this.schedule = schedule;
		this.emitter = Executors.newSingleThreadScheduledExecutor(task ->
		{
			Thread thread = new Thread(task, "throttled-stream-rate-" + THREAD_ID.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		});
		long periodNanos;
		if (schedule.getPeriod().compareTo(MAX_NANOS) >= 0)
			periodNanos = Long.MAX_VALUE;
		else
			periodNanos = schedule.getPeriod().toNanos();
		emitter.scheduleAtFixedRate(this::release, periodNanos, periodNanos, TimeUnit.NANOSECONDS);
		log.debug("Started emitter: {}", schedule);
	}

	/**
	 * Returns the schedule that this source follows.
	 *
	 * @return the schedule that this source follows
	 */
	public RateSchedule getSchedule()
	{
		return schedule;
	}

	/**
	 * Returns {@code true} if the source was closed.
	 *
	 * @return {@code true} if the source was closed
	 */
	public boolean isClosed()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return closed;
		}
	}

	/**
	 * Releases the next quota, unless the previous one is still pending.
	 */
	private void release()
	{
		try (CloseableLock ignored = lock.lock())
		{
			if (closed)
				return;
			if (pendingQuota > 0)
			{
				++ticksDropped;
				return;
			}
			pendingQuota = schedule.getQuota();
			quotaUpdated.signalAll();
		}
	}

	@Override
	public OptionalLong poll()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return claimQuota();
		}
	}

	@Override
	public OptionalLong take() throws InterruptedException
	{
		try (CloseableLock ignored = lock.lockInterruptibly())
		{
			while (pendingQuota == 0 && !closed)
				quotaUpdated.await();
			return claimQuota();
		}
	}

	/**
	 * Claims the pending quota.
	 *
	 * @return an empty value if no quota is pending or the source is closed
	 * @implNote The caller must hold {@code lock}
	 */
	private OptionalLong claimQuota()
	{
		if (closed || pendingQuota == 0)
			return OptionalLong.empty();
		long quota = pendingQuota;
		pendingQuota = 0;
		return OptionalLong.of(quota);
	}

	/**
	 * Stops the emitter. Consumers that are blocked in {@link #take()} return an empty value.
	 */
	@Override
	public void close()
	{
		try (CloseableLock ignored = lock.lock())
		{
			if (closed)
				return;
			closed = true;
			pendingQuota = 0;
			quotaUpdated.signalAll();
		}
		emitter.shutdownNow();
		log.debug("Stopped emitter: {}", this);
	}

	@Override
	public String toString()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return new ToStringBuilder(ScheduledRateSource.class).
				add("schedule", schedule).
				add("pendingQuota", pendingQuota).
				add("ticksDropped", ticksDropped).
				add("closed", closed).
				toString();
		}
	}
}
