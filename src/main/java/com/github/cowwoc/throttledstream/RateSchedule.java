package com.github.cowwoc.throttledstream;

import com.github.cowwoc.throttledstream.annotation.CheckReturnValue;
import com.github.cowwoc.throttledstream.internal.ToStringBuilder;

import java.time.Duration;
import java.util.Objects;

import static com.github.cowwoc.requirements.DefaultRequirements.assertThat;
import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * A fixed-cadence token schedule: {@code quota} tokens are released once every {@code period}.
 * <p>
 * Schedules are derived from a target rate so that consumers observe a smooth flow of small quotas
 * instead of large bursts separated by long pauses.
 * <p>
 * <b>Thread safety</b>: This class is immutable.
 */
public final class RateSchedule
{
	private static final double NANOS_PER_SECOND = 1_000_000_000.0;
	private final long quota;
	private final Duration period;

	/**
	 * Creates a new schedule.
	 *
	 * @param quota  the number of tokens to release every {@code period}
	 * @param period how often {@code quota} tokens are released
	 * @throws NullPointerException     if {@code period} is null
	 * @throws IllegalArgumentException if {@code quota} or {@code period} are negative or zero
	 */
	private RateSchedule(long quota, Duration period)
	{
		assertThat(r ->
		{
			r.requireThat(quota, "quota").isPositive();
			r.requireThat(period, "period").isGreaterThan(Duration.ZERO);
		});
		this.quota = quota;
		this.period = period;
	}

	/**
	 * Converts a target rate of {@code count} tokens per {@code duration} into a schedule on a grid of
	 * {@code tick}-sized steps.
	 * <p>
	 * If the rate amounts to at least one token per tick, the schedule releases the rounded per-tick
	 * quota every {@code tick}. Otherwise, it releases exactly one token per period, where the period is
	 * stretched to however many ticks it takes to accumulate a whole token. Quotas are never fractional
	 * or zero.
	 *
	 * @param count    the number of tokens to release every {@code duration}
	 * @param duration the window over which {@code count} tokens are released
	 * @param tick     the canonical scheduling granularity
	 * @return the schedule
	 * @throws NullPointerException     if {@code duration} or {@code tick} are null
	 * @throws IllegalArgumentException if any of the arguments are negative or zero
	 */
	@CheckReturnValue
	public static RateSchedule of(long count, Duration duration, Duration tick)
	{
		requireThat(count, "count").isPositive();
		requireThat(duration, "duration").isGreaterThan(Duration.ZERO);
		requireThat(tick, "tick").isGreaterThan(Duration.ZERO);

		double tickNanos = toNanos(tick);
		double ticksPerDuration = toNanos(duration) / tickNanos;
		double tokensPerTick = count / ticksPerDuration;
		if (tokensPerTick >= 1.0)
			return new RateSchedule(Math.round(tokensPerTick), tick);

		// Stretch the period so that each release carries exactly one token
		double periodNanos = Math.max(1, tickNanos / tokensPerTick);
		return new RateSchedule(1, ofNanos(periodNanos));
	}

	/**
	 * @param duration a duration
	 * @return the number of nanoseconds in {@code duration}, without overflowing for durations that
	 * {@link Duration#toNanos()} rejects
	 */
	private static double toNanos(Duration duration)
	{
		return duration.getSeconds() * NANOS_PER_SECOND + duration.getNano();
	}

	/**
	 * @param nanos a positive number of nanoseconds
	 * @return a duration of {@code nanos}, rounded to the nearest nanosecond
	 */
	private static Duration ofNanos(double nanos)
	{
		long seconds = (long) (nanos / NANOS_PER_SECOND);
		long nanoAdjustment = Math.round(nanos - seconds * NANOS_PER_SECOND);
		return Duration.ofSeconds(seconds, nanoAdjustment);
	}

	/**
	 * Returns the number of tokens released every {@code period}.
	 *
	 * @return the number of tokens released every {@code period}
	 */
	public long getQuota()
	{
		return quota;
	}

	/**
	 * Returns how often {@code quota} tokens are released.
	 *
	 * @return how often {@code quota} tokens are released
	 */
	public Duration getPeriod()
	{
		return period;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(quota, period);
	}

	@Override
	public boolean equals(Object o)
	{
		if (!(o instanceof RateSchedule other))
			return false;
		return quota == other.quota && period.equals(other.period);
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(RateSchedule.class).
			add("quota", quota).
			add("period", period).
			toString();
	}
}
