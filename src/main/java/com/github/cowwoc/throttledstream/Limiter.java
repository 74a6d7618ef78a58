package com.github.cowwoc.throttledstream;

import java.time.Duration;

/**
 * Lets through at most a configured number of units per unit of time.
 * <p>
 * The rate is either derived from a count and a duration, in which case the limiter schedules quota
 * delivery itself, or read from a caller-supplied {@link RateSource}, in which case timing is handled
 * externally.
 */
public interface Limiter
{
	/**
	 * Limits throughput to {@code count} units per {@code duration}. The limiter does its best to deliver
	 * units at a constant rate, in small regular quotas, so that adaptive consumers (such as TCP window
	 * sizing) can self-adjust.
	 * <p>
	 * This method may be invoked concurrently with a read. A read that is in progress keeps using its
	 * current quota, and picks up the new rate the next time it requests a quota.
	 *
	 * @param count    the number of units to let through every {@code duration}
	 * @param duration the window over which {@code count} units are let through
	 * @throws NullPointerException     if {@code duration} is null
	 * @throws IllegalArgumentException if {@code count} or {@code duration} are negative or zero
	 * @throws IllegalStateException    if the limiter is closed
	 */
	void setRate(long count, Duration duration);

	/**
	 * Reads quotas from {@code rateSource}. The caller owns the source and controls the timing of its
	 * quotas.
	 *
	 * @param rateSource the source of quotas ({@code null} to remove the limit)
	 * @throws IllegalStateException if the limiter is closed
	 */
	void setRateSource(RateSource rateSource);
}
