package com.github.cowwoc.throttledstream;

import java.time.Duration;

/**
 * A limiter that also reports when the underlying data has been fully consumed. This lets code that
 * manages several limiters synchronize on their completion without polling.
 */
public interface AwaitableLimiter extends Limiter
{
	/**
	 * Blocks until the underlying data has been fully consumed. Returns immediately if it already has.
	 *
	 * @throws InterruptedException if the thread is interrupted while waiting
	 */
	void awaitCompletion() throws InterruptedException;

	/**
	 * Blocks until the underlying data has been fully consumed, or a timeout occurs.
	 *
	 * @param timeout the maximum amount of time to wait
	 * @return {@code false} if the timeout elapsed first
	 * @throws NullPointerException     if {@code timeout} is null
	 * @throws IllegalArgumentException if {@code timeout} is negative
	 * @throws InterruptedException     if the thread is interrupted while waiting
	 */
	boolean awaitCompletion(Duration timeout) throws InterruptedException;

	/**
	 * Returns {@code true} if the underlying data has been fully consumed.
	 *
	 * @return {@code true} if the underlying data has been fully consumed
	 */
	boolean isComplete();
}
