package com.github.cowwoc.throttledstream.internal;

/**
 * A held lock that is released by {@link #close()}. Releasing a lock does not throw checked exceptions.
 */
public interface CloseableLock extends AutoCloseable
{
	@Override
	void close();
}
