package com.github.cowwoc.throttledstream.internal;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Enables the use of try-with-resources with an exclusive lock and its conditions.
 */
public final class LockAsResource
{
	private final Lock lock = new ReentrantLock();

	/**
	 * Creates a new lock.
	 */
	public LockAsResource()
	{
	}

	/**
	 * Acquires the lock.
	 *
	 * @return the lock as a resource
	 */
	public CloseableLock lock()
	{
		lock.lock();
		return lock::unlock;
	}

	/**
	 * Acquires the lock unless the current thread is interrupted.
	 *
	 * @return the lock as a resource
	 * @throws InterruptedException if the current thread is interrupted while acquiring the lock
	 */
	public CloseableLock lockInterruptibly() throws InterruptedException
	{
		lock.lockInterruptibly();
		return lock::unlock;
	}

	/**
	 * Returns a new condition bound to this lock.
	 *
	 * @return a new condition
	 */
	public Condition newCondition()
	{
		return lock.newCondition();
	}
}
