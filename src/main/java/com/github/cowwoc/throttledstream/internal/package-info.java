/**
 * <h1>Locking policy</h1>
 * <p>
 * Quota hand-off between an emitter thread and the reading thread uses a {@code ReentrantLock} together
 * with a {@link java.util.concurrent.locks.Condition}, acquired through {@link
 * com.github.cowwoc.throttledstream.internal.LockAsResource} so that it can be released by
 * try-with-resources.
 * <p>
 * The reference to the active rate source is not guarded by a lock. It lives in an
 * {@link java.util.concurrent.atomic.AtomicReference} and is swapped atomically.
 */
package com.github.cowwoc.throttledstream.internal;
