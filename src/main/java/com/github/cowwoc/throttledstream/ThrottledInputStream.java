package com.github.cowwoc.throttledstream;

import com.github.cowwoc.throttledstream.annotation.CheckReturnValue;
import com.github.cowwoc.throttledstream.internal.CloseableLock;
import com.github.cowwoc.throttledstream.internal.LockAsResource;
import com.github.cowwoc.throttledstream.internal.ToStringBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static com.github.cowwoc.requirements.DefaultRequirements.assertThat;
import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * An {@code InputStream} that bounds how many bytes may be read from another stream per unit of time.
 * <p>
 * Reads block the way the wrapped stream's reads do, return {@code -1} at the end of the stream and
 * propagate the wrapped stream's exceptions. When a rate is installed, each read is bounded by the
 * quota currently available from the rate source:
 * <ul>
 *   <li>if the quota runs out after some bytes were read, the read returns them immediately;</li>
 *   <li>if the quota runs out before any byte was read, the read blocks until the next quota
 *   arrives.</li>
 * </ul>
 * Without a rate, reads pass straight through to the wrapped stream.
 * <p>
 * <b>Thread safety</b>: Rates may be installed, and completion awaited, from any thread. Reads must be
 * performed by one thread at a time.
 */
public final class ThrottledInputStream extends InputStream implements AwaitableLimiter
{
	private final ThrottleConfiguration configuration;
	private volatile InputStream source;
	/**
	 * The active rate source. {@code null} if reads are unthrottled.
	 */
	private final AtomicReference<RateSource> rateSource = new AtomicReference<>();
	/**
	 * Serializes rate installation with teardown.
	 */
	private final LockAsResource installLock = new LockAsResource();
	/**
	 * The rate source created by {@link #setRate(long, Duration)} that this stream must close. {@code null}
	 * if none. Guarded by {@code installLock}.
	 */
	private ScheduledRateSource ownedRateSource;
	private final AtomicBoolean reachedEnd = new AtomicBoolean();
	private final AtomicBoolean closed = new AtomicBoolean();
	/**
	 * Released once the end of the stream is reached, or the stream is closed.
	 */
	private final CountDownLatch completion = new CountDownLatch(1);
	private byte[] buffer;
	private final byte[] singleByte = new byte[1];
	/**
	 * The number of bytes left in the current quota. Only meaningful while a rate source is active.
	 */
	private long remainingQuota;
	/**
	 * An exception thrown by the wrapped stream after part of a read had already been satisfied. It is
	 * rethrown by the next read.
	 */
	private IOException deferredException;
	private final Logger log = LoggerFactory.getLogger(ThrottledInputStream.class);

	/**
	 * Wraps a stream using the default configuration.
	 *
	 * @param source the stream to throttle
	 * @return {@code source} if it is already throttled; otherwise, a new stream that throttles it
	 * @throws NullPointerException if {@code source} is null
	 */
	@CheckReturnValue
	public static ThrottledInputStream wrap(InputStream source)
	{
		return wrap(source, ThrottleConfiguration.DEFAULT);
	}

	/**
	 * Wraps a stream.
	 *
	 * @param source        the stream to throttle
	 * @param configuration the configuration of the new stream (ignored if {@code source} is already
	 *                      throttled)
	 * @return {@code source} if it is already throttled; otherwise, a new stream that throttles it
	 * @throws NullPointerException if any of the arguments are null
	 */
	@CheckReturnValue
	public static ThrottledInputStream wrap(InputStream source, ThrottleConfiguration configuration)
	{
		requireThat(source, "source").isNotNull();
		requireThat(configuration, "configuration").isNotNull();
		if (source instanceof ThrottledInputStream throttled)
			return throttled;
		return new ThrottledInputStream(source, configuration);
	}

	/**
	 * @param source        the stream to throttle
	 * @param configuration the configuration of the stream
	 */
	private ThrottledInputStream(InputStream source, ThrottleConfiguration configuration)
	{
		assertThat(r ->
		{
			r.requireThat(source, "source").isNotNull();
			r.requireThat(configuration, "configuration").isNotNull();
		});
		this.source = source;
		this.configuration = configuration;
	}

	/**
	 * Returns the configuration of this stream.
	 *
	 * @return the configuration of this stream
	 */
	public ThrottleConfiguration getConfiguration()
	{
		return configuration;
	}

	/**
	 * Returns the active rate source.
	 *
	 * @return {@code null} if reads are unthrottled
	 */
	public RateSource getRateSource()
	{
		return rateSource.get();
	}

	@Override
	public void setRate(long count, Duration duration)
	{
		RateSchedule schedule = RateSchedule.of(count, duration, configuration.getTickDuration());
		ensureOpen();
		log.debug("Installing rate of {} per {}: {}", count, duration, schedule);
		ScheduledRateSource created = new ScheduledRateSource(schedule);
		install(created, created);
	}

	@Override
	public void setRateSource(RateSource rateSource)
	{
		ensureOpen();
		log.debug("Installing rate source: {}", rateSource);
		install(rateSource, null);
	}

	/**
	 * Replaces the active rate source. A source created by {@link #setRate(long, Duration)} is owned by
	 * this stream and is closed once it is no longer installed. Sources supplied by the caller are never
	 * closed.
	 *
	 * @param newSource the new rate source ({@code null} to remove the limit)
	 * @param created   {@code newSource} if this stream created it; otherwise, {@code null}
	 */
	private void install(RateSource newSource, ScheduledRateSource created)
	{
		try (CloseableLock ignored = installLock.lock())
		{
			if (closed.get() || reachedEnd.get())
			{
				// Raced with close() or end-of-stream
				if (created != null)
					created.close();
				return;
			}
			rateSource.set(newSource);
			if (ownedRateSource != null && ownedRateSource != newSource)
			{
				ownedRateSource.close();
				ownedRateSource = null;
			}
			if (created != null)
				ownedRateSource = created;
		}
	}

	/**
	 * Uninstalls the active rate source, closing it if this stream created it.
	 */
	private void uninstall()
	{
		try (CloseableLock ignored = installLock.lock())
		{
			rateSource.set(null);
			if (ownedRateSource != null)
			{
				ownedRateSource.close();
				ownedRateSource = null;
			}
		}
	}

	/**
	 * @throws IllegalStateException if the stream is closed
	 */
	private void ensureOpen()
	{
		if (closed.get())
			throw new IllegalStateException("Stream is closed");
	}

	@Override
	public int read() throws IOException
	{
		int count = read(singleByte, 0, 1);
		if (count <= 0)
			return -1;
		return singleByte[0] & 0xFF;
	}

	@Override
	public int read(byte[] b, int off, int len) throws IOException
	{
		Objects.checkFromIndexSize(off, len, b.length);
		InputStream source = this.source;
		if (source == null)
			throw new EOFException("Unexpected end of stream: the source is closed");
		if (reachedEnd.get())
			return -1;
		if (deferredException != null)
		{
			IOException e = deferredException;
			deferredException = null;
			throw e;
		}
		if (len == 0)
			return 0;
		if (buffer == null)
			buffer = new byte[configuration.getBufferSize()];

		int written = 0;
		while (written < len)
		{
			RateSource rateSource = this.rateSource.get();
			if (rateSource == null)
			{
				// Quota left over from a removed rate must not carry over to the next one
				remainingQuota = 0;
			}
			else if (remainingQuota == 0)
			{
				OptionalLong quota = rateSource.poll();
				if (quota.isEmpty())
				{
					// Return what we have instead of waiting for the next quota
					if (written > 0)
						return written;
					quota = waitForQuota(rateSource);
					if (quota.isEmpty())
						continue;
				}
				remainingQuota = quota.getAsLong();
				if (remainingQuota == 0)
					continue;
			}

			int limit = Math.min(len - written, buffer.length);
			if (rateSource != null)
				limit = (int) Math.min(limit, remainingQuota);

			int count;
			try
			{
				count = source.read(buffer, 0, limit);
			}
			catch (IOException e)
			{
				if (written == 0)
					throw e;
				log.debug("Deferring exception until the next read. Bytes returned: {}", written, e);
				deferredException = e;
				return written;
			}
			if (count == -1)
			{
				onEndOfStream();
				if (written == 0)
					return -1;
				return written;
			}
			System.arraycopy(buffer, 0, b, off + written, count);
			written += count;
			if (rateSource != null)
				remainingQuota -= count;
		}
		return written;
	}

	/**
	 * Blocks until the next quota is available.
	 *
	 * @param rateSource the source to wait on
	 * @return an empty value if the source was closed while waiting
	 * @throws IOException if the stream was closed while waiting, or if the thread was interrupted
	 */
	private OptionalLong waitForQuota(RateSource rateSource) throws IOException
	{
		for (ThrottleListener listener : configuration.getListeners())
			listener.beforeQuotaWait(this, rateSource);
		log.debug("Waiting for quota from {}", rateSource);
		OptionalLong quota;
		try
		{
			quota = rateSource.take();
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			InterruptedIOException ioe = new InterruptedIOException("Interrupted while waiting for quota");
			ioe.initCause(e);
			throw ioe;
		}
		if (quota.isEmpty())
		{
			if (closed.get())
				throw new EOFException("Unexpected end of stream: the source is closed");
			if (this.rateSource.get() == rateSource)
			{
				throw new IOException("The rate source was closed while it was still in use. Rate source: " +
					rateSource);
			}
			log.debug("Rate source was replaced while waiting for quota");
		}
		return quota;
	}

	/**
	 * Records that the end of the stream was reached.
	 */
	private void onEndOfStream()
	{
		if (!reachedEnd.compareAndSet(false, true))
			return;
		log.debug("Reached end of stream");
		uninstall();
		completion.countDown();
		for (ThrottleListener listener : configuration.getListeners())
			listener.endOfStream(this);
	}

	@Override
	public int available() throws IOException
	{
		InputStream source = this.source;
		if (source == null)
			throw new EOFException("Unexpected end of stream: the source is closed");
		if (reachedEnd.get())
			return 0;
		int available = source.available();
		if (rateSource.get() == null)
			return available;
		return (int) Math.min(available, remainingQuota);
	}

	@Override
	public void awaitCompletion() throws InterruptedException
	{
		completion.await();
	}

	@Override
	public boolean awaitCompletion(Duration timeout) throws InterruptedException
	{
		requireThat(timeout, "timeout").isGreaterThanOrEqualTo(Duration.ZERO);
		return completion.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
	}

	@Override
	public boolean isComplete()
	{
		return reachedEnd.get();
	}

	/**
	 * Closes the wrapped stream and stops any rate that this stream created. Threads waiting for
	 * completion are released.
	 *
	 * @throws IOException if the wrapped stream fails to close
	 */
	@Override
	public void close() throws IOException
	{
		if (!closed.compareAndSet(false, true))
			return;
		log.debug("Closing {}", this);
		uninstall();
		InputStream source = this.source;
		this.source = null;
		try
		{
			source.close();
		}
		finally
		{
			completion.countDown();
		}
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(ThrottledInputStream.class).
			add("rateSource", rateSource.get()).
			add("reachedEnd", reachedEnd.get()).
			add("closed", closed.get()).
			add("configuration", configuration).
			toString();
	}
}
