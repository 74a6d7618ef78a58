package com.github.cowwoc.throttledstream;

import com.github.cowwoc.throttledstream.annotation.CheckReturnValue;
import com.github.cowwoc.throttledstream.internal.ToStringBuilder;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * The configuration of a {@link ThrottledInputStream}.
 * <p>
 * <b>Thread safety</b>: This class is immutable.
 */
public final class ThrottleConfiguration
{
	/**
	 * The default scheduling granularity of derived rates.
	 */
	public static final Duration DEFAULT_TICK_DURATION = Duration.ofNanos(100_000);
	/**
	 * The default size of the staging buffer, in bytes.
	 */
	public static final int DEFAULT_BUFFER_SIZE = 8 * 1024;
	/**
	 * The default configuration.
	 */
	public static final ThrottleConfiguration DEFAULT = builder().build();

	private final Duration tickDuration;
	private final int bufferSize;
	private final List<ThrottleListener> listeners;

	/**
	 * Builds a new configuration.
	 *
	 * @return a configuration builder
	 */
	public static Builder builder()
	{
		return new Builder();
	}

	/**
	 * @param tickDuration the scheduling granularity of derived rates
	 * @param bufferSize   the size of the staging buffer, in bytes
	 * @param listeners    the event listeners
	 */
	private ThrottleConfiguration(Duration tickDuration, int bufferSize, List<ThrottleListener> listeners)
	{
		this.tickDuration = tickDuration;
		this.bufferSize = bufferSize;
		this.listeners = List.copyOf(listeners);
	}

	/**
	 * Returns the scheduling granularity of derived rates. Rates set using
	 * {@link Limiter#setRate(long, Duration)} release tokens in multiples of this duration.
	 *
	 * @return the scheduling granularity of derived rates
	 */
	public Duration getTickDuration()
	{
		return tickDuration;
	}

	/**
	 * Returns the size of the staging buffer. A single transfer from the wrapped stream never exceeds
	 * this size.
	 *
	 * @return the size of the staging buffer, in bytes
	 */
	public int getBufferSize()
	{
		return bufferSize;
	}

	/**
	 * Returns the event listeners.
	 *
	 * @return an unmodifiable list
	 */
	public List<ThrottleListener> getListeners()
	{
		return listeners;
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(ThrottleConfiguration.class).
			add("tickDuration", tickDuration).
			add("bufferSize", bufferSize).
			add("listeners", listeners).
			toString();
	}

	/**
	 * Builds a configuration.
	 */
	public static final class Builder
	{
		private Duration tickDuration = DEFAULT_TICK_DURATION;
		private int bufferSize = DEFAULT_BUFFER_SIZE;
		private final List<ThrottleListener> listeners = new ArrayList<>();

		/**
		 * Prevent construction.
		 */
		private Builder()
		{
		}

		/**
		 * Returns the scheduling granularity of derived rates. The default is {@code 100 microseconds}.
		 *
		 * @return the scheduling granularity of derived rates
		 */
		@CheckReturnValue
		public Duration tickDuration()
		{
			return tickDuration;
		}

		/**
		 * Sets the scheduling granularity of derived rates.
		 *
		 * @param tickDuration the scheduling granularity of derived rates
		 * @return this
		 * @throws NullPointerException     if {@code tickDuration} is null
		 * @throws IllegalArgumentException if {@code tickDuration} is negative or zero
		 */
		@CheckReturnValue
		public Builder tickDuration(Duration tickDuration)
		{
			requireThat(tickDuration, "tickDuration").isGreaterThan(Duration.ZERO);
			this.tickDuration = tickDuration;
			return this;
		}

		/**
		 * Returns the size of the staging buffer. The default is {@code 8 KiB}.
		 *
		 * @return the size of the staging buffer, in bytes
		 */
		@CheckReturnValue
		public int bufferSize()
		{
			return bufferSize;
		}

		/**
		 * Sets the size of the staging buffer.
		 *
		 * @param bufferSize the size of the staging buffer, in bytes
		 * @return this
		 * @throws IllegalArgumentException if {@code bufferSize} is negative or zero
		 */
		@CheckReturnValue
		public Builder bufferSize(int bufferSize)
		{
			requireThat(bufferSize, "bufferSize").isPositive();
			this.bufferSize = bufferSize;
			return this;
		}

		/**
		 * Adds an event listener.
		 *
		 * @param listener a listener
		 * @return this
		 * @throws NullPointerException if {@code listener} is null
		 */
		@CheckReturnValue
		public Builder addListener(ThrottleListener listener)
		{
			requireThat(listener, "listener").isNotNull();
			listeners.add(listener);
			return this;
		}

		/**
		 * Builds a new configuration.
		 *
		 * @return a new configuration
		 */
		public ThrottleConfiguration build()
		{
			return new ThrottleConfiguration(tickDuration, bufferSize, listeners);
		}

		@Override
		public String toString()
		{
			return new ToStringBuilder(Builder.class).
				add("tickDuration", tickDuration).
				add("bufferSize", bufferSize).
				add("listeners", listeners).
				toString();
		}
	}
}
