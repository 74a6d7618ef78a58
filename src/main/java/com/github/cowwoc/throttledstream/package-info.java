/**
 * Throughput shaping for byte streams.
 * <p>
 * {@link com.github.cowwoc.throttledstream.ThrottledInputStream} wraps an {@code InputStream} and
 * bounds how many bytes may be read from it per unit of time, either at a fixed rate or according to
 * quotas supplied by a {@link com.github.cowwoc.throttledstream.RateSource}.
 * <p>
 * <b>Thread safety</b>: Classes are not thread-safe unless indicated otherwise (e.g.
 * {@link com.github.cowwoc.throttledstream.ScheduledRateSource}).
 */
package com.github.cowwoc.throttledstream;
