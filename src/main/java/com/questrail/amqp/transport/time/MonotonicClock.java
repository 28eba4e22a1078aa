package com.questrail.amqp.transport.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for transport deadlines (connect and write timeouts).
 *
 * <h2>Binding invariant</h2>
 * Deadlines MUST be computed from a monotonic time source. Wall-clock time
 * (e.g. {@code Instant.now()}) is permitted only for observability timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>Values are only meaningful for elapsed time computations.</p>
     */
    long nowNanos();
}
