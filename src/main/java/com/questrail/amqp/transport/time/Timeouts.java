package com.questrail.amqp.transport.time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Timeouts
 * =============================================================================
 * Blocking deadline wrapper around a pending asynchronous operation.
 *
 * <ul>
 *   <li>Settles in time with a value: the value is returned.</li>
 *   <li>Settles in time with a fault: the fault itself is rethrown, unwrapped
 *       from {@link ExecutionException}.</li>
 *   <li>Deadline passes first: {@link TimeoutException} is thrown. The
 *       operation keeps running; whatever fault it eventually settles with is
 *       observed and discarded.</li>
 * </ul>
 */
public final class Timeouts
{
    private static final Logger log = LoggerFactory.getLogger(Timeouts.class);

    private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

    private Timeouts() {}

    public static <T> T await(CompletableFuture<T> operation, Duration timeout)
            throws IOException, TimeoutException, InterruptedException
    {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(timeout, "timeout");

        try {
            return operation.get(saturatedNanos(timeout), TimeUnit.NANOSECONDS);
        }
        catch (TimeoutException e) {
            operation.whenComplete((ignored, fault) -> {
                if (fault != null) {
                    log.debug("Discarding late failure of timed-out operation", unwrap(fault));
                }
            });
            throw e;
        }
        catch (ExecutionException e) {
            throw rethrow(unwrap(e));
        }
    }

    /**
     * @return {@code duration} in nanoseconds, or {@link Long#MAX_VALUE} when it does not fit
     */
    public static long saturatedNanos(Duration duration)
    {
        if (duration.compareTo(MAX_NANOS) >= 0) {
            return Long.MAX_VALUE;
        }
        return duration.toNanos();
    }

    private static Throwable unwrap(Throwable t)
    {
        Throwable current = t;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static IOException rethrow(Throwable cause) throws TimeoutException
    {
        if (cause instanceof IOException io) {
            return io;
        }
        if (cause instanceof TimeoutException te) {
            throw te;
        }
        if (cause instanceof RuntimeException re) {
            throw re;
        }
        if (cause instanceof Error err) {
            throw err;
        }
        return new IOException(cause);
    }
}
