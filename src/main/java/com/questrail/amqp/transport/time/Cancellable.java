package com.questrail.amqp.transport.time;

/**
 * Cancellable
 * =============================================================================
 * Minimal cancellation handle for a scheduled deadline.
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();
}
