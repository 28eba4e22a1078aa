package com.questrail.amqp.transport.time;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <p>Monotonic deadlines are converted into relative delays at scheduling time
 * using the supplied {@link MonotonicClock}; callers must compute deadlines on
 * the same clock.</p>
 *
 * <p>This class does <strong>not</strong> own the executor. Once the executor
 * has been shut down, scheduling returns an already-cancelled handle instead
 * of failing, so a deadline armed during teardown is simply never fired.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long now = clock.nowNanos();
        long delayNanos = now < 0 && deadlineNanos > Long.MAX_VALUE + now
            ? Long.MAX_VALUE
            : Math.max(0, deadlineNanos - now);

        try {
            ScheduledFuture<?> future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
            return () -> future.cancel(false);
        }
        catch (RejectedExecutionException e) {
            return () -> false;
        }
    }
}
