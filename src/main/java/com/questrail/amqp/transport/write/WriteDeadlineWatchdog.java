package com.questrail.amqp.transport.write;

import com.questrail.amqp.transport.time.Cancellable;
import com.questrail.amqp.transport.time.MonotonicClock;
import com.questrail.amqp.transport.time.MonotonicScheduler;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * WriteDeadlineWatchdog
 * =============================================================================
 * Bounds blocking socket writes.
 *
 * <p>JDK sockets have no send timeout. Each guarded write arms a deadline on
 * a {@link MonotonicScheduler}; if the write is still blocked when the
 * deadline fires, the expiry action runs (the frame handler closes the
 * socket, which makes the blocked write fail). The deadline is cancelled as
 * soon as the write returns.</p>
 *
 * <p>A timeout of {@link Duration#ZERO} disables the watchdog.</p>
 */
public final class WriteDeadlineWatchdog
{
    /**
     * A blocking write to run under the deadline.
     */
    @FunctionalInterface
    public interface GuardedWrite
    {
        void run() throws IOException;
    }

    private static final Cancellable DISARMED = () -> false;

    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Runnable onExpiry;
    private final AtomicBoolean expired = new AtomicBoolean(false);

    private volatile Duration timeout;

    public WriteDeadlineWatchdog(MonotonicScheduler scheduler, MonotonicClock clock, Duration timeout, Runnable onExpiry)
    {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.onExpiry = Objects.requireNonNull(onExpiry, "onExpiry");
        setTimeout(timeout);
    }

    public void setTimeout(Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0");
        }
        this.timeout = timeout;
    }

    public Duration timeout()
    {
        return timeout;
    }

    /**
     * @return {@code true} once a deadline has fired
     */
    public boolean expired()
    {
        return expired.get();
    }

    public void guard(GuardedWrite write) throws IOException
    {
        Cancellable deadline = arm();
        try {
            write.run();
        }
        finally {
            deadline.cancel();
        }
    }

    private Cancellable arm()
    {
        Duration t = timeout;
        if (t.isZero()) {
            return DISARMED;
        }
        return scheduler.scheduleAfter(t, clock, () -> {
            if (expired.compareAndSet(false, true)) {
                onExpiry.run();
            }
        });
    }
}
