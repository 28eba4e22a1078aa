package com.questrail.amqp.transport.write;

import com.questrail.amqp.transport.observability.TransportErrorEvent;
import com.questrail.amqp.transport.observability.TransportObservabilitySink;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.util.ReferenceCountUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * OutboundWritePipeline
 * =============================================================================
 * Unbounded multi-producer / single-consumer queue of serialized frames,
 * drained onto an output stream by one dedicated writer thread.
 *
 * <h2>Ownership</h2>
 * {@link #enqueue(ByteBuf)} takes ownership of the buffer. The writer
 * releases it back to its pool right after it has been written; a buffer
 * refused by the pipeline is released immediately. Producers must not touch
 * a buffer after handing it over.
 *
 * <h2>Writer loop</h2>
 * <ol>
 *   <li>Block until at least one buffer is queued.</li>
 *   <li>Write that buffer and every buffer already queued behind it, without
 *       flushing in between.</li>
 *   <li>Flush once, then go back to waiting.</li>
 * </ol>
 * Buffers reach the stream in enqueue order. The loop ends only after
 * {@link #close()} and once everything enqueued before it has been written.
 *
 * <h2>Failure</h2>
 * If a write fails, the writer reports the fault to the sink, stops
 * accepting buffers, releases everything still queued, and exits.
 */
public final class OutboundWritePipeline implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(OutboundWritePipeline.class);

    private static final ByteBuf END_OF_QUEUE = Unpooled.unreleasableBuffer(Unpooled.wrappedBuffer(new byte[1]));

    private final OutputStream out;
    private final WriteDeadlineWatchdog watchdog;
    private final TransportObservabilitySink sink;

    private final BlockingQueue<ByteBuf> queue = new LinkedBlockingQueue<>();

    // Producers share the read lock; completion takes the write lock so no
    // buffer can slip in behind END_OF_QUEUE.
    private final ReadWriteLock completionLock = new ReentrantReadWriteLock();
    private boolean completed;

    private final ExecutorService writerExecutor;
    private final Future<?> writerTask;

    private volatile Throwable failure;

    public OutboundWritePipeline(
            OutputStream out,
            WriteDeadlineWatchdog watchdog,
            TransportObservabilitySink sink,
            ThreadFactory threadFactory)
    {
        this.out = Objects.requireNonNull(out, "out");
        this.watchdog = Objects.requireNonNull(watchdog, "watchdog");
        this.sink = Objects.requireNonNull(sink, "sink");

        this.writerExecutor = Executors.newSingleThreadExecutor(Objects.requireNonNull(threadFactory, "threadFactory"));
        this.writerTask = writerExecutor.submit(this::writeLoop);
    }

    /**
     * Queue a buffer for transmission. Never blocks.
     *
     * @return {@code true} if queued; {@code false} if the pipeline has been
     *         closed or has failed, in which case the buffer was released
     */
    public boolean enqueue(ByteBuf buffer)
    {
        Objects.requireNonNull(buffer, "buffer");

        Lock lock = completionLock.readLock();
        lock.lock();
        try {
            if (!completed) {
                queue.add(buffer);
                return true;
            }
        }
        finally {
            lock.unlock();
        }

        ReferenceCountUtil.safeRelease(buffer);
        return false;
    }

    /**
     * Stop accepting buffers, then wait until the writer has drained the queue
     * and exited. Never throws; a writer failure is only logged.
     */
    @Override
    public void close()
    {
        markCompleted(true);

        try {
            writerTask.get();
        }
        catch (ExecutionException | CancellationException e) {
            log.debug("Writer loop ended abnormally during close", e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while waiting for the writer loop to drain");
        }
        finally {
            writerExecutor.shutdown();
        }
    }

    /**
     * @return the fault that stopped the writer, if any
     */
    public Optional<Throwable> failure()
    {
        return Optional.ofNullable(failure);
    }

    /**
     * @return number of buffers waiting for the writer
     */
    public int pending()
    {
        int size = queue.size();
        return queue.contains(END_OF_QUEUE) ? size - 1 : size;
    }

    private void markCompleted(boolean enqueueEnd)
    {
        Lock lock = completionLock.writeLock();
        lock.lock();
        try {
            if (!completed) {
                completed = true;
                if (enqueueEnd) {
                    queue.add(END_OF_QUEUE);
                }
            }
        }
        finally {
            lock.unlock();
        }
    }

    private void writeLoop()
    {
        try {
            while (true) {
                ByteBuf next = queue.take();
                boolean end = false;

                while (next != null) {
                    if (next == END_OF_QUEUE) {
                        end = true;
                        break;
                    }
                    writeOne(next);
                    next = queue.poll();
                }

                watchdog.guard(out::flush);

                if (end) {
                    return;
                }
            }
        }
        catch (IOException | RuntimeException e) {
            fail(e);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(e);
        }
    }

    private void writeOne(ByteBuf buffer) throws IOException
    {
        int length = buffer.readableBytes();
        try {
            watchdog.guard(() -> buffer.readBytes(out, length));
        }
        finally {
            ReferenceCountUtil.safeRelease(buffer);
        }
        try {
            sink.onBytesSent(length);
        }
        catch (RuntimeException e) {
            log.debug("Observability sink failed in onBytesSent", e);
        }
    }

    private void fail(Throwable cause)
    {
        failure = cause;
        markCompleted(false);

        ByteBuf leftover;
        while ((leftover = queue.poll()) != null) {
            if (leftover != END_OF_QUEUE) {
                ReferenceCountUtil.safeRelease(leftover);
            }
        }

        try {
            sink.onError(new TransportErrorEvent(Instant.now(), "Outbound writer stopped", cause));
        }
        catch (RuntimeException e) {
            log.debug("Observability sink failed in onError", e);
        }
    }
}
