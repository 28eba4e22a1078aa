package com.questrail.amqp.transport;

import com.questrail.amqp.transport.frame.InboundFrame;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * FrameHandler
 * =============================================================================
 * Framed read/write surface over exactly one physical broker connection.
 *
 * <h2>Threading</h2>
 * <ul>
 *   <li>{@link #write(ByteBuf)} may be called from any number of threads.</li>
 *   <li>{@link #readFrame()} is meant for one dedicated reader thread.</li>
 *   <li>{@link #close()} may be called concurrently and repeatedly.</li>
 * </ul>
 *
 * <h2>What this layer does not do</h2>
 * It does not interpret payloads, schedule heartbeats, or retry anything.
 */
public interface FrameHandler extends AutoCloseable
{
    enum State
    {
        CONSTRUCTING,
        CONNECTED,
        CLOSED
    }

    AmqpTcpEndpoint endpoint();

    State state();

    InetSocketAddress localAddress();

    int localPort();

    InetSocketAddress remoteAddress();

    int remotePort();

    /**
     * Pool that outbound buffers should be leased from.
     */
    ByteBufAllocator allocator();

    /**
     * Write and flush the protocol header synchronously. Must be called once,
     * before any frame is written.
     */
    void sendProtocolHeader() throws IOException;

    /**
     * Block until one complete frame has been read.
     */
    InboundFrame readFrame() throws IOException;

    /**
     * Queue a serialized frame for transmission; never blocks. Ownership of
     * {@code frame} passes to the handler, which releases it once written.
     * After close the frame is released and dropped.
     */
    void write(ByteBuf frame);

    void setReadTimeout(Duration timeout);

    void setWriteTimeout(Duration timeout);

    /**
     * Drain queued frames, then close the socket. Idempotent; never throws.
     */
    @Override
    void close();
}
