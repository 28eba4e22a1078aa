package com.questrail.amqp.transport.connect;

import java.io.Closeable;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * TransportSocket
 * -----------------------------------------------------------------------------
 * Port over one TCP client socket.
 *
 * <p>The connector only needs to start a connect and tear the socket down; the
 * frame handler additionally reaches the underlying {@link Socket} for streams,
 * buffer sizes and the TLS upgrade. Implementations may be backed by a plain
 * JDK socket or by a test double.</p>
 */
public interface TransportSocket extends Closeable
{
    /**
     * Start connecting to {@code remote}. The returned future completes when
     * the connection is established, or exceptionally with the connect fault.
     *
     * <p>Closing the socket while the connect is pending must make the future
     * complete exceptionally.</p>
     */
    CompletableFuture<Void> connectAsync(InetSocketAddress remote);

    boolean isConnected();

    /**
     * Set the read timeout ({@code SO_TIMEOUT}); {@link Duration#ZERO} waits forever.
     */
    void setReceiveTimeout(Duration timeout) throws SocketException;

    /**
     * @return the underlying socket
     */
    Socket socket();

    /**
     * Closes the socket. Must be safe to call more than once.
     */
    @Override
    void close();
}
