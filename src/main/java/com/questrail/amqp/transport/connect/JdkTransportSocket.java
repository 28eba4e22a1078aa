package com.questrail.amqp.transport.connect;

import com.questrail.amqp.transport.AddressFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * {@link TransportSocket} over a blocking JDK {@link Socket}.
 */
final class JdkTransportSocket implements TransportSocket
{
    private static final Logger log = LoggerFactory.getLogger(JdkTransportSocket.class);

    private final Socket socket;
    private final AddressFamily family;
    private final Executor connectExecutor;

    JdkTransportSocket(Socket socket, AddressFamily family, Executor connectExecutor)
    {
        this.socket = Objects.requireNonNull(socket, "socket");
        this.family = Objects.requireNonNull(family, "family");
        this.connectExecutor = Objects.requireNonNull(connectExecutor, "connectExecutor");
    }

    @Override
    public CompletableFuture<Void> connectAsync(InetSocketAddress remote)
    {
        Objects.requireNonNull(remote, "remote");
        if (remote.isUnresolved()) {
            return CompletableFuture.failedFuture(
                new IllegalArgumentException("Unresolved address: " + remote));
        }
        if (!family.matches(remote.getAddress())) {
            return CompletableFuture.failedFuture(
                new IllegalArgumentException(remote.getAddress() + " is not an " + family + " address"));
        }

        return CompletableFuture.runAsync(() -> {
            try {
                socket.connect(remote);
            }
            catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, connectExecutor).exceptionallyCompose(t -> {
            Throwable cause = t.getCause() != null ? t.getCause() : t;
            if (cause instanceof UncheckedIOException u) {
                cause = u.getCause();
            }
            return CompletableFuture.failedFuture(cause);
        });
    }

    @Override
    public boolean isConnected()
    {
        return socket.isConnected() && !socket.isClosed();
    }

    @Override
    public void setReceiveTimeout(Duration timeout) throws SocketException
    {
        socket.setSoTimeout(soTimeoutMillis(timeout));
    }

    /**
     * {@code SO_TIMEOUT} of 0 waits forever, so a positive timeout below one
     * millisecond rounds up to 1.
     */
    static int soTimeoutMillis(Duration timeout)
    {
        if (timeout.isZero()) {
            return 0;
        }
        if (timeout.compareTo(Duration.ofMillis(Integer.MAX_VALUE)) >= 0) {
            return Integer.MAX_VALUE;
        }
        return (int) Math.max(1, timeout.toMillis());
    }

    @Override
    public Socket socket()
    {
        return socket;
    }

    @Override
    public void close()
    {
        try {
            socket.close();
        }
        catch (IOException e) {
            log.debug("Ignoring failure closing socket", e);
        }
    }
}
