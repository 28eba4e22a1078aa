package com.questrail.amqp.transport.connect;

import com.questrail.amqp.transport.AddressFamily;
import com.questrail.amqp.transport.time.Timeouts;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * SocketConnector
 * -----------------------------------------------------------------------------
 * Creates one socket for an address family and connects it under a deadline.
 *
 * <p>Every failure mode (bad argument, socket error, unsupported operation,
 * deadline exceeded, interruption) is reported as {@link ConnectFailureException}
 * with the original fault as cause. The socket is closed before the exception
 * leaves this class.</p>
 */
public final class SocketConnector
{
    private final TransportSocketFactory socketFactory;

    public SocketConnector(TransportSocketFactory socketFactory)
    {
        this.socketFactory = Objects.requireNonNull(socketFactory, "socketFactory");
    }

    public TransportSocket connect(InetSocketAddress remote, AddressFamily family, Duration timeout)
            throws ConnectFailureException
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(family, "family");
        Objects.requireNonNull(timeout, "timeout");

        TransportSocket socket;
        try {
            socket = socketFactory.create(family);
        }
        catch (IOException | IllegalArgumentException | UnsupportedOperationException e) {
            throw failed(e);
        }

        try {
            Timeouts.await(socket.connectAsync(remote), timeout);
            return socket;
        }
        catch (IOException | IllegalArgumentException | UnsupportedOperationException | TimeoutException e) {
            socket.close();
            throw failed(e);
        }
        catch (InterruptedException e) {
            socket.close();
            Thread.currentThread().interrupt();
            throw failed(e);
        }
    }

    private static ConnectFailureException failed(Exception cause)
    {
        return new ConnectFailureException("Connection failed", cause);
    }
}
