package com.questrail.amqp.transport.connect;

import com.questrail.amqp.transport.AddressFamily;
import io.netty.util.concurrent.DefaultThreadFactory;

import java.io.IOException;
import java.net.Socket;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Default {@link TransportSocketFactory} creating plain {@link Socket}s with
 * {@code TCP_NODELAY} and fixed send/receive buffer sizes.
 *
 * <p>Blocking connects run on a shared pool of daemon threads so the caller
 * can bound them with a deadline.</p>
 */
public final class JdkTransportSocketFactory implements TransportSocketFactory
{
    public static final int DEFAULT_BUFFER_SIZE = 64 * 1024;

    private static final ExecutorService CONNECT_EXECUTOR =
        Executors.newCachedThreadPool(new DefaultThreadFactory("amqp-connect", true));

    private final int receiveBufferSize;
    private final int sendBufferSize;
    private final ExecutorService connectExecutor;

    public JdkTransportSocketFactory() {
        this(DEFAULT_BUFFER_SIZE, DEFAULT_BUFFER_SIZE);
    }

    public JdkTransportSocketFactory(int receiveBufferSize, int sendBufferSize) {
        this(receiveBufferSize, sendBufferSize, CONNECT_EXECUTOR);
    }

    JdkTransportSocketFactory(int receiveBufferSize, int sendBufferSize, ExecutorService connectExecutor) {
        if (receiveBufferSize <= 0 || sendBufferSize <= 0) {
            throw new IllegalArgumentException("buffer sizes must be > 0");
        }
        this.receiveBufferSize = receiveBufferSize;
        this.sendBufferSize = sendBufferSize;
        this.connectExecutor = Objects.requireNonNull(connectExecutor, "connectExecutor");
    }

    @Override
    public TransportSocket create(AddressFamily family) throws IOException {
        Objects.requireNonNull(family, "family");

        Socket socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.setReceiveBufferSize(receiveBufferSize);
            socket.setSendBufferSize(sendBufferSize);
        }
        catch (IOException e) {
            socket.close();
            throw e;
        }
        return new JdkTransportSocket(socket, family, connectExecutor);
    }
}
