package com.questrail.amqp.transport;

import com.questrail.amqp.transport.config.FrameHandlerConfig;
import com.questrail.amqp.transport.connect.DualStackConnector;
import com.questrail.amqp.transport.connect.HostResolver;
import com.questrail.amqp.transport.connect.Ipv6Support;
import com.questrail.amqp.transport.connect.JdkTransportSocketFactory;
import com.questrail.amqp.transport.connect.SocketConnector;
import com.questrail.amqp.transport.connect.TransportSocket;
import com.questrail.amqp.transport.connect.TransportSocketFactory;
import com.questrail.amqp.transport.frame.FrameReader;
import com.questrail.amqp.transport.frame.InboundFrame;
import com.questrail.amqp.transport.frame.ProtocolHeader;
import com.questrail.amqp.transport.observability.NullObservabilitySink;
import com.questrail.amqp.transport.observability.TransportObservabilityEvent;
import com.questrail.amqp.transport.observability.TransportObservabilitySink;
import com.questrail.amqp.transport.time.MonotonicClock;
import com.questrail.amqp.transport.time.ScheduledExecutorScheduler;
import com.questrail.amqp.transport.time.SystemMonotonicClock;
import com.questrail.amqp.transport.tls.JsseStreamUpgrader;
import com.questrail.amqp.transport.tls.SecureStreamUpgrader;
import com.questrail.amqp.transport.write.OutboundWritePipeline;
import com.questrail.amqp.transport.write.WriteDeadlineWatchdog;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.BooleanSupplier;

/**
 * SocketFrameHandler
 * =============================================================================
 * {@link FrameHandler} over a blocking TCP socket, optionally TLS.
 *
 * <h2>Construction</h2>
 * {@link Builder#connect()} performs, in order:
 * <ol>
 *   <li>dual-stack connect (IPv6 first, IPv4 fallback) under the connection timeout;</li>
 *   <li>read timeout on the socket, write timeout on the write watchdog;</li>
 *   <li>TLS upgrade when the endpoint enables it;</li>
 *   <li>independent read and write buffers sized to the socket's receive and
 *       send buffer sizes;</li>
 *   <li>start of the background writer.</li>
 * </ol>
 * Any failure closes whatever was opened and propagates; no instance is returned.
 *
 * <h2>Lifecycle</h2>
 * {@code CONSTRUCTING -> CONNECTED -> CLOSED}. The transition to
 * {@code CLOSED} runs under a lock, at most once.
 */
public final class SocketFrameHandler implements FrameHandler
{
    private static final Logger log = LoggerFactory.getLogger(SocketFrameHandler.class);

    private final AmqpTcpEndpoint endpoint;
    private final TransportObservabilitySink sink;
    private final ByteBufAllocator allocator;

    private final TransportSocket transport;
    private final Socket socket;
    private final OutputStream writer;
    private final FrameReader frameReader;
    private final ScheduledExecutorService deadlineExecutor;
    private final WriteDeadlineWatchdog writeWatchdog;
    private final OutboundWritePipeline pipeline;

    private final Object stateLock = new Object();
    private volatile State state = State.CONSTRUCTING;

    private SocketFrameHandler(Builder b) throws IOException
    {
        this.endpoint = b.endpoint;
        this.sink = b.sink;
        this.allocator = b.allocator;

        FrameHandlerConfig config = b.config;

        DualStackConnector connector = new DualStackConnector(
            b.resolver, new SocketConnector(b.socketFactory), b.ipv6Support, sink);
        this.transport = connector.connect(
            endpoint.hostName(), endpoint.port(), endpoint.addressFamily(), config.connectionTimeout());

        Socket stream = transport.socket();
        ScheduledExecutorService deadlines = null;
        try {
            transport.setReceiveTimeout(config.readTimeout());

            if (endpoint.ssl().enabled()) {
                stream = b.upgrader.upgrade(stream, endpoint.ssl(), endpoint.hostName());
            }
            this.socket = stream;

            InputStream reader = new BufferedInputStream(socket.getInputStream(), socket.getReceiveBufferSize());
            this.writer = new BufferedOutputStream(socket.getOutputStream(), socket.getSendBufferSize());
            this.frameReader = new FrameReader(reader, endpoint.maxMessageSize());

            deadlines = Executors.newSingleThreadScheduledExecutor(
                new DefaultThreadFactory("amqp-write-deadline", true));
            this.deadlineExecutor = deadlines;
            this.writeWatchdog = new WriteDeadlineWatchdog(
                new ScheduledExecutorScheduler(deadlines, b.clock), b.clock,
                config.writeTimeout(), this::onWriteTimeout);

            this.pipeline = new OutboundWritePipeline(
                writer, writeWatchdog, sink, new DefaultThreadFactory("amqp-writer", true));
        }
        catch (IOException | RuntimeException e) {
            if (deadlines != null) {
                deadlines.shutdownNow();
            }
            closeQuietly(stream);
            transport.close();
            throw e;
        }

        synchronized (stateLock) {
            state = State.CONNECTED;
        }
        try {
            sink.onTransportEvent(new TransportObservabilityEvent.Connected(
                Instant.now(), remoteAddress(), endpoint.ssl().enabled()));
        }
        catch (RuntimeException e) {
            log.debug("Observability sink failed on connect", e);
        }
    }

    public static Builder builder()
    {
        return new Builder();
    }

    @Override
    public AmqpTcpEndpoint endpoint()
    {
        return endpoint;
    }

    @Override
    public State state()
    {
        return state;
    }

    @Override
    public InetSocketAddress localAddress()
    {
        return (InetSocketAddress) transport.socket().getLocalSocketAddress();
    }

    @Override
    public int localPort()
    {
        return transport.socket().getLocalPort();
    }

    @Override
    public InetSocketAddress remoteAddress()
    {
        return (InetSocketAddress) transport.socket().getRemoteSocketAddress();
    }

    @Override
    public int remotePort()
    {
        return transport.socket().getPort();
    }

    @Override
    public ByteBufAllocator allocator()
    {
        return allocator;
    }

    @Override
    public void sendProtocolHeader() throws IOException
    {
        byte[] header = ProtocolHeader.encode(endpoint.protocol());
        writeWatchdog.guard(() -> {
            writer.write(header);
            writer.flush();
        });
    }

    @Override
    public InboundFrame readFrame() throws IOException
    {
        return frameReader.readFrame();
    }

    @Override
    public void write(ByteBuf frame)
    {
        pipeline.enqueue(frame);
    }

    @Override
    public void setReadTimeout(Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        try {
            if (transport.isConnected()) {
                transport.setReceiveTimeout(timeout);
            }
        }
        catch (SocketException e) {
            // socket closed concurrently
            log.debug("Could not apply read timeout; socket already closed", e);
        }
    }

    @Override
    public void setWriteTimeout(Duration timeout)
    {
        writeWatchdog.setTimeout(timeout);
    }

    @Override
    public void close()
    {
        synchronized (stateLock) {
            if (state != State.CONNECTED) {
                return;
            }
            try {
                pipeline.close();
            }
            catch (RuntimeException e) {
                log.debug("Ignoring failure draining outbound frames during close", e);
            }

            try {
                closeQuietly(socket);
                transport.close();
            }
            catch (RuntimeException e) {
                log.debug("Ignoring failure closing socket", e);
            }
            finally {
                deadlineExecutor.shutdownNow();
                state = State.CLOSED;
            }
        }

        try {
            sink.onTransportEvent(new TransportObservabilityEvent.Closed(Instant.now(), endpointAddress()));
        }
        catch (RuntimeException e) {
            log.debug("Observability sink failed on close", e);
        }
    }

    private InetSocketAddress endpointAddress()
    {
        InetSocketAddress remote = remoteAddress();
        return remote != null ? remote : InetSocketAddress.createUnresolved(endpoint.hostName(), endpoint.port());
    }

    private void onWriteTimeout()
    {
        try {
            sink.onTransportEvent(new TransportObservabilityEvent.WriteTimedOut(Instant.now(), writeWatchdog.timeout()));
        }
        catch (RuntimeException e) {
            log.debug("Observability sink failed on write timeout", e);
        }
        // Close the plain socket underneath any TLS layer. Closing an SSLSocket
        // sends close_notify under the lock the blocked writer holds.
        transport.close();
    }

    private static void closeQuietly(Socket s)
    {
        try {
            s.close();
        }
        catch (IOException e) {
            log.debug("Ignoring failure closing socket", e);
        }
    }

    @Override
    public String toString()
    {
        return "SocketFrameHandler[" + endpoint + ", " + state() + "]";
    }

    public static final class Builder {
        private AmqpTcpEndpoint endpoint;
        private FrameHandlerConfig config = FrameHandlerConfig.defaults();
        private TransportSocketFactory socketFactory = new JdkTransportSocketFactory();
        private HostResolver resolver = HostResolver.SYSTEM;
        private BooleanSupplier ipv6Support = Ipv6Support.platformDefault();
        private SecureStreamUpgrader upgrader = new JsseStreamUpgrader();
        private TransportObservabilitySink sink = NullObservabilitySink.INSTANCE;
        private ByteBufAllocator allocator = PooledByteBufAllocator.DEFAULT;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;

        private Builder() {}

        public Builder withEndpoint(AmqpTcpEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder withConfig(FrameHandlerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withSocketFactory(TransportSocketFactory socketFactory) {
            this.socketFactory = socketFactory;
            return this;
        }

        public Builder withResolver(HostResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder withIpv6Support(BooleanSupplier ipv6Support) {
            this.ipv6Support = ipv6Support;
            return this;
        }

        public Builder withSecureStreamUpgrader(SecureStreamUpgrader upgrader) {
            this.upgrader = upgrader;
            return this;
        }

        public Builder withObservabilitySink(TransportObservabilitySink sink) {
            this.sink = sink;
            return this;
        }

        public Builder withAllocator(ByteBufAllocator allocator) {
            this.allocator = allocator;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Open the connection. Blocks until connected, upgraded and ready.
         *
         * @throws com.questrail.amqp.transport.connect.ConnectFailureException if no connection could be established
         * @throws IOException if the TLS upgrade or stream setup failed; the socket has been closed
         */
        public SocketFrameHandler connect() throws IOException {
            Objects.requireNonNull(endpoint, "endpoint");
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(socketFactory, "socketFactory");
            Objects.requireNonNull(resolver, "resolver");
            Objects.requireNonNull(ipv6Support, "ipv6Support");
            Objects.requireNonNull(upgrader, "upgrader");
            Objects.requireNonNull(sink, "sink");
            Objects.requireNonNull(allocator, "allocator");
            Objects.requireNonNull(clock, "clock");
            return new SocketFrameHandler(this);
        }
    }
}
