package com.questrail.amqp.transport.connect;

import com.questrail.amqp.transport.AddressFamily;
import com.questrail.amqp.transport.observability.TransportObservabilityEvent;
import com.questrail.amqp.transport.observability.TransportObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * DualStackConnector
 * =============================================================================
 * Connects to a host over IPv6 when possible and falls back to IPv4.
 *
 * <h2>Algorithm</h2>
 * <ol>
 *   <li>Resolve the host name once.</li>
 *   <li>No IPv6 address: fail if IPv6 was explicitly requested.</li>
 *   <li>IPv6 address, platform IPv6 support, and a request other than IPv4:
 *       try IPv6. Any failure is discarded.</li>
 *   <li>Still unconnected: require an IPv4 address and connect over IPv4. A
 *       failure here is final.</li>
 * </ol>
 *
 * <p>The attempts are sequential. There is no concurrent race between the
 * two families; the IPv4 attempt starts only after the IPv6 attempt has
 * failed or timed out.</p>
 */
public final class DualStackConnector
{
    private static final Logger log = LoggerFactory.getLogger(DualStackConnector.class);

    private final HostResolver resolver;
    private final SocketConnector connector;
    private final BooleanSupplier platformSupportsIpv6;
    private final TransportObservabilitySink sink;

    public DualStackConnector(
            HostResolver resolver,
            SocketConnector connector,
            BooleanSupplier platformSupportsIpv6,
            TransportObservabilitySink sink)
    {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.connector = Objects.requireNonNull(connector, "connector");
        this.platformSupportsIpv6 = Objects.requireNonNull(platformSupportsIpv6, "platformSupportsIpv6");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public TransportSocket connect(String hostName, int port, AddressFamily requested, Duration timeout)
            throws ConnectFailureException
    {
        Objects.requireNonNull(hostName, "hostName");
        Objects.requireNonNull(requested, "requested");

        InetAddress[] addresses = resolve(hostName);

        TransportSocket socket = null;

        Optional<InetAddress> ipv6 = AddressSelector.firstMatching(addresses, AddressFamily.IPV6);
        if (ipv6.isEmpty()) {
            if (requested == AddressFamily.IPV6) {
                throw new ConnectFailureException("Connection failed",
                    new IllegalArgumentException("No IPv6 address could be resolved for " + hostName));
            }
        }
        else if (shouldTryIpv6(requested)) {
            InetSocketAddress target = new InetSocketAddress(ipv6.get(), port);
            try {
                socket = connector.connect(target, AddressFamily.IPV6, timeout);
            }
            catch (ConnectFailureException e) {
                log.debug("IPv6 connect to {} failed, trying IPv4", target, e);
                sink.onTransportEvent(new TransportObservabilityEvent.Ipv6Fallback(
                    Instant.now(), target, e.getCause() != null ? e.getCause() : e));
            }
        }

        if (socket == null) {
            InetAddress ipv4 = AddressSelector.firstMatching(addresses, AddressFamily.IPV4)
                .orElseThrow(() -> new ConnectFailureException("Connection failed",
                    new IllegalArgumentException("No ip address could be resolved for " + hostName)));
            socket = connector.connect(new InetSocketAddress(ipv4, port), AddressFamily.IPV4, timeout);
        }

        return socket;
    }

    private boolean shouldTryIpv6(AddressFamily requested)
    {
        return requested != AddressFamily.IPV4 && platformSupportsIpv6.getAsBoolean();
    }

    private InetAddress[] resolve(String hostName) throws ConnectFailureException
    {
        try {
            return resolver.resolve(hostName);
        }
        catch (UnknownHostException | IllegalArgumentException | SecurityException e) {
            throw new ConnectFailureException("Connection failed", e);
        }
    }
}
