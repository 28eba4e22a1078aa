package com.questrail.amqp.transport.connect;

import com.questrail.amqp.transport.AddressFamily;
import com.questrail.amqp.transport.observability.RecordingObservabilitySink;
import com.questrail.amqp.transport.observability.TransportObservabilityEvent;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DualStackConnectorTest
 * -----------------------------------------------------------------------------
 * Address-family selection and IPv6-then-IPv4 fallback, exercised against a
 * scripted socket factory.
 */
final class DualStackConnectorTest {

    private static final int PORT = 5672;
    private static final Duration TIMEOUT = Duration.ofMillis(200);
    private static final BooleanSupplier IPV6_OK = () -> true;
    private static final BooleanSupplier NO_IPV6 = () -> false;

    private final InetAddress v4 = FakeTransportSocketFactory.address("broker", 10, 0, 0, 1);
    private final InetAddress v6 = FakeTransportSocketFactory.address("broker",
        0x20, 0x01, 0x0d, 0xb8, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 1);

    private final FakeTransportSocketFactory factory = new FakeTransportSocketFactory();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    private DualStackConnector connector(BooleanSupplier ipv6Support, InetAddress... resolved) {
        return new DualStackConnector(host -> resolved.clone(), new SocketConnector(factory), ipv6Support, sink);
    }

    @Test
    void ipv4OnlyHostConnectsOverIpv4EvenWhenPlatformSupportsIpv6() throws Exception {
        factory.script(v4, FakeTransportSocketFactory.Outcome.CONNECT);

        TransportSocket socket = connector(IPV6_OK, v4).connect("broker", PORT, AddressFamily.UNSPECIFIED, TIMEOUT);

        assertTrue(socket.isConnected());
        assertEquals(List.of(new InetSocketAddress(v4, PORT)), factory.attempts());
    }

    @Test
    void dualStackHostWithWorkingIpv6NeverTriesIpv4() throws Exception {
        factory.script(v6, FakeTransportSocketFactory.Outcome.CONNECT)
               .script(v4, FakeTransportSocketFactory.Outcome.CONNECT);

        connector(IPV6_OK, v4, v6).connect("broker", PORT, AddressFamily.UNSPECIFIED, TIMEOUT);

        assertEquals(List.of(new InetSocketAddress(v6, PORT)), factory.attempts());
        assertEquals(AddressFamily.IPV6, factory.created().get(0).family());
    }

    @Test
    void refusedIpv6FallsBackToIpv4() throws Exception {
        factory.script(v6, FakeTransportSocketFactory.Outcome.REFUSE)
               .script(v4, FakeTransportSocketFactory.Outcome.CONNECT);

        TransportSocket socket = connector(IPV6_OK, v6, v4).connect("broker", PORT, AddressFamily.UNSPECIFIED, TIMEOUT);

        assertTrue(socket.isConnected());
        assertEquals(List.of(new InetSocketAddress(v6, PORT), new InetSocketAddress(v4, PORT)), factory.attempts());
        assertTrue(factory.created().get(0).isClosed(), "failed IPv6 socket is discarded");
        assertTrue(sink.hasEventOfType(TransportObservabilityEvent.Ipv6Fallback.class));
    }

    @Test
    void hangingIpv6FallsBackToIpv4AfterDeadline() throws Exception {
        factory.script(v6, FakeTransportSocketFactory.Outcome.HANG)
               .script(v4, FakeTransportSocketFactory.Outcome.CONNECT);

        TransportSocket socket = connector(IPV6_OK, v6, v4).connect("broker", PORT, AddressFamily.UNSPECIFIED, TIMEOUT);

        assertTrue(socket.isConnected());
        TransportObservabilityEvent.Ipv6Fallback fallback =
            sink.eventsOfType(TransportObservabilityEvent.Ipv6Fallback.class).get(0);
        assertInstanceOf(TimeoutException.class, fallback.cause());
    }

    @Test
    void ipv6OnlyHostWithIpv4RequestFails() {
        factory.script(v6, FakeTransportSocketFactory.Outcome.CONNECT);

        ConnectFailureException e = assertThrows(ConnectFailureException.class,
            () -> connector(IPV6_OK, v6).connect("broker", PORT, AddressFamily.IPV4, TIMEOUT));

        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertTrue(factory.attempts().isEmpty(), "IPv6 must not be attempted for an IPv4-only request");
    }

    @Test
    void explicitIpv6RequestWithoutIpv6AddressFails() {
        factory.script(v4, FakeTransportSocketFactory.Outcome.CONNECT);

        ConnectFailureException e = assertThrows(ConnectFailureException.class,
            () -> connector(IPV6_OK, v4).connect("broker", PORT, AddressFamily.IPV6, TIMEOUT));

        assertTrue(e.getCause().getMessage().contains("No IPv6 address"));
        assertTrue(factory.attempts().isEmpty());
    }

    @Test
    void platformWithoutIpv6SkipsIpv6Candidate() throws Exception {
        factory.script(v6, FakeTransportSocketFactory.Outcome.CONNECT)
               .script(v4, FakeTransportSocketFactory.Outcome.CONNECT);

        connector(NO_IPV6, v6, v4).connect("broker", PORT, AddressFamily.UNSPECIFIED, TIMEOUT);

        assertEquals(List.of(new InetSocketAddress(v4, PORT)), factory.attempts());
    }

    @Test
    void ipv4FailureAfterFallbackIsFatal() {
        factory.script(v6, FakeTransportSocketFactory.Outcome.REFUSE)
               .script(v4, FakeTransportSocketFactory.Outcome.REFUSE);

        assertThrows(ConnectFailureException.class,
            () -> connector(IPV6_OK, v6, v4).connect("broker", PORT, AddressFamily.UNSPECIFIED, TIMEOUT));
        assertEquals(2, factory.attempts().size());
    }

    @Test
    void failedIpv6WithoutIpv4CandidateFails() {
        factory.script(v6, FakeTransportSocketFactory.Outcome.REFUSE);

        ConnectFailureException e = assertThrows(ConnectFailureException.class,
            () -> connector(IPV6_OK, v6).connect("broker", PORT, AddressFamily.UNSPECIFIED, TIMEOUT));

        assertTrue(e.getCause().getMessage().contains("No ip address"));
    }

    @Test
    void unresolvableHostIsNormalized() {
        DualStackConnector connector = new DualStackConnector(
            host -> { throw new UnknownHostException(host); },
            new SocketConnector(factory), IPV6_OK, sink);

        ConnectFailureException e = assertThrows(ConnectFailureException.class,
            () -> connector.connect("nowhere.invalid", PORT, AddressFamily.UNSPECIFIED, TIMEOUT));

        assertInstanceOf(UnknownHostException.class, e.getCause());
    }
}
