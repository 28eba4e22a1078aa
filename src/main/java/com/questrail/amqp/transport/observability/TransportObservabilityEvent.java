package com.questrail.amqp.transport.observability;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;

/**
 * Transport lifecycle events reported to a {@link TransportObservabilitySink}.
 */
public sealed interface TransportObservabilityEvent {

    Instant timestamp();

    record Connected(Instant timestamp, InetSocketAddress remote, boolean secured)
            implements TransportObservabilityEvent {}

    record Ipv6Fallback(Instant timestamp, InetSocketAddress attempted, Throwable cause)
            implements TransportObservabilityEvent {}

    record WriteTimedOut(Instant timestamp, Duration writeTimeout)
            implements TransportObservabilityEvent {}

    record Closed(Instant timestamp, InetSocketAddress remote)
            implements TransportObservabilityEvent {}
}
