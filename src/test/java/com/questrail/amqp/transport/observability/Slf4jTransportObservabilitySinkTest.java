package com.questrail.amqp.transport.observability;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

class Slf4jTransportObservabilitySinkTest {

    private final Slf4jTransportObservabilitySink sink = new Slf4jTransportObservabilitySink();

    @Test
    void logsEveryEventKindWithoutFailing() {
        InetSocketAddress remote = new InetSocketAddress("127.0.0.1", 5672);

        assertDoesNotThrow(() -> {
            sink.onBytesSent(42);
            sink.onTransportEvent(new TransportObservabilityEvent.Connected(Instant.EPOCH, remote, false));
            sink.onTransportEvent(new TransportObservabilityEvent.Ipv6Fallback(
                Instant.EPOCH, remote, new IOException("unreachable")));
            sink.onTransportEvent(new TransportObservabilityEvent.WriteTimedOut(Instant.EPOCH, Duration.ofSeconds(1)));
            sink.onTransportEvent(new TransportObservabilityEvent.Closed(Instant.EPOCH, remote));
            sink.onError(new TransportErrorEvent(Instant.EPOCH, "boom", new IOException("broken pipe")));
        });
    }
}
