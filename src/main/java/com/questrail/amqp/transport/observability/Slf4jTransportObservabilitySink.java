package com.questrail.amqp.transport.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of TransportObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jTransportObservabilitySink implements TransportObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jTransportObservabilitySink.class);

    @Override
    public void onBytesSent(int bytes) {
        log.trace("AMQP transport sent {} bytes", bytes);
    }

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {
        if (event instanceof TransportObservabilityEvent.Connected c) {
            log.info("AMQP transport connected to {} (tls={})", c.remote(), c.secured());
        }
        else if (event instanceof TransportObservabilityEvent.Ipv6Fallback f) {
            log.info("AMQP transport could not connect over IPv6 to {}, falling back to IPv4: {}",
                f.attempted(), f.cause().toString());
        }
        else if (event instanceof TransportObservabilityEvent.WriteTimedOut w) {
            log.warn("AMQP transport write exceeded {}; closing socket", w.writeTimeout());
        }
        else {
            log.info("AMQP transport event: {}", event);
        }
    }

    @Override
    public void onError(TransportErrorEvent event) {
        log.error("AMQP transport error: {}", event.message(), event.cause());
    }
}
