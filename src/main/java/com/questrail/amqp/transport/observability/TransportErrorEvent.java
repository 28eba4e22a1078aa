package com.questrail.amqp.transport.observability;

import java.time.Instant;

/**
 * Record representing a transport fault that no caller observes directly.
 */
public record TransportErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
