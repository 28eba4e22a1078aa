package com.questrail.amqp.transport.observability;

/**
 * Receives notable transport events. Implementations can provide logging,
 * metrics, or tracing; the transport never depends on what they do.
 *
 * <p>Callbacks may arrive on the writer thread or on a caller thread and must
 * not block.</p>
 */
public interface TransportObservabilitySink {
    /**
     * Called after one outbound buffer has been written to the socket stream.
     * @param bytes number of bytes written
     */
    void onBytesSent(int bytes);

    /**
     * Called on connection lifecycle changes (connected, IPv6 fallback, closed, write timeout).
     * @param event the transport event
     */
    void onTransportEvent(TransportObservabilityEvent event);

    /**
     * Called when the transport hits a fault it cannot surface to a caller.
     * @param event the error event
     */
    void onError(TransportErrorEvent event);
}
