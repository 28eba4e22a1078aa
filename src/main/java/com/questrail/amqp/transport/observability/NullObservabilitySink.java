package com.questrail.amqp.transport.observability;

/**
 * No-op implementation of TransportObservabilitySink.
 */
public final class NullObservabilitySink implements TransportObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onBytesSent(int bytes) {}

    @Override
    public void onTransportEvent(TransportObservabilityEvent event) {}

    @Override
    public void onError(TransportErrorEvent event) {}
}
