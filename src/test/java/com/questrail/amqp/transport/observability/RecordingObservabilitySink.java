package com.questrail.amqp.transport.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements TransportObservabilitySink {
    private final List<Object> events = new ArrayList<>();
    private long bytesSent;

    @Override
    public synchronized void onBytesSent(int bytes) {
        bytesSent += bytes;
    }

    @Override
    public synchronized void onTransportEvent(TransportObservabilityEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(TransportErrorEvent event) {
        events.add(event);
    }

    public synchronized long bytesSent() {
        return bytesSent;
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
