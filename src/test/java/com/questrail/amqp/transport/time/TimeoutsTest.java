package com.questrail.amqp.transport.time;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class TimeoutsTest {

    @Test
    void returnsValueWhenOperationCompletesInTime() throws Exception {
        CompletableFuture<String> op = CompletableFuture.completedFuture("ok");

        assertEquals("ok", Timeouts.await(op, Duration.ofSeconds(1)));
    }

    @Test
    void rethrowsIoFaultUnwrapped() {
        ConnectException refused = new ConnectException("refused");
        CompletableFuture<Void> op = CompletableFuture.failedFuture(refused);

        IOException thrown = assertThrows(IOException.class, () -> Timeouts.await(op, Duration.ofSeconds(1)));
        assertSame(refused, thrown);
    }

    @Test
    void rethrowsRuntimeFaultUnwrapped() {
        IllegalArgumentException bad = new IllegalArgumentException("bad address");
        CompletableFuture<Void> op = CompletableFuture.failedFuture(bad);

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
            () -> Timeouts.await(op, Duration.ofSeconds(1)));
        assertSame(bad, thrown);
    }

    @Test
    void wrapsCheckedNonIoFaultInIoException() {
        Exception odd = new Exception("odd");
        CompletableFuture<Void> op = CompletableFuture.failedFuture(odd);

        IOException thrown = assertThrows(IOException.class, () -> Timeouts.await(op, Duration.ofSeconds(1)));
        assertSame(odd, thrown.getCause());
    }

    @Test
    void timesOutWhenOperationDoesNotSettle() {
        CompletableFuture<Void> never = new CompletableFuture<>();

        assertThrows(TimeoutException.class, () -> Timeouts.await(never, Duration.ofMillis(20)));
    }

    @Test
    void lateFaultOfTimedOutOperationIsObservedAndDiscarded() {
        CompletableFuture<Void> slow = new CompletableFuture<>();

        assertThrows(TimeoutException.class, () -> Timeouts.await(slow, Duration.ofMillis(10)));

        // Settling afterwards must not throw back into the completing thread.
        assertDoesNotThrow(() -> slow.completeExceptionally(new ConnectException("late")));
        assertTrue(slow.isCompletedExceptionally());
    }

    @Test
    void durationBeyondNanosecondRangeSaturates() throws Exception {
        Duration forever = Duration.ofSeconds(Long.MAX_VALUE);

        assertEquals(Long.MAX_VALUE, Timeouts.saturatedNanos(forever));
        assertEquals(1_500L, Timeouts.saturatedNanos(Duration.ofNanos(1_500)));
        assertEquals("ok", Timeouts.await(CompletableFuture.completedFuture("ok"), forever));
    }
}
