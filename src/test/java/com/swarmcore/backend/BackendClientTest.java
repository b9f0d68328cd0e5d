package com.swarmcore.backend;

import com.swarmcore.MutableClock;
import com.swarmcore.core.metrics.SwarmMetrics;
import com.swarmcore.core.pool.ConnectionPool;
import com.swarmcore.core.resilience.CircuitBreakerManager;
import com.swarmcore.core.resilience.CircuitOpenException;
import com.swarmcore.core.resilience.CircuitState;
import com.swarmcore.core.resilience.RetryPolicy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BackendClientTest {

    private BackendConnection connection;
    private CircuitBreakerManager breakers;
    private ConnectionPool pool;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock();
        connection = mock(BackendConnection.class);
        when(connection.isHealthy()).thenReturn(true);
        breakers = new CircuitBreakerManager(3, Duration.ofSeconds(30), clock);
        pool = new ConnectionPool(id -> connection, 2, Duration.ofMinutes(1), Duration.ofSeconds(1), clock);
        registry = new SimpleMeterRegistry();
    }

    private BackendClient client(int maxAttempts) {
        return new BackendClient(breakers, pool,
                RetryPolicy.exponential(maxAttempts, Duration.ofMillis(1), Duration.ofMillis(2)),
                new SwarmMetrics(registry));
    }

    @Test
    @DisplayName("returns the backend result and returns the connection to the pool")
    void success() {
        when(connection.invoke("svc", "in")).thenReturn("out");

        assertEquals("out", client(3).invoke("svc", "in"));
        assertEquals(0, pool.stats().inUse());
        assertEquals(1, registry.find("swarmcore.backend.calls").tag("success", "true").timer().count());
    }

    @Test
    @DisplayName("transient failures are retried")
    void retriesTransientFailure() {
        when(connection.invoke("svc", "in"))
                .thenThrow(new BackendException("svc", "flaky"))
                .thenReturn("out");

        assertEquals("out", client(3).invoke("svc", "in"));
        verify(connection, times(2)).invoke("svc", "in");
    }

    @Test
    @DisplayName("gives up after the last attempt with the backend error")
    void exhaustsAttempts() {
        when(connection.invoke(anyString(), anyString())).thenThrow(new BackendException("svc", "down"));

        var ex = assertThrows(BackendException.class, () -> client(2).invoke("svc", "in"));
        assertEquals("svc", ex.getEndpoint());
        verify(connection, times(2)).invoke("svc", "in");
    }

    @Test
    @DisplayName("three failed calls open the breaker; the fourth fails fast without reaching the backend")
    void breakerOpensAfterThreshold() {
        when(connection.invoke(anyString(), anyString())).thenThrow(new BackendException("E", "down"));
        BackendClient client = client(1);

        for (int i = 0; i < 3; i++) {
            assertThrows(BackendException.class, () -> client.invoke("E", "x"));
        }
        assertEquals(CircuitState.OPEN, breakers.breaker("E").getState());

        assertThrows(CircuitOpenException.class, () -> client.invoke("E", "x"));
        verify(connection, times(3)).invoke("E", "x");
        assertEquals(1.0, registry.find("swarmcore.circuit.rejections").tag("endpoint", "E").counter().count());
    }

    @Test
    @DisplayName("open circuit is not retried")
    void openCircuitNotRetried() {
        when(connection.invoke(anyString(), anyString())).thenThrow(new BackendException("E", "down"));
        for (int i = 0; i < 3; i++) {
            assertThrows(BackendException.class, () -> client(1).invoke("E", "x"));
        }

        assertThrows(CircuitOpenException.class, () -> client(5).invoke("E", "x"));
        verify(connection, times(3)).invoke("E", "x");
    }

    @Test
    @DisplayName("interrupt during backoff surfaces as a backend error naming the endpoint")
    void interruptedBackoff() {
        when(connection.invoke(anyString(), anyString())).thenThrow(new BackendException("svc", "flaky"));
        Thread.currentThread().interrupt();
        try {
            var ex = assertThrows(BackendException.class, () -> client(3).invoke("svc", "in"));
            assertEquals("svc", ex.getEndpoint());
            assertInstanceOf(InterruptedException.class, ex.getCause());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
        verify(connection, times(1)).invoke("svc", "in");
    }
}
