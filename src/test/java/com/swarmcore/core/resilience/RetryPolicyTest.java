package com.swarmcore.core.resilience;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    @DisplayName("delay doubles per failed attempt up to the cap")
    void exponentialWithCap() {
        var policy = RetryPolicy.exponential(10, Duration.ofMillis(100), Duration.ofMillis(500));
        assertEquals(Duration.ofMillis(100), policy.delay(1));
        assertEquals(Duration.ofMillis(200), policy.delay(2));
        assertEquals(Duration.ofMillis(400), policy.delay(3));
        assertEquals(Duration.ofMillis(500), policy.delay(4));
        assertEquals(Duration.ofMillis(500), policy.delay(30));
    }

    @Test
    @DisplayName("invalid settings are rejected")
    void invalid() {
        assertThrows(IllegalArgumentException.class,
                () -> RetryPolicy.exponential(0, Duration.ofMillis(1), Duration.ofMillis(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(1, Duration.ofMillis(1), Duration.ofMillis(1), 0.5));
    }
}
