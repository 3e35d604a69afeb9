package com.ryuqq.circuitbreaker.core.model;

import com.ryuqq.circuitbreaker.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerStatsTest {

    @Test
    void empty_IsClosedWithZeroCounters() {
        // When
        CircuitBreakerStats stats = CircuitBreakerStats.empty("orders");

        // Then
        assertEquals("orders", stats.name());
        assertEquals(CircuitBreakerState.CLOSED, stats.state());
        assertEquals(0, stats.totalRequests());
        assertNull(stats.lastFailureTime());
        assertNull(stats.nextAttemptTime());
        assertEquals(Duration.ZERO, stats.uptime());
        assertEquals(0.0, stats.failureRate());
    }

    @Test
    void failureRate_IsPercentageOfTotalRequests() {
        // Given
        Instant now = Instant.parse("2024-01-01T00:00:00Z");
        CircuitBreakerStats stats = new CircuitBreakerStats(
            "orders", CircuitBreakerState.OPEN, 3, 5, 12, now, now, now.plusSeconds(1), Duration.ZERO);

        // When & Then
        assertEquals(25.0, stats.failureRate(), 0.0001);
    }

    @Test
    void constructor_InvalidValues_ThrowException() {
        assertThrows(IllegalArgumentException.class, () -> CircuitBreakerStats.empty(" "));
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreakerStats(
            "orders", null, 0, 0, 0, null, null, null, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreakerStats(
            "orders", CircuitBreakerState.CLOSED, -1, 0, 0, null, null, null, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new CircuitBreakerStats(
            "orders", CircuitBreakerState.CLOSED, 0, 0, 0, null, null, null, null));
    }
}
