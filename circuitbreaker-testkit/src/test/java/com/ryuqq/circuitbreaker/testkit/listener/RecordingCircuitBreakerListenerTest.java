package com.ryuqq.circuitbreaker.testkit.listener;

import com.ryuqq.circuitbreaker.core.model.CircuitBreakerStats;
import com.ryuqq.circuitbreaker.core.protection.CircuitBreakerState;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class RecordingCircuitBreakerListenerTest {

    @Test
    void records_events_in_arrival_order() {
        // Given
        RecordingCircuitBreakerListener listener = new RecordingCircuitBreakerListener();

        // When
        listener.onFailure("db", new IOException("down"));
        listener.onStateChange("db", CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN);
        listener.onCallRejected("db", CircuitBreakerStats.empty("db"));
        listener.onIgnoredError("db", new TimeoutException());
        listener.onSuccess("db");

        // Then
        assertThat(listener.getEvents()).containsExactly(
            "FAILURE:IOException",
            "STATE:CLOSED->OPEN",
            "REJECTED:CLOSED",
            "IGNORED:TimeoutException",
            "SUCCESS");
        assertThat(listener.getStateChanges()).containsExactly(CircuitBreakerState.OPEN);
        assertThat(listener.getFailures()).singleElement().isInstanceOf(IOException.class);
        assertThat(listener.eventsStartingWith("STATE")).hasSize(1);
    }

    @Test
    void clear_discards_everything() {
        RecordingCircuitBreakerListener listener = new RecordingCircuitBreakerListener();
        listener.onSuccess("db");
        listener.onStateChange("db", CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN);

        listener.clear();

        assertThat(listener.getEvents()).isEmpty();
        assertThat(listener.getStateChanges()).isEmpty();
        assertThat(listener.getFailures()).isEmpty();
    }
}
