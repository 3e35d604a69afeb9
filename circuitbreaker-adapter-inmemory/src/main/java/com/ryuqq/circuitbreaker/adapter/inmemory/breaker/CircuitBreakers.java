package com.ryuqq.circuitbreaker.adapter.inmemory.breaker;

import com.ryuqq.circuitbreaker.core.config.CircuitBreakerConfig;
import com.ryuqq.circuitbreaker.core.config.CircuitBreakerPresets;

import java.time.Clock;
import java.util.function.UnaryOperator;

/**
 * Factory for {@link InMemoryCircuitBreaker} instances built from presets.
 *
 * <p>Every preset method has an overload taking a customizer. The customizer receives the
 * preset configuration and whatever it changes takes precedence over the preset defaults:</p>
 * <pre>{@code
 * CircuitBreaker breaker = CircuitBreakers.forApi("search-api",
 *     config -> config.withFailureThreshold(2).withListener(metricsListener));
 * }</pre>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 * @see CircuitBreakerPresets
 */
public final class CircuitBreakers {

    // Utility class - prevent instantiation
    private CircuitBreakers() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Remote API breaker: threshold 5, recovery 30s, HTTP 4xx expected.
     */
    public static InMemoryCircuitBreaker forApi(String name) {
        return of(name, CircuitBreakerPresets.api());
    }

    public static InMemoryCircuitBreaker forApi(String name, UnaryOperator<CircuitBreakerConfig> customizer) {
        return of(name, CircuitBreakerPresets.api(customizer));
    }

    /**
     * Database breaker: threshold 3, recovery 60s, {@code VALIDATION_ERROR} expected.
     */
    public static InMemoryCircuitBreaker forDatabase(String name) {
        return of(name, CircuitBreakerPresets.database());
    }

    public static InMemoryCircuitBreaker forDatabase(String name, UnaryOperator<CircuitBreakerConfig> customizer) {
        return of(name, CircuitBreakerPresets.database(customizer));
    }

    /**
     * Third-party service breaker: threshold 10, recovery 120s, HTTP 429 expected.
     */
    public static InMemoryCircuitBreaker forExternalService(String name) {
        return of(name, CircuitBreakerPresets.externalService());
    }

    public static InMemoryCircuitBreaker forExternalService(String name, UnaryOperator<CircuitBreakerConfig> customizer) {
        return of(name, CircuitBreakerPresets.externalService(customizer));
    }

    /**
     * Breaker with an explicit configuration on the system UTC clock.
     */
    public static InMemoryCircuitBreaker of(String name, CircuitBreakerConfig config) {
        return new InMemoryCircuitBreaker(name, config);
    }

    /**
     * Breaker with an explicit configuration and time source.
     */
    public static InMemoryCircuitBreaker of(String name, CircuitBreakerConfig config, Clock clock) {
        return new InMemoryCircuitBreaker(name, config, clock);
    }
}
