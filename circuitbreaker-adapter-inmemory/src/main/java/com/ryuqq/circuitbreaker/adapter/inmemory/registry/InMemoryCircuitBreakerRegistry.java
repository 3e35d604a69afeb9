package com.ryuqq.circuitbreaker.adapter.inmemory.registry;

import com.ryuqq.circuitbreaker.core.exception.CircuitBreakerNotFoundException;
import com.ryuqq.circuitbreaker.core.function.ThrowingSupplier;
import com.ryuqq.circuitbreaker.core.model.CircuitBreakerStats;
import com.ryuqq.circuitbreaker.core.protection.CircuitBreaker;
import com.ryuqq.circuitbreaker.core.protection.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * In-memory implementation of {@link CircuitBreakerRegistry}.
 *
 * <p>Breakers are kept in a {@link ConcurrentHashMap} keyed by name. The registry is an
 * ordinary object: create one, hand it to the components that need it, and let it go
 * out of scope with them. There is no process-wide instance.</p>
 *
 * <p><strong>Aggregates:</strong> {@link #getAllStats()} and {@link #getHealthStatus()}
 * return unmodifiable maps sorted by name. Each entry is read from its breaker
 * independently, so the aggregate is not a single atomic snapshot across breakers.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * CircuitBreakerRegistry registry = new InMemoryCircuitBreakerRegistry();
 * registry.register("payment-api", CircuitBreakers.forApi("payment-api"));
 * registry.register("orders-db", CircuitBreakers.forDatabase("orders-db"));
 *
 * Order order = registry.execute("orders-db", () -> orderRepository.find(orderId));
 * Map<String, Boolean> health = registry.getHealthStatus();
 * }</pre>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public class InMemoryCircuitBreakerRegistry implements CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCircuitBreakerRegistry.class);

    /**
     * Registered breakers.
     * Key: registry name, Value: breaker
     */
    private final ConcurrentHashMap<String, CircuitBreaker> breakers;

    /**
     * Creates an empty registry.
     */
    public InMemoryCircuitBreakerRegistry() {
        this.breakers = new ConcurrentHashMap<>();
    }

    /**
     * {@inheritDoc}
     *
     * <p>Replacing an existing entry is allowed and logged at WARN. The replaced breaker
     * keeps its state and is simply no longer reachable through this registry.</p>
     */
    @Override
    public CircuitBreaker register(String name, CircuitBreaker breaker) {
        validateName(name);
        if (breaker == null) {
            throw new IllegalArgumentException("breaker cannot be null");
        }

        CircuitBreaker previous = breakers.put(name, breaker);
        if (previous != null && previous != breaker) {
            log.warn("Circuit breaker '{}' replaced in registry", name);
        } else if (previous == null) {
            log.info("Circuit breaker '{}' registered", name);
        }
        return previous;
    }

    @Override
    public Optional<CircuitBreaker> unregister(String name) {
        validateName(name);
        CircuitBreaker removed = breakers.remove(name);
        if (removed != null) {
            log.info("Circuit breaker '{}' unregistered", name);
        }
        return Optional.ofNullable(removed);
    }

    @Override
    public Optional<CircuitBreaker> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(breakers.get(name));
    }

    @Override
    public Set<String> getNames() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(breakers.keySet()));
    }

    @Override
    public <T, E extends Exception> T execute(String name, ThrowingSupplier<T, E> operation) throws E {
        return lookup(name).execute(operation);
    }

    @Override
    public <T> CompletableFuture<T> executeAsync(String name, Supplier<? extends CompletionStage<T>> operation) {
        CircuitBreaker breaker;
        try {
            breaker = lookup(name);
        } catch (CircuitBreakerNotFoundException e) {
            return CompletableFuture.failedFuture(e);
        }
        return breaker.executeAsync(operation);
    }

    @Override
    public Map<String, CircuitBreakerStats> getAllStats() {
        return collect(CircuitBreaker::getStats);
    }

    @Override
    public Map<String, Boolean> getHealthStatus() {
        return collect(CircuitBreaker::isHealthy);
    }

    @Override
    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
        log.info("Reset {} circuit breakers", breakers.size());
    }

    private CircuitBreaker lookup(String name) {
        CircuitBreaker breaker = name == null ? null : breakers.get(name);
        if (breaker == null) {
            throw new CircuitBreakerNotFoundException(name);
        }
        return breaker;
    }

    private <V> Map<String, V> collect(Function<CircuitBreaker, V> extractor) {
        SortedMap<String, V> result = new TreeMap<>();
        breakers.forEach((name, breaker) -> result.put(name, extractor.apply(breaker)));
        return Collections.unmodifiableSortedMap(result);
    }

    private static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }
}
