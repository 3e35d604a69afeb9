package com.ryuqq.circuitbreaker.adapter.inmemory.breaker;

import com.ryuqq.circuitbreaker.core.config.CircuitBreakerConfig;
import com.ryuqq.circuitbreaker.core.exception.CircuitBreakerOpenException;
import com.ryuqq.circuitbreaker.core.function.ThrowingSupplier;
import com.ryuqq.circuitbreaker.core.model.CircuitBreakerStats;
import com.ryuqq.circuitbreaker.core.protection.CircuitBreaker;
import com.ryuqq.circuitbreaker.core.protection.CircuitBreakerListener;
import com.ryuqq.circuitbreaker.core.protection.CircuitBreakerState;
import com.ryuqq.circuitbreaker.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Process-local, in-memory implementation of the {@link CircuitBreaker} SPI.
 *
 * <p>All state lives in this instance: nothing is persisted and nothing is shared
 * with other processes. Counters are cumulative since construction or the last
 * {@link #reset()}.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>Admission (count, OPEN check, OPEN → HALF_OPEN, probe reservation) is one critical section</li>
 *   <li>Outcome recording (counters, transition, nextAttempt) is one critical section</li>
 *   <li>The protected operation runs outside the lock</li>
 *   <li>Listeners are notified after the lock is released, on the calling thread</li>
 *   <li>Events from different threads may reach a listener out of transition order</li>
 * </ul>
 *
 * <p><strong>Single Probe:</strong> while HALF_OPEN, exactly one call holds the probe
 * permit. Concurrent callers are rejected with {@link CircuitBreakerOpenException}
 * until the probe outcome moves the breaker to CLOSED or back to OPEN.</p>
 *
 * <p><strong>Recovery:</strong> no timer is scheduled. Expiry of {@code recoveryTimeout}
 * is detected lazily by the next call.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>{@code
 * CircuitBreaker breaker = new InMemoryCircuitBreaker("inventory-db", CircuitBreakerPresets.database());
 *
 * Stock stock = breaker.execute(() -> inventoryRepository.findStock(sku));
 * }</pre>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public final class InMemoryCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCircuitBreaker.class);

    private final String name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<CircuitBreakerListener> listeners = new CopyOnWriteArrayList<>();

    // guarded by lock
    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private long failures;
    private long successes;
    private long totalRequests;
    private Instant lastFailureTime;
    private Instant lastSuccessTime;
    private Instant nextAttempt;
    private Permit activeProbe;

    /**
     * Creates a breaker using the system UTC clock.
     *
     * @param name breaker name
     * @param config breaker configuration
     * @throws IllegalArgumentException if any argument is null or name is blank
     */
    public InMemoryCircuitBreaker(String name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }

    /**
     * Creates a breaker with an explicit time source.
     *
     * @param name breaker name
     * @param config breaker configuration
     * @param clock time source for recovery timeout and timestamps
     * @throws IllegalArgumentException if any argument is null or name is blank
     */
    public InMemoryCircuitBreaker(String name, CircuitBreakerConfig config, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.name = name;
        this.config = config;
        this.clock = clock;
        this.listeners.addAll(config.listeners());
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * Returns the configuration this breaker was built with.
     *
     * @return immutable configuration
     */
    public CircuitBreakerConfig getConfig() {
        return config;
    }

    @Override
    public <T, E extends Exception> T execute(ThrowingSupplier<T, E> operation) throws E {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }

        Permit permit = acquirePermission();

        T result;
        try {
            result = operation.get();
        } catch (Exception | Error e) {
            onError(permit, e);
            throw e;
        }

        onSuccess(permit);
        return result;
    }

    @Override
    public <T> CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> operation) {
        return doExecuteAsync(operation, null);
    }

    @Override
    public <T> CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> operation, Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        return doExecuteAsync(operation, timeout);
    }

    private <T> CompletableFuture<T> doExecuteAsync(Supplier<? extends CompletionStage<T>> operation, Duration timeout) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }

        Permit permit;
        try {
            permit = acquirePermission();
        } catch (CircuitBreakerOpenException e) {
            return CompletableFuture.failedFuture(e);
        }

        CompletableFuture<T> source;
        try {
            CompletionStage<T> stage = operation.get();
            if (stage == null) {
                throw new IllegalStateException("operation returned a null CompletionStage");
            }
            source = stage.toCompletableFuture();
        } catch (Exception | Error e) {
            onError(permit, e);
            return CompletableFuture.failedFuture(e);
        }

        // orTimeout completes its receiver, so bound a copy rather than the caller's future
        if (timeout != null) {
            source = source.copy().orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        source.whenComplete((value, throwable) -> {
            if (throwable == null) {
                onSuccess(permit);
                result.complete(value);
            } else {
                Throwable cause = unwrap(throwable);
                onError(permit, cause);
                result.completeExceptionally(cause);
            }
        });
        return result;
    }

    @Override
    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerStats getStats() {
        lock.lock();
        try {
            return snapshot(clock.instant());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        List<Consumer<CircuitBreakerListener>> events = new ArrayList<>();
        lock.lock();
        try {
            CircuitBreakerState from = state;
            state = CircuitBreakerState.CLOSED;
            failures = 0;
            successes = 0;
            totalRequests = 0;
            lastFailureTime = null;
            lastSuccessTime = null;
            nextAttempt = null;
            activeProbe = null;
            log.info("Circuit breaker '{}' reset ({} → CLOSED)", name, from);
            if (from != CircuitBreakerState.CLOSED) {
                events.add(listener -> listener.onStateChange(name, from, CircuitBreakerState.CLOSED));
            }
        } finally {
            lock.unlock();
        }
        publish(events);
    }

    @Override
    public void forceState(CircuitBreakerState target) {
        if (target == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        List<Consumer<CircuitBreakerListener>> events = new ArrayList<>();
        lock.lock();
        try {
            CircuitBreakerState from = state;
            if (target == CircuitBreakerState.OPEN) {
                nextAttempt = nextAttemptFrom(clock.instant());
            }
            activeProbe = null;
            if (from != target) {
                state = target;
                log.info("Circuit breaker '{}' forced {} → {}", name, from, target);
                events.add(listener -> listener.onStateChange(name, from, target));
            }
        } finally {
            lock.unlock();
        }
        publish(events);
    }

    @Override
    public void addListener(CircuitBreakerListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    @Override
    public boolean removeListener(CircuitBreakerListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Admission decision.
     *
     * <p>Counts the request, expires the OPEN window if due, and reserves the
     * probe slot when HALF_OPEN. All of it happens under one lock acquisition.</p>
     *
     * @return permit to be handed back with the outcome
     * @throws CircuitBreakerOpenException if the call must not be attempted
     */
    private Permit acquirePermission() {
        List<Consumer<CircuitBreakerListener>> events = new ArrayList<>();
        lock.lock();
        try {
            totalRequests++;
            Instant now = clock.instant();

            if (state == CircuitBreakerState.OPEN) {
                if (nextAttempt != null && now.isBefore(nextAttempt)) {
                    throw reject(now, events);
                }
                transitionTo(CircuitBreakerState.HALF_OPEN, events);
            }

            if (state == CircuitBreakerState.HALF_OPEN) {
                if (activeProbe != null) {
                    throw reject(now, events);
                }
                activeProbe = new Permit(true);
                log.debug("Circuit breaker '{}' admitted recovery probe", name);
                return activeProbe;
            }

            return Permit.PASS;
        } finally {
            lock.unlock();
            publish(events);
        }
    }

    private CircuitBreakerOpenException reject(Instant now, List<Consumer<CircuitBreakerListener>> events) {
        CircuitBreakerStats stats = snapshot(now);
        log.debug("Circuit breaker '{}' rejected call in {} (nextAttempt: {})", name, state, nextAttempt);
        events.add(listener -> listener.onCallRejected(name, stats));
        return CircuitBreakerOpenException.of(stats);
    }

    private void onSuccess(Permit permit) {
        List<Consumer<CircuitBreakerListener>> events = new ArrayList<>();
        lock.lock();
        try {
            releaseProbe(permit);
            successes++;
            lastSuccessTime = clock.instant();
            events.add(listener -> listener.onSuccess(name));

            if (state == CircuitBreakerState.HALF_OPEN) {
                failures = 0;
                transitionTo(CircuitBreakerState.CLOSED, events);
            }
        } finally {
            lock.unlock();
        }
        publish(events);
    }

    private void onError(Permit permit, Throwable error) {
        // classifier is caller code, keep it out of the critical section
        boolean expected = isExpected(error);

        List<Consumer<CircuitBreakerListener>> events = new ArrayList<>();
        lock.lock();
        try {
            releaseProbe(permit);

            if (expected) {
                log.debug("Circuit breaker '{}' ignored expected error: {}", name, error.toString());
                events.add(listener -> listener.onIgnoredError(name, error));
                return;
            }

            Instant now = clock.instant();
            failures++;
            lastFailureTime = now;
            events.add(listener -> listener.onFailure(name, error));

            if (state == CircuitBreakerState.HALF_OPEN || failures >= config.failureThreshold()) {
                nextAttempt = nextAttemptFrom(now);
                transitionTo(CircuitBreakerState.OPEN, events);
            }
        } finally {
            lock.unlock();
            publish(events);
        }
    }

    /**
     * End of the OPEN window starting at {@code now}, saturated at {@link Instant#MAX}.
     */
    private Instant nextAttemptFrom(Instant now) {
        try {
            return now.plus(config.recoveryTimeout());
        } catch (ArithmeticException | DateTimeException e) {
            return Instant.MAX;
        }
    }

    private boolean isExpected(Throwable error) {
        try {
            return config.expectedErrors().test(error);
        } catch (RuntimeException e) {
            log.warn("Circuit breaker '{}' expectedErrors classifier failed, counting error as failure", name, e);
            return false;
        }
    }

    /**
     * Moves to {@code to} if different from the current state. Must hold the lock.
     */
    private void transitionTo(CircuitBreakerState to, List<Consumer<CircuitBreakerListener>> events) {
        CircuitBreakerState from = state;
        if (from == to) {
            return;
        }
        state = StateTransition.transition(from, to);
        if (to != CircuitBreakerState.HALF_OPEN) {
            activeProbe = null;
        }

        if (to == CircuitBreakerState.OPEN) {
            log.warn("Circuit breaker '{}' {} → {} (failures: {}, threshold: {}, recoveryTimeout: {})",
                name, from, to, failures, config.failureThreshold(), config.recoveryTimeout());
        } else {
            log.info("Circuit breaker '{}' {} → {}", name, from, to);
        }
        events.add(listener -> listener.onStateChange(name, from, to));
    }

    private void releaseProbe(Permit permit) {
        if (permit.probe && activeProbe == permit) {
            activeProbe = null;
        }
    }

    private CircuitBreakerStats snapshot(Instant now) {
        Duration uptime = Duration.ZERO;
        if (lastSuccessTime != null && now.isAfter(lastSuccessTime)) {
            uptime = Duration.between(lastSuccessTime, now);
        }
        return new CircuitBreakerStats(
            name,
            state,
            failures,
            successes,
            totalRequests,
            lastFailureTime,
            lastSuccessTime,
            state == CircuitBreakerState.OPEN ? nextAttempt : null,
            uptime
        );
    }

    private void publish(List<Consumer<CircuitBreakerListener>> events) {
        if (events.isEmpty() || listeners.isEmpty()) {
            return;
        }
        for (Consumer<CircuitBreakerListener> event : events) {
            for (CircuitBreakerListener listener : listeners) {
                try {
                    event.accept(listener);
                } catch (RuntimeException e) {
                    log.warn("Circuit breaker '{}' listener {} failed", name, listener, e);
                }
            }
        }
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Admission ticket returned to the outcome recorders. Identity matters for the probe slot.
     */
    private static final class Permit {

        static final Permit PASS = new Permit(false);

        final boolean probe;

        Permit(boolean probe) {
            this.probe = probe;
        }
    }

    @Override
    public String toString() {
        return "InMemoryCircuitBreaker{" + name + ", " + getState() + '}';
    }
}
