package com.ryuqq.circuitbreaker.core.protection.noop;

import com.ryuqq.circuitbreaker.core.function.ThrowingSupplier;
import com.ryuqq.circuitbreaker.core.model.CircuitBreakerStats;
import com.ryuqq.circuitbreaker.core.protection.CircuitBreaker;
import com.ryuqq.circuitbreaker.core.protection.CircuitBreakerListener;
import com.ryuqq.circuitbreaker.core.protection.CircuitBreakerState;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 실행하며, 상태 추적을 하지 않습니다.
 * 보호 없이 실행하고자 하는 환경(로컬 개발, 배치 재처리 등)에서 실제 구현 대신 주입합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>execute(): 작업을 그대로 실행하고 결과/예외를 그대로 전달</li>
 *   <li>executeAsync(): supplier가 반환한 stage를 그대로 전달 (timeout만 적용)</li>
 *   <li>getState(): 항상 CLOSED 반환</li>
 *   <li>getStats(): 항상 빈 통계 반환</li>
 *   <li>reset(), forceState(), 리스너: 아무 동작 안 함</li>
 * </ul>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private final String name;

    public NoOpCircuitBreaker() {
        this("noop");
    }

    /**
     * 생성자.
     *
     * @param name 이름
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     */
    public NoOpCircuitBreaker(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public <T, E extends Exception> T execute(ThrowingSupplier<T, E> operation) throws E {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        return operation.get();
    }

    @Override
    public <T> CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        try {
            return operation.get().toCompletableFuture();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public <T> CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> operation, Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        // bound a copy so the caller's future is never completed here
        return executeAsync(operation).copy().orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public CircuitBreakerStats getStats() {
        return CircuitBreakerStats.empty(name);
    }

    @Override
    public void reset() {
        // NoOp
    }

    @Override
    public void forceState(CircuitBreakerState state) {
        // NoOp
    }

    @Override
    public void addListener(CircuitBreakerListener listener) {
        // NoOp
    }

    @Override
    public boolean removeListener(CircuitBreakerListener listener) {
        return false;
    }
}
