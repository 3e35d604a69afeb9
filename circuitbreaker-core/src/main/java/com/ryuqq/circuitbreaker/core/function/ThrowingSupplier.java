package com.ryuqq.circuitbreaker.core.function;

/**
 * 예외를 던질 수 있는 인자 없는 작업.
 *
 * <p>Circuit Breaker가 보호하는 동기 작업을 표현합니다.
 * 작업이 던진 예외는 Circuit Breaker를 거쳐 호출자에게 그대로 전달됩니다.</p>
 *
 * @param <T> 결과 타입
 * @param <E> 작업이 던질 수 있는 checked 예외 타입 (없으면 {@link RuntimeException}으로 추론)
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    /**
     * 작업 실행.
     *
     * @return 작업 결과
     * @throws E 작업 실패 시
     */
    T get() throws E;
}
