package com.ryuqq.circuitbreaker.core.function;

/**
 * 예외를 던질 수 있는 단일 인자 함수.
 *
 * @param <A> 인자 타입
 * @param <R> 결과 타입
 * @param <E> 함수가 던질 수 있는 checked 예외 타입
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ThrowingFunction<A, R, E extends Exception> {

    R apply(A argument) throws E;
}
