package com.ryuqq.circuitbreaker.core.protection;

import com.ryuqq.circuitbreaker.core.function.ThrowingSupplier;
import com.ryuqq.circuitbreaker.core.model.CircuitBreakerStats;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * 이름 기반 Circuit Breaker 레지스트리 SPI.
 *
 * <p>호출 코드가 Circuit Breaker 참조를 전달하지 않고 안정적인 문자열 키로
 * 의존성을 지칭할 수 있도록 합니다. 전역 싱글톤이 아니며, 명시적으로 생성하여
 * 필요한 컴포넌트에 주입합니다.</p>
 *
 * <p><strong>오류 구분:</strong></p>
 * <ul>
 *   <li>등록되지 않은 이름: {@code CircuitBreakerNotFoundException} (설정 오류)</li>
 *   <li>차단된 의존성: {@code CircuitBreakerOpenException} (런타임 장애)</li>
 * </ul>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public interface CircuitBreakerRegistry {

    /**
     * Circuit Breaker 등록 (같은 이름이 있으면 교체).
     *
     * @param name 이름
     * @param breaker Circuit Breaker
     * @return 교체된 이전 Circuit Breaker, 없으면 null
     * @throws IllegalArgumentException name이 비어 있거나 breaker가 null인 경우
     */
    CircuitBreaker register(String name, CircuitBreaker breaker);

    /**
     * Circuit Breaker 등록 해제.
     *
     * @param name 이름
     * @return 해제된 Circuit Breaker
     */
    Optional<CircuitBreaker> unregister(String name);

    /**
     * 이름으로 조회 (기본 인스턴스를 만들지 않음).
     *
     * @param name 이름
     * @return 등록된 Circuit Breaker
     */
    Optional<CircuitBreaker> get(String name);

    /**
     * 등록된 이름 목록 (정렬됨).
     *
     * @return 이름 집합
     */
    Set<String> getNames();

    /**
     * 이름으로 찾은 Circuit Breaker로 동기 작업 실행.
     *
     * @throws com.ryuqq.circuitbreaker.core.exception.CircuitBreakerNotFoundException 등록되지 않은 이름인 경우
     * @throws E 작업이 던진 예외
     */
    <T, E extends Exception> T execute(String name, ThrowingSupplier<T, E> operation) throws E;

    /**
     * 이름으로 찾은 Circuit Breaker로 비동기 작업 실행.
     *
     * <p>등록되지 않은 이름이면 {@code CircuitBreakerNotFoundException}으로 완료된 future를 반환합니다.</p>
     */
    <T> CompletableFuture<T> executeAsync(String name, Supplier<? extends CompletionStage<T>> operation);

    /**
     * 전체 통계 조회.
     *
     * @return 이름 → 통계 (이름순)
     */
    Map<String, CircuitBreakerStats> getAllStats();

    /**
     * 전체 건강 상태 조회.
     *
     * @return 이름 → CLOSED 여부 (이름순)
     */
    Map<String, Boolean> getHealthStatus();

    /**
     * 모든 Circuit Breaker가 CLOSED인지 확인.
     *
     * @return 전부 CLOSED이면 true (등록된 것이 없어도 true)
     */
    default boolean isAllHealthy() {
        return getHealthStatus().values().stream().allMatch(Boolean::booleanValue);
    }

    /**
     * 모든 Circuit Breaker 리셋.
     */
    void resetAll();
}
