package com.ryuqq.circuitbreaker.core.protection;

import com.ryuqq.circuitbreaker.core.function.ThrowingSupplier;
import com.ryuqq.circuitbreaker.core.model.CircuitBreakerStats;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Circuit Breaker SPI.
 *
 * <p>하나의 다운스트림 의존성 호출을 감싸고, 실패 가능성이 높은 호출의 반복 실행을 막으며
 * 복구 시점에는 단 하나의 Probe 호출로 회복 여부를 확인합니다.</p>
 *
 * <p><strong>execute 계약:</strong></p>
 * <ol>
 *   <li>totalRequests를 가장 먼저 증가</li>
 *   <li>OPEN이고 now &lt; nextAttempt: 작업을 실행하지 않고 {@code CircuitBreakerOpenException}</li>
 *   <li>OPEN이고 now &gt;= nextAttempt: HALF_OPEN으로 전이 후 이 호출을 Probe로 실행</li>
 *   <li>HALF_OPEN이고 Probe 실행 중: {@code CircuitBreakerOpenException}</li>
 *   <li>성공: 결과를 그대로 반환 / 실패: 원래 예외를 그대로 다시 던짐</li>
 * </ol>
 *
 * <p>Circuit Breaker는 재시도하지 않습니다. 재시도 여부와 방식은 호출자가 결정합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = CircuitBreakers.forApi("payment-api");
 *
 * try {
 *     Receipt receipt = cb.execute(() -> paymentClient.charge(request));
 * } catch (CircuitBreakerOpenException e) {
 *     // 호출하지 않고 거부됨: fallback
 *     return Receipt.pending(e.getStats().nextAttemptTime());
 * }
 * }</pre>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * Circuit Breaker 이름 (로그, 이벤트, 예외 메시지용).
     *
     * @return 이름
     */
    String getName();

    /**
     * 동기 작업을 Circuit Breaker 보호 하에 실행.
     *
     * @param operation 보호할 작업
     * @param <T> 결과 타입
     * @param <E> 작업이 던질 수 있는 checked 예외 타입
     * @return 작업 결과 (변경 없이 그대로)
     * @throws E 작업이 던진 예외 (변경 없이 그대로)
     * @throws com.ryuqq.circuitbreaker.core.exception.CircuitBreakerOpenException 호출이 거부된 경우
     * @throws IllegalArgumentException operation이 null인 경우
     */
    <T, E extends Exception> T execute(ThrowingSupplier<T, E> operation) throws E;

    /**
     * 비동기 작업을 Circuit Breaker 보호 하에 실행.
     *
     * <p>거부 시 supplier를 호출하지 않고 {@code CircuitBreakerOpenException}으로 완료된 future를 반환합니다.
     * 작업 실패 시 반환된 future는 원래 예외로 완료됩니다 ({@code CompletionException} 래핑 제거).
     * 취소({@code CancellationException})도 실패로 기록됩니다.</p>
     *
     * @param operation 보호할 비동기 작업
     * @param <T> 결과 타입
     * @return 작업 결과를 담은 future
     * @throws IllegalArgumentException operation이 null인 경우
     */
    <T> CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> operation);

    /**
     * 비동기 작업을 제한 시간과 함께 실행.
     *
     * <p>timeout 내에 완료되지 않으면 {@code TimeoutException}으로 실패하며, 이 역시 실패로 기록됩니다.</p>
     *
     * @param operation 보호할 비동기 작업
     * @param timeout 제한 시간 (양수)
     * @param <T> 결과 타입
     * @return 작업 결과를 담은 future
     * @throws IllegalArgumentException operation이 null이거나 timeout이 양수가 아닌 경우
     */
    <T> CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> operation, Duration timeout);

    /**
     * 현재 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 통계 스냅샷 조회.
     *
     * @return 불변 스냅샷
     */
    CircuitBreakerStats getStats();

    /**
     * 정상 상태 여부.
     *
     * @return CLOSED이면 true
     */
    default boolean isHealthy() {
        return getState().isPassThrough();
    }

    /**
     * 실패율(%) 조회.
     *
     * @return failures / totalRequests * 100, 요청이 없으면 0
     */
    default double getFailureRate() {
        return getStats().failureRate();
    }

    /**
     * 초기 상태(CLOSED, 모든 카운터 0)로 리셋.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다.</p>
     */
    void reset();

    /**
     * 특정 상태로 강제 전이 (테스트 하네스용).
     *
     * <p>OPEN으로 강제하면 nextAttempt = now + recoveryTimeout으로 설정됩니다.
     * 카운터는 변경하지 않습니다.</p>
     *
     * @param state 목표 상태
     * @throws IllegalArgumentException state가 null인 경우
     */
    void forceState(CircuitBreakerState state);

    /**
     * 이벤트 리스너 등록.
     *
     * @param listener 리스너
     * @throws IllegalArgumentException listener가 null인 경우
     */
    void addListener(CircuitBreakerListener listener);

    /**
     * 이벤트 리스너 해제.
     *
     * @param listener 리스너
     * @return 등록되어 있었다면 true
     */
    boolean removeListener(CircuitBreakerListener listener);
}
