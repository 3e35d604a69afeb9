package com.ryuqq.circuitbreaker.core.protection;

import com.ryuqq.circuitbreaker.core.model.CircuitBreakerStats;

/**
 * Circuit Breaker 이벤트 관찰자.
 *
 * <p>메트릭, 로깅, 알림 등 여러 소비자가 Circuit Breaker 구현을 알지 못해도
 * 독립적으로 이벤트를 구독할 수 있도록 합니다. 모든 메서드는 기본 구현이 비어 있으므로
 * 필요한 이벤트만 오버라이드하면 됩니다.</p>
 *
 * <p><strong>호출 규칙:</strong></p>
 * <ul>
 *   <li>이벤트는 Circuit Breaker 내부 락이 해제된 뒤 호출 스레드에서 전달됩니다.</li>
 *   <li>리스너가 던진 예외는 WARN 로그로 남고, 호출 결과나 다른 리스너에 영향을 주지 않습니다.</li>
 *   <li>{@link #onStateChange}는 실제로 상태가 바뀐 경우에만 호출됩니다.</li>
 * </ul>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public interface CircuitBreakerListener {

    /**
     * 상태 전이 발생.
     *
     * @param breakerName Circuit Breaker 이름
     * @param from 이전 상태
     * @param to 새 상태
     */
    default void onStateChange(String breakerName, CircuitBreakerState from, CircuitBreakerState to) {
    }

    /**
     * 작업 성공 기록.
     *
     * @param breakerName Circuit Breaker 이름
     */
    default void onSuccess(String breakerName) {
    }

    /**
     * 임계값에 반영되는 실패 기록.
     *
     * @param breakerName Circuit Breaker 이름
     * @param error 작업이 던진 오류
     */
    default void onFailure(String breakerName, Throwable error) {
    }

    /**
     * Expected error로 분류되어 실패 카운트에서 제외된 오류.
     *
     * @param breakerName Circuit Breaker 이름
     * @param error 작업이 던진 오류
     */
    default void onIgnoredError(String breakerName, Throwable error) {
    }

    /**
     * 작업을 실행하지 않고 거부함.
     *
     * @param breakerName Circuit Breaker 이름
     * @param stats 거부 시점의 통계
     */
    default void onCallRejected(String breakerName, CircuitBreakerStats stats) {
    }
}
