package com.ryuqq.circuitbreaker.core.exception;

import com.ryuqq.circuitbreaker.core.model.CircuitBreakerStats;

/**
 * Circuit Breaker가 호출을 시도하지 않고 거부했을 때 발생하는 예외.
 *
 * <p>작업은 실행되지 않았으며, 거부 시점의 통계 스냅샷을 함께 전달합니다.
 * 호출자는 자체 재시도/백오프 정책 또는 fallback으로 복구할 수 있습니다.</p>
 *
 * <p><strong>발생 조건:</strong></p>
 * <ul>
 *   <li>OPEN 상태이고 nextAttempt 이전인 경우</li>
 *   <li>HALF_OPEN 상태에서 이미 Probe가 실행 중인 경우</li>
 * </ul>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public class CircuitBreakerOpenException extends RuntimeException {

    private final transient CircuitBreakerStats stats;

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     * @param stats 거부 시점의 통계 스냅샷
     * @throws IllegalArgumentException stats가 null인 경우
     */
    public CircuitBreakerOpenException(String message, CircuitBreakerStats stats) {
        super(message);
        if (stats == null) {
            throw new IllegalArgumentException("stats cannot be null");
        }
        this.stats = stats;
    }

    /**
     * 통계 스냅샷으로부터 표준 메시지를 가진 예외 생성.
     *
     * @param stats 거부 시점의 통계 스냅샷
     * @return 예외 인스턴스
     */
    public static CircuitBreakerOpenException of(CircuitBreakerStats stats) {
        String suffix = switch (stats.state()) {
            case HALF_OPEN -> " (probe in flight)";
            case OPEN -> stats.nextAttemptTime() != null ? " until " + stats.nextAttemptTime() : "";
            case CLOSED -> "";
        };
        return new CircuitBreakerOpenException(
            "Circuit breaker '" + stats.name() + "' is " + stats.state() + suffix, stats);
    }

    /**
     * 거부 시점의 통계 스냅샷 조회.
     *
     * @return 통계 스냅샷
     */
    public CircuitBreakerStats getStats() {
        return stats;
    }
}
