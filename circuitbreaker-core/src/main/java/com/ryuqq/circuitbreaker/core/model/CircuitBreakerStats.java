package com.ryuqq.circuitbreaker.core.model;

import com.ryuqq.circuitbreaker.core.protection.CircuitBreakerState;

import java.time.Duration;
import java.time.Instant;

/**
 * Circuit Breaker 통계 스냅샷 (불변).
 *
 * <p>{@code getStats()} 호출 시점의 상태와 카운터를 복사한 값입니다.
 * 이후 Circuit Breaker 상태가 바뀌어도 스냅샷은 변하지 않습니다.</p>
 *
 * <p>모든 카운터는 생성 또는 마지막 reset() 이후 누적값입니다.</p>
 *
 * @param name Circuit Breaker 이름
 * @param state 스냅샷 시점의 상태
 * @param failures 임계값 판정에 사용되는 실패 횟수 (expected error 제외)
 * @param successes 성공 횟수
 * @param totalRequests 전체 요청 수 (거부된 요청, expected error 포함)
 * @param lastFailureTime 마지막 실패 시각 (없으면 null)
 * @param lastSuccessTime 마지막 성공 시각 (없으면 null)
 * @param nextAttemptTime OPEN 상태에서 다음 Probe 허용 시각 (OPEN이 아니면 null)
 * @param uptime 마지막 성공 이후 경과 시간 (성공 이력이 없으면 {@link Duration#ZERO})
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public record CircuitBreakerStats(
    String name,
    CircuitBreakerState state,
    long failures,
    long successes,
    long totalRequests,
    Instant lastFailureTime,
    Instant lastSuccessTime,
    Instant nextAttemptTime,
    Duration uptime
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name, state, uptime이 null이거나 카운터가 음수인 경우
     */
    public CircuitBreakerStats {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (failures < 0 || successes < 0 || totalRequests < 0) {
            throw new IllegalArgumentException(
                String.format("counters cannot be negative (failures: %d, successes: %d, totalRequests: %d)",
                    failures, successes, totalRequests));
        }
        if (uptime == null) {
            throw new IllegalArgumentException("uptime cannot be null");
        }
        // lastFailureTime, lastSuccessTime, nextAttemptTime은 null 허용
    }

    /**
     * 요청 이력이 없는 CLOSED 상태 스냅샷 생성.
     *
     * @param name Circuit Breaker 이름
     * @return 빈 통계
     */
    public static CircuitBreakerStats empty(String name) {
        return new CircuitBreakerStats(name, CircuitBreakerState.CLOSED, 0, 0, 0, null, null, null, Duration.ZERO);
    }

    /**
     * 실패율(%) 계산.
     *
     * @return failures / totalRequests * 100, 요청이 없으면 0
     */
    public double failureRate() {
        if (totalRequests == 0) {
            return 0.0;
        }
        return (failures * 100.0) / totalRequests;
    }
}
