package com.ryuqq.circuitbreaker.core.statemachine;

import com.ryuqq.circuitbreaker.core.protection.CircuitBreakerState;

/**
 * Circuit Breaker 자동 상태 전이 검증.
 *
 * <p>execute 경로에서 일어나는 전이가 허용된 규칙을 따르는지 검증합니다.
 * {@code reset()}과 {@code forceState()}는 이 검증을 거치지 않습니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN (trip)</li>
 *   <li>OPEN → HALF_OPEN (recoveryTimeout 경과 후 첫 호출)</li>
 *   <li>HALF_OPEN → CLOSED (Probe 성공)</li>
 *   <li>HALF_OPEN → OPEN (Probe 실패)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>CLOSED에서 HALF_OPEN으로 바로 갈 수 없음</li>
 *   <li>OPEN에서 CLOSED로 바로 갈 수 없음 (반드시 Probe를 거침)</li>
 *   <li>같은 상태로의 전이는 전이가 아님 (호출자가 걸러야 함)</li>
 * </ul>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 확인.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용된 전이이면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(CircuitBreakerState from, CircuitBreakerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        return switch (from) {
            case CLOSED -> to == CircuitBreakerState.OPEN;
            case OPEN -> to == CircuitBreakerState.HALF_OPEN;
            case HALF_OPEN -> to == CircuitBreakerState.CLOSED || to == CircuitBreakerState.OPEN;
        };
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(CircuitBreakerState from, CircuitBreakerState to) {
        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid circuit breaker transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static CircuitBreakerState transition(CircuitBreakerState current, CircuitBreakerState next) {
        validate(current, next);
        return next;
    }
}
