package com.ryuqq.circuitbreaker.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p>Circuit Breaker는 하나의 다운스트림 의존성(HTTP API, DB, 외부 서비스)의 건강 상태를 추적하고,
 * 실패 임계값 도달 시 호출을 차단하여 장애 전파를 방지합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (failures &gt;= failureThreshold)
 * OPEN (차단)
 *   │
 *   ▼ (now &gt;= nextAttempt, 다음 호출 시점에 지연 판정)
 * HALF_OPEN (반개방, 단일 Probe)
 *   │
 *   ├─► Probe 성공 → CLOSED (failures = 0)
 *   └─► Probe 실패 → OPEN (nextAttempt = now + recoveryTimeout)
 * </pre>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>모든 요청이 그대로 실행되며, 실패 횟수를 누적합니다.
     * 실패 횟수가 임계값에 도달하면 OPEN 상태로 전이합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>nextAttempt 이전의 모든 요청을 실행하지 않고 즉시 거부합니다.
     * nextAttempt 이후 첫 요청에서 HALF_OPEN 상태로 전이합니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태 (단 하나의 Probe 요청만 통과).
     *
     * <p>Probe 결과가 나올 때까지 다른 요청은 거부됩니다.
     * Probe가 성공하면 CLOSED, 실패하면 다시 OPEN으로 전이합니다.</p>
     */
    HALF_OPEN;

    /**
     * 요청이 조건 없이 통과되는 상태인지 확인.
     *
     * @return CLOSED이면 true
     */
    public boolean isPassThrough() {
        return this == CLOSED;
    }
}
