/**
 * Circuit Breaker SPI (Service Provider Interface) 패키지.
 *
 * <p>의존성 호출을 감싸 연속 실패를 감지하고, 장애가 난 의존성에 대한 호출을
 * 즉시 거절한 뒤 복구 여부를 단일 probe 호출로 확인하는 보호 메커니즘의
 * 확장점을 정의합니다.</p>
 *
 * <h2>상태 모델</h2>
 * <pre>
 * CLOSED    ── failures ≥ failureThreshold ──→ OPEN
 * OPEN      ── now ≥ nextAttempt (다음 호출) ──→ HALF_OPEN
 * HALF_OPEN ── probe 성공 ──→ CLOSED (failures = 0)
 * HALF_OPEN ── probe 실패 ──→ OPEN (nextAttempt = now + recoveryTimeout)
 * </pre>
 *
 * <h3>설계 원칙</h3>
 * <ul>
 *   <li><strong>Lazy Recovery:</strong> 타이머 없음, 다음 호출이 만료를 감지</li>
 *   <li><strong>Single Probe:</strong> HALF_OPEN에서는 한 번에 하나의 호출만 진행</li>
 *   <li><strong>Transparent:</strong> 작업의 결과와 예외를 변형 없이 전달</li>
 *   <li><strong>Expected Errors:</strong> 의존성 장애가 아닌 오류는 상태에 영향 없음</li>
 * </ul>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>{@code noop} 하위 패키지는 항상 허용하고 상태를 추적하지 않는 기본 구현을 제공합니다.
 * 보호를 끈 환경에서 같은 호출 코드를 그대로 쓸 때 사용합니다.</p>
 *
 * <h2>사용 예시</h2>
 * <pre>{@code
 * CircuitBreakerRegistry registry = new InMemoryCircuitBreakerRegistry();
 * registry.register("payment-api", CircuitBreakers.forApi("payment-api"));
 *
 * Receipt receipt = registry.execute("payment-api", () -> paymentClient.charge(order));
 * }</pre>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 * @see com.ryuqq.circuitbreaker.core.protection.CircuitBreaker
 * @see com.ryuqq.circuitbreaker.core.protection.CircuitBreakerRegistry
 * @see com.ryuqq.circuitbreaker.core.protection.noop
 */
package com.ryuqq.circuitbreaker.core.protection;
