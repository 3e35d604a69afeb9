package com.ryuqq.circuitbreaker.core.exception;

/**
 * Registry에 등록되지 않은 이름으로 Circuit Breaker를 조회했을 때 발생하는 예외.
 *
 * <p>의존성 장애가 아니라 설정/프로그래밍 오류입니다.
 * {@link CircuitBreakerOpenException}과 계층이 분리되어 있어
 * "설정되지 않은 의존성"과 "차단된 의존성"을 구분할 수 있습니다.</p>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public class CircuitBreakerNotFoundException extends RuntimeException {

    private final String breakerName;

    /**
     * 생성자.
     *
     * @param breakerName 조회한 이름
     */
    public CircuitBreakerNotFoundException(String breakerName) {
        super("Circuit breaker '" + breakerName + "' not found");
        this.breakerName = breakerName;
    }

    public String getBreakerName() {
        return breakerName;
    }
}
