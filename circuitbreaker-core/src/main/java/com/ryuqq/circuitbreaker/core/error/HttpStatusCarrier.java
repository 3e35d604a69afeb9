package com.ryuqq.circuitbreaker.core.error;

/**
 * HTTP 응답 상태 코드를 노출하는 예외.
 *
 * <p>HTTP 클라이언트 예외가 이 인터페이스를 구현하면
 * {@link ExpectedErrors#clientErrors()}, {@link ExpectedErrors#httpStatus(int)}로 분류할 수 있습니다.</p>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public interface HttpStatusCarrier {

    /**
     * HTTP 응답 상태 코드.
     *
     * @return 상태 코드 (예: 404, 429, 503)
     */
    int getStatusCode();
}
