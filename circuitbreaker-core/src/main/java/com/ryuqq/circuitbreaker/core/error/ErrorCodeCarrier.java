package com.ryuqq.circuitbreaker.core.error;

/**
 * 도메인 오류 코드를 노출하는 예외.
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public interface ErrorCodeCarrier {

    /**
     * 오류 코드.
     *
     * @return 오류 코드 (예: VALIDATION_ERROR)
     */
    String getErrorCode();
}
