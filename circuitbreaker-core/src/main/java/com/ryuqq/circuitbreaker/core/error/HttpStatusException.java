package com.ryuqq.circuitbreaker.core.error;

/**
 * HTTP 상태 코드를 가진 범용 예외.
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public class HttpStatusException extends RuntimeException implements HttpStatusCarrier {

    private final int statusCode;

    /**
     * 생성자.
     *
     * @param statusCode HTTP 상태 코드 (100~599)
     * @param message 오류 메시지
     * @throws IllegalArgumentException statusCode가 범위를 벗어난 경우
     */
    public HttpStatusException(int statusCode, String message) {
        this(statusCode, message, null);
    }

    /**
     * 생성자 (cause 포함).
     *
     * @param statusCode HTTP 상태 코드 (100~599)
     * @param message 오류 메시지
     * @param cause 원인 (null 허용)
     * @throws IllegalArgumentException statusCode가 범위를 벗어난 경우
     */
    public HttpStatusException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        if (statusCode < 100 || statusCode > 599) {
            throw new IllegalArgumentException("statusCode must be between 100 and 599 (current: " + statusCode + ")");
        }
        this.statusCode = statusCode;
    }

    @Override
    public int getStatusCode() {
        return statusCode;
    }
}
