package com.ryuqq.circuitbreaker.core.error;

/**
 * 도메인 오류 코드를 가진 범용 예외.
 *
 * <p>예: DB 계층에서 제약 조건 위반을 {@code VALIDATION_ERROR} 코드로 던지는 경우.</p>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public class ErrorCodeException extends RuntimeException implements ErrorCodeCarrier {

    private final String errorCode;

    public ErrorCodeException(String errorCode, String message) {
        this(errorCode, message, null);
    }

    /**
     * 생성자 (cause 포함).
     *
     * @param errorCode 오류 코드
     * @param message 오류 메시지
     * @param cause 원인 (null 허용)
     * @throws IllegalArgumentException errorCode가 null이거나 빈 문자열인 경우
     */
    public ErrorCodeException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        this.errorCode = errorCode;
    }

    @Override
    public String getErrorCode() {
        return errorCode;
    }
}
