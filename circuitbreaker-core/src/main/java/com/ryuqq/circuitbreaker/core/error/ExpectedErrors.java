package com.ryuqq.circuitbreaker.core.error;

import java.util.HashSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Expected error 분류기 모음.
 *
 * <p>Expected error는 의존성의 장애가 아니라 호출자 측 원인(4xx, 검증 실패, rate limit)으로 발생한 오류입니다.
 * Circuit Breaker는 이 오류를 실패 카운트에 반영하지 않지만, 호출자에게는 그대로 다시 던집니다.</p>
 *
 * <p>모든 분류기는 예외 자신과 cause 체인을 순서대로 검사합니다.
 * {@code CompletionException}처럼 감싸진 예외도 분류됩니다.</p>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public final class ExpectedErrors {

    /** 검증 오류 코드 (Database preset). */
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";

    /** Too Many Requests. */
    public static final int TOO_MANY_REQUESTS = 429;

    // Utility class - prevent instantiation
    private ExpectedErrors() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 어떤 오류도 expected로 분류하지 않음 (기본값).
     *
     * @return 항상 false를 반환하는 분류기
     */
    public static Predicate<Throwable> none() {
        return error -> false;
    }

    /**
     * HTTP 4xx (클라이언트 오류)를 expected로 분류.
     *
     * @return 400 이상 500 미만 상태 코드를 가진 오류에 true
     */
    public static Predicate<Throwable> clientErrors() {
        return httpStatusBetween(400, 500);
    }

    /**
     * 특정 HTTP 상태 코드를 expected로 분류.
     *
     * @param statusCode HTTP 상태 코드
     * @return 해당 상태 코드를 가진 오류에 true
     */
    public static Predicate<Throwable> httpStatus(int statusCode) {
        return httpStatusBetween(statusCode, statusCode + 1);
    }

    /**
     * HTTP 상태 코드 범위 [fromInclusive, toExclusive)를 expected로 분류.
     *
     * @param fromInclusive 시작 (포함)
     * @param toExclusive 끝 (미포함)
     * @return 범위 안의 상태 코드를 가진 오류에 true
     * @throws IllegalArgumentException 범위가 비어 있는 경우
     */
    public static Predicate<Throwable> httpStatusBetween(int fromInclusive, int toExclusive) {
        if (fromInclusive >= toExclusive) {
            throw new IllegalArgumentException(
                String.format("empty status range [%d, %d)", fromInclusive, toExclusive));
        }
        return error -> {
            HttpStatusCarrier carrier = findInCauseChain(error, HttpStatusCarrier.class);
            if (carrier == null) {
                return false;
            }
            int status = carrier.getStatusCode();
            return status >= fromInclusive && status < toExclusive;
        };
    }

    /**
     * 특정 오류 코드를 expected로 분류.
     *
     * @param errorCode 오류 코드
     * @return 해당 오류 코드를 가진 오류에 true
     * @throws IllegalArgumentException errorCode가 null이거나 빈 문자열인 경우
     */
    public static Predicate<Throwable> errorCode(String errorCode) {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        return error -> {
            ErrorCodeCarrier carrier = findInCauseChain(error, ErrorCodeCarrier.class);
            return carrier != null && errorCode.equals(carrier.getErrorCode());
        };
    }

    /**
     * 특정 예외 타입(하위 타입 포함)을 expected로 분류.
     *
     * @param type 예외 타입
     * @return 해당 타입의 오류에 true
     */
    public static Predicate<Throwable> instanceOf(Class<? extends Throwable> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return error -> findInCauseChain(error, type) != null;
    }

    /**
     * cause 체인에서 주어진 타입의 첫 번째 예외 탐색.
     *
     * <p>순환 cause 체인에서도 종료됩니다.</p>
     *
     * @param error 시작 예외 (null 허용)
     * @param type 찾을 타입
     * @return 찾은 예외, 없으면 null
     */
    static <T> T findInCauseChain(Throwable error, Class<T> type) {
        Set<Throwable> visited = new HashSet<>();
        Throwable current = error;
        while (current != null && visited.add(current)) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = current.getCause();
        }
        return null;
    }
}
