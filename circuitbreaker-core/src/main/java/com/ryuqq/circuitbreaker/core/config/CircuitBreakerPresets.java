package com.ryuqq.circuitbreaker.core.config;

import com.ryuqq.circuitbreaker.core.error.ExpectedErrors;

import java.time.Duration;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * 의존성 유형별 Circuit Breaker 기본 설정.
 *
 * <table>
 *   <caption>Preset 기본값</caption>
 *   <tr><th>Preset</th><th>failureThreshold</th><th>recoveryTimeout</th><th>monitoringPeriod</th><th>expected error</th></tr>
 *   <tr><td>api</td><td>5</td><td>30s</td><td>5min</td><td>HTTP 4xx</td></tr>
 *   <tr><td>database</td><td>3</td><td>60s</td><td>10min</td><td>VALIDATION_ERROR</td></tr>
 *   <tr><td>externalService</td><td>10</td><td>120s</td><td>15min</td><td>HTTP 429</td></tr>
 * </table>
 *
 * <p>각 메서드는 customizer를 받아 preset 위에 덮어쓸 수 있으며, customizer가 설정한 값이 우선합니다.</p>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public final class CircuitBreakerPresets {

    // Utility class - prevent instantiation
    private CircuitBreakerPresets() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 원격 API 호출용 설정.
     *
     * <p>4xx는 호출자 원인이므로 의존성은 정상으로 간주합니다.</p>
     *
     * @return API preset
     */
    public static CircuitBreakerConfig api() {
        return new CircuitBreakerConfig(
            5,
            Duration.ofSeconds(30),
            Duration.ofMinutes(5),
            ExpectedErrors.clientErrors(),
            List.of()
        );
    }

    public static CircuitBreakerConfig api(UnaryOperator<CircuitBreakerConfig> customizer) {
        return customize(api(), customizer);
    }

    /**
     * 데이터베이스 작업용 설정.
     *
     * <p>DB 장애는 더 긴급하게 취급하여 적은 실패로 차단하고, 검증 오류는 제외합니다.</p>
     *
     * @return Database preset
     */
    public static CircuitBreakerConfig database() {
        return new CircuitBreakerConfig(
            3,
            Duration.ofSeconds(60),
            Duration.ofMinutes(10),
            ExpectedErrors.errorCode(ExpectedErrors.VALIDATION_ERROR),
            List.of()
        );
    }

    public static CircuitBreakerConfig database(UnaryOperator<CircuitBreakerConfig> customizer) {
        return customize(database(), customizer);
    }

    /**
     * 외부(서드파티) 서비스용 설정.
     *
     * <p>일시적 불안정에 관대하며, 429 응답은 호출자 행동의 결과이므로 제외합니다.</p>
     *
     * @return External service preset
     */
    public static CircuitBreakerConfig externalService() {
        return new CircuitBreakerConfig(
            10,
            Duration.ofSeconds(120),
            Duration.ofMinutes(15),
            ExpectedErrors.httpStatus(ExpectedErrors.TOO_MANY_REQUESTS),
            List.of()
        );
    }

    public static CircuitBreakerConfig externalService(UnaryOperator<CircuitBreakerConfig> customizer) {
        return customize(externalService(), customizer);
    }

    private static CircuitBreakerConfig customize(CircuitBreakerConfig preset,
                                                  UnaryOperator<CircuitBreakerConfig> customizer) {
        if (customizer == null) {
            throw new IllegalArgumentException("customizer cannot be null");
        }
        CircuitBreakerConfig customized = customizer.apply(preset);
        if (customized == null) {
            throw new IllegalArgumentException("customizer must not return null");
        }
        return customized;
    }
}
