package com.ryuqq.circuitbreaker.core.config;

import com.ryuqq.circuitbreaker.core.error.ExpectedErrors;
import com.ryuqq.circuitbreaker.core.protection.CircuitBreakerListener;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>failureThreshold: CLOSED → OPEN 전이 실패 횟수 (기본 5)</li>
 *   <li>recoveryTimeout: OPEN 유지 시간, 이후 첫 호출이 Probe (기본 60초)</li>
 *   <li>monitoringPeriod: 관측 구간 (기본 5분, 현재 버전에서는 카운터 감쇠에 사용하지 않음)</li>
 *   <li>expectedErrors: 실패로 세지 않을 오류 분류기 (기본 없음)</li>
 *   <li>listeners: 생성 시 등록할 이벤트 리스너 (기본 없음)</li>
 * </ul>
 *
 * <p>카운터는 생성 또는 reset() 이후 누적됩니다. monitoringPeriod는 향후 sliding window 정책을 위해
 * 예약된 값이며 {@code getStats()} 결과에 영향을 주지 않습니다.</p>
 *
 * <p><strong>부분 오버라이드:</strong></p>
 * <pre>{@code
 * CircuitBreakerConfig config = CircuitBreakerPresets.api()
 *     .withFailureThreshold(2)
 *     .withRecoveryTimeout(Duration.ofSeconds(5));
 * }</pre>
 *
 * @param failureThreshold 실패 임계값 (1 이상)
 * @param recoveryTimeout OPEN 유지 시간 (양수)
 * @param monitoringPeriod 관측 구간 (양수)
 * @param expectedErrors expected error 분류기
 * @param listeners 이벤트 리스너 목록
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    Duration recoveryTimeout,
    Duration monitoringPeriod,
    Predicate<Throwable> expectedErrors,
    List<CircuitBreakerListener> listeners
) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;
    public static final Duration DEFAULT_RECOVERY_TIMEOUT = Duration.ofMinutes(1);
    public static final Duration DEFAULT_MONITORING_PERIOD = Duration.ofMinutes(5);

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: failureThreshold=5, recoveryTimeout=60s, monitoringPeriod=5min,
     * expectedErrors=none, listeners=[]</p>
     */
    public CircuitBreakerConfig() {
        this(DEFAULT_FAILURE_THRESHOLD, DEFAULT_RECOVERY_TIMEOUT, DEFAULT_MONITORING_PERIOD,
            ExpectedErrors.none(), List.of());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative() || recoveryTimeout.isZero()) {
            throw new IllegalArgumentException(
                "recoveryTimeout must be positive (current: " + recoveryTimeout + ")"
            );
        }
        if (monitoringPeriod == null || monitoringPeriod.isNegative() || monitoringPeriod.isZero()) {
            throw new IllegalArgumentException(
                "monitoringPeriod must be positive (current: " + monitoringPeriod + ")"
            );
        }
        if (expectedErrors == null) {
            throw new IllegalArgumentException("expectedErrors cannot be null");
        }
        if (listeners == null) {
            throw new IllegalArgumentException("listeners cannot be null");
        }
        listeners = List.copyOf(listeners);
    }

    /**
     * failureThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, monitoringPeriod, expectedErrors, listeners);
    }

    /**
     * recoveryTimeout만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withRecoveryTimeout(Duration recoveryTimeout) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, monitoringPeriod, expectedErrors, listeners);
    }

    /**
     * monitoringPeriod만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withMonitoringPeriod(Duration monitoringPeriod) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, monitoringPeriod, expectedErrors, listeners);
    }

    /**
     * expectedErrors만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withExpectedErrors(Predicate<Throwable> expectedErrors) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, monitoringPeriod, expectedErrors, listeners);
    }

    /**
     * listeners를 교체한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withListeners(List<CircuitBreakerListener> listeners) {
        return new CircuitBreakerConfig(failureThreshold, recoveryTimeout, monitoringPeriod, expectedErrors, listeners);
    }

    /**
     * 기존 listeners 뒤에 하나를 추가한 새 인스턴스 생성.
     *
     * @param listener 추가할 리스너
     * @return 새 설정
     * @throws IllegalArgumentException listener가 null인 경우
     */
    public CircuitBreakerConfig withListener(CircuitBreakerListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        List<CircuitBreakerListener> appended = new ArrayList<>(listeners);
        appended.add(listener);
        return withListeners(appended);
    }
}
