package com.ryuqq.circuitbreaker.core.config;

import com.ryuqq.circuitbreaker.core.error.ErrorCodeException;
import com.ryuqq.circuitbreaker.core.error.ExpectedErrors;
import com.ryuqq.circuitbreaker.core.error.HttpStatusException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CircuitBreakerPresets 테스트")
class CircuitBreakerPresetsTest {

    @Test
    @DisplayName("API 프리셋: 5회 / 30초 / 5분, 4xx 는 예상된 오류")
    void api_프리셋() {
        CircuitBreakerConfig config = CircuitBreakerPresets.api();

        assertThat(config.failureThreshold()).isEqualTo(5);
        assertThat(config.recoveryTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.monitoringPeriod()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.expectedErrors().test(new HttpStatusException(400, "bad request"))).isTrue();
        assertThat(config.expectedErrors().test(new HttpStatusException(499, "client closed"))).isTrue();
        assertThat(config.expectedErrors().test(new HttpStatusException(500, "server error"))).isFalse();
        assertThat(config.expectedErrors().test(new IOException("reset"))).isFalse();
    }

    @Test
    @DisplayName("Database 프리셋: 3회 / 60초 / 10분, VALIDATION_ERROR 는 예상된 오류")
    void database_프리셋() {
        CircuitBreakerConfig config = CircuitBreakerPresets.database();

        assertThat(config.failureThreshold()).isEqualTo(3);
        assertThat(config.recoveryTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.monitoringPeriod()).isEqualTo(Duration.ofMinutes(10));
        assertThat(config.expectedErrors().test(
            new ErrorCodeException(ExpectedErrors.VALIDATION_ERROR, "duplicate key"))).isTrue();
        assertThat(config.expectedErrors().test(
            new ErrorCodeException("CONNECTION_ERROR", "refused"))).isFalse();
    }

    @Test
    @DisplayName("External service 프리셋: 10회 / 120초 / 15분, 429 만 예상된 오류")
    void externalService_프리셋() {
        CircuitBreakerConfig config = CircuitBreakerPresets.externalService();

        assertThat(config.failureThreshold()).isEqualTo(10);
        assertThat(config.recoveryTimeout()).isEqualTo(Duration.ofSeconds(120));
        assertThat(config.monitoringPeriod()).isEqualTo(Duration.ofMinutes(15));
        assertThat(config.expectedErrors().test(new HttpStatusException(429, "slow down"))).isTrue();
        assertThat(config.expectedErrors().test(new HttpStatusException(404, "not found"))).isFalse();
    }

    @Test
    @DisplayName("customizer 로 지정한 값이 프리셋보다 우선한다")
    void customizer_우선() {
        CircuitBreakerConfig config = CircuitBreakerPresets.api(c -> c.withFailureThreshold(2));

        assertThat(config.failureThreshold()).isEqualTo(2);
        assertThat(config.recoveryTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.expectedErrors().test(new HttpStatusException(404, "not found"))).isTrue();
    }

    @Test
    @DisplayName("customizer 로 expectedErrors 를 교체할 수 있다")
    void customizer_expectedErrors_교체() {
        CircuitBreakerConfig config = CircuitBreakerPresets.externalService(
            c -> c.withExpectedErrors(ExpectedErrors.none()));

        assertThat(config.expectedErrors().test(new HttpStatusException(429, "slow down"))).isFalse();
        assertThat(config.failureThreshold()).isEqualTo(10);
    }

    @Test
    @DisplayName("customizer 가 null 이거나 null 을 반환하면 IllegalArgumentException")
    void customizer_null_거부() {
        assertThatThrownBy(() -> CircuitBreakerPresets.database(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CircuitBreakerPresets.database(c -> null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("null");
    }
}
