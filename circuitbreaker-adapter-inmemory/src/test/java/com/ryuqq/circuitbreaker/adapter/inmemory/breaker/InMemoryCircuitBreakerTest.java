package com.ryuqq.circuitbreaker.adapter.inmemory.breaker;

import com.ryuqq.circuitbreaker.core.config.CircuitBreakerConfig;
import com.ryuqq.circuitbreaker.core.exception.CircuitBreakerOpenException;
import com.ryuqq.circuitbreaker.core.model.CircuitBreakerStats;
import com.ryuqq.circuitbreaker.core.protection.CircuitBreakerListener;
import com.ryuqq.circuitbreaker.core.protection.CircuitBreakerState;
import com.ryuqq.circuitbreaker.testkit.clock.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * InMemoryCircuitBreaker 구현 고유 동작 테스트.
 *
 * <p>공통 시나리오는 {@link InMemoryCircuitBreakerContractTest}가 다루고, 여기서는
 * 리스너 호출 순서, 잠금 밖 알림, 분류기 오류 처리 등 구현 세부를 검증합니다.</p>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class InMemoryCircuitBreakerTest {

    @Mock
    private CircuitBreakerListener listener;

    private MutableClock clock;
    private InMemoryCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.fixed();
        CircuitBreakerConfig config = new CircuitBreakerConfig()
            .withFailureThreshold(2)
            .withRecoveryTimeout(Duration.ofSeconds(10))
            .withListener(listener);
        breaker = new InMemoryCircuitBreaker("inventory-db", config, clock);
    }

    private void failOnce() {
        assertThatThrownBy(() -> breaker.execute(() -> {
            throw new IOException("connection reset");
        })).isInstanceOf(IOException.class);
    }

    @Test
    void 생성자_인자_검증() {
        CircuitBreakerConfig config = new CircuitBreakerConfig();

        assertThatThrownBy(() -> new InMemoryCircuitBreaker(null, config))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InMemoryCircuitBreaker("x", null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InMemoryCircuitBreaker("x", config, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> breaker.execute(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> breaker.executeAsync(() -> CompletableFuture.completedFuture("x"), Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 실패_후_OPEN_전이_순서대로_알림() {
        // When
        failOnce();
        failOnce();

        // Then
        InOrder order = inOrder(listener);
        order.verify(listener, times(2)).onFailure(eq("inventory-db"), any(IOException.class));
        order.verify(listener).onStateChange("inventory-db", CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN);
        order.verifyNoMoreInteractions();
    }

    @Test
    void 차단된_호출은_통계와_함께_알림() {
        // Given
        failOnce();
        failOnce();

        // When
        assertThatThrownBy(() -> breaker.execute(() -> "never"))
            .isInstanceOf(CircuitBreakerOpenException.class);

        // Then
        ArgumentCaptor<CircuitBreakerStats> captor = ArgumentCaptor.forClass(CircuitBreakerStats.class);
        verify(listener).onCallRejected(eq("inventory-db"), captor.capture());
        assertThat(captor.getValue().state()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(captor.getValue().nextAttemptTime()).isEqualTo(clock.instant().plusSeconds(10));
    }

    @Test
    @Timeout(5)
    void 리스너는_잠금_밖에서_호출된다() throws Exception {
        // Given: reads state from another thread, which blocks forever if the lock is still held
        AtomicReference<CircuitBreakerState> observed = new AtomicReference<>();
        breaker.addListener(new CircuitBreakerListener() {
            @Override
            public void onStateChange(String breakerName, CircuitBreakerState from, CircuitBreakerState to) {
                CompletableFuture<CircuitBreakerState> read = CompletableFuture.supplyAsync(breaker::getState);
                observed.set(read.join());
            }
        });

        // When
        failOnce();
        failOnce();

        // Then
        assertThat(observed.get()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void 리스너_예외는_다른_리스너와_호출에_영향_없음() throws Exception {
        // Given
        doThrow(new IllegalStateException("listener bug")).when(listener).onSuccess("inventory-db");
        CircuitBreakerListener second = mock(CircuitBreakerListener.class);
        breaker.addListener(second);

        // When
        String result = breaker.execute(() -> "stock");

        // Then
        assertThat(result).isEqualTo("stock");
        verify(second).onSuccess("inventory-db");
        assertThat(breaker.getStats().successes()).isEqualTo(1);
    }

    @Test
    void 분류기_예외는_실패로_집계() {
        // Given
        InMemoryCircuitBreaker strict = new InMemoryCircuitBreaker("strict",
            new CircuitBreakerConfig()
                .withFailureThreshold(1)
                .withExpectedErrors(error -> {
                    throw new IllegalStateException("classifier bug");
                }),
            clock);

        // When
        assertThatThrownBy(() -> strict.execute(() -> {
            throw new IOException("down");
        })).isInstanceOf(IOException.class);

        // Then
        assertThat(strict.getState()).isEqualTo(CircuitBreakerState.OPEN);
    }

    @Test
    void Error_도_실패로_집계되고_그대로_전파() {
        // Given
        StackOverflowError error = new StackOverflowError("deep");

        // When & Then
        assertThatThrownBy(() -> breaker.execute(() -> {
            throw error;
        })).isSameAs(error);
        assertThat(breaker.getStats().failures()).isEqualTo(1);
    }

    @Test
    void null_stage_를_반환하면_실패로_집계() {
        // When
        CompletableFuture<String> future = breaker.executeAsync(() -> null);

        // Then
        assertThatThrownBy(future::join).hasCauseInstanceOf(IllegalStateException.class);
        assertThat(breaker.getStats().failures()).isEqualTo(1);
    }

    @Test
    void OPEN_중_늦게_도착한_실패는_nextAttempt_를_갱신() {
        // Given: a slow call admitted while CLOSED
        CompletableFuture<String> slow = new CompletableFuture<>();
        CompletableFuture<String> result = breaker.executeAsync(() -> slow);
        failOnce();
        failOnce();
        clock.advance(Duration.ofSeconds(5));

        // When
        slow.completeExceptionally(new IOException("late timeout"));

        // Then
        assertThat(result).isCompletedExceptionally();
        assertThat(breaker.getStats().nextAttemptTime()).isEqualTo(clock.instant().plusSeconds(10));
        verify(listener, never()).onStateChange("inventory-db", CircuitBreakerState.OPEN, CircuitBreakerState.OPEN);
    }

    @Test
    void forceState_CLOSED_는_카운터를_유지() {
        // Given
        failOnce();
        failOnce();

        // When
        breaker.forceState(CircuitBreakerState.CLOSED);

        // Then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.getStats().failures()).isEqualTo(2);
        assertThat(breaker.getStats().nextAttemptTime()).isNull();
    }

    @Test
    void 복구_시간이_Instant_범위를_넘으면_nextAttempt_는_Instant_MAX() {
        // Given
        InMemoryCircuitBreaker forever = new InMemoryCircuitBreaker("forever",
            new CircuitBreakerConfig()
                .withFailureThreshold(1)
                .withRecoveryTimeout(ChronoUnit.FOREVER.getDuration()),
            clock);
        IOException original = new IOException("down");
        AtomicInteger invocations = new AtomicInteger();

        // When
        assertThatThrownBy(() -> forever.execute(() -> {
            throw original;
        })).isSameAs(original);

        // Then
        assertThat(forever.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(forever.getStats().nextAttemptTime()).isEqualTo(Instant.MAX);
        assertThatThrownBy(() -> forever.execute(invocations::incrementAndGet))
            .isInstanceOf(CircuitBreakerOpenException.class);
        assertThat(invocations.get()).isZero();
    }

    @Test
    void 복구_시간이_Instant_범위를_넘어도_forceState_OPEN_은_차단() {
        // Given
        InMemoryCircuitBreaker forever = new InMemoryCircuitBreaker("forever",
            new CircuitBreakerConfig().withRecoveryTimeout(ChronoUnit.FOREVER.getDuration()),
            clock);
        AtomicInteger invocations = new AtomicInteger();

        // When
        forever.forceState(CircuitBreakerState.OPEN);

        // Then
        assertThat(forever.getStats().nextAttemptTime()).isEqualTo(Instant.MAX);
        assertThatThrownBy(() -> forever.execute(invocations::incrementAndGet))
            .isInstanceOf(CircuitBreakerOpenException.class);
        assertThat(invocations.get()).isZero();
    }

    @Test
    void 설정과_이름_노출() {
        assertThat(breaker.getName()).isEqualTo("inventory-db");
        assertThat(breaker.getConfig().failureThreshold()).isEqualTo(2);
        assertThat(breaker.toString()).contains("inventory-db").contains("CLOSED");
    }
}
