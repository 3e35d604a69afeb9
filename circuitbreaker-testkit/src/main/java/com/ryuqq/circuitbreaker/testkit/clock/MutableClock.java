package com.ryuqq.circuitbreaker.testkit.clock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 테스트에서 직접 움직이는 Clock.
 *
 * <p>recoveryTimeout 경과를 실제 대기 없이 재현합니다.
 * 여러 스레드에서 읽을 수 있도록 현재 시각은 volatile로 보관합니다.</p>
 *
 * <pre>{@code
 * MutableClock clock = MutableClock.startingAt(Instant.parse("2024-01-01T00:00:00Z"));
 * CircuitBreaker cb = new InMemoryCircuitBreaker("api", config, clock);
 * clock.advance(Duration.ofSeconds(31));
 * }</pre>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private final ZoneId zone;
    private volatile Instant now;

    private MutableClock(Instant start, ZoneId zone) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.now = start;
        this.zone = zone;
    }

    /**
     * 지정 시각에서 시작하는 UTC Clock 생성.
     *
     * @param start 시작 시각
     * @return MutableClock
     */
    public static MutableClock startingAt(Instant start) {
        return new MutableClock(start, ZoneOffset.UTC);
    }

    /**
     * 고정된 기준 시각(2024-01-01T00:00:00Z)에서 시작하는 Clock 생성.
     *
     * @return MutableClock
     */
    public static MutableClock fixed() {
        return startingAt(Instant.parse("2024-01-01T00:00:00Z"));
    }

    /**
     * 시간 전진.
     *
     * @param duration 전진할 시간 (음수 불가)
     * @throws IllegalArgumentException duration이 null이거나 음수인 경우
     */
    public void advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be zero or positive (current: " + duration + ")");
        }
        synchronized (this) {
            now = now.plus(duration);
        }
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    public void setTime(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        this.now = instant;
    }

    @Override
    public Instant instant() {
        return now;
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(now, zone);
    }
}
