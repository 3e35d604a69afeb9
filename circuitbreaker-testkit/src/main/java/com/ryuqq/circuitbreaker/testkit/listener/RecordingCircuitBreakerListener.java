package com.ryuqq.circuitbreaker.testkit.listener;

import com.ryuqq.circuitbreaker.core.model.CircuitBreakerStats;
import com.ryuqq.circuitbreaker.core.protection.CircuitBreakerListener;
import com.ryuqq.circuitbreaker.core.protection.CircuitBreakerState;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * 수신한 이벤트를 순서대로 기록하는 리스너.
 *
 * <p>이벤트는 {@code "STATE:CLOSED->OPEN"}, {@code "SUCCESS"}, {@code "FAILURE:IOException"},
 * {@code "IGNORED:HttpStatusException"}, {@code "REJECTED:OPEN"} 형태의 문자열로 기록됩니다.</p>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public class RecordingCircuitBreakerListener implements CircuitBreakerListener {

    private final List<String> events = new CopyOnWriteArrayList<>();
    private final List<CircuitBreakerState> stateChanges = new CopyOnWriteArrayList<>();
    private final List<Throwable> failures = new CopyOnWriteArrayList<>();

    @Override
    public void onStateChange(String breakerName, CircuitBreakerState from, CircuitBreakerState to) {
        stateChanges.add(to);
        events.add("STATE:" + from + "->" + to);
    }

    @Override
    public void onSuccess(String breakerName) {
        events.add("SUCCESS");
    }

    @Override
    public void onFailure(String breakerName, Throwable error) {
        failures.add(error);
        events.add("FAILURE:" + error.getClass().getSimpleName());
    }

    @Override
    public void onIgnoredError(String breakerName, Throwable error) {
        events.add("IGNORED:" + error.getClass().getSimpleName());
    }

    @Override
    public void onCallRejected(String breakerName, CircuitBreakerStats stats) {
        events.add("REJECTED:" + stats.state());
    }

    public List<String> getEvents() {
        return List.copyOf(events);
    }

    /**
     * 상태 전이 이벤트의 목표 상태 목록.
     *
     * @return 전이 순서대로의 목표 상태
     */
    public List<CircuitBreakerState> getStateChanges() {
        return List.copyOf(stateChanges);
    }

    public List<Throwable> getFailures() {
        return List.copyOf(failures);
    }

    /**
     * 접두사로 시작하는 이벤트만 조회.
     *
     * @param prefix 접두사 (예: "STATE")
     * @return 해당 이벤트 목록
     */
    public List<String> eventsStartingWith(String prefix) {
        return events.stream().filter(event -> event.startsWith(prefix)).collect(Collectors.toList());
    }

    public void clear() {
        events.clear();
        stateChanges.clear();
        failures.clear();
    }
}
