package com.ryuqq.circuitbreaker.core.decorator;

import com.ryuqq.circuitbreaker.core.function.ThrowingFunction;
import com.ryuqq.circuitbreaker.core.function.ThrowingSupplier;
import com.ryuqq.circuitbreaker.core.protection.CircuitBreaker;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 임의의 함수를 Circuit Breaker로 보호된 함수로 감싸는 어댑터.
 *
 * <p>{@code execute}를 매번 직접 호출하는 대신, 보호된 함수를 한 번 만들어 재사용합니다.
 * 감싼 함수의 매 호출은 독립된 {@code execute} 호출입니다.</p>
 *
 * <pre>{@code
 * Function<String, CompletableFuture<User>> findUser =
 *     CircuitBreakerDecorators.decorateAsyncFunction(cb, userClient::findAsync);
 *
 * findUser.apply("u-1").join();
 * }</pre>
 *
 * @author CircuitBreaker Team
 * @since 1.0.0
 */
public final class CircuitBreakerDecorators {

    // Utility class - prevent instantiation
    private CircuitBreakerDecorators() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 동기 작업 보호.
     *
     * @param breaker Circuit Breaker
     * @param supplier 원래 작업
     * @return 보호된 작업
     */
    public static <T, E extends Exception> ThrowingSupplier<T, E> decorateSupplier(
        CircuitBreaker breaker,
        ThrowingSupplier<T, E> supplier
    ) {
        requireNonNull(breaker, supplier);
        return () -> breaker.execute(supplier);
    }

    /**
     * 동기 함수 보호.
     *
     * @param breaker Circuit Breaker
     * @param function 원래 함수
     * @return 보호된 함수
     */
    public static <A, R, E extends Exception> ThrowingFunction<A, R, E> decorateFunction(
        CircuitBreaker breaker,
        ThrowingFunction<A, R, E> function
    ) {
        requireNonNull(breaker, function);
        return argument -> breaker.execute(() -> function.apply(argument));
    }

    /**
     * 비동기 작업 보호.
     *
     * @param breaker Circuit Breaker
     * @param supplier 원래 비동기 작업
     * @return 보호된 비동기 작업
     */
    public static <T> Supplier<CompletableFuture<T>> decorateAsync(
        CircuitBreaker breaker,
        Supplier<? extends CompletionStage<T>> supplier
    ) {
        requireNonNull(breaker, supplier);
        return () -> breaker.executeAsync(supplier);
    }

    /**
     * 비동기 함수 보호.
     *
     * @param breaker Circuit Breaker
     * @param function 원래 비동기 함수
     * @return 보호된 비동기 함수
     */
    public static <A, R> Function<A, CompletableFuture<R>> decorateAsyncFunction(
        CircuitBreaker breaker,
        Function<A, ? extends CompletionStage<R>> function
    ) {
        requireNonNull(breaker, function);
        return argument -> breaker.executeAsync(() -> function.apply(argument));
    }

    private static void requireNonNull(CircuitBreaker breaker, Object target) {
        if (breaker == null) {
            throw new IllegalArgumentException("breaker cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("decorated target cannot be null");
        }
    }
}
