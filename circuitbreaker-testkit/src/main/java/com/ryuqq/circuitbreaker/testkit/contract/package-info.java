/**
 * Abstract contract tests for {@code CircuitBreaker} and {@code CircuitBreakerRegistry}
 * implementations.
 *
 * <p>Extend the abstract class in the implementation module's test sources and provide
 * the factory method. The scenarios drive time through
 * {@link com.ryuqq.circuitbreaker.testkit.clock.MutableClock}, so implementations must
 * read time only from the injected {@link java.time.Clock}.</p>
 *
 * <pre>{@code
 * class MyBreakerContractTest extends AbstractCircuitBreakerContractTest {
 *     @Override
 *     protected CircuitBreaker createBreaker(String name, CircuitBreakerConfig config, Clock clock) {
 *         return new MyBreaker(name, config, clock);
 *     }
 * }
 * }</pre>
 */
package com.ryuqq.circuitbreaker.testkit.contract;
