package io.github.drompincen.clawtrigger.runtime.breaker;

import io.github.drompincen.clawtrigger.protocol.api.CircuitState;

public interface CircuitBreakerListener {

    CircuitBreakerListener NOOP = new CircuitBreakerListener() {};

    default void onStateChange(CircuitBreaker breaker, CircuitState from, CircuitState to) {}

    default void onSuccess(CircuitBreaker breaker) {}

    default void onFailure(CircuitBreaker breaker, Throwable error) {}

    default void onRejected(CircuitBreaker breaker) {}
}
