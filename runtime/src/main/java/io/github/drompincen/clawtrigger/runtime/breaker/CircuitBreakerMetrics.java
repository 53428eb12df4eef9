package io.github.drompincen.clawtrigger.runtime.breaker;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

public class CircuitBreakerMetrics implements CircuitBreakerListener {

    static final String STATE = "circuit_breaker_state";
    static final String FAILURES = "circuit_breaker_failures_total";
    static final String SUCCESSES = "circuit_breaker_success_total";
    static final String REJECTED = "circuit_breaker_rejected_total";

    private final MeterRegistry registry;

    public CircuitBreakerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void bind(CircuitBreaker breaker) {
        Gauge.builder(STATE, breaker, b -> b.state().gaugeValue())
                .description("Circuit breaker state (0=closed, 1=open, 2=half_open)")
                .tag("breaker", breaker.name())
                .register(registry);
    }

    @Override
    public void onSuccess(CircuitBreaker breaker) {
        counter(SUCCESSES, "Successful calls through the circuit breaker", breaker).increment();
    }

    @Override
    public void onFailure(CircuitBreaker breaker, Throwable error) {
        counter(FAILURES, "Failed calls through the circuit breaker", breaker).increment();
    }

    @Override
    public void onRejected(CircuitBreaker breaker) {
        counter(REJECTED, "Calls rejected by an open circuit breaker", breaker).increment();
    }

    private Counter counter(String name, String description, CircuitBreaker breaker) {
        return Counter.builder(name)
                .description(description)
                .tag("breaker", breaker.name())
                .register(registry);
    }
}
