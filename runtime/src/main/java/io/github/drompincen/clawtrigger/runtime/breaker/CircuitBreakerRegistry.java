package io.github.drompincen.clawtrigger.runtime.breaker;

import io.github.drompincen.clawtrigger.protocol.api.CircuitBreakerStatus;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class CircuitBreakerRegistry {

    public static final String AI_SERVICE = "ai_service";
    public static final String WEBHOOK_SERVICE = "webhook_service";

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerMetrics metrics;
    private final int failMax;
    private final Duration resetTimeout;
    private final Clock clock;

    @Autowired
    public CircuitBreakerRegistry(MeterRegistry meterRegistry,
                                  @Value("${clawtrigger.breaker.fail-max:5}") int failMax,
                                  @Value("${clawtrigger.breaker.reset-timeout-seconds:60}") long resetTimeoutSeconds) {
        this(meterRegistry, failMax, Duration.ofSeconds(resetTimeoutSeconds), Clock.systemUTC());
    }

    public CircuitBreakerRegistry(MeterRegistry meterRegistry, int failMax, Duration resetTimeout, Clock clock) {
        this.metrics = new CircuitBreakerMetrics(meterRegistry);
        this.failMax = failMax;
        this.resetTimeout = resetTimeout;
        this.clock = clock;
        getOrCreate(AI_SERVICE);
        getOrCreate(WEBHOOK_SERVICE);
    }

    public Optional<CircuitBreaker> get(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    public CircuitBreaker getOrCreate(String name) {
        return breakers.computeIfAbsent(name, n -> {
            CircuitBreaker breaker = new CircuitBreaker(n, failMax, resetTimeout, clock, metrics);
            metrics.bind(breaker);
            return breaker;
        });
    }

    public Map<String, CircuitBreakerStatus> getCircuitBreakerStatus() {
        Map<String, CircuitBreakerStatus> status = new LinkedHashMap<>();
        breakers.keySet().stream().sorted().forEach(name -> status.put(name, breakers.get(name).status()));
        return status;
    }

    public boolean reset(String name) {
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }

    public void resetAll() {
        breakers.values().forEach(CircuitBreaker::reset);
    }
}
