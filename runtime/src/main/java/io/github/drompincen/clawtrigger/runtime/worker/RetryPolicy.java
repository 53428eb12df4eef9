package io.github.drompincen.clawtrigger.runtime.worker;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

@Component
public class RetryPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final DoubleSupplier random;

    @Autowired
    public RetryPolicy(@Value("${clawtrigger.worker.retry-base-delay-seconds:60}") long baseSeconds,
                       @Value("${clawtrigger.worker.retry-max-delay-seconds:600}") long maxSeconds) {
        this(Duration.ofSeconds(baseSeconds), Duration.ofSeconds(maxSeconds), () -> ThreadLocalRandom.current().nextDouble());
    }

    public RetryPolicy(Duration baseDelay, Duration maxDelay, DoubleSupplier random) {
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.random = random;
    }

    /** Delay before retry number {@code attempt}, counting from 1. */
    public Duration delayFor(int attempt) {
        int exponent = Math.max(0, Math.min(attempt - 1, 20));
        long base = baseDelay.toMillis() * (1L << exponent);
        long capped = Math.min(base, maxDelay.toMillis());
        long jitter = (long) (capped * 0.1 * random.getAsDouble());
        return Duration.ofMillis(Math.min(capped + jitter, maxDelay.toMillis()));
    }
}
