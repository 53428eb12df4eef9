package io.github.drompincen.clawtrigger.runtime.breaker;

import java.time.Duration;

public class CircuitBreakerOpenException extends RuntimeException {

    private final String breakerName;
    private final Duration remaining;

    public CircuitBreakerOpenException(String breakerName, Duration resetTimeout, Duration remaining) {
        super("Service temporarily unavailable. Circuit will reset in " + resetTimeout.toSeconds() + "s");
        this.breakerName = breakerName;
        this.remaining = remaining;
    }

    public String getBreakerName() {
        return breakerName;
    }

    /** Time left until the breaker admits a trial call. */
    public Duration getRemaining() {
        return remaining;
    }
}
