package io.github.drompincen.clawtrigger.protocol.api;

public record CircuitBreakerStatus(
        CircuitState state,
        int failCounter,
        int failMax,
        long resetTimeoutSeconds
) {}
