package io.github.drompincen.clawtrigger.runtime.scheduler;

import java.time.Instant;

public record JobHandle(String jobId, String runId, Instant submittedAt) {}
