package io.github.drompincen.clawtrigger.protocol.api;

import java.time.Instant;

public record ScheduledJobResponse(
        String jobId,
        String name,
        TriggerType triggerType,
        TriggerConfig triggerConfig,
        Instant nextRunTime,
        boolean paused
) {}
