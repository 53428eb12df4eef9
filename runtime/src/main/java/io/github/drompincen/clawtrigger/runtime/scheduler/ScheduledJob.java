package io.github.drompincen.clawtrigger.runtime.scheduler;

import io.github.drompincen.clawtrigger.protocol.api.ScheduledJobResponse;
import io.github.drompincen.clawtrigger.protocol.api.TriggerConfig;
import io.github.drompincen.clawtrigger.protocol.api.TriggerType;

import java.time.Instant;
import java.util.Map;

public record ScheduledJob(
        String jobId,
        String name,
        TriggerType triggerType,
        TriggerConfig triggerConfig,
        Instant nextRunTime,
        boolean paused,
        Runnable task,
        Map<String, Object> args
) {
    public ScheduledJob withNextRunTime(Instant next) {
        return new ScheduledJob(jobId, name, triggerType, triggerConfig, next, paused, task, args);
    }

    public ScheduledJob withPaused(boolean value) {
        return new ScheduledJob(jobId, name, triggerType, triggerConfig, nextRunTime, value, task, args);
    }

    public ScheduledJobResponse toResponse() {
        return new ScheduledJobResponse(jobId, name, triggerType, triggerConfig, nextRunTime, paused);
    }
}
