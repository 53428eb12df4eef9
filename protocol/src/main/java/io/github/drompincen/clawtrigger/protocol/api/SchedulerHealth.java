package io.github.drompincen.clawtrigger.protocol.api;

import java.util.Map;

public record SchedulerHealth(
        boolean healthy,
        String backendType,
        SchedulerState state,
        int jobsCount,
        Map<String, Object> details
) {
    public static SchedulerHealth unhealthy(String backendType, SchedulerState state, int jobsCount, String error) {
        return new SchedulerHealth(false, backendType, state, jobsCount, Map.of("error", String.valueOf(error)));
    }
}
