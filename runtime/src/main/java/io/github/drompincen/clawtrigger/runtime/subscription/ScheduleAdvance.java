package io.github.drompincen.clawtrigger.runtime.subscription;

import java.time.Instant;

public record ScheduleAdvance(Instant nextExecutionTime, boolean enabled) {

    public static ScheduleAdvance finished() {
        return new ScheduleAdvance(null, false);
    }
}
