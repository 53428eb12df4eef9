package io.github.drompincen.clawtrigger.runtime.scheduler;

import io.github.drompincen.clawtrigger.protocol.api.SchedulerHealth;
import io.github.drompincen.clawtrigger.protocol.api.SchedulerState;
import io.github.drompincen.clawtrigger.protocol.api.TriggerConfig;
import io.github.drompincen.clawtrigger.protocol.api.TriggerType;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Runs registered tasks on cron, interval or one-time schedules. Event triggers are not
 * schedulable. Optional operations throw {@link UnsupportedSchedulerOperationException} on backends
 * that cannot honour them.
 */
public interface SchedulerBackend {

    /** The job id under which every process registers the due-subscription scan. */
    String CHECK_DUE_SUBSCRIPTIONS_JOB_ID = "check-due-subscriptions";

    String backendType();

    SchedulerState state();

    /** Idempotent. */
    void start();

    /** With {@code wait}, returns only after in-flight runs finished. */
    void stop(boolean wait);

    /**
     * @throws JobAlreadyExistsException if {@code replaceExisting} is false and the id is taken
     * @throws IllegalArgumentException for event triggers
     */
    ScheduledJob scheduleJob(String jobId, String name, Runnable task, TriggerType type, TriggerConfig config,
                             boolean replaceExisting);

    /** Idempotent; false when no such job was registered. */
    boolean removeJob(String jobId);

    Optional<ScheduledJob> getJob(String jobId);

    List<ScheduledJob> getJobs();

    default Optional<Instant> getNextRunTime(String jobId) {
        return getJob(jobId).map(ScheduledJob::nextRunTime);
    }

    SchedulerHealth healthCheck();

    default void pause() {
        throw new UnsupportedSchedulerOperationException(backendType(), "pause");
    }

    default void resume() {
        throw new UnsupportedSchedulerOperationException(backendType(), "resume");
    }

    default void pauseJob(String jobId) {
        throw new UnsupportedSchedulerOperationException(backendType(), "pauseJob");
    }

    default void resumeJob(String jobId) {
        throw new UnsupportedSchedulerOperationException(backendType(), "resumeJob");
    }

    default JobHandle executeJobNow(String jobId) {
        throw new UnsupportedSchedulerOperationException(backendType(), "executeJobNow");
    }
}
