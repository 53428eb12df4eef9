package io.github.drompincen.clawtrigger.runtime.scheduler.local;

import io.github.drompincen.clawtrigger.protocol.api.IntervalUnit;
import io.github.drompincen.clawtrigger.protocol.api.SchedulerHealth;
import io.github.drompincen.clawtrigger.protocol.api.SchedulerState;
import io.github.drompincen.clawtrigger.protocol.api.TriggerConfig;
import io.github.drompincen.clawtrigger.protocol.api.TriggerType;
import io.github.drompincen.clawtrigger.runtime.scheduler.JobAlreadyExistsException;
import io.github.drompincen.clawtrigger.runtime.scheduler.JobHandle;
import io.github.drompincen.clawtrigger.runtime.scheduler.JobNotFoundException;
import io.github.drompincen.clawtrigger.runtime.scheduler.ScheduledJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskSchedulerBackendTest {

    private TaskSchedulerBackend backend;

    @BeforeEach
    void setUp() {
        backend = new TaskSchedulerBackend(2);
    }

    @AfterEach
    void tearDown() {
        backend.stop(false);
    }

    @Test
    void intervalJobFiresRepeatedly() throws Exception {
        CountDownLatch fired = new CountDownLatch(2);
        backend.start();

        backend.scheduleJob("tick", "Tick", fired::countDown, TriggerType.INTERVAL,
                TriggerConfig.interval(1, IntervalUnit.SECONDS), false);

        assertThat(fired.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void jobsScheduledBeforeStartAreArmedOnStart() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);
        backend.scheduleJob("tick", "Tick", fired::countDown, TriggerType.INTERVAL,
                TriggerConfig.interval(1, IntervalUnit.SECONDS), false);
        assertThat(backend.getJob("tick").orElseThrow().nextRunTime()).isNull();

        backend.start();
        backend.start();

        assertThat(backend.state()).isEqualTo(SchedulerState.RUNNING);
        assertThat(backend.getJob("tick").orElseThrow().nextRunTime()).isAfter(Instant.now().minusSeconds(1));
        assertThat(fired.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void oneTimeJobRunsOnceAndIsForgotten() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);
        backend.start();

        backend.scheduleJob("once", "Once", fired::countDown, TriggerType.ONE_TIME,
                TriggerConfig.oneTime(Instant.now().plusMillis(200)), false);

        assertThat(fired.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(100);
        assertThat(backend.getJob("once")).isEmpty();
    }

    @Test
    void duplicateIdIsRejectedUnlessReplacing() {
        backend.scheduleJob("job", "Job", () -> {}, TriggerType.CRON, TriggerConfig.cron("0 9 * * *", "UTC"), false);

        assertThatThrownBy(() -> backend.scheduleJob("job", "Job", () -> {}, TriggerType.CRON,
                TriggerConfig.cron("0 9 * * *", "UTC"), false))
                .isInstanceOf(JobAlreadyExistsException.class);

        ScheduledJob replaced = backend.scheduleJob("job", "Job v2", () -> {}, TriggerType.INTERVAL,
                TriggerConfig.interval(5, IntervalUnit.MINUTES), true);
        assertThat(replaced.name()).isEqualTo("Job v2");
        assertThat(backend.getJobs()).hasSize(1);
    }

    @Test
    void eventTriggerCannotBeScheduled() {
        assertThatThrownBy(() -> backend.scheduleJob("e", "E", () -> {}, TriggerType.EVENT,
                TriggerConfig.event("git_push"), false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void removeJobIsIdempotent() {
        backend.scheduleJob("job", "Job", () -> {}, TriggerType.CRON, TriggerConfig.cron("0 9 * * *", "UTC"), false);

        assertThat(backend.removeJob("job")).isTrue();
        assertThat(backend.removeJob("job")).isFalse();
        assertThat(backend.getJobs()).isEmpty();
    }

    @Test
    void pausedSchedulerSkipsPlannedRunsButRunsOnDemand() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        backend.start();
        backend.scheduleJob("tick", "Tick", runs::incrementAndGet, TriggerType.INTERVAL,
                TriggerConfig.interval(1, IntervalUnit.SECONDS), false);

        backend.pause();
        assertThat(backend.state()).isEqualTo(SchedulerState.PAUSED);
        Thread.sleep(1500);
        assertThat(runs).hasValue(0);

        JobHandle handle = backend.executeJobNow("tick");
        assertThat(handle.jobId()).isEqualTo("tick");
        assertThat(handle.runId()).isNotBlank();
        Thread.sleep(200);
        assertThat(runs).hasValue(1);

        backend.resume();
        assertThat(backend.state()).isEqualTo(SchedulerState.RUNNING);
    }

    @Test
    void pausedJobStopsFiringUntilResumed() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);
        backend.start();
        backend.scheduleJob("tick", "Tick", fired::countDown, TriggerType.INTERVAL,
                TriggerConfig.interval(1, IntervalUnit.SECONDS), false);

        backend.pauseJob("tick");
        assertThat(backend.getJob("tick").orElseThrow().paused()).isTrue();
        assertThat(fired.await(1500, TimeUnit.MILLISECONDS)).isFalse();

        backend.resumeJob("tick");
        assertThat(fired.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void overlappingRunsOfOneJobAreSkipped() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger started = new AtomicInteger();
        backend.start();
        backend.scheduleJob("slow", "Slow", () -> {
            started.incrementAndGet();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, TriggerType.CRON, TriggerConfig.cron("0 9 * * *", "UTC"), false);

        backend.executeJobNow("slow");
        Thread.sleep(200);
        backend.executeJobNow("slow");
        Thread.sleep(200);
        release.countDown();

        assertThat(started).hasValue(1);
    }

    @Test
    void unknownJobOperationsThrow() {
        assertThatThrownBy(() -> backend.pauseJob("nope")).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> backend.executeJobNow("nope")).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void healthReflectsState() {
        SchedulerHealth stopped = backend.healthCheck();
        assertThat(stopped.healthy()).isFalse();
        assertThat(stopped.backendType()).isEqualTo("local");

        backend.start();
        backend.scheduleJob("job", "Job", () -> {}, TriggerType.CRON, TriggerConfig.cron("0 9 * * *", "UTC"), false);
        SchedulerHealth running = backend.healthCheck();
        assertThat(running.healthy()).isTrue();
        assertThat(running.jobsCount()).isEqualTo(1);
        assertThat(running.details()).containsEntry("poolSize", 2);
    }
}
