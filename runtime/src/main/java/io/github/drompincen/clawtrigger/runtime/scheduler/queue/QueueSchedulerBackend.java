package io.github.drompincen.clawtrigger.runtime.scheduler.queue;

import io.github.drompincen.clawtrigger.persistence.document.QueuedJobDocument;
import io.github.drompincen.clawtrigger.protocol.api.QueueStats;
import io.github.drompincen.clawtrigger.protocol.api.SchedulerHealth;
import io.github.drompincen.clawtrigger.protocol.api.SchedulerState;
import io.github.drompincen.clawtrigger.protocol.api.TriggerConfig;
import io.github.drompincen.clawtrigger.protocol.api.TriggerType;
import io.github.drompincen.clawtrigger.runtime.queue.ExecutionQueue;
import io.github.drompincen.clawtrigger.runtime.scheduler.JobAlreadyExistsException;
import io.github.drompincen.clawtrigger.runtime.scheduler.JobHandle;
import io.github.drompincen.clawtrigger.runtime.scheduler.JobNotFoundException;
import io.github.drompincen.clawtrigger.runtime.scheduler.JobTriggers;
import io.github.drompincen.clawtrigger.runtime.scheduler.ScheduledJob;
import io.github.drompincen.clawtrigger.runtime.scheduler.SchedulerBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Beat-driven backend: a beat thread computes due times and, instead of running a job inline, puts
 * a tick on the shared job queue. Whichever worker claims the tick runs the task through
 * {@link #runTick}, so the task has to be registered in the consuming process too.
 */
public class QueueSchedulerBackend implements SchedulerBackend {

    private static final Logger log = LoggerFactory.getLogger(QueueSchedulerBackend.class);

    public static final String TYPE = "queue";

    private final ExecutionQueue queue;
    private final Duration beatInterval;
    private final Clock clock;
    private final Map<String, ScheduledJob> jobs = new ConcurrentHashMap<>();
    private volatile SchedulerState state = SchedulerState.STOPPED;
    private ScheduledExecutorService beat;

    public QueueSchedulerBackend(ExecutionQueue queue, Duration beatInterval) {
        this(queue, beatInterval, Clock.systemUTC());
    }

    QueueSchedulerBackend(ExecutionQueue queue, Duration beatInterval, Clock clock) {
        this.queue = queue;
        this.beatInterval = beatInterval;
        this.clock = clock;
    }

    @Override
    public String backendType() {
        return TYPE;
    }

    @Override
    public SchedulerState state() {
        return state;
    }

    @Override
    public synchronized void start() {
        if (state != SchedulerState.STOPPED) {
            return;
        }
        beat = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "clawtrigger-beat");
            t.setDaemon(true);
            return t;
        });
        beat.scheduleWithFixedDelay(this::beatSafely, 0, beatInterval.toMillis(), TimeUnit.MILLISECONDS);
        state = SchedulerState.RUNNING;
        log.info("Queue scheduler started, beat every {}ms", beatInterval.toMillis());
    }

    @Override
    public synchronized void stop(boolean wait) {
        if (state == SchedulerState.STOPPED) {
            return;
        }
        beat.shutdown();
        if (wait) {
            try {
                if (!beat.awaitTermination(30, TimeUnit.SECONDS)) {
                    log.warn("Beat thread did not finish within 30s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        state = SchedulerState.STOPPED;
        log.info("Queue scheduler stopped (wait={})", wait);
    }

    @Override
    public ScheduledJob scheduleJob(String jobId, String name, Runnable task, TriggerType type,
                                    TriggerConfig config, boolean replaceExisting) {
        JobTriggers.requireSchedulable(type, config);
        Instant next = type == TriggerType.ONE_TIME
                ? config.executeAt()
                : JobTriggers.nextRun(type, config, clock.instant());
        ScheduledJob job = new ScheduledJob(jobId, name, type, config, next, false, task, Map.of());
        if (replaceExisting) {
            jobs.put(jobId, job);
        } else if (jobs.putIfAbsent(jobId, job) != null) {
            throw new JobAlreadyExistsException(jobId);
        }
        log.info("Scheduled queue job {} ({}), next run {}", jobId, type.wireName(), next);
        return job;
    }

    @Override
    public boolean removeJob(String jobId) {
        boolean removed = jobs.remove(jobId) != null;
        if (removed) {
            log.info("Removed queue job {}", jobId);
        }
        return removed;
    }

    @Override
    public Optional<ScheduledJob> getJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public List<ScheduledJob> getJobs() {
        return new ArrayList<>(jobs.values());
    }

    @Override
    public SchedulerHealth healthCheck() {
        try {
            QueueStats stats = queue.stats();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("ready", stats.ready());
            details.put("claimed", stats.claimed());
            details.put("dead", stats.dead());
            return new SchedulerHealth(state != SchedulerState.STOPPED, TYPE, state, jobs.size(), details);
        } catch (Exception e) {
            log.warn("Queue health check failed: {}", e.getMessage());
            return SchedulerHealth.unhealthy(TYPE, state, jobs.size(), e.getMessage());
        }
    }

    @Override
    public void pause() {
        if (state == SchedulerState.RUNNING) {
            state = SchedulerState.PAUSED;
            log.info("Queue scheduler paused");
        }
    }

    @Override
    public void resume() {
        if (state == SchedulerState.PAUSED) {
            state = SchedulerState.RUNNING;
            log.info("Queue scheduler resumed");
        }
    }

    @Override
    public JobHandle executeJobNow(String jobId) {
        if (!jobs.containsKey(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        String tickId = enqueueTick(jobId);
        return new JobHandle(jobId, tickId, clock.instant());
    }

    /**
     * Runs the task behind a claimed tick. Returns false when this process has no such job, e.g. a
     * tick left over from a removed job.
     */
    public boolean runTick(String jobId) {
        ScheduledJob job = jobs.get(jobId);
        if (job == null) {
            return false;
        }
        job.task().run();
        if (job.triggerType() == TriggerType.ONE_TIME && job.nextRunTime() == null) {
            jobs.remove(jobId, job);
        }
        return true;
    }

    void beat() {
        if (state != SchedulerState.RUNNING) {
            return;
        }
        Instant now = clock.instant();
        for (ScheduledJob job : jobs.values()) {
            if (job.nextRunTime() == null || job.nextRunTime().isAfter(now)) {
                continue;
            }
            // Computed from now, so a long outage yields one tick rather than a burst.
            Instant next = JobTriggers.nextRun(job.triggerType(), job.triggerConfig(), now);
            if (jobs.replace(job.jobId(), job, job.withNextRunTime(next))) {
                enqueueTick(job.jobId());
            }
        }
    }

    private void beatSafely() {
        try {
            beat();
        } catch (Exception e) {
            log.error("Scheduler beat failed", e);
        }
    }

    private String enqueueTick(String jobId) {
        String tickId = UUID.randomUUID().toString();
        queue.enqueue(tickId, QueuedJobDocument.Kind.SCHEDULER_TICK, jobId, Duration.ZERO);
        log.debug("Enqueued tick {} for job {}", tickId, jobId);
        return tickId;
    }
}
