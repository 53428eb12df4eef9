package io.github.drompincen.clawtrigger.runtime.scheduler.local;

import io.github.drompincen.clawtrigger.protocol.api.SchedulerHealth;
import io.github.drompincen.clawtrigger.protocol.api.SchedulerState;
import io.github.drompincen.clawtrigger.protocol.api.TriggerConfig;
import io.github.drompincen.clawtrigger.protocol.api.TriggerType;
import io.github.drompincen.clawtrigger.runtime.scheduler.JobAlreadyExistsException;
import io.github.drompincen.clawtrigger.runtime.scheduler.JobHandle;
import io.github.drompincen.clawtrigger.runtime.scheduler.JobNotFoundException;
import io.github.drompincen.clawtrigger.runtime.scheduler.JobTriggers;
import io.github.drompincen.clawtrigger.runtime.scheduler.ScheduledJob;
import io.github.drompincen.clawtrigger.runtime.scheduler.SchedulerBackend;
import io.github.drompincen.clawtrigger.runtime.subscription.CronExpressions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.scheduling.support.PeriodicTrigger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process backend on a {@link ThreadPoolTaskScheduler}. Runs coalesce (the next fire time is
 * computed from the last completion), at most one run per job is in flight, and a run that starts
 * more than {@link #MISFIRE_GRACE} after its planned time is skipped.
 */
public class TaskSchedulerBackend implements SchedulerBackend {

    private static final Logger log = LoggerFactory.getLogger(TaskSchedulerBackend.class);

    public static final String TYPE = "local";
    static final Duration MISFIRE_GRACE = Duration.ofSeconds(60);

    private final ThreadPoolTaskScheduler taskScheduler;
    private final Map<String, LocalJob> jobs = new ConcurrentHashMap<>();
    private volatile SchedulerState state = SchedulerState.STOPPED;

    public TaskSchedulerBackend(int poolSize) {
        this(newScheduler(poolSize));
    }

    TaskSchedulerBackend(ThreadPoolTaskScheduler taskScheduler) {
        this.taskScheduler = taskScheduler;
    }

    private static ThreadPoolTaskScheduler newScheduler(int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("clawtrigger-local-");
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
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
        taskScheduler.initialize();
        state = SchedulerState.RUNNING;
        jobs.values().stream().filter(job -> !job.paused).forEach(this::arm);
        log.info("Local scheduler started with {} job(s)", jobs.size());
    }

    @Override
    public synchronized void stop(boolean wait) {
        if (state == SchedulerState.STOPPED) {
            return;
        }
        jobs.values().forEach(LocalJob::disarm);
        taskScheduler.setWaitForTasksToCompleteOnShutdown(wait);
        taskScheduler.shutdown();
        state = SchedulerState.STOPPED;
        log.info("Local scheduler stopped (wait={})", wait);
    }

    @Override
    public synchronized ScheduledJob scheduleJob(String jobId, String name, Runnable task, TriggerType type,
                                                 TriggerConfig config, boolean replaceExisting) {
        JobTriggers.requireSchedulable(type, config);
        LocalJob existing = jobs.get(jobId);
        if (existing != null) {
            if (!replaceExisting) {
                throw new JobAlreadyExistsException(jobId);
            }
            existing.disarm();
        }
        LocalJob job = new LocalJob(new ScheduledJob(jobId, name, type, config, null, false, task, Map.of()));
        jobs.put(jobId, job);
        if (state != SchedulerState.STOPPED) {
            arm(job);
        }
        log.info("Scheduled local job {} ({} {})", jobId, type.wireName(), config);
        return job.view();
    }

    @Override
    public boolean removeJob(String jobId) {
        LocalJob job = jobs.remove(jobId);
        if (job == null) {
            return false;
        }
        job.disarm();
        log.info("Removed local job {}", jobId);
        return true;
    }

    @Override
    public Optional<ScheduledJob> getJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(LocalJob::view);
    }

    @Override
    public List<ScheduledJob> getJobs() {
        return new ArrayList<>(jobs.values().stream().map(LocalJob::view).toList());
    }

    @Override
    public SchedulerHealth healthCheck() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("poolSize", taskScheduler.getPoolSize());
        details.put("activeCount", state == SchedulerState.STOPPED ? 0 : taskScheduler.getActiveCount());
        boolean healthy = state != SchedulerState.STOPPED;
        return new SchedulerHealth(healthy, TYPE, state, jobs.size(), details);
    }

    @Override
    public void pause() {
        if (state == SchedulerState.RUNNING) {
            state = SchedulerState.PAUSED;
            log.info("Local scheduler paused");
        }
    }

    @Override
    public void resume() {
        if (state == SchedulerState.PAUSED) {
            state = SchedulerState.RUNNING;
            log.info("Local scheduler resumed");
        }
    }

    @Override
    public synchronized void pauseJob(String jobId) {
        LocalJob job = require(jobId);
        job.paused = true;
        job.disarm();
        log.info("Paused local job {}", jobId);
    }

    @Override
    public synchronized void resumeJob(String jobId) {
        LocalJob job = require(jobId);
        if (job.paused) {
            job.paused = false;
            if (state != SchedulerState.STOPPED) {
                arm(job);
            }
            log.info("Resumed local job {}", jobId);
        }
    }

    @Override
    public JobHandle executeJobNow(String jobId) {
        LocalJob job = require(jobId);
        String runId = UUID.randomUUID().toString();
        taskScheduler.execute(() -> job.run(null));
        return new JobHandle(jobId, runId, Instant.now());
    }

    private LocalJob require(String jobId) {
        LocalJob job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    private void arm(LocalJob job) {
        ScheduledJob view = job.descriptor;
        if (view.triggerType() == TriggerType.ONE_TIME) {
            Instant at = view.triggerConfig().executeAt();
            job.plannedAt = at;
            job.future = taskScheduler.schedule(() -> {
                job.run(at);
                jobs.remove(view.jobId(), job);
            }, at);
            return;
        }
        Trigger trigger = new PlannedTrigger(job, toSpringTrigger(view));
        job.future = taskScheduler.schedule(() -> job.run(job.plannedAt), trigger);
    }

    private static Trigger toSpringTrigger(ScheduledJob view) {
        TriggerConfig config = view.triggerConfig() != null ? view.triggerConfig() : TriggerConfig.empty();
        if (view.triggerType() == TriggerType.CRON) {
            String expr = config.cronExpressionOrDefault();
            String sixField = expr.split("\\s+").length == 5 ? "0 " + expr : expr;
            return new CronTrigger(sixField, CronExpressions.zoneOrUtc(config.timezoneOrDefault()));
        }
        Duration period = config.intervalDuration();
        PeriodicTrigger periodic = new PeriodicTrigger(period);
        periodic.setInitialDelay(period);
        return periodic;
    }

    private final class LocalJob {
        final ScheduledJob descriptor;
        final AtomicBoolean running = new AtomicBoolean();
        volatile boolean paused;
        volatile Instant plannedAt;
        volatile ScheduledFuture<?> future;

        LocalJob(ScheduledJob descriptor) {
            this.descriptor = descriptor;
        }

        void run(Instant planned) {
            if (state == SchedulerState.PAUSED && planned != null) {
                log.debug("Scheduler paused, skipping run of {}", descriptor.jobId());
                return;
            }
            if (planned != null && Duration.between(planned, Instant.now()).compareTo(MISFIRE_GRACE) > 0) {
                log.warn("Job {} missed its run at {} by more than {}s, skipping",
                        descriptor.jobId(), planned, MISFIRE_GRACE.getSeconds());
                return;
            }
            if (!running.compareAndSet(false, true)) {
                log.warn("Job {} is still running, skipping this run", descriptor.jobId());
                return;
            }
            try {
                descriptor.task().run();
            } catch (Exception e) {
                log.error("Local job {} failed", descriptor.jobId(), e);
            } finally {
                running.set(false);
            }
        }

        void disarm() {
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
                future = null;
            }
        }

        ScheduledJob view() {
            Instant next = null;
            ScheduledFuture<?> f = future;
            if (f != null && !f.isDone()) {
                next = Instant.now().plusMillis(Math.max(0, f.getDelay(TimeUnit.MILLISECONDS)));
            }
            return descriptor.withNextRunTime(next).withPaused(paused);
        }
    }

    /** Records each planned fire time so the run can tell how late it started. */
    private static final class PlannedTrigger implements Trigger {
        private final LocalJob job;
        private final Trigger delegate;

        PlannedTrigger(LocalJob job, Trigger delegate) {
            this.job = job;
            this.delegate = delegate;
        }

        @Override
        public Instant nextExecution(TriggerContext triggerContext) {
            Instant next = delegate.nextExecution(triggerContext);
            job.plannedAt = next;
            return next;
        }
    }
}
