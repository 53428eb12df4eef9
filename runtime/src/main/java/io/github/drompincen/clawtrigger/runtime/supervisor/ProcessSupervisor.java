package io.github.drompincen.clawtrigger.runtime.supervisor;

import io.github.drompincen.clawtrigger.protocol.api.IntervalUnit;
import io.github.drompincen.clawtrigger.protocol.api.TriggerConfig;
import io.github.drompincen.clawtrigger.protocol.api.TriggerType;
import io.github.drompincen.clawtrigger.runtime.lock.DistributedLock;
import io.github.drompincen.clawtrigger.runtime.queue.ExecutionQueue;
import io.github.drompincen.clawtrigger.runtime.queue.LeaseHeartbeatService;
import io.github.drompincen.clawtrigger.runtime.scheduler.SchedulerBackend;
import io.github.drompincen.clawtrigger.runtime.scheduler.SchedulerBackendRegistry;
import io.github.drompincen.clawtrigger.runtime.trigger.DueSubscriptionEvaluator;
import io.github.drompincen.clawtrigger.runtime.worker.ExecutionWorker;
import io.github.drompincen.clawtrigger.runtime.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

/**
 * Brings the scheduler backend, the due-subscription job and the worker pool up in order and takes
 * them down in reverse. Every step is guarded so one failing part does not keep the others from
 * starting or stopping.
 */
@Component
public class ProcessSupervisor implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(ProcessSupervisor.class);
    static final Duration LEASE_RECOVERY_INTERVAL = Duration.ofSeconds(30);

    private final SchedulerBackendRegistry registry;
    private final DueSubscriptionEvaluator evaluator;
    private final WorkerPool workerPool;
    private final ExecutionWorker executionWorker;
    private final LeaseHeartbeatService leaseHeartbeat;
    private final ExecutionQueue queue;
    private final DistributedLock lock;
    private final TaskScheduler taskScheduler;
    private final boolean schedulerEnabled;
    private final boolean workerEnabled;
    private final int triggerIntervalSeconds;
    private final Duration shutdownTimeout;

    private volatile boolean running;
    private SchedulerBackend backend;
    private ScheduledFuture<?> leaseRecovery;

    public ProcessSupervisor(SchedulerBackendRegistry registry,
                             DueSubscriptionEvaluator evaluator,
                             WorkerPool workerPool,
                             ExecutionWorker executionWorker,
                             LeaseHeartbeatService leaseHeartbeat,
                             ExecutionQueue queue,
                             DistributedLock lock,
                             TaskScheduler taskScheduler,
                             @Value("${clawtrigger.scheduler.enabled:true}") boolean schedulerEnabled,
                             @Value("${clawtrigger.worker.enabled:true}") boolean workerEnabled,
                             @Value("${clawtrigger.trigger.interval-seconds:60}") int triggerIntervalSeconds,
                             @Value("${clawtrigger.supervisor.shutdown-timeout-seconds:30}") long shutdownTimeoutSeconds) {
        this.registry = registry;
        this.evaluator = evaluator;
        this.workerPool = workerPool;
        this.executionWorker = executionWorker;
        this.leaseHeartbeat = leaseHeartbeat;
        this.queue = queue;
        this.lock = lock;
        this.taskScheduler = taskScheduler;
        this.schedulerEnabled = schedulerEnabled;
        this.workerEnabled = workerEnabled;
        this.triggerIntervalSeconds = triggerIntervalSeconds;
        this.shutdownTimeout = Duration.ofSeconds(shutdownTimeoutSeconds);
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        log.info("Starting ClawTrigger process (scheduler={}, worker={}, backend={})",
                schedulerEnabled, workerEnabled, registry.defaultBackend());
        try {
            backend = registry.create(registry.defaultBackend());
            // Worker-only processes still register the job so queued ticks can run here.
            backend.scheduleJob(SchedulerBackend.CHECK_DUE_SUBSCRIPTIONS_JOB_ID, "Check due subscriptions",
                    this::checkDueSubscriptions, TriggerType.INTERVAL,
                    TriggerConfig.interval(triggerIntervalSeconds, IntervalUnit.SECONDS), true);
            if (schedulerEnabled) {
                backend.start();
                registry.setActive(backend);
            } else {
                registry.setJobHost(backend);
            }
        } catch (Exception e) {
            log.error("Failed to start scheduler backend {}", registry.defaultBackend(), e);
        }

        if (workerEnabled) {
            try {
                workerPool.start();
            } catch (Exception e) {
                log.error("Failed to start worker pool", e);
            }
        }

        try {
            leaseRecovery = taskScheduler.scheduleWithFixedDelay(this::recoverLeases, LEASE_RECOVERY_INTERVAL);
        } catch (Exception e) {
            log.error("Failed to schedule queue lease recovery", e);
        }
        running = true;
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("Stopping ClawTrigger process");
        if (backend != null) {
            try {
                backend.stop(true);
            } catch (Exception e) {
                log.error("Failed to stop scheduler backend", e);
            }
        }
        try {
            workerPool.stop(shutdownTimeout);
            executionWorker.shutdown();
            leaseHeartbeat.shutdown();
        } catch (Exception e) {
            log.error("Failed to stop worker pool", e);
        }
        if (schedulerEnabled) {
            try {
                lock.release(DueSubscriptionEvaluator.LOCK_NAME);
            } catch (Exception e) {
                log.error("Failed to release lock {}", DueSubscriptionEvaluator.LOCK_NAME, e);
            }
        }
        if (leaseRecovery != null) {
            leaseRecovery.cancel(false);
        }
        registry.clearActive();
        backend = null;
        running = false;
        log.info("ClawTrigger process stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 100;
    }

    private void checkDueSubscriptions() {
        try {
            evaluator.checkDueSubscriptions();
        } catch (Exception e) {
            log.error("Due subscription check failed", e);
        }
    }

    private void recoverLeases() {
        try {
            int recovered = queue.recoverExpiredLeases();
            if (recovered > 0) {
                log.info("Recovered {} job(s) with expired leases", recovered);
            }
        } catch (Exception e) {
            log.warn("Queue lease recovery failed: {}", e.getMessage());
        }
    }
}
