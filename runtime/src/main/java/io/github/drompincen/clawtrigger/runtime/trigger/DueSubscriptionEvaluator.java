package io.github.drompincen.clawtrigger.runtime.trigger;

import io.github.drompincen.clawtrigger.persistence.document.BackgroundExecutionDocument;
import io.github.drompincen.clawtrigger.persistence.document.SubscriptionDocument;
import io.github.drompincen.clawtrigger.persistence.repository.BackgroundExecutionRepository;
import io.github.drompincen.clawtrigger.persistence.repository.SubscriptionRepository;
import io.github.drompincen.clawtrigger.protocol.api.ExecutionStatus;
import io.github.drompincen.clawtrigger.protocol.api.TriggerType;
import io.github.drompincen.clawtrigger.runtime.execution.BackgroundExecutionService;
import io.github.drompincen.clawtrigger.runtime.execution.ExecutionMutation;
import io.github.drompincen.clawtrigger.runtime.lock.DistributedLock;
import io.github.drompincen.clawtrigger.runtime.lock.LockLease;
import io.github.drompincen.clawtrigger.runtime.queue.ExecutionQueue;
import io.github.drompincen.clawtrigger.runtime.subscription.NextExecutionTimeCalculator;
import io.github.drompincen.clawtrigger.runtime.subscription.ScheduleAdvance;
import io.github.drompincen.clawtrigger.runtime.subscription.SubscriptionStateStore;
import io.github.drompincen.clawtrigger.runtime.subscription.TriggerReasons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Periodic scan that turns due subscriptions into queued executions. One instance at a time holds
 * the {@value #LOCK_NAME} lease; the lock fails open, so a store outage can let several instances
 * scan, and the guarded schedule advance then cancels the losers' duplicate executions.
 */
@Service
public class DueSubscriptionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(DueSubscriptionEvaluator.class);

    public static final String LOCK_NAME = "check_due_subscriptions";
    static final Set<TriggerType> SCHEDULED_TYPES = EnumSet.of(TriggerType.CRON, TriggerType.INTERVAL, TriggerType.ONE_TIME);
    static final int STALE_PENDING_LIMIT = 50;
    static final Duration LOCK_EXTEND_AFTER = Duration.ofSeconds(30);

    private final DistributedLock lock;
    private final SubscriptionRepository subscriptionRepository;
    private final BackgroundExecutionRepository executionRepository;
    private final BackgroundExecutionService executionService;
    private final SubscriptionStateStore subscriptionStateStore;
    private final NextExecutionTimeCalculator calculator;
    private final ExecutionDispatcher dispatcher;
    private final ExecutionQueue queue;
    private final Duration lockTtl;
    private final int batchSize;
    private final Duration stalePending;
    private final Duration staleRunning;

    @Autowired
    public DueSubscriptionEvaluator(DistributedLock lock,
                                    SubscriptionRepository subscriptionRepository,
                                    BackgroundExecutionRepository executionRepository,
                                    BackgroundExecutionService executionService,
                                    SubscriptionStateStore subscriptionStateStore,
                                    NextExecutionTimeCalculator calculator,
                                    ExecutionDispatcher dispatcher,
                                    ExecutionQueue queue,
                                    @Value("${clawtrigger.trigger.lock-ttl-seconds:120}") long lockTtlSeconds,
                                    @Value("${clawtrigger.trigger.batch-size:100}") int batchSize,
                                    @Value("${clawtrigger.trigger.stale-pending-hours:2}") long stalePendingHours,
                                    @Value("${clawtrigger.trigger.stale-running-hours:3}") long staleRunningHours) {
        this.lock = lock;
        this.subscriptionRepository = subscriptionRepository;
        this.executionRepository = executionRepository;
        this.executionService = executionService;
        this.subscriptionStateStore = subscriptionStateStore;
        this.calculator = calculator;
        this.dispatcher = dispatcher;
        this.queue = queue;
        this.lockTtl = Duration.ofSeconds(lockTtlSeconds);
        this.batchSize = batchSize;
        this.stalePending = Duration.ofHours(stalePendingHours);
        this.staleRunning = Duration.ofHours(staleRunningHours);
    }

    public EvaluationSummary checkDueSubscriptions() {
        try (LockLease lease = lock.tryLease(LOCK_NAME, lockTtl)) {
            if (!lease.acquired()) {
                log.debug("Another instance is checking due subscriptions, skipping");
                return EvaluationSummary.SKIPPED;
            }
            Instant started = Instant.now();
            int recovered = recoverStalePending(started);
            int cleaned = cleanStaleRunning(started);

            int due = 0;
            int dispatched = 0;
            String afterId = "";
            Instant lastExtended = started;
            while (true) {
                List<SubscriptionDocument> page = subscriptionRepository
                        .findByEnabledTrueAndDeletedFalseAndTriggerTypeInAndNextExecutionTimeLessThanEqualAndSubscriptionIdGreaterThanOrderBySubscriptionIdAsc(
                                SCHEDULED_TYPES, started, afterId, PageRequest.of(0, batchSize));
                if (page.isEmpty()) {
                    break;
                }
                for (SubscriptionDocument subscription : page) {
                    due++;
                    try {
                        if (fire(subscription)) {
                            dispatched++;
                        }
                    } catch (Exception e) {
                        log.error("Failed to fire subscription {}", subscription.getSubscriptionId(), e);
                    }
                }
                afterId = page.get(page.size() - 1).getSubscriptionId();
                if (page.size() < batchSize) {
                    break;
                }
                Instant now = Instant.now();
                if (Duration.between(lastExtended, now).compareTo(LOCK_EXTEND_AFTER) > 0) {
                    lease.extend(lockTtl);
                    lastExtended = now;
                }
            }

            EvaluationSummary summary = new EvaluationSummary(false, due, dispatched, recovered, cleaned);
            if (due > 0 || recovered > 0 || cleaned > 0) {
                log.info("Checked due subscriptions: due={}, dispatched={}, recovered={}, cleaned={}",
                        due, dispatched, recovered, cleaned);
            }
            return summary;
        }
    }

    private boolean fire(SubscriptionDocument subscription) {
        BackgroundExecutionDocument execution = dispatcher.createExecution(
                subscription, TriggerReasons.scheduled(subscription), Map.of());

        // manual and event firings do not count toward maxExecutions
        long executionsSoFar = subscription.getScheduledRunCount() + 1;
        Instant now = Instant.now();
        ScheduleAdvance advance = calculator.advance(subscription, now, executionsSoFar);
        boolean advanced = subscriptionStateStore.advanceSchedule(subscription.getSubscriptionId(),
                subscription.getNextExecutionTime(), advance.nextExecutionTime(), advance.enabled(), now);
        if (!advanced) {
            log.warn("Subscription {} was claimed or changed concurrently, cancelling duplicate execution {}",
                    subscription.getSubscriptionId(), execution.getExecutionId());
            executionService.tryTransition(execution.getExecutionId(), execution.getVersion(),
                    ExecutionStatus.CANCELLED, ExecutionMutation.error("Superseded by a concurrent scheduler run"));
            return false;
        }
        dispatcher.enqueue(execution);
        log.debug("Subscription {} fired execution {}, next run {}",
                subscription.getSubscriptionId(), execution.getExecutionId(), advance.nextExecutionTime());
        return true;
    }

    private int recoverStalePending(Instant now) {
        List<BackgroundExecutionDocument> stale = executionRepository
                .findByStatusAndTaskIdAndCreatedAtLessThanOrderByCreatedAtAsc(
                        ExecutionStatus.PENDING, 0L, now.minus(stalePending), PageRequest.of(0, STALE_PENDING_LIMIT));
        int recovered = 0;
        for (BackgroundExecutionDocument execution : stale) {
            try {
                Optional<SubscriptionDocument> subscription = subscriptionRepository.findById(execution.getSubscriptionId());
                if (subscription.isEmpty() || subscription.get().isDeleted()) {
                    executionService.tryTransition(execution.getExecutionId(), execution.getVersion(),
                            ExecutionStatus.CANCELLED, ExecutionMutation.error("Subscription no longer exists"));
                    log.info("Cancelled stale execution {} of missing subscription {}",
                            execution.getExecutionId(), execution.getSubscriptionId());
                    recovered++;
                } else if (!queue.hasOutstanding(execution.getExecutionId())) {
                    dispatcher.enqueue(execution);
                    log.info("Re-dispatched stale pending execution {}", execution.getExecutionId());
                    recovered++;
                }
            } catch (Exception e) {
                log.error("Failed to recover stale execution {}", execution.getExecutionId(), e);
            }
        }
        return recovered;
    }

    private int cleanStaleRunning(Instant now) {
        List<BackgroundExecutionDocument> stale = executionRepository
                .findByStatusAndUpdatedAtLessThan(ExecutionStatus.RUNNING, now.minus(staleRunning));
        long hours = staleRunning.toHours();
        String message = "Execution timed out after " + hours + " hour(s) without completion";
        int cleaned = 0;
        for (BackgroundExecutionDocument execution : stale) {
            try {
                if (executionService.tryTransition(execution.getExecutionId(), execution.getVersion(),
                        ExecutionStatus.FAILED, ExecutionMutation.error(message)).applied()) {
                    log.warn("Marked stale running execution {} as failed", execution.getExecutionId());
                    cleaned++;
                }
            } catch (Exception e) {
                log.error("Failed to clean stale execution {}", execution.getExecutionId(), e);
            }
        }
        return cleaned;
    }
}
