package io.github.drompincen.clawtrigger.runtime.execution;

import io.github.drompincen.clawtrigger.persistence.document.BackgroundExecutionDocument;
import io.github.drompincen.clawtrigger.persistence.document.SubscriptionDocument;
import io.github.drompincen.clawtrigger.persistence.repository.BackgroundExecutionRepository;
import io.github.drompincen.clawtrigger.protocol.api.ExecutionStatus;
import io.github.drompincen.clawtrigger.runtime.event.ExecutionEventEmitter;
import io.github.drompincen.clawtrigger.runtime.subscription.SubscriptionStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates background executions and moves them through {@link ExecutionStateMachine} with
 * optimistic versioning. Every accepted transition updates subscription statistics where relevant
 * and is published through the {@link ExecutionEventEmitter}.
 */
@Service
public class BackgroundExecutionService {

    private static final Logger log = LoggerFactory.getLogger(BackgroundExecutionService.class);
    public static final String CANCELLED_BY_USER = "Cancelled by user";

    private final ExecutionStore executionStore;
    private final BackgroundExecutionRepository executionRepository;
    private final SubscriptionStateStore subscriptionStateStore;
    private final ExecutionEventEmitter eventEmitter;

    public BackgroundExecutionService(ExecutionStore executionStore,
                                      BackgroundExecutionRepository executionRepository,
                                      SubscriptionStateStore subscriptionStateStore,
                                      ExecutionEventEmitter eventEmitter) {
        this.executionStore = executionStore;
        this.executionRepository = executionRepository;
        this.subscriptionStateStore = subscriptionStateStore;
        this.eventEmitter = eventEmitter;
    }

    public BackgroundExecutionDocument create(SubscriptionDocument subscription, String triggerReason, String prompt) {
        Instant now = Instant.now();
        BackgroundExecutionDocument execution = new BackgroundExecutionDocument();
        execution.setExecutionId(UUID.randomUUID().toString());
        execution.setSubscriptionId(subscription.getSubscriptionId());
        execution.setUserId(subscription.getUserId());
        execution.setTaskId(0);
        execution.setTriggerType(subscription.getTriggerType());
        execution.setTriggerReason(triggerReason);
        execution.setPrompt(prompt);
        execution.setStatus(ExecutionStatus.PENDING);
        execution.setVersion(0);
        execution.setCreatedAt(now);
        execution.setUpdatedAt(now);

        BackgroundExecutionDocument saved = executionStore.insert(execution);
        log.info("Created execution {} for subscription {} ({})",
                saved.getExecutionId(), subscription.getSubscriptionId(), triggerReason);
        eventEmitter.emit(saved);
        return saved;
    }

    /**
     * Attempts {@code next} against the record read at {@code expectedVersion}.
     *
     * @throws InvalidStateTransitionException if the stored status does not allow {@code next}
     */
    public TransitionOutcome tryTransition(String executionId, long expectedVersion, ExecutionStatus next,
                                           ExecutionMutation details) {
        Optional<BackgroundExecutionDocument> found = executionStore.findById(executionId);
        if (found.isEmpty()) {
            return TransitionOutcome.notFound(expectedVersion);
        }
        BackgroundExecutionDocument current = found.get();
        if (current.getVersion() != expectedVersion) {
            log.debug("Version conflict on execution {}: expected {}, actual {}",
                    executionId, expectedVersion, current.getVersion());
            return TransitionOutcome.conflict(current, expectedVersion);
        }
        ExecutionStateMachine.requireTransition(current.getStatus(), next);
        if (current.getStatus() == next) {
            return TransitionOutcome.unchanged(current);
        }

        Instant now = Instant.now();
        Optional<BackgroundExecutionDocument> updated = executionStore.compareAndSet(
                executionId, expectedVersion, current.getStatus(), next, details, now);
        if (updated.isEmpty()) {
            return executionStore.findById(executionId)
                    .map(latest -> TransitionOutcome.conflict(latest, expectedVersion))
                    .orElseGet(() -> TransitionOutcome.notFound(expectedVersion));
        }

        BackgroundExecutionDocument execution = updated.get();
        log.info("Execution {} {} -> {} (version {})",
                executionId, current.getStatus(), next, execution.getVersion());
        if (subscriptionStateStore.recordOutcome(execution.getSubscriptionId(), next, now)) {
            log.debug("Updated statistics of subscription {} with {}", execution.getSubscriptionId(), next);
        }
        eventEmitter.emit(execution);
        return TransitionOutcome.applied(execution, expectedVersion);
    }

    /**
     * Exception-raising form of {@link #tryTransition}.
     *
     * @throws OptimisticLockException when the stored version differs from {@code expectedVersion}
     * @throws ExecutionNotFoundException when no such execution exists
     */
    public BackgroundExecutionDocument transition(String executionId, long expectedVersion, ExecutionStatus next,
                                                  ExecutionMutation details) {
        TransitionOutcome outcome = tryTransition(executionId, expectedVersion, next, details);
        return switch (outcome.result()) {
            case APPLIED, UNCHANGED -> outcome.execution();
            case CONFLICT -> throw new OptimisticLockException(executionId, expectedVersion, outcome.actualVersion());
            case NOT_FOUND -> throw new ExecutionNotFoundException(executionId);
        };
    }

    /**
     * Rereads and retries on version conflicts. When every attempt conflicts the execution is marked
     * FAILED with a descriptive message instead of surfacing the conflict.
     */
    public BackgroundExecutionDocument transitionWithRetry(String executionId, ExecutionStatus next,
                                                           ExecutionMutation details, int maxAttempts) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            BackgroundExecutionDocument current = executionStore.findById(executionId)
                    .orElseThrow(() -> new ExecutionNotFoundException(executionId));
            if (current.getStatus() == next) {
                return current;
            }
            TransitionOutcome outcome = tryTransition(executionId, current.getVersion(), next, details);
            switch (outcome.result()) {
                case APPLIED, UNCHANGED:
                    return outcome.execution();
                case NOT_FOUND:
                    throw new ExecutionNotFoundException(executionId);
                case CONFLICT:
                    log.debug("Retrying transition of execution {} to {} (attempt {}/{})",
                            executionId, next, attempt, maxAttempts);
                    break;
            }
        }
        log.warn("Giving up moving execution {} to {} after {} conflicting attempts", executionId, next, maxAttempts);
        return failAfterConflicts(executionId, next, maxAttempts);
    }

    private BackgroundExecutionDocument failAfterConflicts(String executionId, ExecutionStatus wanted, int attempts) {
        BackgroundExecutionDocument current = executionStore.findById(executionId)
                .orElseThrow(() -> new ExecutionNotFoundException(executionId));
        if (!ExecutionStateMachine.validateTransition(current.getStatus(), ExecutionStatus.FAILED)) {
            return current;
        }
        String message = "Could not record status " + wanted + " after " + attempts
                + " concurrent modification attempts";
        TransitionOutcome outcome = tryTransition(executionId, current.getVersion(), ExecutionStatus.FAILED,
                ExecutionMutation.error(message));
        return outcome.execution() != null ? outcome.execution() : current;
    }

    public BackgroundExecutionDocument cancel(String executionId) {
        BackgroundExecutionDocument current = executionStore.findById(executionId)
                .orElseThrow(() -> new ExecutionNotFoundException(executionId));
        if (current.getStatus().isTerminal()) {
            throw new InvalidStateTransitionException(current.getStatus(), ExecutionStatus.CANCELLED,
                    "Cannot cancel execution in terminal state " + current.getStatus());
        }
        return transitionWithRetry(executionId, ExecutionStatus.CANCELLED,
                ExecutionMutation.error(CANCELLED_BY_USER), 3);
    }

    public boolean isCancelled(String executionId) {
        return executionStore.findById(executionId)
                .map(e -> e.getStatus() == ExecutionStatus.CANCELLED)
                .orElse(false);
    }

    public Optional<BackgroundExecutionDocument> findById(String executionId) {
        return executionStore.findById(executionId);
    }

    public List<BackgroundExecutionDocument> listBySubscription(String subscriptionId) {
        return executionRepository.findBySubscriptionIdOrderByCreatedAtDesc(subscriptionId);
    }
}
