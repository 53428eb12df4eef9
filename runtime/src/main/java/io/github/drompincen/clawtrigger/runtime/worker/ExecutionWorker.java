package io.github.drompincen.clawtrigger.runtime.worker;

import io.github.drompincen.clawtrigger.persistence.document.BackgroundExecutionDocument;
import io.github.drompincen.clawtrigger.persistence.document.QueuedJobDocument;
import io.github.drompincen.clawtrigger.persistence.document.SubscriptionDocument;
import io.github.drompincen.clawtrigger.persistence.repository.SubscriptionRepository;
import io.github.drompincen.clawtrigger.protocol.api.ExecutionStatus;
import io.github.drompincen.clawtrigger.runtime.breaker.CallResult;
import io.github.drompincen.clawtrigger.runtime.breaker.CircuitBreaker;
import io.github.drompincen.clawtrigger.runtime.breaker.CircuitBreakerRegistry;
import io.github.drompincen.clawtrigger.runtime.execution.BackgroundExecutionService;
import io.github.drompincen.clawtrigger.runtime.execution.ExecutionMutation;
import io.github.drompincen.clawtrigger.runtime.execution.InvalidStateTransitionException;
import io.github.drompincen.clawtrigger.runtime.execution.TransitionOutcome;
import io.github.drompincen.clawtrigger.runtime.queue.ExecutionQueue;
import io.github.drompincen.clawtrigger.runtime.queue.QueuedJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one queued execution: claims it with a versioned PENDING/RETRYING to RUNNING transition,
 * calls the {@link ExecutionHandler} through the {@code ai_service} breaker under a soft and a hard
 * timeout, then records the outcome. Deliveries of executions that are already running or finished
 * are acknowledged without doing anything, which makes redelivery harmless.
 */
@Component
public class ExecutionWorker implements QueuedJobHandler {

    private static final Logger log = LoggerFactory.getLogger(ExecutionWorker.class);

    static final String SERVICE_UNAVAILABLE = "AI service temporarily unavailable";
    private static final int CLAIM_ATTEMPTS = 3;
    private static final int RECORD_ATTEMPTS = 3;

    private final BackgroundExecutionService executionService;
    private final SubscriptionRepository subscriptionRepository;
    private final ExecutionHandler handler;
    private final CircuitBreakerRegistry breakers;
    private final ExecutionQueue queue;
    private final RetryPolicy retryPolicy;
    private final Duration defaultTimeout;
    private final Duration hardTimeoutGrace;
    private final ExecutorService runner;

    public ExecutionWorker(BackgroundExecutionService executionService,
                           SubscriptionRepository subscriptionRepository,
                           ExecutionHandler handler,
                           CircuitBreakerRegistry breakers,
                           ExecutionQueue queue,
                           RetryPolicy retryPolicy,
                           @Value("${clawtrigger.worker.default-timeout-seconds:600}") long defaultTimeoutSeconds,
                           @Value("${clawtrigger.worker.hard-timeout-grace-seconds:60}") long hardTimeoutGraceSeconds) {
        this.executionService = executionService;
        this.subscriptionRepository = subscriptionRepository;
        this.handler = handler;
        this.breakers = breakers;
        this.queue = queue;
        this.retryPolicy = retryPolicy;
        this.defaultTimeout = Duration.ofSeconds(defaultTimeoutSeconds);
        this.hardTimeoutGrace = Duration.ofSeconds(hardTimeoutGraceSeconds);
        AtomicInteger counter = new AtomicInteger();
        this.runner = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "clawtrigger-exec-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public QueuedJobDocument.Kind kind() {
        return QueuedJobDocument.Kind.EXECUTION;
    }

    @Override
    public void handle(QueuedJob job) {
        ProcessResult result = process(job.payload());
        log.debug("Job {} for execution {} finished with {}", job.jobId(), job.payload(), result);
    }

    public ProcessResult process(String executionId) {
        Optional<BackgroundExecutionDocument> running = claim(executionId);
        if (running.isEmpty()) {
            return ProcessResult.SKIPPED;
        }
        BackgroundExecutionDocument execution = running.get();
        Optional<SubscriptionDocument> subscription = subscriptionRepository.findById(execution.getSubscriptionId());
        if (subscription.isEmpty() || subscription.get().isDeleted()) {
            record(execution, ExecutionStatus.CANCELLED, ExecutionMutation.error("Subscription no longer exists"));
            return ProcessResult.CANCELLED;
        }
        int retryCount = subscription.get().getRetryCount();
        Duration timeout = subscription.get().getTimeoutSeconds() > 0
                ? Duration.ofSeconds(subscription.get().getTimeoutSeconds())
                : defaultTimeout;

        ExecutionContext context = new ExecutionContext(execution, timeout,
                () -> executionService.isCancelled(executionId));
        CallResult<ExecutionOutcome> result = invoke(context, timeout);

        if (result.isSuccess()) {
            ExecutionOutcome outcome = result.value();
            ExecutionStatus status = outcome.silent() ? ExecutionStatus.COMPLETED_SILENT : ExecutionStatus.COMPLETED;
            ExecutionMutation mutation = ExecutionMutation.result(outcome.summary());
            if (outcome.taskId() > 0) {
                mutation = mutation.withTaskId(outcome.taskId());
            }
            return record(execution, status, mutation) ? ProcessResult.COMPLETED : ProcessResult.CANCELLED;
        }

        boolean retriesLeft = execution.getRetryAttempt() < retryCount;
        if (result.isRejected()) {
            if (retriesLeft) {
                // remaining is zero while a half-open trial is in flight
                Duration remaining = result.rejection().getRemaining();
                Duration backoff = retryPolicy.delayFor(execution.getRetryAttempt() + 1);
                return scheduleRetry(execution, SERVICE_UNAVAILABLE,
                        remaining.compareTo(backoff) > 0 ? remaining : backoff);
            }
            return record(execution, ExecutionStatus.FAILED, ExecutionMutation.error(SERVICE_UNAVAILABLE))
                    ? ProcessResult.FAILED : ProcessResult.CANCELLED;
        }

        String error = errorText(result.error());
        if (retriesLeft) {
            return scheduleRetry(execution, error, retryPolicy.delayFor(execution.getRetryAttempt() + 1));
        }
        ExecutionMutation failed = new ExecutionMutation(context.partialSummary(), error, null, null);
        return record(execution, ExecutionStatus.FAILED, failed) ? ProcessResult.FAILED : ProcessResult.CANCELLED;
    }

    private Optional<BackgroundExecutionDocument> claim(String executionId) {
        for (int attempt = 1; attempt <= CLAIM_ATTEMPTS; attempt++) {
            Optional<BackgroundExecutionDocument> found = executionService.findById(executionId);
            if (found.isEmpty()) {
                log.warn("Execution {} no longer exists, dropping job", executionId);
                return Optional.empty();
            }
            BackgroundExecutionDocument current = found.get();
            ExecutionStatus status = current.getStatus();
            if (status.isTerminal()) {
                log.info("Execution {} already {}, skipping redelivered job", executionId, status);
                return Optional.empty();
            }
            if (status == ExecutionStatus.RUNNING) {
                log.info("Execution {} is already running elsewhere, skipping duplicate delivery", executionId);
                return Optional.empty();
            }
            TransitionOutcome outcome = executionService.tryTransition(executionId, current.getVersion(),
                    ExecutionStatus.RUNNING, ExecutionMutation.NONE);
            if (outcome.applied()) {
                return Optional.of(outcome.execution());
            }
            log.debug("Claim of execution {} conflicted (attempt {}/{})", executionId, attempt, CLAIM_ATTEMPTS);
        }
        log.warn("Could not claim execution {} after {} attempts", executionId, CLAIM_ATTEMPTS);
        return Optional.empty();
    }

    private CallResult<ExecutionOutcome> invoke(ExecutionContext context, Duration timeout) {
        CircuitBreaker breaker = breakers.getOrCreate(CircuitBreakerRegistry.AI_SERVICE);
        Future<CallResult<ExecutionOutcome>> future = runner.submit(() -> breaker.execute(() -> handler.execute(context)));
        try {
            try {
                return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException soft) {
                log.warn("Execution {} passed its {}s timeout, requesting cancellation",
                        context.executionId(), timeout.getSeconds());
                context.requestCancellation();
                return future.get(hardTimeoutGrace.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (TimeoutException hard) {
            future.cancel(true);
            log.error("Execution {} ignored cancellation, interrupted after {}s grace",
                    context.executionId(), hardTimeoutGrace.getSeconds());
            return CallResult.failure(new TimeoutException(
                    "Execution timed out after " + timeout.getSeconds() + " seconds"));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return CallResult.failure(e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            return CallResult.failure(cause instanceof Exception ex ? ex : new ExecutionHandlerException(
                    "Handler crashed: " + cause, cause));
        }
    }

    private ProcessResult scheduleRetry(BackgroundExecutionDocument execution, String error, Duration delay) {
        int nextAttempt = execution.getRetryAttempt() + 1;
        if (!record(execution, ExecutionStatus.RETRYING, ExecutionMutation.retry(nextAttempt, error))) {
            return ProcessResult.CANCELLED;
        }
        queue.enqueueExecution(execution.getExecutionId(), delay);
        log.info("Execution {} will retry (attempt {}) in {}s: {}",
                execution.getExecutionId(), nextAttempt, delay.getSeconds(), error);
        return ProcessResult.RETRY_SCHEDULED;
    }

    /** False when the execution was cancelled meanwhile; its status and stored result are left alone. */
    private boolean record(BackgroundExecutionDocument execution, ExecutionStatus next, ExecutionMutation mutation) {
        String executionId = execution.getExecutionId();
        try {
            TransitionOutcome outcome = executionService.tryTransition(executionId, execution.getVersion(), next, mutation);
            if (outcome.applied()) {
                return true;
            }
            executionService.transitionWithRetry(executionId, next, mutation, RECORD_ATTEMPTS);
            return true;
        } catch (InvalidStateTransitionException e) {
            if (executionService.isCancelled(executionId)) {
                log.info("Execution {} was cancelled while running, keeping CANCELLED", executionId);
                return false;
            }
            throw e;
        }
    }

    private static String errorText(Exception error) {
        if (error == null) {
            return "Unknown error";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    public void shutdown() {
        runner.shutdownNow();
    }
}
