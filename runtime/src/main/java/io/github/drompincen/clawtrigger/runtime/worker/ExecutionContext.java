package io.github.drompincen.clawtrigger.runtime.worker;

import io.github.drompincen.clawtrigger.persistence.document.BackgroundExecutionDocument;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Handed to an {@link ExecutionHandler} for one run. Handlers should poll {@link #isCancellationRequested()}
 * and report partial output through {@link #reportProgress} so a timed-out or cancelled run keeps it.
 */
public class ExecutionContext {

    private final BackgroundExecutionDocument execution;
    private final Duration timeout;
    private final BooleanSupplier cancelledExternally;
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private volatile String partialSummary;

    public ExecutionContext(BackgroundExecutionDocument execution, Duration timeout, BooleanSupplier cancelledExternally) {
        this.execution = execution;
        this.timeout = timeout;
        this.cancelledExternally = cancelledExternally;
    }

    public String executionId() { return execution.getExecutionId(); }
    public String subscriptionId() { return execution.getSubscriptionId(); }
    public String userId() { return execution.getUserId(); }
    public String prompt() { return execution.getPrompt(); }
    public int retryAttempt() { return execution.getRetryAttempt(); }
    public Duration timeout() { return timeout; }

    public void requestCancellation() {
        cancelRequested.set(true);
    }

    /** True once the soft timeout passed or a user cancelled the execution. */
    public boolean isCancellationRequested() {
        if (cancelRequested.get()) {
            return true;
        }
        if (cancelledExternally.getAsBoolean()) {
            cancelRequested.set(true);
            return true;
        }
        return false;
    }

    public void reportProgress(String summarySoFar) {
        this.partialSummary = summarySoFar;
    }

    public String partialSummary() {
        return partialSummary;
    }
}
