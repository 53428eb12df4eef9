package io.github.drompincen.clawtrigger.runtime.execution;

import io.github.drompincen.clawtrigger.persistence.document.BackgroundExecutionDocument;

public record TransitionOutcome(Result result, BackgroundExecutionDocument execution,
                                long expectedVersion, long actualVersion) {

    public enum Result { APPLIED, UNCHANGED, CONFLICT, NOT_FOUND }

    static TransitionOutcome applied(BackgroundExecutionDocument execution, long expectedVersion) {
        return new TransitionOutcome(Result.APPLIED, execution, expectedVersion, execution.getVersion());
    }

    static TransitionOutcome unchanged(BackgroundExecutionDocument execution) {
        return new TransitionOutcome(Result.UNCHANGED, execution, execution.getVersion(), execution.getVersion());
    }

    static TransitionOutcome conflict(BackgroundExecutionDocument current, long expectedVersion) {
        return new TransitionOutcome(Result.CONFLICT, current, expectedVersion, current.getVersion());
    }

    static TransitionOutcome notFound(long expectedVersion) {
        return new TransitionOutcome(Result.NOT_FOUND, null, expectedVersion, -1);
    }

    public boolean applied() {
        return result == Result.APPLIED;
    }
}
