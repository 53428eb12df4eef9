package io.github.drompincen.clawtrigger.runtime.worker;

public record ExecutionOutcome(String summary, boolean silent, long taskId) {

    public static ExecutionOutcome completed(String summary) {
        return new ExecutionOutcome(summary, false, 0);
    }

    public static ExecutionOutcome silent(String summary) {
        return new ExecutionOutcome(summary, true, 0);
    }

    public ExecutionOutcome withTaskId(long id) {
        return new ExecutionOutcome(summary, silent, id);
    }
}
