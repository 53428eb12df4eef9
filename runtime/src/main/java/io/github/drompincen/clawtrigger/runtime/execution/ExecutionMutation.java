package io.github.drompincen.clawtrigger.runtime.execution;

public record ExecutionMutation(String resultSummary, String errorMessage, Integer retryAttempt, Long taskId) {

    public static final ExecutionMutation NONE = new ExecutionMutation(null, null, null, null);

    public static ExecutionMutation result(String resultSummary) {
        return new ExecutionMutation(resultSummary, null, null, null);
    }

    public static ExecutionMutation error(String errorMessage) {
        return new ExecutionMutation(null, errorMessage, null, null);
    }

    public static ExecutionMutation retry(int retryAttempt, String errorMessage) {
        return new ExecutionMutation(null, errorMessage, retryAttempt, null);
    }

    public ExecutionMutation withTaskId(long taskId) {
        return new ExecutionMutation(resultSummary, errorMessage, retryAttempt, taskId);
    }
}
