package io.github.drompincen.clawtrigger.runtime.execution;

public class ExecutionNotFoundException extends RuntimeException {

    public ExecutionNotFoundException(String executionId) {
        super("Background execution not found: " + executionId);
    }
}
