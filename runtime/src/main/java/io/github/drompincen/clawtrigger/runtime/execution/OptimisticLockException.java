package io.github.drompincen.clawtrigger.runtime.execution;

public class OptimisticLockException extends RuntimeException {

    private final String executionId;
    private final long expectedVersion;
    private final long actualVersion;

    public OptimisticLockException(String executionId, long expectedVersion, long actualVersion) {
        super("Execution " + executionId + " was modified concurrently (expected version "
                + expectedVersion + ", actual " + actualVersion + ")");
        this.executionId = executionId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getExecutionId() { return executionId; }
    public long getExpectedVersion() { return expectedVersion; }
    public long getActualVersion() { return actualVersion; }
}
