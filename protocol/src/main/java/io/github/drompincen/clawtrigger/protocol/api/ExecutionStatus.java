package io.github.drompincen.clawtrigger.protocol.api;

public enum ExecutionStatus {
    PENDING,
    RUNNING,
    RETRYING,
    COMPLETED,
    COMPLETED_SILENT,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == COMPLETED_SILENT || this == FAILED || this == CANCELLED;
    }
}
