package io.github.drompincen.clawtrigger.runtime.worker;

public enum ProcessResult {
    SKIPPED,
    COMPLETED,
    RETRY_SCHEDULED,
    FAILED,
    CANCELLED
}
