package io.github.drompincen.clawtrigger.runtime.scheduler;

public class UnsupportedSchedulerOperationException extends UnsupportedOperationException {

    public UnsupportedSchedulerOperationException(String backendType, String operation) {
        super("Scheduler backend '" + backendType + "' does not support " + operation);
    }
}
