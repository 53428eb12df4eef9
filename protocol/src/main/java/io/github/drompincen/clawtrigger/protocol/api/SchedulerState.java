package io.github.drompincen.clawtrigger.protocol.api;

public enum SchedulerState {
    STOPPED,
    RUNNING,
    PAUSED
}
