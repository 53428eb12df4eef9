package io.github.drompincen.clawtrigger.runtime.execution;

import io.github.drompincen.clawtrigger.protocol.api.ExecutionStatus;

public class InvalidStateTransitionException extends RuntimeException {

    private final ExecutionStatus from;
    private final ExecutionStatus to;

    public InvalidStateTransitionException(ExecutionStatus from, ExecutionStatus to) {
        this(from, to, "Invalid state transition from " + from + " to " + to);
    }

    public InvalidStateTransitionException(ExecutionStatus from, ExecutionStatus to, String message) {
        super(message);
        this.from = from;
        this.to = to;
    }

    public ExecutionStatus getFrom() { return from; }
    public ExecutionStatus getTo() { return to; }
}
