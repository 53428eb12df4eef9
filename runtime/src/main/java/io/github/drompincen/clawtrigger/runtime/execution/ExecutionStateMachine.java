package io.github.drompincen.clawtrigger.runtime.execution;

import io.github.drompincen.clawtrigger.protocol.api.ExecutionStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static io.github.drompincen.clawtrigger.protocol.api.ExecutionStatus.*;

public final class ExecutionStateMachine {

    private static final Map<ExecutionStatus, Set<ExecutionStatus>> TRANSITIONS = new EnumMap<>(ExecutionStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(RUNNING, CANCELLED, FAILED));
        TRANSITIONS.put(RUNNING, EnumSet.of(COMPLETED, COMPLETED_SILENT, FAILED, RETRYING, CANCELLED));
        TRANSITIONS.put(RETRYING, EnumSet.of(RUNNING, FAILED, CANCELLED, COMPLETED_SILENT));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(ExecutionStatus.class));
        TRANSITIONS.put(COMPLETED_SILENT, EnumSet.noneOf(ExecutionStatus.class));
        TRANSITIONS.put(FAILED, EnumSet.noneOf(ExecutionStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(ExecutionStatus.class));
    }

    private ExecutionStateMachine() {}

    public static boolean validateTransition(ExecutionStatus current, ExecutionStatus next) {
        if (current == next) {
            return true;
        }
        return TRANSITIONS.getOrDefault(current, Set.of()).contains(next);
    }

    public static void requireTransition(ExecutionStatus current, ExecutionStatus next) {
        if (!validateTransition(current, next)) {
            throw new InvalidStateTransitionException(current, next);
        }
    }

    public static boolean isTerminal(ExecutionStatus status) {
        return status.isTerminal();
    }

    public static Set<ExecutionStatus> allowedTransitions(ExecutionStatus status) {
        return Collections.unmodifiableSet(TRANSITIONS.getOrDefault(status, Set.of()));
    }
}
