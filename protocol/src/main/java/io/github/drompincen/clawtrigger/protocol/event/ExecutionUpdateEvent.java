package io.github.drompincen.clawtrigger.protocol.event;

import io.github.drompincen.clawtrigger.protocol.api.ExecutionStatus;

import java.time.Instant;

public record ExecutionUpdateEvent(
        String executionId,
        String subscriptionId,
        String userId,
        ExecutionStatus status,
        boolean silent,
        long taskId,
        String prompt,
        String resultSummary,
        String errorMessage,
        String triggerReason,
        Instant createdAt,
        Instant updatedAt
) {
    public static final String EVENT_NAME = "background:execution_update";

    public static String userTopic(String userId) {
        return "user:" + userId;
    }

    public String topic() {
        return userTopic(userId);
    }
}
