package io.github.drompincen.clawtrigger.protocol.api;

import java.util.Map;

public record CreateSubscriptionRequest(
        String userId,
        String name,
        String description,
        TriggerType triggerType,
        TriggerConfig triggerConfig,
        String promptTemplate,
        Map<String, Object> promptVariables,
        Integer retryCount,
        Integer timeoutSeconds,
        Boolean enabled
) {}
