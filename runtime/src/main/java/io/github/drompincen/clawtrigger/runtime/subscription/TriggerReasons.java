package io.github.drompincen.clawtrigger.runtime.subscription;

import io.github.drompincen.clawtrigger.persistence.document.SubscriptionDocument;
import io.github.drompincen.clawtrigger.protocol.api.TriggerConfig;

public final class TriggerReasons {

    public static final String MANUAL = "Manual trigger";

    private TriggerReasons() {}

    public static String scheduled(SubscriptionDocument subscription) {
        if (subscription.getTriggerType() == null) {
            return "Scheduled execution";
        }
        TriggerConfig config = subscription.getTriggerConfig() != null
                ? subscription.getTriggerConfig() : TriggerConfig.empty();
        return switch (subscription.getTriggerType()) {
            case CRON -> "Scheduled (cron: " + config.cronExpressionOrDefault() + ")";
            case INTERVAL -> "Scheduled (interval: " + config.intervalValueOrDefault() + " "
                    + config.intervalUnitOrDefault().wireName() + ")";
            case ONE_TIME -> "One-time scheduled execution";
            default -> "Scheduled execution";
        };
    }

    public static String event(String eventType) {
        return "Event: " + eventType;
    }
}
