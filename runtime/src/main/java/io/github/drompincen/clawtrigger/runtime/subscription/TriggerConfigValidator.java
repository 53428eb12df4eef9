package io.github.drompincen.clawtrigger.runtime.subscription;

import io.github.drompincen.clawtrigger.protocol.api.TriggerConfig;
import io.github.drompincen.clawtrigger.protocol.api.TriggerType;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Set;

@Component
public class TriggerConfigValidator {

    public static final Set<String> EVENT_TYPES = Set.of("webhook", "git_push");

    private final Clock clock;

    public TriggerConfigValidator() {
        this(Clock.systemUTC());
    }

    TriggerConfigValidator(Clock clock) {
        this.clock = clock;
    }

    public void validate(TriggerType type, TriggerConfig config) {
        if (type == null) {
            throw new InvalidTriggerConfigException("Trigger type is required");
        }
        TriggerConfig cfg = config != null ? config : TriggerConfig.empty();
        switch (type) {
            case CRON -> validateCron(cfg);
            case INTERVAL -> validateInterval(cfg);
            case ONE_TIME -> validateOneTime(cfg);
            case EVENT -> validateEvent(cfg);
        }
    }

    private void validateCron(TriggerConfig cfg) {
        try {
            CronExpressions.parse(cfg.cronExpressionOrDefault());
        } catch (IllegalArgumentException e) {
            throw new InvalidTriggerConfigException("Invalid cron expression '" + cfg.expression() + "': "
                    + e.getMessage(), e);
        }
        if (cfg.timezone() != null) {
            try {
                ZoneId.of(cfg.timezone().trim());
            } catch (DateTimeException e) {
                throw new InvalidTriggerConfigException("Unknown timezone: " + cfg.timezone(), e);
            }
        }
    }

    private void validateInterval(TriggerConfig cfg) {
        if (cfg.intervalValue() != null && cfg.intervalValue() <= 0) {
            throw new InvalidTriggerConfigException("Interval value must be positive, got " + cfg.intervalValue());
        }
        if (cfg.maxExecutions() != null && cfg.maxExecutions() <= 0) {
            throw new InvalidTriggerConfigException("maxExecutions must be positive, got " + cfg.maxExecutions());
        }
    }

    private void validateOneTime(TriggerConfig cfg) {
        if (cfg.executeAt() == null) {
            throw new InvalidTriggerConfigException("executeAt is required for one_time triggers");
        }
        if (!cfg.executeAt().isAfter(Instant.now(clock))) {
            throw new InvalidTriggerConfigException("executeAt must be in the future: " + cfg.executeAt());
        }
    }

    private void validateEvent(TriggerConfig cfg) {
        if (cfg.eventType() == null || !EVENT_TYPES.contains(cfg.eventType())) {
            throw new InvalidTriggerConfigException("Unknown event type: " + cfg.eventType()
                    + " (expected one of " + EVENT_TYPES + ")");
        }
    }
}
