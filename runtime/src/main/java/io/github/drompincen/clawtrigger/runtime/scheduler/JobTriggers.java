package io.github.drompincen.clawtrigger.runtime.scheduler;

import io.github.drompincen.clawtrigger.protocol.api.IntervalUnit;
import io.github.drompincen.clawtrigger.protocol.api.TriggerConfig;
import io.github.drompincen.clawtrigger.protocol.api.TriggerType;
import io.github.drompincen.clawtrigger.runtime.subscription.CronExpressions;

import java.time.Instant;
import java.time.ZonedDateTime;

public final class JobTriggers {

    private JobTriggers() {}

    public static void requireSchedulable(TriggerType type, TriggerConfig config) {
        if (type == null || type == TriggerType.EVENT) {
            throw new IllegalArgumentException("Trigger type " + type + " cannot be scheduled");
        }
        if (type == TriggerType.ONE_TIME && (config == null || config.executeAt() == null)) {
            throw new IllegalArgumentException("One-time trigger needs executeAt");
        }
        if (type == TriggerType.INTERVAL && config != null && config.intervalValue() != null
                && config.intervalValue() <= 0) {
            throw new IllegalArgumentException("Interval must be positive: " + config.intervalValue());
        }
    }

    /** Next fire time strictly after {@code after}, or null when the trigger will not fire again. */
    public static Instant nextRun(TriggerType type, TriggerConfig config, Instant after) {
        TriggerConfig cfg = config != null ? config : TriggerConfig.empty();
        return switch (type) {
            case INTERVAL -> after.plus(cfg.intervalDuration());
            case CRON -> {
                ZonedDateTime next = CronExpressions.parse(cfg.cronExpressionOrDefault())
                        .next(after.atZone(CronExpressions.zoneOrUtc(cfg.timezoneOrDefault())));
                yield next != null ? next.toInstant() : null;
            }
            case ONE_TIME -> cfg.executeAt() != null && cfg.executeAt().isAfter(after) ? cfg.executeAt() : null;
            case EVENT -> throw new IllegalArgumentException("Event triggers cannot be scheduled");
        };
    }

    /** Six-field Quartz-style cron for admin-driven schedulers. */
    public static String toQuartzCron(TriggerType type, TriggerConfig config) {
        TriggerConfig cfg = config != null ? config : TriggerConfig.empty();
        if (type == TriggerType.CRON) {
            String expr = cfg.cronExpressionOrDefault();
            return expr.split("\\s+").length == 5 ? "0 " + expr : expr;
        }
        if (type == TriggerType.INTERVAL) {
            int value = cfg.intervalValueOrDefault();
            IntervalUnit unit = cfg.intervalUnitOrDefault();
            long seconds = unit.toDuration(value).getSeconds();
            if (unit == IntervalUnit.SECONDS && seconds < 60) {
                return "*/" + value + " * * * * ?";
            }
            return switch (unit) {
                case SECONDS -> "0 */" + Math.max(1, seconds / 60) + " * * * ?";
                case MINUTES -> "0 */" + value + " * * * ?";
                case HOURS -> "0 0 */" + value + " * * ?";
                case DAYS -> "0 0 0 */" + value + " * ?";
            };
        }
        throw new IllegalArgumentException("Trigger type " + type + " has no cron form");
    }
}
