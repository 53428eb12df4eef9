package io.github.drompincen.clawtrigger.protocol.api;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.time.Instant;

/**
 * Schedule parameters of a subscription. Which fields are populated depends on the trigger type:
 * cron uses {@code expression}/{@code timezone}, interval uses {@code intervalValue}/{@code intervalUnit}
 * (optionally capped by {@code maxExecutions}), one_time uses {@code executeAt}, and event uses
 * {@code eventType} with optional git filters.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TriggerConfig(
        String expression,
        String timezone,
        Integer intervalValue,
        IntervalUnit intervalUnit,
        Integer maxExecutions,
        Instant executeAt,
        String eventType,
        String repository,
        String branch
) {
    public static final String DEFAULT_CRON = "0 9 * * *";
    public static final String DEFAULT_TIMEZONE = "UTC";

    public static TriggerConfig empty() {
        return new TriggerConfig(null, null, null, null, null, null, null, null, null);
    }

    public static TriggerConfig cron(String expression, String timezone) {
        return new TriggerConfig(expression, timezone, null, null, null, null, null, null, null);
    }

    public static TriggerConfig interval(int value, IntervalUnit unit) {
        return interval(value, unit, null);
    }

    public static TriggerConfig interval(int value, IntervalUnit unit, Integer maxExecutions) {
        return new TriggerConfig(null, null, value, unit, maxExecutions, null, null, null, null);
    }

    public static TriggerConfig oneTime(Instant executeAt) {
        return new TriggerConfig(null, null, null, null, null, executeAt, null, null, null);
    }

    public static TriggerConfig event(String eventType) {
        return new TriggerConfig(null, null, null, null, null, null, eventType, null, null);
    }

    public static TriggerConfig gitPush(String repository, String branch) {
        return new TriggerConfig(null, null, null, null, null, null, "git_push", repository, branch);
    }

    public String cronExpressionOrDefault() {
        return expression != null && !expression.isBlank() ? expression.trim() : DEFAULT_CRON;
    }

    public String timezoneOrDefault() {
        return timezone != null && !timezone.isBlank() ? timezone.trim() : DEFAULT_TIMEZONE;
    }

    public int intervalValueOrDefault() {
        return intervalValue != null ? intervalValue : 1;
    }

    public IntervalUnit intervalUnitOrDefault() {
        return intervalUnit != null ? intervalUnit : IntervalUnit.HOURS;
    }

    public Duration intervalDuration() {
        return intervalUnitOrDefault().toDuration(intervalValueOrDefault());
    }
}
