package io.github.drompincen.clawtrigger.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.Locale;

public enum IntervalUnit {
    SECONDS,
    MINUTES,
    HOURS,
    DAYS;

    public Duration toDuration(long value) {
        return switch (this) {
            case SECONDS -> Duration.ofSeconds(value);
            case MINUTES -> Duration.ofMinutes(value);
            case HOURS -> Duration.ofHours(value);
            case DAYS -> Duration.ofDays(value);
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IntervalUnit fromWire(String value) {
        if (value == null || value.isBlank()) {
            return HOURS;
        }
        return IntervalUnit.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
