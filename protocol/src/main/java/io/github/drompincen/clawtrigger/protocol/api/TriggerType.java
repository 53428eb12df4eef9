package io.github.drompincen.clawtrigger.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TriggerType {
    CRON("cron"),
    INTERVAL("interval"),
    ONE_TIME("one_time"),
    EVENT("event");

    private final String wireName;

    TriggerType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Accepts the wire name, the enum name, and "date" as an alias for one-time. */
    @JsonCreator
    public static TriggerType fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Trigger type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("date".equals(normalized)) {
            return ONE_TIME;
        }
        for (TriggerType type : values()) {
            if (type.wireName.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown trigger type: " + value);
    }
}
