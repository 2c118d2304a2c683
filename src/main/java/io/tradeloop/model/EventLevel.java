package io.tradeloop.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EventLevel {
    DEBUG("debug"),
    INFO("info"),
    WARNING("warning"),
    ERROR("error"),
    CRITICAL("critical");

    private final String wireName;

    EventLevel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static EventLevel fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return INFO;
        }
        for (EventLevel value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        // "warn" shows up in hand-edited logs
        if ("warn".equalsIgnoreCase(raw)) {
            return WARNING;
        }
        throw new IllegalArgumentException("Unknown event level: " + raw);
    }
}
