package io.tradeloop.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionStatus {
    RUNNING("running"),
    SUCCESS("success"),
    FAILED("failed"),
    ERROR("error");

    private final String wireName;

    SessionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this != RUNNING;
    }

    @JsonCreator
    public static SessionStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return RUNNING;
        }
        for (SessionStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown session status: " + raw);
    }
}
