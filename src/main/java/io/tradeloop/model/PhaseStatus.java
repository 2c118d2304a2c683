package io.tradeloop.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PhaseStatus {
    PENDING("pending"),
    RUNNING("running"),
    SUCCESS("success"),
    FAILED("failed");

    private final String wireName;

    PhaseStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}
