package com.socialgenius.browseruse.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of an automation task. Transitions only ever go from {@link #PENDING}
 * to one of the terminal states.
 */
public enum TaskStatus {
    PENDING("pending"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }
}
