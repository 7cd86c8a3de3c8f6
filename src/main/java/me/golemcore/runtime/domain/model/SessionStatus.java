package me.golemcore.runtime.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle states of a {@link Session}. Every state except {@link #RUNNING}
 * is terminal.
 */
public enum SessionStatus {

    RUNNING("running"), COMPLETED("completed"), FAILED("failed"), STEP_LIMIT_REACHED("step_limit_reached");

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
}
