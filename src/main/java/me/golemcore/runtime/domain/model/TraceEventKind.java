package me.golemcore.runtime.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stable trace event kinds emitted by the runtime.
 */
public enum TraceEventKind {

    SESSION_STARTED("session_started"),

    DECISION_REQUESTED("decision_requested"),

    DECISION_RECEIVED("decision_received"),

    POLICY_CHECKED("policy_checked"),

    TOOL_EXECUTED("tool_executed"),

    TOOL_FAILED("tool_failed"),

    OBSERVATION_TRUNCATED("observation_truncated"),

    FINAL_RETURNED("final_returned"),

    STEP_LIMIT_HIT("step_limit_hit"),

    SESSION_FAILED("session_failed"),

    MEMORY_FAILED("memory_failed");

    private final String wireName;

    TraceEventKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
