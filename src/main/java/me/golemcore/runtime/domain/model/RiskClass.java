package me.golemcore.runtime.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Risk classification of a tool, consumed by the policy gate.
 */
public enum RiskClass {

    /** No side effects outside the process. */
    PURE("pure"),

    FILESYSTEM_READ("filesystem-read"),

    FILESYSTEM_WRITE("filesystem-write"),

    NETWORK("network");

    private final String wireName;

    RiskClass(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
