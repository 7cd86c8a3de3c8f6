package me.golemcore.runtime.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Roles a transcript message can have.
 */
public enum MessageRole {

    SYSTEM("system"), USER("user"), ASSISTANT("assistant"), TOOL_OBSERVATION("tool_observation");

    private final String wireName;

    MessageRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
