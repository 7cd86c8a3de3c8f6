package me.golemcore.runtime.domain.model;

import java.time.Instant;

/**
 * A conversation turn persisted through the memory port.
 */
public record MemoryTurn(MessageRole role, String content, Instant timestamp) {
}
