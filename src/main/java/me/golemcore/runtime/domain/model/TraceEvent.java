package me.golemcore.runtime.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable audit record emitted by the runtime. Events of one session are
 * ordered by step, then by {@code sequence}.
 */
@Builder
public record TraceEvent(String sessionId, int step, long sequence, TraceEventKind kind, Map<String, Object> payload,
        Instant timestamp) {
}
