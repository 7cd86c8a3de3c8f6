package me.golemcore.runtime.domain.trace;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.Session;
import me.golemcore.runtime.domain.model.TraceEvent;
import me.golemcore.runtime.domain.model.TraceEventKind;
import me.golemcore.runtime.port.outbound.TraceSinkPort;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds trace events for a session and forwards them to every configured
 * sink.
 *
 * <p>
 * Recording is best effort: a failing sink is logged and skipped, and never
 * fails the session or prevents other sinks from receiving the event. The
 * first failure of each sink is logged at WARN, later ones at DEBUG.
 */
@Slf4j
public class TraceRecorder {

    private final Clock clock;
    private final List<TraceSinkPort> sinks;
    private final Set<TraceSinkPort> failingSinks = ConcurrentHashMap.newKeySet();

    public TraceRecorder(Clock clock, List<TraceSinkPort> sinks) {
        this.clock = clock;
        this.sinks = sinks != null ? List.copyOf(sinks) : List.of();
    }

    /**
     * Emits an event for the session's current step.
     */
    public TraceEvent emit(Session session, TraceEventKind kind, Map<String, Object> payload) {
        Map<String, Object> safePayload = payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
                : Map.of();

        TraceEvent event = TraceEvent.builder()
                .sessionId(session.getId())
                .step(session.getStepCount())
                .sequence(session.nextTraceSequence())
                .kind(kind)
                .payload(safePayload)
                .timestamp(Instant.now(clock))
                .build();

        for (TraceSinkPort sink : sinks) {
            forward(sink, event);
        }
        return event;
    }

    public TraceEvent emit(Session session, TraceEventKind kind) {
        return emit(session, kind, Map.of());
    }

    private void forward(TraceSinkPort sink, TraceEvent event) {
        try {
            sink.record(event);
        } catch (RuntimeException e) { // NOSONAR - trace recording must be best effort
            if (failingSinks.add(sink)) {
                log.warn("[Trace] Sink {} failed, further failures logged at debug: {}",
                        sink.getClass().getSimpleName(), e.getMessage());
            } else {
                log.debug("[Trace] Sink {} failed for {} event: {}",
                        sink.getClass().getSimpleName(), event.kind().wireName(), e.getMessage());
            }
        }
    }
}
