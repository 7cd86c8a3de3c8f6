package me.golemcore.runtime.adapter.outbound.trace;

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
import me.golemcore.runtime.domain.model.TraceEvent;
import me.golemcore.runtime.port.outbound.TraceSinkPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps trace events in memory, grouped per session, for the HTTP API and
 * tests. Only the most recent sessions are retained.
 */
@Component
@Slf4j
public class InMemoryTraceSinkAdapter implements TraceSinkPort {

    static final int DEFAULT_MAX_SESSIONS = 200;

    private final int maxSessions;
    private final Map<String, List<TraceEvent>> eventsBySession;

    public InMemoryTraceSinkAdapter() {
        this(DEFAULT_MAX_SESSIONS);
    }

    InMemoryTraceSinkAdapter(int maxSessions) {
        this.maxSessions = maxSessions;
        this.eventsBySession = new LinkedHashMap<>(16, 0.75f, false) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, List<TraceEvent>> eldest) {
                boolean evict = size() > InMemoryTraceSinkAdapter.this.maxSessions;
                if (evict) {
                    log.debug("[Trace] Evicting in-memory trace of session {}", eldest.getKey());
                }
                return evict;
            }
        };
    }

    @Override
    public synchronized void record(TraceEvent event) {
        eventsBySession.computeIfAbsent(event.sessionId(), id -> new ArrayList<>()).add(event);
    }

    @Override
    public synchronized List<TraceEvent> findBySession(String sessionId) {
        List<TraceEvent> events = eventsBySession.get(sessionId);
        return events != null ? List.copyOf(events) : List.of();
    }

    public synchronized boolean hasSession(String sessionId) {
        return eventsBySession.containsKey(sessionId);
    }
}
