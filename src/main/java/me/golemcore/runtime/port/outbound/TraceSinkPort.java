package me.golemcore.runtime.port.outbound;

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

import me.golemcore.runtime.domain.model.TraceEvent;

import java.util.List;

/**
 * Append-only destination for trace events. Implementations must accept
 * events from several sessions concurrently; a failing sink never fails a
 * session.
 */
public interface TraceSinkPort {

    void record(TraceEvent event);

    /**
     * Events recorded for a session in emission order. Sinks that cannot read
     * back return an empty list.
     */
    default List<TraceEvent> findBySession(String sessionId) {
        return List.of();
    }
}
