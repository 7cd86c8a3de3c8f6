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

import me.golemcore.runtime.domain.model.MemoryTurn;

import java.util.List;

/**
 * Port for long-lived conversation memory. Used only when memory is enabled
 * for the run; failures never fail a session.
 */
public interface MemoryPort {

    /**
     * Persists one turn of a session.
     */
    void append(String sessionId, MemoryTurn turn);

    /**
     * Returns at most {@code limit} stored snippets relevant to the query, most
     * relevant first.
     */
    List<String> search(String query, int limit);
}
