package me.golemcore.runtime.adapter.outbound.memory;

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
import me.golemcore.runtime.domain.model.MemoryTurn;
import me.golemcore.runtime.port.outbound.MemoryPort;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Process-local memory. Turns are kept in insertion order and searched by
 * token overlap; ties go to the most recent turn.
 */
@Slf4j
public class InMemoryMemoryAdapter implements MemoryPort {

    private final List<StoredTurn> turns = new ArrayList<>();

    @Override
    public void append(String sessionId, MemoryTurn turn) {
        if (turn == null || turn.content() == null || turn.content().isBlank()) {
            return;
        }
        add(new StoredTurn(sessionId, turn));
    }

    @Override
    public List<String> search(String query, int limit) {
        if (limit <= 0 || query == null || query.isBlank()) {
            return List.of();
        }
        List<ScoredTurn> scored = new ArrayList<>();
        synchronized (turns) {
            for (int i = 0; i < turns.size(); i++) {
                StoredTurn stored = turns.get(i);
                double score = TokenOverlapScorer.score(query, stored.turn().content());
                if (score > 0.0) {
                    scored.add(new ScoredTurn(stored, score, i));
                }
            }
        }
        scored.sort(Comparator.comparingDouble(ScoredTurn::score).reversed()
                .thenComparing(Comparator.comparingInt(ScoredTurn::position).reversed()));

        List<String> results = new ArrayList<>();
        for (ScoredTurn candidate : scored) {
            if (results.size() >= limit) {
                break;
            }
            results.add(candidate.stored().snippet());
        }
        log.debug("[Memory] {} of {} candidates returned for query", results.size(), scored.size());
        return results;
    }

    public int size() {
        synchronized (turns) {
            return turns.size();
        }
    }

    protected void add(StoredTurn stored) {
        synchronized (turns) {
            turns.add(stored);
        }
    }

    protected record StoredTurn(String sessionId, MemoryTurn turn) {

        String snippet() {
            return turn.role().wireName() + ": " + turn.content();
        }
    }

    private record ScoredTurn(StoredTurn stored, double score, int position) {
    }
}
