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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.MemoryTurn;
import me.golemcore.runtime.domain.model.MessageRole;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Memory persisted to a local JSONL file. Existing lines are loaded at
 * construction; every append writes one line and updates the in-memory index
 * used for search.
 */
@Slf4j
public class JsonlMemoryAdapter extends InMemoryMemoryAdapter {

    private final ObjectMapper objectMapper;
    private final Path path;
    private final Object writeLock = new Object();

    public JsonlMemoryAdapter(ObjectMapper objectMapper, Path path) {
        this.objectMapper = objectMapper;
        this.path = path;
        load();
    }

    @Override
    public void append(String sessionId, MemoryTurn turn) {
        if (turn == null || turn.content() == null || turn.content().isBlank()) {
            return;
        }
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("session_id", sessionId);
        line.put("role", turn.role().wireName());
        line.put("content", turn.content());
        line.put("timestamp", turn.timestamp() != null ? turn.timestamp().toString() : null);
        synchronized (writeLock) {
            try {
                Path parent = path.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(path, objectMapper.writeValueAsString(line) + "\n", StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to append memory turn to " + path, e);
            }
        }
        add(new StoredTurn(sessionId, turn));
    }

    private void load() {
        if (!Files.isRegularFile(path)) {
            return;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read memory file " + path, e);
        }
        int skipped = 0;
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            try {
                JsonNode node = objectMapper.readTree(line);
                MessageRole role = parseRole(node.path("role").asText(null));
                String content = node.path("content").asText(null);
                if (role == null || content == null) {
                    skipped++;
                    continue;
                }
                String timestamp = node.path("timestamp").asText(null);
                add(new StoredTurn(node.path("session_id").asText(null),
                        new MemoryTurn(role, content, timestamp != null ? Instant.parse(timestamp) : null)));
            } catch (JsonProcessingException | RuntimeException e) {
                skipped++;
            }
        }
        log.info("[Memory] Loaded {} turns from {}{}", size(), path,
                skipped > 0 ? " (" + skipped + " malformed lines skipped)" : "");
    }

    private static MessageRole parseRole(String wireName) {
        if (wireName == null) {
            return null;
        }
        for (MessageRole role : MessageRole.values()) {
            if (role.wireName().equals(wireName)) {
                return role;
            }
        }
        return null;
    }
}
