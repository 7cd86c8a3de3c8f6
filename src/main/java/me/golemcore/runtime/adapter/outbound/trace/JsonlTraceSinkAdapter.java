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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.TraceEvent;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.TraceSinkPort;
import me.golemcore.runtime.security.SecretRedactor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Appends trace events to a local JSONL file, one JSON object per line.
 *
 * <p>
 * Lines are written under a lock so events from concurrent sessions never
 * interleave. Payloads pass through {@link SecretRedactor} unless redaction is
 * disabled. Does nothing when {@code runtime.trace.jsonl-enabled} is false.
 */
@Component
@Slf4j
public class JsonlTraceSinkAdapter implements TraceSinkPort {

    private final ObjectMapper objectMapper;
    private final SecretRedactor redactor;
    private final Path path;
    private final boolean enabled;
    private final boolean redact;
    private final Object writeLock = new Object();

    @Autowired
    public JsonlTraceSinkAdapter(RuntimeProperties properties, ObjectMapper objectMapper, SecretRedactor redactor) {
        this(objectMapper, redactor, RuntimeProperties.resolvePath(properties.getTrace().getJsonlPath()),
                properties.getTrace().isJsonlEnabled(), properties.getTrace().isRedactSecrets());
    }

    public JsonlTraceSinkAdapter(ObjectMapper objectMapper, SecretRedactor redactor, Path path, boolean enabled,
            boolean redact) {
        this.objectMapper = objectMapper;
        this.redactor = redactor;
        this.path = path;
        this.enabled = enabled;
        this.redact = redact;
        if (enabled) {
            log.info("[Trace] Writing JSONL trace to {}", path);
        }
    }

    @Override
    public void record(TraceEvent event) {
        if (!enabled) {
            return;
        }
        String line = toJsonLine(event);
        synchronized (writeLock) {
            try {
                Path parent = path.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(path, line + "\n", StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to append trace event to " + path, e);
            }
        }
    }

    private String toJsonLine(TraceEvent event) {
        Map<String, Object> payload = event.payload();
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("session_id", event.sessionId());
        line.put("step", event.step());
        line.put("sequence", event.sequence());
        line.put("kind", event.kind().wireName());
        line.put("payload", redact ? redactor.redact(payload) : payload);
        line.put("timestamp", event.timestamp() != null ? event.timestamp().toString() : null);
        try {
            return objectMapper.writeValueAsString(line);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize trace event", e);
        }
    }
}
