package me.golemcore.runtime.security;

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

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks credentials in text and structured trace payloads before they are
 * persisted. Covers {@code key=value} and {@code key: value} pairs for common
 * secret names (quoted or JSON style), bearer tokens and {@code sk-} API keys.
 */
@Component
public class SecretRedactor {

    public static final String MASK = "[REDACTED]";

    private static final Pattern KEY_VALUE = Pattern.compile(
            "\\b(password|passwd|secret|token|access_token|api[_-]?key)([\"']?\\s*[:=]\\s*[\"']?)([^\"'\\s,;&}]+)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern BEARER = Pattern.compile("(Bearer\\s+)[A-Za-z0-9\\-._~+/]+=*",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern SK_KEY = Pattern.compile("\\bsk-[A-Za-z0-9_-]{8,}");

    private static final Set<String> SENSITIVE_KEYS = Set.of(
            "password", "passwd", "secret", "token", "access_token", "api_key", "apikey", "api-key",
            "authorization");

    public String redact(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = KEY_VALUE.matcher(text).replaceAll("$1$2" + MASK);
        result = BEARER.matcher(result).replaceAll("$1" + MASK);
        return SK_KEY.matcher(result).replaceAll(MASK);
    }

    /**
     * Returns a redacted deep copy of a payload. Values under sensitive keys are
     * replaced entirely; strings elsewhere are scanned with {@link #redact}.
     */
    public Map<String, Object> redact(Map<String, Object> payload) {
        if (payload == null) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : payload.entrySet()) {
            String key = entry.getKey();
            if (key != null && SENSITIVE_KEYS.contains(key.toLowerCase(Locale.ROOT)) && entry.getValue() != null) {
                copy.put(key, MASK);
            } else {
                copy.put(key, redactValue(entry.getValue()));
            }
        }
        return copy;
    }

    @SuppressWarnings("unchecked")
    private Object redactValue(Object value) {
        if (value instanceof String text) {
            return redact(text);
        }
        if (value instanceof Map<?, ?> map) {
            return redact((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(redactValue(item));
            }
            return copy;
        }
        return value;
    }
}
