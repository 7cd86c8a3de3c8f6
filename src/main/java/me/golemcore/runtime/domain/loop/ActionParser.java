package me.golemcore.runtime.domain.loop;

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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.Action;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses raw decision text into an {@link Action}.
 *
 * <p>
 * Recognized forms:
 * <ul>
 * <li>{@code {"action":"tool","tool":"<name>","args":{...}}}</li>
 * <li>{@code {"action":"final","content":"<text>"}}</li>
 * <li>{@code {"tool_calls":[{"tool":"<name>","args":{...}}, ...]}}, where only
 * the first call is honored</li>
 * </ul>
 * A JSON array honors its first element, and JSON wrapped in a markdown code
 * fence is unwrapped first. Unknown fields are ignored. Everything else,
 * including structured output missing a required field, becomes
 * {@link Action.PlainText} with the raw text.
 */
@Slf4j
public class ActionParser {

    public static final String EMPTY_RESPONSE_MARKER = "(empty response)";

    private static final Pattern CODE_FENCE = Pattern.compile("^```[A-Za-z0-9_-]*\\s*(.*?)\\s*```$",
            Pattern.DOTALL);
    private static final TypeReference<LinkedHashMap<String, Object>> ARGS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ActionParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Action parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return new Action.PlainText(EMPTY_RESPONSE_MARKER);
        }

        JsonNode node = readJson(unwrapCodeFence(raw.strip()));
        if (node != null && node.isArray()) {
            node = node.size() > 0 ? node.get(0) : null;
        }
        if (node == null || !node.isObject()) {
            return new Action.PlainText(raw);
        }

        JsonNode toolCalls = node.get("tool_calls");
        if (!node.has("action") && toolCalls != null && toolCalls.isArray() && toolCalls.size() > 0) {
            if (toolCalls.size() > 1) {
                log.debug("[Runtime] Decision contained {} tool calls, honoring the first", toolCalls.size());
            }
            Action first = parseToolCall(toolCalls.get(0));
            return first != null ? first : new Action.PlainText(raw);
        }

        String kind = textOrNull(node.get("action"));
        if (kind == null) {
            return new Action.PlainText(raw);
        }
        Action action = null;
        switch (kind.strip().toLowerCase(Locale.ROOT)) {
        case "tool":
            action = parseToolCall(node);
            break;
        case "final":
            action = parseFinal(node);
            break;
        default:
            break;
        }
        return action != null ? action : new Action.PlainText(raw);
    }

    private Action parseToolCall(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        String tool = textOrNull(node.get("tool"));
        JsonNode args = node.get("args");
        if (tool == null || tool.isBlank() || args == null || !args.isObject()) {
            return null;
        }
        Map<String, Object> arguments = objectMapper.convertValue(args, ARGS_TYPE);
        return new Action.ToolCall(tool.strip(), arguments, textOrNull(node.get("content")));
    }

    private static Action parseFinal(JsonNode node) {
        JsonNode content = node.get("content");
        if (content == null || content.isNull() || content.isMissingNode()) {
            return null;
        }
        return new Action.Final(content.isTextual() ? content.asText() : content.toString());
    }

    private JsonNode readJson(String text) {
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String unwrapCodeFence(String text) {
        Matcher matcher = CODE_FENCE.matcher(text);
        return matcher.matches() ? matcher.group(1) : text;
    }

    private static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
