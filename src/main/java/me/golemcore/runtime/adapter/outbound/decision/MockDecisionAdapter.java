package me.golemcore.runtime.adapter.outbound.decision;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.DecisionRequest;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic offline decision provider for local runs, evals and tests.
 *
 * <p>
 * Heuristics, checked against the latest transcript message:
 * <ul>
 * <li>a tool observation is turned into a final answer quoting it</li>
 * <li>a task containing an arithmetic expression asks the {@code calculator}
 * tool</li>
 * <li>a task asking to read a file asks the {@code file_read} tool</li>
 * <li>anything else gets a fixed final reply</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MockDecisionAdapter implements DecisionProviderAdapter {

    static final String NO_TOOL_REPLY = "I do not have a tool suited for this task.";

    private static final Pattern EXPRESSION = Pattern.compile("[-(]*\\d[\\d.\\s]*(?:[-+*/%^()\\s]+[\\d.]+[)\\s]*)+");
    private static final Pattern READ_FILE = Pattern.compile(
            "\\b(?:read|open|show)\\s+(?:the\\s+)?(?:file\\s+)?([\\w./-]+\\.\\w+)", Pattern.CASE_INSENSITIVE);
    private static final String CALCULATOR = "calculator";
    private static final String FILE_READ = "file_read";

    private final ObjectMapper objectMapper;

    @Override
    public String getProviderId() {
        return "mock";
    }

    @Override
    public CompletableFuture<String> decide(DecisionRequest request) {
        try {
            return CompletableFuture.completedFuture(decideNow(request));
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private String decideNow(DecisionRequest request) throws JsonProcessingException {
        List<Message> transcript = request.transcript();
        Message last = transcript.isEmpty() ? null : transcript.get(transcript.size() - 1);

        if (last != null && last.isObservation()) {
            return finalAnswer(answerFromObservation(last));
        }

        String task = latestTask(transcript);
        if (task == null) {
            return finalAnswer(NO_TOOL_REPLY);
        }

        Optional<String> expression = findExpression(task);
        if (expression.isPresent() && hasTool(request, CALCULATOR)) {
            log.debug("[Decision] Mock provider requests calculator for: {}", expression.get());
            return toolCall(CALCULATOR, Map.of("expression", expression.get()));
        }

        Matcher fileMatcher = READ_FILE.matcher(task);
        if (fileMatcher.find() && hasTool(request, FILE_READ)) {
            return toolCall(FILE_READ, Map.of("path", fileMatcher.group(1)));
        }

        return finalAnswer(NO_TOOL_REPLY);
    }

    private static String answerFromObservation(Message observation) {
        String content = observation.getContent() != null ? observation.getContent().strip() : "";
        if (observation.isError()) {
            return "I could not complete the task. " + content;
        }
        if (CALCULATOR.equals(observation.getToolName())) {
            return "The result is " + content + ".";
        }
        return "Tool " + observation.getToolName() + " returned: " + content;
    }

    static Optional<String> findExpression(String text) {
        Matcher matcher = EXPRESSION.matcher(text);
        while (matcher.find()) {
            String candidate = matcher.group().strip();
            if (candidate.matches(".*\\d\\s*[-+*/%^]\\s*[-(]*\\d.*") && balanced(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static boolean balanced(String candidate) {
        int depth = 0;
        for (char c : candidate.toCharArray()) {
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    private static String latestTask(List<Message> transcript) {
        for (int i = transcript.size() - 1; i >= 0; i--) {
            if (transcript.get(i).isUserMessage()) {
                return transcript.get(i).getContent();
            }
        }
        return null;
    }

    private static boolean hasTool(DecisionRequest request, String name) {
        for (ToolDefinition tool : request.catalog()) {
            if (name.equals(tool.getName())) {
                return true;
            }
        }
        return false;
    }

    private String toolCall(String tool, Map<String, Object> args) throws JsonProcessingException {
        Map<String, Object> action = new LinkedHashMap<>();
        action.put("action", "tool");
        action.put("tool", tool);
        action.put("args", args);
        return objectMapper.writeValueAsString(action);
    }

    private String finalAnswer(String content) throws JsonProcessingException {
        Map<String, Object> action = new LinkedHashMap<>();
        action.put("action", "final");
        action.put("content", content);
        return objectMapper.writeValueAsString(action);
    }
}
