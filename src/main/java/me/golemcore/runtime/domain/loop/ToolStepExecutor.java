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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.model.Action;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.PolicyDecision;
import me.golemcore.runtime.domain.model.Session;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolFailureKind;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.domain.model.TraceEventKind;
import me.golemcore.runtime.domain.model.ValidatedArgs;
import me.golemcore.runtime.domain.policy.PolicyGate;
import me.golemcore.runtime.domain.tool.SchemaValidationException;
import me.golemcore.runtime.domain.tool.ToolRegistry;
import me.golemcore.runtime.domain.tool.UnknownToolException;
import me.golemcore.runtime.domain.trace.TraceRecorder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Handles one tool-call step: resolve, validate, authorize, execute, and
 * append exactly one observation to the transcript.
 *
 * <p>
 * A tool executes only right after the policy gate allowed it for the same
 * tool, arguments and session. Unknown tools and schema violations never reach
 * the policy gate; denied calls never reach the executor. Every failure becomes
 * an error observation the model can react to.
 */
@Slf4j
public class ToolStepExecutor {

    static final String DENIED_PREFIX = "Denied by policy: ";

    private final ToolRegistry registry;
    private final PolicyGate policyGate;
    private final TraceRecorder trace;
    private final TranscriptWriter transcriptWriter;
    private final Executor workerPool;
    private final Clock clock;

    public ToolStepExecutor(ToolRegistry registry, PolicyGate policyGate, TraceRecorder trace,
            TranscriptWriter transcriptWriter, Executor workerPool, Clock clock) {
        this.registry = registry;
        this.policyGate = policyGate;
        this.trace = trace;
        this.transcriptWriter = transcriptWriter;
        this.workerPool = workerPool;
        this.clock = clock;
    }

    /**
     * Runs the tool call and appends its observation.
     *
     * @param deadline
     *            session deadline, or {@code null} when unbounded
     * @return the appended observation
     */
    public Message execute(Session session, Action.ToolCall call, CancellationToken token, Instant deadline) {
        String toolName = call.toolName();

        ToolComponent tool;
        try {
            tool = registry.resolve(toolName);
        } catch (UnknownToolException e) {
            String available = registry.names().isEmpty() ? "none" : String.join(", ", registry.names());
            return fail(session, toolName, ToolFailureKind.UNKNOWN_TOOL, "resolve",
                    "Unknown tool '" + toolName + "'. Available tools: " + available);
        }

        ToolDefinition definition = tool.getDefinition();
        ValidatedArgs args;
        try {
            args = registry.validate(definition, call.arguments());
        } catch (SchemaValidationException e) {
            return fail(session, toolName, ToolFailureKind.SCHEMA_ERROR, "validate", e.getMessage());
        }

        PolicyDecision decision = policyGate.authorize(definition, args, session);
        Map<String, Object> policyPayload = new LinkedHashMap<>();
        policyPayload.put("tool", toolName);
        policyPayload.put("args", args.asMap());
        policyPayload.put("result", decision.allowed() ? "allow" : "deny");
        if (decision.denied()) {
            policyPayload.put("reason", decision.reason());
        }
        trace.emit(session, TraceEventKind.POLICY_CHECKED, policyPayload);

        if (decision.denied()) {
            log.info("[Tools] Denied {} in session {}: {}", toolName, session.getId(), decision.reason());
            return transcriptWriter.appendObservation(session, toolName,
                    truncate(session, toolName, DENIED_PREFIX + decision.reason()),
                    ToolFailureKind.POLICY_DENIED.code());
        }

        if (token.isCancellationRequested()) {
            return fail(session, toolName, ToolFailureKind.CANCELLED, "execute",
                    "Session cancelled before tool '" + toolName + "' was started");
        }

        ToolResult result = invoke(session, tool, args, deadline);
        if (result.isSuccess()) {
            String output = result.getOutput() != null ? result.getOutput() : "";
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("tool", toolName);
            payload.put("output_length", output.length());
            trace.emit(session, TraceEventKind.TOOL_EXECUTED, payload);
            log.debug("[Tools] {} succeeded in session {} ({} chars)", toolName, session.getId(), output.length());
            return transcriptWriter.appendObservation(session, toolName, truncate(session, toolName, output), null);
        }

        ToolFailureKind kind = result.getFailureKind() != null ? result.getFailureKind()
                : ToolFailureKind.EXECUTION_FAILED;
        String error = result.getError() != null ? result.getError() : "Tool failed without an error message";
        return fail(session, toolName, kind, "execute", error);
    }

    private ToolResult invoke(Session session, ToolComponent tool, ValidatedArgs args, Instant deadline) {
        String toolName = tool.getToolName();
        long timeoutMs = stepBudgetMillis(session, deadline);
        CompletableFuture<ToolResult> future = CompletableFuture
                .supplyAsync(() -> tool.execute(args), workerPool)
                .thenCompose(Function.identity());
        try {
            ToolResult result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return result != null ? result
                    : ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool returned no result");
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Tools] {} timed out after {} ms in session {}", toolName, timeoutMs, session.getId());
            return ToolResult.failure(ToolFailureKind.TIMEOUT,
                    "Tool '" + toolName + "' timed out after " + timeoutMs + " ms");
        } catch (ExecutionException e) {
            log.warn("[Tools] {} failed in session {}: {}", toolName, session.getId(), safeCauseMessage(e));
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Tool '" + toolName + "' failed: " + safeCauseMessage(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Tool '" + toolName + "' was interrupted");
        }
    }

    private Message fail(Session session, String toolName, ToolFailureKind kind, String stage, String error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("tool", toolName);
        payload.put("error_code", kind.code());
        payload.put("stage", stage);
        payload.put("error", error);
        trace.emit(session, TraceEventKind.TOOL_FAILED, payload);
        String content = "Error [" + kind.code() + "]: " + error;
        return transcriptWriter.appendObservation(session, toolName, truncate(session, toolName, content),
                kind.code());
    }

    private String truncate(Session session, String toolName, String content) {
        int limit = session.getConfig().getMaxObservationChars();
        if (content.length() <= limit) {
            return content;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("tool", toolName);
        payload.put("original_length", content.length());
        payload.put("truncated_length", limit);
        trace.emit(session, TraceEventKind.OBSERVATION_TRUNCATED, payload);
        return content.substring(0, limit);
    }

    private long stepBudgetMillis(Session session, Instant deadline) {
        long stepMs = session.getConfig().getStepTimeout().toMillis();
        if (deadline == null) {
            return stepMs;
        }
        long remaining = Duration.between(clock.instant(), deadline).toMillis();
        return Math.max(1L, Math.min(stepMs, remaining));
    }

    static String safeCauseMessage(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        String message = current.getMessage();
        return message != null && !message.isBlank() ? message : current.getClass().getSimpleName();
    }
}
