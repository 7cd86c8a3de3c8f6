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
import me.golemcore.runtime.domain.model.Action;
import me.golemcore.runtime.domain.model.DecisionRequest;
import me.golemcore.runtime.domain.model.MemoryTurn;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.MessageRole;
import me.golemcore.runtime.domain.model.PolicySnapshot;
import me.golemcore.runtime.domain.model.RunConfig;
import me.golemcore.runtime.domain.model.RunResult;
import me.golemcore.runtime.domain.model.Session;
import me.golemcore.runtime.domain.model.SessionStatus;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.TraceEventKind;
import me.golemcore.runtime.domain.policy.PolicyGate;
import me.golemcore.runtime.domain.policy.PolicySnapshotHolder;
import me.golemcore.runtime.domain.tool.ToolRegistry;
import me.golemcore.runtime.domain.trace.TraceRecorder;
import me.golemcore.runtime.port.outbound.DecisionPort;
import me.golemcore.runtime.port.outbound.MemoryPort;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sequential tool-use loop.
 *
 * <p>
 * Each step requests one decision, parses it into one action and either
 * finishes the session (final answer or plain text) or runs one tool call
 * through {@link ToolStepExecutor}. Every step consumes exactly one unit of the
 * step budget, including steps whose tool call was unknown, malformed or
 * denied, so the loop always terminates within {@code maxSteps} decisions.
 *
 * <p>
 * Sessions are independent; one instance may run many sessions concurrently
 * because all per-session state lives in {@link Session}.
 */
@Slf4j
public class DefaultAgentRuntime implements AgentRuntime {

    static final String UNABLE_TO_COMPLETE = "Unable to complete the task within the step limit.";

    private final DecisionPort decisionPort;
    private final ToolRegistry registry;
    private final PolicySnapshotHolder policyHolder;
    private final TraceRecorder trace;
    private final MemoryPort memoryPort;
    private final ActionParser actionParser;
    private final Clock clock;

    private final TranscriptWriter transcriptWriter;
    private final TranscriptViewBuilder viewBuilder = new TranscriptViewBuilder();
    private final SystemPromptBuilder promptBuilder = new SystemPromptBuilder();
    private final ToolStepExecutor toolStepExecutor;

    public DefaultAgentRuntime(DecisionPort decisionPort, ToolRegistry registry, PolicyGate policyGate,
            PolicySnapshotHolder policyHolder, TraceRecorder trace, MemoryPort memoryPort,
            ActionParser actionParser, Executor workerPool, Clock clock) {
        this.decisionPort = Objects.requireNonNull(decisionPort, "decisionPort must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.policyHolder = Objects.requireNonNull(policyHolder, "policyHolder must not be null");
        this.trace = Objects.requireNonNull(trace, "trace must not be null");
        this.memoryPort = memoryPort;
        this.actionParser = Objects.requireNonNull(actionParser, "actionParser must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.transcriptWriter = new TranscriptWriter(clock);
        this.toolStepExecutor = new ToolStepExecutor(registry, policyGate, trace, transcriptWriter, workerPool,
                clock);
    }

    @Override
    public RunResult run(String task, RunConfig config, CancellationToken token) {
        if (task == null || task.isBlank()) {
            throw new IllegalArgumentException("task must not be blank");
        }
        RunConfig runConfig = config != null ? config : RunConfig.defaults();
        runConfig.validate();
        CancellationToken cancellation = token != null ? token : CancellationToken.none();

        Instant startedAt = clock.instant();
        Instant deadline = runConfig.getTimeout() != null ? startedAt.plus(runConfig.getTimeout()) : null;
        PolicySnapshot policy = policyHolder.current();
        Session session = new Session(UUID.randomUUID().toString(), task, runConfig, policy, startedAt);
        List<ToolDefinition> catalog = registry.catalog();

        transcriptWriter.appendSystem(session, promptBuilder.build(policy, catalog));
        transcriptWriter.appendTask(session, task);

        Map<String, Object> started = new LinkedHashMap<>();
        started.put("task", task);
        started.put("max_steps", runConfig.getMaxSteps());
        started.put("tools", registry.names());
        started.put("policy", policy.summary());
        trace.emit(session, TraceEventKind.SESSION_STARTED, started);
        log.info("[Runtime] Session {} started (maxSteps={}, tools={})", session.getId(), runConfig.getMaxSteps(),
                catalog.size());

        List<String> memory = recallMemory(session);
        try {
            loop(session, catalog, memory, cancellation, deadline);
        } catch (DecisionFailedException e) {
            if (cancellation.isCancellationRequested()) {
                stopEarly(session, StopReasons.CANCELLED);
            } else if (deadlinePassed(deadline)) {
                stopEarly(session, StopReasons.DEADLINE_EXCEEDED);
            } else {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("error", e.getMessage());
                payload.put("error_type", e.getErrorType());
                payload.put("attempts", e.getAttempts());
                failSession(session, StopReasons.DECISION_FAILED, payload);
            }
        } catch (RuntimeException e) { // NOSONAR - a session never leaks raw exceptions
            log.error("[Runtime] Session {} failed unexpectedly", session.getId(), e);
            if (session.isRunning()) {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("error", ToolStepExecutor.safeCauseMessage(e));
                payload.put("error_type", e.getClass().getSimpleName());
                failSession(session, StopReasons.INTERNAL_ERROR, payload);
            }
        }

        rememberOutcome(session);
        log.info("[Runtime] Session {} finished: status={}, steps={}, reason={}", session.getId(),
                session.getStatus().wireName(), session.getStepCount(), session.getStopReason());
        return new RunResult(session.getFinalAnswer(), session);
    }

    private void loop(Session session, List<ToolDefinition> catalog, List<String> memory, CancellationToken token,
            Instant deadline) {
        RunConfig config = session.getConfig();
        while (true) {
            if (token.isCancellationRequested()) {
                stopEarly(session, StopReasons.CANCELLED);
                return;
            }
            if (deadlinePassed(deadline)) {
                stopEarly(session, StopReasons.DEADLINE_EXCEEDED);
                return;
            }
            if (session.getStepCount() >= config.getMaxSteps()) {
                stopEarly(session, StopReasons.MAX_STEPS);
                return;
            }

            TranscriptView view = viewBuilder.build(session.getTranscript(), config.getTranscriptMaxMessages(),
                    memory);
            if (view.droppedMessages() > 0) {
                log.debug("[Runtime] Session {}: {} old messages left out of the view", session.getId(),
                        view.droppedMessages());
            }
            DecisionRequest request = new DecisionRequest(session.getId(), session.getStepCount(), view.messages(),
                    catalog);
            String raw = requestDecision(session, request, token, deadline);

            Action action = actionParser.parse(raw);
            transcriptWriter.appendDecision(session, raw, action);

            if (action instanceof Action.ToolCall call) {
                log.debug("[Runtime] Session {} step {}: tool call {}", session.getId(), session.getStepCount(),
                        call.toolName());
                toolStepExecutor.execute(session, call, token, deadline);
                session.advanceStep();
                continue;
            }

            String answer = action instanceof Action.Final finalAction
                    ? finalAction.content()
                    : ((Action.PlainText) action).content();
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("answer_length", answer.length());
            payload.put("structured", action instanceof Action.Final);
            trace.emit(session, TraceEventKind.FINAL_RETURNED, payload);
            session.advanceStep();
            session.complete(answer, clock.instant());
            return;
        }
    }

    /**
     * Calls the decision provider, retrying transport failures and timeouts up
     * to {@code decisionRetries} more times. No retry starts once the session
     * deadline has passed. Every attempt is traced as one requested/received
     * pair.
     */
    private String requestDecision(Session session, DecisionRequest request, CancellationToken token,
            Instant deadline) {
        int attempts = 1 + session.getConfig().getDecisionRetries();
        String lastError = null;
        String lastErrorType = null;
        Throwable lastCause = null;
        int attempt = 0;

        while (attempt < attempts) {
            if (attempt > 0 && (token.isCancellationRequested() || deadlinePassed(deadline))) {
                break;
            }
            attempt++;
            Map<String, Object> requested = new LinkedHashMap<>();
            requested.put("attempt", attempt);
            requested.put("provider", decisionPort.getProviderId());
            requested.put("messages", request.transcript().size());
            trace.emit(session, TraceEventKind.DECISION_REQUESTED, requested);

            long timeoutMs = stepBudgetMillis(session, deadline);
            CompletableFuture<String> future = null;
            try {
                future = decisionPort.decide(request);
                if (future == null) {
                    throw new IllegalStateException("Decision provider returned no result");
                }
                String raw = future.get(timeoutMs, TimeUnit.MILLISECONDS);
                Map<String, Object> received = new LinkedHashMap<>();
                received.put("attempt", attempt);
                received.put("status", "ok");
                received.put("length", raw != null ? raw.length() : 0);
                trace.emit(session, TraceEventKind.DECISION_RECEIVED, received);
                return raw != null ? raw : "";
            } catch (TimeoutException e) {
                future.cancel(true);
                lastError = "Decision timed out after " + timeoutMs + " ms";
                lastErrorType = "timeout";
                lastCause = e;
            } catch (ExecutionException e) {
                lastError = ToolStepExecutor.safeCauseMessage(e);
                lastErrorType = "transport";
                lastCause = e.getCause();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                emitDecisionError(session, attempt, "Decision interrupted", "interrupted");
                throw new DecisionFailedException("Decision interrupted", e, attempt, "interrupted");
            } catch (RuntimeException e) { // NOSONAR - provider errors are retried like transport failures
                lastError = ToolStepExecutor.safeCauseMessage(e);
                lastErrorType = "transport";
                lastCause = e;
            }
            emitDecisionError(session, attempt, lastError, lastErrorType);
            log.warn("[Decision] Attempt {}/{} failed in session {}: {}", attempt, attempts, session.getId(),
                    lastError);
        }
        throw new DecisionFailedException(lastError, lastCause, attempt, lastErrorType);
    }

    private void emitDecisionError(Session session, int attempt, String error, String errorType) {
        Map<String, Object> received = new LinkedHashMap<>();
        received.put("attempt", attempt);
        received.put("status", "error");
        received.put("error", error);
        received.put("error_type", errorType);
        trace.emit(session, TraceEventKind.DECISION_RECEIVED, received);
    }

    private void stopEarly(Session session, String reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("reason", reason);
        payload.put("steps", session.getStepCount());
        payload.put("max_steps", session.getConfig().getMaxSteps());
        trace.emit(session, TraceEventKind.STEP_LIMIT_HIT, payload);
        session.stopAtLimit(bestEffortAnswer(session), reason, clock.instant());
        log.info("[Runtime] Session {} stopped: {}", session.getId(), reason);
    }

    private void failSession(Session session, String reason, Map<String, Object> details) {
        Map<String, Object> payload = new LinkedHashMap<>(details);
        payload.put("reason", reason);
        trace.emit(session, TraceEventKind.SESSION_FAILED, payload);
        session.fail(reason, clock.instant());
        log.warn("[Runtime] Session {} failed: {} ({})", session.getId(), reason, details.get("error"));
    }

    /**
     * Most recent commentary the model attached to a tool call, or a fixed
     * marker when there is none.
     */
    private static String bestEffortAnswer(Session session) {
        List<Message> transcript = session.getTranscript();
        for (int i = transcript.size() - 1; i >= 0; i--) {
            Message message = transcript.get(i);
            if (message.isAssistantMessage() && message.getAction() instanceof Action.ToolCall call
                    && call.commentary() != null && !call.commentary().isBlank()) {
                return call.commentary();
            }
        }
        return UNABLE_TO_COMPLETE;
    }

    private List<String> recallMemory(Session session) {
        RunConfig config = session.getConfig();
        if (!config.isMemoryEnabled() || memoryPort == null) {
            return List.of();
        }
        try {
            List<String> snippets = memoryPort.search(session.getTask(), config.getMemorySearchLimit());
            return snippets != null ? snippets : List.of();
        } catch (RuntimeException e) { // NOSONAR - memory is best effort
            memoryFailed(session, "search", e);
            return List.of();
        }
    }

    private void rememberOutcome(Session session) {
        if (!session.getConfig().isMemoryEnabled() || memoryPort == null
                || session.getStatus() != SessionStatus.COMPLETED) {
            return;
        }
        try {
            memoryPort.append(session.getId(),
                    new MemoryTurn(MessageRole.USER, session.getTask(), session.getCreatedAt()));
            memoryPort.append(session.getId(),
                    new MemoryTurn(MessageRole.ASSISTANT, session.getFinalAnswer(), session.getFinishedAt()));
        } catch (RuntimeException e) { // NOSONAR - memory is best effort
            memoryFailed(session, "append", e);
        }
    }

    private void memoryFailed(Session session, String operation, RuntimeException e) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("operation", operation);
        payload.put("error", ToolStepExecutor.safeCauseMessage(e));
        trace.emit(session, TraceEventKind.MEMORY_FAILED, payload);
        log.warn("[Memory] {} failed for session {}: {}", operation, session.getId(), e.getMessage());
    }

    private long stepBudgetMillis(Session session, Instant deadline) {
        long stepMs = session.getConfig().getStepTimeout().toMillis();
        if (deadline == null) {
            return stepMs;
        }
        // rounded up so a timed-out wait always ends at or past the deadline
        long remaining = (Duration.between(clock.instant(), deadline).toNanos() + 999_999L) / 1_000_000L;
        return Math.max(1L, Math.min(stepMs, remaining));
    }

    private boolean deadlinePassed(Instant deadline) {
        return deadline != null && !clock.instant().isBefore(deadline);
    }
}
