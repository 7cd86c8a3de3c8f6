package me.golemcore.runtime.domain.loop;

import me.golemcore.runtime.adapter.outbound.trace.InMemoryTraceSinkAdapter;
import me.golemcore.runtime.domain.model.DecisionRequest;
import me.golemcore.runtime.domain.model.InputSchema;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.MessageRole;
import me.golemcore.runtime.domain.model.MemoryTurn;
import me.golemcore.runtime.domain.model.PolicySnapshot;
import me.golemcore.runtime.domain.model.RiskClass;
import me.golemcore.runtime.domain.model.RunConfig;
import me.golemcore.runtime.domain.model.RunResult;
import me.golemcore.runtime.domain.model.SessionStatus;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.TraceEvent;
import me.golemcore.runtime.domain.model.TraceEventKind;
import me.golemcore.runtime.domain.model.ValidatedArgs;
import me.golemcore.runtime.domain.policy.DefaultPolicyGate;
import me.golemcore.runtime.domain.policy.PolicySnapshotHolder;
import me.golemcore.runtime.domain.tool.ToolExecutor;
import me.golemcore.runtime.domain.tool.ToolRegistry;
import me.golemcore.runtime.domain.trace.TraceRecorder;
import me.golemcore.runtime.port.outbound.DecisionPort;
import me.golemcore.runtime.port.outbound.MemoryPort;
import me.golemcore.runtime.testsupport.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class DefaultAgentRuntimeTest {

    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    private static final String TOOL_CALCULATOR = "calculator";
    private static final String TOOL_HTTP_GET = "http_get";
    private static final String CALCULATOR_CALL = "{\"action\":\"tool\",\"tool\":\"calculator\","
            + "\"args\":{\"expression\":\"23*19\"}}";
    private static final String FINAL_437 = "{\"action\":\"final\",\"content\":\"The result is 437.\"}";
    private static final String TASK = "What is 23*19?";

    @TempDir
    Path workspace;

    private MutableClock clock;
    private DecisionPort decisionPort;
    private ToolExecutor calculator;
    private ToolRegistry registry;
    private PolicySnapshotHolder policyHolder;
    private InMemoryTraceSinkAdapter traceStore;
    private MemoryPort memoryPort;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(NOW);
        decisionPort = mock(DecisionPort.class);
        when(decisionPort.getProviderId()).thenReturn("scripted");

        calculator = mock(ToolExecutor.class);
        when(calculator.execute(any(ValidatedArgs.class))).thenReturn("437");

        registry = new ToolRegistry();
        registry.register(ToolDefinition.builder()
                .name(TOOL_CALCULATOR)
                .description("Evaluates arithmetic")
                .inputSchema(InputSchema.builder()
                        .field(InputSchema.required("expression", InputSchema.FieldType.STRING, "expression"))
                        .build())
                .build(), calculator);

        policyHolder = new PolicySnapshotHolder(PolicySnapshot.restrictive(workspace));
        traceStore = new InMemoryTraceSinkAdapter();
        memoryPort = null;
    }

    private DefaultAgentRuntime runtime() {
        return runtime(Runnable::run);
    }

    private DefaultAgentRuntime runtime(Executor workerPool) {
        TraceRecorder trace = new TraceRecorder(clock, List.of(traceStore));
        return new DefaultAgentRuntime(decisionPort, registry, new DefaultPolicyGate(), policyHolder, trace,
                memoryPort, new ActionParser(new ObjectMapper()), workerPool, clock);
    }

    private static RunConfig config(int maxSteps) {
        return RunConfig.builder().maxSteps(maxSteps).decisionRetries(0).build();
    }

    private void scriptDecisions(String... responses) {
        Iterator<String> script = List.of(responses).iterator();
        when(decisionPort.decide(any(DecisionRequest.class)))
                .thenAnswer(inv -> CompletableFuture.completedFuture(script.next()));
    }

    private List<TraceEventKind> traceKinds(RunResult result) {
        return traceStore.findBySession(result.session().getId()).stream()
                .map(TraceEvent::kind)
                .collect(Collectors.toList());
    }

    private List<TraceEvent> traceEvents(RunResult result, TraceEventKind kind) {
        return traceStore.findBySession(result.session().getId()).stream()
                .filter(event -> event.kind() == kind)
                .collect(Collectors.toList());
    }

    private static Message lastObservation(RunResult result) {
        List<Message> transcript = result.session().getTranscript();
        for (int i = transcript.size() - 1; i >= 0; i--) {
            if (transcript.get(i).isObservation()) {
                return transcript.get(i);
            }
        }
        throw new AssertionError("no observation in transcript");
    }

    @Test
    void shouldCallToolThenReturnFinalAnswer() throws Exception {
        scriptDecisions(CALCULATOR_CALL, FINAL_437);

        RunResult result = runtime().run(TASK, config(5));

        assertEquals(SessionStatus.COMPLETED, result.status());
        assertEquals("The result is 437.", result.finalAnswer());
        assertEquals("final_answer", result.stopReason());
        assertEquals(2, result.session().getStepCount());

        List<MessageRole> roles = result.session().getTranscript().stream()
                .map(Message::getRole)
                .collect(Collectors.toList());
        assertEquals(List.of(MessageRole.SYSTEM, MessageRole.USER, MessageRole.ASSISTANT,
                MessageRole.TOOL_OBSERVATION, MessageRole.ASSISTANT), roles);
        assertEquals("437", lastObservation(result).getContent());
        assertEquals(TOOL_CALCULATOR, lastObservation(result).getToolName());

        assertEquals(List.of(
                TraceEventKind.SESSION_STARTED,
                TraceEventKind.DECISION_REQUESTED,
                TraceEventKind.DECISION_RECEIVED,
                TraceEventKind.POLICY_CHECKED,
                TraceEventKind.TOOL_EXECUTED,
                TraceEventKind.DECISION_REQUESTED,
                TraceEventKind.DECISION_RECEIVED,
                TraceEventKind.FINAL_RETURNED), traceKinds(result));
        verify(calculator, times(1)).execute(any(ValidatedArgs.class));
    }

    @Test
    void shouldRejectBlankTask() {
        DefaultAgentRuntime runtime = runtime();
        assertThrows(IllegalArgumentException.class, () -> runtime.run("  ", config(3)));
        verifyNoInteractions(decisionPort);
    }

    @Test
    void shouldRejectInvalidConfig() {
        DefaultAgentRuntime runtime = runtime();
        RunConfig invalid = RunConfig.builder().maxSteps(0).build();
        assertThrows(IllegalArgumentException.class, () -> runtime.run(TASK, invalid));
    }

    @Test
    void shouldTreatPlainTextAsFinalAnswer() {
        scriptDecisions("Sure, the answer is 437.");

        RunResult result = runtime().run(TASK, config(3));

        assertEquals(SessionStatus.COMPLETED, result.status());
        assertEquals("Sure, the answer is 437.", result.finalAnswer());
        assertEquals(1, result.session().getStepCount());
        TraceEvent finalEvent = traceEvents(result, TraceEventKind.FINAL_RETURNED).get(0);
        assertEquals(false, finalEvent.payload().get("structured"));
    }

    @Test
    void shouldStopAtStepLimitWithLatestCommentary() throws Exception {
        when(decisionPort.decide(any(DecisionRequest.class))).thenAnswer(inv -> CompletableFuture.completedFuture(
                "{\"action\":\"tool\",\"tool\":\"calculator\",\"args\":{\"expression\":\"1+1\"},"
                        + "\"content\":\"Still computing partial sums\"}"));

        RunResult result = runtime().run(TASK, config(3));

        assertEquals(SessionStatus.STEP_LIMIT_REACHED, result.status());
        assertEquals(StopReasons.MAX_STEPS, result.stopReason());
        assertEquals("Still computing partial sums", result.finalAnswer());
        assertEquals(3, result.session().getStepCount());
        verify(decisionPort, times(3)).decide(any(DecisionRequest.class));
        verify(calculator, times(3)).execute(any(ValidatedArgs.class));

        TraceEvent limit = traceEvents(result, TraceEventKind.STEP_LIMIT_HIT).get(0);
        assertEquals(StopReasons.MAX_STEPS, limit.payload().get("reason"));
        assertEquals(3, limit.payload().get("steps"));
    }

    @Test
    void shouldFallBackToFixedAnswerWhenNoCommentaryAtStepLimit() {
        when(decisionPort.decide(any(DecisionRequest.class)))
                .thenAnswer(inv -> CompletableFuture.completedFuture(CALCULATOR_CALL));

        RunResult result = runtime().run(TASK, config(2));

        assertEquals(SessionStatus.STEP_LIMIT_REACHED, result.status());
        assertEquals(DefaultAgentRuntime.UNABLE_TO_COMPLETE, result.finalAnswer());
        assertEquals(2, result.session().getStepCount());
    }

    @Test
    void shouldAllowFinalAnswerOnLastStep() {
        scriptDecisions(CALCULATOR_CALL, FINAL_437);

        RunResult result = runtime().run(TASK, config(2));

        assertEquals(SessionStatus.COMPLETED, result.status());
        assertEquals(2, result.session().getStepCount());
    }

    @Test
    void shouldNeverExecuteToolDeniedByPolicy() throws Exception {
        ToolExecutor httpGet = mock(ToolExecutor.class);
        registry.register(ToolDefinition.builder()
                .name(TOOL_HTTP_GET)
                .description("Fetches a URL")
                .riskClass(RiskClass.NETWORK)
                .urlArgument("url")
                .inputSchema(InputSchema.builder()
                        .field(InputSchema.required("url", InputSchema.FieldType.STRING, "url"))
                        .build())
                .build(), httpGet);
        when(decisionPort.decide(any(DecisionRequest.class))).thenAnswer(inv -> CompletableFuture.completedFuture(
                "{\"action\":\"tool\",\"tool\":\"http_get\",\"args\":{\"url\":\"https://example.com\"}}"));

        RunResult result = runtime().run("Fetch example.com", config(4));

        // The model keeps asking; every request is denied and the limit ends the
        // session
        assertEquals(SessionStatus.STEP_LIMIT_REACHED, result.status());
        verifyNoInteractions(httpGet);

        Message observation = lastObservation(result);
        assertEquals(ToolStepExecutor.DENIED_PREFIX + "network_disabled", observation.getContent());
        assertEquals("policy_denied", observation.getErrorCode());

        List<TraceEvent> checks = traceEvents(result, TraceEventKind.POLICY_CHECKED);
        assertEquals(4, checks.size());
        assertEquals("deny", checks.get(0).payload().get("result"));
        assertEquals("network_disabled", checks.get(0).payload().get("reason"));
        assertTrue(traceEvents(result, TraceEventKind.TOOL_EXECUTED).isEmpty());
        assertTrue(traceEvents(result, TraceEventKind.TOOL_FAILED).isEmpty());
    }

    @Test
    void shouldUsePolicySnapshotCapturedAtSessionStart() throws Exception {
        ToolExecutor httpGet = mock(ToolExecutor.class);
        registry.register(ToolDefinition.builder()
                .name(TOOL_HTTP_GET)
                .riskClass(RiskClass.NETWORK)
                .inputSchema(InputSchema.builder()
                        .field(InputSchema.required("url", InputSchema.FieldType.STRING, "url"))
                        .build())
                .build(), httpGet);
        when(decisionPort.decide(any(DecisionRequest.class)))
                .thenAnswer(inv -> {
                    policyHolder.update(policyHolder.current().toBuilder().allowNetwork(true).build());
                    return CompletableFuture.completedFuture(
                            "{\"action\":\"tool\",\"tool\":\"http_get\",\"args\":{\"url\":\"https://a.io\"}}");
                })
                .thenReturn(CompletableFuture.completedFuture(FINAL_437));

        RunResult result = runtime().run(TASK, config(3));

        assertEquals(SessionStatus.COMPLETED, result.status());
        assertFalse(result.session().getPolicy().isAllowNetwork());
        assertTrue(policyHolder.current().isAllowNetwork());
        verifyNoInteractions(httpGet);
    }

    @Test
    void shouldReportUnknownToolWithoutCheckingPolicy() {
        scriptDecisions("{\"action\":\"tool\",\"tool\":\"nope\",\"args\":{}}", FINAL_437);

        RunResult result = runtime().run(TASK, config(3));

        assertEquals(SessionStatus.COMPLETED, result.status());
        Message observation = lastObservation(result);
        assertEquals("Error [unknown_tool]: Unknown tool 'nope'. Available tools: calculator",
                observation.getContent());
        assertEquals("unknown_tool", observation.getErrorCode());
        assertTrue(traceEvents(result, TraceEventKind.POLICY_CHECKED).isEmpty());

        TraceEvent failed = traceEvents(result, TraceEventKind.TOOL_FAILED).get(0);
        assertEquals("resolve", failed.payload().get("stage"));
        assertEquals("unknown_tool", failed.payload().get("error_code"));
    }

    @Test
    void shouldReportSchemaErrorWithoutExecuting() throws Exception {
        scriptDecisions("{\"action\":\"tool\",\"tool\":\"calculator\",\"args\":{\"expression\":42}}", FINAL_437);

        RunResult result = runtime().run(TASK, config(3));

        assertEquals(SessionStatus.COMPLETED, result.status());
        Message observation = lastObservation(result);
        assertEquals("schema_error", observation.getErrorCode());
        assertTrue(observation.getContent().startsWith("Error [schema_error]: "));
        assertTrue(observation.getContent().contains("argument 'expression' must be string, got number"));
        verify(calculator, never()).execute(any(ValidatedArgs.class));
        assertTrue(traceEvents(result, TraceEventKind.POLICY_CHECKED).isEmpty());
        assertEquals("validate", traceEvents(result, TraceEventKind.TOOL_FAILED).get(0).payload().get("stage"));
    }

    @Test
    void shouldTurnToolExceptionIntoErrorObservation() throws Exception {
        when(calculator.execute(any(ValidatedArgs.class))).thenThrow(new IllegalStateException("division by zero"));
        scriptDecisions(CALCULATOR_CALL, FINAL_437);

        RunResult result = runtime().run(TASK, config(3));

        assertEquals(SessionStatus.COMPLETED, result.status());
        Message observation = lastObservation(result);
        assertEquals("Error [execution_failed]: Tool 'calculator' failed: division by zero", observation.getContent());
        assertEquals("execution_failed", observation.getErrorCode());
        assertEquals("execute", traceEvents(result, TraceEventKind.TOOL_FAILED).get(0).payload().get("stage"));
    }

    @Test
    void shouldTruncateLongObservations() throws Exception {
        when(calculator.execute(any(ValidatedArgs.class))).thenReturn("x".repeat(50));
        scriptDecisions(CALCULATOR_CALL, FINAL_437);

        RunConfig config = RunConfig.builder().maxSteps(3).maxObservationChars(10).build();
        RunResult result = runtime().run(TASK, config);

        assertEquals("x".repeat(10), lastObservation(result).getContent());
        TraceEvent truncated = traceEvents(result, TraceEventKind.OBSERVATION_TRUNCATED).get(0);
        assertEquals(50, truncated.payload().get("original_length"));
        assertEquals(10, truncated.payload().get("truncated_length"));
        assertEquals(50, traceEvents(result, TraceEventKind.TOOL_EXECUTED).get(0).payload().get("output_length"));
    }

    @Test
    void shouldTimeOutSlowTool() throws Exception {
        when(calculator.execute(any(ValidatedArgs.class))).thenAnswer(inv -> {
            Thread.sleep(5000);
            return "late";
        });
        scriptDecisions(CALCULATOR_CALL, FINAL_437);

        ExecutorService pool = Executors.newCachedThreadPool();
        try {
            RunConfig config = RunConfig.builder().maxSteps(3).stepTimeout(Duration.ofMillis(100)).build();
            RunResult result = runtime(pool).run(TASK, config);

            assertEquals(SessionStatus.COMPLETED, result.status());
            Message observation = lastObservation(result);
            assertEquals("tool_timeout", observation.getErrorCode());
            assertEquals("Error [tool_timeout]: Tool 'calculator' timed out after 100 ms", observation.getContent());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldRetryFailedDecisionOnce() {
        when(decisionPort.decide(any(DecisionRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(new IOException("connection reset")))
                .thenReturn(CompletableFuture.completedFuture(FINAL_437));

        RunConfig config = RunConfig.builder().maxSteps(3).decisionRetries(1).build();
        RunResult result = runtime().run(TASK, config);

        assertEquals(SessionStatus.COMPLETED, result.status());
        List<TraceEvent> received = traceEvents(result, TraceEventKind.DECISION_RECEIVED);
        assertEquals(2, received.size());
        assertEquals("error", received.get(0).payload().get("status"));
        assertEquals("transport", received.get(0).payload().get("error_type"));
        assertEquals("ok", received.get(1).payload().get("status"));
        assertEquals(2, received.get(1).payload().get("attempt"));
    }

    @Test
    void shouldFailSessionWhenDecisionRetriesAreExhausted() {
        when(decisionPort.decide(any(DecisionRequest.class)))
                .thenAnswer(inv -> CompletableFuture.failedFuture(new IOException("provider down")));

        RunConfig config = RunConfig.builder().maxSteps(3).decisionRetries(1).build();
        RunResult result = runtime().run(TASK, config);

        assertEquals(SessionStatus.FAILED, result.status());
        assertEquals(StopReasons.DECISION_FAILED, result.stopReason());
        assertNull(result.finalAnswer());
        verify(decisionPort, times(2)).decide(any(DecisionRequest.class));

        TraceEvent failed = traceEvents(result, TraceEventKind.SESSION_FAILED).get(0);
        assertEquals("provider down", failed.payload().get("error"));
        assertEquals(2, failed.payload().get("attempts"));
        assertEquals(StopReasons.DECISION_FAILED, failed.payload().get("reason"));
    }

    @Test
    void shouldStopBeforeFirstStepWhenAlreadyCancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();

        RunResult result = runtime().run(TASK, config(3), token);

        assertEquals(SessionStatus.STEP_LIMIT_REACHED, result.status());
        assertEquals(StopReasons.CANCELLED, result.stopReason());
        assertEquals(0, result.session().getStepCount());
        verify(decisionPort, never()).decide(any(DecisionRequest.class));
    }

    @Test
    void shouldNotStartToolAfterCancellation() throws Exception {
        CancellationToken token = new CancellationToken();
        when(decisionPort.decide(any(DecisionRequest.class))).thenAnswer(inv -> {
            token.cancel();
            return CompletableFuture.completedFuture(CALCULATOR_CALL);
        });

        RunResult result = runtime().run(TASK, config(5), token);

        assertEquals(SessionStatus.STEP_LIMIT_REACHED, result.status());
        assertEquals(StopReasons.CANCELLED, result.stopReason());
        assertEquals("cancelled", lastObservation(result).getErrorCode());
        verify(calculator, never()).execute(any(ValidatedArgs.class));
        verify(decisionPort, times(1)).decide(any(DecisionRequest.class));
    }

    @Test
    void shouldStopWhenDeadlinePasses() {
        when(decisionPort.decide(any(DecisionRequest.class))).thenAnswer(inv -> {
            clock.advance(Duration.ofSeconds(11));
            return CompletableFuture.completedFuture(CALCULATOR_CALL);
        });

        RunConfig config = RunConfig.builder().maxSteps(5).timeout(Duration.ofSeconds(10)).build();
        RunResult result = runtime().run(TASK, config);

        assertEquals(SessionStatus.STEP_LIMIT_REACHED, result.status());
        assertEquals(StopReasons.DEADLINE_EXCEEDED, result.stopReason());
        assertEquals(1, result.session().getStepCount());
        assertEquals(NOW.plusSeconds(11), result.session().getFinishedAt());
    }

    @Test
    void shouldStopAtDeadlineWhileDecisionIsPending() {
        when(decisionPort.decide(any(DecisionRequest.class))).thenAnswer(inv -> {
            clock.advance(Duration.ofSeconds(1));
            return new CompletableFuture<String>();
        });

        RunConfig config = RunConfig.builder()
                .maxSteps(3)
                .timeout(Duration.ofMillis(200))
                .decisionRetries(1)
                .build();
        RunResult result = runtime().run(TASK, config);

        assertEquals(SessionStatus.STEP_LIMIT_REACHED, result.status());
        assertEquals(StopReasons.DEADLINE_EXCEEDED, result.stopReason());
        assertEquals(DefaultAgentRuntime.UNABLE_TO_COMPLETE, result.finalAnswer());
        assertEquals(0, result.session().getStepCount());
        verify(decisionPort, times(1)).decide(any(DecisionRequest.class));
        List<TraceEventKind> kinds = traceKinds(result);
        assertFalse(kinds.contains(TraceEventKind.SESSION_FAILED));
        assertEquals(TraceEventKind.STEP_LIMIT_HIT, kinds.get(kinds.size() - 1));
    }

    @Test
    void shouldEndWithDeadlineExceededWhenDecisionNeverAnswers() {
        when(decisionPort.decide(any(DecisionRequest.class))).thenAnswer(inv -> new CompletableFuture<String>());
        Clock systemClock = Clock.systemUTC();
        TraceRecorder trace = new TraceRecorder(systemClock, List.of(traceStore));
        DefaultAgentRuntime runtime = new DefaultAgentRuntime(decisionPort, registry, new DefaultPolicyGate(),
                policyHolder, trace, null, new ActionParser(new ObjectMapper()), Runnable::run, systemClock);

        RunConfig config = RunConfig.builder().maxSteps(3).timeout(Duration.ofMillis(200)).build();
        RunResult result = runtime.run(TASK, config);

        assertEquals(SessionStatus.STEP_LIMIT_REACHED, result.status());
        assertEquals(StopReasons.DEADLINE_EXCEEDED, result.stopReason());
        assertFalse(traceKinds(result).contains(TraceEventKind.SESSION_FAILED));
    }

    @Test
    void shouldInjectMemoryIntoViewOnly() {
        memoryPort = mock(MemoryPort.class);
        when(memoryPort.search(anyString(), anyInt())).thenReturn(List.of("user: 23*19 was asked before"));
        scriptDecisions(FINAL_437);

        RunConfig config = RunConfig.builder().maxSteps(3).memoryEnabled(true).build();
        RunResult result = runtime().run(TASK, config);

        ArgumentCaptor<DecisionRequest> captor = ArgumentCaptor.forClass(DecisionRequest.class);
        verify(decisionPort).decide(captor.capture());
        String viewSystem = captor.getValue().transcript().get(0).getContent();
        assertTrue(viewSystem.contains(TranscriptViewBuilder.MEMORY_HEADER));
        assertTrue(viewSystem.contains("- user: 23*19 was asked before"));

        String storedSystem = result.session().getTranscript().get(0).getContent();
        assertFalse(storedSystem.contains(TranscriptViewBuilder.MEMORY_HEADER));

        verify(memoryPort).search(TASK, 3);
        verify(memoryPort, times(2)).append(eq(result.session().getId()), any(MemoryTurn.class));
    }

    @Test
    void shouldCompleteWhenMemoryFails() {
        memoryPort = mock(MemoryPort.class);
        when(memoryPort.search(anyString(), anyInt())).thenThrow(new IllegalStateException("index corrupted"));
        scriptDecisions(FINAL_437);

        RunConfig config = RunConfig.builder().maxSteps(3).memoryEnabled(true).build();
        RunResult result = runtime().run(TASK, config);

        assertEquals(SessionStatus.COMPLETED, result.status());
        TraceEvent failed = traceEvents(result, TraceEventKind.MEMORY_FAILED).get(0);
        assertEquals("search", failed.payload().get("operation"));
        assertEquals("index corrupted", failed.payload().get("error"));
    }

    @Test
    void shouldNotRememberUnfinishedSessions() {
        memoryPort = mock(MemoryPort.class);
        when(decisionPort.decide(any(DecisionRequest.class)))
                .thenAnswer(inv -> CompletableFuture.completedFuture(CALCULATOR_CALL));

        RunConfig config = RunConfig.builder().maxSteps(1).memoryEnabled(true).build();
        runtime().run(TASK, config);

        verify(memoryPort, never()).append(anyString(), any(MemoryTurn.class));
    }

    @Test
    void shouldEmitStrictlyIncreasingTraceSequence() {
        scriptDecisions(CALCULATOR_CALL, FINAL_437);

        RunResult result = runtime().run(TASK, config(5));

        List<TraceEvent> events = traceStore.findBySession(result.session().getId());
        for (int i = 1; i < events.size(); i++) {
            assertTrue(events.get(i).sequence() > events.get(i - 1).sequence());
            assertTrue(events.get(i).step() >= events.get(i - 1).step());
        }
        assertEquals(0, events.get(0).step());
        assertEquals(1, traceEvents(result, TraceEventKind.FINAL_RETURNED).get(0).step());
    }

    @Test
    void shouldKeepTranscriptAppendOnly() {
        scriptDecisions(CALCULATOR_CALL, FINAL_437);

        RunResult result = runtime().run(TASK, config(5));

        List<Message> transcript = result.session().getTranscript();
        assertThrows(UnsupportedOperationException.class, () -> transcript.add(Message.user("x", NOW)));
        assertThrows(IllegalStateException.class, () -> result.session().append(Message.user("late", NOW)));
        assertEquals(TASK, transcript.get(1).getContent());
    }

    @Test
    void shouldExtendTranscriptStrictlyFromStepToStep() {
        List<List<Message>> seen = new ArrayList<>();
        Iterator<String> script = List.of(CALCULATOR_CALL, CALCULATOR_CALL, FINAL_437).iterator();
        when(decisionPort.decide(any(DecisionRequest.class))).thenAnswer(inv -> {
            DecisionRequest request = inv.getArgument(0);
            seen.add(List.copyOf(request.transcript()));
            return CompletableFuture.completedFuture(script.next());
        });

        RunConfig config = RunConfig.builder().maxSteps(5).transcriptMaxMessages(0).decisionRetries(0).build();
        RunResult result = runtime().run(TASK, config);

        assertEquals(SessionStatus.COMPLETED, result.status());
        assertEquals(3, seen.size());
        for (int step = 1; step < seen.size(); step++) {
            List<Message> before = seen.get(step - 1);
            List<Message> after = seen.get(step);
            assertTrue(after.size() > before.size(), "step " + step + " did not extend the transcript");
            assertEquals(before, after.subList(0, before.size()), "step " + step + " rewrote earlier messages");
        }
        List<Message> finalTranscript = result.session().getTranscript();
        List<Message> lastSeen = seen.get(seen.size() - 1);
        assertEquals(lastSeen, finalTranscript.subList(0, lastSeen.size()));
    }
}
