package me.golemcore.runtime.eval;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.runtime.adapter.outbound.decision.MockDecisionAdapter;
import me.golemcore.runtime.domain.loop.ActionParser;
import me.golemcore.runtime.domain.loop.DefaultAgentRuntime;
import me.golemcore.runtime.domain.model.PolicySnapshot;
import me.golemcore.runtime.domain.model.RunConfig;
import me.golemcore.runtime.domain.model.SessionStatus;
import me.golemcore.runtime.domain.policy.DefaultPolicyGate;
import me.golemcore.runtime.domain.policy.PolicySnapshotHolder;
import me.golemcore.runtime.domain.tool.ToolRegistry;
import me.golemcore.runtime.domain.trace.TraceRecorder;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.tools.CalculatorTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the sample eval cases end to end: mock decision provider, real
 * calculator tool, default policy gate.
 */
class EvalHarnessTest {

    private static final Path SAMPLE_CASES = Path.of("src/test/resources/eval/sample_cases.jsonl");

    @TempDir
    Path workspace;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private EvalHarness harness;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T12:00:00Z"), ZoneOffset.UTC);
        ToolRegistry registry = new ToolRegistry();
        registry.register(new CalculatorTool(new RuntimeProperties()));
        DefaultAgentRuntime runtime = new DefaultAgentRuntime(
                new MockDecisionAdapter(objectMapper),
                registry,
                new DefaultPolicyGate(),
                new PolicySnapshotHolder(PolicySnapshot.restrictive(workspace)),
                new TraceRecorder(clock, List.of()),
                null,
                new ActionParser(objectMapper),
                Runnable::run,
                clock);
        harness = new EvalHarness(runtime, objectMapper);
    }

    @Test
    void shouldLoadCasesSkippingCommentsAndBlankLines() throws Exception {
        List<EvalCase> cases = harness.loadCases(SAMPLE_CASES);

        assertEquals(3, cases.size());
        assertEquals("multiply", cases.get(0).id());
        assertEquals(List.of("437"), cases.get(0).expectContains());
        assertEquals("case-5", cases.get(2).id());
    }

    @Test
    void shouldPassSampleCases() throws Exception {
        EvalReport report = harness.run(harness.loadCases(SAMPLE_CASES), RunConfig.builder().maxSteps(8).build());

        assertEquals(3, report.total());
        assertEquals(3, report.passed());
        assertEquals("Passed 3/3", report.summary());

        EvalResult multiply = report.results().get(0);
        assertEquals(SessionStatus.COMPLETED, multiply.status());
        assertEquals("The result is 437.", multiply.finalAnswer());
        assertEquals(2, multiply.steps());
    }

    @Test
    void shouldReportMissingSubstrings() throws Exception {
        EvalReport report = harness.run(List.of(new EvalCase("c1", "What is 2+2?", List.of("5", "4"))),
                RunConfig.defaults());

        EvalResult result = report.results().get(0);
        assertFalse(result.passed());
        assertEquals(List.of("5"), result.missing());
        assertEquals(0, report.passed());
    }

    @Test
    void shouldRejectCaseWithoutTask(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("cases.jsonl");
        Files.writeString(file, "{\"id\":\"x\",\"expect_contains\":[\"a\"]}\n");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> harness.loadCases(file));
        assertEquals("Eval case at line 1 has no task", e.getMessage());
    }

    @Test
    void shouldRejectMalformedLine(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("cases.jsonl");
        Files.writeString(file, "{not json\n");

        assertThrows(IllegalArgumentException.class, () -> harness.loadCases(file));
    }
}
