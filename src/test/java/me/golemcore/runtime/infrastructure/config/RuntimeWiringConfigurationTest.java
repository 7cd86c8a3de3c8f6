package me.golemcore.runtime.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.runtime.adapter.outbound.memory.InMemoryMemoryAdapter;
import me.golemcore.runtime.adapter.outbound.memory.JsonlMemoryAdapter;
import me.golemcore.runtime.domain.model.PolicySnapshot;
import me.golemcore.runtime.domain.model.RunConfig;
import me.golemcore.runtime.domain.policy.PolicySnapshotHolder;
import me.golemcore.runtime.domain.tool.ToolRegistry;
import me.golemcore.runtime.tools.CalculatorTool;
import me.golemcore.runtime.tools.FileWriteTool;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.*;

class RuntimeWiringConfigurationTest {

    @TempDir
    Path tempDir;

    private final RuntimeWiringConfiguration wiring = new RuntimeWiringConfiguration();

    @Test
    void shouldBuildRunConfigFromLoopProperties() {
        RuntimeProperties properties = new RuntimeProperties();
        properties.getLoop().setMaxSteps(4);
        properties.getLoop().setStepTimeout(Duration.ofSeconds(5));
        properties.getLoop().setMaxObservationChars(100);

        RunConfig config = wiring.defaultRunConfig(properties);

        assertEquals(4, config.getMaxSteps());
        assertEquals(Duration.ofSeconds(5), config.getStepTimeout());
        assertEquals(100, config.getMaxObservationChars());
        assertEquals(Duration.ofMinutes(5), config.getTimeout());
        assertTrue(config.isMemoryEnabled());
    }

    @Test
    void shouldRejectInvalidLoopProperties() {
        RuntimeProperties properties = new RuntimeProperties();
        properties.getLoop().setMaxSteps(0);

        assertThrows(IllegalArgumentException.class, () -> wiring.defaultRunConfig(properties));
    }

    @Test
    void shouldCreateWorkspaceAndPolicySnapshot() {
        RuntimeProperties properties = new RuntimeProperties();
        Path root = tempDir.resolve("ws");
        properties.getWorkspace().setRoot(root.toString());
        properties.getPolicy().setAllowNetwork(true);
        properties.getPolicy().setAllowedDomains(List.of("example.com"));
        properties.getPolicy().setDeniedTools(List.of("file_write"));

        PolicySnapshotHolder holder = wiring.policySnapshotHolder(properties);

        PolicySnapshot policy = holder.current();
        assertTrue(Files.isDirectory(root));
        assertEquals(root.toAbsolutePath().normalize(), policy.getWorkspaceRoot());
        assertTrue(policy.isAllowNetwork());
        assertTrue(policy.getAllowedDomains().contains("example.com"));
        assertFalse(policy.isAllowWrites());
        assertTrue(policy.getDeniedTools().contains("file_write"));
    }

    @Test
    void shouldRegisterOnlyEnabledTools() {
        RuntimeProperties properties = new RuntimeProperties();

        ToolRegistry registry = wiring.toolRegistry(List.of(
                new CalculatorTool(properties),
                new FileWriteTool(tempDir, false)));

        assertEquals(List.of("calculator"), registry.names());
    }

    @Test
    void shouldSelectMemoryBackend() {
        RuntimeProperties properties = new RuntimeProperties();
        ObjectMapper objectMapper = new ObjectMapper();

        assertInstanceOf(InMemoryMemoryAdapter.class, wiring.memoryPort(properties, objectMapper));

        properties.getMemory().setBackend("jsonl");
        properties.getMemory().setJsonlPath(tempDir.resolve("memory.jsonl").toString());
        assertInstanceOf(JsonlMemoryAdapter.class, wiring.memoryPort(properties, objectMapper));
    }

    @Test
    void shouldUseDaemonWorkerThreads() throws Exception {
        ExecutorService pool = wiring.runtimeWorkerPool();
        try {
            Boolean daemon = pool.submit(() -> Thread.currentThread().isDaemon()).get();
            assertTrue(daemon);
        } finally {
            pool.shutdownNow();
        }
    }
}
