package me.golemcore.runtime.infrastructure.config;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.adapter.outbound.memory.InMemoryMemoryAdapter;
import me.golemcore.runtime.adapter.outbound.memory.JsonlMemoryAdapter;
import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.loop.ActionParser;
import me.golemcore.runtime.domain.loop.AgentRuntime;
import me.golemcore.runtime.domain.loop.DefaultAgentRuntime;
import me.golemcore.runtime.domain.model.PolicySnapshot;
import me.golemcore.runtime.domain.model.RunConfig;
import me.golemcore.runtime.domain.policy.DefaultPolicyGate;
import me.golemcore.runtime.domain.policy.PolicyGate;
import me.golemcore.runtime.domain.policy.PolicySnapshotHolder;
import me.golemcore.runtime.domain.tool.ToolRegistry;
import me.golemcore.runtime.domain.trace.TraceRecorder;
import me.golemcore.runtime.eval.EvalHarness;
import me.golemcore.runtime.port.outbound.DecisionPort;
import me.golemcore.runtime.port.outbound.MemoryPort;
import me.golemcore.runtime.port.outbound.TraceSinkPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the plain domain classes of the runtime into the Spring context.
 */
@Configuration
@Slf4j
public class RuntimeWiringConfiguration {

    @Bean(name = "runtimeWorkerPool", destroyMethod = "shutdownNow")
    public ExecutorService runtimeWorkerPool() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "runtime-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public RunConfig defaultRunConfig(RuntimeProperties properties) {
        RuntimeProperties.LoopProperties loop = properties.getLoop();
        RunConfig config = RunConfig.builder()
                .maxSteps(loop.getMaxSteps())
                .timeout(loop.getTimeout())
                .stepTimeout(loop.getStepTimeout())
                .maxObservationChars(loop.getMaxObservationChars())
                .decisionRetries(loop.getDecisionRetries())
                .transcriptMaxMessages(loop.getTranscriptMaxMessages())
                .memoryEnabled(loop.isMemoryEnabled())
                .memorySearchLimit(loop.getMemorySearchLimit())
                .build();
        config.validate();
        return config;
    }

    @Bean
    public PolicySnapshotHolder policySnapshotHolder(RuntimeProperties properties) {
        Path workspaceRoot = RuntimeProperties.resolvePath(properties.getWorkspace().getRoot());
        try {
            Files.createDirectories(workspaceRoot);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create workspace " + workspaceRoot, e);
        }
        RuntimeProperties.PolicyProperties policy = properties.getPolicy();
        PolicySnapshot snapshot = PolicySnapshot.builder()
                .allowNetwork(policy.isAllowNetwork())
                .allowedDomains(policy.getAllowedDomains())
                .allowWrites(policy.isAllowWrites())
                .workspaceRoot(workspaceRoot)
                .deniedTools(policy.getDeniedTools())
                .build();
        return new PolicySnapshotHolder(snapshot);
    }

    @Bean
    public ToolRegistry toolRegistry(List<ToolComponent> tools) {
        ToolRegistry registry = new ToolRegistry();
        for (ToolComponent tool : tools) {
            if (tool.isEnabled()) {
                registry.register(tool);
            } else {
                log.debug("[Tools] Skipping disabled tool: {}", tool.getToolName());
            }
        }
        return registry;
    }

    @Bean
    public PolicyGate policyGate() {
        return new DefaultPolicyGate();
    }

    @Bean
    public TraceRecorder traceRecorder(Clock clock, List<TraceSinkPort> sinks) {
        return new TraceRecorder(clock, sinks);
    }

    @Bean
    public ActionParser actionParser(ObjectMapper objectMapper) {
        return new ActionParser(objectMapper);
    }

    @Bean
    public MemoryPort memoryPort(RuntimeProperties properties, ObjectMapper objectMapper) {
        String backend = properties.getMemory().getBackend();
        if ("jsonl".equalsIgnoreCase(backend)) {
            Path path = RuntimeProperties.resolvePath(properties.getMemory().getJsonlPath());
            log.info("[Memory] Using JSONL memory at {}", path);
            return new JsonlMemoryAdapter(objectMapper, path);
        }
        if (!"in-memory".equalsIgnoreCase(backend)) {
            log.warn("[Memory] Unknown backend '{}', falling back to in-memory", backend);
        }
        return new InMemoryMemoryAdapter();
    }

    @Bean
    public AgentRuntime agentRuntime(DecisionPort decisionPort, ToolRegistry toolRegistry, PolicyGate policyGate,
            PolicySnapshotHolder policySnapshotHolder, TraceRecorder traceRecorder, MemoryPort memoryPort,
            ActionParser actionParser, @Qualifier("runtimeWorkerPool") ExecutorService runtimeWorkerPool,
            Clock clock) {
        return new DefaultAgentRuntime(decisionPort, toolRegistry, policyGate, policySnapshotHolder,
                traceRecorder, memoryPort, actionParser, runtimeWorkerPool, clock);
    }

    @Bean
    public EvalHarness evalHarness(AgentRuntime agentRuntime, ObjectMapper objectMapper) {
        return new EvalHarness(agentRuntime, objectMapper);
    }
}
