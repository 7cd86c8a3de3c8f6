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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the agent runtime, bound from
 * {@code runtime.*} in {@code application.properties}.
 */
@Component
@ConfigurationProperties(prefix = "runtime")
@Data
public class RuntimeProperties {

    private LoopProperties loop = new LoopProperties();
    private PolicyProperties policy = new PolicyProperties();
    private WorkspaceProperties workspace = new WorkspaceProperties();
    private ToolsProperties tools = new ToolsProperties();
    private HttpProperties http = new HttpProperties();
    private DecisionProperties decision = new DecisionProperties();
    private TraceProperties trace = new TraceProperties();
    private MemoryProperties memory = new MemoryProperties();
    private EvalProperties eval = new EvalProperties();

    /**
     * Expands {@code ${user.home}} and returns the absolute, normalized path.
     */
    public static Path resolvePath(String configured) {
        return Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath()
                .normalize();
    }

    // ==================== LOOP ====================

    @Data
    public static class LoopProperties {
        private int maxSteps = 8;
        private Duration timeout = Duration.ofMinutes(5);
        private Duration stepTimeout = Duration.ofSeconds(60);
        private int maxObservationChars = 4000;
        private int decisionRetries = 1;
        private int transcriptMaxMessages = 40;
        private boolean memoryEnabled = true;
        private int memorySearchLimit = 3;
    }

    // ==================== POLICY ====================

    @Data
    public static class PolicyProperties {
        private boolean allowNetwork = false;
        private List<String> allowedDomains = new ArrayList<>();
        private boolean allowWrites = false;
        private List<String> deniedTools = new ArrayList<>();
    }

    @Data
    public static class WorkspaceProperties {
        private String root = "${user.home}/.golemcore/runtime-workspace";
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private ToggleProperties calculator = new ToggleProperties();
        private FileReadToolProperties fileRead = new FileReadToolProperties();
        private ToggleProperties fileWrite = new ToggleProperties();
        private HttpGetToolProperties httpGet = new HttpGetToolProperties();
    }

    @Data
    public static class ToggleProperties {
        private boolean enabled = true;
    }

    @Data
    public static class FileReadToolProperties {
        private boolean enabled = true;
        private long maxFileBytes = 1024 * 1024;
    }

    @Data
    public static class HttpGetToolProperties {
        private boolean enabled = true;
        private int maxBodyChars = 20000;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 30000;
        private long writeTimeout = 30000;
        private long callTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
        private String userAgent = "golemcore-agent-runtime";
    }

    // ==================== DECISION ====================

    @Data
    public static class DecisionProperties {
        private String provider = "mock";
        private String apiKey;
        private String baseUrl;
        private String model = "gpt-4o-mini";
        private Double temperature = 0.0;
        private Duration requestTimeout = Duration.ofSeconds(60);
    }

    // ==================== TRACE / MEMORY ====================

    @Data
    public static class TraceProperties {
        private boolean jsonlEnabled = false;
        private String jsonlPath = "${user.home}/.golemcore/runtime-traces/trace.jsonl";
        private boolean redactSecrets = true;
    }

    @Data
    public static class MemoryProperties {
        private String backend = "in-memory";
        private String jsonlPath = "${user.home}/.golemcore/runtime-memory/memory.jsonl";
    }

    @Data
    public static class EvalProperties {
        private String casesFile;
        private int maxSteps = 8;
    }
}
