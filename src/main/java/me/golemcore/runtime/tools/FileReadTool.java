package me.golemcore.runtime.tools;

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
import me.golemcore.runtime.domain.model.InputSchema;
import me.golemcore.runtime.domain.model.RiskClass;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.domain.model.ValidatedArgs;
import me.golemcore.runtime.domain.policy.WorkspacePaths;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Reads a UTF-8 text file inside the workspace.
 *
 * <p>
 * Paths are resolved against the workspace root; paths escaping it, directly or
 * through a symlink, are rejected. Files above the configured size cap are not
 * read.
 */
@Component
@Slf4j
public class FileReadTool implements ToolComponent {

    private final Path workspaceRoot;
    private final long maxFileBytes;
    private final boolean enabled;

    @Autowired
    public FileReadTool(RuntimeProperties properties) {
        this(RuntimeProperties.resolvePath(properties.getWorkspace().getRoot()),
                properties.getTools().getFileRead().getMaxFileBytes(),
                properties.getTools().getFileRead().isEnabled());
    }

    public FileReadTool(Path workspaceRoot, long maxFileBytes, boolean enabled) {
        this.workspaceRoot = workspaceRoot;
        this.maxFileBytes = maxFileBytes;
        this.enabled = enabled;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("file_read")
                .description("Read a UTF-8 text file from the workspace.")
                .inputSchema(InputSchema.builder()
                        .field(InputSchema.required("path", InputSchema.FieldType.STRING,
                                "File path relative to the workspace root"))
                        .build())
                .riskClass(RiskClass.FILESYSTEM_READ)
                .pathArgument("path")
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(ValidatedArgs args) {
        return CompletableFuture.completedFuture(read(args.getString("path")));
    }

    private ToolResult read(String rawPath) {
        Optional<Path> resolved = WorkspacePaths.resolveReal(workspaceRoot, rawPath);
        if (resolved.isEmpty()) {
            log.warn("[FileRead] Path outside workspace: {}", rawPath);
            return ToolResult.failure("Invalid path: must be within workspace");
        }
        Path path = resolved.get();
        if (!Files.exists(path)) {
            return ToolResult.failure("File not found: " + rawPath);
        }
        if (!Files.isRegularFile(path)) {
            return ToolResult.failure("Not a regular file: " + rawPath);
        }
        try {
            long size = Files.size(path);
            if (size > maxFileBytes) {
                return ToolResult.failure("File too large: " + size + " bytes (max " + maxFileBytes + ")");
            }
            String content = Files.readString(path, StandardCharsets.UTF_8);
            log.debug("[FileRead] Read {} ({} bytes)", path, size);
            return ToolResult.success(content);
        } catch (CharacterCodingException e) {
            return ToolResult.failure("Not a UTF-8 text file: " + rawPath);
        } catch (IOException e) {
            log.warn("[FileRead] Failed to read {}: {}", path, e.getMessage());
            return ToolResult.failure("Failed to read file: " + e.getMessage());
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }
}
