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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Writes or appends UTF-8 text to a file inside the workspace, creating parent
 * directories as needed. Whether writes are allowed at all is decided by the
 * policy gate before this tool runs.
 */
@Component
@Slf4j
public class FileWriteTool implements ToolComponent {

    private final Path workspaceRoot;
    private final boolean enabled;

    @Autowired
    public FileWriteTool(RuntimeProperties properties) {
        this(RuntimeProperties.resolvePath(properties.getWorkspace().getRoot()),
                properties.getTools().getFileWrite().isEnabled());
    }

    public FileWriteTool(Path workspaceRoot, boolean enabled) {
        this.workspaceRoot = workspaceRoot;
        this.enabled = enabled;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("file_write")
                .description("Write text to a file in the workspace. Set append=true to append.")
                .inputSchema(InputSchema.builder()
                        .field(InputSchema.required("path", InputSchema.FieldType.STRING,
                                "File path relative to the workspace root"))
                        .field(InputSchema.required("content", InputSchema.FieldType.STRING, "Text to write"))
                        .field(InputSchema.optional("append", InputSchema.FieldType.BOOLEAN,
                                "Append instead of overwrite"))
                        .build())
                .riskClass(RiskClass.FILESYSTEM_WRITE)
                .pathArgument("path")
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(ValidatedArgs args) {
        return CompletableFuture.completedFuture(
                write(args.getString("path"), args.getString("content"), args.getBoolean("append", false)));
    }

    private ToolResult write(String rawPath, String content, boolean append) {
        Optional<Path> resolved = WorkspacePaths.resolveReal(workspaceRoot, rawPath);
        if (resolved.isEmpty()) {
            log.warn("[FileWrite] Path outside workspace: {}", rawPath);
            return ToolResult.failure("Invalid path: must be within workspace");
        }
        Path path = resolved.get();
        if (Files.isDirectory(path)) {
            return ToolResult.failure("Path is a directory: " + rawPath);
        }
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (append) {
                Files.writeString(path, content, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } else {
                Files.writeString(path, content, StandardCharsets.UTF_8);
            }
            log.info("[FileWrite] {} {} chars to {}", append ? "Appended" : "Wrote", content.length(), path);
            return ToolResult.success((append ? "Appended " : "Wrote ") + content.length()
                    + " characters to " + rawPath);
        } catch (IOException e) {
            log.warn("[FileWrite] Failed to write {}: {}", path, e.getMessage());
            return ToolResult.failure("Failed to write file: " + e.getMessage());
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }
}
