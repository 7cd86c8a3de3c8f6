package me.golemcore.runtime.domain.component;

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

import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.domain.model.ValidatedArgs;

import java.util.concurrent.CompletableFuture;

/**
 * Executable tool that can be invoked by the decision provider. Tools expose
 * their definition (name, description, input schema, risk class) and implement
 * the execution logic. Spring beans implementing this interface are registered
 * in the tool registry at startup.
 */
public interface ToolComponent {

    /**
     * Returns the tool definition shown in the tool catalog.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with arguments already validated against
     * {@link ToolDefinition#getInputSchema()}.
     *
     * <p>
     * Expected failures are reported as {@link ToolResult#failure(String)};
     * exceptions thrown here or completing the future exceptionally are mapped
     * to {@code execution_failed} by the runtime.
     *
     * @param args
     *            the validated arguments
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(ValidatedArgs args);

    /**
     * Returns the unique name of this tool.
     */
    default String getToolName() {
        return getDefinition().getName();
    }

    /**
     * Checks whether this tool should be registered. Tools disabled via
     * configuration return false.
     */
    default boolean isEnabled() {
        return true;
    }
}
