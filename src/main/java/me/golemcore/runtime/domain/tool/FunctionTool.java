package me.golemcore.runtime.domain.tool;

import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.domain.model.ValidatedArgs;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Adapts a {@link ToolExecutor} function to {@link ToolComponent}. The executor
 * runs on the calling thread; the runtime already executes tools on its worker
 * pool.
 */
final class FunctionTool implements ToolComponent {

    private final ToolDefinition definition;
    private final ToolExecutor executor;

    FunctionTool(ToolDefinition definition, ToolExecutor executor) {
        this.definition = Objects.requireNonNull(definition, "definition must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    @Override
    public ToolDefinition getDefinition() {
        return definition;
    }

    @Override
    public CompletableFuture<ToolResult> execute(ValidatedArgs args) {
        try {
            return CompletableFuture.completedFuture(ToolResult.success(executor.execute(args)));
        } catch (Exception e) { // NOSONAR - executor contract allows any exception
            return CompletableFuture.failedFuture(e);
        }
    }
}
