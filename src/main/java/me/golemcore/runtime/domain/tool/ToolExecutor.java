package me.golemcore.runtime.domain.tool;

import me.golemcore.runtime.domain.model.ValidatedArgs;

/**
 * Synchronous tool body used for tools registered as plain functions.
 */
@FunctionalInterface
public interface ToolExecutor {

    String execute(ValidatedArgs args) throws Exception;
}
