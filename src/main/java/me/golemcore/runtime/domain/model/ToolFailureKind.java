package me.golemcore.runtime.domain.model;

/**
 * Machine-readable classification of tool step failures.
 *
 * <p>
 * The code is written into observations and trace payloads, so model feedback
 * and tests never depend on string matching in error messages.
 */
public enum ToolFailureKind {

    /**
     * The model named a tool that is not registered.
     */
    UNKNOWN_TOOL("unknown_tool"),

    /**
     * Arguments did not match the tool's input schema.
     */
    SCHEMA_ERROR("schema_error"),

    /**
     * The policy gate denied the call.
     */
    POLICY_DENIED("policy_denied"),

    /**
     * Tool execution failed during runtime (exceptions, failure results).
     */
    EXECUTION_FAILED("execution_failed"),

    /**
     * Tool execution exceeded the step timeout.
     */
    TIMEOUT("tool_timeout"),

    /**
     * Cancellation was observed before the tool was started.
     */
    CANCELLED("cancelled");

    private final String code;

    ToolFailureKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
