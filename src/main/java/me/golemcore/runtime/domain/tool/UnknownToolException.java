package me.golemcore.runtime.domain.tool;

/**
 * Thrown when a tool name cannot be resolved in the registry.
 */
public class UnknownToolException extends ToolRegistryException {

    private static final long serialVersionUID = 1L;

    private final String toolName;

    public UnknownToolException(String toolName) {
        super("Unknown tool: " + toolName);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
