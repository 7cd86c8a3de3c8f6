package me.golemcore.runtime.domain.tool;

/**
 * Thrown when a tool is registered under a name that is already taken.
 */
public class DuplicateToolException extends ToolRegistryException {

    private static final long serialVersionUID = 1L;

    private final String toolName;

    public DuplicateToolException(String toolName) {
        super("Tool already registered: " + toolName);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
