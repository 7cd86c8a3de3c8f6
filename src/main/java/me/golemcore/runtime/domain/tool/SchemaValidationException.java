package me.golemcore.runtime.domain.tool;

import java.util.List;

/**
 * Thrown when tool arguments do not match the declared input schema. Carries
 * every violation found, in schema field order.
 */
public class SchemaValidationException extends ToolRegistryException {

    private static final long serialVersionUID = 1L;

    private final String toolName;
    private final List<String> violations;

    public SchemaValidationException(String toolName, List<String> violations) {
        super("Invalid arguments for tool '" + toolName + "': " + String.join("; ", violations));
        this.toolName = toolName;
        this.violations = List.copyOf(violations);
    }

    public String getToolName() {
        return toolName;
    }

    public List<String> getViolations() {
        return violations;
    }
}
