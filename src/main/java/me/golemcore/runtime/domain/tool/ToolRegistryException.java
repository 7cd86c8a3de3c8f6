package me.golemcore.runtime.domain.tool;

/**
 * Base class for tool registration and resolution errors.
 */
public class ToolRegistryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ToolRegistryException(String message) {
        super(message);
    }
}
