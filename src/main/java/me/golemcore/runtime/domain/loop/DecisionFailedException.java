package me.golemcore.runtime.domain.loop;

/**
 * Raised inside the loop when the decision provider failed on every attempt.
 * Never escapes {@link AgentRuntime#run}; the session ends as failed.
 */
public class DecisionFailedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int attempts;
    private final String errorType;

    public DecisionFailedException(String message, Throwable cause, int attempts, String errorType) {
        super(message, cause);
        this.attempts = attempts;
        this.errorType = errorType;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getErrorType() {
        return errorType;
    }
}
