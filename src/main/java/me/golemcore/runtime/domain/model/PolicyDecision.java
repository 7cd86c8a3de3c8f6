package me.golemcore.runtime.domain.model;

/**
 * Result of the policy gate: allow, or deny with a short stable reason code.
 * Never persisted beyond the trace event that records it.
 */
public record PolicyDecision(boolean allowed, String reason) {

    private static final PolicyDecision ALLOW = new PolicyDecision(true, null);

    public static PolicyDecision allow() {
        return ALLOW;
    }

    public static PolicyDecision deny(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("deny reason must not be blank");
        }
        return new PolicyDecision(false, reason);
    }

    public boolean denied() {
        return !allowed;
    }
}
