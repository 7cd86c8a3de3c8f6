package me.golemcore.runtime.domain.loop;

/**
 * Stop reasons recorded on terminal sessions.
 */
public final class StopReasons {

    public static final String FINAL_ANSWER = "final_answer";
    public static final String MAX_STEPS = "max_steps";
    public static final String DEADLINE_EXCEEDED = "deadline_exceeded";
    public static final String CANCELLED = "cancelled";
    public static final String DECISION_FAILED = "decision_failed";
    public static final String INTERNAL_ERROR = "internal_error";

    private StopReasons() {
    }
}
