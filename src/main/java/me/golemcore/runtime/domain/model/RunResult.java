package me.golemcore.runtime.domain.model;

/**
 * Outcome of one runtime invocation. The session is always terminal.
 *
 * @param finalAnswer
 *            the final answer, the best-effort answer on early termination, or
 *            {@code null} for failed sessions
 * @param session
 *            the terminal session with its full transcript
 */
public record RunResult(String finalAnswer, Session session) {

    public SessionStatus status() {
        return session.getStatus();
    }

    public String stopReason() {
        return session.getStopReason();
    }
}
