package me.golemcore.runtime.eval;

import me.golemcore.runtime.domain.model.SessionStatus;

import java.util.List;

/**
 * Outcome of one evaluation case.
 *
 * @param missing
 *            expected substrings not found in the final answer
 */
public record EvalResult(String id, boolean passed, String finalAnswer, SessionStatus status, int steps,
        List<String> missing) {
}
