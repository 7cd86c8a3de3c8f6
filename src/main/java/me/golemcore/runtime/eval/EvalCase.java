package me.golemcore.runtime.eval;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One evaluation case: a task and the substrings its final answer must
 * contain.
 */
public record EvalCase(String id, String task, @JsonProperty("expect_contains") List<String> expectContains) {

    public EvalCase {
        expectContains = expectContains == null ? List.of() : List.copyOf(expectContains);
    }
}
