package me.golemcore.runtime.eval;

import java.util.List;

/**
 * Results of an evaluation run, in case order.
 */
public record EvalReport(List<EvalResult> results) {

    public EvalReport {
        results = List.copyOf(results);
    }

    public long passed() {
        return results.stream().filter(EvalResult::passed).count();
    }

    public int total() {
        return results.size();
    }

    public String summary() {
        return "Passed " + passed() + "/" + total();
    }
}
