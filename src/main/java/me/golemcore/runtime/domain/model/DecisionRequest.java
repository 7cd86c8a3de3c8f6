package me.golemcore.runtime.domain.model;

import java.util.List;

/**
 * Input of one decision provider call.
 *
 * @param sessionId
 *            session the decision belongs to
 * @param step
 *            zero-based step index
 * @param transcript
 *            ordered transcript view (system message first)
 * @param catalog
 *            tool catalog in registration order
 */
public record DecisionRequest(String sessionId, int step, List<Message> transcript, List<ToolDefinition> catalog) {

    public DecisionRequest {
        transcript = List.copyOf(transcript);
        catalog = List.copyOf(catalog);
    }
}
