package me.golemcore.runtime.domain.loop;

import me.golemcore.runtime.domain.model.PolicySnapshot;
import me.golemcore.runtime.domain.model.ToolDefinition;

import java.util.List;

/**
 * Renders the system message: action protocol, policy summary and tool
 * catalog.
 */
public class SystemPromptBuilder {

    static final String PROTOCOL = """
            You complete the user's task by calling tools. Reply with exactly one JSON object per turn.
            To call a tool: {"action":"tool","tool":"<tool name>","args":{...}}
            To finish: {"action":"final","content":"<answer>"}
            Tool results are returned as observations. Denied or failed calls are reported the same way; adjust and retry or finish.""";

    public String build(PolicySnapshot policy, List<ToolDefinition> catalog) {
        StringBuilder sb = new StringBuilder(PROTOCOL);
        sb.append("\n\nPolicy: ").append(policy.summary());
        sb.append("\n\nTools:");
        if (catalog.isEmpty()) {
            sb.append(" none");
        }
        for (ToolDefinition tool : catalog) {
            sb.append("\n- ").append(tool.signature());
        }
        return sb.toString();
    }
}
