package me.golemcore.runtime.domain.loop;

import me.golemcore.runtime.domain.model.Action;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.MessageRole;
import me.golemcore.runtime.domain.model.Session;

import java.time.Clock;

/**
 * Single place where the loop appends messages to a session transcript.
 */
public class TranscriptWriter {

    private final Clock clock;

    public TranscriptWriter(Clock clock) {
        this.clock = clock;
    }

    public Message appendSystem(Session session, String content) {
        return append(session, Message.system(content, clock.instant()));
    }

    public Message appendTask(Session session, String task) {
        return append(session, Message.user(task, clock.instant()));
    }

    /**
     * Appends the raw decision text together with the action it was parsed
     * into.
     */
    public Message appendDecision(Session session, String raw, Action action) {
        return append(session, Message.builder()
                .role(MessageRole.ASSISTANT)
                .content(raw != null ? raw : "")
                .action(action)
                .timestamp(clock.instant())
                .build());
    }

    public Message appendObservation(Session session, String toolName, String content, String errorCode) {
        return append(session, Message.builder()
                .role(MessageRole.TOOL_OBSERVATION)
                .toolName(toolName)
                .content(content)
                .errorCode(errorCode)
                .timestamp(clock.instant())
                .build());
    }

    private static Message append(Session session, Message message) {
        session.append(message);
        return message;
    }
}
