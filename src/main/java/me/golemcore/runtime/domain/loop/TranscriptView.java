package me.golemcore.runtime.domain.loop;

import me.golemcore.runtime.domain.model.Message;

import java.util.List;

/**
 * Messages sent to the decision provider for one step, plus how many
 * transcript messages were left out to fit the size bound.
 */
public record TranscriptView(List<Message> messages, int droppedMessages) {

    public TranscriptView {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
