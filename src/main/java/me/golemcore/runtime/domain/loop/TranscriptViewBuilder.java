package me.golemcore.runtime.domain.loop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.runtime.domain.model.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the per-step view of a session transcript. The transcript itself is
 * never modified; the view may enrich the system message with memory snippets
 * and leave out old turns.
 *
 * <p>
 * When the view exceeds the message bound, the oldest turns are dropped first.
 * System messages, the task message (first user message) and the most recent
 * message are pinned and always kept, so the view can exceed the bound only
 * when pinned messages alone do.
 */
public class TranscriptViewBuilder {

    static final String MEMORY_HEADER = "Relevant memory from earlier sessions:";

    public TranscriptView build(List<Message> transcript, int maxMessages, List<String> memorySnippets) {
        List<Message> messages = new ArrayList<>(transcript);
        if (memorySnippets != null && !memorySnippets.isEmpty() && !messages.isEmpty()
                && messages.get(0).isSystemMessage()) {
            messages.set(0, withMemory(messages.get(0), memorySnippets));
        }

        if (maxMessages <= 0 || messages.size() <= maxMessages) {
            return new TranscriptView(messages, 0);
        }

        boolean[] pinned = pinnedMask(messages);
        int excess = messages.size() - maxMessages;
        List<Message> kept = new ArrayList<>(messages.size());
        int dropped = 0;
        for (int i = 0; i < messages.size(); i++) {
            if (dropped < excess && !pinned[i]) {
                dropped++;
                continue;
            }
            kept.add(messages.get(i));
        }
        return new TranscriptView(kept, dropped);
    }

    private static boolean[] pinnedMask(List<Message> messages) {
        boolean[] pinned = new boolean[messages.size()];
        boolean taskSeen = false;
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            if (message.isSystemMessage()) {
                pinned[i] = true;
            } else if (!taskSeen && message.isUserMessage()) {
                pinned[i] = true;
                taskSeen = true;
            }
        }
        pinned[messages.size() - 1] = true;
        return pinned;
    }

    private static Message withMemory(Message system, List<String> snippets) {
        StringBuilder sb = new StringBuilder(system.getContent() != null ? system.getContent() : "");
        sb.append("\n\n").append(MEMORY_HEADER);
        for (String snippet : snippets) {
            sb.append("\n- ").append(snippet);
        }
        return Message.builder()
                .role(system.getRole())
                .content(sb.toString())
                .timestamp(system.getTimestamp())
                .build();
    }
}
