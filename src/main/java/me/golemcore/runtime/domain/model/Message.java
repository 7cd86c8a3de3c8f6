package me.golemcore.runtime.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable transcript entry. Messages are appended to a {@link Session} and
 * never edited or removed afterwards.
 *
 * <p>
 * Assistant messages carry the parsed {@link Action} next to the raw decision
 * text, so the audit trail keeps both what the model wrote and how it was
 * interpreted. Tool observations carry the tool name and, for failures, a
 * stable error code.
 */
@Value
@Builder
public class Message {

    MessageRole role;
    String content;
    Action action;
    String toolName;
    String errorCode;
    Instant timestamp;

    public boolean isSystemMessage() {
        return role == MessageRole.SYSTEM;
    }

    public boolean isUserMessage() {
        return role == MessageRole.USER;
    }

    public boolean isAssistantMessage() {
        return role == MessageRole.ASSISTANT;
    }

    public boolean isObservation() {
        return role == MessageRole.TOOL_OBSERVATION;
    }

    /**
     * Checks if this is an observation describing a failure (unknown tool, schema
     * violation, policy denial, executor error).
     */
    public boolean isError() {
        return errorCode != null;
    }

    public static Message system(String content, Instant timestamp) {
        return Message.builder()
                .role(MessageRole.SYSTEM)
                .content(content)
                .timestamp(timestamp)
                .build();
    }

    public static Message user(String content, Instant timestamp) {
        return Message.builder()
                .role(MessageRole.USER)
                .content(content)
                .timestamp(timestamp)
                .build();
    }
}
