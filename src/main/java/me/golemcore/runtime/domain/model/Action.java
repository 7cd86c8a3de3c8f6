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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One parsed decision of the decision provider.
 *
 * <p>
 * Closed set of variants: a tool call, a final answer, or plain text that did
 * not follow the action protocol. {@link PlainText} is handled exactly like
 * {@link Final} by the runtime.
 */
public sealed interface Action permits Action.ToolCall, Action.Final, Action.PlainText {

    /**
     * Whether this action ends the session.
     */
    default boolean isTerminal() {
        return !(this instanceof ToolCall);
    }

    /**
     * Request to invoke a single tool. Arguments are untyped until validated
     * against the tool's input schema.
     *
     * @param toolName
     *            tool name as written by the model
     * @param arguments
     *            raw arguments (never null)
     * @param commentary
     *            optional free text the model attached to the call
     */
    record ToolCall(String toolName, Map<String, Object> arguments, String commentary) implements Action {

        public ToolCall {
            arguments = arguments == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        }

        public ToolCall(String toolName, Map<String, Object> arguments) {
            this(toolName, arguments, null);
        }
    }

    /**
     * Final answer in the structured protocol.
     */
    record Final(String content) implements Action {
    }

    /**
     * Output that could not be parsed as a structured action.
     */
    record PlainText(String content) implements Action {
    }
}
