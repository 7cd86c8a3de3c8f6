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

/**
 * Defines a tool that the decision provider can call. Contains the tool name,
 * description, input schema and the risk classification used by the policy
 * gate.
 *
 * <p>
 * {@code urlArgument} and {@code pathArgument} name the argument that holds the
 * target of a network or filesystem tool. When set, the policy gate scopes the
 * call by allowed domains or by the workspace root.
 */
@Value
@Builder
public class ToolDefinition {

    String name;
    String description;

    @Builder.Default
    InputSchema inputSchema = InputSchema.empty();

    @Builder.Default
    RiskClass riskClass = RiskClass.PURE;

    String urlArgument;
    String pathArgument;

    /**
     * Creates a pure tool definition without input parameters.
     */
    public static ToolDefinition simple(String name, String description) {
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .build();
    }

    /**
     * Catalog line shown to the decision provider, e.g.
     * {@code file_read(path: string) [filesystem-read] Reads a text file}.
     */
    public String signature() {
        StringBuilder sb = new StringBuilder(name)
                .append('(').append(inputSchema.signature()).append(')')
                .append(" [").append(riskClass.wireName()).append(']');
        if (description != null && !description.isBlank()) {
            sb.append(' ').append(description.strip());
        }
        return sb.toString();
    }
}
