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
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable authorization configuration. A snapshot is captured by every
 * session at start; updates are published as a new snapshot, never by mutating
 * an existing one.
 */
@Value
@Builder(toBuilder = true)
public class PolicySnapshot {

    boolean allowNetwork;

    /** Hosts reachable by network tools; subdomains of an entry match too. */
    @Singular
    Set<String> allowedDomains;

    boolean allowWrites;

    /** Absolute, normalized root for filesystem tools. */
    Path workspaceRoot;

    @Singular
    Set<String> deniedTools;

    /**
     * Most restrictive snapshot: no network, no writes, nothing explicitly
     * denied.
     */
    public static PolicySnapshot restrictive(Path workspaceRoot) {
        return PolicySnapshot.builder()
                .workspaceRoot(workspaceRoot.toAbsolutePath().normalize())
                .build();
    }

    /**
     * One-line description shown to the decision provider. Lists only what the
     * model needs to plan calls, in a stable order.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("network=").append(allowNetwork ? "enabled" : "disabled");
        if (allowNetwork) {
            sb.append(" (domains: ")
                    .append(allowedDomains.isEmpty() ? "none" : String.join(", ", new TreeSet<>(allowedDomains)))
                    .append(')');
        }
        sb.append("; writes=").append(allowWrites ? "enabled" : "disabled");
        sb.append("; denied tools=")
                .append(deniedTools.isEmpty() ? "none" : String.join(", ", new TreeSet<>(deniedTools)));
        return sb.toString();
    }
}
