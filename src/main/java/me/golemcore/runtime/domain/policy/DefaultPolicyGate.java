package me.golemcore.runtime.domain.policy;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.PolicyDecision;
import me.golemcore.runtime.domain.model.PolicySnapshot;
import me.golemcore.runtime.domain.model.RiskClass;
import me.golemcore.runtime.domain.model.Session;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ValidatedArgs;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Rule-based policy gate. Rules are evaluated in order and the first deny
 * wins:
 * <ol>
 * <li>network tools need {@code allowNetwork} and, when the tool names a URL
 * argument, a host inside {@code allowedDomains}</li>
 * <li>filesystem-write tools need a target inside the workspace root and
 * {@code allowWrites}</li>
 * <li>tools in {@code deniedTools} are always denied</li>
 * </ol>
 * Only the snapshot captured by the session is consulted.
 */
@Slf4j
public class DefaultPolicyGate implements PolicyGate {

    @Override
    public PolicyDecision authorize(ToolDefinition tool, ValidatedArgs args, Session session) {
        PolicySnapshot policy = session.getPolicy();
        PolicyDecision decision = evaluate(tool, args, policy);
        if (decision.denied()) {
            log.debug("[Policy] Denied {} in session {}: {}", tool.getName(), session.getId(), decision.reason());
        }
        return decision;
    }

    private PolicyDecision evaluate(ToolDefinition tool, ValidatedArgs args, PolicySnapshot policy) {
        RiskClass risk = tool.getRiskClass();

        if (risk == RiskClass.NETWORK) {
            if (!policy.isAllowNetwork()) {
                return PolicyDecision.deny(PolicyReasons.NETWORK_DISABLED);
            }
            if (tool.getUrlArgument() != null && !isDomainAllowed(args.getString(tool.getUrlArgument()), policy)) {
                return PolicyDecision.deny(PolicyReasons.DOMAIN_NOT_ALLOWED);
            }
        }

        if (risk == RiskClass.FILESYSTEM_WRITE) {
            if (tool.getPathArgument() != null && WorkspacePaths
                    .resolveLogical(policy.getWorkspaceRoot(), args.getString(tool.getPathArgument())).isEmpty()) {
                return PolicyDecision.deny(PolicyReasons.PATH_OUTSIDE_WORKSPACE);
            }
            if (!policy.isAllowWrites()) {
                return PolicyDecision.deny(PolicyReasons.WRITES_DISABLED);
            }
        }

        if (policy.getDeniedTools().contains(tool.getName())) {
            return PolicyDecision.deny(PolicyReasons.TOOL_DENIED);
        }

        return PolicyDecision.allow();
    }

    private boolean isDomainAllowed(String url, PolicySnapshot policy) {
        String host = extractHost(url);
        if (host == null) {
            return false;
        }
        for (String domain : policy.getAllowedDomains()) {
            String allowed = domain.toLowerCase(Locale.ROOT).strip();
            if (allowed.isEmpty()) {
                continue;
            }
            if (host.equals(allowed) || host.endsWith("." + allowed)) {
                return true;
            }
        }
        return false;
    }

    private static String extractHost(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            String host = new URI(url.strip()).getHost();
            return host != null ? host.toLowerCase(Locale.ROOT) : null;
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
