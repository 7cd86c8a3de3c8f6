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

import me.golemcore.runtime.domain.model.PolicyDecision;
import me.golemcore.runtime.domain.model.Session;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ValidatedArgs;

/**
 * Authorization decision for a single tool call.
 *
 * <p>
 * Implementations must be deterministic: the same tool, arguments and session
 * policy snapshot always produce the same decision, with no I/O.
 */
public interface PolicyGate {

    PolicyDecision authorize(ToolDefinition tool, ValidatedArgs args, Session session);
}
