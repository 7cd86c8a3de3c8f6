package me.golemcore.runtime.port.outbound;

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

import me.golemcore.runtime.domain.model.DecisionRequest;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the component that chooses the next action (a language model or a
 * deterministic mock). Returns the raw decision text; parsing into an action is
 * done by the runtime.
 */
public interface DecisionPort {

    /**
     * Returns the provider identifier (e.g., "mock", "openai").
     */
    String getProviderId();

    /**
     * Requests the next decision for the given transcript view and tool catalog.
     * Transport failures complete the future exceptionally.
     */
    CompletableFuture<String> decide(DecisionRequest request);
}
