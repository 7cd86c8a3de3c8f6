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

import me.golemcore.runtime.domain.model.RunConfig;
import me.golemcore.runtime.domain.model.RunResult;

/**
 * Tool-use control loop: turns a task into model decisions, policy-gated tool
 * calls and a final answer.
 */
public interface AgentRuntime {

    /**
     * Runs a task to a terminal session status.
     *
     * <p>
     * Never throws for failures inside the loop: decision provider errors and
     * unexpected exceptions end the session as {@code FAILED}. The step limit,
     * the session deadline and cancellation end it as
     * {@code STEP_LIMIT_REACHED} with a best-effort answer.
     *
     * @param task
     *            the user task, not blank
     * @param config
     *            run budget; {@code null} uses {@link RunConfig#defaults()}
     * @param token
     *            cancellation signal checked between units of work
     * @throws IllegalArgumentException
     *             if the task is blank or the config is invalid
     */
    RunResult run(String task, RunConfig config, CancellationToken token);

    default RunResult run(String task, RunConfig config) {
        return run(task, config, CancellationToken.none());
    }
}
