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

import java.time.Duration;

/**
 * Per-session execution budget and loop behavior. A snapshot of this object is
 * stored on the {@link Session} when the run starts.
 */
@Value
@Builder(toBuilder = true)
public class RunConfig {

    /** Hard upper bound on loop iterations. Must be at least 1. */
    @Builder.Default
    int maxSteps = 8;

    /** Wall-clock budget for the whole run; {@code null} means unbounded. */
    Duration timeout;

    /** Bound for a single decision call and a single tool execution. */
    @Builder.Default
    Duration stepTimeout = Duration.ofSeconds(60);

    /** Tool output longer than this is cut before entering the transcript. */
    @Builder.Default
    int maxObservationChars = 4000;

    /** Additional decision attempts after a transport failure or timeout. */
    @Builder.Default
    int decisionRetries = 1;

    /** Max messages in the view sent to the decision provider; 0 disables. */
    @Builder.Default
    int transcriptMaxMessages = 0;

    @Builder.Default
    boolean memoryEnabled = false;

    @Builder.Default
    int memorySearchLimit = 3;

    public static RunConfig defaults() {
        return RunConfig.builder().build();
    }

    /**
     * Rejects configurations the runtime cannot honor.
     *
     * @throws IllegalArgumentException
     *             if any bound is out of range
     */
    public void validate() {
        if (maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be >= 1, got " + maxSteps);
        }
        if (maxObservationChars < 1) {
            throw new IllegalArgumentException("maxObservationChars must be >= 1, got " + maxObservationChars);
        }
        if (decisionRetries < 0) {
            throw new IllegalArgumentException("decisionRetries must be >= 0, got " + decisionRetries);
        }
        if (transcriptMaxMessages < 0) {
            throw new IllegalArgumentException(
                    "transcriptMaxMessages must be >= 0, got " + transcriptMaxMessages);
        }
        if (stepTimeout == null || stepTimeout.isNegative() || stepTimeout.isZero()) {
            throw new IllegalArgumentException("stepTimeout must be positive");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive when set");
        }
    }
}
