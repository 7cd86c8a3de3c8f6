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

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One execution of the tool-use loop for one task.
 *
 * <p>
 * A session is owned by the runtime instance executing it and is never mutated
 * concurrently. The transcript is append-only; {@link #getTranscript()} returns
 * a read-only view. The step counter grows by exactly one per completed
 * iteration and never exceeds {@link RunConfig#getMaxSteps()}.
 *
 * <p>
 * Both the run configuration and the policy snapshot are captured when the
 * session is created, so configuration reloads never affect a running session.
 */
@Getter
public class Session {

    private final String id;
    private final String task;
    private final RunConfig config;
    private final PolicySnapshot policy;
    private final Instant createdAt;

    @Getter(lombok.AccessLevel.NONE)
    private final List<Message> transcript = new ArrayList<>();

    private int stepCount;
    private SessionStatus status = SessionStatus.RUNNING;
    private String finalAnswer;
    private String stopReason;
    private Instant finishedAt;

    @Getter(lombok.AccessLevel.NONE)
    private long traceSequence;

    public Session(String id, String task, RunConfig config, PolicySnapshot policy, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.task = Objects.requireNonNull(task, "task must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.createdAt = createdAt;
    }

    public List<Message> getTranscript() {
        return Collections.unmodifiableList(transcript);
    }

    public boolean isRunning() {
        return status == SessionStatus.RUNNING;
    }

    /**
     * Appends a message to the transcript.
     *
     * @throws IllegalStateException
     *             if the session already reached a terminal status
     */
    public void append(Message message) {
        Objects.requireNonNull(message, "message must not be null");
        ensureRunning();
        transcript.add(message);
    }

    /**
     * Marks one loop iteration as completed.
     *
     * @throws IllegalStateException
     *             if the step limit would be exceeded
     */
    public void advanceStep() {
        ensureRunning();
        if (stepCount >= config.getMaxSteps()) {
            throw new IllegalStateException("Step limit already reached: " + config.getMaxSteps());
        }
        stepCount++;
    }

    public void complete(String answer, Instant at) {
        finish(SessionStatus.COMPLETED, answer, "final_answer", at);
    }

    public void stopAtLimit(String answer, String reason, Instant at) {
        finish(SessionStatus.STEP_LIMIT_REACHED, answer, reason, at);
    }

    public void fail(String reason, Instant at) {
        finish(SessionStatus.FAILED, null, reason, at);
    }

    /**
     * Next sequence number for trace events of this session. Sequence numbers are
     * strictly increasing, which keeps emission order within a step.
     */
    public long nextTraceSequence() {
        return traceSequence++;
    }

    private void finish(SessionStatus terminal, String answer, String reason, Instant at) {
        ensureRunning();
        this.status = terminal;
        this.finalAnswer = answer;
        this.stopReason = reason;
        this.finishedAt = at;
    }

    private void ensureRunning() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Session " + id + " is already " + status.wireName());
        }
    }
}
