package me.golemcore.runtime.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.adapter.inbound.web.dto.MessageDto;
import me.golemcore.runtime.adapter.inbound.web.dto.RunRequest;
import me.golemcore.runtime.adapter.inbound.web.dto.RunResponse;
import me.golemcore.runtime.adapter.inbound.web.dto.TraceEventDto;
import me.golemcore.runtime.adapter.outbound.trace.InMemoryTraceSinkAdapter;
import me.golemcore.runtime.domain.loop.AgentRuntime;
import me.golemcore.runtime.domain.loop.CancellationToken;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.domain.model.RunConfig;
import me.golemcore.runtime.domain.model.RunResult;
import me.golemcore.runtime.domain.model.Session;
import me.golemcore.runtime.domain.model.TraceEvent;
import me.golemcore.runtime.security.SecretRedactor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * HTTP front end of the runtime. A run blocks a bounded-elastic thread until
 * the session is terminal; a client disconnect cancels it before the next
 * step.
 */
@RestController
@RequestMapping("/api/runs")
@RequiredArgsConstructor
@Slf4j
public class RunsController {

    private final AgentRuntime agentRuntime;
    private final RunConfig defaultRunConfig;
    private final InMemoryTraceSinkAdapter traceStore;
    private final SecretRedactor redactor;

    @PostMapping
    public Mono<ResponseEntity<RunResponse>> createRun(@RequestBody RunRequest request) {
        if (request == null || request.getTask() == null || request.getTask().isBlank()) {
            throw new IllegalArgumentException("task must not be blank");
        }
        RunConfig config = request.getMaxSteps() != null
                ? defaultRunConfig.toBuilder().maxSteps(request.getMaxSteps()).build()
                : defaultRunConfig;
        config.validate();

        CancellationToken token = new CancellationToken();
        return Mono.fromCallable(() -> agentRuntime.run(request.getTask(), config, token))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnCancel(() -> {
                    log.info("[API] Client went away, cancelling run");
                    token.cancel();
                })
                .map(result -> ResponseEntity.ok(toResponse(result)));
    }

    @GetMapping("/{sessionId}/trace")
    public Mono<ResponseEntity<List<TraceEventDto>>> getTrace(@PathVariable String sessionId) {
        if (!traceStore.hasSession(sessionId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + sessionId);
        }
        List<TraceEventDto> events = traceStore.findBySession(sessionId).stream()
                .map(this::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(events));
    }

    private RunResponse toResponse(RunResult result) {
        Session session = result.session();
        return RunResponse.builder()
                .sessionId(session.getId())
                .status(session.getStatus().wireName())
                .stopReason(session.getStopReason())
                .finalAnswer(result.finalAnswer())
                .steps(session.getStepCount())
                .transcript(session.getTranscript().stream().map(RunsController::toDto).toList())
                .build();
    }

    private static MessageDto toDto(Message message) {
        return MessageDto.builder()
                .role(message.getRole().wireName())
                .content(message.getContent())
                .toolName(message.getToolName())
                .errorCode(message.getErrorCode())
                .timestamp(message.getTimestamp() != null ? message.getTimestamp().toString() : null)
                .build();
    }

    private TraceEventDto toDto(TraceEvent event) {
        return TraceEventDto.builder()
                .step(event.step())
                .sequence(event.sequence())
                .kind(event.kind().wireName())
                .payload(redactor.redact(event.payload()))
                .timestamp(event.timestamp() != null ? event.timestamp().toString() : null)
                .build();
    }
}
