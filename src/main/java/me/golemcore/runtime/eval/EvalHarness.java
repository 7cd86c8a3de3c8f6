package me.golemcore.runtime.eval;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.loop.AgentRuntime;
import me.golemcore.runtime.domain.model.RunConfig;
import me.golemcore.runtime.domain.model.RunResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Runs evaluation cases through the runtime and checks each final answer for
 * the expected substrings (case-insensitive).
 *
 * <p>
 * Cases are read from JSONL: one {@code {"id","task","expect_contains"}}
 * object per line; blank lines and lines starting with {@code #} are skipped.
 */
@RequiredArgsConstructor
@Slf4j
public class EvalHarness {

    private final AgentRuntime runtime;
    private final ObjectMapper objectMapper;

    /**
     * @throws IOException
     *             if the file cannot be read
     * @throws IllegalArgumentException
     *             if a line is not a valid case
     */
    public List<EvalCase> loadCases(Path file) throws IOException {
        List<EvalCase> cases = new ArrayList<>();
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            EvalCase evalCase;
            try {
                evalCase = objectMapper.readValue(line, EvalCase.class);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("Invalid eval case at line " + (i + 1) + ": "
                        + e.getOriginalMessage(), e);
            }
            if (evalCase.task() == null || evalCase.task().isBlank()) {
                throw new IllegalArgumentException("Eval case at line " + (i + 1) + " has no task");
            }
            cases.add(evalCase.id() != null ? evalCase
                    : new EvalCase("case-" + (i + 1), evalCase.task(), evalCase.expectContains()));
        }
        return cases;
    }

    public EvalReport run(List<EvalCase> cases, RunConfig config) {
        List<EvalResult> results = new ArrayList<>();
        for (EvalCase evalCase : cases) {
            EvalResult result = runCase(evalCase, config);
            log.info("[Eval] {} {}: {}", result.passed() ? "OK" : "FAIL", result.id(), result.finalAnswer());
            results.add(result);
        }
        EvalReport report = new EvalReport(results);
        log.info("[Eval] {}", report.summary());
        return report;
    }

    private EvalResult runCase(EvalCase evalCase, RunConfig config) {
        RunResult run = runtime.run(evalCase.task(), config);
        String answer = run.finalAnswer() != null ? run.finalAnswer() : "";
        String normalized = answer.toLowerCase(Locale.ROOT);
        List<String> missing = new ArrayList<>();
        for (String expected : evalCase.expectContains()) {
            if (!normalized.contains(expected.toLowerCase(Locale.ROOT))) {
                missing.add(expected);
            }
        }
        return new EvalResult(evalCase.id(), missing.isEmpty(), answer, run.status(),
                run.session().getStepCount(), List.copyOf(missing));
    }
}
