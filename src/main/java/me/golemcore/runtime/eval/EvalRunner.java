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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.RunConfig;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs the eval harness at startup when {@code runtime.eval.cases-file} is
 * set.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EvalRunner implements ApplicationRunner {

    private final EvalHarness harness;
    private final RuntimeProperties properties;
    private final RunConfig defaultRunConfig;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        String casesFile = properties.getEval().getCasesFile();
        if (casesFile == null || casesFile.isBlank()) {
            return;
        }
        Path path = RuntimeProperties.resolvePath(casesFile);
        log.info("[Eval] Running cases from {}", path);
        RunConfig config = defaultRunConfig.toBuilder()
                .maxSteps(properties.getEval().getMaxSteps())
                .memoryEnabled(false)
                .build();
        EvalReport report = harness.run(harness.loadCases(path), config);
        log.info("[Eval] Finished: {}", report.summary());
    }
}
