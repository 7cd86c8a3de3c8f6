package me.golemcore.runtime.tools;

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
import me.golemcore.runtime.domain.component.ToolComponent;
import me.golemcore.runtime.domain.model.InputSchema;
import me.golemcore.runtime.domain.model.RiskClass;
import me.golemcore.runtime.domain.model.ToolDefinition;
import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.domain.model.ValidatedArgs;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Evaluates arithmetic expressions: {@code + - * / % ^}, parentheses and unary
 * minus. Pure; touches no external state.
 */
@Component
@Slf4j
public class CalculatorTool implements ToolComponent {

    private final boolean enabled;

    public CalculatorTool(RuntimeProperties properties) {
        this.enabled = properties.getTools().getCalculator().isEnabled();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("calculator")
                .description("Evaluate an arithmetic expression, e.g. (2+3)*4.")
                .inputSchema(InputSchema.builder()
                        .field(InputSchema.required("expression", InputSchema.FieldType.STRING,
                                "Expression using + - * / % ^ and parentheses"))
                        .build())
                .riskClass(RiskClass.PURE)
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(ValidatedArgs args) {
        String expression = args.getString("expression");
        try {
            String result = ExpressionEvaluator.format(ExpressionEvaluator.evaluate(expression));
            log.debug("[Calculator] {} = {}", expression, result);
            return CompletableFuture.completedFuture(ToolResult.success(result));
        } catch (IllegalArgumentException | ArithmeticException e) {
            return CompletableFuture.completedFuture(ToolResult.failure("Invalid expression: " + e.getMessage()));
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }
}
