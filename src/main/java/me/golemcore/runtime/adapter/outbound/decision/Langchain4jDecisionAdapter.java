package me.golemcore.runtime.adapter.outbound.decision;

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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.DecisionRequest;
import me.golemcore.runtime.domain.model.Message;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Decision provider backed by an OpenAI-compatible chat model through
 * langchain4j. The action protocol and tool catalog travel in the system
 * message, so no native function calling is needed.
 *
 * <p>
 * The model is created lazily on first use; a missing API key fails the
 * decision instead of the application startup. Retries are left to the
 * runtime, so the client itself never retries.
 */
@Component
@Slf4j
public class Langchain4jDecisionAdapter implements DecisionProviderAdapter {

    private final RuntimeProperties properties;
    private final Executor workerPool;
    private volatile ChatModel chatModel;

    @Autowired
    public Langchain4jDecisionAdapter(RuntimeProperties properties,
            @Qualifier("runtimeWorkerPool") Executor runtimeWorkerPool) {
        this.properties = properties;
        this.workerPool = runtimeWorkerPool;
    }

    // Visible for testing
    Langchain4jDecisionAdapter(RuntimeProperties properties, Executor workerPool, ChatModel chatModel) {
        this.properties = properties;
        this.workerPool = workerPool;
        this.chatModel = chatModel;
    }

    @Override
    public String getProviderId() {
        return "openai";
    }

    @Override
    public CompletableFuture<String> decide(DecisionRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ChatModel model = ensureInitialized();
            ChatRequest chatRequest = ChatRequest.builder()
                    .messages(convertMessages(request.transcript()))
                    .build();
            ChatResponse response = model.chat(chatRequest);
            if (response == null || response.aiMessage() == null) {
                throw new IllegalStateException("Chat model returned no message");
            }
            String text = response.aiMessage().text();
            log.debug("[Decision] Session {} step {}: {} chars from {}", request.sessionId(), request.step(),
                    text != null ? text.length() : 0, properties.getDecision().getModel());
            return text != null ? text : "";
        }, workerPool);
    }

    private ChatModel ensureInitialized() {
        ChatModel model = chatModel;
        if (model != null) {
            return model;
        }
        synchronized (this) {
            if (chatModel == null) {
                chatModel = createModel(properties.getDecision());
            }
            return chatModel;
        }
    }

    private static ChatModel createModel(RuntimeProperties.DecisionProperties config) {
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new IllegalStateException("runtime.decision.api-key is not configured");
        }
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0)
                .timeout(config.getRequestTimeout());
        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        if (config.getTemperature() != null) {
            builder.temperature(config.getTemperature());
        }
        log.info("[Decision] Created OpenAI-compatible chat model: {}", config.getModel());
        return builder.build();
    }

    static List<ChatMessage> convertMessages(List<Message> transcript) {
        List<ChatMessage> messages = new ArrayList<>();
        for (Message message : transcript) {
            String content = message.getContent() != null && !message.getContent().isBlank()
                    ? message.getContent()
                    : "(empty)";
            switch (message.getRole()) {
            case SYSTEM:
                messages.add(SystemMessage.from(content));
                break;
            case USER:
                messages.add(UserMessage.from(content));
                break;
            case ASSISTANT:
                messages.add(AiMessage.from(content));
                break;
            case TOOL_OBSERVATION:
                messages.add(UserMessage.from("Observation from " + message.getToolName() + ":\n" + content));
                break;
            default:
                break;
            }
        }
        return messages;
    }
}
