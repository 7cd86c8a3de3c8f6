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
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/**
 * Fetches a URL with HTTP GET and returns the status line and body text.
 *
 * <p>
 * Which hosts are reachable is decided by the policy gate from the {@code url}
 * argument. Redirects are not followed, so a response can never lead the call
 * to a host the policy did not check. The body is cut to the configured number
 * of characters.
 */
@Component
@Slf4j
public class HttpGetTool implements ToolComponent {

    private final OkHttpClient httpClient;
    private final int maxBodyChars;
    private final boolean enabled;

    @Autowired
    public HttpGetTool(OkHttpClient httpClient, RuntimeProperties properties) {
        this(httpClient, properties.getTools().getHttpGet().getMaxBodyChars(),
                properties.getTools().getHttpGet().isEnabled());
    }

    public HttpGetTool(OkHttpClient httpClient, int maxBodyChars, boolean enabled) {
        this.httpClient = httpClient;
        this.maxBodyChars = maxBodyChars;
        this.enabled = enabled;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("http_get")
                .description("Fetch a web page or API response with HTTP GET.")
                .inputSchema(InputSchema.builder()
                        .field(InputSchema.required("url", InputSchema.FieldType.STRING, "Absolute http(s) URL"))
                        .build())
                .riskClass(RiskClass.NETWORK)
                .urlArgument("url")
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(ValidatedArgs args) {
        return CompletableFuture.completedFuture(fetch(args.getString("url")));
    }

    private ToolResult fetch(String url) {
        HttpUrl httpUrl = url != null ? HttpUrl.parse(url.strip()) : null;
        if (httpUrl == null) {
            return ToolResult.failure("Invalid URL: " + url);
        }
        Request request = new Request.Builder().url(httpUrl).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (text.length() > maxBodyChars) {
                text = text.substring(0, maxBodyChars);
            }
            log.debug("[HttpGet] {} -> {}", httpUrl.host(), response.code());
            if (!response.isSuccessful()) {
                return ToolResult.failure("HTTP " + response.code() + " from " + httpUrl.host()
                        + (text.isBlank() ? "" : ": " + text));
            }
            return ToolResult.success("HTTP " + response.code() + "\n" + text);
        } catch (IOException e) {
            log.warn("[HttpGet] Request to {} failed: {}", httpUrl.host(), e.getMessage());
            return ToolResult.failure("Request failed: " + e.getMessage());
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }
}
