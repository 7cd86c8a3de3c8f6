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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.DecisionRequest;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.DecisionPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Primary {@link DecisionPort} that delegates to the provider selected by
 * {@code runtime.decision.provider}. Falls back to the offline mock provider
 * when the configured one is not available.
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class DecisionAdapterFactory implements DecisionPort {

    private static final String PROVIDER_MOCK = "mock";

    private final RuntimeProperties properties;
    private final List<DecisionProviderAdapter> adapters;

    private final Map<String, DecisionProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private DecisionProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (DecisionProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("[Decision] Registered decision adapter: {}", adapter.getProviderId());
        }

        String provider = properties.getDecision().getProvider();
        activeAdapter = adaptersByProvider.get(provider);

        if (activeAdapter == null) {
            activeAdapter = adaptersByProvider.get(PROVIDER_MOCK);
            if (activeAdapter == null && !adapters.isEmpty()) {
                activeAdapter = adapters.get(0);
            }
            log.warn("[Decision] Provider '{}' not found, using: {}",
                    provider, activeAdapter != null ? activeAdapter.getProviderId() : "none");
        } else {
            log.info("[Decision] Active decision provider: {}", provider);
        }
    }

    public DecisionPort getActiveAdapter() {
        return activeAdapter;
    }

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : "none";
    }

    @Override
    public CompletableFuture<String> decide(DecisionRequest request) {
        if (activeAdapter == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No decision provider configured"));
        }
        return activeAdapter.decide(request);
    }
}
