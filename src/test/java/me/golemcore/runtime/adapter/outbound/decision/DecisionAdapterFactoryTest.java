package me.golemcore.runtime.adapter.outbound.decision;

import me.golemcore.runtime.domain.model.DecisionRequest;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DecisionAdapterFactoryTest {

    private static final DecisionRequest REQUEST = new DecisionRequest("s1", 0, List.of(), List.of());

    private static DecisionProviderAdapter adapter(String providerId, String reply) {
        DecisionProviderAdapter adapter = mock(DecisionProviderAdapter.class);
        when(adapter.getProviderId()).thenReturn(providerId);
        when(adapter.decide(any(DecisionRequest.class))).thenReturn(CompletableFuture.completedFuture(reply));
        return adapter;
    }

    private static DecisionAdapterFactory factory(String provider, DecisionProviderAdapter... adapters) {
        RuntimeProperties properties = new RuntimeProperties();
        properties.getDecision().setProvider(provider);
        DecisionAdapterFactory factory = new DecisionAdapterFactory(properties, List.of(adapters));
        factory.init();
        return factory;
    }

    @Test
    void shouldDelegateToConfiguredProvider() throws Exception {
        DecisionProviderAdapter mock = adapter("mock", "from mock");
        DecisionProviderAdapter openai = adapter("openai", "from openai");

        DecisionAdapterFactory factory = factory("openai", mock, openai);

        assertSame(openai, factory.getActiveAdapter());
        assertEquals("openai", factory.getProviderId());
        assertEquals("from openai", factory.decide(REQUEST).get());
    }

    @Test
    void shouldFallBackToMockForUnknownProvider() throws Exception {
        DecisionProviderAdapter mock = adapter("mock", "from mock");
        DecisionProviderAdapter openai = adapter("openai", "from openai");

        DecisionAdapterFactory factory = factory("anthropic", openai, mock);

        assertEquals("mock", factory.getProviderId());
        assertEquals("from mock", factory.decide(REQUEST).get());
    }

    @Test
    void shouldFailDecisionsWithoutAnyProvider() {
        DecisionAdapterFactory factory = factory("openai");

        assertEquals("none", factory.getProviderId());
        assertThrows(ExecutionException.class, () -> factory.decide(REQUEST).get());
    }
}
