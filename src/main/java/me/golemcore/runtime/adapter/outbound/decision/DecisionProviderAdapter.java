package me.golemcore.runtime.adapter.outbound.decision;

import me.golemcore.runtime.port.outbound.DecisionPort;

/**
 * Marker for concrete decision providers. The active one is chosen by
 * {@link DecisionAdapterFactory} from {@code runtime.decision.provider}.
 */
public interface DecisionProviderAdapter extends DecisionPort {
}
