package me.golemcore.runtime.domain.policy;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.model.PolicySnapshot;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current policy snapshot. Updates swap the whole snapshot
 * atomically; sessions already running keep the snapshot they captured.
 */
@Slf4j
public class PolicySnapshotHolder {

    private final AtomicReference<PolicySnapshot> current;

    public PolicySnapshotHolder(PolicySnapshot initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial policy must not be null"));
    }

    public PolicySnapshot current() {
        return current.get();
    }

    public void update(PolicySnapshot snapshot) {
        Objects.requireNonNull(snapshot, "policy must not be null");
        current.set(snapshot);
        log.info("[Policy] Policy updated: {}", snapshot.summary());
    }
}
