package me.golemcore.runtime.domain.loop;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for one session. The runtime checks it before
 * each step and before each decision or tool call; work already in flight is
 * not interrupted.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * A fresh token nobody else holds, so it is never cancelled.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
