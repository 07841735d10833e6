package io.powledger.core.consensus;

import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative stop signal for an in-flight nonce search. */
public final class MiningCancellation {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
