package com.questrail.rotator.session;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide stop signal shared by the listener and every session it spawns.
 *
 * <p>The token is only consulted at blocking boundaries (before an accept, before
 * a client read). A read already in progress is <strong>not</strong> interrupted
 * by cancellation; only closing the underlying socket ends it.</p>
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Request cancellation.
     *
     * @return {@code true} if this call performed the transition
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
