package org.calista.autobuild.solver.util;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between the caller and a running search.
 *
 * <p>The search polls {@link #throwIfCancelled()} at stage boundaries, per exact / fallback
 * node, during finalization and between rescue tiers.</p>
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /** A token that is never cancelled by the engine itself. */
    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        if (this == NONE) throw new IllegalStateException("shared none() token cannot be cancelled");
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) throw new SearchCancelledException("Auto build cancelled");
    }
}
