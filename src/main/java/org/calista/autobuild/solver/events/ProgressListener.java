package org.calista.autobuild.solver.events;

/**
 * Receives progress and diagnostics events synchronously on the search thread.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NOOP = e -> { };

    void onProgress(ProgressEvent event);

    /** Fan-out in registration order. */
    default ProgressListener andThen(ProgressListener next) {
        if (next == null) return this;
        return e -> {
            onProgress(e);
            next.onProgress(e);
        };
    }
}
