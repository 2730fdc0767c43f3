package org.calista.autobuild.solver.util;

/**
 * Raised when a {@link CancellationToken} is cancelled mid-search. Never caught by the engine.
 */
public final class SearchCancelledException extends RuntimeException {

    public SearchCancelledException(String message) {
        super(message);
    }
}
