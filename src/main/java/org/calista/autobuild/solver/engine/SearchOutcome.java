package org.calista.autobuild.solver.engine;

import org.calista.autobuild.solver.events.ReasonCode;
import org.calista.autobuild.solver.search.Candidate;

import java.util.List;

/**
 * Result of one search run (or of the whole attempt ladder).
 *
 * <p>Candidates are ranked and at most topN long. An empty outcome always carries a reason.</p>
 */
public final class SearchOutcome {

    public final List<Candidate> candidates;
    /** Null when candidates were found. */
    public final ReasonCode reasonCode;
    public final long processedStates;
    public final String detail;
    /** Ladder tier that produced the outcome, null for a bare engine run. */
    public final String attempt;

    private SearchOutcome(List<Candidate> candidates, ReasonCode reasonCode, long processedStates, String detail, String attempt) {
        this.candidates = List.copyOf(candidates);
        this.reasonCode = reasonCode;
        this.processedStates = processedStates;
        this.detail = detail;
        this.attempt = attempt;
    }

    public static SearchOutcome found(List<Candidate> candidates, long processedStates, String detail) {
        if (candidates.isEmpty()) throw new IllegalArgumentException("found() needs at least one candidate");
        return new SearchOutcome(candidates, null, processedStates, detail, null);
    }

    public static SearchOutcome empty(ReasonCode reasonCode, long processedStates, String detail) {
        return new SearchOutcome(List.of(), reasonCode == null ? ReasonCode.SEARCH_PRUNED : reasonCode, processedStates, detail, null);
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public Candidate best() {
        return candidates.isEmpty() ? null : candidates.get(0);
    }

    public SearchOutcome withAttempt(String label) {
        return new SearchOutcome(candidates, reasonCode, processedStates, detail, label);
    }

    @Override
    public String toString() {
        return "SearchOutcome{candidates=" + candidates.size()
                + (reasonCode == null ? "" : ", reason=" + reasonCode)
                + ", states=" + processedStates
                + (attempt == null ? "" : ", attempt=" + attempt)
                + (detail == null ? "" : ", detail='" + detail + '\'')
                + '}';
    }
}
