package org.calista.autobuild.solver.search;

import org.calista.autobuild.solver.build.BuildSummary;
import org.calista.autobuild.solver.build.SlotAssignment;
import org.calista.autobuild.solver.score.ScoreBreakdown;

import java.util.Comparator;
import java.util.Objects;

/**
 * A complete, validated and scored loadout.
 *
 * <p>Only produced by finalization (the exact and fallback searches reuse the same validation), so
 * every instance satisfies the hard constraints it was finalized against.</p>
 */
public final class Candidate {

    /** Score desc, then item ids in slot order (empty = 0). */
    public static final Comparator<Candidate> RANKING = (a, b) -> {
        int c = Double.compare(b.score, a.score);
        return c != 0 ? c : SlotAssignment.compareBySlotIds(a.slots, b.slots);
    };

    public final SlotAssignment slots;
    public final double score;
    public final ScoreBreakdown breakdown;
    public final BuildSummary summary;

    public Candidate(SlotAssignment slots, double score, ScoreBreakdown breakdown, BuildSummary summary) {
        this.slots = Objects.requireNonNull(slots, "slots");
        this.score = score;
        this.breakdown = Objects.requireNonNull(breakdown, "breakdown");
        this.summary = Objects.requireNonNull(summary, "summary");
    }

    public String canonicalKey() {
        return slots.canonicalKey();
    }

    @Override
    public String toString() {
        return "Candidate{score=" + score + ", slots=" + slots + '}';
    }
}
