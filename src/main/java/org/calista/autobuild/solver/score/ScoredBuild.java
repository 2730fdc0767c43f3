package org.calista.autobuild.solver.score;

import java.util.Objects;

/**
 * Small immutable pair of a score and the breakdown it was summed from.
 */
public final class ScoredBuild {
    public final double score;
    public final ScoreBreakdown breakdown;

    public ScoredBuild(double score, ScoreBreakdown breakdown) {
        this.score = score;
        this.breakdown = Objects.requireNonNull(breakdown, "breakdown");
    }

    @Override
    public String toString() {
        return "ScoredBuild{score=" + score + ", " + breakdown + '}';
    }
}
