package org.calista.autobuild.solver.search;

import java.time.Clock;
import java.util.Objects;

/**
 * SearchTuning — эмпирические ручки движка, не входящие в пользовательские ограничения.
 *
 * <p>Defaults reproduce the reference behaviour: 60% of every beam goes to the primary lane,
 * the per-node branch cap is clamped to [8, 96], beams never shrink below 20 (standard) or
 * 40 (feasibility-biased) nodes, and the deterministic fallback stops after 2 seconds.</p>
 */
public final class SearchTuning {

    public static final SearchTuning DEFAULTS = builder().build();

    public final double primaryShare;
    public final int minBranchCap;
    public final int maxBranchCap;
    public final int standardBeamFloor;
    public final int feasibilityBeamFloor;
    public final long fallbackTimeCapMs;
    public final int previewSize;
    public final int exactProgressInterval;
    /** Wall clock of the deterministic fallback. */
    public final Clock clock;

    private SearchTuning(Builder b) {
        if (!(b.primaryShare > 0.0 && b.primaryShare <= 1.0)) {
            throw new IllegalArgumentException("tuning.primaryShare must be in (0, 1]: " + b.primaryShare);
        }
        if (b.minBranchCap < 1) throw new IllegalArgumentException("tuning.minBranchCap must be >= 1: " + b.minBranchCap);
        if (b.maxBranchCap < b.minBranchCap) {
            throw new IllegalArgumentException("tuning.maxBranchCap must be >= minBranchCap: " + b.maxBranchCap);
        }
        if (b.standardBeamFloor < 1) throw new IllegalArgumentException("tuning.standardBeamFloor must be >= 1");
        if (b.feasibilityBeamFloor < 1) throw new IllegalArgumentException("tuning.feasibilityBeamFloor must be >= 1");
        if (b.fallbackTimeCapMs < 0) throw new IllegalArgumentException("tuning.fallbackTimeCapMs must be >= 0");
        if (b.previewSize < 0) throw new IllegalArgumentException("tuning.previewSize must be >= 0");
        if (b.exactProgressInterval < 1) throw new IllegalArgumentException("tuning.exactProgressInterval must be >= 1");

        this.primaryShare = b.primaryShare;
        this.minBranchCap = b.minBranchCap;
        this.maxBranchCap = b.maxBranchCap;
        this.standardBeamFloor = b.standardBeamFloor;
        this.feasibilityBeamFloor = b.feasibilityBeamFloor;
        this.fallbackTimeCapMs = b.fallbackTimeCapMs;
        this.previewSize = b.previewSize;
        this.exactProgressInterval = b.exactProgressInterval;
        this.clock = Objects.requireNonNull(b.clock, "clock");
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .primaryShare(primaryShare)
                .branchCapBounds(minBranchCap, maxBranchCap)
                .standardBeamFloor(standardBeamFloor)
                .feasibilityBeamFloor(feasibilityBeamFloor)
                .fallbackTimeCapMs(fallbackTimeCapMs)
                .previewSize(previewSize)
                .exactProgressInterval(exactProgressInterval)
                .clock(clock);
    }

    /**
     * Per-node branch cap for one stage: the remaining state budget spread over the beam and the
     * remaining stages, clamped to [minBranchCap, maxBranchCap] and never above the pool size.
     * Returns 0 for an empty pool.
     */
    public int branchCap(int poolSize, int beamSize, int remainingStages, long processedStates, long maxStates) {
        if (poolSize <= 0) return 0;
        long remainingBudget = Math.max(0L, maxStates - processedStates);
        long denominator = Math.max(1L, (long) beamSize * Math.max(1, remainingStages));
        long perNode = remainingBudget / denominator;
        long cap = Math.max(minBranchCap, Math.min(maxBranchCap, perNode));
        return (int) Math.min(poolSize, cap);
    }

    @Override
    public String toString() {
        return "SearchTuning{primaryShare=" + primaryShare + ", branchCap=[" + minBranchCap + ", " + maxBranchCap
                + "], floors=" + standardBeamFloor + "/" + feasibilityBeamFloor
                + ", fallbackCapMs=" + fallbackTimeCapMs + '}';
    }

    public static final class Builder {
        private double primaryShare = 0.6;
        private int minBranchCap = 8;
        private int maxBranchCap = 96;
        private int standardBeamFloor = 20;
        private int feasibilityBeamFloor = 40;
        private long fallbackTimeCapMs = 2000L;
        private int previewSize = 2;
        private int exactProgressInterval = 2000;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder primaryShare(double v) { this.primaryShare = v; return this; }

        public Builder branchCapBounds(int min, int max) {
            this.minBranchCap = min;
            this.maxBranchCap = max;
            return this;
        }

        public Builder standardBeamFloor(int v) { this.standardBeamFloor = v; return this; }
        public Builder feasibilityBeamFloor(int v) { this.feasibilityBeamFloor = v; return this; }
        public Builder fallbackTimeCapMs(long v) { this.fallbackTimeCapMs = v; return this; }
        public Builder previewSize(int v) { this.previewSize = v; return this; }
        public Builder exactProgressInterval(int v) { this.exactProgressInterval = v; return this; }
        public Builder clock(Clock v) { this.clock = v; return this; }

        public SearchTuning build() {
            return new SearchTuning(this);
        }
    }
}
