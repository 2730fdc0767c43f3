package org.calista.autobuild.solver.constraints;

/**
 * Search budgets.
 */
public final class Budgets {

    public static final Budgets DEFAULTS = builder().build();

    public final int topN;
    public final int topKPerSlot;
    public final int beamWidth;
    public final long maxStates;
    public final boolean useExhaustiveSmallPool;
    public final long exhaustiveStateLimit;

    private Budgets(Builder b) {
        if (b.topN < 1) throw new IllegalArgumentException("budgets.topN must be >= 1: " + b.topN);
        if (b.topKPerSlot < 1) throw new IllegalArgumentException("budgets.topKPerSlot must be >= 1: " + b.topKPerSlot);
        if (b.beamWidth < 1) throw new IllegalArgumentException("budgets.beamWidth must be >= 1: " + b.beamWidth);
        if (b.maxStates < 1) throw new IllegalArgumentException("budgets.maxStates must be >= 1: " + b.maxStates);
        if (b.exhaustiveStateLimit < 0) {
            throw new IllegalArgumentException("budgets.exhaustiveStateLimit must be >= 0: " + b.exhaustiveStateLimit);
        }
        this.topN = b.topN;
        this.topKPerSlot = b.topKPerSlot;
        this.beamWidth = b.beamWidth;
        this.maxStates = b.maxStates;
        this.useExhaustiveSmallPool = b.useExhaustiveSmallPool;
        this.exhaustiveStateLimit = b.exhaustiveStateLimit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .topN(topN)
                .topKPerSlot(topKPerSlot)
                .beamWidth(beamWidth)
                .maxStates(maxStates)
                .useExhaustiveSmallPool(useExhaustiveSmallPool)
                .exhaustiveStateLimit(exhaustiveStateLimit);
    }

    @Override
    public String toString() {
        return "Budgets{topN=" + topN + ", topK=" + topKPerSlot + ", beam=" + beamWidth
                + ", maxStates=" + maxStates + ", exhaustive=" + useExhaustiveSmallPool
                + "/" + exhaustiveStateLimit + "}";
    }

    public static final class Builder {
        private int topN = 50;
        private int topKPerSlot = 80;
        private int beamWidth = 400;
        private long maxStates = 150_000L;
        private boolean useExhaustiveSmallPool = true;
        private long exhaustiveStateLimit = 250_000L;

        private Builder() {}

        public Builder topN(int v) { this.topN = v; return this; }
        public Builder topKPerSlot(int v) { this.topKPerSlot = v; return this; }
        public Builder beamWidth(int v) { this.beamWidth = v; return this; }
        public Builder maxStates(long v) { this.maxStates = v; return this; }
        public Builder useExhaustiveSmallPool(boolean v) { this.useExhaustiveSmallPool = v; return this; }
        public Builder exhaustiveStateLimit(long v) { this.exhaustiveStateLimit = v; return this; }

        public Budgets build() {
            return new Budgets(this);
        }
    }
}
