package org.calista.autobuild.solver.constraints;

/**
 * Linear scoring weights.
 *
 * <p>Immutable; {@link #toBuilder()} gives a modified copy. Two derived profiles exist:
 * {@link #thresholdBiased(Targets)} boosts thresholded dimensions, {@link #rescue()} shifts weight
 * from damage toward survivability and low requirements.</p>
 */
public final class Weights {

    /** Factor applied to the default weight of every thresholded dimension. */
    public static final double THRESHOLD_WEIGHT_BOOST = 2.5;

    public static final Weights DEFAULTS = builder().build();

    public final double legacyBaseDps;
    public final double legacyEhp;
    public final double dpsProxy;
    public final double spellProxy;
    public final double meleeProxy;
    public final double ehpProxy;
    public final double speed;
    public final double sustain;
    public final double skillPointTotal;
    public final double reqTotalPenalty;

    private Weights(Builder b) {
        this.legacyBaseDps = finite(b.legacyBaseDps, "legacyBaseDps");
        this.legacyEhp = finite(b.legacyEhp, "legacyEhp");
        this.dpsProxy = finite(b.dpsProxy, "dpsProxy");
        this.spellProxy = finite(b.spellProxy, "spellProxy");
        this.meleeProxy = finite(b.meleeProxy, "meleeProxy");
        this.ehpProxy = finite(b.ehpProxy, "ehpProxy");
        this.speed = finite(b.speed, "speed");
        this.sustain = finite(b.sustain, "sustain");
        this.skillPointTotal = finite(b.skillPointTotal, "skillPointTotal");
        this.reqTotalPenalty = finite(b.reqTotalPenalty, "reqTotalPenalty");
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .legacyBaseDps(legacyBaseDps)
                .legacyEhp(legacyEhp)
                .dpsProxy(dpsProxy)
                .spellProxy(spellProxy)
                .meleeProxy(meleeProxy)
                .ehpProxy(ehpProxy)
                .speed(speed)
                .sustain(sustain)
                .skillPointTotal(skillPointTotal)
                .reqTotalPenalty(reqTotalPenalty);
    }

    /**
     * Raises each thresholded dimension to at least default * {@value #THRESHOLD_WEIGHT_BOOST}.
     * mr / ms thresholds and custom ranges boost sustain.
     */
    public Weights thresholdBiased(Targets target) {
        if (target == null) return this;
        Weights d = DEFAULTS;
        double k = THRESHOLD_WEIGHT_BOOST;
        Builder b = toBuilder();
        if (target.minLegacyBaseDps != null) b.legacyBaseDps(Math.max(legacyBaseDps, d.legacyBaseDps * k));
        if (target.minLegacyEhp != null) b.legacyEhp(Math.max(legacyEhp, d.legacyEhp * k));
        if (target.minDpsProxy != null) b.dpsProxy(Math.max(dpsProxy, d.dpsProxy * k));
        if (target.minEhpProxy != null) b.ehpProxy(Math.max(ehpProxy, d.ehpProxy * k));
        if (target.minMr != null || target.minMs != null || !target.customRanges.isEmpty()) {
            b.sustain(Math.max(sustain, d.sustain * k));
        }
        if (target.minSpeed != null) b.speed(Math.max(speed, d.speed * k));
        if (target.minSkillPointTotal != null) b.skillPointTotal(Math.max(skillPointTotal, d.skillPointTotal * k));
        if (target.maxReqTotal != null) b.reqTotalPenalty(Math.max(reqTotalPenalty, d.reqTotalPenalty * k));
        return b.build();
    }

    /** Profile used by rescue attempts of the ladder. */
    public Weights rescue() {
        return toBuilder()
                .legacyBaseDps(legacyBaseDps * 0.6)
                .dpsProxy(dpsProxy * 0.55)
                .legacyEhp(Math.max(legacyEhp, 1.0))
                .ehpProxy(Math.max(ehpProxy, 1.0))
                .sustain(Math.max(sustain, 0.8))
                .skillPointTotal(Math.max(skillPointTotal, 0.8))
                .reqTotalPenalty(Math.max(reqTotalPenalty, 1.8))
                .build();
    }

    private static double finite(double v, String field) {
        if (!Double.isFinite(v)) throw new IllegalArgumentException("weights." + field + " must be finite");
        return v;
    }

    @Override
    public String toString() {
        return "Weights{baseDps=" + legacyBaseDps + ", ehp=" + legacyEhp + ", dps=" + dpsProxy
                + ", spell=" + spellProxy + ", melee=" + meleeProxy + ", ehpProxy=" + ehpProxy
                + ", speed=" + speed + ", sustain=" + sustain + ", sp=" + skillPointTotal
                + ", reqPenalty=" + reqTotalPenalty + "}";
    }

    public static final class Builder {
        private double legacyBaseDps = 1.0;
        private double legacyEhp = 0.7;
        private double dpsProxy = 1.0;
        private double spellProxy = 0.0;
        private double meleeProxy = 0.0;
        private double ehpProxy = 0.6;
        private double speed = 0.4;
        private double sustain = 0.35;
        private double skillPointTotal = 0.15;
        private double reqTotalPenalty = 0.2;

        private Builder() {}

        public Builder legacyBaseDps(double v) { this.legacyBaseDps = v; return this; }
        public Builder legacyEhp(double v) { this.legacyEhp = v; return this; }
        public Builder dpsProxy(double v) { this.dpsProxy = v; return this; }
        public Builder spellProxy(double v) { this.spellProxy = v; return this; }
        public Builder meleeProxy(double v) { this.meleeProxy = v; return this; }
        public Builder ehpProxy(double v) { this.ehpProxy = v; return this; }
        public Builder speed(double v) { this.speed = v; return this; }
        public Builder sustain(double v) { this.sustain = v; return this; }
        public Builder skillPointTotal(double v) { this.skillPointTotal = v; return this; }
        public Builder reqTotalPenalty(double v) { this.reqTotalPenalty = v; return this; }

        public Weights build() {
            return new Weights(this);
        }
    }
}
