package org.calista.autobuild.solver.constraints;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Targets — жёсткие пороги по метрикам билда.
 *
 * <p>Все пороги опциональны (null = не задан). Кастомные диапазоны проверяются по сумме ключа
 * на всех надетых предметах; ключ {@code atkTier} обрабатывается отдельно (см. attack tier requirement).</p>
 */
public final class Targets {

    public static final Targets NONE = builder().build();

    public final Double minLegacyBaseDps;
    public final Double minLegacyEhp;
    public final Double minDpsProxy;
    public final Double minEhpProxy;
    public final Double minMr;
    public final Double minMs;
    public final Double minSpeed;
    public final Double minSkillPointTotal;
    public final Double maxReqTotal;
    public final List<NumericRange> customRanges;

    private Targets(Builder b) {
        this.minLegacyBaseDps = finiteOrNull(b.minLegacyBaseDps, "minLegacyBaseDps");
        this.minLegacyEhp = finiteOrNull(b.minLegacyEhp, "minLegacyEhp");
        this.minDpsProxy = finiteOrNull(b.minDpsProxy, "minDpsProxy");
        this.minEhpProxy = finiteOrNull(b.minEhpProxy, "minEhpProxy");
        this.minMr = finiteOrNull(b.minMr, "minMr");
        this.minMs = finiteOrNull(b.minMs, "minMs");
        this.minSpeed = finiteOrNull(b.minSpeed, "minSpeed");
        this.minSkillPointTotal = finiteOrNull(b.minSkillPointTotal, "minSkillPointTotal");
        this.maxReqTotal = finiteOrNull(b.maxReqTotal, "maxReqTotal");
        this.customRanges = Collections.unmodifiableList(new ArrayList<>(b.customRanges));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.minLegacyBaseDps = minLegacyBaseDps;
        b.minLegacyEhp = minLegacyEhp;
        b.minDpsProxy = minDpsProxy;
        b.minEhpProxy = minEhpProxy;
        b.minMr = minMr;
        b.minMs = minMs;
        b.minSpeed = minSpeed;
        b.minSkillPointTotal = minSkillPointTotal;
        b.maxReqTotal = maxReqTotal;
        b.customRanges.addAll(customRanges);
        return b;
    }

    /** Any threshold at all, custom ranges included. */
    public boolean hasAnyThreshold() {
        return minLegacyBaseDps != null
                || minLegacyEhp != null
                || minDpsProxy != null
                || minEhpProxy != null
                || minMr != null
                || minMs != null
                || minSpeed != null
                || minSkillPointTotal != null
                || maxReqTotal != null
                || !customRanges.isEmpty();
    }

    /**
     * Thresholds that justify the final threshold rescue of the attempt ladder.
     */
    public boolean hasLadderRescueThreshold() {
        return minDpsProxy != null || minEhpProxy != null || minSkillPointTotal != null || !customRanges.isEmpty();
    }

    /**
     * Active custom ranges (blank keys and bound-less rows dropped).
     *
     * @param includeAttackTier whether {@code atkTier} rows are kept
     */
    public List<NumericRange> customSpecs(boolean includeAttackTier) {
        List<NumericRange> out = new ArrayList<>(customRanges.size());
        for (NumericRange r : customRanges) {
            if (r == null || !r.isActive()) continue;
            if (!includeAttackTier && r.isAttackTier()) continue;
            out.add(r);
        }
        return out;
    }

    public List<NumericRange> attackTierSpecs() {
        List<NumericRange> out = new ArrayList<>(2);
        for (NumericRange r : customSpecs(true)) {
            if (r.isAttackTier()) out.add(r);
        }
        return out;
    }

    private static Double finiteOrNull(Double v, String field) {
        if (v == null) return null;
        if (!Double.isFinite(v)) throw new IllegalArgumentException(field + " must be finite");
        return v;
    }

    public static final class Builder {
        private Double minLegacyBaseDps;
        private Double minLegacyEhp;
        private Double minDpsProxy;
        private Double minEhpProxy;
        private Double minMr;
        private Double minMs;
        private Double minSpeed;
        private Double minSkillPointTotal;
        private Double maxReqTotal;
        private final List<NumericRange> customRanges = new ArrayList<>();

        private Builder() {}

        public Builder minLegacyBaseDps(Double v) { this.minLegacyBaseDps = v; return this; }
        public Builder minLegacyEhp(Double v) { this.minLegacyEhp = v; return this; }
        public Builder minDpsProxy(Double v) { this.minDpsProxy = v; return this; }
        public Builder minEhpProxy(Double v) { this.minEhpProxy = v; return this; }
        public Builder minMr(Double v) { this.minMr = v; return this; }
        public Builder minMs(Double v) { this.minMs = v; return this; }
        public Builder minSpeed(Double v) { this.minSpeed = v; return this; }
        public Builder minSkillPointTotal(Double v) { this.minSkillPointTotal = v; return this; }
        public Builder maxReqTotal(Double v) { this.maxReqTotal = v; return this; }

        public Builder customRange(NumericRange r) {
            customRanges.add(Objects.requireNonNull(r, "range"));
            return this;
        }

        public Builder customRanges(List<NumericRange> rs) {
            customRanges.clear();
            if (rs != null) {
                for (NumericRange r : rs) {
                    if (r != null) customRanges.add(r);
                }
            }
            return this;
        }

        public Targets build() {
            return new Targets(this);
        }
    }
}
