package org.calista.autobuild.solver.search;

import org.calista.autobuild.solver.constraints.NumericRange;

import java.util.List;

/**
 * Intersection of every {@code atkTier} custom range: min = largest min, max = smallest max.
 */
public final class AttackTierRequirement {

    public static final AttackTierRequirement NONE =
            new AttackTierRequirement(false, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);

    public final boolean configured;
    public final double minAllowed;
    public final double maxAllowed;

    private AttackTierRequirement(boolean configured, double minAllowed, double maxAllowed) {
        this.configured = configured;
        this.minAllowed = minAllowed;
        this.maxAllowed = maxAllowed;
    }

    public static AttackTierRequirement of(List<NumericRange> rows) {
        if (rows == null || rows.isEmpty()) return NONE;
        double min = Double.NEGATIVE_INFINITY;
        double max = Double.POSITIVE_INFINITY;
        for (NumericRange r : rows) {
            if (r.hasMin()) min = Math.max(min, r.min);
            if (r.hasMax()) max = Math.min(max, r.max);
        }
        return new AttackTierRequirement(true, min, max);
    }

    /** min above max: nothing can ever satisfy the requirement. */
    public boolean isInverted() {
        return configured && minAllowed > maxAllowed;
    }

    public boolean isSatisfiedBy(int totalAtkTier) {
        return configured && totalAtkTier >= minAllowed && totalAtkTier <= maxAllowed;
    }

    /**
     * @param minTotal smallest reachable atkTier total
     * @param maxTotal largest reachable atkTier total
     */
    public boolean canStillReach(int minTotal, int maxTotal) {
        if (!configured) return false;
        int lo = Math.min(minTotal, maxTotal);
        int hi = Math.max(minTotal, maxTotal);
        return lo <= maxAllowed && hi >= minAllowed;
    }

    public String describe(int total) {
        return "atkTier (" + total + " not in [" + bound(minAllowed) + ", " + bound(maxAllowed) + "])";
    }

    private static String bound(double v) {
        if (Double.isInfinite(v)) return v > 0 ? "+inf" : "-inf";
        return v == Math.rint(v) ? Long.toString((long) v) : Double.toString(v);
    }

    @Override
    public String toString() {
        return configured ? "atkTier[" + bound(minAllowed) + ", " + bound(maxAllowed) + "]" : "atkTier[none]";
    }
}
