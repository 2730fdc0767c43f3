package org.calista.autobuild.solver.search;

import org.calista.autobuild.solver.catalog.Slot;
import org.calista.autobuild.solver.constraints.NumericRange;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * BoundOracles — суффиксные таблицы по порядку слотов.
 *
 * <p>Index {@code i} summarizes slots {@code order[i..n-1]}; index {@code n} is all zeros.
 * Per slot the pool contributes its best rough score (floored at 0), its atkTier min / max, its
 * min / max of every custom key and its best positive bonus per focus stat. Empty pools
 * contribute 0 everywhere.</p>
 */
public final class BoundOracles {

    private final double[] roughMax;
    private final int[] tierMin;
    private final int[] tierMax;
    private final double[][] customMin;
    private final double[][] customMax;
    private final double[][] supportMax;

    private BoundOracles(int n, int keys, int focus) {
        this.roughMax = new double[n + 1];
        this.tierMin = new int[n + 1];
        this.tierMax = new int[n + 1];
        this.customMin = new double[n + 1][keys];
        this.customMax = new double[n + 1][keys];
        this.supportMax = new double[n + 1][focus];
    }

    public static BoundOracles build(List<Slot> order, Map<Slot, List<PoolEntry>> pools, List<String> customKeys, FocusStats focus) {
        int n = order.size();
        int k = customKeys.size();
        int fs = focus.size();
        BoundOracles b = new BoundOracles(n, k, fs);

        for (int i = n - 1; i >= 0; i--) {
            List<PoolEntry> pool = pools.getOrDefault(order.get(i), List.of());

            double rough = 0.0;
            int tMin = 0;
            int tMax = 0;
            double[] cMin = new double[k];
            double[] cMax = new double[k];
            double[] sMax = new double[fs];
            if (!pool.isEmpty()) {
                tMin = Integer.MAX_VALUE;
                tMax = Integer.MIN_VALUE;
                Arrays.fill(cMin, Double.POSITIVE_INFINITY);
                Arrays.fill(cMax, Double.NEGATIVE_INFINITY);
            }
            for (PoolEntry e : pool) {
                if (e.rough > rough) rough = e.rough;
                tMin = Math.min(tMin, e.item.atkTier);
                tMax = Math.max(tMax, e.item.atkTier);
                for (int j = 0; j < k; j++) {
                    double v = e.item.numeric(customKeys.get(j));
                    if (v < cMin[j]) cMin[j] = v;
                    if (v > cMax[j]) cMax[j] = v;
                }
                for (int j = 0; j < fs; j++) {
                    double v = e.item.positiveBonus(focus.stats().get(j));
                    if (v > sMax[j]) sMax[j] = v;
                }
            }

            b.roughMax[i] = b.roughMax[i + 1] + rough;
            b.tierMin[i] = b.tierMin[i + 1] + tMin;
            b.tierMax[i] = b.tierMax[i + 1] + tMax;
            for (int j = 0; j < k; j++) {
                b.customMin[i][j] = b.customMin[i + 1][j] + (Double.isFinite(cMin[j]) ? cMin[j] : 0.0);
                b.customMax[i][j] = b.customMax[i + 1][j] + (Double.isFinite(cMax[j]) ? cMax[j] : 0.0);
            }
            for (int j = 0; j < fs; j++) {
                b.supportMax[i][j] = b.supportMax[i + 1][j] + sMax[j];
            }
        }
        return b;
    }

    /** Optimistic rough score still obtainable from slots {@code index..n-1}. */
    public double roughSuffix(int index) {
        return roughMax[index];
    }

    public int tierMinSuffix(int index) {
        return tierMin[index];
    }

    public int tierMaxSuffix(int index) {
        return tierMax[index];
    }

    public double customMinSuffix(int index, int key) {
        return customMin[index][key];
    }

    public double customMaxSuffix(int index, int key) {
        return customMax[index][key];
    }

    public double[] supportSuffix(int index) {
        return supportMax[index];
    }

    /**
     * Whether every custom range can still be met given the running totals and what slots
     * {@code index..n-1} can add.
     */
    public boolean customRangesReachable(double[] totals, List<NumericRange> specs, int index) {
        for (int j = 0; j < specs.size(); j++) {
            NumericRange r = specs.get(j);
            if (r.hasMin() && totals[j] + customMax[index][j] < r.min) return false;
            if (r.hasMax() && totals[j] + customMin[index][j] > r.max) return false;
        }
        return true;
    }

    /** Total distance of the running totals outside their ranges. */
    public static double customDeficit(double[] totals, List<NumericRange> specs) {
        double d = 0.0;
        for (int j = 0; j < specs.size(); j++) d += specs.get(j).deficit(totals[j]);
        return d;
    }
}
