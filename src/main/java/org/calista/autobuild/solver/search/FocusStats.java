package org.calista.autobuild.solver.search;

import org.calista.autobuild.solver.catalog.Item;
import org.calista.autobuild.solver.catalog.SkillStat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * FocusStats — скилл-статы, требования по которым у уже надетых предметов "перевалили" за 100.
 *
 * <p>Stats whose maximum requirement among the placed items exceeds 100 (highest first); when
 * there are none, up to two stats with a requirement of at least 70. Overcap need per focus stat
 * is {@code max(0, maxReq - 100)}: the bonus points the remaining slots have to supply because
 * hand-assigned points stop at 100.</p>
 */
public final class FocusStats {

    public static final FocusStats NONE = new FocusStats(List.of(), new double[0]);

    private static final double OVERCAP_REQ = 100.0;
    private static final double HIGH_REQ = 70.0;
    private static final int MAX_HIGH_REQ_STATS = 2;

    private final List<SkillStat> stats;
    private final double[] need;

    private FocusStats(List<SkillStat> stats, double[] need) {
        this.stats = stats;
        this.need = need;
    }

    /** @param placed items already fixed before the search starts */
    public static FocusStats collect(List<Item> placed) {
        double[] maxReq = new double[SkillStat.COUNT];
        for (Item it : placed) {
            for (SkillStat s : SkillStat.values()) {
                maxReq[s.ordinal()] = Math.max(maxReq[s.ordinal()], it.req(s));
            }
        }

        List<SkillStat> focused = new ArrayList<>();
        for (SkillStat s : SkillStat.values()) {
            if (maxReq[s.ordinal()] > OVERCAP_REQ) focused.add(s);
        }
        if (focused.isEmpty()) {
            for (SkillStat s : SkillStat.values()) {
                if (maxReq[s.ordinal()] >= HIGH_REQ) focused.add(s);
            }
            focused.sort((a, b) -> Double.compare(maxReq[b.ordinal()], maxReq[a.ordinal()]));
            if (focused.size() > MAX_HIGH_REQ_STATS) focused = new ArrayList<>(focused.subList(0, MAX_HIGH_REQ_STATS));
        } else {
            focused.sort((a, b) -> Double.compare(maxReq[b.ordinal()], maxReq[a.ordinal()]));
        }
        if (focused.isEmpty()) return NONE;

        double[] need = new double[focused.size()];
        for (int i = 0; i < need.length; i++) {
            need[i] = Math.max(0.0, maxReq[focused.get(i).ordinal()] - OVERCAP_REQ);
        }
        return new FocusStats(Collections.unmodifiableList(focused), need);
    }

    public List<SkillStat> stats() {
        return stats;
    }

    public int size() {
        return stats.size();
    }

    public boolean isEmpty() {
        return stats.isEmpty();
    }

    public double need(int i) {
        return need[i];
    }

    /** Positive bonus of the item per focus stat. */
    public double[] bonusVector(Item item) {
        double[] v = new double[stats.size()];
        for (int i = 0; i < v.length; i++) v[i] = item.positiveBonus(stats.get(i));
        return v;
    }

    /**
     * Pool ordering key: positive focus bonuses reward, focus requirements and the total
     * requirement penalize.
     */
    public double supportScore(Item item) {
        if (stats.isEmpty()) return 0.0;
        double score = 0.0;
        for (SkillStat s : stats) {
            score += item.positiveBonus(s) * 10;
            score -= Math.max(0.0, item.req(s)) * 0.7;
        }
        score -= Math.max(0.0, item.reqTotal) * 0.12;
        return score;
    }

    /** Best single-item sum of positive focus bonuses in the pool; orders slots. */
    public double supportPotential(List<PoolEntry> pool) {
        if (stats.isEmpty()) return 0.0;
        double best = 0.0;
        for (PoolEntry e : pool) {
            double s = 0.0;
            for (SkillStat st : stats) s += e.item.positiveBonus(st);
            if (s > best) best = s;
        }
        return best;
    }

    public boolean canStillMeetNeed(double[] current, double[] remainingMax) {
        for (int i = 0; i < need.length; i++) {
            if (current[i] + remainingMax[i] < need[i]) return false;
        }
        return true;
    }

    public double deficit(double[] current) {
        double d = 0.0;
        for (int i = 0; i < need.length; i++) d += Math.max(0.0, need[i] - current[i]);
        return d;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (SkillStat s : stats) {
            if (sb.length() > 0) sb.append('/');
            sb.append(s.bonusKey());
        }
        return sb.toString();
    }
}
