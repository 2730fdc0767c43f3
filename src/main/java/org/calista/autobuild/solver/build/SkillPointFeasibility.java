package org.calista.autobuild.solver.build;

import org.calista.autobuild.solver.catalog.Item;
import org.calista.autobuild.solver.catalog.SkillStat;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SkillPointFeasibility — точная проверка "можно ли надеть" с учётом порядка экипировки.
 *
 * <p>DP по подмножествам уже надетых предметов. Для каждой маски храним Pareto-фронт векторов
 * вручную вложенных очков (assigned). Предмет i можно надеть поверх маски, если для каждого стата
 * assigned + бонусы маски + base покрывают требование; недостающее доливается в assigned.
 * Ограничения: assigned[stat] ≤ 100, сумма assigned ≤ доступных очков уровня.</p>
 */
public final class SkillPointFeasibility {

    public static final int MAX_ASSIGNED_PER_STAT = 100;

    private SkillPointFeasibility() {}

    public static final class Result {
        public static final Result EMPTY = new Result(true, 0.0, new double[SkillStat.COUNT]);
        public static final Result INFEASIBLE = new Result(false, Double.POSITIVE_INFINITY, null);

        public final boolean feasible;
        /** Total hand-assigned points of the cheapest order; +Inf when infeasible. */
        public final double assignedTotal;
        private final double[] assignedByStat;

        private Result(boolean feasible, double assignedTotal, double[] assignedByStat) {
            this.feasible = feasible;
            this.assignedTotal = assignedTotal;
            this.assignedByStat = assignedByStat;
        }

        /** @return assigned points for the stat, or NaN when infeasible */
        public double assigned(SkillStat s) {
            return assignedByStat == null ? Double.NaN : assignedByStat[s.ordinal()];
        }

        @Override
        public String toString() {
            return feasible ? "feasible(assigned=" + assignedTotal + ")" : "infeasible";
        }
    }

    /** Level ≥ 101 → 200 points, otherwise 2 per level above 1. Level is clamped to [1, 106]. */
    public static int availablePoints(int level) {
        int l = Math.max(1, Math.min(106, level));
        if (l >= 101) return 200;
        return (l - 1) * 2;
    }

    public static Result evaluate(List<Item> items, int level, TomeMode mode) {
        Objects.requireNonNull(items, "items");
        TomeMode m = mode == null ? TomeMode.NO_TOMES : mode;
        if (items.isEmpty()) return Result.EMPTY;

        final int n = items.size();
        final int k = SkillStat.COUNT;
        final double available = availablePoints(level) + m.extraAvailable();
        final double base = m.basePerStat();

        double[][] reqs = new double[n][k];
        double[][] bonus = new double[n][k];
        for (int i = 0; i < n; i++) {
            Item it = items.get(i);
            for (SkillStat s : SkillStat.values()) {
                reqs[i][s.ordinal()] = it.req(s);
                bonus[i][s.ordinal()] = it.bonus(s);
            }
        }

        final int states = 1 << n;
        double[][] bonusByMask = new double[states][k];
        for (int mask = 1; mask < states; mask++) {
            int lsb = mask & -mask;
            int bit = Integer.numberOfTrailingZeros(lsb);
            double[] prev = bonusByMask[mask ^ lsb];
            for (int j = 0; j < k; j++) bonusByMask[mask][j] = prev[j] + bonus[bit][j];
        }

        @SuppressWarnings("unchecked")
        List<double[]>[] frontiers = new List[states];
        frontiers[0] = new ArrayList<>(1);
        frontiers[0].add(new double[k]);

        for (int mask = 0; mask < states; mask++) {
            List<double[]> frontier = frontiers[mask];
            if (frontier == null || frontier.isEmpty()) continue;
            double[] bonusSum = bonusByMask[mask];

            for (double[] assigned : frontier) {
                for (int i = 0; i < n; i++) {
                    if ((mask & (1 << i)) != 0) continue;

                    double[] next = assigned.clone();
                    boolean valid = true;
                    for (int j = 0; j < k; j++) {
                        double current = assigned[j] + bonusSum[j] + base;
                        double required = reqs[i][j];
                        if (required > current) next[j] += required - current;
                        if (next[j] > MAX_ASSIGNED_PER_STAT) {
                            valid = false;
                            break;
                        }
                    }
                    if (!valid) continue;
                    if (total(next) > available) continue;

                    int nextMask = mask | (1 << i);
                    if (frontiers[nextMask] == null) frontiers[nextMask] = new ArrayList<>(4);
                    pushPareto(frontiers[nextMask], next);
                }
            }
        }

        List<double[]> finals = frontiers[states - 1];
        if (finals == null || finals.isEmpty()) return Result.INFEASIBLE;

        double best = Double.POSITIVE_INFINITY;
        double[] bestVec = null;
        for (double[] s : finals) {
            double t = total(s);
            if (t < best) {
                best = t;
                bestVec = s;
            }
        }
        return new Result(true, best, bestVec.clone());
    }

    private static void pushPareto(List<double[]> frontier, double[] candidate) {
        for (double[] existing : frontier) {
            if (dominates(existing, candidate)) return;
        }
        frontier.removeIf(existing -> dominates(candidate, existing));
        frontier.add(candidate);
    }

    /** a dominates b when a needs no more points than b in every stat. */
    private static boolean dominates(double[] a, double[] b) {
        for (int i = 0; i < a.length; i++) {
            if (a[i] > b[i]) return false;
        }
        return true;
    }

    private static double total(double[] v) {
        double t = 0.0;
        for (double x : v) t += x;
        return t;
    }
}
