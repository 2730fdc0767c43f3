package org.calista.autobuild.solver.search;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.autobuild.solver.catalog.CatalogSnapshot;
import org.calista.autobuild.solver.catalog.Item;
import org.calista.autobuild.solver.catalog.SkillStat;
import org.calista.autobuild.solver.catalog.Slot;
import org.calista.autobuild.solver.constraints.Constraints;
import org.calista.autobuild.solver.constraints.NumericRange;
import org.calista.autobuild.solver.constraints.Weights;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * CandidatePoolBuilder — пул кандидатов на один слот.
 *
 * <p>Берём все легальные предметы слота и собираем из них разнообразный пул через round-robin
 * по нескольким отсортированным "витринам": rough score, низкие требования, бонусы скиллов,
 * утилити, atkTier (если заданы скорости атаки), поддержка focus-статов, по одной витрине на
 * каждый focus-стат и на каждую кастомную границу. Так предметы, закрывающие ограничения,
 * попадают в пул даже если по rough score они последние.</p>
 *
 * <p>Порядок вставки сохраняется: поиск с branch cap видит supporting / low-req предметы рано,
 * а не только лидеров по rough score. Чистая функция.</p>
 */
public final class CandidatePoolBuilder {

    private static final Logger log = LogManager.getLogger(CandidatePoolBuilder.class);

    static final double CUSTOM_MIN_WEIGHT = 3.0;
    static final double CUSTOM_MIN_WEIGHT_STRONG = 14.0;
    static final double CUSTOM_MAX_WEIGHT = 2.0;

    private final CatalogSnapshot catalog;
    private final Constraints constraints;

    public CandidatePoolBuilder(CatalogSnapshot catalog, Constraints constraints) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.constraints = Objects.requireNonNull(constraints, "constraints");
    }

    /**
     * @param slot      slot to fill
     * @param allowlist pinned item ids, or null when any legal item may be used
     * @param focus     focus stats of the placed items
     */
    public List<PoolEntry> build(Slot slot, Set<Integer> allowlist, FocusStats focus) {
        Objects.requireNonNull(slot, "slot");
        FocusStats f = focus == null ? FocusStats.NONE : focus;

        List<Row> all = new ArrayList<>();
        for (Item item : catalog.itemsOf(slot.category())) {
            if (allowlist != null && !allowlist.contains(item.id)) continue;
            if (!constraints.filters.admits(item)) continue;
            all.add(new Row(item, roughScore(item, constraints), f.supportScore(item)));
        }

        List<NumericRange> specs = constraints.targets.customSpecs(true);
        List<Row> roughSorted = sorted(all, Comparator.comparingDouble((Row r) -> -r.rough));

        List<Source> sources = new ArrayList<>();
        int target = Math.max(10, constraints.budgets.topKPerSlot);
        int diversity = Math.min(140, Math.max(40, (int) Math.floor(target * 0.8)));
        int desired = Math.min(all.size(), target + diversity
                + (f.isEmpty() ? 0 : Math.min(60, f.size() * 12))
                + Math.min(80, specs.size() * 14));
        int seed = Math.min(12, Math.min((int) Math.floor(target * 0.4), roughSorted.size()));

        sources.add(new Source(roughSorted, Math.max(0, target - seed)));
        sources.add(new Source(sorted(all, Comparator.comparingDouble((Row r) -> r.reqTotal)
                .thenComparingInt(r -> r.item.level)), (int) Math.floor(diversity * 0.28)));
        sources.add(new Source(sorted(all, Comparator.comparingDouble((Row r) -> -r.spTotal)
                .thenComparingDouble(r -> r.reqTotal)), (int) Math.floor(diversity * 0.24)));
        sources.add(new Source(sorted(all, Comparator.comparingDouble((Row r) -> -r.utility)
                .thenComparingDouble(r -> r.reqTotal)), (int) Math.floor(diversity * 0.18)));

        if (constraints.filters.hasAttackSpeeds()) {
            sources.add(new Source(sorted(all, Comparator.comparingInt((Row r) -> -Math.max(0, r.item.atkTier))
                    .thenComparingInt(r -> -r.item.atkTier)
                    .thenComparingDouble(r -> r.reqTotal)
                    .thenComparingDouble(r -> -r.spTotal)), Math.max(18, (int) Math.floor(diversity * 0.22))));
        }
        if (!f.isEmpty()) {
            sources.add(new Source(sorted(all, Comparator.comparingDouble((Row r) -> -r.supportFocus)
                    .thenComparingDouble(r -> r.reqTotal)
                    .thenComparingDouble(r -> -r.spTotal)), Math.max(16, (int) Math.floor(diversity * 0.2))));
            for (SkillStat stat : f.stats()) {
                sources.add(new Source(sorted(all, Comparator.comparingDouble((Row r) -> -r.item.bonus(stat))
                        .thenComparingDouble(r -> r.reqTotal)
                        .thenComparingDouble(r -> -r.supportFocus)), 10));
            }
        }
        for (NumericRange range : specs) {
            if (!range.hasMin()) continue;
            sources.add(new Source(sorted(all, Comparator.comparingDouble((Row r) -> -r.item.numeric(range.key))
                    .thenComparingDouble(r -> r.reqTotal)
                    .thenComparingDouble(r -> -r.spTotal)), 35));
        }
        for (NumericRange range : specs) {
            if (!range.hasMax()) continue;
            sources.add(new Source(sorted(all, Comparator.comparingDouble((Row r) -> r.item.numeric(range.key))
                    .thenComparingDouble(r -> r.reqTotal)
                    .thenComparingDouble(r -> -r.spTotal)), 20));
        }

        LinkedHashMap<Integer, PoolEntry> picks = new LinkedHashMap<>();
        for (int i = 0; i < seed; i++) pick(picks, roughSorted.get(i));

        // one new id per source per round; already-picked ids are skipped for free
        while (picks.size() < desired) {
            boolean progressed = false;
            for (Source s : sources) {
                if (s.remaining <= 0) continue;
                while (s.cursor < s.list.size()) {
                    Row r = s.list.get(s.cursor++);
                    if (picks.containsKey(r.item.id)) continue;
                    pick(picks, r);
                    s.remaining--;
                    progressed = true;
                    break;
                }
            }
            if (!progressed) break;
        }

        for (Row r : roughSorted) {
            if (picks.size() >= desired) break;
            if (!picks.containsKey(r.item.id)) pick(picks, r);
        }

        log.debug("Pool {}: legal={}, desired={}, picked={}, sources={}", slot.key(), all.size(), desired, picks.size(), sources.size());
        return List.copyOf(picks.values());
    }

    /**
     * Heuristic per-item score used for pool ordering and beam bounds.
     *
     * <p>Constraint-only mode: custom range contribution only. Otherwise weighted generic terms,
     * scaled down as more custom minimums are configured, plus the custom range contribution.</p>
     */
    public static double roughScore(Item item, Constraints c) {
        List<NumericRange> rows = c.targets.customRanges;

        if (c.constraintOnlyMode) {
            double score = 0.0;
            for (NumericRange r : rows) {
                if (r.key.isEmpty()) continue;
                double v = item.numeric(r.key);
                if (r.hasMin()) score += v * CUSTOM_MIN_WEIGHT_STRONG;
                if (r.hasMax()) score -= v * CUSTOM_MAX_WEIGHT;
            }
            return score - item.reqTotal * 0.05;
        }

        int customMinCount = 0;
        for (NumericRange r : rows) {
            if (r.hasMin()) customMinCount++;
        }
        boolean hasCustomMins = customMinCount > 0;
        double genericScale = hasCustomMins ? Math.max(0.15, 1 - customMinCount * 0.2) : 1.0;

        Weights w = c.weights;
        double defWeight = (w.legacyEhp + w.ehpProxy) * genericScale;
        double score = item.stat("averageDps") * w.legacyBaseDps * genericScale
                + item.ehpProxy * defWeight
                + item.offense * w.dpsProxy * genericScale
                + item.stat("spd") * w.speed
                + item.utility * w.sustain
                + item.skillPointTotal * w.skillPointTotal
                - item.reqTotal * w.reqTotalPenalty;

        double minWeight = hasCustomMins ? CUSTOM_MIN_WEIGHT_STRONG : CUSTOM_MIN_WEIGHT;
        for (NumericRange r : rows) {
            if (r.key.isEmpty()) continue;
            double v = item.numeric(r.key);
            if (r.hasMin()) score += v * minWeight;
            if (r.hasMax()) score -= v * CUSTOM_MAX_WEIGHT;
        }
        return score;
    }

    private static void pick(LinkedHashMap<Integer, PoolEntry> picks, Row r) {
        picks.put(r.item.id, new PoolEntry(r.item, r.rough));
    }

    /** Stable copy sorted by {@code order}, ties broken by ascending id. */
    private static List<Row> sorted(List<Row> rows, Comparator<Row> order) {
        List<Row> out = new ArrayList<>(rows);
        out.sort(order.thenComparingInt(r -> r.item.id));
        return out;
    }

    private static final class Row {
        final Item item;
        final double rough;
        final double reqTotal;
        final double spTotal;
        final double utility;
        final double supportFocus;

        Row(Item item, double rough, double supportFocus) {
            this.item = item;
            this.rough = rough;
            this.reqTotal = item.reqTotal;
            this.spTotal = item.skillPointTotal;
            this.utility = item.utility + item.stat("spd") * 0.8;
            this.supportFocus = supportFocus;
        }
    }

    private static final class Source {
        final List<Row> list;
        int remaining;
        int cursor;

        Source(List<Row> list, int remaining) {
            this.list = list;
            this.remaining = remaining;
        }
    }
}
