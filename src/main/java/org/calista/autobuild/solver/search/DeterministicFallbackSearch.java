package org.calista.autobuild.solver.search;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.autobuild.solver.build.BuildEvaluator;
import org.calista.autobuild.solver.build.SlotAssignment;
import org.calista.autobuild.solver.catalog.Item;
import org.calista.autobuild.solver.catalog.Slot;
import org.calista.autobuild.solver.constraints.Constraints;
import org.calista.autobuild.solver.util.CancellationToken;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * DeterministicFallbackSearch — последний шанс перед пустым ответом.
 *
 * <p>Depth-first with an explicit stack over pools re-sorted by rough score (id ascending on
 * ties). Prunes illegal set combos, unreachable attack targets and custom ranges, and partial
 * assignments that can no longer be worn. Stops at the wall clock cap or after topN valid
 * builds.</p>
 */
public final class DeterministicFallbackSearch {

    private static final Logger log = LogManager.getLogger(DeterministicFallbackSearch.class);

    private static final Comparator<Candidate> BY_SCORE_THEN_KEY = Comparator
            .comparingDouble((Candidate c) -> c.score).reversed()
            .thenComparing(Candidate::canonicalKey);

    public static final class Result {
        public final List<Candidate> candidates;
        public final long processedStates;
        public final boolean timedOut;

        Result(List<Candidate> candidates, long processedStates, boolean timedOut) {
            this.candidates = candidates;
            this.processedStates = processedStates;
            this.timedOut = timedOut;
        }
    }

    private static final class Frame {
        final int orderIndex;
        final SlotAssignment slots;
        final int atkAssigned;
        final double[] customTotals;
        int cursor;
        boolean entered;

        Frame(int orderIndex, SlotAssignment slots, int atkAssigned, double[] customTotals) {
            this.orderIndex = orderIndex;
            this.slots = slots;
            this.atkAssigned = atkAssigned;
            this.customTotals = customTotals;
        }
    }

    private final SearchSpace space;
    private final BuildEvaluator evaluator;
    private final Finalizer finalizer;
    private final SearchTuning tuning;
    private final CancellationToken cancel;

    public DeterministicFallbackSearch(SearchSpace space, BuildEvaluator evaluator, Finalizer finalizer,
                                SearchTuning tuning, CancellationToken cancel) {
        this.space = Objects.requireNonNull(space, "space");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.finalizer = Objects.requireNonNull(finalizer, "finalizer");
        this.tuning = Objects.requireNonNull(tuning, "tuning");
        this.cancel = Objects.requireNonNull(cancel, "cancel");
    }

    public Result run(Constraints constraints) {
        int depth = space.depth();
        int limit = Math.max(1, constraints.budgets.topN);
        List<List<PoolEntry>> sorted = new ArrayList<>(depth);
        for (int i = 0; i < depth; i++) {
            List<PoolEntry> p = new ArrayList<>(space.pool(i));
            p.sort(Comparator.comparingDouble((PoolEntry e) -> e.rough).reversed().thenComparingInt(PoolEntry::id));
            sorted.add(p);
        }

        long start = tuning.clock.millis();
        boolean timedOut = false;
        long processed = 0;
        Set<String> seen = new HashSet<>();
        RejectStats ignored = new RejectStats();
        List<Candidate> found = new ArrayList<>();

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(0, space.base, 0, space.baseCustomTotals()));
        while (!stack.isEmpty()) {
            Frame f = stack.peek();
            if (!f.entered) {
                f.entered = true;
                cancel.throwIfCancelled();
                if (tuning.clock.millis() - start >= tuning.fallbackTimeCapMs) {
                    timedOut = true;
                    break;
                }
                if (found.size() >= limit) break;
                if (f.orderIndex >= depth) {
                    Candidate c = finalizer.accept(f.slots, constraints, seen, ignored);
                    if (c != null) found.add(c);
                    stack.pop();
                    continue;
                }
            }

            List<PoolEntry> pool = sorted.get(f.orderIndex);
            if (f.cursor >= pool.size()) {
                stack.pop();
                continue;
            }
            PoolEntry entry = pool.get(f.cursor++);
            processed++;
            if (SetRules.wouldCreateIllegalCombo(entry.id(), f.slots, space.catalog)) continue;

            Item item = entry.item;
            int next = f.orderIndex + 1;
            int atk = f.atkAssigned + item.atkTier;
            if (!space.attackReachable(atk, next)) continue;
            double[] totals = space.specs.isEmpty() ? f.customTotals : space.addCustom(f.customTotals, item);
            if (!space.customReachable(totals, next)) continue;

            Slot slot = space.order.get(f.orderIndex);
            SlotAssignment slots = f.slots.with(slot, item.id);
            if (!evaluator.partialFeasibility(slots, constraints.filters.level, constraints.filters.tomeMode).feasible) continue;

            stack.push(new Frame(next, slots, atk, totals));
        }

        found.sort(BY_SCORE_THEN_KEY);
        log.debug("Deterministic fallback: processed={} valid={} timedOut={}", processed, found.size(), timedOut);
        return new Result(found.size() > limit ? new ArrayList<>(found.subList(0, limit)) : found, processed, timedOut);
    }
}
