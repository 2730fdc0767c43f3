package org.calista.autobuild.solver.search;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.autobuild.solver.build.BuildEvaluator;
import org.calista.autobuild.solver.build.SkillPointFeasibility;
import org.calista.autobuild.solver.build.SlotAssignment;
import org.calista.autobuild.solver.catalog.Item;
import org.calista.autobuild.solver.catalog.Slot;
import org.calista.autobuild.solver.constraints.Constraints;
import org.calista.autobuild.solver.events.ProgressEvent;
import org.calista.autobuild.solver.events.ProgressListener;
import org.calista.autobuild.solver.events.ProgressPhase;
import org.calista.autobuild.solver.events.ReasonCode;
import org.calista.autobuild.solver.util.CancellationToken;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * BeamPass — один проход beam search по порядку слотов.
 *
 * <p>Stage loop: per node, expand up to the branch cap of the stage, drop children that create
 * an illegal set combo or can no longer reach the attack target / custom ranges, then keep
 * {@code max(floor, beamWidth)} nodes through the dual-lane merge. The feasibility mode also
 * prunes on focus-stat support and ranks by the partial skill point cost.</p>
 *
 * <p>A stage without children ends the pass with a {@code search_pruned} diagnostics event and an
 * empty beam. Cancellation is polled at every stage boundary.</p>
 */
public final class BeamPass {

    private static final Logger log = LogManager.getLogger(BeamPass.class);

    public enum Mode { STANDARD, FEASIBILITY }

    public static final class Result {
        final List<BeamNode> beam;
        public final long processedStates;
        public final boolean budgetHit;
        /** Why the pass ended with an empty beam; null when it reached the last slot. */
        public final String prunedDetail;

        Result(List<BeamNode> beam, long processedStates, boolean budgetHit, String prunedDetail) {
            this.beam = beam;
            this.processedStates = processedStates;
            this.budgetHit = budgetHit;
            this.prunedDetail = prunedDetail;
        }

        public int size() {
            return beam.size();
        }

        public boolean isEmpty() {
            return beam.isEmpty();
        }

        public List<SlotAssignment> assignments() {
            List<SlotAssignment> out = new ArrayList<>(beam.size());
            for (BeamNode n : beam) out.add(n.slots);
            return out;
        }
    }

    private static final Comparator<BeamNode> HARD_LANE = Comparator
            .comparingDouble((BeamNode n) -> n.customDeficit)
            .thenComparing(Comparator.comparingDouble((BeamNode n) -> n.attackBias).reversed())
            .thenComparing(Comparator.comparingDouble((BeamNode n) -> n.bound).reversed());

    private final SearchSpace space;
    private final BuildEvaluator evaluator;
    private final Finalizer finalizer;
    private final SearchTuning tuning;
    private final ProgressListener listener;
    private final CancellationToken cancel;

    public BeamPass(SearchSpace space, BuildEvaluator evaluator, Finalizer finalizer, SearchTuning tuning,
             ProgressListener listener, CancellationToken cancel) {
        this.space = Objects.requireNonNull(space, "space");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.finalizer = Objects.requireNonNull(finalizer, "finalizer");
        this.tuning = Objects.requireNonNull(tuning, "tuning");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.cancel = Objects.requireNonNull(cancel, "cancel");
    }

    /**
     * @param pass budgets, weights (preview scoring) and filters of this pass
     */
    public Result run(Mode mode, Constraints pass) {
        boolean feasibility = mode == Mode.FEASIBILITY;
        long maxStates = pass.budgets.maxStates;
        int width = Math.max(feasibility ? tuning.feasibilityBeamFloor : tuning.standardBeamFloor, pass.budgets.beamWidth);
        int depth = space.depth();
        Comparator<BeamNode> primaryLane = primaryLane(feasibility);

        List<BeamNode> beam = List.of(space.root());
        long processed = 0;
        boolean budgetHit = false;

        for (int orderIndex = 0; orderIndex < depth; orderIndex++) {
            cancel.throwIfCancelled();
            Slot slot = space.order.get(orderIndex);
            List<PoolEntry> pool = space.pool(orderIndex);
            int next = orderIndex + 1;
            List<BeamNode> children = new ArrayList<>();

            int cap = tuning.branchCap(pool.size(), beam.size(), depth - orderIndex, processed, maxStates);
            if (cap <= 0) budgetHit = true;

            for (BeamNode node : beam) {
                int branched = 0;
                for (PoolEntry entry : pool) {
                    if (branched >= cap) break;
                    if (processed >= maxStates) {
                        budgetHit = true;
                        break;
                    }
                    processed++;
                    branched++;

                    if (SetRules.wouldCreateIllegalCombo(entry.id(), node.slots, space.catalog)) continue;
                    BeamNode child = expand(node, slot, entry, next, feasibility, pass);
                    if (child != null) children.add(child);
                }
                if (budgetHit) break;
            }

            if (children.isEmpty()) {
                String detail = pruneDetail(feasibility, budgetHit, slot);
                log.debug("Beam {} pruned at {} ({}): processed={}", mode, slot.key(), budgetHit ? "budget" : "no expansions", processed);
                listener.onProgress(ProgressEvent.diagnostics(processed, beam.size(), depth, orderIndex,
                        ReasonCode.SEARCH_PRUNED, detail));
                return new Result(List.of(), processed, budgetHit, detail);
            }

            List<BeamNode> primary = new ArrayList<>(children);
            primary.sort(primaryLane);
            List<BeamNode> hard = new ArrayList<>(children);
            hard.sort(HARD_LANE);
            beam = LaneMerger.merge(primary, hard, width, tuning.primaryShare);

            log.debug("Beam {} stage {}/{} slot={} cap={} children={} kept={} processed={}",
                    mode, next, depth, slot.key(), cap, children.size(), beam.size(), processed);
            listener.onProgress(ProgressEvent.of(ProgressPhase.BEAM_SEARCH, processed, beam.size(), depth, next)
                    .detail(stageDetail(feasibility, cap))
                    .preview(preview(beam, pass)));
        }
        return new Result(beam, processed, budgetHit, null);
    }

    private BeamNode expand(BeamNode node, Slot slot, PoolEntry entry, int next, boolean feasibility, Constraints pass) {
        Item item = entry.item;
        SlotAssignment slots = node.slots.with(slot, item.id);
        int atk = node.atkAssigned + item.atkTier;

        if (!space.attackReachable(atk, next)) return null;

        double[] support = node.focusSupport;
        if (feasibility && !space.focus.isEmpty()) {
            support = support.clone();
            double[] bonus = space.focus.bonusVector(item);
            for (int i = 0; i < support.length; i++) support[i] += bonus[i];
            if (!space.focusReachable(support, next)) return null;
        }

        double[] totals = space.specs.isEmpty() ? node.customTotals : space.addCustom(node.customTotals, item);
        if (!space.customReachable(totals, next)) return null;

        double assigned = 0.0;
        if (feasibility) {
            SkillPointFeasibility.Result partial = evaluator.partialFeasibility(slots, pass.filters.level, pass.filters.tomeMode);
            assigned = partial.feasible ? partial.assignedTotal : Double.POSITIVE_INFINITY;
        }

        double rough = node.rough + entry.rough;
        return new BeamNode(slots, next, rough, rough + space.bounds.roughSuffix(next), atk, totals, support, assigned,
                space.attackBias(atk, next), space.customDeficit(totals), space.focus.deficit(support));
    }

    private Comparator<BeamNode> primaryLane(boolean feasibility) {
        Comparator<BeamNode> c = Comparator.comparingDouble((BeamNode n) -> n.attackBias).reversed();
        if (feasibility) {
            c = c.thenComparingDouble(n -> n.supportDeficit)
                    .thenComparingDouble(n -> n.feasibilityAssigned);
        }
        return c.thenComparing(Comparator.comparingDouble((BeamNode n) -> n.bound).reversed())
                .thenComparing(Comparator.comparingDouble((BeamNode n) -> n.rough).reversed());
    }

    private List<Candidate> preview(List<BeamNode> beam, Constraints pass) {
        if (tuning.previewSize <= 0 || beam.isEmpty()) return List.of();
        List<BeamNode> byRough = new ArrayList<>(beam);
        byRough.sort(Comparator.comparingDouble((BeamNode n) -> n.rough).reversed());
        int n = Math.min(tuning.previewSize, byRough.size());
        List<Candidate> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) out.add(finalizer.preview(byRough.get(i).slots, pass));
        return out;
    }

    private String stageDetail(boolean feasibility, int cap) {
        AttackSpeedContext ctx = space.attack.speedContext;
        if (!feasibility) {
            String d = "branchCap=" + cap;
            if (ctx != null && ctx.preferredDirection != 0) d += " | atkSpeedTarget=" + space.attack.speedsLabel();
            return d;
        }
        StringBuilder sb = new StringBuilder("feasibility-first | branchCap=").append(cap);
        if (!space.focus.isEmpty()) sb.append(" | focus=").append(space.focus);
        if (ctx != null) sb.append(" | atkSpeed=").append(space.attack.speedsLabel());
        return sb.toString();
    }

    private static String pruneDetail(boolean feasibility, boolean budgetHit, Slot slot) {
        if (feasibility) {
            return budgetHit
                    ? "Feasibility-first search exhausted state budget before completing slot " + slot.key() + "."
                    : "Feasibility-first search found no branches that can still satisfy high-skill requirements by slot " + slot.key() + ".";
        }
        return budgetHit
                ? "Search state budget exhausted before completing slot " + slot.key() + ". Try enabling deep fallback/exact mode or reduce hard filters."
                : "No expansions produced at slot " + slot.key() + ".";
    }
}
