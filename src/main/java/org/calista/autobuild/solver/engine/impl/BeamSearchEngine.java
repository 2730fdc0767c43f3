package org.calista.autobuild.solver.engine.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.autobuild.solver.build.BuildEvaluator;
import org.calista.autobuild.solver.build.SlotAssignment;
import org.calista.autobuild.solver.catalog.CatalogSnapshot;
import org.calista.autobuild.solver.catalog.Item;
import org.calista.autobuild.solver.catalog.Slot;
import org.calista.autobuild.solver.constraints.Budgets;
import org.calista.autobuild.solver.constraints.Constraints;
import org.calista.autobuild.solver.constraints.NumericRange;
import org.calista.autobuild.solver.engine.LoadoutSearchEngine;
import org.calista.autobuild.solver.engine.SearchOutcome;
import org.calista.autobuild.solver.events.ProgressEvent;
import org.calista.autobuild.solver.events.ProgressListener;
import org.calista.autobuild.solver.events.ProgressPhase;
import org.calista.autobuild.solver.events.ReasonCode;
import org.calista.autobuild.solver.score.Scorer;
import org.calista.autobuild.solver.search.AttackSpeedContext;
import org.calista.autobuild.solver.search.AttackTargets;
import org.calista.autobuild.solver.search.AttackTierRequirement;
import org.calista.autobuild.solver.search.BeamPass;
import org.calista.autobuild.solver.search.Candidate;
import org.calista.autobuild.solver.search.CandidatePoolBuilder;
import org.calista.autobuild.solver.search.DeterministicFallbackSearch;
import org.calista.autobuild.solver.search.ExactEnumerator;
import org.calista.autobuild.solver.search.Finalizer;
import org.calista.autobuild.solver.search.FocusStats;
import org.calista.autobuild.solver.search.HardConstraintCheck;
import org.calista.autobuild.solver.search.PoolEntry;
import org.calista.autobuild.solver.search.RejectStats;
import org.calista.autobuild.solver.search.SearchSpace;
import org.calista.autobuild.solver.search.SearchTuning;
import org.calista.autobuild.solver.search.WorkbenchSnapshot;
import org.calista.autobuild.solver.util.CancellationToken;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * BeamSearchEngine
 *
 * One deterministic search run:
 * - base slots: locked items + must-includes, everything else cleared
 * - per free slot: candidate pool, then slot order and unsatisfiability prechecks
 * - exact enumeration when the pool product is small, otherwise the standard beam pass
 * - rescues on the same pools: feasibility-biased pass, threshold re-entry (depth 0 only),
 *   deterministic fallback
 *
 * NOTE:
 * - Same inputs give the same candidates; the only wall clock is the fallback time cap.
 * - Every early return emits a diagnostics event with the reason code it returns.
 */
public final class BeamSearchEngine implements LoadoutSearchEngine {

    private static final Logger log = LogManager.getLogger(BeamSearchEngine.class);

    private static final long THRESHOLD_STATE_CAP = 18_000_000L;
    private static final long ATTACK_STATE_CAP = 16_000_000L;
    private static final long SKILL_STATE_CAP = 8_000_000L;
    private static final int THRESHOLD_RESCUE_BEAM = 3600;
    private static final int ATTACK_RESCUE_BEAM = 3200;
    private static final int SKILL_RESCUE_BEAM = 1800;

    private final CatalogSnapshot catalog;
    private final BuildEvaluator evaluator;
    private final Finalizer finalizer;
    private final SearchTuning tuning;

    public BeamSearchEngine(CatalogSnapshot catalog, BuildEvaluator evaluator, Scorer scorer, SearchTuning tuning) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.finalizer = new Finalizer(catalog, evaluator, Objects.requireNonNull(scorer, "scorer"));
        this.tuning = Objects.requireNonNull(tuning, "tuning");
    }

    @Override
    public SearchOutcome search(WorkbenchSnapshot workbench, Constraints constraints, ProgressListener listener, CancellationToken cancel) {
        Objects.requireNonNull(workbench, "workbench");
        Objects.requireNonNull(constraints, "constraints");
        ProgressListener out = listener == null ? ProgressListener.NOOP : listener;
        CancellationToken c = cancel == null ? CancellationToken.none() : cancel;

        SearchOutcome outcome = run(workbench, constraints, out, c, 0);
        log.info("search.done candidates={} reason={} states={} best={}",
                outcome.candidates.size(), outcome.reasonCode, outcome.processedStates,
                outcome.isEmpty() ? "-" : outcome.best().canonicalKey());
        return outcome;
    }

    private SearchOutcome run(WorkbenchSnapshot workbench, Constraints constraints, ProgressListener out,
                              CancellationToken cancel, int rescueDepth) {
        cancel.throwIfCancelled();
        int limit = Math.max(1, constraints.budgets.topN);

        // ---- base slots ----
        Set<Slot> locked = EnumSet.noneOf(Slot.class);
        locked.addAll(constraints.filters.lockedSlots);
        locked.addAll(workbench.lockedSlots);
        SlotAssignment base = workbench.slots;
        for (Slot s : Slot.ALL) {
            if (!locked.contains(s)) base = base.cleared(s);
        }

        MustIncludePlacement placed = placeMustIncludes(base, constraints);
        if (placed.failure != null) {
            log.debug("Must-include conflict: {}", placed.failure);
            return fail(out, ReasonCode.MUST_INCLUDE_CONFLICT, 0, 0, 0, placed.failure);
        }
        base = placed.slots;

        // ---- pools and order ----
        FocusStats focus = FocusStats.collect(base.items(catalog));
        CandidatePoolBuilder poolBuilder = new CandidatePoolBuilder(catalog, constraints);
        Map<Slot, List<PoolEntry>> pools = new EnumMap<>(Slot.class);
        List<Slot> free = base.emptySlots();
        for (Slot s : free) {
            Set<Integer> allowlist = constraints.filters.onlyPinnedItems ? workbench.pinnedAllowlist(s) : null;
            pools.put(s, poolBuilder.build(s, allowlist, focus));
        }
        AttackTargets attack = AttackTargets.of(constraints.filters, constraints.targets, base, catalog);
        List<Slot> order = slotOrder(free, pools, focus, attack, constraints);
        SearchSpace space = new SearchSpace(catalog, constraints, base, order, pools, focus, attack);
        int depth = space.depth();
        log.debug("Search space: base={} order={} focus={} attack={} specs={}", base, order, focus, attack.speedContext, space.specs);

        // ---- prechecks ----
        for (Slot s : order) {
            if (pools.get(s).isEmpty()) {
                return fail(out, ReasonCode.EMPTY_POOL, 0, depth, 0,
                        "No candidate items available for slot " + s.key() + " under current hard filters.");
            }
        }
        AttackTierRequirement tier = attack.tierRequirement;
        if (tier.isInverted()) {
            return fail(out, ReasonCode.UNSAT_ATTACK_TARGET, 0, depth, 0,
                    "Attack target is unsatisfiable: atkTier min (" + HardConstraintCheck.num(tier.minAllowed)
                            + ") exceeds atkTier max (" + HardConstraintCheck.num(tier.maxAllowed) + ").");
        }
        String customUnsat = unreachableCustomRange(space);
        if (customUnsat != null) return fail(out, ReasonCode.UNSAT_THRESHOLD, 0, depth, 0, customUnsat);
        if (attack.needsTierBounds()
                && !attack.canStillSatisfy(0, space.bounds.tierMinSuffix(0), space.bounds.tierMaxSuffix(0))) {
            return fail(out, ReasonCode.UNSAT_ATTACK_TARGET, 0, depth, 0,
                    "Attack-speed / atkTier target cannot be reached from current candidate pools.");
        }

        // ---- exact enumeration ----
        Budgets budgets = constraints.budgets;
        if (budgets.useExhaustiveSmallPool && depth > 0) {
            long combos = space.combinationCount(budgets.exhaustiveStateLimit + 1);
            if (combos > 0 && combos <= budgets.exhaustiveStateLimit) {
                log.debug("Exact enumeration: combinations={} limit={}", combos, budgets.exhaustiveStateLimit);
                out.onProgress(ProgressEvent.of(ProgressPhase.EXACT_SEARCH, 0, 0, depth, 0));
                ExactEnumerator.Result exact = new ExactEnumerator(space, finalizer, tuning, out, cancel).run(constraints);
                if (!exact.candidates.isEmpty()) {
                    return SearchOutcome.found(exact.candidates, exact.processedStates, "exact");
                }
                return fail(out, fallbackReason(exact.rejects), exact.processedStates, depth, depth,
                        "Exact search produced 0 valid builds. Rejected " + exact.rejects.fullSummary() + ".");
            }
        }

        // ---- standard beam ----
        BeamPass pass = new BeamPass(space, evaluator, finalizer, tuning, out, cancel);
        BeamPass.Result beam = pass.run(BeamPass.Mode.STANDARD, constraints);
        long processed = beam.processedStates;
        if (beam.isEmpty()) {
            // the pass has already emitted the search_pruned diagnostics event
            return SearchOutcome.empty(ReasonCode.SEARCH_PRUNED, processed, beam.prunedDetail);
        }

        Finalizer.Result fin = finalizer.finalizeAll(beam.assignments(), constraints, cancel);
        List<Candidate> candidates = fin.candidates;
        RejectStats rejects = fin.rejects;
        int finalizationBeamSize = beam.size();
        out.onProgress(ProgressEvent.diagnostics(processed, beam.size(), depth, depth,
                candidates.isEmpty() ? reasonFromRejects(rejects) : null,
                candidates.isEmpty()
                        ? "Final eval found 0 valid builds. Rejected " + rejects.fullSummary() + "." + rejects.exampleSuffix()
                        : "Final eval: " + candidates.size() + " valid builds. Rejected " + rejects.shortSummary() + "."));

        // ---- feasibility-first rescue ----
        boolean hasAttackTarget = attack.speedConfigured() || tier.configured;
        if (candidates.isEmpty() && depth > 0
                && (rejects.spInvalid > 0 || (hasAttackTarget && rejects.hardAttackSpeed > 0) || rejects.hardThresholds > 0)) {
            boolean thresholdRescue = rejects.hardThresholds > 0;
            String why = thresholdRescue && !constraints.targets.customRanges.isEmpty()
                    ? "Retrying with threshold-aware rescue (advanced ID constraints + support-aware feasibility search)."
                    : rejects.hardAttackSpeed > 0
                    ? "Retrying with feasibility-first beam search (support-aware rescue + attack target reachability)."
                    : "Retrying with feasibility-first beam search (support-aware rescue for high-skill requirements).";
            out.onProgress(ProgressEvent.diagnostics(processed, beam.size(), depth, depth, null, why));

            Constraints rescue = feasibilityRescueConstraints(constraints, thresholdRescue, hasAttackTarget);
            BeamPass.Result feas = pass.run(BeamPass.Mode.FEASIBILITY, rescue);
            if (!feas.isEmpty()) {
                finalizationBeamSize = feas.size();
                Finalizer.Result refin = finalizer.finalizeAll(feas.assignments(), constraints, cancel);
                candidates = refin.candidates;
                rejects = refin.rejects;
                out.onProgress(ProgressEvent.diagnostics(feas.processedStates, feas.size(), depth, depth, null,
                        candidates.isEmpty()
                                ? "Feasibility-first eval still found 0 valid builds. Rejected " + rejects.fullSummary() + "." + rejects.exampleSuffix()
                                : "Feasibility-first eval: " + candidates.size() + " valid builds. Rejected " + rejects.shortSummary() + "."));
            }
        }

        // ---- threshold re-entry ----
        if (candidates.isEmpty() && rejects.hardThresholds > 0 && rescueDepth == 0 && constraints.targets.hasAnyThreshold()) {
            out.onProgress(ProgressEvent.diagnostics(processed, finalizationBeamSize, depth, depth, null,
                    "Retrying with threshold-biased beam search (weights tuned to target min/max)."));
            Budgets b = constraints.budgets;
            Constraints reentry = constraints.toBuilder()
                    .weights(constraints.weights.thresholdBiased(constraints.targets))
                    .budgets(b.toBuilder()
                            .beamWidth(Math.max(b.beamWidth, THRESHOLD_RESCUE_BEAM))
                            .maxStates(Math.max(b.maxStates, Math.min(THRESHOLD_STATE_CAP, b.maxStates * 5)))
                            .build())
                    .build();
            SearchOutcome rescued = run(workbench, reentry, out, cancel, rescueDepth + 1);
            if (!rescued.isEmpty()) {
                out.onProgress(ProgressEvent.diagnostics(processed, rescued.candidates.size(), depth, depth, null,
                        "Threshold rescue: " + rescued.candidates.size() + " valid builds."));
                return SearchOutcome.found(head(rescued.candidates, limit), processed + rescued.processedStates, "threshold rescue");
            }
        }

        // ---- deterministic fallback ----
        if (candidates.isEmpty() && depth > 0) {
            out.onProgress(ProgressEvent.diagnostics(processed, finalizationBeamSize, depth, depth, ReasonCode.SEARCH_PRUNED,
                    "Running deterministic fallback search (" + seconds(tuning.fallbackTimeCapMs) + "s cap) before returning no candidates."));
            DeterministicFallbackSearch.Result fb = new DeterministicFallbackSearch(space, evaluator, finalizer, tuning, cancel).run(constraints);
            long total = processed + fb.processedStates;
            if (!fb.candidates.isEmpty()) {
                out.onProgress(ProgressEvent.diagnostics(total, fb.candidates.size(), depth, depth, null,
                        "Deterministic fallback recovered " + fb.candidates.size() + " valid build(s)."));
                return SearchOutcome.found(head(fb.candidates, limit), total, "deterministic fallback");
            }
            ReasonCode reason = fb.timedOut ? ReasonCode.FALLBACK_TIMEOUT : fallbackReason(rejects);
            String detail = fb.timedOut
                    ? "Deterministic fallback timed out after " + seconds(tuning.fallbackTimeCapMs) + " seconds with no valid candidates."
                    : "Deterministic fallback found 0 valid builds. Rejected " + rejects.fullSummary() + "." + rejects.exampleSuffix();
            return fail(out, reason, total, depth, depth, detail);
        }

        if (candidates.isEmpty()) {
            return fail(out, fallbackReason(rejects), processed, depth, depth,
                    "Final eval found 0 valid builds. Rejected " + rejects.fullSummary() + ".");
        }
        return SearchOutcome.found(head(candidates, limit), processed, "beam");
    }

    // -------------------- must-include --------------------

    private static final class MustIncludePlacement {
        final SlotAssignment slots;
        final String failure;

        MustIncludePlacement(SlotAssignment slots, String failure) {
            this.slots = slots;
            this.failure = failure;
        }
    }

    /** Each must-include goes to the first free slot (slot order) that accepts its category. */
    private MustIncludePlacement placeMustIncludes(SlotAssignment base, Constraints constraints) {
        SlotAssignment slots = base;
        for (Integer id : constraints.filters.mustIncludeIds) {
            Item item = catalog.item(id);
            if (item == null) {
                return new MustIncludePlacement(slots, "Must-include item " + id + " does not exist in catalog.");
            }
            if (!constraints.filters.admits(item)) {
                return new MustIncludePlacement(slots, "Must-include item " + item.name
                        + " is incompatible with current hard filters (class/level/tier/exclusions).");
            }
            if (slots.contains(item.id)) continue;

            Slot target = null;
            for (Slot s : Slot.ALL) {
                if (slots.isEmpty(s) && s.accepts(item)) {
                    target = s;
                    break;
                }
            }
            if (target == null) {
                return new MustIncludePlacement(slots, "No free " + item.category.key()
                        + " slot available to place must-include item " + item.name + ".");
            }
            slots = slots.with(target, item.id);
        }
        return new MustIncludePlacement(slots, null);
    }

    // -------------------- ordering and prechecks --------------------

    /**
     * Attack potential toward the preferred direction desc, focus support potential desc,
     * accessories first when custom minimums exist, smaller pool first, slot name.
     */
    private static List<Slot> slotOrder(List<Slot> free, Map<Slot, List<PoolEntry>> pools, FocusStats focus,
                                        AttackTargets attack, Constraints constraints) {
        AttackSpeedContext ctx = attack.speedContext;
        int direction = ctx == null ? 0 : ctx.preferredDirection;
        boolean customMins = false;
        for (NumericRange r : SearchSpace.pruningSpecs(constraints)) {
            if (r.hasMin()) customMins = true;
        }

        Map<Slot, Double> attackPotential = new EnumMap<>(Slot.class);
        Map<Slot, Double> supportPotential = new EnumMap<>(Slot.class);
        for (Slot s : free) {
            double best = 0.0;
            if (direction != 0) {
                for (PoolEntry e : pools.get(s)) {
                    int t = e.item.atkTier;
                    best = Math.max(best, direction > 0 ? Math.max(0, t) : Math.max(0, -t));
                }
            }
            attackPotential.put(s, best);
            supportPotential.put(s, focus.supportPotential(pools.get(s)));
        }

        Comparator<Slot> cmp = Comparator.comparingDouble((Slot s) -> -attackPotential.get(s))
                .thenComparingDouble(s -> -supportPotential.get(s));
        if (customMins) cmp = cmp.thenComparingInt(s -> s.isSupportSlot() ? 0 : 1);
        cmp = cmp.thenComparingInt(s -> pools.get(s).size()).thenComparing(Slot::key);

        List<Slot> order = new ArrayList<>(free);
        order.sort(cmp);
        return order;
    }

    private static String unreachableCustomRange(SearchSpace space) {
        double[] base = space.baseCustomTotals();
        for (int i = 0; i < space.specs.size(); i++) {
            NumericRange r = space.specs.get(i);
            double minPossible = base[i] + space.bounds.customMinSuffix(0, i);
            double maxPossible = base[i] + space.bounds.customMaxSuffix(0, i);
            if (r.hasMin() && maxPossible < r.min) {
                return "Unsatisfiable threshold: " + r.key + " min " + HardConstraintCheck.num(r.min)
                        + " is above maximum reachable total " + HardConstraintCheck.num(maxPossible) + ".";
            }
            if (r.hasMax() && minPossible > r.max) {
                return "Unsatisfiable threshold: " + r.key + " max " + HardConstraintCheck.num(r.max)
                        + " is below minimum reachable total " + HardConstraintCheck.num(minPossible) + ".";
            }
        }
        return null;
    }

    // -------------------- rescue helpers --------------------

    private static Constraints feasibilityRescueConstraints(Constraints c, boolean thresholds, boolean attack) {
        Budgets b = c.budgets;
        long states = thresholds ? Math.min(THRESHOLD_STATE_CAP, b.maxStates * 5)
                : attack ? Math.min(ATTACK_STATE_CAP, b.maxStates * 4)
                : Math.min(SKILL_STATE_CAP, b.maxStates * 2);
        int beam = thresholds ? THRESHOLD_RESCUE_BEAM : attack ? ATTACK_RESCUE_BEAM : SKILL_RESCUE_BEAM;
        Constraints.Builder out = c.toBuilder().budgets(b.toBuilder()
                .maxStates(Math.max(b.maxStates, states))
                .beamWidth(Math.max(b.beamWidth, beam))
                .build());
        if (thresholds) out.weights(c.weights.thresholdBiased(c.targets));
        return out.build();
    }

    /** Reason for an empty finalization, or null when the rejects explain nothing specific. */
    private static ReasonCode reasonFromRejects(RejectStats r) {
        if (r.spInvalid > 0 && r.hardConstraints == 0) return ReasonCode.SP_INFEASIBLE;
        if (r.hardThresholds > 0) return ReasonCode.UNSAT_THRESHOLD;
        if (r.hardAttackSpeed > 0) return ReasonCode.UNSAT_ATTACK_TARGET;
        return null;
    }

    private static ReasonCode fallbackReason(RejectStats r) {
        ReasonCode code = reasonFromRejects(r);
        return code == null ? ReasonCode.SEARCH_PRUNED : code;
    }

    private static SearchOutcome fail(ProgressListener out, ReasonCode reason, long processed, int totalSlots, int expanded, String detail) {
        out.onProgress(ProgressEvent.diagnostics(processed, 0, totalSlots, expanded, reason, detail));
        return SearchOutcome.empty(reason, processed, detail);
    }

    private static List<Candidate> head(List<Candidate> list, int limit) {
        return list.size() > limit ? new ArrayList<>(list.subList(0, limit)) : list;
    }

    private static String seconds(long ms) {
        return HardConstraintCheck.num(ms / 1000.0);
    }
}
