package org.calista.autobuild.solver.search;

import org.calista.autobuild.solver.build.BuildEvaluator;
import org.calista.autobuild.solver.build.BuildSummary;
import org.calista.autobuild.solver.build.SlotAssignment;
import org.calista.autobuild.solver.catalog.CatalogSnapshot;
import org.calista.autobuild.solver.catalog.Item;
import org.calista.autobuild.solver.constraints.Constraints;
import org.calista.autobuild.solver.score.ScoredBuild;
import org.calista.autobuild.solver.score.Scorer;
import org.calista.autobuild.solver.util.CancellationToken;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Finalizer — превращает полные назначения в кандидатов.
 *
 * <p>Per assignment: required major ids, full evaluation, skill point feasibility, hard checks,
 * canonical duplicate, score. Every rejection is counted in {@link RejectStats}. The exact
 * enumeration and the deterministic fallback validate their leaves through {@link #accept}.</p>
 */
public final class Finalizer {

    private final CatalogSnapshot catalog;
    private final BuildEvaluator evaluator;
    private final Scorer scorer;

    public Finalizer(CatalogSnapshot catalog, BuildEvaluator evaluator, Scorer scorer) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
    }

    public static final class Result {
        public final List<Candidate> candidates;
        public final RejectStats rejects;

        Result(List<Candidate> candidates, RejectStats rejects) {
            this.candidates = candidates;
            this.rejects = rejects;
        }
    }

    /** Validates and scores every assignment; candidates come back in ranking order. */
    public Result finalizeAll(List<SlotAssignment> assignments, Constraints constraints, CancellationToken cancel) {
        RejectStats stats = new RejectStats();
        Set<String> seen = new HashSet<>();
        List<Candidate> out = new ArrayList<>();
        for (SlotAssignment a : assignments) {
            cancel.throwIfCancelled();
            Candidate c = accept(a, constraints, seen, stats);
            if (c != null) out.add(c);
        }
        out.sort(Candidate.RANKING);
        return new Result(out, stats);
    }

    /**
     * One assignment through the full validation.
     *
     * @return the candidate, or null when rejected (the reason is counted in {@code stats})
     */
    public Candidate accept(SlotAssignment slots, Constraints constraints, Set<String> seen, RejectStats stats) {
        if (!hasRequiredMajorIds(slots, constraints.filters.requiredMajorIds)) {
            stats.majorIds++;
            return null;
        }
        BuildSummary summary = evaluator.evaluate(slots, constraints.filters.level,
                constraints.filters.characterClass, constraints.filters.tomeMode);
        if (!summary.skillPointFeasible) {
            stats.spInvalid++;
            return null;
        }
        HardConstraintCheck check = HardConstraintCheck.validate(slots, catalog, constraints, summary);
        if (!check.ok()) {
            stats.hard(check);
            return null;
        }
        if (!seen.add(slots.canonicalKey())) {
            stats.duplicate++;
            return null;
        }
        ScoredBuild scored = scorer.score(summary, constraints.weights, constraints.targets);
        return new Candidate(slots, scored.score, scored.breakdown, summary);
    }

    /** Live preview of a beam: evaluated and scored, never validated. */
    public Candidate preview(SlotAssignment slots, Constraints constraints) {
        BuildSummary summary = evaluator.evaluate(slots, constraints.filters.level,
                constraints.filters.characterClass, constraints.filters.tomeMode);
        ScoredBuild scored = scorer.score(summary, constraints.weights, constraints.targets);
        return new Candidate(slots, scored.score, scored.breakdown, summary);
    }

    private boolean hasRequiredMajorIds(SlotAssignment slots, List<String> required) {
        if (required.isEmpty()) return true;
        Set<String> found = new HashSet<>();
        for (Item it : slots.items(catalog)) {
            for (String m : it.majorIds) {
                if (required.contains(m)) found.add(m);
            }
        }
        return found.containsAll(required);
    }
}
