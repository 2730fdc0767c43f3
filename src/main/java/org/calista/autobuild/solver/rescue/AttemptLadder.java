package org.calista.autobuild.solver.rescue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AttemptLadder — фиксированный набор попыток и их порядок по стратегии.
 *
 * <p>Состав:
 * <ul>
 *   <li>AUTO: fast, затем (deep fallback) deep, bruteish, feasibility rescue</li>
 *   <li>FAST: fast</li>
 *   <li>CONSTRAINT: constraint pass, затем (deep fallback) constraint deep, exhaustive</li>
 *   <li>EXHAUSTIVE: с deep fallback constraint pass + exhaustive, без него только exhaustive</li>
 * </ul>
 * Несколько стратегий склеиваются по порядку, повторы не убираются.</p>
 */
public final class AttemptLadder {

    public static final Attempt FAST = new Attempt("Fast pass", 0, 0, 0, false, 0);
    public static final Attempt DEEP = new Attempt("Deep pass", 140, 700, 900_000L, false, 0);
    public static final Attempt BRUTEISH = new Attempt("Bruteforce-ish pass", 220, 1200, 4_000_000L, false, 0);
    public static final Attempt FEASIBILITY_RESCUE = new Attempt("Feasibility rescue", 260, 1400, 4_500_000L, true, 0);
    public static final Attempt CONSTRAINT_PASS = new Attempt("Constraint-first pass", 180, 1200, 2_200_000L, true, 0);
    public static final Attempt CONSTRAINT_DEEP = new Attempt("Constraint rescue deep", 280, 2200, 9_000_000L, true, 1_200_000L);
    public static final Attempt EXHAUSTIVE = new Attempt("Exhaustive-ish pass", 300, 2600, 12_000_000L, true, 2_000_000L);

    /** Last resort after every tier came back empty; weights are replaced by threshold-biased ones. */
    public static final Attempt THRESHOLD_RESCUE = new Attempt("Threshold rescue pass", 180, 3600, 2_200_000L, false, 0);

    private AttemptLadder() {}

    public static List<Attempt> forStrategy(SolverStrategy strategy, boolean deepFallback) {
        SolverStrategy s = strategy == null ? SolverStrategy.AUTO : strategy;
        switch (s) {
            case FAST:
                return List.of(FAST);
            case CONSTRAINT:
                return deepFallback ? List.of(CONSTRAINT_PASS, CONSTRAINT_DEEP, EXHAUSTIVE) : List.of(CONSTRAINT_PASS);
            case EXHAUSTIVE:
                return deepFallback ? List.of(CONSTRAINT_PASS, EXHAUSTIVE) : List.of(EXHAUSTIVE);
            case AUTO:
            default:
                return deepFallback ? List.of(FAST, DEEP, BRUTEISH, FEASIBILITY_RESCUE) : List.of(FAST);
        }
    }

    /** Empty or null list means AUTO. */
    public static List<Attempt> compose(List<SolverStrategy> strategies, boolean deepFallback) {
        if (strategies == null || strategies.isEmpty()) return forStrategy(SolverStrategy.AUTO, deepFallback);
        List<Attempt> out = new ArrayList<>();
        for (SolverStrategy s : strategies) out.addAll(forStrategy(s, deepFallback));
        return Collections.unmodifiableList(out);
    }
}
