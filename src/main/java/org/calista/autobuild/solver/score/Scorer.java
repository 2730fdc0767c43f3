package org.calista.autobuild.solver.score;

import org.calista.autobuild.solver.build.BuildSummary;
import org.calista.autobuild.solver.constraints.Targets;
import org.calista.autobuild.solver.constraints.Weights;

/**
 * A scorer turns an evaluated build into a single ranking value.
 *
 * Design goals:
 *  - deterministic (same summary, weights and targets give the same score)
 *  - pure (no state between calls)
 */
public interface Scorer {
    ScoredBuild score(BuildSummary summary, Weights weights, Targets targets);
}
