package org.calista.autobuild.solver.score.impl;

import org.calista.autobuild.solver.build.BuildSummary;
import org.calista.autobuild.solver.constraints.Targets;
import org.calista.autobuild.solver.constraints.Weights;
import org.calista.autobuild.solver.score.ScoreBreakdown;
import org.calista.autobuild.solver.score.ScoredBuild;
import org.calista.autobuild.solver.score.Scorer;

import java.util.Objects;

/**
 * WeightedScorer — линейная сумма взвешенных метрик минус штрафы.
 *
 * <p>sustain = hpr * 0.9 + mr * 14 + ms * 10 + ls * 9.
 * Штраф за порог = недобор (или перебор для maxReqTotal) * множитель порога.</p>
 */
public final class WeightedScorer implements Scorer {

    private static final double PENALTY_MIN_LEGACY_BASE_DPS = 4.0;
    private static final double PENALTY_MIN_LEGACY_EHP = 0.8;
    private static final double PENALTY_MIN_DPS_PROXY = 4.0;
    private static final double PENALTY_MIN_EHP_PROXY = 1.1;
    private static final double PENALTY_MIN_MR = 45.0;
    private static final double PENALTY_MIN_MS = 35.0;
    private static final double PENALTY_MIN_SPEED = 12.0;
    private static final double PENALTY_MIN_SKILL_POINTS = 15.0;
    private static final double PENALTY_MAX_REQ_TOTAL = 8.0;

    @Override
    public ScoredBuild score(BuildSummary s, Weights w, Targets targets) {
        Objects.requireNonNull(s, "summary");
        Objects.requireNonNull(w, "weights");
        Targets t = targets == null ? Targets.NONE : targets;

        double sustain = sustain(s);
        ScoreBreakdown b = new ScoreBreakdown(
                s.legacyBaseDps * w.legacyBaseDps,
                s.legacyEhp * w.legacyEhp,
                s.dpsProxy * w.dpsProxy,
                s.spellProxy * w.spellProxy,
                s.meleeProxy * w.meleeProxy,
                s.ehpProxy * w.ehpProxy,
                s.speed * w.speed,
                sustain * w.sustain,
                s.skillPointTotal * w.skillPointTotal,
                s.reqTotal * w.reqTotalPenalty,
                thresholdPenalty(s, t)
        );
        return new ScoredBuild(b.total(), b);
    }

    public static double sustain(BuildSummary s) {
        return s.hprTotal * 0.9 + s.mr * 14 + s.ms * 10 + s.ls * 9;
    }

    public static double thresholdPenalty(BuildSummary s, Targets t) {
        double p = 0.0;
        p += shortfall(t.minLegacyBaseDps, s.legacyBaseDps) * PENALTY_MIN_LEGACY_BASE_DPS;
        p += shortfall(t.minLegacyEhp, s.legacyEhp) * PENALTY_MIN_LEGACY_EHP;
        p += shortfall(t.minDpsProxy, s.dpsProxy) * PENALTY_MIN_DPS_PROXY;
        p += shortfall(t.minEhpProxy, s.ehpProxy) * PENALTY_MIN_EHP_PROXY;
        p += shortfall(t.minMr, s.mr) * PENALTY_MIN_MR;
        p += shortfall(t.minMs, s.ms) * PENALTY_MIN_MS;
        p += shortfall(t.minSpeed, s.speed) * PENALTY_MIN_SPEED;
        p += shortfall(t.minSkillPointTotal, s.skillPointTotal) * PENALTY_MIN_SKILL_POINTS;
        if (t.maxReqTotal != null && s.reqTotal > t.maxReqTotal) {
            p += (s.reqTotal - t.maxReqTotal) * PENALTY_MAX_REQ_TOTAL;
        }
        return p;
    }

    private static double shortfall(Double min, double value) {
        if (min == null || value >= min) return 0.0;
        return min - value;
    }
}
