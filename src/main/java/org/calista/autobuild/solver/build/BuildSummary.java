package org.calista.autobuild.solver.build;

import org.calista.autobuild.solver.catalog.SkillStat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Derived combat metrics of one (possibly partial) assignment.
 *
 * <p>Aggregated fields are plain sums over the placed items (requirements are maxima).
 * Derived fields are what scoring and thresholds read.</p>
 */
public final class BuildSummary {

    // -------------------- aggregated --------------------
    public final double hpTotal;
    public final double hprTotal;
    public final double mr;
    public final double ms;
    public final double ls;
    public final double speed;
    public final double[] skillPoints;
    public final double[] skillReqs;
    /** earth, thunder, water, fire, air */
    public final double[] defenses;
    public final double baseDps;
    public final double spellPct;
    public final double spellRaw;
    public final double meleePct;
    public final double meleeRaw;
    public final double elemDamPct;
    public final double genericDamPct;
    public final double offenseScore;

    // -------------------- derived --------------------
    public final double dpsProxy;
    public final double spellProxy;
    public final double meleeProxy;
    public final double ehpProxy;
    public final double reqTotal;
    public final double skillPointTotal;
    public final double legacyBaseDps;
    public final double legacyEhp;
    public final double legacyEhpNoAgi;
    public final boolean skillPointFeasible;
    public final double assignedSkillPointsRequired;

    public final List<String> warnings;

    private BuildSummary(Builder b) {
        this.hpTotal = b.hpTotal;
        this.hprTotal = b.hprTotal;
        this.mr = b.mr;
        this.ms = b.ms;
        this.ls = b.ls;
        this.speed = b.speed;
        this.skillPoints = b.skillPoints.clone();
        this.skillReqs = b.skillReqs.clone();
        this.defenses = b.defenses.clone();
        this.baseDps = b.baseDps;
        this.spellPct = b.spellPct;
        this.spellRaw = b.spellRaw;
        this.meleePct = b.meleePct;
        this.meleeRaw = b.meleeRaw;
        this.elemDamPct = b.elemDamPct;
        this.genericDamPct = b.genericDamPct;
        this.offenseScore = b.offenseScore;

        this.dpsProxy = b.dpsProxy;
        this.spellProxy = b.spellProxy;
        this.meleeProxy = b.meleeProxy;
        this.ehpProxy = b.ehpProxy;
        this.reqTotal = b.reqTotal;
        this.skillPointTotal = b.skillPointTotal;
        this.legacyBaseDps = b.legacyBaseDps;
        this.legacyEhp = b.legacyEhp;
        this.legacyEhpNoAgi = b.legacyEhpNoAgi;
        this.skillPointFeasible = b.skillPointFeasible;
        this.assignedSkillPointsRequired = b.assignedSkillPointsRequired;

        this.warnings = Collections.unmodifiableList(new ArrayList<>(b.warnings));
    }

    public double skillPoints(SkillStat s) {
        return skillPoints[s.ordinal()];
    }

    public double skillReq(SkillStat s) {
        return skillReqs[s.ordinal()];
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable accumulator filled by an evaluator, then frozen with {@link #build()}.
     */
    public static final class Builder {
        public double hpTotal;
        public double hprTotal;
        public double mr;
        public double ms;
        public double ls;
        public double speed;
        public final double[] skillPoints = new double[SkillStat.COUNT];
        public final double[] skillReqs = new double[SkillStat.COUNT];
        public final double[] defenses = new double[5];
        public double baseDps;
        public double spellPct;
        public double spellRaw;
        public double meleePct;
        public double meleeRaw;
        public double elemDamPct;
        public double genericDamPct;
        public double offenseScore;

        public double dpsProxy;
        public double spellProxy;
        public double meleeProxy;
        public double ehpProxy;
        public double reqTotal;
        public double skillPointTotal;
        public double legacyBaseDps;
        public double legacyEhp;
        public double legacyEhpNoAgi;
        public boolean skillPointFeasible = true;
        public double assignedSkillPointsRequired;

        public final List<String> warnings = new ArrayList<>();

        private Builder() {}

        public BuildSummary build() {
            return new BuildSummary(this);
        }
    }
}
