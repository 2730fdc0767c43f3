package org.calista.autobuild.solver.score;

/**
 * Weighted score terms. Positive terms are summed, {@code reqPenalty} and
 * {@code thresholdPenalty} are subtracted.
 */
public final class ScoreBreakdown {
    public final double legacyBaseDps;
    public final double legacyEhp;
    public final double dpsProxy;
    public final double spellProxy;
    public final double meleeProxy;
    public final double ehpProxy;
    public final double speed;
    public final double sustain;
    public final double skillPointTotal;
    public final double reqPenalty;
    public final double thresholdPenalty;

    public ScoreBreakdown(double legacyBaseDps,
                          double legacyEhp,
                          double dpsProxy,
                          double spellProxy,
                          double meleeProxy,
                          double ehpProxy,
                          double speed,
                          double sustain,
                          double skillPointTotal,
                          double reqPenalty,
                          double thresholdPenalty) {
        this.legacyBaseDps = legacyBaseDps;
        this.legacyEhp = legacyEhp;
        this.dpsProxy = dpsProxy;
        this.spellProxy = spellProxy;
        this.meleeProxy = meleeProxy;
        this.ehpProxy = ehpProxy;
        this.speed = speed;
        this.sustain = sustain;
        this.skillPointTotal = skillPointTotal;
        this.reqPenalty = reqPenalty;
        this.thresholdPenalty = thresholdPenalty;
    }

    public double total() {
        return legacyBaseDps + legacyEhp + dpsProxy + spellProxy + meleeProxy + ehpProxy
                + speed + sustain + skillPointTotal
                - reqPenalty - thresholdPenalty;
    }

    @Override
    public String toString() {
        return "ScoreBreakdown{baseDps=" + legacyBaseDps + ", ehp=" + legacyEhp + ", dps=" + dpsProxy
                + ", spell=" + spellProxy + ", melee=" + meleeProxy + ", ehpProxy=" + ehpProxy
                + ", speed=" + speed + ", sustain=" + sustain + ", sp=" + skillPointTotal
                + ", reqPenalty=" + reqPenalty + ", thresholdPenalty=" + thresholdPenalty + '}';
    }
}
