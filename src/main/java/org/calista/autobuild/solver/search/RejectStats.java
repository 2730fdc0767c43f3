package org.calista.autobuild.solver.search;

/**
 * Why complete assignments were thrown away during finalization.
 */
public final class RejectStats {
    public int majorIds;
    public int spInvalid;
    public int duplicate;
    public int hardConstraints;
    public int hardAttackSpeed;
    public int hardThresholds;
    public int hardItem;
    /** First threshold failure seen, e.g. {@code minLegacyBaseDps (1200 < 1500)}. */
    public String thresholdFailureExample;

    void hard(HardConstraintCheck check) {
        hardConstraints++;
        switch (check.kind) {
            case ATTACK_SPEED:
                hardAttackSpeed++;
                break;
            case THRESHOLDS:
                hardThresholds++;
                if (thresholdFailureExample == null && !check.failures.isEmpty()) {
                    thresholdFailureExample = check.failures.get(0);
                }
                break;
            default:
                hardItem++;
        }
    }

    /** "duplicates=.., SP-invalid=.., majorID=.., hard=.." */
    public String shortSummary() {
        return "duplicates=" + duplicate + ", SP-invalid=" + spInvalid + ", majorID=" + majorIds + ", hard=" + hardConstraints;
    }

    /** "SP-invalid=.., majorID=.., duplicates=.., hard=.. (speed=.., thresholds=.., item=..)" */
    public String fullSummary() {
        return "SP-invalid=" + spInvalid + ", majorID=" + majorIds + ", duplicates=" + duplicate
                + ", hard=" + hardConstraints + hardSplit();
    }

    String hardSplit() {
        return " (speed=" + hardAttackSpeed + ", thresholds=" + hardThresholds + ", item=" + hardItem + ")";
    }

    /** " Example failure: X." or empty. */
    public String exampleSuffix() {
        return thresholdFailureExample == null ? "" : " Example failure: " + thresholdFailureExample + ".";
    }

    @Override
    public String toString() {
        return "RejectStats{" + fullSummary() + '}';
    }
}
