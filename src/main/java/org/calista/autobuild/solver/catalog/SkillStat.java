package org.calista.autobuild.solver.catalog;

/**
 * The five skill point stats with their catalog keys (bonus key, requirement key).
 */
public enum SkillStat {
    STR("str", "strReq"),
    DEX("dex", "dexReq"),
    INT("int", "intReq"),
    DEF("def", "defReq"),
    AGI("agi", "agiReq");

    public static final int COUNT = values().length;

    private final String bonusKey;
    private final String reqKey;

    SkillStat(String bonusKey, String reqKey) {
        this.bonusKey = bonusKey;
        this.reqKey = reqKey;
    }

    public String bonusKey() {
        return bonusKey;
    }

    public String reqKey() {
        return reqKey;
    }
}
