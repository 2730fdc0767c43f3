package org.calista.autobuild.solver.build.impl;

import org.calista.autobuild.solver.build.BuildEvaluator;
import org.calista.autobuild.solver.build.BuildSummary;
import org.calista.autobuild.solver.build.SkillPointFeasibility;
import org.calista.autobuild.solver.build.SlotAssignment;
import org.calista.autobuild.solver.build.TomeMode;
import org.calista.autobuild.solver.catalog.CatalogSnapshot;
import org.calista.autobuild.solver.catalog.CharacterClass;
import org.calista.autobuild.solver.catalog.Item;
import org.calista.autobuild.solver.catalog.SkillStat;
import org.calista.autobuild.solver.catalog.Slot;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * DefaultBuildEvaluator — агрегирует статы предметов и считает производные метрики.
 *
 * <p>Формулы:</p>
 * <ul>
 *   <li>spell/melee proxy = (baseDps * (1 + (pct + elem + generic) / 100) + raw) * (1 + strPct)</li>
 *   <li>dpsProxy = melee + spell + speed * 0.8</li>
 *   <li>ehpProxy = hp + defs * 0.45 + hpr * 2 + def * 12 + agi * 10</li>
 *   <li>legacy EHP: def/agi skill curves, agi cap 90%, class defence multiplier by weapon type</li>
 * </ul>
 *
 * Stateless apart from the catalog reference; safe to share between rescue tiers.
 */
public final class DefaultBuildEvaluator implements BuildEvaluator {

    private static final double SKILL_CURVE_R = 0.9908;
    private static final double SKILL_CURVE_CAP = 150.0;
    private static final double DEFENSE_MULT_SCALE = 0.867;
    private static final double AGILITY_MULT_SCALE = 0.951;
    private static final double AGI_DEF_CAP = 90.0;

    private final CatalogSnapshot catalog;

    public DefaultBuildEvaluator(CatalogSnapshot catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    @Override
    public BuildSummary evaluate(SlotAssignment slots, int level, CharacterClass characterClass, TomeMode tomeMode) {
        Objects.requireNonNull(slots, "slots");
        BuildSummary.Builder s = BuildSummary.builder();

        String weaponType = null;
        List<Item> equipped = new ArrayList<>(Slot.COUNT);

        for (Slot slot : Slot.ALL) {
            Item item = catalog.item(slots.get(slot));
            if (item == null) continue;
            equipped.add(item);
            if (slot == Slot.WEAPON) weaponType = item.type;

            s.hpTotal += item.stat("hp") + item.stat("hpBonus");
            s.hprTotal += item.stat("hprRaw") + item.stat("hprPct");
            s.mr += item.stat("mr");
            s.ms += item.stat("ms");
            s.ls += item.stat("ls");
            s.speed += item.stat("spd");

            for (SkillStat st : SkillStat.values()) {
                s.skillPoints[st.ordinal()] += item.bonus(st);
                s.skillReqs[st.ordinal()] = Math.max(s.skillReqs[st.ordinal()], item.req(st));
            }

            s.defenses[0] += item.stat("eDef");
            s.defenses[1] += item.stat("tDef");
            s.defenses[2] += item.stat("wDef");
            s.defenses[3] += item.stat("fDef");
            s.defenses[4] += item.stat("aDef");

            s.baseDps += item.stat("averageDps");
            s.spellPct += item.stat("sdPct");
            s.spellRaw += item.stat("sdRaw");
            s.meleePct += item.stat("mdPct");
            s.meleeRaw += item.stat("mdRaw");
            s.elemDamPct += item.stat("eDamPct") + item.stat("tDamPct") + item.stat("wDamPct")
                    + item.stat("fDamPct") + item.stat("aDamPct");
            s.genericDamPct += item.stat("damPct") + item.stat("rDamPct") + item.stat("nDamPct");
            s.offenseScore += item.offense;
        }

        CharacterClass cls = characterClass;
        if (cls == null && weaponType != null) cls = CharacterClass.fromWeaponType(weaponType);
        collectWarnings(slots, level, cls, s.warnings);

        for (int i = 0; i < SkillStat.COUNT; i++) {
            s.reqTotal += s.skillReqs[i];
            s.skillPointTotal += s.skillPoints[i];
        }

        SkillPointFeasibility.Result feas = SkillPointFeasibility.evaluate(equipped, level, tomeMode);

        double strPct = skillPointsToPercentage(s.skillPoints[SkillStat.STR.ordinal()]);
        double skillMult = 1.0 + strPct;

        s.spellProxy = (s.baseDps * (1.0 + (s.spellPct + s.elemDamPct + s.genericDamPct) / 100.0) + s.spellRaw) * skillMult;
        s.meleeProxy = (s.baseDps * (1.0 + (s.meleePct + s.elemDamPct + s.genericDamPct) / 100.0) + s.meleeRaw) * skillMult;
        s.dpsProxy = s.meleeProxy + s.spellProxy + s.speed * 0.8;

        double defSum = 0.0;
        for (double d : s.defenses) defSum += d;
        s.ehpProxy = s.hpTotal
                + defSum * 0.45
                + s.hprTotal * 2
                + Math.max(0.0, s.skillPoints[SkillStat.DEF.ordinal()]) * 12
                + Math.max(0.0, s.skillPoints[SkillStat.AGI.ordinal()]) * 10;

        s.legacyBaseDps = s.baseDps;
        double totalHp = levelToBaseHp(level) + s.hpTotal;
        double[] ehp = legacyEhp(totalHp,
                s.skillPoints[SkillStat.DEF.ordinal()],
                s.skillPoints[SkillStat.AGI.ordinal()],
                weaponType);
        s.legacyEhp = ehp[0];
        s.legacyEhpNoAgi = ehp[1];

        s.skillPointFeasible = feas.feasible;
        s.assignedSkillPointsRequired = Double.isFinite(feas.assignedTotal) ? feas.assignedTotal : 0.0;
        if (!feas.feasible) {
            s.warnings.add("Skill requirements are not satisfiable at level " + level
                    + " (assigned points exceed available or no valid equip order).");
        }
        return s.build();
    }

    @Override
    public SkillPointFeasibility.Result partialFeasibility(SlotAssignment slots, int level, TomeMode tomeMode) {
        Objects.requireNonNull(slots, "slots");
        return SkillPointFeasibility.evaluate(slots.items(catalog), level, tomeMode);
    }

    // -------------------- warnings --------------------

    private void collectWarnings(SlotAssignment slots, int level, CharacterClass cls, List<String> out) {
        for (Slot slot : Slot.ALL) {
            Item item = catalog.item(slots.get(slot));
            if (item == null) continue;
            if (!slot.accepts(item)) {
                out.add(slot.key() + " contains incompatible item type (" + item.type + ").");
            }
            if (item.level > level) {
                out.add(item.name + " requires level " + item.level + ".");
            }
            if (cls != null && item.classReq != null && item.classReq != cls) {
                out.add(item.name + " requires " + item.classReq.name().toLowerCase(Locale.ROOT) + ".");
            }
            if (item.restricted || item.deprecated) {
                out.add(item.name + " is restricted/deprecated.");
            }
        }
    }

    // -------------------- formulas --------------------

    static double skillPointsToPercentage(double skillPoints) {
        double skp = Double.isFinite(skillPoints) ? skillPoints : 0.0;
        if (skp <= 0.0) return 0.0;
        if (skp >= SKILL_CURVE_CAP) skp = SKILL_CURVE_CAP;
        double r = SKILL_CURVE_R;
        return (r / (1.0 - r) * (1.0 - Math.pow(r, skp))) / 100.0;
    }

    static double levelToBaseHp(int level) {
        int l = Math.max(1, Math.min(106, level));
        return l * 5.0 + 5.0;
    }

    static double classDefenseMultiplier(String weaponType) {
        if (weaponType == null) return 1.0;
        switch (weaponType) {
            case "relik":
                return 0.6;
            case "bow":
                return 0.7;
            case "wand":
                return 0.8;
            default:
                return 1.0;
        }
    }

    /**
     * @return {withAgi, noAgi}
     */
    static double[] legacyEhp(double totalHp, double defSkillPoints, double agiSkillPoints, String weaponType) {
        double hp = Math.max(5.0, totalHp);
        double defPct = skillPointsToPercentage(defSkillPoints) * DEFENSE_MULT_SCALE;
        double agiPct = skillPointsToPercentage(agiSkillPoints) * AGILITY_MULT_SCALE;
        double defMult = 2.0 - classDefenseMultiplier(weaponType);
        double agiReduction = (100.0 - AGI_DEF_CAP) / 100.0;
        double denomWithAgi = agiReduction * agiPct + (1.0 - agiPct) * (1.0 - defPct);
        double denomNoAgi = 1.0 - defPct;

        double withAgi = hp / Math.max(1e-9, denomWithAgi) / Math.max(1e-9, defMult);
        double noAgi = hp / Math.max(1e-9, denomNoAgi) / Math.max(1e-9, defMult);
        return new double[]{withAgi, noAgi};
    }
}
