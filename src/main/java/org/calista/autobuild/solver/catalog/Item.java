package org.calista.autobuild.solver.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Item — неизменяемая запись каталога.
 *
 * <p>Числовые статы хранятся по ключам каталога ("hp", "mr", "strReq", "atkTier", ...).
 * Грубые поля (offense / ehpProxy / utility / reqTotal / skillPointTotal) считаются один раз
 * при сборке и дальше используются пулами кандидатов и rough-score.</p>
 */
public final class Item {

    public final int id;
    public final String name;
    public final ItemCategory category;
    public final String type;
    public final String tier;
    public final int level;
    public final CharacterClass classReq;
    public final Set<String> majorIds;
    public final int powderSlots;
    public final AttackSpeed attackSpeed;
    public final boolean restricted;
    public final boolean deprecated;

    // rough fields
    public final double reqTotal;
    public final double skillPointTotal;
    public final double offense;
    public final double ehpProxy;
    public final double utility;
    public final int atkTier;

    private final Map<String, Double> numeric;
    private final double[] reqs = new double[SkillStat.COUNT];
    private final double[] bonuses = new double[SkillStat.COUNT];

    private Item(Builder b) {
        if (b.category == null) throw new IllegalArgumentException("item " + b.id + ": category is required");
        this.id = b.id;
        this.name = (b.name == null || b.name.isBlank()) ? ("item-" + b.id) : b.name;
        this.category = b.category;
        this.type = b.type == null ? b.category.key() : b.type;
        this.tier = (b.tier == null || b.tier.isBlank()) ? "Normal" : b.tier;
        this.level = Math.max(0, b.level);
        this.classReq = b.classReq != null ? b.classReq : CharacterClass.fromWeaponType(this.type);
        this.majorIds = Collections.unmodifiableSet(new LinkedHashSet<>(b.majorIds));
        this.powderSlots = Math.max(0, b.powderSlots);
        this.attackSpeed = b.attackSpeed;
        this.restricted = b.restricted;
        this.deprecated = b.deprecated;
        this.numeric = Collections.unmodifiableMap(new LinkedHashMap<>(b.numeric));

        double rt = 0.0;
        double st = 0.0;
        for (SkillStat s : SkillStat.values()) {
            reqs[s.ordinal()] = stat(s.reqKey());
            bonuses[s.ordinal()] = stat(s.bonusKey());
            rt += reqs[s.ordinal()];
            st += bonuses[s.ordinal()];
        }
        this.reqTotal = rt;
        this.skillPointTotal = st;

        this.offense = stat("averageDps")
                + stat("sdPct") * 1.4
                + stat("mdPct") * 1.15
                + stat("sdRaw") * 0.12
                + stat("mdRaw") * 0.12
                + (stat("damPct") + stat("rDamPct") + stat("nDamPct")) * 0.8
                + (stat("eDamPct") + stat("tDamPct") + stat("wDamPct") + stat("fDamPct") + stat("aDamPct")) * 0.5
                + stat("atkTier") * 7
                + stat("poison") * 0.03;
        this.ehpProxy = stat("hp") + stat("hpBonus")
                + (stat("eDef") + stat("tDef") + stat("wDef") + stat("fDef") + stat("aDef")) * 0.45
                + stat("hprRaw") * 1.2
                + stat("hprPct") * 2.5;
        this.utility = stat("spd") * 1.8 + stat("mr") * 8 + stat("ms") * 7 + stat("ls") * 6;
        this.atkTier = (int) Math.round(stat("atkTier"));
    }

    public static Builder builder(int id) {
        return new Builder(id);
    }

    /** Raw catalog stat; absent keys read as 0. */
    public double stat(String key) {
        Double v = numeric.get(key);
        return v == null ? 0.0 : v;
    }

    /**
     * Numeric value as seen by threshold rows: raw stats plus the derived keys
     * reqTotal, skillPointTotal, offenseScore, ehpProxy, utilityScore, lvl, slots.
     */
    public double numeric(String key) {
        if (key == null) return 0.0;
        Double v = numeric.get(key);
        if (v != null) return v;
        switch (key) {
            case "reqTotal":
                return reqTotal;
            case "skillPointTotal":
                return skillPointTotal;
            case "offenseScore":
                return offense;
            case "ehpProxy":
                return ehpProxy;
            case "utilityScore":
                return utility;
            case "lvl":
                return level;
            case "slots":
                return powderSlots;
            default:
                return 0.0;
        }
    }

    public Map<String, Double> stats() {
        return numeric;
    }

    public double req(SkillStat s) {
        return reqs[s.ordinal()];
    }

    public double bonus(SkillStat s) {
        return bonuses[s.ordinal()];
    }

    public double positiveBonus(SkillStat s) {
        return Math.max(0.0, bonuses[s.ordinal()]);
    }

    public boolean canBeWornBy(CharacterClass cls) {
        return cls == null || classReq == null || classReq == cls;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Item other)) return false;
        return id == other.id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return "Item{" + id + " '" + name + "' " + category.key() + '}';
    }

    // -------------------- builder --------------------

    public static final class Builder {
        private final int id;
        private String name;
        private ItemCategory category;
        private String type;
        private String tier;
        private int level;
        private CharacterClass classReq;
        private final Set<String> majorIds = new LinkedHashSet<>();
        private int powderSlots;
        private AttackSpeed attackSpeed;
        private boolean restricted;
        private boolean deprecated;
        private final Map<String, Double> numeric = new LinkedHashMap<>();

        private Builder(int id) {
            this.id = id;
        }

        public Builder name(String v) {
            this.name = v;
            return this;
        }

        public Builder category(ItemCategory v) {
            this.category = v;
            return this;
        }

        /** Sets type and derives the category from it when none was given. */
        public Builder type(String v) {
            this.type = v;
            if (this.category == null) this.category = ItemCategory.fromType(v);
            return this;
        }

        public Builder tier(String v) {
            this.tier = v;
            return this;
        }

        public Builder level(int v) {
            this.level = v;
            return this;
        }

        public Builder classReq(CharacterClass v) {
            this.classReq = v;
            return this;
        }

        public Builder majorId(String v) {
            if (v != null && !v.isBlank()) this.majorIds.add(v.trim());
            return this;
        }

        public Builder powderSlots(int v) {
            this.powderSlots = v;
            return this;
        }

        public Builder attackSpeed(AttackSpeed v) {
            this.attackSpeed = v;
            return this;
        }

        public Builder restricted(boolean v) {
            this.restricted = v;
            return this;
        }

        public Builder deprecated(boolean v) {
            this.deprecated = v;
            return this;
        }

        public Builder stat(String key, double value) {
            Objects.requireNonNull(key, "key");
            if (Double.isFinite(value)) numeric.put(key, value);
            return this;
        }

        public Builder stats(Map<String, ? extends Number> values) {
            if (values == null) return this;
            for (Map.Entry<String, ? extends Number> e : values.entrySet()) {
                if (e.getKey() == null || e.getValue() == null) continue;
                stat(e.getKey(), e.getValue().doubleValue());
            }
            return this;
        }

        public Item build() {
            return new Item(this);
        }
    }
}
