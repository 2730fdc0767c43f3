package org.calista.autobuild.solver.constraints;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.autobuild.solver.build.TomeMode;
import org.calista.autobuild.solver.catalog.AttackSpeed;
import org.calista.autobuild.solver.catalog.CharacterClass;
import org.calista.autobuild.solver.catalog.Slot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * ConstraintsDocument — JSON-форма {@link Constraints} (для конфига и CLI).
 *
 * <p>Простой POJO: дефолты в полях, неизвестные поля игнорируются, {@link #toConstraints()}
 * валидирует через билдеры. Неизвестные attack speed / slot имена пропускаются с warn.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ConstraintsDocument {

    private static final Logger log = LogManager.getLogger(ConstraintsDocument.class);

    public String characterClass;
    public int level = Filters.MAX_LEVEL;
    public List<Integer> mustIncludeIds = new ArrayList<>();
    public List<Integer> excludedIds = new ArrayList<>();
    public Map<String, Boolean> lockedSlots = new LinkedHashMap<>();
    public Target target = new Target();
    public List<String> allowedTiers = new ArrayList<>();
    public List<String> requiredMajorIds = new ArrayList<>();
    public List<String> excludedMajorIds = new ArrayList<>();
    public List<String> weaponAttackSpeeds = new ArrayList<>();
    public String attackSpeedConstraintMode = "or";
    public String skillpointFeasibilityMode = "no_tomes";
    public Integer minPowderSlots;
    public boolean onlyPinnedItems = false;
    public WeightsSection weights = new WeightsSection();
    public int topN = 50;
    public int topKPerSlot = 80;
    public int beamWidth = 400;
    public long maxStates = 150_000L;
    public boolean useExhaustiveSmallPool = true;
    public long exhaustiveStateLimit = 250_000L;
    public boolean allowRestricted = true;
    public boolean constraintOnlyMode = false;

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Target {
        public Double minLegacyBaseDps;
        public Double minLegacyEhp;
        public Double minDpsProxy;
        public Double minEhpProxy;
        public Double minMr;
        public Double minMs;
        public Double minSpeed;
        public Double minSkillPointTotal;
        public Double maxReqTotal;
        public List<NumericRange> customNumericRanges = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class WeightsSection {
        public double legacyBaseDps = 1.0;
        public double legacyEhp = 0.7;
        public double dpsProxy = 1.0;
        public double spellProxy = 0.0;
        public double meleeProxy = 0.0;
        public double ehpProxy = 0.6;
        public double speed = 0.4;
        public double sustain = 0.35;
        public double skillPointTotal = 0.15;
        public double reqTotalPenalty = 0.2;
    }

    // -------------------- Conversion --------------------

    public Constraints toConstraints() {
        Filters.Builder f = Filters.builder()
                .characterClass(CharacterClass.parseOrNull(characterClass))
                .level(level)
                .mustIncludeIds(mustIncludeIds)
                .excludedIds(excludedIds)
                .allowedTiers(allowedTiers)
                .requiredMajorIds(requiredMajorIds)
                .excludedMajorIds(excludedMajorIds)
                .attackSpeedMode(AttackSpeedMode.parseOrDefault(attackSpeedConstraintMode, AttackSpeedMode.OR))
                .tomeMode(TomeMode.parseOrDefault(skillpointFeasibilityMode, TomeMode.NO_TOMES))
                .minPowderSlots(minPowderSlots)
                .onlyPinnedItems(onlyPinnedItems)
                .allowRestricted(allowRestricted);

        if (weaponAttackSpeeds != null) {
            for (String raw : weaponAttackSpeeds) {
                AttackSpeed s = AttackSpeed.parseOrNull(raw);
                if (s == null) {
                    log.warn("Unknown weapon attack speed '{}' ignored", raw);
                    continue;
                }
                f.weaponAttackSpeed(s);
            }
        }
        if (lockedSlots != null) {
            for (Map.Entry<String, Boolean> e : lockedSlots.entrySet()) {
                if (!Boolean.TRUE.equals(e.getValue())) continue;
                try {
                    f.lock(Slot.parse(e.getKey()));
                } catch (IllegalArgumentException ex) {
                    log.warn("Locked slot ignored: {}", ex.getMessage());
                }
            }
        }

        Target t = target == null ? new Target() : target;
        Targets targets = Targets.builder()
                .minLegacyBaseDps(t.minLegacyBaseDps)
                .minLegacyEhp(t.minLegacyEhp)
                .minDpsProxy(t.minDpsProxy)
                .minEhpProxy(t.minEhpProxy)
                .minMr(t.minMr)
                .minMs(t.minMs)
                .minSpeed(t.minSpeed)
                .minSkillPointTotal(t.minSkillPointTotal)
                .maxReqTotal(t.maxReqTotal)
                .customRanges(t.customNumericRanges)
                .build();

        WeightsSection w = weights == null ? new WeightsSection() : weights;
        Weights ws = Weights.builder()
                .legacyBaseDps(w.legacyBaseDps)
                .legacyEhp(w.legacyEhp)
                .dpsProxy(w.dpsProxy)
                .spellProxy(w.spellProxy)
                .meleeProxy(w.meleeProxy)
                .ehpProxy(w.ehpProxy)
                .speed(w.speed)
                .sustain(w.sustain)
                .skillPointTotal(w.skillPointTotal)
                .reqTotalPenalty(w.reqTotalPenalty)
                .build();

        Budgets budgets = Budgets.builder()
                .topN(topN)
                .topKPerSlot(topKPerSlot)
                .beamWidth(beamWidth)
                .maxStates(maxStates)
                .useExhaustiveSmallPool(useExhaustiveSmallPool)
                .exhaustiveStateLimit(exhaustiveStateLimit)
                .build();

        return Constraints.builder()
                .filters(f.build())
                .targets(targets)
                .weights(ws)
                .budgets(budgets)
                .constraintOnlyMode(constraintOnlyMode)
                .build();
    }

    public static ConstraintsDocument from(Constraints c) {
        ConstraintsDocument d = new ConstraintsDocument();
        Filters f = c.filters;
        d.characterClass = f.characterClass == null ? null : f.characterClass.name().toLowerCase(Locale.ROOT);
        d.level = f.level;
        d.mustIncludeIds = new ArrayList<>(f.mustIncludeIds);
        d.excludedIds = new ArrayList<>(f.excludedIds);
        for (Slot s : f.lockedSlots) d.lockedSlots.put(s.key(), true);
        d.allowedTiers = new ArrayList<>(f.allowedTiers);
        d.requiredMajorIds = new ArrayList<>(f.requiredMajorIds);
        d.excludedMajorIds = new ArrayList<>(f.excludedMajorIds);
        for (AttackSpeed s : f.weaponAttackSpeeds) d.weaponAttackSpeeds.add(s.name());
        d.attackSpeedConstraintMode = f.attackSpeedMode.name().toLowerCase(Locale.ROOT);
        d.skillpointFeasibilityMode = f.tomeMode.name().toLowerCase(Locale.ROOT);
        d.minPowderSlots = f.minPowderSlots;
        d.onlyPinnedItems = f.onlyPinnedItems;
        d.allowRestricted = f.allowRestricted;

        Targets t = c.targets;
        d.target.minLegacyBaseDps = t.minLegacyBaseDps;
        d.target.minLegacyEhp = t.minLegacyEhp;
        d.target.minDpsProxy = t.minDpsProxy;
        d.target.minEhpProxy = t.minEhpProxy;
        d.target.minMr = t.minMr;
        d.target.minMs = t.minMs;
        d.target.minSpeed = t.minSpeed;
        d.target.minSkillPointTotal = t.minSkillPointTotal;
        d.target.maxReqTotal = t.maxReqTotal;
        d.target.customNumericRanges = new ArrayList<>(t.customRanges);

        Weights w = c.weights;
        d.weights.legacyBaseDps = w.legacyBaseDps;
        d.weights.legacyEhp = w.legacyEhp;
        d.weights.dpsProxy = w.dpsProxy;
        d.weights.spellProxy = w.spellProxy;
        d.weights.meleeProxy = w.meleeProxy;
        d.weights.ehpProxy = w.ehpProxy;
        d.weights.speed = w.speed;
        d.weights.sustain = w.sustain;
        d.weights.skillPointTotal = w.skillPointTotal;
        d.weights.reqTotalPenalty = w.reqTotalPenalty;

        Budgets b = c.budgets;
        d.topN = b.topN;
        d.topKPerSlot = b.topKPerSlot;
        d.beamWidth = b.beamWidth;
        d.maxStates = b.maxStates;
        d.useExhaustiveSmallPool = b.useExhaustiveSmallPool;
        d.exhaustiveStateLimit = b.exhaustiveStateLimit;
        d.constraintOnlyMode = c.constraintOnlyMode;
        return d;
    }
}
