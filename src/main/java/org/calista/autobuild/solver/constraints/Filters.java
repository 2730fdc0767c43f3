package org.calista.autobuild.solver.constraints;

import org.calista.autobuild.solver.build.TomeMode;
import org.calista.autobuild.solver.catalog.AttackSpeed;
import org.calista.autobuild.solver.catalog.CharacterClass;
import org.calista.autobuild.solver.catalog.Item;
import org.calista.autobuild.solver.catalog.Slot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Filters — жёсткие фильтры предметов и параметры персонажа.
 *
 * <p>{@link #admits(Item)} — глобальная легальность предмета; её проверяют и пул кандидатов,
 * и финализатор (включая залоченные / must-include предметы).</p>
 */
public final class Filters {

    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 106;

    public static final Filters DEFAULTS = builder().build();

    public final CharacterClass characterClass;
    public final int level;
    /** Distinct, in declaration order. */
    public final List<Integer> mustIncludeIds;
    public final Set<Integer> excludedIds;
    public final Set<String> allowedTiers;
    public final List<String> requiredMajorIds;
    public final Set<String> excludedMajorIds;
    public final Set<AttackSpeed> weaponAttackSpeeds;
    public final AttackSpeedMode attackSpeedMode;
    public final TomeMode tomeMode;
    public final Integer minPowderSlots;
    public final boolean onlyPinnedItems;
    public final boolean allowRestricted;
    public final Set<Slot> lockedSlots;

    private Filters(Builder b) {
        if (b.level < MIN_LEVEL || b.level > MAX_LEVEL) {
            throw new IllegalArgumentException("filters.level must be in [" + MIN_LEVEL + ", " + MAX_LEVEL + "]: " + b.level);
        }
        this.characterClass = b.characterClass;
        this.level = b.level;
        this.mustIncludeIds = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(b.mustIncludeIds)));
        this.excludedIds = Collections.unmodifiableSet(new LinkedHashSet<>(b.excludedIds));
        this.allowedTiers = Collections.unmodifiableSet(new LinkedHashSet<>(b.allowedTiers));
        this.requiredMajorIds = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(b.requiredMajorIds)));
        this.excludedMajorIds = Collections.unmodifiableSet(new LinkedHashSet<>(b.excludedMajorIds));
        this.weaponAttackSpeeds = b.weaponAttackSpeeds.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(b.weaponAttackSpeeds));
        this.attackSpeedMode = Objects.requireNonNull(b.attackSpeedMode, "attackSpeedMode");
        this.tomeMode = Objects.requireNonNull(b.tomeMode, "tomeMode");
        this.minPowderSlots = b.minPowderSlots;
        this.onlyPinnedItems = b.onlyPinnedItems;
        this.allowRestricted = b.allowRestricted;
        this.lockedSlots = b.lockedSlots.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(b.lockedSlots));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.characterClass = characterClass;
        b.level = level;
        b.mustIncludeIds.addAll(mustIncludeIds);
        b.excludedIds.addAll(excludedIds);
        b.allowedTiers.addAll(allowedTiers);
        b.requiredMajorIds.addAll(requiredMajorIds);
        b.excludedMajorIds.addAll(excludedMajorIds);
        b.weaponAttackSpeeds.addAll(weaponAttackSpeeds);
        b.attackSpeedMode = attackSpeedMode;
        b.tomeMode = tomeMode;
        b.minPowderSlots = minPowderSlots;
        b.onlyPinnedItems = onlyPinnedItems;
        b.allowRestricted = allowRestricted;
        b.lockedSlots.addAll(lockedSlots);
        return b;
    }

    public boolean hasAttackSpeeds() {
        return !weaponAttackSpeeds.isEmpty();
    }

    public boolean isLocked(Slot slot) {
        return lockedSlots.contains(slot);
    }

    /**
     * Global item legality: restricted/deprecated, level, class, exclusions, tiers, powder slots,
     * excluded major ids.
     */
    public boolean admits(Item item) {
        if (item == null) return false;
        if (!allowRestricted && (item.restricted || item.deprecated)) return false;
        if (item.level > level) return false;
        if (!item.canBeWornBy(characterClass)) return false;
        if (excludedIds.contains(item.id)) return false;
        if (!allowedTiers.isEmpty() && !allowedTiers.contains(item.tier)) return false;
        if (minPowderSlots != null && item.powderSlots < minPowderSlots) return false;
        if (!excludedMajorIds.isEmpty()) {
            for (String m : item.majorIds) {
                if (excludedMajorIds.contains(m)) return false;
            }
        }
        return true;
    }

    public static final class Builder {
        private CharacterClass characterClass;
        private int level = MAX_LEVEL;
        private final List<Integer> mustIncludeIds = new ArrayList<>();
        private final Set<Integer> excludedIds = new LinkedHashSet<>();
        private final Set<String> allowedTiers = new LinkedHashSet<>();
        private final List<String> requiredMajorIds = new ArrayList<>();
        private final Set<String> excludedMajorIds = new LinkedHashSet<>();
        private final Set<AttackSpeed> weaponAttackSpeeds = EnumSet.noneOf(AttackSpeed.class);
        private AttackSpeedMode attackSpeedMode = AttackSpeedMode.OR;
        private TomeMode tomeMode = TomeMode.NO_TOMES;
        private Integer minPowderSlots;
        private boolean onlyPinnedItems;
        private boolean allowRestricted = true;
        private final Set<Slot> lockedSlots = EnumSet.noneOf(Slot.class);

        private Builder() {}

        public Builder characterClass(CharacterClass v) { this.characterClass = v; return this; }
        public Builder level(int v) { this.level = v; return this; }

        public Builder mustInclude(int id) { mustIncludeIds.add(id); return this; }
        public Builder mustIncludeIds(Collection<Integer> ids) { replace(mustIncludeIds, ids); return this; }

        public Builder exclude(int id) { excludedIds.add(id); return this; }
        public Builder excludedIds(Collection<Integer> ids) { replace(excludedIds, ids); return this; }

        public Builder allowedTiers(Collection<String> tiers) { replace(allowedTiers, tiers); return this; }

        public Builder requireMajorId(String id) { requiredMajorIds.add(Objects.requireNonNull(id, "majorId")); return this; }
        public Builder requiredMajorIds(Collection<String> ids) { replace(requiredMajorIds, ids); return this; }
        public Builder excludedMajorIds(Collection<String> ids) { replace(excludedMajorIds, ids); return this; }

        public Builder weaponAttackSpeed(AttackSpeed s) { weaponAttackSpeeds.add(Objects.requireNonNull(s, "attackSpeed")); return this; }
        public Builder weaponAttackSpeeds(Collection<AttackSpeed> s) { replace(weaponAttackSpeeds, s); return this; }

        public Builder attackSpeedMode(AttackSpeedMode v) { this.attackSpeedMode = v; return this; }
        public Builder tomeMode(TomeMode v) { this.tomeMode = v; return this; }
        public Builder minPowderSlots(Integer v) { this.minPowderSlots = v; return this; }
        public Builder onlyPinnedItems(boolean v) { this.onlyPinnedItems = v; return this; }
        public Builder allowRestricted(boolean v) { this.allowRestricted = v; return this; }

        public Builder lock(Slot slot) { lockedSlots.add(Objects.requireNonNull(slot, "slot")); return this; }
        public Builder lockedSlots(Collection<Slot> slots) { replace(lockedSlots, slots); return this; }

        public Filters build() {
            return new Filters(this);
        }

        private static <T> void replace(Collection<T> target, Collection<T> values) {
            target.clear();
            if (values == null) return;
            for (T v : values) {
                if (v != null) target.add(v);
            }
        }
    }
}
