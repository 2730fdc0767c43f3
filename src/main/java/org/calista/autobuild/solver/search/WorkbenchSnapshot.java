package org.calista.autobuild.solver.search;

import org.calista.autobuild.solver.build.SlotAssignment;
import org.calista.autobuild.solver.catalog.CharacterClass;
import org.calista.autobuild.solver.catalog.ItemCategory;
import org.calista.autobuild.solver.catalog.Slot;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * WorkbenchSnapshot — текущее состояние верстака, от которого стартует поиск.
 *
 * <p>Base slots, per-slot locks, character class / level of the workbench and per-category
 * "bins" of pinned item ids. Bins feed the pinned allowlist when the constraints ask for
 * pinned items only.</p>
 */
public final class WorkbenchSnapshot {

    public final SlotAssignment slots;
    public final Set<Slot> lockedSlots;
    public final CharacterClass characterClass;
    public final Integer level;
    public final Map<ItemCategory, List<Integer>> binsByCategory;

    private WorkbenchSnapshot(Builder b) {
        this.slots = Objects.requireNonNull(b.slots, "slots");
        this.lockedSlots = b.lockedSlots.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(b.lockedSlots));
        this.characterClass = b.characterClass;
        this.level = b.level;
        EnumMap<ItemCategory, List<Integer>> bins = new EnumMap<>(ItemCategory.class);
        for (Map.Entry<ItemCategory, Set<Integer>> e : b.bins.entrySet()) {
            bins.put(e.getKey(), List.copyOf(e.getValue()));
        }
        this.binsByCategory = Collections.unmodifiableMap(bins);
    }

    public static WorkbenchSnapshot empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isLocked(Slot slot) {
        return lockedSlots.contains(slot);
    }

    public List<Integer> bin(ItemCategory category) {
        return binsByCategory.getOrDefault(category, List.of());
    }

    /**
     * Items a slot may draw from in pinned-only mode: the category bin plus whatever this
     * workbench currently has equipped in the slot.
     */
    public Set<Integer> pinnedAllowlist(Slot slot) {
        Set<Integer> ids = new LinkedHashSet<>(bin(slot.category()));
        Integer equipped = slots.get(slot);
        if (equipped != null) ids.add(equipped);
        return ids;
    }

    @Override
    public String toString() {
        return "WorkbenchSnapshot{slots=" + slots + ", locked=" + lockedSlots + ", class=" + characterClass
                + ", level=" + level + ", bins=" + binsByCategory.keySet() + '}';
    }

    public static final class Builder {
        private SlotAssignment slots = SlotAssignment.empty();
        private final Set<Slot> lockedSlots = EnumSet.noneOf(Slot.class);
        private CharacterClass characterClass;
        private Integer level;
        private final EnumMap<ItemCategory, Set<Integer>> bins = new EnumMap<>(ItemCategory.class);

        private Builder() {}

        public Builder slots(SlotAssignment v) { this.slots = v; return this; }

        public Builder equip(Slot slot, int itemId) {
            this.slots = slots.with(Objects.requireNonNull(slot, "slot"), itemId);
            return this;
        }

        public Builder lock(Slot slot) {
            lockedSlots.add(Objects.requireNonNull(slot, "slot"));
            return this;
        }

        /** Equips and locks in one call. */
        public Builder equipLocked(Slot slot, int itemId) {
            return equip(slot, itemId).lock(slot);
        }

        public Builder characterClass(CharacterClass v) { this.characterClass = v; return this; }
        public Builder level(Integer v) { this.level = v; return this; }

        public Builder pin(ItemCategory category, int itemId) {
            bins.computeIfAbsent(Objects.requireNonNull(category, "category"), k -> new LinkedHashSet<>()).add(itemId);
            return this;
        }

        public Builder bin(ItemCategory category, Collection<Integer> ids) {
            Set<Integer> set = new LinkedHashSet<>();
            if (ids != null) {
                for (Integer id : ids) {
                    if (id != null) set.add(id);
                }
            }
            bins.put(Objects.requireNonNull(category, "category"), set);
            return this;
        }

        public WorkbenchSnapshot build() {
            return new WorkbenchSnapshot(this);
        }
    }
}
