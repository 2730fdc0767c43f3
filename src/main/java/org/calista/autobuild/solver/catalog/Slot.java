package org.calista.autobuild.solver.catalog;

import java.util.List;
import java.util.Locale;

/**
 * Gear slot. Declaration order is the canonical slot order used by keys and tie-breaks.
 */
public enum Slot {
    HELMET(ItemCategory.HELMET),
    CHESTPLATE(ItemCategory.CHESTPLATE),
    LEGGINGS(ItemCategory.LEGGINGS),
    BOOTS(ItemCategory.BOOTS),
    RING1(ItemCategory.RING),
    RING2(ItemCategory.RING),
    BRACELET(ItemCategory.BRACELET),
    NECKLACE(ItemCategory.NECKLACE),
    WEAPON(ItemCategory.WEAPON);

    public static final List<Slot> ALL = List.of(values());
    public static final int COUNT = ALL.size();

    private final ItemCategory category;

    Slot(ItemCategory category) {
        this.category = category;
    }

    public ItemCategory category() {
        return category;
    }

    public boolean accepts(Item item) {
        return item != null && item.category == category;
    }

    /** Accessory slots: filled first when custom minimums are configured. */
    public boolean isSupportSlot() {
        return this == RING1 || this == RING2 || this == BRACELET || this == NECKLACE;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Slot parse(String raw) {
        if (raw == null) throw new IllegalArgumentException("slot is null");
        String k = raw.trim().toUpperCase(Locale.ROOT);
        try {
            return Slot.valueOf(k);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown slot: " + raw, e);
        }
    }
}
