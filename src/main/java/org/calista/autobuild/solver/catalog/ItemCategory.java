package org.calista.autobuild.solver.catalog;

import java.util.Locale;

/**
 * Item category. Each {@link Slot} accepts exactly one category; RING covers both ring slots.
 */
public enum ItemCategory {
    HELMET,
    CHESTPLATE,
    LEGGINGS,
    BOOTS,
    RING,
    BRACELET,
    NECKLACE,
    WEAPON;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves category from raw item type. Weapon types (spear, dagger, wand, bow, relik) map to WEAPON.
     *
     * @return category or null if the type is not equippable
     */
    public static ItemCategory fromType(String type) {
        if (type == null) return null;
        String t = type.trim().toLowerCase(Locale.ROOT);
        if (t.isEmpty()) return null;
        if (CharacterClass.fromWeaponType(t) != null) return WEAPON;
        for (ItemCategory c : values()) {
            if (c.key().equals(t)) return c;
        }
        return null;
    }
}
