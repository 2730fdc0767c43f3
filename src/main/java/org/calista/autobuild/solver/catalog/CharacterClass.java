package org.calista.autobuild.solver.catalog;

import java.util.Locale;

public enum CharacterClass {
    WARRIOR("spear"),
    ASSASSIN("dagger"),
    MAGE("wand"),
    ARCHER("bow"),
    SHAMAN("relik");

    private final String weaponType;

    CharacterClass(String weaponType) {
        this.weaponType = weaponType;
    }

    public String weaponType() {
        return weaponType;
    }

    public static CharacterClass fromWeaponType(String type) {
        if (type == null) return null;
        String t = type.trim().toLowerCase(Locale.ROOT);
        for (CharacterClass c : values()) {
            if (c.weaponType.equals(t)) return c;
        }
        return null;
    }

    /**
     * Lenient parse: "mage", "Mage", "MAGE" are all accepted. Blank or unknown values return null.
     */
    public static CharacterClass parseOrNull(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String k = raw.trim().toUpperCase(Locale.ROOT);
        for (CharacterClass c : values()) {
            if (c.name().equals(k)) return c;
        }
        return null;
    }
}
