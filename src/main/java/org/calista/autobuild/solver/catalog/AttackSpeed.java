package org.calista.autobuild.solver.catalog;

import java.util.Locale;

/**
 * Weapon attack speed tiers, slowest first. Final speed = base index + total atkTier, clamped.
 */
public enum AttackSpeed {
    SUPER_SLOW,
    VERY_SLOW,
    SLOW,
    NORMAL,
    FAST,
    VERY_FAST,
    SUPER_FAST;

    public static final int MAX_INDEX = values().length - 1;

    public int index() {
        return ordinal();
    }

    public static int clampIndex(int index) {
        return Math.max(0, Math.min(MAX_INDEX, index));
    }

    public static AttackSpeed fromIndexClamped(int index) {
        return values()[clampIndex(index)];
    }

    /** Returns null for blank or unknown values. */
    public static AttackSpeed parseOrNull(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String k = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (AttackSpeed s : values()) {
            if (s.name().equals(k)) return s;
        }
        return null;
    }
}
