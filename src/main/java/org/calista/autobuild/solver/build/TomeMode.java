package org.calista.autobuild.solver.build;

import java.util.Locale;

/**
 * Skill point tome assumption used by wearability checks.
 *
 * <p>GUILD_RAINBOW grants one base point in every stat (counts toward requirements, not toward the
 * assignable pool). FLEXIBLE_2 grants two extra assignable points.</p>
 */
public enum TomeMode {
    NO_TOMES(0, 0),
    GUILD_RAINBOW(1, 0),
    FLEXIBLE_2(0, 2);

    private final int basePerStat;
    private final int extraAvailable;

    TomeMode(int basePerStat, int extraAvailable) {
        this.basePerStat = basePerStat;
        this.extraAvailable = extraAvailable;
    }

    public int basePerStat() {
        return basePerStat;
    }

    public int extraAvailable() {
        return extraAvailable;
    }

    public static TomeMode parseOrDefault(String raw, TomeMode def) {
        if (raw == null || raw.isBlank()) return def;
        String k = raw.trim().toUpperCase(Locale.ROOT);
        for (TomeMode m : values()) {
            if (m.name().equals(k)) return m;
        }
        return def;
    }
}
