package org.calista.autobuild.solver.rescue;

import java.util.Locale;

/**
 * Which attempts the ladder is built from.
 */
public enum SolverStrategy {
    AUTO,
    FAST,
    CONSTRAINT,
    EXHAUSTIVE;

    /** Lenient: case-insensitive, trimmed; unknown or blank gives null. */
    public static SolverStrategy parseOrNull(String raw) {
        if (raw == null) return null;
        String s = raw.trim().toUpperCase(Locale.ROOT);
        if (s.isEmpty()) return null;
        for (SolverStrategy v : values()) {
            if (v.name().equals(s)) return v;
        }
        return null;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
