package org.calista.autobuild.solver.constraints;

import java.util.Locale;

/**
 * How a weapon attack speed whitelist combines with an {@code atkTier} range when both are set.
 */
public enum AttackSpeedMode {
    OR,
    AND;

    public static AttackSpeedMode parseOrDefault(String raw, AttackSpeedMode def) {
        if (raw == null || raw.isBlank()) return def;
        String k = raw.trim().toUpperCase(Locale.ROOT);
        for (AttackSpeedMode m : values()) {
            if (m.name().equals(k)) return m;
        }
        return def;
    }
}
