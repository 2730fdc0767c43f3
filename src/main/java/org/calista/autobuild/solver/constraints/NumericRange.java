package org.calista.autobuild.solver.constraints;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Advanced numeric id range: the summed value of {@code key} over all equipped items must lie in
 * [min, max]. Either bound may be absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class NumericRange {

    public static final String ATTACK_TIER_KEY = "atkTier";

    public final String key;
    public final Double min;
    public final Double max;

    @JsonCreator
    public NumericRange(@JsonProperty("key") String key,
                        @JsonProperty("min") Double min,
                        @JsonProperty("max") Double max) {
        this.key = key == null ? "" : key.trim();
        if (min != null && !Double.isFinite(min)) throw new IllegalArgumentException("range.min must be finite: " + key);
        if (max != null && !Double.isFinite(max)) throw new IllegalArgumentException("range.max must be finite: " + key);
        this.min = min;
        this.max = max;
    }

    public static NumericRange min(String key, double min) {
        return new NumericRange(key, min, null);
    }

    public static NumericRange max(String key, double max) {
        return new NumericRange(key, null, max);
    }

    public static NumericRange between(String key, double min, double max) {
        return new NumericRange(key, min, max);
    }

    /** Rows with a blank key or no bound at all are ignored everywhere. */
    @JsonIgnore
    public boolean isActive() {
        return !key.isEmpty() && (min != null || max != null);
    }

    @JsonIgnore
    public boolean isAttackTier() {
        return ATTACK_TIER_KEY.equals(key);
    }

    public boolean hasMin() {
        return min != null;
    }

    public boolean hasMax() {
        return max != null;
    }

    /** Distance of {@code total} outside [min, max]; 0 inside. */
    public double deficit(double total) {
        double d = 0.0;
        if (min != null && total < min) d += min - total;
        if (max != null && total > max) d += total - max;
        return d;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NumericRange)) return false;
        NumericRange r = (NumericRange) o;
        return key.equals(r.key) && Objects.equals(min, r.min) && Objects.equals(max, r.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, min, max);
    }

    @Override
    public String toString() {
        return key + "[" + (min == null ? "-inf" : min) + ", " + (max == null ? "+inf" : max) + "]";
    }
}
