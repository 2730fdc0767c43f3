package org.calista.autobuild.solver.events;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a search produced no candidates (or why a pass ended early). Wire names are stable.
 */
public enum ReasonCode {
    /** Some free slot has no legal item under the hard filters. */
    EMPTY_POOL("empty_pool"),
    /** Attack speed whitelist / atkTier range cannot be met. */
    UNSAT_ATTACK_TARGET("unsat_attack_target"),
    /** A numeric threshold or custom range cannot be met. */
    UNSAT_THRESHOLD("unsat_threshold"),
    /** Complete builds exist but none is wearable. */
    SP_INFEASIBLE("sp_infeasible"),
    /** Beam emptied before the last slot, or nothing else explains the failure. */
    SEARCH_PRUNED("search_pruned"),
    FALLBACK_TIMEOUT("fallback_timeout"),
    MUST_INCLUDE_CONFLICT("must_include_conflict");

    private final String wireName;

    ReasonCode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
