package org.calista.autobuild.solver.events;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProgressPhase {
    BEAM_SEARCH("beam-search"),
    EXACT_SEARCH("exact-search"),
    DIAGNOSTICS("diagnostics");

    private final String wireName;

    ProgressPhase(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
