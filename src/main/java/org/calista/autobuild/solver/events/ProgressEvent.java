package org.calista.autobuild.solver.events;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.calista.autobuild.solver.search.Candidate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One progress / diagnostics record.
 *
 * <p>Plain POJO so it serializes straight into the JSONL diagnostics log. Live preview candidates
 * are kept in memory only; the log stores their score and canonical key.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ProgressEvent {
    public ProgressPhase phase;
    public long processedStates;
    public int beamSize;
    public int totalSlots;
    public int expandedSlots;
    public String detail;
    public ReasonCode reasonCode;
    /** Label of the rescue tier that emitted the event, when run through the ladder. */
    public String attempt;
    public long tsEpochMs;

    @JsonIgnore
    public List<Candidate> previewCandidates = List.of();

    public static ProgressEvent of(ProgressPhase phase, long processedStates, int beamSize, int totalSlots, int expandedSlots) {
        ProgressEvent e = new ProgressEvent();
        e.phase = phase;
        e.processedStates = processedStates;
        e.beamSize = beamSize;
        e.totalSlots = totalSlots;
        e.expandedSlots = expandedSlots;
        e.tsEpochMs = System.currentTimeMillis();
        return e;
    }

    public static ProgressEvent diagnostics(long processedStates, int beamSize, int totalSlots, int expandedSlots,
                                            ReasonCode reasonCode, String detail) {
        ProgressEvent e = of(ProgressPhase.DIAGNOSTICS, processedStates, beamSize, totalSlots, expandedSlots);
        e.reasonCode = reasonCode;
        e.detail = detail;
        return e;
    }

    public ProgressEvent detail(String d) {
        this.detail = d;
        return this;
    }

    public ProgressEvent preview(List<Candidate> candidates) {
        this.previewCandidates = candidates == null ? List.of() : List.copyOf(candidates);
        return this;
    }

    /** Copy tagged with the ladder tier label. */
    public ProgressEvent tagged(String attemptLabel) {
        ProgressEvent e = of(phase, processedStates, beamSize, totalSlots, expandedSlots);
        e.detail = detail;
        e.reasonCode = reasonCode;
        e.attempt = attemptLabel;
        e.tsEpochMs = tsEpochMs;
        e.previewCandidates = previewCandidates;
        return e;
    }

    @JsonProperty(value = "preview", access = JsonProperty.Access.READ_ONLY)
    public List<String> previewSummary() {
        if (previewCandidates == null || previewCandidates.isEmpty()) return null;
        List<String> out = new ArrayList<>(previewCandidates.size());
        for (Candidate c : previewCandidates) {
            out.add(String.format(Locale.ROOT, "%.2f@%s", c.score, c.slots.canonicalKey()));
        }
        return out;
    }

    @Override
    public String toString() {
        return phase.wireName() + " " + expandedSlots + "/" + totalSlots
                + " beam=" + beamSize + " states=" + processedStates
                + (reasonCode == null ? "" : " reason=" + reasonCode)
                + (detail == null ? "" : " | " + detail);
    }
}
