package org.calista.autobuild.solver.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.autobuild.io.FileIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticsStoreTest {

    @TempDir
    Path dir;

    @Test
    void listenerAppendsEventsThatReadBack() throws Exception {
        FileIO io = new FileIO(dir);
        DiagnosticsStore store = new DiagnosticsStore(io, new ObjectMapper(), io.resolve("diagnostics.jsonl"));
        ProgressListener listener = store.asListener();

        listener.onProgress(ProgressEvent.diagnostics(12, 3, 9, 4, ReasonCode.EMPTY_POOL, "no boots").tagged("Fast pass"));
        listener.onProgress(ProgressEvent.of(ProgressPhase.BEAM_SEARCH, 40, 20, 9, 5));

        List<ProgressEvent> back = store.readAll();
        assertEquals(2, back.size());

        ProgressEvent first = back.get(0);
        assertEquals(ProgressPhase.DIAGNOSTICS, first.phase);
        assertEquals(ReasonCode.EMPTY_POOL, first.reasonCode);
        assertEquals("no boots", first.detail);
        assertEquals("Fast pass", first.attempt);
        assertEquals(12, first.processedStates);
        assertEquals(4, first.expandedSlots);

        ProgressEvent second = back.get(1);
        assertEquals(ProgressPhase.BEAM_SEARCH, second.phase);
        assertNull(second.reasonCode);
        assertEquals(20, second.beamSize);
    }

    @Test
    void malformedLinesAreSkipped() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = io.resolve("diagnostics.jsonl");
        DiagnosticsStore store = new DiagnosticsStore(io, new ObjectMapper(), file);

        io.appendJsonl(file, "{not json");
        store.append(ProgressEvent.diagnostics(1, 0, 9, 0, ReasonCode.SEARCH_PRUNED, "pruned"));

        List<ProgressEvent> back = store.readAll();
        assertEquals(1, back.size());
        assertEquals(ReasonCode.SEARCH_PRUNED, back.get(0).reasonCode);
    }

    @Test
    void wireNamesAreStable() {
        assertEquals("must_include_conflict", ReasonCode.MUST_INCLUDE_CONFLICT.wireName());
        assertEquals("fallback_timeout", ReasonCode.FALLBACK_TIMEOUT.toString());
        assertEquals("exact-search", ProgressPhase.EXACT_SEARCH.wireName());
    }

    @Test
    void andThenFansOutInOrder() {
        StringBuilder seen = new StringBuilder();
        ProgressListener a = e -> seen.append('a');
        ProgressListener b = e -> seen.append('b');

        a.andThen(b).andThen(null).onProgress(ProgressEvent.of(ProgressPhase.BEAM_SEARCH, 0, 0, 0, 0));

        assertEquals("ab", seen.toString());
    }
}
