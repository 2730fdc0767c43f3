package org.calista.autobuild.solver.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.autobuild.io.FileIO;
import org.calista.autobuild.solver.rescue.SolverStrategy;
import org.calista.autobuild.solver.search.SearchTuning;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SolverConfigTest {

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void missingFileIsCreatedWithDefaults() throws Exception {
        FileIO io = new FileIO(dir);
        Path f = io.resolve("config/autobuild.json");

        SolverConfig cfg = SolverConfig.loadOrCreate(io, f, mapper);

        assertTrue(io.exists(f));
        assertEquals("data", cfg.baseDir);
        assertEquals(50, cfg.search.topN);
        assertEquals(List.of("auto"), cfg.rescue.strategies);
        assertTrue(cfg.rescue.deepFallback);
        assertEquals("diagnostics.jsonl", cfg.events.logFile);
        assertEquals("catalog.json", cfg.catalog.file);

        SolverConfig again = SolverConfig.loadOrCreate(io, f, mapper);
        assertEquals(cfg.search.beamWidth, again.search.beamWidth);
    }

    @Test
    void outOfRangeValuesAreClamped() throws Exception {
        FileIO io = new FileIO(dir);
        Path f = io.resolve("autobuild.json");
        io.writeString(f, "{\"baseDir\":\" \",\"search\":{\"topN\":0,\"beamWidth\":-3,\"exhaustiveStateLimit\":-5},"
                + "\"rescue\":{\"primaryShare\":2.0,\"minBranchCap\":10,\"maxBranchCap\":4,\"strategies\":[]},"
                + "\"events\":{\"logFile\":\"\"},\"somethingElse\":1}");

        SolverConfig cfg = SolverConfig.loadOrCreate(io, f, mapper);

        assertEquals("data", cfg.baseDir);
        assertEquals(1, cfg.search.topN);
        assertEquals(1, cfg.search.beamWidth);
        assertEquals(0, cfg.search.exhaustiveStateLimit);
        assertEquals(0.6, cfg.rescue.primaryShare, 1e-9);
        assertEquals(10, cfg.rescue.maxBranchCap);
        assertEquals(List.of("auto"), cfg.rescue.strategies);
        assertEquals("diagnostics.jsonl", cfg.events.logFile);

        SearchTuning t = cfg.tuning();
        assertEquals(10, t.minBranchCap);
        assertEquals(10, t.maxBranchCap);
    }

    @Test
    void nonObjectRootIsRejected() throws Exception {
        FileIO io = new FileIO(dir);
        Path f = io.resolve("autobuild.json");
        io.writeString(f, "[1, 2]");

        assertThrows(IllegalStateException.class, () -> SolverConfig.loadOrCreate(io, f, mapper));
    }

    @Test
    void blankFileIsRecreated() throws Exception {
        FileIO io = new FileIO(dir);
        Path f = io.resolve("autobuild.json");
        io.writeString(f, "   ");

        SolverConfig cfg = SolverConfig.loadOrCreate(io, f, mapper);

        assertEquals(400, cfg.search.beamWidth);
        assertFalse(io.readString(f).isBlank());
    }

    @Test
    void unknownStrategiesAreDropped() {
        SolverConfig cfg = new SolverConfig();
        cfg.rescue.strategies = List.of("fast", "warp", " CONSTRAINT ");

        assertEquals(List.of(SolverStrategy.FAST, SolverStrategy.CONSTRAINT), cfg.strategies());
    }

    @Test
    void savedConfigLoadsBack() throws Exception {
        FileIO io = new FileIO(dir);
        Path f = io.resolve("autobuild.json");
        SolverConfig cfg = new SolverConfig();
        cfg.search.topKPerSlot = 33;
        cfg.rescue.deepFallback = false;
        cfg.search.weights.sustain = 1.25;

        SolverConfig.save(io, f, mapper, cfg);
        SolverConfig back = SolverConfig.loadOrCreate(io, f, mapper);

        assertEquals(33, back.search.topKPerSlot);
        assertFalse(back.rescue.deepFallback);
        assertEquals(1.25, back.search.weights.sustain, 1e-9);
        assertEquals(33, back.defaultsDocument().topKPerSlot);
    }
}
