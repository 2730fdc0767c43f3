package org.calista.autobuild.solver.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.autobuild.io.FileIO;
import org.calista.autobuild.solver.constraints.ConstraintsDocument;
import org.calista.autobuild.solver.rescue.SolverStrategy;
import org.calista.autobuild.solver.search.SearchTuning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * SolverConfig — простой POJO конфиг:
 * - дефолты в полях
 * - loadOrCreate() создаёт файл, если его нет
 * - validate() нормализует значения (clamp, не падает)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SolverConfig {

    private static final Logger log = LoggerFactory.getLogger(SolverConfig.class);

    public String baseDir = "data";
    public Search search = new Search();
    public Rescue rescue = new Rescue();
    public Events events = new Events();
    public Catalog catalog = new Catalog();

    // -------------------- Sections --------------------

    /** Default budgets and weights; a request may still override them. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Search {
        public int topN = 50;
        public int topKPerSlot = 80;
        public int beamWidth = 400;
        public long maxStates = 150_000L;
        public boolean useExhaustiveSmallPool = true;
        public long exhaustiveStateLimit = 250_000L;
        public ConstraintsDocument.WeightsSection weights = new ConstraintsDocument.WeightsSection();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Rescue {
        public List<String> strategies = new ArrayList<>(List.of("auto"));
        public boolean deepFallback = true;
        public long fallbackTimeCapMs = 2000L;

        // lane merge / branch cap heuristics
        public double primaryShare = 0.6;
        public int minBranchCap = 8;
        public int maxBranchCap = 96;
        public int standardBeamFloor = 20;
        public int feasibilityBeamFloor = 40;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Events {
        public String logFile = "diagnostics.jsonl";
        public boolean enabled = true;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Catalog {
        public String file = "catalog.json";
    }

    // -------------------- Load / Create --------------------

    /**
     * Загружает конфиг. Если файла нет (или он пустой) — создаёт дефолтный и пишет на диск.
     *
     * @throws IllegalStateException when the root is not a JSON object
     */
    public static SolverConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            SolverConfig created = new SolverConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            SolverConfig created = new SolverConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        JsonNode root = mapper.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Config root must be a JSON object: " + configFile);
        }
        SolverConfig cfg = mapper.treeToValue(root, SolverConfig.class);
        if (cfg == null) cfg = new SolverConfig();

        cfg.validate();
        log.debug("Config loaded from {}: strategies={}, deepFallback={}", configFile, cfg.rescue.strategies, cfg.rescue.deepFallback);
        return cfg;
    }

    /**
     * Перезаписывает конфиг на диск (pretty JSON).
     */
    public static void save(FileIO io, Path configFile, ObjectMapper mapper, SolverConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, SolverConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Derived --------------------

    /** Parsed strategies; unknown names are dropped with a warning, an empty result means AUTO. */
    public List<SolverStrategy> strategies() {
        List<SolverStrategy> out = new ArrayList<>();
        for (String raw : rescue.strategies) {
            SolverStrategy s = SolverStrategy.parseOrNull(raw);
            if (s == null) {
                log.warn("Unknown solver strategy '{}' ignored", raw);
                continue;
            }
            out.add(s);
        }
        return out;
    }

    public SearchTuning tuning() {
        return SearchTuning.builder()
                .primaryShare(rescue.primaryShare)
                .branchCapBounds(rescue.minBranchCap, rescue.maxBranchCap)
                .standardBeamFloor(rescue.standardBeamFloor)
                .feasibilityBeamFloor(rescue.feasibilityBeamFloor)
                .fallbackTimeCapMs(rescue.fallbackTimeCapMs)
                .build();
    }

    /** Copies the default budgets and weights into a fresh request document. */
    public ConstraintsDocument defaultsDocument() {
        ConstraintsDocument d = new ConstraintsDocument();
        d.topN = search.topN;
        d.topKPerSlot = search.topKPerSlot;
        d.beamWidth = search.beamWidth;
        d.maxStates = search.maxStates;
        d.useExhaustiveSmallPool = search.useExhaustiveSmallPool;
        d.exhaustiveStateLimit = search.exhaustiveStateLimit;
        d.weights = search.weights;
        return d;
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (search == null) search = new Search();
        if (search.topN < 1) search.topN = 1;
        if (search.topKPerSlot < 1) search.topKPerSlot = 1;
        if (search.beamWidth < 1) search.beamWidth = 1;
        if (search.maxStates < 1) search.maxStates = 1;
        if (search.exhaustiveStateLimit < 0) search.exhaustiveStateLimit = 0;
        if (search.weights == null) search.weights = new ConstraintsDocument.WeightsSection();

        if (rescue == null) rescue = new Rescue();
        if (rescue.strategies == null || rescue.strategies.isEmpty()) rescue.strategies = new ArrayList<>(List.of("auto"));
        if (rescue.fallbackTimeCapMs < 0) rescue.fallbackTimeCapMs = 0;
        if (!Double.isFinite(rescue.primaryShare) || rescue.primaryShare <= 0.0 || rescue.primaryShare > 1.0) {
            rescue.primaryShare = 0.6;
        }
        if (rescue.minBranchCap < 1) rescue.minBranchCap = 1;
        if (rescue.maxBranchCap < rescue.minBranchCap) rescue.maxBranchCap = rescue.minBranchCap;
        if (rescue.standardBeamFloor < 1) rescue.standardBeamFloor = 1;
        if (rescue.feasibilityBeamFloor < 1) rescue.feasibilityBeamFloor = 1;

        if (events == null) events = new Events();
        if (events.logFile == null || events.logFile.isBlank()) events.logFile = "diagnostics.jsonl";

        if (catalog == null) catalog = new Catalog();
        if (catalog.file == null || catalog.file.isBlank()) catalog.file = "catalog.json";
    }
}
