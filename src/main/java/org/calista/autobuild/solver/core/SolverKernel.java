package org.calista.autobuild.solver.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.autobuild.io.FileIO;
import org.calista.autobuild.solver.bootstrap.CatalogLoader;
import org.calista.autobuild.solver.build.BuildEvaluator;
import org.calista.autobuild.solver.build.impl.DefaultBuildEvaluator;
import org.calista.autobuild.solver.catalog.CatalogSnapshot;
import org.calista.autobuild.solver.engine.LoadoutSearchEngine;
import org.calista.autobuild.solver.engine.impl.BeamSearchEngine;
import org.calista.autobuild.solver.events.DiagnosticsStore;
import org.calista.autobuild.solver.rescue.RescueOrchestrator;
import org.calista.autobuild.solver.score.Scorer;
import org.calista.autobuild.solver.score.impl.WeightedScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;

/**
 * SolverKernel — instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(configFile) -> loadOrCreate config + IO + diagnostics store (catalog NOT loaded)
 *   2) loadCatalog()     -> explicit, or an injected snapshot
 *   3) orchestrator()    -> engine + attempt ladder wired from config
 *
 * No static singletons.
 */
public final class SolverKernel {

    private static final Logger log = LoggerFactory.getLogger(SolverKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final SolverConfig cfg;
    private final DiagnosticsStore diagnostics;

    private volatile CatalogSnapshot catalog;

    private SolverKernel(FileIO io, ObjectMapper mapper, SolverConfig cfg, DiagnosticsStore diagnostics, CatalogSnapshot catalog) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.catalog = catalog; // nullable until loadCatalog()
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /** Config is read BEFORE baseDir is known (baseDir is inside config). */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        private CatalogSnapshot catalog;

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        /** Pre-built catalog; loadCatalog() then becomes a no-op. */
        public Builder catalog(CatalogSnapshot catalog) {
            this.catalog = Objects.requireNonNull(catalog, "catalog");
            return this;
        }

        public SolverKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();
            FileIO.Options opts = FileIO.Options.builder().charset(charset).build();

            FileIO external = new FileIO(configRoot, opts);
            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);
            SolverConfig cfg = SolverConfig.loadOrCreate(external, cfgPath, om);

            Path base = Path.of(cfg.baseDir);
            FileIO io = new FileIO(base.isAbsolute() ? base : configRoot.resolve(base), opts);
            DiagnosticsStore diagnostics = new DiagnosticsStore(io, om, io.resolve(cfg.events.logFile));

            SolverKernel k = new SolverKernel(io, om, cfg, diagnostics, catalog);
            log.info("SolverKernel created: config={}, baseDir={}, catalogPreloaded={}",
                    cfgPath, io.baseDir(), catalog != null);
            return k;
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Catalog (explicit)
    // ---------------------------------------------------------------------

    /**
     * Loads the catalog named in config from baseDir. Repeated calls return the same snapshot.
     */
    public synchronized CatalogSnapshot loadCatalog() throws IOException {
        if (catalog != null) return catalog;
        catalog = new CatalogLoader(io, mapper).load(io.resolve(cfg.catalog.file));
        return catalog;
    }

    public CatalogSnapshot catalog() {
        CatalogSnapshot c = catalog;
        if (c == null) throw new IllegalStateException("catalog not loaded: call loadCatalog() first");
        return c;
    }

    // ---------------------------------------------------------------------
    // Wiring
    // ---------------------------------------------------------------------

    public LoadoutSearchEngine engine() {
        CatalogSnapshot c = catalog();
        BuildEvaluator evaluator = new DefaultBuildEvaluator(c);
        Scorer scorer = new WeightedScorer();
        return new BeamSearchEngine(c, evaluator, scorer, cfg.tuning());
    }

    public RescueOrchestrator orchestrator() {
        RescueOrchestrator o = new RescueOrchestrator(engine(), cfg.strategies(), cfg.rescue.deepFallback);
        log.debug("Attempt ladder: {}", o.ladder());
        return o;
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public SolverConfig config() { return cfg; }
    public DiagnosticsStore diagnostics() { return diagnostics; }
}
