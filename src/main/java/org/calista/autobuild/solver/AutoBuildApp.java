package org.calista.autobuild.solver;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.autobuild.solver.catalog.CatalogSnapshot;
import org.calista.autobuild.solver.catalog.Item;
import org.calista.autobuild.solver.catalog.Slot;
import org.calista.autobuild.solver.constraints.Constraints;
import org.calista.autobuild.solver.core.SearchRequest;
import org.calista.autobuild.solver.core.SolverKernel;
import org.calista.autobuild.solver.engine.SearchOutcome;
import org.calista.autobuild.solver.events.ProgressListener;
import org.calista.autobuild.solver.events.ProgressPhase;
import org.calista.autobuild.solver.search.Candidate;
import org.calista.autobuild.solver.search.WorkbenchSnapshot;
import org.calista.autobuild.solver.util.CancellationToken;
import org.calista.autobuild.solver.util.LogFmt;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * AutoBuildApp — console runner.
 *
 * Lifecycle:
 *  1) build kernel (config loadOrCreate, IO, diagnostics store)
 *  2) kernel.loadCatalog()
 *  3) read request (workbench + constraints), run the attempt ladder
 *  4) print ranked candidates; every progress event goes to the JSONL diagnostics log
 *
 * Args: [configFile] [requestFile]; defaults config/autobuild.json and request.json in baseDir.
 */
public final class AutoBuildApp {

    private static final Logger log = LogManager.getLogger(AutoBuildApp.class);

    private final Path cfgPath;
    private final String requestFile;
    private SolverKernel kernel;

    public static void main(String[] args) throws Exception {
        Path cfg = Path.of(args.length > 0 ? args[0] : "config/autobuild.json");
        String request = args.length > 1 ? args[1] : "request.json";
        SearchOutcome outcome = new AutoBuildApp(cfg, request).run();
        if (outcome.isEmpty()) System.exit(2);
    }

    public AutoBuildApp(Path cfgPath, String requestFile) {
        this.cfgPath = cfgPath;
        this.requestFile = requestFile;
    }

    public SearchOutcome run() throws IOException {
        kernel = SolverKernel.builder()
                .configRoot(Path.of("."))
                .build(cfgPath);
        CatalogSnapshot catalog = kernel.loadCatalog();

        SearchRequest req = readRequest();
        WorkbenchSnapshot workbench = req.toWorkbench();
        Constraints constraints = req.constraintsOr(kernel.config()).toConstraints();
        log.info("Request: workbench={}, constraints={}", workbench, constraints);

        ProgressListener listener = e -> {
            if (e.phase == ProgressPhase.DIAGNOSTICS) log.info("[{}] {}", e.attempt, e);
            else log.debug("[{}] {}", e.attempt, e);
        };
        if (kernel.config().events.enabled) listener = listener.andThen(kernel.diagnostics().asListener());

        SearchOutcome outcome = kernel.orchestrator().run(workbench, constraints, listener, CancellationToken.create());
        System.out.println(report(outcome, catalog));
        return outcome;
    }

    private SearchRequest readRequest() throws IOException {
        Path p = kernel.io().resolve(requestFile);
        try {
            return kernel.mapper().readValue(kernel.io().readString(p), SearchRequest.class);
        } catch (NoSuchFileException e) {
            log.warn("Request file {} not found, searching an empty workbench with config defaults", p);
            return new SearchRequest();
        }
    }

    static String report(SearchOutcome outcome, CatalogSnapshot catalog) {
        if (outcome.isEmpty()) {
            return LogFmt.box("No valid builds", b -> b
                    .kv("reason", outcome.reasonCode.wireName())
                    .kv("states", String.valueOf(outcome.processedStates))
                    .sep()
                    .line(outcome.detail));
        }
        StringBuilder out = new StringBuilder();
        int rank = 1;
        for (Candidate c : outcome.candidates) {
            int r = rank++;
            out.append(LogFmt.box("#" + r + "  score " + LogFmt.num(c.score), b -> {
                for (Slot s : Slot.ALL) {
                    Item it = catalog.item(c.slots.get(s));
                    b.kv(s.key(), it == null ? "-" : it.name);
                }
                b.sep()
                        .kv("dpsProxy", c.summary.dpsProxy)
                        .kv("ehpProxy", c.summary.ehpProxy)
                        .kv("reqTotal", c.summary.reqTotal)
                        .kv("skillPoints", c.summary.skillPointTotal);
            })).append('\n');
        }
        out.append("attempt=").append(outcome.attempt).append(", states=").append(outcome.processedStates);
        return out.toString();
    }

    public SolverKernel getKernel() { return kernel; }
}
