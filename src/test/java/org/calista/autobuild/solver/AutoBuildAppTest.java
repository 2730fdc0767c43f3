package org.calista.autobuild.solver;

import org.calista.autobuild.solver.build.impl.DefaultBuildEvaluator;
import org.calista.autobuild.solver.catalog.CatalogSnapshot;
import org.calista.autobuild.solver.constraints.Constraints;
import org.calista.autobuild.solver.engine.SearchOutcome;
import org.calista.autobuild.solver.engine.impl.BeamSearchEngine;
import org.calista.autobuild.solver.events.ReasonCode;
import org.calista.autobuild.solver.score.impl.WeightedScorer;
import org.calista.autobuild.solver.search.SearchTuning;
import org.calista.autobuild.solver.search.WorkbenchSnapshot;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AutoBuildAppTest {

    @Test
    void reportListsRankedBuilds() {
        CatalogSnapshot catalog = TestCatalogs.small();
        Constraints c = Constraints.defaults().toBuilder()
                .budgets(Constraints.defaults().budgets.toBuilder().topN(2).build())
                .build();
        SearchOutcome outcome = new BeamSearchEngine(catalog, new DefaultBuildEvaluator(catalog), new WeightedScorer(), SearchTuning.DEFAULTS)
                .search(WorkbenchSnapshot.empty(), c, null, null)
                .withAttempt("Fast pass");

        String report = AutoBuildApp.report(outcome, catalog);

        assertTrue(report.contains("#1"));
        assertTrue(report.contains("#2"));
        assertFalse(report.contains("#3"));
        assertTrue(report.contains("attempt=Fast pass"));
    }

    @Test
    void reportExplainsAnEmptyOutcome() {
        SearchOutcome empty = SearchOutcome.empty(ReasonCode.EMPTY_POOL, 0, "No candidate items available for slot boots under current hard filters.");

        String report = AutoBuildApp.report(empty, TestCatalogs.small());

        assertTrue(report.contains("empty_pool"));
        assertTrue(report.contains("slot boots"));
    }
}
