package org.calista.autobuild.solver.score.impl;

import org.calista.autobuild.solver.build.BuildSummary;
import org.calista.autobuild.solver.build.SlotAssignment;
import org.calista.autobuild.solver.build.TomeMode;
import org.calista.autobuild.solver.build.impl.DefaultBuildEvaluator;
import org.calista.autobuild.solver.catalog.CatalogSnapshot;
import org.calista.autobuild.solver.catalog.Item;
import org.calista.autobuild.solver.catalog.Slot;
import org.calista.autobuild.solver.constraints.Targets;
import org.calista.autobuild.solver.constraints.Weights;
import org.calista.autobuild.solver.score.ScoredBuild;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WeightedScorerTest {

    private static final Weights ZERO = Weights.builder()
            .legacyBaseDps(0).legacyEhp(0).dpsProxy(0).spellProxy(0).meleeProxy(0)
            .ehpProxy(0).speed(0).sustain(0).skillPointTotal(0).reqTotalPenalty(0)
            .build();

    private static BuildSummary helmetOnly() {
        CatalogSnapshot catalog = CatalogSnapshot.builder()
                .item(Item.builder(1).type("helmet").stat("hp", 100).stat("mr", 3)
                        .stat("strReq", 10).stat("str", 5).build())
                .build();
        return new DefaultBuildEvaluator(catalog)
                .evaluate(SlotAssignment.empty().with(Slot.HELMET, 1), 106, null, TomeMode.NO_TOMES);
    }

    @Test
    void evaluatorAggregatesPlacedItems() {
        BuildSummary s = helmetOnly();

        assertEquals(100, s.hpTotal, 1e-9);
        assertEquals(3, s.mr, 1e-9);
        assertEquals(10, s.reqTotal, 1e-9);
        assertEquals(5, s.skillPointTotal, 1e-9);
        assertEquals(100, s.ehpProxy, 1e-9);
        assertEquals(0, s.dpsProxy, 1e-9);
        assertTrue(s.skillPointFeasible);
    }

    @Test
    void sustainTermUsesManaRegen() {
        ScoredBuild scored = new WeightedScorer().score(helmetOnly(), ZERO.toBuilder().sustain(1).build(), null);

        assertEquals(42, scored.score, 1e-9);
        assertEquals(42, scored.breakdown.sustain, 1e-9);
    }

    @Test
    void requirementsArePenalised() {
        ScoredBuild scored = new WeightedScorer().score(helmetOnly(), ZERO.toBuilder().reqTotalPenalty(1).build(), Targets.NONE);

        assertEquals(-10, scored.score, 1e-9);
    }

    @Test
    void missedMinimumCostsAPenalty() {
        Targets t = Targets.builder().minMr(5.0).maxReqTotal(4.0).build();

        ScoredBuild scored = new WeightedScorer().score(helmetOnly(), ZERO, t);

        assertEquals(2 * 45 + 6 * 8, scored.breakdown.thresholdPenalty, 1e-9);
        assertEquals(-(2 * 45 + 6 * 8), scored.score, 1e-9);
    }
}
