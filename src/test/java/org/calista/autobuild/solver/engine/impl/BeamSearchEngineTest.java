package org.calista.autobuild.solver.engine.impl;

import org.calista.autobuild.solver.TestCatalogs;
import org.calista.autobuild.solver.build.SlotAssignment;
import org.calista.autobuild.solver.build.impl.DefaultBuildEvaluator;
import org.calista.autobuild.solver.catalog.CatalogSnapshot;
import org.calista.autobuild.solver.catalog.Item;
import org.calista.autobuild.solver.catalog.ItemCategory;
import org.calista.autobuild.solver.catalog.Slot;
import org.calista.autobuild.solver.constraints.Budgets;
import org.calista.autobuild.solver.constraints.Constraints;
import org.calista.autobuild.solver.constraints.Filters;
import org.calista.autobuild.solver.constraints.NumericRange;
import org.calista.autobuild.solver.constraints.Targets;
import org.calista.autobuild.solver.constraints.Weights;
import org.calista.autobuild.solver.engine.SearchOutcome;
import org.calista.autobuild.solver.events.ProgressEvent;
import org.calista.autobuild.solver.events.ProgressPhase;
import org.calista.autobuild.solver.events.ReasonCode;
import org.calista.autobuild.solver.score.impl.WeightedScorer;
import org.calista.autobuild.solver.search.Candidate;
import org.calista.autobuild.solver.search.Finalizer;
import org.calista.autobuild.solver.search.SearchTuning;
import org.calista.autobuild.solver.search.WorkbenchSnapshot;
import org.calista.autobuild.solver.util.CancellationToken;
import org.calista.autobuild.solver.util.SearchCancelledException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BeamSearchEngineTest {

    private static BeamSearchEngine engine(CatalogSnapshot catalog) {
        return new BeamSearchEngine(catalog, new DefaultBuildEvaluator(catalog), new WeightedScorer(), SearchTuning.DEFAULTS);
    }

    private static Constraints exact(int topN) {
        return Constraints.builder()
                .budgets(Budgets.builder().topN(topN).build())
                .build();
    }

    private static Constraints beamOnly(int topN, int beamWidth) {
        return Constraints.builder()
                .budgets(Budgets.builder()
                        .topN(topN)
                        .beamWidth(beamWidth)
                        .maxStates(5_000)
                        .useExhaustiveSmallPool(false)
                        .build())
                .build();
    }

    /** Every full combination of the catalog through the same finalizer, keyed by canonical key. */
    private static Map<String, Double> bruteForce(CatalogSnapshot catalog, Constraints constraints) {
        List<SlotAssignment> all = new ArrayList<>();
        expand(catalog, SlotAssignment.empty(), 0, all);
        Finalizer finalizer = new Finalizer(catalog, new DefaultBuildEvaluator(catalog), new WeightedScorer());
        Finalizer.Result r = finalizer.finalizeAll(all, constraints, CancellationToken.none());
        Map<String, Double> out = new HashMap<>();
        for (Candidate c : r.candidates) out.put(c.canonicalKey(), c.score);
        return out;
    }

    private static void expand(CatalogSnapshot catalog, SlotAssignment current, int index, List<SlotAssignment> out) {
        if (index == Slot.COUNT) {
            out.add(current);
            return;
        }
        Slot slot = Slot.ALL.get(index);
        for (Item item : catalog.itemsOf(slot.category())) {
            expand(catalog, current.with(slot, item.id), index + 1, out);
        }
    }

    private static Map<String, Double> byKey(List<Candidate> candidates) {
        Map<String, Double> out = new HashMap<>();
        for (Candidate c : candidates) {
            assertNull(out.put(c.canonicalKey(), c.score), "duplicate canonical key " + c.canonicalKey());
        }
        return out;
    }

    private static void assertRanked(List<Candidate> candidates) {
        for (int i = 1; i < candidates.size(); i++) {
            assertTrue(Candidate.RANKING.compare(candidates.get(i - 1), candidates.get(i)) <= 0,
                    "candidates out of order at " + i);
        }
    }

    @Test
    void exactEnumerationMatchesBruteForce() {
        CatalogSnapshot catalog = TestCatalogs.small();
        Constraints c = exact(500);

        SearchOutcome outcome = engine(catalog).search(WorkbenchSnapshot.empty(), c, null, null);

        assertFalse(outcome.isEmpty());
        assertEquals("exact", outcome.detail);
        Map<String, Double> expected = bruteForce(catalog, c);
        assertEquals(96, expected.size());
        assertEquals(expected, byKey(outcome.candidates));
        assertRanked(outcome.candidates);
    }

    @Test
    void topNCapsTheResult() {
        CatalogSnapshot catalog = TestCatalogs.small();

        SearchOutcome outcome = engine(catalog).search(WorkbenchSnapshot.empty(), exact(5), null, null);

        assertEquals(5, outcome.candidates.size());
        double bestExpected = bruteForce(catalog, exact(5)).values().stream().mapToDouble(Double::doubleValue).max().orElseThrow();
        assertEquals(bestExpected, outcome.best().score, 1e-9);
    }

    @Test
    void beamCandidatesAreValidRankedAndDeterministic() {
        CatalogSnapshot catalog = TestCatalogs.small();
        Constraints c = beamOnly(50, 4);
        BeamSearchEngine engine = engine(catalog);

        SearchOutcome first = engine.search(WorkbenchSnapshot.empty(), c, null, null);
        SearchOutcome second = engine.search(WorkbenchSnapshot.empty(), c, null, null);

        assertFalse(first.isEmpty());
        assertRanked(first.candidates);
        Map<String, Double> valid = bruteForce(catalog, c);
        for (Candidate cand : first.candidates) {
            assertTrue(valid.containsKey(cand.canonicalKey()), "not a valid build: " + cand);
            assertEquals(valid.get(cand.canonicalKey()), cand.score, 1e-9);
            assertEquals(Slot.COUNT, cand.slots.filledCount());
        }

        assertEquals(first.candidates.size(), second.candidates.size());
        for (int i = 0; i < first.candidates.size(); i++) {
            assertEquals(first.candidates.get(i).slots, second.candidates.get(i).slots);
            assertEquals(first.candidates.get(i).score, second.candidates.get(i).score);
        }
    }

    @Test
    void lockedSlotIsKeptInEveryCandidate() {
        CatalogSnapshot catalog = TestCatalogs.small();
        WorkbenchSnapshot wb = WorkbenchSnapshot.builder()
                .equipLocked(Slot.HELMET, TestCatalogs.HELMET_B)
                .equip(Slot.BOOTS, TestCatalogs.BOOTS_B)
                .build();

        SearchOutcome outcome = engine(catalog).search(wb, exact(500), null, null);

        assertFalse(outcome.isEmpty());
        assertEquals(48, outcome.candidates.size());
        for (Candidate cand : outcome.candidates) {
            assertEquals(TestCatalogs.HELMET_B, cand.slots.get(Slot.HELMET));
        }
    }

    @Test
    void mustIncludeItemIsPlaced() {
        CatalogSnapshot catalog = TestCatalogs.small();
        Constraints c = exact(500).toBuilder()
                .filters(Filters.builder().mustInclude(TestCatalogs.RING_C).build())
                .build();

        SearchOutcome outcome = engine(catalog).search(WorkbenchSnapshot.empty(), c, null, null);

        assertFalse(outcome.isEmpty());
        for (Candidate cand : outcome.candidates) {
            assertEquals(TestCatalogs.RING_C, cand.slots.get(Slot.RING1));
        }
    }

    @Test
    void illegalSetComboNeverAppears() {
        CatalogSnapshot catalog = TestCatalogs.smallBuilder()
                .set("Twins", List.of(TestCatalogs.HELMET_A, TestCatalogs.CHEST_A), List.of(2))
                .build();

        SearchOutcome outcome = engine(catalog).search(WorkbenchSnapshot.empty(), exact(500), null, null);

        assertEquals(72, outcome.candidates.size());
        for (Candidate cand : outcome.candidates) {
            boolean both = cand.slots.contains(TestCatalogs.HELMET_A) && cand.slots.contains(TestCatalogs.CHEST_A);
            assertFalse(both, "illegal set combo in " + cand);
        }
    }

    @Test
    void missingMustIncludeIsAConflict() {
        CatalogSnapshot catalog = TestCatalogs.small();
        Constraints c = exact(10).toBuilder()
                .filters(Filters.builder().mustInclude(9999).build())
                .build();
        List<ProgressEvent> events = new ArrayList<>();

        SearchOutcome outcome = engine(catalog).search(WorkbenchSnapshot.empty(), c, events::add, null);

        assertTrue(outcome.isEmpty());
        assertEquals(ReasonCode.MUST_INCLUDE_CONFLICT, outcome.reasonCode);
        assertEquals("Must-include item 9999 does not exist in catalog.", outcome.detail);
        ProgressEvent last = events.get(events.size() - 1);
        assertEquals(ProgressPhase.DIAGNOSTICS, last.phase);
        assertEquals(ReasonCode.MUST_INCLUDE_CONFLICT, last.reasonCode);
    }

    @Test
    void secondWeaponMustIncludeHasNoFreeSlot() {
        CatalogSnapshot catalog = TestCatalogs.small();
        Constraints c = exact(10).toBuilder()
                .filters(Filters.builder().mustInclude(TestCatalogs.WAND_A).mustInclude(TestCatalogs.WAND_B).build())
                .build();

        SearchOutcome outcome = engine(catalog).search(WorkbenchSnapshot.empty(), c, null, null);

        assertEquals(ReasonCode.MUST_INCLUDE_CONFLICT, outcome.reasonCode);
        assertEquals("No free weapon slot available to place must-include item wand-82.", outcome.detail);
    }

    @Test
    void excludedCategoryGivesEmptyPool() {
        CatalogSnapshot catalog = TestCatalogs.small();
        Constraints c = exact(10).toBuilder()
                .filters(Filters.builder().exclude(TestCatalogs.BOOTS_A).exclude(TestCatalogs.BOOTS_B).build())
                .build();

        SearchOutcome outcome = engine(catalog).search(WorkbenchSnapshot.empty(), c, null, null);

        assertEquals(ReasonCode.EMPTY_POOL, outcome.reasonCode);
        assertEquals("No candidate items available for slot boots under current hard filters.", outcome.detail);
    }

    @Test
    void invertedAttackTierRangeIsUnsatisfiable() {
        CatalogSnapshot catalog = TestCatalogs.small();
        Constraints c = exact(10).toBuilder()
                .targets(Targets.builder().customRange(NumericRange.between("atkTier", 3, 1)).build())
                .build();

        SearchOutcome outcome = engine(catalog).search(WorkbenchSnapshot.empty(), c, null, null);

        assertEquals(ReasonCode.UNSAT_ATTACK_TARGET, outcome.reasonCode);
        assertEquals("Attack target is unsatisfiable: atkTier min (3) exceeds atkTier max (1).", outcome.detail);
    }

    @Test
    void unreachableCustomMinimumIsReportedBeforeSearching() {
        CatalogSnapshot catalog = TestCatalogs.small();
        Constraints c = exact(10).toBuilder()
                .targets(Targets.builder().customRange(NumericRange.min("mr", 1000)).build())
                .build();

        SearchOutcome outcome = engine(catalog).search(WorkbenchSnapshot.empty(), c, null, null);

        assertEquals(ReasonCode.UNSAT_THRESHOLD, outcome.reasonCode);
        assertTrue(outcome.detail.startsWith("Unsatisfiable threshold: mr min 1000 is above maximum reachable total"),
                outcome.detail);
        assertEquals(0, outcome.processedStates);
    }

    @Test
    void unwearableWeaponsAreReportedAsSkillPointInfeasible() {
        CatalogSnapshot catalog = TestCatalogs.smallBuilder()
                .item(Item.builder(TestCatalogs.WAND_A).name("heavy-a").type("wand").stat("strReq", 150).build())
                .item(Item.builder(TestCatalogs.WAND_B).name("heavy-b").type("wand").stat("strReq", 160).build())
                .build();

        List<ProgressEvent> events = new ArrayList<>();

        SearchOutcome outcome = engine(catalog).search(WorkbenchSnapshot.empty(), exact(10), events::add, null);

        assertTrue(outcome.isEmpty());
        assertEquals(ReasonCode.SP_INFEASIBLE, outcome.reasonCode);
        assertTrue(outcome.detail.startsWith("Exact search produced 0 valid builds."), outcome.detail);
        List<ProgressEvent> diagnostics = phase(events, ProgressPhase.DIAGNOSTICS);
        assertEquals(1, diagnostics.size());
        ProgressEvent last = events.get(events.size() - 1);
        assertSame(diagnostics.get(0), last);
        assertEquals(ReasonCode.SP_INFEASIBLE, last.reasonCode);
        assertEquals(outcome.detail, last.detail);
    }

    @Test
    void customMinimumFiltersCandidates() {
        CatalogSnapshot catalog = TestCatalogs.small();
        Constraints c = exact(500).toBuilder()
                .targets(Targets.builder().customRange(NumericRange.min("mr", 20)).build())
                .build();

        SearchOutcome outcome = engine(catalog).search(WorkbenchSnapshot.empty(), c, null, null);

        assertFalse(outcome.isEmpty());
        for (Candidate cand : outcome.candidates) {
            double mr = 0;
            for (Item it : cand.slots.items(catalog)) mr += it.stat("mr");
            assertTrue(mr >= 20, "mr " + mr + " in " + cand);
        }
        assertEquals(bruteForce(catalog, c), byKey(outcome.candidates));
    }

    @Test
    void onlyPinnedItemsRestrictsPools() {
        CatalogSnapshot catalog = TestCatalogs.small();
        WorkbenchSnapshot.Builder wb = WorkbenchSnapshot.builder();
        for (Item it : catalog.items()) {
            if (it.category != ItemCategory.RING) wb.pin(it.category, it.id);
        }
        wb.pin(ItemCategory.RING, TestCatalogs.RING_B);
        Constraints c = exact(500).toBuilder()
                .filters(Filters.builder().onlyPinnedItems(true).build())
                .build();

        SearchOutcome outcome = engine(catalog).search(wb.build(), c, null, null);

        assertFalse(outcome.isEmpty());
        for (Candidate cand : outcome.candidates) {
            assertEquals(TestCatalogs.RING_B, cand.slots.get(Slot.RING1));
            assertEquals(TestCatalogs.RING_B, cand.slots.get(Slot.RING2));
        }
    }

    @Test
    void cancelledTokenStopsTheSearch() {
        CatalogSnapshot catalog = TestCatalogs.small();
        CancellationToken token = CancellationToken.create();
        token.cancel();

        assertThrows(SearchCancelledException.class,
                () -> engine(catalog).search(WorkbenchSnapshot.empty(), exact(10), null, token));
    }

    @Test
    void exactSearchEmitsProgressAndSummary() {
        CatalogSnapshot catalog = TestCatalogs.small();
        List<ProgressEvent> events = new ArrayList<>();

        engine(catalog).search(WorkbenchSnapshot.empty(), exact(10), events::add, null);

        assertFalse(events.isEmpty());
        assertEquals(ProgressPhase.EXACT_SEARCH, events.get(0).phase);
        ProgressEvent last = events.get(events.size() - 1);
        assertEquals(ProgressPhase.DIAGNOSTICS, last.phase);
        assertTrue(last.detail.startsWith("Exact search produced 96 valid builds."), last.detail);
    }

    // -------------------- beam under pressure --------------------

    private static final String[] GEAR_TYPES = {"helmet", "chestplate", "leggings", "boots", "ring", "bracelet", "necklace", "wand"};
    private static final int ANCHOR = 9001;

    /** 40 heavy mr=0 items plus one mr=8 item per category, and an mr=2 anchor helmet. */
    private static CatalogSnapshot distractorCatalog() {
        CatalogSnapshot.Builder b = CatalogSnapshot.builder().version("distractors");
        for (int c = 0; c < GEAR_TYPES.length; c++) {
            int base = (c + 1) * 1000;
            for (int i = 1; i <= 40; i++) {
                b.item(Item.builder(base + i).name(GEAR_TYPES[c] + "-heavy-" + i).type(GEAR_TYPES[c]).level(90)
                        .stat("hp", 1000 + i * 10).build());
            }
            b.item(Item.builder(base + 99).name(GEAR_TYPES[c] + "-mana").type(GEAR_TYPES[c]).level(90)
                    .stat("hp", 10).stat("mr", 8).build());
        }
        b.item(Item.builder(ANCHOR).name("anchor").type("helmet").level(90).stat("hp", 500).stat("mr", 2).build());
        return b.build();
    }

    private static Budgets beamBudgets(int beamWidth, long maxStates) {
        return Budgets.builder()
                .topN(5)
                .beamWidth(beamWidth)
                .maxStates(maxStates)
                .useExhaustiveSmallPool(false)
                .build();
    }

    private static List<ProgressEvent> phase(List<ProgressEvent> events, ProgressPhase phase) {
        List<ProgressEvent> out = new ArrayList<>();
        for (ProgressEvent e : events) {
            if (e.phase == phase) out.add(e);
        }
        return out;
    }

    private static boolean hasDetail(List<ProgressEvent> events, String prefix) {
        for (ProgressEvent e : events) {
            if (e.detail != null && e.detail.startsWith(prefix)) return true;
        }
        return false;
    }

    @Test
    void constraintLaneKeepsThresholdBuildsAmongDistractors() {
        CatalogSnapshot catalog = distractorCatalog();
        Constraints c = Constraints.builder()
                .filters(Filters.builder().mustInclude(ANCHOR).build())
                .targets(Targets.builder().customRange(NumericRange.min("mr", 50)).build())
                .budgets(beamBudgets(20, 20_000))
                .build();
        List<ProgressEvent> events = new ArrayList<>();

        SearchOutcome outcome = engine(catalog).search(WorkbenchSnapshot.empty(), c, events::add, null);

        assertFalse(outcome.isEmpty());
        assertEquals("beam", outcome.detail);
        for (Candidate cand : outcome.candidates) {
            assertEquals(ANCHOR, cand.slots.get(Slot.HELMET));
            assertTrue(cand.summary.mr >= 50, "mr " + cand.summary.mr + " in " + cand);
        }
        List<ProgressEvent> stages = phase(events, ProgressPhase.BEAM_SEARCH);
        assertFalse(stages.isEmpty());
        for (ProgressEvent e : stages) {
            assertTrue(e.beamSize <= 20, "beam " + e.beamSize);
            assertTrue(e.processedStates <= 20_000, "states " + e.processedStates);
        }
    }

    @Test
    void beamStaysWithinWidthAndStateBudget() {
        CatalogSnapshot catalog = TestCatalogs.small();
        List<ProgressEvent> events = new ArrayList<>();
        int width = Math.max(SearchTuning.DEFAULTS.standardBeamFloor, 4);

        SearchOutcome outcome = engine(catalog).search(WorkbenchSnapshot.empty(), beamOnly(50, 4), events::add, null);

        assertFalse(outcome.isEmpty());
        assertTrue(outcome.processedStates <= 5_000);
        List<ProgressEvent> stages = phase(events, ProgressPhase.BEAM_SEARCH);
        assertEquals(Slot.COUNT, stages.size());
        for (ProgressEvent e : stages) {
            assertTrue(e.beamSize <= width, "beam " + e.beamSize);
            assertTrue(e.processedStates <= 5_000, "states " + e.processedStates);
        }
    }

    @Test
    void exhaustedStateBudgetPrunesTheSearch() {
        CatalogSnapshot catalog = TestCatalogs.small();
        Constraints c = Constraints.builder().budgets(beamBudgets(4, 1)).build();
        List<ProgressEvent> events = new ArrayList<>();

        SearchOutcome outcome = engine(catalog).search(WorkbenchSnapshot.empty(), c, events::add, null);

        assertTrue(outcome.isEmpty());
        assertEquals(ReasonCode.SEARCH_PRUNED, outcome.reasonCode);
        assertTrue(outcome.detail.startsWith("Search state budget exhausted before completing slot"), outcome.detail);
        assertEquals(1, outcome.processedStates);
        ProgressEvent last = events.get(events.size() - 1);
        assertEquals(ReasonCode.SEARCH_PRUNED, last.reasonCode);
        assertEquals(outcome.detail, last.detail);
    }

    // -------------------- rescues --------------------

    private static final int WARP = 1729;
    private static final int AGI_HELMET = 199;

    /**
     * A wand needing 125 agility (25 above what can be hand-assigned), 25 heavy helmets without
     * agility and, optionally, one weak helmet with +30 agility. Every other slot has one filler.
     */
    private static CatalogSnapshot warpLike(boolean withSupport) {
        CatalogSnapshot.Builder b = CatalogSnapshot.builder().version("warp-like");
        for (int i = 0; i < 25; i++) {
            b.item(Item.builder(100 + i).name("heavy-helm-" + i).type("helmet").level(100)
                    .stat("hp", 2500 - i * 50).stat("sdPct", 25 - i).build());
        }
        if (withSupport) {
            b.item(Item.builder(AGI_HELMET).name("agi-helm").type("helmet").level(100)
                    .stat("hp", 50).stat("agi", 30).build());
        }
        b.item(Item.builder(210).name("chest-filler").type("chestplate").level(100).build());
        b.item(Item.builder(220).name("legs-filler").type("leggings").level(100).build());
        b.item(Item.builder(230).name("boots-filler").type("boots").level(100).build());
        b.item(Item.builder(240).name("ring-filler").type("ring").level(100).build());
        b.item(Item.builder(250).name("bracelet-filler").type("bracelet").level(100).build());
        b.item(Item.builder(260).name("necklace-filler").type("necklace").level(100).build());
        b.item(Item.builder(WARP).name("warp-like").type("wand").level(99)
                .stat("averageDps", 500).stat("agiReq", 125).build());
        return b.build();
    }

    private static Constraints warpConstraints() {
        return Constraints.builder()
                .filters(Filters.builder().mustInclude(WARP).build())
                .budgets(Budgets.builder()
                        .topN(5)
                        .topKPerSlot(12)
                        .beamWidth(20)
                        .maxStates(2_000)
                        .useExhaustiveSmallPool(false)
                        .build())
                .build();
    }

    @Test
    void feasibilityFirstPassRecoversLowRoughSupportItem() {
        CatalogSnapshot catalog = warpLike(true);
        List<ProgressEvent> events = new ArrayList<>();

        SearchOutcome outcome = engine(catalog).search(WorkbenchSnapshot.empty(), warpConstraints(), events::add, null);

        assertFalse(outcome.isEmpty());
        Candidate best = outcome.best();
        assertEquals(WARP, best.slots.get(Slot.WEAPON));
        assertEquals(AGI_HELMET, best.slots.get(Slot.HELMET));
        assertTrue(best.summary.skillPointFeasible);

        assertTrue(hasDetail(events, "Final eval found 0 valid builds."));
        assertTrue(hasDetail(events, "Retrying with feasibility-first beam search (support-aware rescue for high-skill requirements)."));
        assertTrue(hasDetail(events, "Feasibility-first eval: 1 valid builds."));
        assertTrue(phase(events, ProgressPhase.BEAM_SEARCH).stream()
                .anyMatch(e -> e.detail != null && e.detail.startsWith("feasibility-first")));
    }

    @Test
    void fallbackReportsSkillPointFailureWhenNothingCanBeWorn() {
        CatalogSnapshot catalog = warpLike(false);
        List<ProgressEvent> events = new ArrayList<>();

        SearchOutcome outcome = engine(catalog).search(WorkbenchSnapshot.empty(), warpConstraints(), events::add, null);

        assertTrue(outcome.isEmpty());
        assertEquals(ReasonCode.SP_INFEASIBLE, outcome.reasonCode);
        assertTrue(outcome.detail.startsWith("Deterministic fallback found 0 valid builds."), outcome.detail);
        assertTrue(hasDetail(events, "Running deterministic fallback search (2s cap)"));
        ProgressEvent last = events.get(events.size() - 1);
        assertEquals(ReasonCode.SP_INFEASIBLE, last.reasonCode);
        assertEquals(outcome.detail, last.detail);
    }

    @Test
    void fallbackStopsAtTimeCap() {
        CatalogSnapshot catalog = warpLike(false);
        SearchTuning tuning = SearchTuning.DEFAULTS.toBuilder()
                .fallbackTimeCapMs(1_000)
                .clock(new SteppingClock(1_000))
                .build();
        BeamSearchEngine engine = new BeamSearchEngine(catalog, new DefaultBuildEvaluator(catalog), new WeightedScorer(), tuning);
        List<ProgressEvent> events = new ArrayList<>();

        SearchOutcome outcome = engine.search(WorkbenchSnapshot.empty(), warpConstraints(), events::add, null);

        assertTrue(outcome.isEmpty());
        assertEquals(ReasonCode.FALLBACK_TIMEOUT, outcome.reasonCode);
        assertEquals("Deterministic fallback timed out after 1 seconds with no valid candidates.", outcome.detail);
        assertEquals(ReasonCode.FALLBACK_TIMEOUT, events.get(events.size() - 1).reasonCode);
    }

    private static final int MANA_HELMET = 499;

    /**
     * 50 heavy helmets, 12 life-steal helmets that own the utility ranking, and one mr=200 helmet
     * that only enters the helmet pool once sustain carries weight.
     */
    private static CatalogSnapshot hiddenManaCatalog() {
        CatalogSnapshot.Builder b = CatalogSnapshot.builder().version("hidden-mana");
        for (int i = 0; i < 50; i++) {
            b.item(Item.builder(300 + i).name("heavy-helm-" + i).type("helmet").level(90)
                    .stat("hp", 1000 - i * 5).build());
        }
        for (int i = 0; i < 12; i++) {
            b.item(Item.builder(400 + i).name("leech-helm-" + i).type("helmet").level(100)
                    .stat("hp", 100).stat("ls", 300).build());
        }
        b.item(Item.builder(MANA_HELMET).name("mana-helm").type("helmet").level(100)
                .stat("mr", 200).stat("intReq", 1).build());
        b.item(Item.builder(510).name("chest-filler").type("chestplate").level(90).build());
        b.item(Item.builder(520).name("legs-filler").type("leggings").level(90).build());
        b.item(Item.builder(530).name("boots-filler").type("boots").level(90).build());
        b.item(Item.builder(540).name("ring-filler").type("ring").level(90).build());
        b.item(Item.builder(550).name("bracelet-filler").type("bracelet").level(90).build());
        b.item(Item.builder(560).name("necklace-filler").type("necklace").level(90).build());
        b.item(Item.builder(570).name("wand-filler").type("wand").level(90).build());
        return b.build();
    }

    @Test
    void thresholdReentryRebuildsPoolsWithBiasedWeights() {
        CatalogSnapshot catalog = hiddenManaCatalog();
        Constraints c = Constraints.builder()
                .targets(Targets.builder().minMr(150.0).build())
                .weights(Weights.DEFAULTS.toBuilder().sustain(0).build())
                .budgets(Budgets.builder()
                        .topN(5)
                        .topKPerSlot(10)
                        .beamWidth(20)
                        .maxStates(5_000)
                        .useExhaustiveSmallPool(false)
                        .build())
                .build();
        List<ProgressEvent> events = new ArrayList<>();

        SearchOutcome outcome = engine(catalog).search(WorkbenchSnapshot.empty(), c, events::add, null);

        assertFalse(outcome.isEmpty());
        assertEquals("threshold rescue", outcome.detail);
        assertEquals(MANA_HELMET, outcome.best().slots.get(Slot.HELMET));
        assertTrue(outcome.best().summary.mr >= 150);
        assertTrue(hasDetail(events, "Retrying with threshold-biased beam search"));
        assertTrue(hasDetail(events, "Threshold rescue: 1 valid builds."));
    }

    /** Every read moves the clock forward by a fixed step. */
    private static final class SteppingClock extends Clock {
        private final long stepMs;
        private long now;

        SteppingClock(long stepMs) {
            this.stepMs = stepMs;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public long millis() {
            now += stepMs;
            return now;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis());
        }
    }
}
