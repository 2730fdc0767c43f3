package org.calista.autobuild.solver.search;

import org.calista.autobuild.solver.build.SlotAssignment;
import org.calista.autobuild.solver.catalog.Slot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LaneMergerTest {

    private static BeamNode node(int helmetId) {
        return new BeamNode(SlotAssignment.empty().with(Slot.HELMET, helmetId), 1, 0.0, 0.0, 0,
                new double[0], new double[0], 0.0, 0.0, 0.0, 0.0);
    }

    private static List<BeamNode> nodes(int... ids) {
        List<BeamNode> out = new ArrayList<>();
        for (int id : ids) out.add(node(id));
        return out;
    }

    private static List<Integer> helmets(List<BeamNode> beam) {
        List<Integer> out = new ArrayList<>();
        for (BeamNode n : beam) out.add(n.slots.get(Slot.HELMET));
        return out;
    }

    @Test
    void primaryLaneTakesItsRoundedShareFirst() {
        List<BeamNode> primary = nodes(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
        List<BeamNode> hard = nodes(101, 102, 103, 104, 105, 106, 107, 108, 109, 110);

        assertEquals(List.of(1, 2, 3, 101, 102), helmets(LaneMerger.merge(primary, hard, 5, 0.6)));
        assertEquals(List.of(1, 2, 3, 4, 101, 102, 103), helmets(LaneMerger.merge(primary, hard, 7, 0.6)));
    }

    @Test
    void twentyWideBeamSplitsTwelveAndEight() {
        List<BeamNode> primary = new ArrayList<>();
        List<BeamNode> hard = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            primary.add(node(1 + i));
            hard.add(node(1000 + i));
        }

        List<BeamNode> merged = LaneMerger.merge(primary, hard, 20, 0.6);

        assertEquals(20, merged.size());
        long fromPrimary = helmets(merged).stream().filter(id -> id < 1000).count();
        assertEquals(12, fromPrimary);
    }

    @Test
    void duplicatesDoNotCountTowardWidth() {
        List<BeamNode> primary = nodes(1, 2, 3);
        List<BeamNode> hard = nodes(1, 2, 4, 5);

        List<BeamNode> merged = LaneMerger.merge(primary, hard, 4, 0.5);

        assertEquals(List.of(1, 2, 4, 5), helmets(merged));
    }

    @Test
    void hardLaneFillsWhenPrimaryRunsShort() {
        List<BeamNode> merged = LaneMerger.merge(nodes(1), nodes(101, 102, 103, 104, 105), 5, 0.6);

        assertEquals(List.of(1, 101, 102, 103, 104), helmets(merged));
    }

    @Test
    void primaryLaneFillsWhenHardRunsShort() {
        List<BeamNode> merged = LaneMerger.merge(nodes(1, 2, 3, 4, 5), nodes(101), 5, 0.6);

        assertEquals(List.of(1, 2, 3, 101, 4), helmets(merged));
    }

    @Test
    void emptyLanesGiveEmptyBeam() {
        assertTrue(LaneMerger.merge(List.of(), List.of(), 10, 0.6).isEmpty());
    }
}
