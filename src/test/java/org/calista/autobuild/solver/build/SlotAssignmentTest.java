package org.calista.autobuild.solver.build;

import org.calista.autobuild.solver.catalog.Slot;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SlotAssignmentTest {

    @Test
    void withReturnsACopy() {
        SlotAssignment empty = SlotAssignment.empty();
        SlotAssignment one = empty.with(Slot.HELMET, 7);

        assertTrue(empty.isEmpty(Slot.HELMET));
        assertEquals(7, one.get(Slot.HELMET));
        assertEquals(1, one.filledCount());
        assertTrue(one.cleared(Slot.HELMET).isEmpty(Slot.HELMET));
        assertEquals(7, one.get(Slot.HELMET));
    }

    @Test
    void ringSwapSharesCanonicalKey() {
        SlotAssignment a = SlotAssignment.empty().with(Slot.RING1, 5).with(Slot.RING2, 9);
        SlotAssignment b = SlotAssignment.empty().with(Slot.RING1, 9).with(Slot.RING2, 5);

        assertNotEquals(a, b);
        assertEquals(a.canonicalKey(), b.canonicalKey());
        assertEquals("0|0|0|0|5|9|0|0|0", a.canonicalKey());
    }

    @Test
    void compareBySlotIdsFollowsSlotOrder() {
        SlotAssignment a = SlotAssignment.empty().with(Slot.HELMET, 1).with(Slot.WEAPON, 99);
        SlotAssignment b = SlotAssignment.empty().with(Slot.HELMET, 2).with(Slot.WEAPON, 3);

        assertTrue(SlotAssignment.compareBySlotIds(a, b) < 0);
        assertTrue(SlotAssignment.compareBySlotIds(b, a) > 0);
        assertEquals(0, SlotAssignment.compareBySlotIds(a, a.with(Slot.WEAPON, 99)));
    }

    @Test
    void ofSkipsNullIdsAndListsEmptySlots() {
        Map<Slot, Integer> m = new EnumMap<>(Slot.class);
        m.put(Slot.BOOTS, 4);
        m.put(Slot.NECKLACE, null);

        SlotAssignment a = SlotAssignment.of(m);

        assertTrue(a.contains(4));
        assertFalse(a.contains(0));
        assertEquals(List.of(Slot.HELMET, Slot.CHESTPLATE, Slot.LEGGINGS, Slot.RING1, Slot.RING2,
                Slot.BRACELET, Slot.NECKLACE, Slot.WEAPON), a.emptySlots());
        assertEquals(Map.of(Slot.BOOTS, 4), a.asMap());
    }
}
