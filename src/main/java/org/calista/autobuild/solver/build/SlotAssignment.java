package org.calista.autobuild.solver.build;

import org.calista.autobuild.solver.catalog.CatalogSnapshot;
import org.calista.autobuild.solver.catalog.Item;
import org.calista.autobuild.solver.catalog.Slot;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * SlotAssignment — фиксированный массив из 9 позиций, индекс = {@link Slot#ordinal()}.
 *
 * <p>Value type: {@link #with(Slot, Integer)} всегда возвращает новую копию, поэтому
 * соседние ветки beam-а никогда не видят мутации друг друга.</p>
 */
public final class SlotAssignment {

    private static final int NONE = Integer.MIN_VALUE;

    private static final SlotAssignment EMPTY = new SlotAssignment(filledWith(NONE));

    private final int[] ids;

    private SlotAssignment(int[] ids) {
        this.ids = ids;
    }

    public static SlotAssignment empty() {
        return EMPTY;
    }

    public static SlotAssignment of(Map<Slot, Integer> bySlot) {
        Objects.requireNonNull(bySlot, "bySlot");
        int[] a = filledWith(NONE);
        for (Map.Entry<Slot, Integer> e : bySlot.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            a[e.getKey().ordinal()] = e.getValue();
        }
        return new SlotAssignment(a);
    }

    /** @return item id or null when the slot is empty */
    public Integer get(Slot slot) {
        int v = ids[slot.ordinal()];
        return v == NONE ? null : v;
    }

    /** Id for keys and tie-breaks: empty slots read as 0. */
    public int keyId(Slot slot) {
        int v = ids[slot.ordinal()];
        return v == NONE ? 0 : v;
    }

    public boolean isEmpty(Slot slot) {
        return ids[slot.ordinal()] == NONE;
    }

    public SlotAssignment with(Slot slot, Integer itemId) {
        int[] copy = ids.clone();
        copy[slot.ordinal()] = itemId == null ? NONE : itemId;
        return new SlotAssignment(copy);
    }

    public SlotAssignment cleared(Slot slot) {
        return with(slot, null);
    }

    public boolean contains(int itemId) {
        for (int v : ids) {
            if (v == itemId) return true;
        }
        return false;
    }

    public int filledCount() {
        int n = 0;
        for (int v : ids) {
            if (v != NONE) n++;
        }
        return n;
    }

    public List<Slot> emptySlots() {
        ArrayList<Slot> out = new ArrayList<>(Slot.COUNT);
        for (Slot s : Slot.ALL) {
            if (isEmpty(s)) out.add(s);
        }
        return out;
    }

    /** Resolves the placed items in slot order; unknown ids are skipped. */
    public List<Item> items(CatalogSnapshot catalog) {
        ArrayList<Item> out = new ArrayList<>(Slot.COUNT);
        for (int v : ids) {
            if (v == NONE) continue;
            Item it = catalog.item(v);
            if (it != null) out.add(it);
        }
        return out;
    }

    public Map<Slot, Integer> asMap() {
        EnumMap<Slot, Integer> m = new EnumMap<>(Slot.class);
        for (Slot s : Slot.ALL) {
            Integer v = get(s);
            if (v != null) m.put(s, v);
        }
        return m;
    }

    /**
     * Normalized dedup key: slots in fixed order, ring ids sorted so ring1/ring2 swaps collapse.
     */
    public String canonicalKey() {
        int ringA = keyId(Slot.RING1);
        int ringB = keyId(Slot.RING2);
        int r1 = Math.min(ringA, ringB);
        int r2 = Math.max(ringA, ringB);
        StringBuilder sb = new StringBuilder(64);
        sb.append(keyId(Slot.HELMET)).append('|')
                .append(keyId(Slot.CHESTPLATE)).append('|')
                .append(keyId(Slot.LEGGINGS)).append('|')
                .append(keyId(Slot.BOOTS)).append('|')
                .append(r1).append('|')
                .append(r2).append('|')
                .append(keyId(Slot.BRACELET)).append('|')
                .append(keyId(Slot.NECKLACE)).append('|')
                .append(keyId(Slot.WEAPON));
        return sb.toString();
    }

    /**
     * Lexicographic comparison by item id in slot order (empty = 0). Used as the deterministic tie-break.
     */
    public static int compareBySlotIds(SlotAssignment a, SlotAssignment b) {
        for (Slot s : Slot.ALL) {
            int c = Integer.compare(a.keyId(s), b.keyId(s));
            if (c != 0) return c;
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SlotAssignment other)) return false;
        return Arrays.equals(ids, other.ids);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(ids);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        boolean first = true;
        for (Slot s : Slot.ALL) {
            Integer v = get(s);
            if (v == null) continue;
            if (!first) sb.append(", ");
            sb.append(s.key()).append('=').append(v);
            first = false;
        }
        return sb.append('}').toString();
    }

    private static int[] filledWith(int v) {
        int[] a = new int[Slot.COUNT];
        Arrays.fill(a, v);
        return a;
    }
}
