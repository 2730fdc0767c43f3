package org.calista.autobuild.solver.search;

import org.calista.autobuild.solver.build.SlotAssignment;
import org.calista.autobuild.solver.catalog.CatalogSnapshot;
import org.calista.autobuild.solver.catalog.SetMeta;
import org.calista.autobuild.solver.catalog.Slot;

import java.util.Map;
import java.util.TreeMap;

/**
 * Set legality: some sets forbid wearing exactly N of their pieces.
 */
public final class SetRules {

    private SetRules() {}

    /** Whether placing {@code itemId} next to {@code current} makes its set count illegal. */
    public static boolean wouldCreateIllegalCombo(int itemId, SlotAssignment current, CatalogSnapshot catalog) {
        String set = catalog.setOf(itemId);
        if (set == null) return false;
        SetMeta meta = catalog.setMeta(set);
        if (meta == null) return false;

        int existing = 0;
        for (Slot s : Slot.ALL) {
            Integer id = current.get(s);
            if (id != null && set.equals(catalog.setOf(id))) existing++;
        }
        return meta.isIllegal(existing + 1);
    }

    /** @return name of the first set (by name) worn in an illegal count, or null */
    public static String firstIllegalSet(SlotAssignment slots, CatalogSnapshot catalog) {
        Map<String, Integer> counts = new TreeMap<>();
        for (Slot s : Slot.ALL) {
            Integer id = slots.get(s);
            if (id == null) continue;
            String set = catalog.setOf(id);
            if (set != null) counts.merge(set, 1, Integer::sum);
        }
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            SetMeta meta = catalog.setMeta(e.getKey());
            if (meta != null && meta.isIllegal(e.getValue())) return e.getKey();
        }
        return null;
    }
}
