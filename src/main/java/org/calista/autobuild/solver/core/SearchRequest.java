package org.calista.autobuild.solver.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.calista.autobuild.solver.catalog.CharacterClass;
import org.calista.autobuild.solver.catalog.ItemCategory;
import org.calista.autobuild.solver.catalog.Slot;
import org.calista.autobuild.solver.constraints.ConstraintsDocument;
import org.calista.autobuild.solver.search.WorkbenchSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON request of the console runner: base workbench + constraints.
 *
 * <pre>
 * { "workbench": { "slots": { "weapon": 12 }, "locked": ["weapon"], "characterClass": "mage",
 *                  "level": 106, "bins": { "ring": [3, 4] } },
 *   "constraints": { ... ConstraintsDocument ... } }
 * </pre>
 *
 * Missing constraints fall back to config defaults. Workbench class / level fill the filters
 * only when the constraints leave them unset.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SearchRequest {

    private static final Logger log = LoggerFactory.getLogger(SearchRequest.class);

    public Workbench workbench = new Workbench();
    public ConstraintsDocument constraints;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Workbench {
        public Map<String, Integer> slots = new LinkedHashMap<>();
        public List<String> locked = new ArrayList<>();
        public String characterClass;
        public Integer level;
        public Map<String, List<Integer>> bins = new LinkedHashMap<>();
    }

    public WorkbenchSnapshot toWorkbench() {
        Workbench w = workbench == null ? new Workbench() : workbench;
        WorkbenchSnapshot.Builder b = WorkbenchSnapshot.builder()
                .characterClass(CharacterClass.parseOrNull(w.characterClass))
                .level(w.level);
        if (w.slots != null) {
            for (Map.Entry<String, Integer> e : w.slots.entrySet()) {
                if (e.getValue() == null) continue;
                Slot s = slotOrNull(e.getKey());
                if (s != null) b.equip(s, e.getValue());
            }
        }
        if (w.locked != null) {
            for (String raw : w.locked) {
                Slot s = slotOrNull(raw);
                if (s != null) b.lock(s);
            }
        }
        if (w.bins != null) {
            for (Map.Entry<String, List<Integer>> e : w.bins.entrySet()) {
                ItemCategory c = ItemCategory.fromType(e.getKey());
                if (c == null) {
                    log.warn("Unknown bin category '{}' ignored", e.getKey());
                    continue;
                }
                if (e.getValue() != null) b.bin(c, e.getValue());
            }
        }
        return b.build();
    }

    /**
     * Request constraints, or config defaults when absent, with workbench class / level filled in
     * where the document leaves them open.
     */
    public ConstraintsDocument constraintsOr(SolverConfig cfg) {
        boolean explicit = constraints != null;
        ConstraintsDocument d = explicit ? constraints : cfg.defaultsDocument();
        Workbench w = workbench == null ? new Workbench() : workbench;
        if (d.characterClass == null && w.characterClass != null) d.characterClass = w.characterClass;
        if (!explicit && w.level != null) d.level = w.level;
        return d;
    }

    private static Slot slotOrNull(String raw) {
        try {
            return Slot.parse(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Workbench slot ignored: {}", e.getMessage());
            return null;
        }
    }
}
