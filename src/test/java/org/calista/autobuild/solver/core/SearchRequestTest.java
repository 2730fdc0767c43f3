package org.calista.autobuild.solver.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.autobuild.solver.catalog.CharacterClass;
import org.calista.autobuild.solver.catalog.ItemCategory;
import org.calista.autobuild.solver.catalog.Slot;
import org.calista.autobuild.solver.constraints.ConstraintsDocument;
import org.calista.autobuild.solver.search.WorkbenchSnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SearchRequestTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void workbenchIsReadLeniently() throws Exception {
        SearchRequest req = mapper.readValue("{\"workbench\":{"
                + "\"slots\":{\"helmet\":11,\"RING2\":52,\"cape\":3,\"boots\":null},"
                + "\"locked\":[\"helmet\",\"tail\"],"
                + "\"characterClass\":\"Mage\",\"level\":88,"
                + "\"bins\":{\"ring\":[51,52],\"trinket\":[1]}}}", SearchRequest.class);

        WorkbenchSnapshot wb = req.toWorkbench();

        assertEquals(11, wb.slots.get(Slot.HELMET));
        assertEquals(52, wb.slots.get(Slot.RING2));
        assertTrue(wb.slots.isEmpty(Slot.BOOTS));
        assertEquals(Set.of(Slot.HELMET), wb.lockedSlots);
        assertEquals(CharacterClass.MAGE, wb.characterClass);
        assertEquals(88, wb.level);
        assertEquals(List.of(51, 52), wb.bin(ItemCategory.RING));
    }

    @Test
    void configDefaultsApplyWhenConstraintsAreAbsent() {
        SolverConfig cfg = new SolverConfig();
        cfg.search.beamWidth = 77;
        SearchRequest req = new SearchRequest();
        req.workbench.characterClass = "archer";
        req.workbench.level = 70;

        ConstraintsDocument d = req.constraintsOr(cfg);

        assertEquals(77, d.beamWidth);
        assertEquals("archer", d.characterClass);
        assertEquals(70, d.level);
    }

    @Test
    void explicitConstraintsKeepTheirLevel() {
        SearchRequest req = new SearchRequest();
        req.constraints = new ConstraintsDocument();
        req.constraints.level = 100;
        req.workbench.level = 70;
        req.workbench.characterClass = "shaman";

        ConstraintsDocument d = req.constraintsOr(new SolverConfig());

        assertEquals(100, d.level);
        assertEquals("shaman", d.characterClass);
    }
}
