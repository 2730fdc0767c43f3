package org.calista.autobuild.solver.core;

import org.calista.autobuild.solver.TestCatalogs;
import org.calista.autobuild.solver.catalog.CatalogSnapshot;
import org.calista.autobuild.solver.catalog.Slot;
import org.calista.autobuild.solver.constraints.Constraints;
import org.calista.autobuild.solver.engine.SearchOutcome;
import org.calista.autobuild.solver.events.ProgressEvent;
import org.calista.autobuild.solver.search.WorkbenchSnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SolverKernelTest {

    private static final String CATALOG = "{\"version\":\"kernel-test\",\"items\":["
            + "{\"id\":1,\"name\":\"Weak Cap\",\"type\":\"helmet\",\"stats\":{\"hp\":100}},"
            + "{\"id\":2,\"name\":\"Strong Cap\",\"type\":\"helmet\",\"stats\":{\"hp\":900}},"
            + "{\"id\":3,\"name\":\"Plate\",\"type\":\"chestplate\",\"stats\":{\"hp\":500}},"
            + "{\"id\":4,\"name\":\"Greaves\",\"type\":\"leggings\",\"stats\":{\"hp\":400}},"
            + "{\"id\":5,\"name\":\"Boots\",\"type\":\"boots\",\"stats\":{\"hp\":300}},"
            + "{\"id\":6,\"name\":\"Band\",\"type\":\"ring\",\"stats\":{\"mr\":2}},"
            + "{\"id\":7,\"name\":\"Cuff\",\"type\":\"bracelet\",\"stats\":{\"mr\":1}},"
            + "{\"id\":8,\"name\":\"Charm\",\"type\":\"necklace\",\"stats\":{\"hp\":50}},"
            + "{\"id\":9,\"name\":\"Rod\",\"type\":\"wand\",\"attackSpeed\":\"normal\",\"stats\":{\"averageDps\":120}}"
            + "]}";

    @TempDir
    Path root;

    @Test
    void endToEndSearchThroughTheLadder() throws Exception {
        SolverKernel kernel = SolverKernel.builder().configRoot(root).build(Path.of("autobuild.json"));
        kernel.io().writeString(kernel.io().resolve("catalog.json"), CATALOG);

        assertThrows(IllegalStateException.class, kernel::catalog);
        CatalogSnapshot catalog = kernel.loadCatalog();
        assertSame(catalog, kernel.loadCatalog());
        assertEquals(9, catalog.size());

        SearchOutcome r = kernel.orchestrator().run(WorkbenchSnapshot.empty(), Constraints.defaults(),
                kernel.diagnostics().asListener(), null);

        assertFalse(r.isEmpty());
        assertEquals("Fast pass", r.attempt);
        assertEquals(2, r.candidates.size());
        assertEquals(2, r.best().slots.get(Slot.HELMET));
        assertEquals(6, r.best().slots.get(Slot.RING1));
        assertEquals(6, r.best().slots.get(Slot.RING2));

        List<ProgressEvent> logged = kernel.diagnostics().readAll();
        assertFalse(logged.isEmpty());
        for (ProgressEvent e : logged) assertEquals("Fast pass", e.attempt);
    }

    @Test
    void configFileIsCreatedUnderConfigRoot() throws Exception {
        SolverKernel kernel = SolverKernel.builder()
                .configRoot(root)
                .catalog(TestCatalogs.small())
                .build(Path.of("conf/solver.json"));

        assertTrue(kernel.io().exists(root.resolve("conf/solver.json")));
        assertEquals(root.resolve("data").toAbsolutePath().normalize(), kernel.io().baseDir());
        assertEquals(TestCatalogs.small().size(), kernel.loadCatalog().size());
        assertEquals(4, kernel.orchestrator().ladder().size());
    }
}
