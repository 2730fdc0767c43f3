package org.calista.autobuild.solver.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.autobuild.io.FileIO;
import org.calista.autobuild.solver.catalog.AttackSpeed;
import org.calista.autobuild.solver.catalog.CatalogSnapshot;
import org.calista.autobuild.solver.catalog.CharacterClass;
import org.calista.autobuild.solver.catalog.ItemCategory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CatalogLoaderTest {

    private static final String CATALOG = "{"
            + "\"version\":\"v1\",\"extra\":true,"
            + "\"items\":["
            + "{\"id\":1,\"name\":\"Cap\",\"type\":\"helmet\",\"level\":10,\"stats\":{\"hp\":100,\"strReq\":5}},"
            + "{\"id\":2,\"name\":\"Stick\",\"type\":\"wand\",\"attackSpeed\":\"fast\",\"stats\":{\"averageDps\":50}},"
            + "{\"id\":3,\"name\":\"Potion\",\"type\":\"potion\"},"
            + "{\"id\":4,\"name\":\"Band\",\"category\":\"ring\",\"majorIds\":[\"MAGNET\"],\"unknown\":1}"
            + "],"
            + "\"sets\":[{\"name\":\"Duo\",\"items\":[1,4],\"illegalCounts\":[2]},{\"items\":[2]}]"
            + "}";

    @TempDir
    Path dir;

    private CatalogLoader loader() {
        return new CatalogLoader(new FileIO(dir), new ObjectMapper());
    }

    @Test
    void parsesItemsAndSets() throws Exception {
        CatalogSnapshot c = loader().parse(CATALOG, "inline");

        assertEquals("v1", c.version);
        assertEquals(3, c.size());
        assertNull(c.item(3));

        assertEquals(ItemCategory.HELMET, c.item(1).category);
        assertEquals(5.0, c.item(1).reqTotal, 1e-9);
        assertEquals(ItemCategory.WEAPON, c.item(2).category);
        assertEquals(CharacterClass.MAGE, c.item(2).classReq);
        assertEquals(AttackSpeed.FAST, c.item(2).attackSpeed);
        assertEquals(ItemCategory.RING, c.item(4).category);
        assertTrue(c.item(4).majorIds.contains("MAGNET"));

        assertEquals("Duo", c.setOf(1));
        assertTrue(c.setMeta("Duo").isIllegal(2));
        assertFalse(c.setMeta("Duo").isIllegal(1));
        assertNull(c.setOf(2));
    }

    @Test
    void loadsFromFile() throws Exception {
        FileIO io = new FileIO(dir);
        Path f = io.resolve("catalog.json");
        io.writeString(f, CATALOG);

        assertEquals(3, new CatalogLoader(io, new ObjectMapper()).load(f).size());
        assertThrows(NoSuchFileException.class, () -> loader().load(io.resolve("other.json")));
    }

    @Test
    void rejectsMalformedDocuments() {
        CatalogLoader l = loader();
        assertThrows(IllegalStateException.class, () -> l.parse("  ", "blank"));
        assertThrows(IllegalStateException.class, () -> l.parse("[1,2]", "array"));
        assertThrows(IllegalStateException.class, () -> l.parse("{\"items\":{}}", "object-items"));
    }

    @Test
    void missingItemsGivesAnEmptyCatalog() throws Exception {
        CatalogSnapshot c = loader().parse("{\"version\":\"empty\"}", "inline");
        assertEquals(0, c.size());
        assertTrue(c.itemsOf(ItemCategory.BOOTS).isEmpty());
    }
}
