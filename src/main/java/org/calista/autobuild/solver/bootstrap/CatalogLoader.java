package org.calista.autobuild.solver.bootstrap;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.autobuild.io.FileIO;
import org.calista.autobuild.solver.catalog.AttackSpeed;
import org.calista.autobuild.solver.catalog.CatalogSnapshot;
import org.calista.autobuild.solver.catalog.CharacterClass;
import org.calista.autobuild.solver.catalog.Item;
import org.calista.autobuild.solver.catalog.ItemCategory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * CatalogLoader — JSON каталог в {@link CatalogSnapshot}.
 *
 * <pre>
 * { "version": "...",
 *   "items": [ { "id": 1, "name": "...", "type": "helmet", "tier": "Legendary", "level": 90,
 *                "majorIds": [], "powderSlots": 2, "attackSpeed": "FAST", "stats": { "hp": 3000 } } ],
 *   "sets":  [ { "name": "...", "items": [1, 2], "illegalCounts": [2] } ] }
 * </pre>
 *
 * Предметы с неизвестной категорией пропускаются с warn. Битая структура документа =
 * IllegalStateException, нечитаемый файл = IOException.
 */
public final class CatalogLoader {

    private static final Logger log = LogManager.getLogger(CatalogLoader.class);

    private final FileIO io;
    private final ObjectMapper mapper;

    public CatalogLoader(FileIO io, ObjectMapper mapper) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public CatalogSnapshot load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        String json = io.readString(file);
        CatalogSnapshot snap = parse(json, file.toString());
        log.info("Catalog loaded: {} (version={}, items={}, sets={})", file, snap.version, snap.size(), snap.sets().size());
        return snap;
    }

    public CatalogSnapshot parse(String json, String source) throws IOException {
        if (json == null || json.isBlank()) throw new IllegalStateException("Catalog " + source + " is empty");
        JsonNode root = mapper.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IllegalStateException("Catalog " + source + " must be a JSON object");
        }
        JsonNode items = root.get("items");
        if (items != null && !items.isArray()) {
            throw new IllegalStateException("Catalog " + source + ": 'items' must be an array");
        }
        Document doc = mapper.treeToValue(root, Document.class);

        CatalogSnapshot.Builder b = CatalogSnapshot.builder().version(doc.version);
        int skipped = 0;
        for (ItemRow row : doc.items == null ? List.<ItemRow>of() : doc.items) {
            if (row == null) continue;
            Item item = toItem(row);
            if (item == null) {
                skipped++;
                continue;
            }
            b.item(item);
        }
        for (SetRow s : doc.sets == null ? List.<SetRow>of() : doc.sets) {
            if (s == null || s.name == null || s.name.isBlank()) {
                log.warn("Set without name ignored in {}", source);
                continue;
            }
            b.set(s.name, s.items, s.illegalCounts);
        }
        if (skipped > 0) log.warn("Catalog {}: {} item(s) skipped", source, skipped);
        return b.build();
    }

    private static Item toItem(ItemRow row) {
        ItemCategory category = row.category != null ? ItemCategory.fromType(row.category) : ItemCategory.fromType(row.type);
        if (category == null) {
            log.warn("Item {} '{}' has unknown category (type={}, category={})", row.id, row.name, row.type, row.category);
            return null;
        }
        Item.Builder ib = Item.builder(row.id)
                .name(row.name)
                .category(category)
                .type(row.type)
                .tier(row.tier)
                .level(row.level)
                .classReq(CharacterClass.parseOrNull(row.classReq))
                .powderSlots(row.powderSlots)
                .restricted(row.restricted)
                .deprecated(row.deprecated)
                .stats(row.stats);
        if (row.attackSpeed != null) {
            AttackSpeed speed = AttackSpeed.parseOrNull(row.attackSpeed);
            if (speed == null) log.warn("Item {} '{}': unknown attack speed '{}'", row.id, row.name, row.attackSpeed);
            ib.attackSpeed(speed);
        }
        if (row.majorIds != null) {
            for (String m : row.majorIds) ib.majorId(m);
        }
        return ib.build();
    }

    // -------------------- JSON rows --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Document {
        public String version;
        public List<ItemRow> items = new ArrayList<>();
        public List<SetRow> sets = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ItemRow {
        public int id;
        public String name;
        public String type;
        public String category;
        public String tier;
        public int level;
        public String classReq;
        public List<String> majorIds = new ArrayList<>();
        public int powderSlots;
        public String attackSpeed;
        public boolean restricted;
        public boolean deprecated;
        public Map<String, Double> stats = new LinkedHashMap<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class SetRow {
        public String name;
        public List<Integer> items = new ArrayList<>();
        public List<Integer> illegalCounts = new ArrayList<>();
    }
}
