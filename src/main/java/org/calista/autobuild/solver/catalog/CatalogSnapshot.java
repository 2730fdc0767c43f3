package org.calista.autobuild.solver.catalog;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * CatalogSnapshot — read-only каталог на один прогон.
 *
 * <ul>
 *   <li>items в стабильном порядке (как были добавлены)</li>
 *   <li>индексы по id и по категории</li>
 *   <li>метаданные сетов (illegal counts) и обратная карта itemId → set</li>
 * </ul>
 *
 * Снапшот разделяется по ссылке между всеми rescue-тирами и никогда не мутируется.
 */
public final class CatalogSnapshot {

    private static final Logger log = LogManager.getLogger(CatalogSnapshot.class);

    public final String version;

    private final List<Item> items;
    private final Map<Integer, Item> byId;
    private final Map<ItemCategory, List<Item>> byCategory;
    private final Map<String, SetMeta> sets;
    private final Map<Integer, String> setByItemId;

    private CatalogSnapshot(Builder b) {
        this.version = b.version == null ? "unknown" : b.version;
        this.items = Collections.unmodifiableList(new ArrayList<>(b.items.values()));
        this.byId = Collections.unmodifiableMap(new HashMap<>(b.items));

        EnumMap<ItemCategory, List<Item>> cats = new EnumMap<>(ItemCategory.class);
        for (ItemCategory c : ItemCategory.values()) cats.put(c, new ArrayList<>());
        for (Item it : items) cats.get(it.category).add(it);
        for (ItemCategory c : ItemCategory.values()) cats.put(c, Collections.unmodifiableList(cats.get(c)));
        this.byCategory = Collections.unmodifiableMap(cats);

        this.sets = Collections.unmodifiableMap(new LinkedHashMap<>(b.sets));
        this.setByItemId = Collections.unmodifiableMap(new HashMap<>(b.setByItemId));
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Item> items() {
        return items;
    }

    public int size() {
        return items.size();
    }

    /** @return item or null */
    public Item item(int id) {
        return byId.get(id);
    }

    public Item item(Integer id) {
        return id == null ? null : byId.get(id);
    }

    public List<Item> itemsOf(ItemCategory category) {
        return byCategory.getOrDefault(category, List.of());
    }

    /** @return set name or null when the item belongs to no set */
    public String setOf(int itemId) {
        return setByItemId.get(itemId);
    }

    /** @return metadata or null when the set has no legality rules */
    public SetMeta setMeta(String setName) {
        return setName == null ? null : sets.get(setName);
    }

    public Map<String, SetMeta> sets() {
        return sets;
    }

    // -------------------- builder --------------------

    public static final class Builder {
        private String version;
        private final LinkedHashMap<Integer, Item> items = new LinkedHashMap<>();
        private final LinkedHashMap<String, SetMeta> sets = new LinkedHashMap<>();
        private final HashMap<Integer, String> setByItemId = new HashMap<>();

        public Builder version(String v) {
            this.version = v;
            return this;
        }

        public Builder item(Item item) {
            Objects.requireNonNull(item, "item");
            Item prev = items.put(item.id, item);
            if (prev != null) log.warn("Duplicate item id {} ('{}' replaced by '{}')", item.id, prev.name, item.name);
            return this;
        }

        public Builder items(Iterable<Item> list) {
            for (Item it : list) item(it);
            return this;
        }

        /**
         * Registers set membership. Legality metadata is stored only when the set has illegal counts.
         */
        public Builder set(String name, List<Integer> memberIds, List<Integer> illegalCounts) {
            Objects.requireNonNull(name, "name");
            if (illegalCounts != null && !illegalCounts.isEmpty()) {
                sets.put(name, new SetMeta(name, new TreeSet<>(illegalCounts)));
            }
            if (memberIds != null) {
                for (Integer id : memberIds) {
                    if (id != null) setByItemId.put(id, name);
                }
            }
            return this;
        }

        public CatalogSnapshot build() {
            CatalogSnapshot snap = new CatalogSnapshot(this);
            log.debug("Catalog built: version={}, items={}, sets={}", snap.version, snap.items.size(), snap.sets.size());
            return snap;
        }
    }
}
