package org.calista.autobuild.solver;

import org.calista.autobuild.solver.catalog.AttackSpeed;
import org.calista.autobuild.solver.catalog.CatalogSnapshot;
import org.calista.autobuild.solver.catalog.Item;

/**
 * Small hand-built catalogs shared by the solver tests.
 *
 * <p>Ids: helmets 11-12, chestplate 21-22, leggings 31, boots 41-42, rings 51-53, bracelet 61,
 * necklace 71, wands 81-82. No item has skill requirements, so every combination is wearable.</p>
 */
public final class TestCatalogs {

    public static final int HELMET_A = 11;
    public static final int HELMET_B = 12;
    public static final int CHEST_A = 21;
    public static final int CHEST_B = 22;
    public static final int LEGS = 31;
    public static final int BOOTS_A = 41;
    public static final int BOOTS_B = 42;
    public static final int RING_A = 51;
    public static final int RING_B = 52;
    public static final int RING_C = 53;
    public static final int BRACELET = 61;
    public static final int NECKLACE = 71;
    public static final int WAND_A = 81;
    public static final int WAND_B = 82;

    private TestCatalogs() {}

    /** 2 * 2 * 1 * 2 * 3 * 3 * 1 * 1 * 2 = 144 raw combinations, 96 after ring dedupe. */
    public static CatalogSnapshot.Builder smallBuilder() {
        return CatalogSnapshot.builder()
                .version("test")
                .item(armor(HELMET_A, "helmet", 410, 2))
                .item(armor(HELMET_B, "helmet", 370, 5))
                .item(armor(CHEST_A, "chestplate", 900, 0))
                .item(armor(CHEST_B, "chestplate", 760, 3))
                .item(armor(LEGS, "leggings", 650, 1))
                .item(armor(BOOTS_A, "boots", 330, 0))
                .item(armor(BOOTS_B, "boots", 290, 4))
                .item(armor(RING_A, "ring", 60, 1))
                .item(armor(RING_B, "ring", 45, 2))
                .item(armor(RING_C, "ring", 20, 6))
                .item(armor(BRACELET, "bracelet", 80, 1))
                .item(armor(NECKLACE, "necklace", 120, 0))
                .item(wand(WAND_A, 210, AttackSpeed.NORMAL))
                .item(wand(WAND_B, 185, AttackSpeed.FAST));
    }

    public static CatalogSnapshot small() {
        return smallBuilder().build();
    }

    public static Item armor(int id, String type, double hp, double mr) {
        return Item.builder(id)
                .name(type + "-" + id)
                .type(type)
                .level(60 + id % 10)
                .stat("hp", hp)
                .stat("mr", mr)
                .build();
    }

    public static Item wand(int id, double averageDps, AttackSpeed speed) {
        return Item.builder(id)
                .name("wand-" + id)
                .type("wand")
                .level(70)
                .attackSpeed(speed)
                .stat("averageDps", averageDps)
                .build();
    }
}
