package org.calista.autobuild.solver.search;

import org.calista.autobuild.solver.catalog.Item;

import java.util.Objects;

/**
 * One item of a per-slot candidate pool together with its rough score.
 */
public final class PoolEntry {
    public final Item item;
    public final double rough;

    public PoolEntry(Item item, double rough) {
        this.item = Objects.requireNonNull(item, "item");
        this.rough = rough;
    }

    public int id() {
        return item.id;
    }

    @Override
    public String toString() {
        return item.id + ":" + rough;
    }
}
