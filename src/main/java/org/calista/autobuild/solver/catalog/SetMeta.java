package org.calista.autobuild.solver.catalog;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Set legality metadata: piece counts (1-based) that may not be worn together.
 */
public final class SetMeta {
    public final String name;
    public final Set<Integer> illegalCounts;

    public SetMeta(String name, Set<Integer> illegalCounts) {
        this.name = Objects.requireNonNull(name, "name");
        this.illegalCounts = Collections.unmodifiableSet(new TreeSet<>(Objects.requireNonNull(illegalCounts, "illegalCounts")));
    }

    public boolean isIllegal(int pieceCount) {
        return illegalCounts.contains(pieceCount);
    }

    @Override
    public String toString() {
        return "SetMeta{" + name + ", illegal=" + illegalCounts + '}';
    }
}
