package org.calista.autobuild.solver.search;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Dual-lane merge: the primary (score-oriented) lane fills its share of the beam first, the hard
 * (constraint-deficit) lane fills the rest, then whatever is left of the primary lane.
 * Duplicates by {@code orderIndex|canonicalKey} are dropped and do not count toward the width.
 */
final class LaneMerger {

    private LaneMerger() {}

    static List<BeamNode> merge(List<BeamNode> primary, List<BeamNode> hard, int beamWidth, double primaryShare) {
        int width = Math.max(1, beamWidth);
        int primaryTarget = (int) Math.max(1, Math.min(width, Math.round(width * primaryShare)));
        List<BeamNode> merged = new ArrayList<>(Math.min(width, primary.size() + hard.size()));
        Set<String> seen = new HashSet<>();
        int i = 0;
        int j = 0;

        while (merged.size() < width && (i < primary.size() || j < hard.size())) {
            if (merged.size() < primaryTarget && i < primary.size()) {
                push(merged, seen, primary.get(i++));
            } else if (j < hard.size()) {
                push(merged, seen, hard.get(j++));
            } else if (i < primary.size()) {
                push(merged, seen, primary.get(i++));
            } else {
                break;
            }
        }
        return merged;
    }

    private static void push(List<BeamNode> merged, Set<String> seen, BeamNode node) {
        if (seen.add(node.dedupKey())) merged.add(node);
    }
}
