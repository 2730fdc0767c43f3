package org.calista.autobuild.solver.search;

import org.calista.autobuild.solver.build.SlotAssignment;

/**
 * Partial assignment inside a beam.
 *
 * <p>{@code orderIndex} slots of the slot order are filled; {@code bound} is the rough score so
 * far plus the optimistic suffix of the rest. The feasibility pass also tracks the cheapest
 * hand-assigned skill points of the placed items and the focus-stat support collected so far.
 * Sort keys ({@code attackBias}, the deficits) are computed once when the node is created.</p>
 */
final class BeamNode {
    final SlotAssignment slots;
    final int orderIndex;
    final double rough;
    final double bound;
    final int atkAssigned;
    final double[] customTotals;
    final double[] focusSupport;
    /** +Inf when the placed items cannot be worn together; 0 outside the feasibility pass. */
    final double feasibilityAssigned;

    final double attackBias;
    final double customDeficit;
    final double supportDeficit;

    BeamNode(SlotAssignment slots, int orderIndex, double rough, double bound, int atkAssigned,
             double[] customTotals, double[] focusSupport, double feasibilityAssigned,
             double attackBias, double customDeficit, double supportDeficit) {
        this.slots = slots;
        this.orderIndex = orderIndex;
        this.rough = rough;
        this.bound = bound;
        this.atkAssigned = atkAssigned;
        this.customTotals = customTotals;
        this.focusSupport = focusSupport;
        this.feasibilityAssigned = feasibilityAssigned;
        this.attackBias = attackBias;
        this.customDeficit = customDeficit;
        this.supportDeficit = supportDeficit;
    }

    String dedupKey() {
        return orderIndex + "|" + slots.canonicalKey();
    }
}
