package org.calista.autobuild.solver.rescue;

import org.calista.autobuild.solver.constraints.Budgets;
import org.calista.autobuild.solver.constraints.Constraints;

import java.util.Objects;

/**
 * One tier of the attempt ladder: budget floors applied on top of the caller's constraints.
 *
 * <p>Every floor is applied as {@code max(base, floor)}, so a tier never shrinks what the caller
 * asked for. {@code exhaustiveStateLimit} &gt; 0 also switches small-pool exact enumeration on.</p>
 */
public final class Attempt {

    public final String label;
    public final int topKPerSlot;
    public final int beamWidth;
    public final long maxStates;
    public final boolean rescueWeights;
    /** 0 = keep the caller's exhaustive settings. */
    public final long exhaustiveStateLimit;

    public Attempt(String label, int topKPerSlot, int beamWidth, long maxStates, boolean rescueWeights, long exhaustiveStateLimit) {
        this.label = Objects.requireNonNull(label, "label");
        if (topKPerSlot < 0) throw new IllegalArgumentException("attempt.topKPerSlot must be >= 0");
        if (beamWidth < 0) throw new IllegalArgumentException("attempt.beamWidth must be >= 0");
        if (maxStates < 0) throw new IllegalArgumentException("attempt.maxStates must be >= 0");
        if (exhaustiveStateLimit < 0) throw new IllegalArgumentException("attempt.exhaustiveStateLimit must be >= 0");
        this.topKPerSlot = topKPerSlot;
        this.beamWidth = beamWidth;
        this.maxStates = maxStates;
        this.rescueWeights = rescueWeights;
        this.exhaustiveStateLimit = exhaustiveStateLimit;
    }

    public Constraints apply(Constraints base) {
        Objects.requireNonNull(base, "base");
        Budgets b = base.budgets;
        Budgets.Builder nb = b.toBuilder()
                .topKPerSlot(Math.max(b.topKPerSlot, topKPerSlot))
                .beamWidth(Math.max(b.beamWidth, beamWidth))
                .maxStates(Math.max(b.maxStates, maxStates));
        if (exhaustiveStateLimit > 0) {
            nb.useExhaustiveSmallPool(true).exhaustiveStateLimit(Math.max(b.exhaustiveStateLimit, exhaustiveStateLimit));
        }
        Constraints.Builder out = base.toBuilder().budgets(nb.build());
        if (rescueWeights) out.weights(base.weights.rescue());
        return out.build();
    }

    @Override
    public String toString() {
        return label + "{topK>=" + topKPerSlot + ", beam>=" + beamWidth + ", states>=" + maxStates
                + (rescueWeights ? ", rescue" : "")
                + (exhaustiveStateLimit > 0 ? ", exhaustive>=" + exhaustiveStateLimit : "") + "}";
    }
}
