package org.calista.autobuild.solver.constraints;

import java.util.Objects;

/**
 * Constraints — полный набор ограничений одного запуска поиска.
 *
 * <p>Immutable. Sub-structs default to their own defaults, so
 * {@code Constraints.builder().build()} is a valid unconstrained request. Rescue passes derive
 * modified copies through {@link #toBuilder()}.</p>
 */
public final class Constraints {

    public final Filters filters;
    public final Targets targets;
    public final Weights weights;
    public final Budgets budgets;
    /** Score purely by custom range contribution; generic damage / ehp terms are ignored by rough scoring. */
    public final boolean constraintOnlyMode;

    private Constraints(Builder b) {
        this.filters = Objects.requireNonNull(b.filters, "filters");
        this.targets = Objects.requireNonNull(b.targets, "targets");
        this.weights = Objects.requireNonNull(b.weights, "weights");
        this.budgets = Objects.requireNonNull(b.budgets, "budgets");
        this.constraintOnlyMode = b.constraintOnlyMode;
    }

    public static Constraints defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .filters(filters)
                .targets(targets)
                .weights(weights)
                .budgets(budgets)
                .constraintOnlyMode(constraintOnlyMode);
    }

    /** Copy with new budgets. */
    public Constraints withBudgets(Budgets b) {
        return toBuilder().budgets(b).build();
    }

    /** Copy with new weights. */
    public Constraints withWeights(Weights w) {
        return toBuilder().weights(w).build();
    }

    @Override
    public String toString() {
        return "Constraints{" + budgets + ", level=" + filters.level + ", class=" + filters.characterClass
                + ", mustInclude=" + filters.mustIncludeIds + ", constraintOnly=" + constraintOnlyMode + "}";
    }

    public static final class Builder {
        private Filters filters = Filters.DEFAULTS;
        private Targets targets = Targets.NONE;
        private Weights weights = Weights.DEFAULTS;
        private Budgets budgets = Budgets.DEFAULTS;
        private boolean constraintOnlyMode;

        private Builder() {}

        public Builder filters(Filters v) { this.filters = v; return this; }
        public Builder targets(Targets v) { this.targets = v; return this; }
        public Builder weights(Weights v) { this.weights = v; return this; }
        public Builder budgets(Budgets v) { this.budgets = v; return this; }
        public Builder constraintOnlyMode(boolean v) { this.constraintOnlyMode = v; return this; }

        public Constraints build() {
            return new Constraints(this);
        }
    }
}
