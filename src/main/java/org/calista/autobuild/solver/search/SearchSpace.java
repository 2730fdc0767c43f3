package org.calista.autobuild.solver.search;

import org.calista.autobuild.solver.build.SlotAssignment;
import org.calista.autobuild.solver.catalog.CatalogSnapshot;
import org.calista.autobuild.solver.catalog.Item;
import org.calista.autobuild.solver.catalog.Slot;
import org.calista.autobuild.solver.constraints.AttackSpeedMode;
import org.calista.autobuild.solver.constraints.Constraints;
import org.calista.autobuild.solver.constraints.NumericRange;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * SearchSpace — всё, что фиксируется до первого шага поиска.
 *
 * <p>Base slots (locked + must-include), slot order, per-slot pools, focus stats, the attack
 * target and the custom ranges used for pruning, with their suffix bounds. Shared read-only by
 * every pass of one engine run.</p>
 */
public final class SearchSpace {

    public final CatalogSnapshot catalog;
    public final SlotAssignment base;
    public final List<Slot> order;
    public final Map<Slot, List<PoolEntry>> pools;
    public final FocusStats focus;
    public final AttackTargets attack;
    /** Custom ranges the beams prune on (see {@link #pruningSpecs}). */
    public final List<NumericRange> specs;
    public final BoundOracles bounds;
    private final double[] baseCustomTotals;
    private final double attackAmplifier;

    public SearchSpace(CatalogSnapshot catalog, Constraints constraints, SlotAssignment base, List<Slot> order,
                       Map<Slot, List<PoolEntry>> pools, FocusStats focus, AttackTargets attack) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.base = Objects.requireNonNull(base, "base");
        this.order = List.copyOf(order);
        this.pools = Map.copyOf(pools);
        this.focus = Objects.requireNonNull(focus, "focus");
        this.attack = Objects.requireNonNull(attack, "attack");
        this.specs = pruningSpecs(constraints);

        String[] keys = new String[specs.size()];
        for (int i = 0; i < keys.length; i++) keys[i] = specs.get(i).key;
        this.bounds = BoundOracles.build(this.order, this.pools, List.of(keys), focus);
        this.baseCustomTotals = new double[keys.length];
        for (Item it : base.items(catalog)) {
            for (int i = 0; i < keys.length; i++) baseCustomTotals[i] += it.numeric(keys[i]);
        }
        this.attackAmplifier = constraints.constraintOnlyMode ? 10.0 : 1.0;
    }

    /**
     * Custom ranges checked during search. {@code atkTier} rows are left out when attack speeds
     * are configured in OR mode, since the speed alone may satisfy the attack target.
     */
    public static List<NumericRange> pruningSpecs(Constraints c) {
        boolean skipAtkTier = c.filters.attackSpeedMode == AttackSpeedMode.OR && c.filters.hasAttackSpeeds();
        return c.targets.customSpecs(!skipAtkTier);
    }

    public int depth() {
        return order.size();
    }

    public List<PoolEntry> pool(int orderIndex) {
        return pools.getOrDefault(order.get(orderIndex), List.of());
    }

    public double[] baseCustomTotals() {
        return baseCustomTotals.clone();
    }

    double[] addCustom(double[] totals, Item item) {
        double[] next = totals.clone();
        for (int i = 0; i < next.length; i++) next[i] += item.numeric(specs.get(i).key);
        return next;
    }

    /** Attack target still reachable once slots {@code nextIndex..} are filled. */
    boolean attackReachable(int atkAssigned, int nextIndex) {
        if (!attack.needsTierBounds()) return true;
        return attack.canStillSatisfy(atkAssigned, bounds.tierMinSuffix(nextIndex), bounds.tierMaxSuffix(nextIndex));
    }

    boolean customReachable(double[] totals, int nextIndex) {
        return specs.isEmpty() || bounds.customRangesReachable(totals, specs, nextIndex);
    }

    boolean focusReachable(double[] support, int nextIndex) {
        return focus.isEmpty() || focus.canStillMeetNeed(support, bounds.supportSuffix(nextIndex));
    }

    double attackBias(int atkAssigned, int nextIndex) {
        AttackSpeedContext ctx = attack.speedContext;
        if (ctx == null) return 0.0;
        return ctx.bias(atkAssigned, bounds.tierMinSuffix(nextIndex), bounds.tierMaxSuffix(nextIndex), attackAmplifier);
    }

    double customDeficit(double[] totals) {
        return BoundOracles.customDeficit(totals, specs);
    }

    /** Pool-size product, or a value above {@code cap} as soon as it exceeds it; 0 if any pool is empty. */
    public long combinationCount(long cap) {
        long product = 1;
        for (Slot s : order) {
            int size = pools.getOrDefault(s, List.of()).size();
            if (size == 0) return 0;
            product *= size;
            if (product > cap) return product;
        }
        return product;
    }

    BeamNode root() {
        return new BeamNode(base, 0, 0.0, bounds.roughSuffix(0), 0, baseCustomTotals(),
                new double[focus.size()], 0.0, 0.0, 0.0, 0.0);
    }
}
