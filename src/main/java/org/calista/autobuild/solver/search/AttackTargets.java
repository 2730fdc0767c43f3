package org.calista.autobuild.solver.search;

import org.calista.autobuild.solver.build.SlotAssignment;
import org.calista.autobuild.solver.catalog.AttackSpeed;
import org.calista.autobuild.solver.catalog.CatalogSnapshot;
import org.calista.autobuild.solver.catalog.Item;
import org.calista.autobuild.solver.catalog.Slot;
import org.calista.autobuild.solver.constraints.AttackSpeedMode;
import org.calista.autobuild.solver.constraints.Filters;
import org.calista.autobuild.solver.constraints.Targets;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * AttackTargets — объединённое ограничение "скорость атаки оружия" + "диапазон atkTier".
 *
 * <p>When both are configured they combine with the OR / AND mode of the filters, otherwise the
 * configured one decides alone. Used for eager pruning during search and for the final check.</p>
 */
public final class AttackTargets {

    private final Set<AttackSpeed> speeds;
    private final AttackSpeedMode mode;
    public final AttackSpeedContext speedContext;
    public final AttackTierRequirement tierRequirement;
    public final int fixedAtkTierTotal;

    public AttackTargets(Filters filters, AttackSpeedContext speedContext, AttackTierRequirement tierRequirement, int fixedAtkTierTotal) {
        Objects.requireNonNull(filters, "filters");
        this.speeds = filters.weaponAttackSpeeds;
        this.mode = filters.attackSpeedMode;
        this.speedContext = speedContext;
        this.tierRequirement = Objects.requireNonNull(tierRequirement, "tierRequirement");
        this.fixedAtkTierTotal = fixedAtkTierTotal;
    }

    /**
     * Builds the targets for a search starting from {@code base}.
     */
    public static AttackTargets of(Filters filters, Targets targets, SlotAssignment base, CatalogSnapshot catalog) {
        int fixed = totalAtkTier(base, catalog);
        AttackSpeedContext ctx = null;
        if (filters.hasAttackSpeeds()) {
            Item weapon = catalog.item(base.get(Slot.WEAPON));
            if (weapon != null) ctx = AttackSpeedContext.create(weapon.attackSpeed, fixed, filters.weaponAttackSpeeds);
        }
        return new AttackTargets(filters, ctx, AttackTierRequirement.of(targets.attackTierSpecs()), fixed);
    }

    public boolean speedConfigured() {
        return !speeds.isEmpty();
    }

    public boolean isConfigured() {
        return speedConfigured() || tierRequirement.configured;
    }

    /** Whether searches need atkTier suffix bounds at all. */
    public boolean needsTierBounds() {
        return speedContext != null || tierRequirement.configured;
    }

    public int preferredDirection() {
        return speedContext == null ? 0 : speedContext.preferredDirection;
    }

    /**
     * Optimistic check for a partial assignment.
     *
     * @param assigned     atkTier total of items placed by the search so far
     * @param remainingMin smallest atkTier the remaining slots can add
     * @param remainingMax largest atkTier the remaining slots can add
     */
    public boolean canStillSatisfy(int assigned, int remainingMin, int remainingMax) {
        boolean speedSet = speedConfigured();
        boolean tierSet = tierRequirement.configured;
        if (!speedSet && !tierSet) return true;

        // weapon not fixed yet: the speed side stays open
        boolean speedReachable = speedSet && (speedContext == null || speedContext.canStillReach(assigned, remainingMin, remainingMax));
        boolean tierReachable = tierSet && tierRequirement.canStillReach(
                fixedAtkTierTotal + assigned + Math.min(remainingMin, remainingMax),
                fixedAtkTierTotal + assigned + Math.max(remainingMin, remainingMax));

        if (speedSet && tierSet) {
            return mode == AttackSpeedMode.AND ? speedReachable && tierReachable : speedReachable || tierReachable;
        }
        return speedSet ? speedReachable : tierReachable;
    }

    /**
     * Final check on a complete assignment.
     *
     * @return failure messages; empty when satisfied or not configured
     */
    public List<String> check(SlotAssignment slots, CatalogSnapshot catalog) {
        boolean speedSet = speedConfigured();
        boolean tierSet = tierRequirement.configured;
        if (!speedSet && !tierSet) return List.of();

        List<String> failures = new ArrayList<>(2);
        int total = totalAtkTier(slots, catalog);

        boolean speedOk = false;
        if (speedSet) {
            AttackSpeed fin = finalWeaponSpeed(slots, catalog, total);
            speedOk = fin != null && speeds.contains(fin);
            if (!speedOk) {
                failures.add("attackSpeed (expected " + speeds.stream().map(Enum::name).collect(Collectors.joining("/")) + " )");
            }
        }
        boolean tierOk = false;
        if (tierSet) {
            tierOk = tierRequirement.isSatisfiedBy(total);
            if (!tierOk) failures.add(tierRequirement.describe(total));
        }

        boolean ok;
        if (speedSet && tierSet) ok = mode == AttackSpeedMode.AND ? speedOk && tierOk : speedOk || tierOk;
        else ok = speedSet ? speedOk : tierOk;
        return ok ? List.of() : failures;
    }

    public String speedsLabel() {
        return speeds.stream().map(Enum::name).collect(Collectors.joining("/"));
    }

    /** Sum of rounded atkTier over every placed item. */
    public static int totalAtkTier(SlotAssignment slots, CatalogSnapshot catalog) {
        int total = 0;
        for (Item it : slots.items(catalog)) total += it.atkTier;
        return total;
    }

    /** @return clamped final weapon speed or null without a weapon (or weapon speed) */
    public static AttackSpeed finalWeaponSpeed(SlotAssignment slots, CatalogSnapshot catalog, int totalAtkTier) {
        Item weapon = catalog.item(slots.get(Slot.WEAPON));
        if (weapon == null || weapon.attackSpeed == null) return null;
        return AttackSpeed.fromIndexClamped(weapon.attackSpeed.index() + totalAtkTier);
    }
}
