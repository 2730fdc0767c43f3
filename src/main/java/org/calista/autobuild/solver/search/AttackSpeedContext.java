package org.calista.autobuild.solver.search;

import org.calista.autobuild.solver.catalog.AttackSpeed;

import java.util.Arrays;
import java.util.Collection;

/**
 * AttackSpeedContext — достижимость разрешённой итоговой скорости атаки оружия.
 *
 * <p>Exists only when attack speeds are configured and the weapon is already placed before the
 * search starts. Final speed index = clamp(base + fixed atkTier + assigned atkTier).</p>
 */
public final class AttackSpeedContext {

    public final int baseSpeedIndex;
    public final int fixedAtkTierTotal;
    private final int[] allowed;
    private final boolean[] allowedMask;
    /** +1 / -1 toward the nearest allowed index, 0 when the current final index is already allowed. */
    public final int preferredDirection;

    private AttackSpeedContext(int baseSpeedIndex, int fixedAtkTierTotal, int[] allowed, int preferredDirection) {
        this.baseSpeedIndex = baseSpeedIndex;
        this.fixedAtkTierTotal = fixedAtkTierTotal;
        this.allowed = allowed;
        this.allowedMask = new boolean[AttackSpeed.MAX_INDEX + 1];
        for (int a : allowed) allowedMask[a] = true;
        this.preferredDirection = preferredDirection;
    }

    /**
     * @return context or null when no speed is configured or the weapon speed is unknown
     */
    public static AttackSpeedContext create(AttackSpeed weaponSpeed, int fixedAtkTierTotal, Collection<AttackSpeed> allowedSpeeds) {
        if (weaponSpeed == null || allowedSpeeds == null || allowedSpeeds.isEmpty()) return null;
        int[] allowed = allowedSpeeds.stream().mapToInt(AttackSpeed::index).distinct().sorted().toArray();
        if (allowed.length == 0) return null;

        int current = AttackSpeed.clampIndex(weaponSpeed.index() + fixedAtkTierTotal);
        int direction = 0;
        if (Arrays.binarySearch(allowed, current) < 0) {
            int nearest = allowed[0];
            for (int idx : allowed) {
                if (Math.abs(idx - current) < Math.abs(nearest - current)) nearest = idx;
            }
            direction = Integer.compare(nearest, current);
        }
        return new AttackSpeedContext(weaponSpeed.index(), fixedAtkTierTotal, allowed, direction);
    }

    public boolean isAllowed(int finalIndex) {
        return finalIndex >= 0 && finalIndex < allowedMask.length && allowedMask[finalIndex];
    }

    /**
     * True when some total atkTier in the reachable interval lands on an allowed index.
     */
    public boolean canStillReach(int assigned, int remainingMin, int remainingMax) {
        int a = fixedAtkTierTotal + assigned + remainingMin;
        int b = fixedAtkTierTotal + assigned + remainingMax;
        int lo = Math.min(a, b);
        int hi = Math.max(a, b);
        for (int t = lo; t <= hi; t++) {
            if (allowedMask[AttackSpeed.clampIndex(baseSpeedIndex + t)]) return true;
        }
        return false;
    }

    /**
     * Ordering value (higher is better) for nodes that still have to move the weapon speed
     * toward the allowed set. Zero when no direction is needed or every reachable index is allowed.
     *
     * @param amplifier 10 in constraint-only mode, otherwise 1
     */
    public double bias(int assigned, int remainingMin, int remainingMax, double amplifier) {
        if (preferredDirection == 0) return 0.0;
        int total = fixedAtkTierTotal + assigned;
        int minFinal = AttackSpeed.clampIndex(baseSpeedIndex + total + remainingMin);
        int maxFinal = AttackSpeed.clampIndex(baseSpeedIndex + total + remainingMax);
        int lo = Math.min(minFinal, maxFinal);
        int hi = Math.max(minFinal, maxFinal);

        int best = Integer.MAX_VALUE;
        int worst = 0;
        for (int idx = lo; idx <= hi; idx++) {
            int d = Integer.MAX_VALUE;
            for (int a : allowed) d = Math.min(d, Math.abs(a - idx));
            best = Math.min(best, d);
            worst = Math.max(worst, d);
        }
        if (worst == 0) return 0.0;
        int safety = preferredDirection > 0 ? lo : -hi;
        return (-worst * 1000.0 - best * 100.0 + safety) * amplifier;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int a : allowed) {
            if (sb.length() > 0) sb.append('/');
            sb.append(AttackSpeed.values()[a].name());
        }
        return "AttackSpeedContext{base=" + AttackSpeed.values()[baseSpeedIndex] + ", fixed=" + fixedAtkTierTotal
                + ", allowed=" + sb + ", direction=" + preferredDirection + '}';
    }
}
