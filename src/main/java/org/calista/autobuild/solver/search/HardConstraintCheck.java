package org.calista.autobuild.solver.search;

import org.calista.autobuild.solver.build.BuildSummary;
import org.calista.autobuild.solver.build.SlotAssignment;
import org.calista.autobuild.solver.catalog.CatalogSnapshot;
import org.calista.autobuild.solver.catalog.Item;
import org.calista.autobuild.solver.catalog.Slot;
import org.calista.autobuild.solver.constraints.Constraints;
import org.calista.autobuild.solver.constraints.NumericRange;
import org.calista.autobuild.solver.constraints.Targets;

import java.util.ArrayList;
import java.util.List;

/**
 * HardConstraintCheck — финальная проверка полного билда.
 *
 * <p>Order: must-include presence, per-item legality (locked and must-include items included),
 * illegal set counts, combined attack constraint, thresholds. The first failing group decides
 * the {@link Kind}; failure messages name the check and its numbers.</p>
 */
public final class HardConstraintCheck {

    public enum Kind { OK, ITEM, ATTACK_SPEED, THRESHOLDS }

    private static final HardConstraintCheck PASSED = new HardConstraintCheck(Kind.OK, List.of());

    public final Kind kind;
    public final List<String> failures;

    private HardConstraintCheck(Kind kind, List<String> failures) {
        this.kind = kind;
        this.failures = failures;
    }

    public boolean ok() {
        return kind == Kind.OK;
    }

    public static HardConstraintCheck validate(SlotAssignment slots, CatalogSnapshot catalog, Constraints c, BuildSummary summary) {
        for (Integer id : c.filters.mustIncludeIds) {
            if (!slots.contains(id)) return new HardConstraintCheck(Kind.ITEM, List.of("mustIncludeMissing (" + id + ")"));
        }

        for (Slot s : Slot.ALL) {
            Integer id = slots.get(s);
            if (id == null) continue;
            Item it = catalog.item(id);
            if (it == null) return new HardConstraintCheck(Kind.ITEM, List.of("unknownItem (" + id + ")"));
            if (!c.filters.admits(it)) return new HardConstraintCheck(Kind.ITEM, List.of("itemFiltered (" + it.name + ")"));
        }

        String illegalSet = SetRules.firstIllegalSet(slots, catalog);
        if (illegalSet != null) return new HardConstraintCheck(Kind.ITEM, List.of("illegalSetCombo (" + illegalSet + ")"));

        AttackTargets attack = new AttackTargets(c.filters, null, AttackTierRequirement.of(c.targets.attackTierSpecs()), 0);
        List<String> attackFailures = attack.check(slots, catalog);
        if (!attackFailures.isEmpty()) return new HardConstraintCheck(Kind.ATTACK_SPEED, List.copyOf(attackFailures));

        List<String> thr = thresholdFailures(slots, catalog, c.targets, summary);
        if (!thr.isEmpty()) return new HardConstraintCheck(Kind.THRESHOLDS, List.copyOf(thr));
        return PASSED;
    }

    static List<String> thresholdFailures(SlotAssignment slots, CatalogSnapshot catalog, Targets t, BuildSummary s) {
        List<String> out = new ArrayList<>(2);
        min(out, "minLegacyBaseDps", s.legacyBaseDps, t.minLegacyBaseDps);
        min(out, "minLegacyEhp", s.legacyEhp, t.minLegacyEhp);
        min(out, "minDpsProxy", s.dpsProxy, t.minDpsProxy);
        min(out, "minEhpProxy", s.ehpProxy, t.minEhpProxy);
        min(out, "minMr", s.mr, t.minMr);
        min(out, "minMs", s.ms, t.minMs);
        min(out, "minSpeed", s.speed, t.minSpeed);
        min(out, "minSkillPointTotal", s.skillPointTotal, t.minSkillPointTotal);
        if (t.maxReqTotal != null && s.reqTotal > t.maxReqTotal) {
            out.add("maxReqTotal (" + num(s.reqTotal) + " > " + num(t.maxReqTotal) + ")");
        }

        List<NumericRange> custom = t.customSpecs(false);
        if (custom.isEmpty()) return out;
        List<Item> items = slots.items(catalog);
        for (NumericRange r : custom) {
            double total = 0.0;
            for (Item it : items) total += it.numeric(r.key);
            if (r.hasMin() && total < r.min) out.add(r.key + " (" + num(total) + " < " + num(r.min) + ")");
            if (r.hasMax() && total > r.max) out.add(r.key + " (" + num(total) + " > " + num(r.max) + ")");
        }
        return out;
    }

    private static void min(List<String> out, String name, double value, Double threshold) {
        if (threshold != null && value < threshold) out.add(name + " (" + num(value) + " < " + num(threshold) + ")");
    }

    /** Integral values without a trailing ".0". */
    public static String num(double v) {
        if (Double.isFinite(v) && v == Math.rint(v) && Math.abs(v) < 1e15) return Long.toString((long) v);
        return Double.toString(v);
    }

    @Override
    public String toString() {
        return kind + (failures.isEmpty() ? "" : " " + failures);
    }
}
