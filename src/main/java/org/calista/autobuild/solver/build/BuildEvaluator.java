package org.calista.autobuild.solver.build;

import org.calista.autobuild.solver.catalog.CharacterClass;

/**
 * BuildEvaluator — контракт внешнего калькулятора билда.
 *
 * <p>Поиск не знает формул: он только вызывает evaluate() на полных сборках (финализация)
 * и partialFeasibility() на частичных (feasibility-biased beam и детерминированный fallback).</p>
 */
public interface BuildEvaluator {

    /**
     * Full evaluation of an assignment.
     *
     * @param slots          placed items (empty slots allowed)
     * @param level          character level
     * @param characterClass class or null to derive it from the weapon
     * @param tomeMode       skill point tome assumption
     */
    BuildSummary evaluate(SlotAssignment slots, int level, CharacterClass characterClass, TomeMode tomeMode);

    /**
     * Wearability of the items placed so far, ignoring empty slots.
     */
    SkillPointFeasibility.Result partialFeasibility(SlotAssignment slots, int level, TomeMode tomeMode);
}
