package org.calista.autobuild.solver.engine;

import org.calista.autobuild.solver.constraints.Constraints;
import org.calista.autobuild.solver.events.ProgressListener;
import org.calista.autobuild.solver.search.WorkbenchSnapshot;
import org.calista.autobuild.solver.util.CancellationToken;

/**
 * LoadoutSearchEngine — контракт одного запуска поиска.
 *
 * <p>ВАЖНО:
 * <ul>
 *   <li>НЕ ladder: попытки с разными бюджетами живут выше, в RescueOrchestrator</li>
 *   <li>НЕ владеет каталогом / калькулятором: всё приходит снаружи</li>
 * </ul>
 *
 * <p>Один вызов = одни ограничения. Пустой результат не исключение: это {@link SearchOutcome}
 * с {@link org.calista.autobuild.solver.events.ReasonCode}. Исключение только при отмене.</p>
 */
public interface LoadoutSearchEngine {

    /**
     * @param workbench current loadout; locked slots and pinned bins are read from it
     * @param constraints hard filters, targets, weights and budgets of this run
     * @param listener receives progress and diagnostics synchronously
     * @param cancel polled at stage boundaries
     * @throws org.calista.autobuild.solver.util.SearchCancelledException when cancelled
     */
    SearchOutcome search(WorkbenchSnapshot workbench, Constraints constraints, ProgressListener listener, CancellationToken cancel);
}
