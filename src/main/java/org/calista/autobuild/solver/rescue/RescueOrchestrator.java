package org.calista.autobuild.solver.rescue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.autobuild.solver.constraints.Budgets;
import org.calista.autobuild.solver.constraints.Constraints;
import org.calista.autobuild.solver.engine.LoadoutSearchEngine;
import org.calista.autobuild.solver.engine.SearchOutcome;
import org.calista.autobuild.solver.events.ProgressListener;
import org.calista.autobuild.solver.search.WorkbenchSnapshot;
import org.calista.autobuild.solver.util.CancellationToken;
import org.calista.autobuild.solver.util.LogFmt;

import java.util.List;
import java.util.Objects;

/**
 * RescueOrchestrator — лестница попыток поверх одного {@link LoadoutSearchEngine}.
 *
 * <p>ВАЖНО:
 * <ul>
 *   <li>каждая попытка = отдельный полный прогон движка с поднятыми бюджетами</li>
 *   <li>первая непустая попытка побеждает, остальные не запускаются</li>
 *   <li>отмена проверяется в начале каждой ступени и пробрасывается как есть</li>
 * </ul>
 *
 * <p>Если все ступени пусты и заданы пороги (minDpsProxy / minEhpProxy / minSkillPointTotal /
 * custom ranges), запускается финальный threshold rescue с threshold-biased весами.
 * Пустой итог несёт reason code последней попытки.</p>
 */
public final class RescueOrchestrator {

    private static final Logger log = LogManager.getLogger(RescueOrchestrator.class);

    private final LoadoutSearchEngine engine;
    private final List<Attempt> ladder;

    public RescueOrchestrator(LoadoutSearchEngine engine, List<SolverStrategy> strategies, boolean deepFallback) {
        this(engine, AttemptLadder.compose(strategies, deepFallback));
    }

    public RescueOrchestrator(LoadoutSearchEngine engine, List<Attempt> ladder) {
        this.engine = Objects.requireNonNull(engine, "engine");
        Objects.requireNonNull(ladder, "ladder");
        if (ladder.isEmpty()) throw new IllegalArgumentException("ladder must not be empty");
        this.ladder = List.copyOf(ladder);
    }

    public List<Attempt> ladder() {
        return ladder;
    }

    public SearchOutcome run(WorkbenchSnapshot workbench, Constraints base, ProgressListener listener, CancellationToken cancel) {
        Objects.requireNonNull(workbench, "workbench");
        Objects.requireNonNull(base, "base");
        ProgressListener out = listener == null ? ProgressListener.NOOP : listener;
        CancellationToken c = cancel == null ? CancellationToken.none() : cancel;

        SearchOutcome last = null;
        long states = 0L;
        int tier = 0;
        while (tier < ladder.size()) {
            c.throwIfCancelled();
            Attempt attempt = ladder.get(tier);
            Constraints pass = attempt.apply(base);
            String label = attempt.label + " (" + (tier + 1) + "/" + ladder.size() + ")";
            log.info("{} topK={} beam={} maxStates={}", label,
                    pass.budgets.topKPerSlot, pass.budgets.beamWidth, pass.budgets.maxStates);

            SearchOutcome r = engine.search(workbench, pass, tagging(out, attempt.label), c);
            states += r.processedStates;
            if (!r.isEmpty()) {
                log.info("{} -> {} candidates", label, r.candidates.size());
                return r.withAttempt(attempt.label);
            }
            log.info("{} -> empty, reason={}", label, r.reasonCode);
            last = r.withAttempt(attempt.label);
            tier++;
        }

        if (base.targets.hasLadderRescueThreshold()) {
            c.throwIfCancelled();
            Attempt attempt = AttemptLadder.THRESHOLD_RESCUE;
            Budgets b = base.budgets;
            Constraints pass = base.toBuilder()
                    .weights(base.weights.thresholdBiased(base.targets))
                    .budgets(b.toBuilder()
                            .topKPerSlot(Math.max(b.topKPerSlot, attempt.topKPerSlot))
                            .beamWidth(Math.max(b.beamWidth, attempt.beamWidth))
                            .maxStates(Math.max(b.maxStates, attempt.maxStates))
                            .build())
                    .build();
            log.info("{} topK={} beam={} maxStates={}", attempt.label,
                    pass.budgets.topKPerSlot, pass.budgets.beamWidth, pass.budgets.maxStates);

            SearchOutcome r = engine.search(workbench, pass, tagging(out, attempt.label), c);
            states += r.processedStates;
            if (!r.isEmpty()) return r.withAttempt(attempt.label);
            last = r.withAttempt(attempt.label);
        }

        SearchOutcome result = SearchOutcome.empty(last.reasonCode, states, last.detail).withAttempt(last.attempt);
        if (log.isInfoEnabled()) {
            SearchOutcome f = result;
            long total = states;
            log.info("\n{}", LogFmt.box("No valid builds", b -> b
                    .kv("reason", f.reasonCode.wireName())
                    .kv("attempts", String.valueOf(ladder.size()))
                    .kv("states", String.valueOf(total))
                    .sep()
                    .line(f.detail == null ? "" : f.detail)));
        }
        return result;
    }

    private static ProgressListener tagging(ProgressListener out, String label) {
        return e -> out.onProgress(e.tagged(label));
    }
}
