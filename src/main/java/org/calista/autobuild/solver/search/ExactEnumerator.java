package org.calista.autobuild.solver.search;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.autobuild.solver.build.SlotAssignment;
import org.calista.autobuild.solver.catalog.Slot;
import org.calista.autobuild.solver.constraints.Constraints;
import org.calista.autobuild.solver.events.ProgressEvent;
import org.calista.autobuild.solver.events.ProgressListener;
import org.calista.autobuild.solver.events.ProgressPhase;
import org.calista.autobuild.solver.util.CancellationToken;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Full enumeration of the pool product for small pools.
 *
 * <p>Depth-first over the slot order with an explicit stack. Only illegal set combos are pruned
 * on the way down; leaves go through the same validation as beam finalization. Stops once the
 * state cap {@code max(maxStates, exhaustiveStateLimit)} is exceeded.</p>
 */
public final class ExactEnumerator {

    private static final Logger log = LogManager.getLogger(ExactEnumerator.class);

    public static final class Result {
        public final List<Candidate> candidates;
        public final RejectStats rejects;
        public final long processedStates;

        Result(List<Candidate> candidates, RejectStats rejects, long processedStates) {
            this.candidates = candidates;
            this.rejects = rejects;
            this.processedStates = processedStates;
        }
    }

    private static final class Frame {
        final int orderIndex;
        final SlotAssignment slots;
        int cursor;
        boolean entered;

        Frame(int orderIndex, SlotAssignment slots) {
            this.orderIndex = orderIndex;
            this.slots = slots;
        }
    }

    private final SearchSpace space;
    private final Finalizer finalizer;
    private final SearchTuning tuning;
    private final ProgressListener listener;
    private final CancellationToken cancel;

    public ExactEnumerator(SearchSpace space, Finalizer finalizer, SearchTuning tuning, ProgressListener listener, CancellationToken cancel) {
        this.space = Objects.requireNonNull(space, "space");
        this.finalizer = Objects.requireNonNull(finalizer, "finalizer");
        this.tuning = Objects.requireNonNull(tuning, "tuning");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.cancel = Objects.requireNonNull(cancel, "cancel");
    }

    public Result run(Constraints constraints) {
        int depth = space.depth();
        long maxStates = Math.max(constraints.budgets.maxStates, constraints.budgets.exhaustiveStateLimit);
        RejectStats rejects = new RejectStats();
        Set<String> seen = new HashSet<>();
        List<Candidate> found = new ArrayList<>();
        long processed = 0;

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(0, space.base));
        while (!stack.isEmpty()) {
            Frame f = stack.peek();
            if (!f.entered) {
                f.entered = true;
                cancel.throwIfCancelled();
                if (processed > maxStates) {
                    stack.pop();
                    continue;
                }
                if (f.orderIndex >= depth) {
                    Candidate c = finalizer.accept(f.slots, constraints, seen, rejects);
                    if (c != null) found.add(c);
                    stack.pop();
                    continue;
                }
            }

            List<PoolEntry> pool = space.pool(f.orderIndex);
            if (f.cursor >= pool.size()) {
                stack.pop();
                continue;
            }
            PoolEntry entry = pool.get(f.cursor++);
            processed++;
            if (processed > maxStates) {
                stack.pop();
                continue;
            }
            if (SetRules.wouldCreateIllegalCombo(entry.id(), f.slots, space.catalog)) continue;

            Slot slot = space.order.get(f.orderIndex);
            if (processed % tuning.exactProgressInterval == 0) {
                listener.onProgress(ProgressEvent.of(ProgressPhase.EXACT_SEARCH, processed, 0, depth, f.orderIndex + 1));
            }
            stack.push(new Frame(f.orderIndex + 1, f.slots.with(slot, entry.id())));
        }

        // an empty run is reported by the caller together with its reason code
        if (!found.isEmpty()) {
            listener.onProgress(ProgressEvent.diagnostics(processed, 0, depth, depth, null,
                    "Exact search produced " + found.size() + " valid builds. Rejected "
                            + rejects.shortSummary() + rejects.hardSplit() + "."));
        }

        found.sort(Candidate.RANKING);
        int limit = Math.max(1, constraints.budgets.topN);
        log.debug("Exact search: processed={} valid={} {}", processed, found.size(), rejects);
        return new Result(found.size() > limit ? new ArrayList<>(found.subList(0, limit)) : found, rejects, processed);
    }
}
