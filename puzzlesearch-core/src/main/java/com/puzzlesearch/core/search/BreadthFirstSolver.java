package com.puzzlesearch.core.search;

import com.puzzlesearch.core.PuzzleState;
import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Breadth-first solver. Explores states level by level, so the first solved state dequeued is
 * reached through the minimum possible number of moves.
 *
 * <p>Every discovered node stays in the arena until the run ends; the frontier holds all states
 * of the current depth at once.
 */
public final class BreadthFirstSolver implements Solver {

    private static final Logger LOGGER = Logger.getLogger(BreadthFirstSolver.class.getName());
    private static final int NOT_FOUND = -1;

    private final SolverOptions options;

    public BreadthFirstSolver() {
        this(SolverOptions.defaults());
    }

    public BreadthFirstSolver(SolverOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    @Override
    public SearchStrategy strategy() {
        return SearchStrategy.BREADTH_FIRST;
    }

    @Override
    public <S extends PuzzleState<S>> SolveResult<S> search(S initial) {
        Objects.requireNonNull(initial, "initial");

        SearchTelemetry.Recorder recorder = new SearchTelemetry.Recorder();
        SearchArena<S> arena = new SearchArena<>();
        Set<Object> visited = new HashSet<>();
        Queue<Integer> queue = new ArrayDeque<>();

        int root = arena.addRoot(initial);
        recorder.nodeCreated(0);
        visited.add(initial.canonicalKey());
        queue.add(root);
        recorder.frontier(queue.size());

        int terminal = NOT_FOUND;
        while (!queue.isEmpty()) {
            int current = queue.remove();
            S state = arena.state(current);
            if (state.isSolved()) {
                terminal = current;
                break;
            }
            if (state.failFast()) {
                recorder.pruned();
                continue;
            }

            recorder.expanded();
            logProgress(recorder, queue.size());
            for (S child : state.extensions()) {
                recorder.generated();
                // marked at enqueue time so a state is never queued twice
                if (!visited.add(child.canonicalKey())) {
                    recorder.duplicate();
                    continue;
                }
                if (options.pruneOnGenerate() && child.failFast()) {
                    recorder.pruned();
                    continue;
                }
                int handle = arena.add(child, current);
                recorder.nodeCreated(arena.depth(handle));
                queue.add(handle);
            }
            recorder.frontier(queue.size());
        }

        SearchTelemetry telemetry = recorder.finish();
        SolveResult<S> result = terminal == NOT_FOUND
                ? SolveResult.unsolved(strategy(), telemetry)
                : new SolveResult<>(strategy(), PathReconstructor.reconstruct(arena, terminal), telemetry);

        LOGGER.info(() -> String.format(
                "Breadth-first search %s after expanding %d states (moves=%d, nodes=%d, peakFrontier=%d)",
                result.solved() ? "solved" : "exhausted", telemetry.expandedStates(), result.moveCount(),
                telemetry.nodesCreated(), telemetry.peakFrontier()));
        return result;
    }

    private void logProgress(SearchTelemetry.Recorder recorder, int frontier) {
        long interval = options.progressLogInterval();
        if (interval > 0L && recorder.expandedCount() % interval == 0L && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format("Breadth-first search expanded %d states (frontier=%d)",
                    recorder.expandedCount(), frontier));
        }
    }
}
