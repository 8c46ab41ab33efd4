package com.puzzlesearch.core.search;

import com.puzzlesearch.core.PuzzleState;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Depth-first solver. Explores one branch to completion before trying its siblings and returns
 * the first solution found, which is not necessarily the shortest.
 *
 * <p>The active path is an explicit stack of lazy extension iterators. The arena only ever holds
 * the nodes of that path: a branch is truncated from it as soon as its iterator is exhausted.
 */
public final class DepthFirstSolver implements Solver {

    private static final Logger LOGGER = Logger.getLogger(DepthFirstSolver.class.getName());
    private static final int NOT_FOUND = -1;

    private final SolverOptions options;

    public DepthFirstSolver() {
        this(SolverOptions.defaults());
    }

    public DepthFirstSolver(SolverOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    @Override
    public SearchStrategy strategy() {
        return SearchStrategy.DEPTH_FIRST;
    }

    @Override
    public <S extends PuzzleState<S>> SolveResult<S> search(S initial) {
        Objects.requireNonNull(initial, "initial");

        SearchTelemetry.Recorder recorder = new SearchTelemetry.Recorder();
        SearchArena<S> arena = new SearchArena<>();
        Set<Object> visited = new HashSet<>();

        int root = arena.addRoot(initial);
        recorder.nodeCreated(0);
        visited.add(initial.canonicalKey());

        int terminal = NOT_FOUND;
        if (initial.isSolved()) {
            terminal = root;
        } else if (initial.failFast()) {
            recorder.pruned();
        } else {
            terminal = explore(arena, visited, recorder);
        }

        SearchTelemetry telemetry = recorder.finish();
        SolveResult<S> result = terminal == NOT_FOUND
                ? SolveResult.unsolved(strategy(), telemetry)
                : new SolveResult<>(strategy(), PathReconstructor.reconstruct(arena, terminal), telemetry);

        LOGGER.info(() -> String.format("Depth-first search %s after expanding %d states (moves=%d, peakPath=%d)",
                result.solved() ? "solved" : "exhausted", telemetry.expandedStates(), result.moveCount(),
                telemetry.peakFrontier()));
        return result;
    }

    private <S extends PuzzleState<S>> int explore(SearchArena<S> arena, Set<Object> visited,
            SearchTelemetry.Recorder recorder) {
        // frame i always belongs to arena handle i
        Deque<Iterator<S>> frames = new ArrayDeque<>();
        frames.push(expand(arena.state(0), recorder));
        recorder.frontier(frames.size());

        while (!frames.isEmpty()) {
            Iterator<S> extensions = frames.peek();
            int current = frames.size() - 1;
            if (!extensions.hasNext()) {
                frames.pop();
                arena.truncate(current);
                continue;
            }

            S child = extensions.next();
            recorder.generated();
            if (!visited.add(child.canonicalKey())) {
                recorder.duplicate();
                continue;
            }

            int handle = arena.add(child, current);
            recorder.nodeCreated(arena.depth(handle));
            if (child.isSolved()) {
                return handle;
            }
            if (child.failFast()) {
                recorder.pruned();
                arena.truncate(handle);
                continue;
            }

            frames.push(expand(child, recorder));
            recorder.frontier(frames.size());
        }
        return NOT_FOUND;
    }

    private <S extends PuzzleState<S>> Iterator<S> expand(S state, SearchTelemetry.Recorder recorder) {
        recorder.expanded();
        long interval = options.progressLogInterval();
        if (interval > 0L && recorder.expandedCount() % interval == 0L && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format("Depth-first search expanded %d states", recorder.expandedCount()));
        }
        return state.extensions().iterator();
    }
}
