package com.puzzlesearch.core.search;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.puzzlesearch.core.PuzzleState;
import java.util.List;

/**
 * Shared checks for solution paths returned by the solvers.
 */
public final class PathAssertions {

    private PathAssertions() {
    }

    /**
     * Asserts that the path starts at {@code initial}, ends in a solved state and that every step
     * is one legal move.
     */
    public static <S extends PuzzleState<S>> void assertValidSolution(S initial, List<S> path) {
        assertFalse(path.isEmpty(), "A solution path holds at least the initial state");
        assertTrue(path.get(0).equals(initial), "Path should start at the initial state");
        assertTrue(path.get(path.size() - 1).isSolved(), "Path should end in a solved state");
        for (int step = 1; step < path.size(); step++) {
            S previous = path.get(step - 1);
            S next = path.get(step);
            boolean reachable = false;
            for (S extension : previous.extensions()) {
                if (extension.equals(next)) {
                    reachable = true;
                    break;
                }
            }
            assertTrue(reachable, "Step " + step + " is not a single legal move:\n" + previous + "\n->\n" + next);
        }
    }
}
