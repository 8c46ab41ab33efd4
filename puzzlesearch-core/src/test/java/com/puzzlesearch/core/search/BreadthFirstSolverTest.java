package com.puzzlesearch.core.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class BreadthFirstSolverTest {

    @Test
    void findsShortestPathPastLongerFirstBranch() {
        GraphPuzzle start = GraphPuzzle.graph()
                .edge("a", "b", "g")
                .edge("b", "c")
                .edge("c", "d")
                .edge("d", "g")
                .goal("g")
                .start("a");

        SolveResult<GraphPuzzle> result = new BreadthFirstSolver().search(start);

        assertTrue(result.solved());
        assertEquals(1, result.moveCount());
        assertEquals(List.of("a", "g"), nodes(result.solution()));
        assertSame(SearchStrategy.BREADTH_FIRST, result.strategy());
    }

    @Test
    void returnsInitialStateWhenAlreadySolved() {
        GraphPuzzle.Graph graph = GraphPuzzle.graph().edge("a", "b").goal("a");

        SolveResult<GraphPuzzle> result = new BreadthFirstSolver().search(graph.start("a"));

        assertEquals(0, result.moveCount());
        assertEquals(List.of("a"), nodes(result.solution()));
        assertEquals(0, graph.expansions());
    }

    @Test
    void reportsNoSolutionAfterExhaustingCycle() {
        GraphPuzzle.Graph graph = GraphPuzzle.graph()
                .edge("a", "b")
                .edge("b", "a", "c")
                .edge("c", "a");

        SolveResult<GraphPuzzle> result = new BreadthFirstSolver().search(graph.start("a"));

        assertFalse(result.solved());
        assertTrue(result.path().isEmpty());
        assertEquals(-1, result.moveCount());
        assertEquals(3, result.telemetry().nodesCreated());
        assertEquals(4, result.telemetry().generatedStates());
        assertEquals(2, result.telemetry().duplicateStates());
    }

    @Test
    void failFastInitialStateIsNeverExpanded() {
        GraphPuzzle.Graph graph = GraphPuzzle.graph().edge("a", "g").goal("g").dead("a");

        SolveResult<GraphPuzzle> result = new BreadthFirstSolver().search(graph.start("a"));

        assertFalse(result.solved());
        assertEquals(0, graph.expansions(), "No extension should be generated for a hopeless root");
        assertEquals(0, result.telemetry().expandedStates());
        assertEquals(0, result.telemetry().generatedStates());
        assertEquals(1, result.telemetry().prunedStates());
    }

    @Test
    void createsOneNodePerDistinctState() {
        GraphPuzzle.Graph graph = GraphPuzzle.graph();
        for (int row = 0; row < 3; row++) {
            for (int column = 0; column < 3; column++) {
                String node = "" + row + column;
                if (column < 2) {
                    graph.edge(node, "" + row + (column + 1));
                }
                if (row < 2) {
                    graph.edge(node, "" + (row + 1) + column);
                }
            }
        }

        SolveResult<GraphPuzzle> result = new BreadthFirstSolver().search(graph.start("00"));

        assertFalse(result.solved());
        assertEquals(9, result.telemetry().nodesCreated(), "Each of the 9 cells should be discovered once");
        assertEquals(12, result.telemetry().generatedStates());
        assertEquals(4, result.telemetry().duplicateStates());
        assertEquals(4, result.telemetry().maxDepth());
    }

    @Test
    void pruningOnGenerateKeepsDeadStatesOutOfTheArena() {
        GraphPuzzle.Graph graph = GraphPuzzle.graph()
                .edge("a", "d", "b")
                .edge("d", "e")
                .edge("b", "c")
                .edge("c", "g")
                .goal("g")
                .dead("d");

        SolveResult<GraphPuzzle> pruned = new BreadthFirstSolver(SolverOptions.defaults()).search(graph.start("a"));
        SolveResult<GraphPuzzle> unpruned = new BreadthFirstSolver(SolverOptions.defaults().withPruneOnGenerate(false))
                .search(graph.start("a"));

        assertEquals(List.of("a", "b", "c", "g"), nodes(pruned.solution()));
        assertEquals(List.of("a", "b", "c", "g"), nodes(unpruned.solution()));
        assertEquals(4, pruned.telemetry().nodesCreated());
        assertEquals(5, unpruned.telemetry().nodesCreated());
        assertEquals(1, pruned.telemetry().prunedStates());
        assertEquals(1, unpruned.telemetry().prunedStates());
    }

    @Test
    void frontierHoldsWholeLevel() {
        GraphPuzzle start = GraphPuzzle.graph().binaryTree(4).start("r");

        SolveResult<GraphPuzzle> result = new BreadthFirstSolver().search(start);

        assertFalse(result.solved());
        assertEquals(31, result.telemetry().nodesCreated());
        assertEquals(16, result.telemetry().peakFrontier());
    }

    @Test
    void solveReturnsPathOptional() {
        GraphPuzzle start = GraphPuzzle.graph().edge("a", "b").edge("b", "g").goal("g").start("a");

        assertEquals(List.of("a", "b", "g"), nodes(new BreadthFirstSolver().solve(start).orElseThrow()));
    }

    static List<String> nodes(List<GraphPuzzle> path) {
        return path.stream().map(GraphPuzzle::node).toList();
    }
}
