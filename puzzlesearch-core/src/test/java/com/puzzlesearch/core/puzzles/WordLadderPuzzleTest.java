package com.puzzlesearch.core.puzzles;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.puzzlesearch.core.MalformedPuzzleException;
import com.puzzlesearch.core.search.BreadthFirstSolver;
import com.puzzlesearch.core.search.DepthFirstSolver;
import com.puzzlesearch.core.search.PathAssertions;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class WordLadderPuzzleTest {

    @Test
    void breadthFirstFindsCatToDogLadder() {
        WordLadderPuzzle start = new WordLadderPuzzle("cat", "dog", Set.of("cat", "cot", "cog", "dog"));

        List<WordLadderPuzzle> path = new BreadthFirstSolver().solve(start).orElseThrow();

        assertEquals(List.of("cat", "cot", "cog", "dog"), words(path));
        PathAssertions.assertValidSolution(start, path);
    }

    @Test
    void depthFirstLadderIsValid() {
        WordLadderPuzzle start = new WordLadderPuzzle("cold", "warm",
                Set.of("cold", "cord", "card", "ward", "warm", "word", "worm", "corm", "wold"));

        List<WordLadderPuzzle> path = new DepthFirstSolver().solve(start).orElseThrow();
        List<WordLadderPuzzle> shortest = new BreadthFirstSolver().solve(start).orElseThrow();

        PathAssertions.assertValidSolution(start, path);
        PathAssertions.assertValidSolution(start, shortest);
        assertTrue(shortest.size() <= path.size());
    }

    @Test
    void extensionsChangeOneLetterInPositionThenAlphabeticalOrder() {
        WordLadderPuzzle puzzle = new WordLadderPuzzle("cost", "save",
                Set.of("cost", "cast", "cbst", "ccst", "case", "cave", "save", "most", "cosy"));

        List<String> extensions = new ArrayList<>();
        for (WordLadderPuzzle extension : puzzle.extensions()) {
            extensions.add(extension.word());
        }

        assertEquals(List.of("most", "cast", "cbst", "ccst", "cosy"), extensions);
    }

    @Test
    void failsFastWhenTargetIsUnreachableByConstruction() {
        assertTrue(new WordLadderPuzzle("cat", "dog", Set.of("cat", "cot")).failFast(),
                "Target missing from dictionary");
        assertTrue(new WordLadderPuzzle("cat", "door", Set.of("cat", "door")).failFast(),
                "Different word lengths");
        assertFalse(new WordLadderPuzzle("cat", "dog", Set.of("cat", "dog")).failFast());
        assertFalse(new WordLadderPuzzle("dog", "dog", Set.of()).failFast());
    }

    @Test
    void solvedWhenWordMatchesTarget() {
        assertTrue(new WordLadderPuzzle("save", "save", Set.of("save")).isSolved());
        assertFalse(new WordLadderPuzzle("cave", "save", Set.of("save")).isSolved());
    }

    @Test
    void equalityCoversWordsAndDictionary() {
        WordLadderPuzzle first = new WordLadderPuzzle("cost", "save", Set.of("cost", "cast", "save"));
        WordLadderPuzzle second = new WordLadderPuzzle("cost", "save", List.of("save", "cast", "cost"));
        WordLadderPuzzle widerDictionary = new WordLadderPuzzle("cost", "save", Set.of("cost", "cast", "save", "a"));
        WordLadderPuzzle reversed = new WordLadderPuzzle("save", "cost", Set.of("cost", "cast", "save"));

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, widerDictionary);
        assertNotEquals(first, reversed);
        assertEquals("cost -> save", first.toString());
    }

    @Test
    void rejectsMalformedWords() {
        assertThrows(MalformedPuzzleException.class, () -> new WordLadderPuzzle("", "dog", Set.of("dog")));
        assertThrows(MalformedPuzzleException.class, () -> new WordLadderPuzzle("Cat", "dog", Set.of("dog")));
        assertThrows(MalformedPuzzleException.class, () -> new WordLadderPuzzle("cat", "dog", Set.of("d0g")));
        assertThrows(MalformedPuzzleException.class, () -> new WordLadderPuzzle("cat", "dog", null));
    }

    private static List<String> words(List<WordLadderPuzzle> path) {
        return path.stream().map(WordLadderPuzzle::word).toList();
    }
}
