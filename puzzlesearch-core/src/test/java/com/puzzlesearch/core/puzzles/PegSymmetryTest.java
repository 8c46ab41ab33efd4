package com.puzzlesearch.core.puzzles;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class PegSymmetryTest {

    @Test
    void squareGridsHaveEightSymmetries() {
        assertEquals(8, new PegSymmetry(3, 3).symmetryCount());
        assertEquals(4, new PegSymmetry(2, 3).symmetryCount());
        assertEquals(4, new PegSymmetry(1, 4).symmetryCount());
    }

    @Test
    void everySymmetryIsAPermutation() {
        PegSymmetry[] grids = {new PegSymmetry(3, 3), new PegSymmetry(2, 5), new PegSymmetry(4, 4)};
        for (PegSymmetry grid : grids) {
            int cells = grid.rows() * grid.columns();
            for (int symmetry = 0; symmetry < grid.symmetryCount(); symmetry++) {
                boolean[] hit = new boolean[cells];
                for (int index = 0; index < cells; index++) {
                    int mapped = grid.map(symmetry, index);
                    assertFalse(hit[mapped], "Symmetry " + symmetry + " maps two cells onto " + mapped);
                    hit[mapped] = true;
                }
            }
        }
    }

    @Test
    void quarterTurnRotatesClockwise() {
        PegSymmetry grid = new PegSymmetry(2, 2);
        char[] cells = "abcd".toCharArray();

        assertArrayEquals("cadb".toCharArray(), grid.apply(cells, 4));
        assertArrayEquals("dcba".toCharArray(), grid.apply(cells, 1));
        assertArrayEquals("badc".toCharArray(), grid.apply(cells, 2));
    }

    @Test
    void canonicalFormIsInvariant() {
        PegSymmetry grid = new PegSymmetry(3, 3);
        char[] board = "**.#*...*".toCharArray();
        String canonical = grid.canonical(board);

        for (int symmetry = 0; symmetry < grid.symmetryCount(); symmetry++) {
            assertEquals(canonical, grid.canonical(grid.apply(board, symmetry)));
        }
    }

    @Test
    void rejectsBadArguments() {
        PegSymmetry grid = new PegSymmetry(2, 3);

        assertThrows(IllegalArgumentException.class, () -> new PegSymmetry(0, 3));
        assertThrows(IllegalArgumentException.class, () -> grid.map(4, 0));
        assertThrows(IllegalArgumentException.class, () -> grid.apply(new char[5], 0));
    }
}
