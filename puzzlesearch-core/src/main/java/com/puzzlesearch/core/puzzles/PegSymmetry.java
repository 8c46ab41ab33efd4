package com.puzzlesearch.core.puzzles;

/**
 * Geometric symmetries of a rectangular peg solitaire grid, represented as permutations of the
 * row-major cell indices. Every grid has four symmetries that keep its dimensions (identity,
 * half turn, horizontal and vertical mirror); square grids additionally have the quarter turns
 * and both diagonal mirrors.
 */
public final class PegSymmetry {

    private final int rows;
    private final int columns;

    /**
     * The first index selects the symmetry, the second the original cell; the stored value is
     * the mapped cell index.
     */
    private final int[][] permutations;

    public PegSymmetry(int rows, int columns) {
        if (rows < 1 || columns < 1) {
            throw new IllegalArgumentException("Grid must have at least one row and column");
        }
        this.rows = rows;
        this.columns = columns;
        int count = rows == columns ? 8 : 4;
        this.permutations = new int[count][rows * columns];

        int maxRow = rows - 1;
        int maxColumn = columns - 1;
        for (int index = 0; index < rows * columns; index++) {
            int r = index / columns;
            int c = index % columns;
            permutations[0][index] = index(r, c);
            permutations[1][index] = index(maxRow - r, maxColumn - c); // half turn
            permutations[2][index] = index(r, maxColumn - c); // mirror left/right
            permutations[3][index] = index(maxRow - r, c); // mirror top/bottom
            if (count == 8) {
                permutations[4][index] = index(c, maxRow - r); // quarter turn
                permutations[5][index] = index(maxColumn - c, r); // three-quarter turn
                permutations[6][index] = index(c, r); // main diagonal
                permutations[7][index] = index(maxColumn - c, maxRow - r); // anti-diagonal
            }
        }
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    public int symmetryCount() {
        return permutations.length;
    }

    /**
     * Returns the cell that {@code index} is mapped to by the given symmetry.
     */
    public int map(int symmetry, int index) {
        checkSymmetry(symmetry);
        return permutations[symmetry][index];
    }

    /**
     * Applies the specified symmetry to a row-major cell array.
     */
    public char[] apply(char[] cells, int symmetry) {
        checkSymmetry(symmetry);
        if (cells.length != rows * columns) {
            throw new IllegalArgumentException("Expected " + rows * columns + " cells but got " + cells.length);
        }
        char[] result = new char[cells.length];
        int[] permutation = permutations[symmetry];
        for (int index = 0; index < cells.length; index++) {
            result[permutation[index]] = cells[index];
        }
        return result;
    }

    /**
     * Returns the canonical representative of the provided cells, defined as the lexicographically
     * smallest rendering under all symmetries of this grid.
     */
    public String canonical(char[] cells) {
        String min = null;
        for (int symmetry = 0; symmetry < permutations.length; symmetry++) {
            String transformed = new String(apply(cells, symmetry));
            if (min == null || transformed.compareTo(min) < 0) {
                min = transformed;
            }
        }
        return min;
    }

    private void checkSymmetry(int symmetry) {
        if (symmetry < 0 || symmetry >= permutations.length) {
            throw new IllegalArgumentException("Symmetry index out of range: " + symmetry);
        }
    }

    private int index(int row, int column) {
        return row * columns + column;
    }
}
