package org.fairway.grid;

/**
 * Grid cell coordinate.
 *
 * @param col column index.
 * @param row row index.
 */
public record CellCoord(int col, int row) {

    /**
     * Returns whether {@code other} is one of the eight neighbors of this cell.
     */
    public boolean isAdjacentTo(CellCoord other) {
        int dc = Math.abs(other.col - col);
        int dr = Math.abs(other.row - row);
        return Math.max(dc, dr) == 1;
    }

    /**
     * Returns whether the step to {@code other} is diagonal.
     */
    public boolean isDiagonalTo(CellCoord other) {
        return other.col != col && other.row != row;
    }

    @Override
    public String toString() {
        return "(" + col + "," + row + ")";
    }
}
