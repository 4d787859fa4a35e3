package org.fairway.grid;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.fairway.geometry.Fairway;
import org.fairway.geometry.Point;

import java.util.Objects;

/**
 * Immutable traversability grid rasterized from one level.
 *
 * <p>Cells are stored row-major; the integer key of a cell is {@code row * cols + col}.
 * World coordinates map to cells by flooring and clamping, so any point resolves to a
 * valid cell.</p>
 */
@Getter
@Accessors(fluent = true)
public final class TerrainGrid {
    private static final int[][] NEIGHBOR_OFFSETS = {
            {-1, -1}, {0, -1}, {1, -1},
            {-1, 0}, {1, 0},
            {-1, 1}, {0, 1}, {1, 1}
    };

    private final Fairway fairway;
    private final double cellSize;
    private final int cols;
    private final int rows;
    @Getter(AccessLevel.NONE)
    private final GridCell[] cells;

    TerrainGrid(Fairway fairway, double cellSize, int cols, int rows, GridCell[] cells) {
        this.fairway = Objects.requireNonNull(fairway, "fairway");
        this.cellSize = cellSize;
        this.cols = cols;
        this.rows = rows;
        if (cells.length != cols * rows) {
            throw new IllegalArgumentException("cell array size " + cells.length + " != " + cols + "x" + rows);
        }
        this.cells = cells;
    }

    /**
     * Total number of cells.
     */
    public int size() {
        return cells.length;
    }

    public boolean inBounds(int col, int row) {
        return col >= 0 && row >= 0 && col < cols && row < rows;
    }

    public int key(int col, int row) {
        return row * cols + col;
    }

    public int key(CellCoord cell) {
        return key(cell.col(), cell.row());
    }

    public CellCoord coordOf(int key) {
        return new CellCoord(key % cols, key / cols);
    }

    public GridCell cell(int col, int row) {
        return cells[key(col, row)];
    }

    public GridCell cell(CellCoord coord) {
        return cell(coord.col(), coord.row());
    }

    public GridCell cellAt(int key) {
        return cells[key];
    }

    /**
     * Blocked test that treats out-of-range coordinates as open.
     */
    public boolean isBlocked(int col, int row) {
        return inBounds(col, row) && cells[key(col, row)].blocked();
    }

    /**
     * Maps a world point to its cell, clamping into the grid.
     */
    public CellCoord toCell(double x, double y) {
        int col = clamp((int) Math.floor((x - fairway.x()) / cellSize), cols - 1);
        int row = clamp((int) Math.floor((y - fairway.y()) / cellSize), rows - 1);
        return new CellCoord(col, row);
    }

    public CellCoord toCell(Point point) {
        return toCell(point.x(), point.y());
    }

    /**
     * World-space center of a cell.
     */
    public Point toWorld(int col, int row) {
        return new Point(
                fairway.x() + col * cellSize + cellSize / 2.0d,
                fairway.y() + row * cellSize + cellSize / 2.0d
        );
    }

    public Point toWorld(CellCoord cell) {
        return toWorld(cell.col(), cell.row());
    }

    /**
     * Number of blocked cells among the eight in-range neighbors.
     */
    public int blockedNeighborCount(int col, int row) {
        int count = 0;
        for (int[] offset : NEIGHBOR_OFFSETS) {
            int nc = col + offset[0];
            int nr = row + offset[1];
            if (inBounds(nc, nr) && cells[key(nc, nr)].blocked()) {
                count++;
            }
        }
        return count;
    }

    private static int clamp(int value, int max) {
        if (value < 0) {
            return 0;
        }
        return Math.min(value, max);
    }
}
