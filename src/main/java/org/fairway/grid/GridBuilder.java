package org.fairway.grid;

import lombok.extern.slf4j.Slf4j;
import org.fairway.geometry.Fairway;
import org.fairway.geometry.Shape;
import org.fairway.geometry.ShapeContainment;
import org.fairway.level.Level;
import org.fairway.level.SlopeField;

import java.util.List;
import java.util.Objects;

/**
 * Rasterizes level geometry into a {@link TerrainGrid}.
 *
 * <p>Each cell is classified by its center point with a fixed precedence:</p>
 * <ol>
 * <li>blocked by walls, water, or posts inflated by a clearance ring;</li>
 * <li>un-blocked again when a bridge covers the center;</li>
 * <li>sand when open (cost raised to 3; overlapping traps do not stack);</li>
 * <li>slope vectors summed over every covering field when open.</li>
 * </ol>
 */
@Slf4j
public final class GridBuilder {
    /** Largest grid a single build may allocate. */
    public static final long MAX_CELLS = 4_000_000L;

    private static final double MIN_POST_CLEARANCE = 6.0d;
    private static final double POST_CLEARANCE_PER_CELL = 0.4d;

    /**
     * Builds the grid for one level.
     *
     * @param level source geometry.
     * @param fairway region to rasterize.
     * @param cellSize cell edge length in pixels, finite and positive.
     * @return immutable grid of {@code max(1, ceil(w/cellSize)) x max(1, ceil(h/cellSize))} cells.
     * @throws IllegalArgumentException when the cell size is invalid or the grid would exceed
     *         {@link #MAX_CELLS} cells.
     */
    public TerrainGrid build(Level level, Fairway fairway, double cellSize) {
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(fairway, "fairway");
        if (!Double.isFinite(cellSize) || cellSize <= 0.0d) {
            throw new IllegalArgumentException("cellSize must be finite and positive, got " + cellSize);
        }

        int cols = dimension(fairway.width(), cellSize);
        int rows = dimension(fairway.height(), cellSize);
        double clearance = postClearance(cellSize);
        GridCell[] cells = new GridCell[checkedCellCount(cols, rows, cellSize)];

        int blocked = 0;
        for (int r = 0; r < rows; r++) {
            double y = fairway.y() + r * cellSize + cellSize / 2.0d;
            for (int c = 0; c < cols; c++) {
                double x = fairway.x() + c * cellSize + cellSize / 2.0d;
                GridCell cell = classify(level, x, y, clearance);
                if (cell.blocked()) {
                    blocked++;
                }
                cells[r * cols + c] = cell;
            }
        }
        log.debug("Rasterized {}x{} grid (cellSize={}, blocked={})", cols, rows, cellSize, blocked);
        return new TerrainGrid(fairway, cellSize, cols, rows, cells);
    }

    /**
     * Checks that the fairway rasterizes within {@link #MAX_CELLS} cells at the given cell size.
     *
     * @return number of cells the grid would hold.
     * @throws IllegalArgumentException when the grid would be larger.
     */
    public static int requireGridSize(Fairway fairway, double cellSize) {
        Objects.requireNonNull(fairway, "fairway");
        return checkedCellCount(dimension(fairway.width(), cellSize), dimension(fairway.height(), cellSize), cellSize);
    }

    private static int checkedCellCount(int cols, int rows, double cellSize) {
        long cellCount = (long) cols * rows;
        if (cellCount > MAX_CELLS) {
            throw new IllegalArgumentException("grid of " + cols + "x" + rows + " cells exceeds "
                    + MAX_CELLS + " cells (cellSize=" + cellSize + ")");
        }
        return (int) cellCount;
    }

    /**
     * Clearance ring added around every post: {@code max(6, round(cellSize * 0.4))}.
     */
    static double postClearance(double cellSize) {
        return Math.max(MIN_POST_CLEARANCE, Math.round(cellSize * POST_CLEARANCE_PER_CELL));
    }

    static int dimension(double extent, double cellSize) {
        double raw = Math.ceil(extent / cellSize);
        if (!(raw >= 1.0d)) {
            return 1;
        }
        return (int) Math.min(raw, Integer.MAX_VALUE);
    }

    private static GridCell classify(Level level, double x, double y, double clearance) {
        boolean blocked = anyContains(level.getWalls(), x, y)
                || anyContains(level.getWaterHazards(), x, y)
                || insidePost(level.getPosts(), x, y, clearance);
        if (blocked && anyContains(level.getBridges(), x, y)) {
            blocked = false;
        }
        if (blocked) {
            return GridCell.BLOCKED;
        }

        double cost = GridCell.BASE_COST;
        boolean sand = anyContains(level.getSandTraps(), x, y);
        if (sand) {
            cost = Math.max(cost, GridCell.SAND_COST);
        }

        double vx = 0.0d;
        double vy = 0.0d;
        double strength = 0.0d;
        for (SlopeField slope : level.getSlopes()) {
            if (!slope.covers(x, y)) {
                continue;
            }
            double s = slope.clampedStrength();
            vx += slope.direction().dx() * s;
            vy += slope.direction().dy() * s;
            strength = Math.max(strength, s);
        }

        if (vx == 0.0d && vy == 0.0d) {
            return sand ? new GridCell(cost, false, true, 0.0d, 0.0d, 0.0d) : GridCell.OPEN;
        }
        if (cost <= GridCell.BASE_COST) {
            cost = GridCell.SLOPE_BASE_COST;
        }
        double magnitude = Math.hypot(vx, vy);
        return new GridCell(
                cost,
                false,
                sand,
                vx / magnitude,
                vy / magnitude,
                Math.min(GridCell.MAX_SLOPE_STRENGTH, strength)
        );
    }

    private static boolean anyContains(List<Shape> shapes, double x, double y) {
        for (Shape shape : shapes) {
            if (shape.contains(x, y)) {
                return true;
            }
        }
        return false;
    }

    private static boolean insidePost(List<Shape> posts, double x, double y, double clearance) {
        for (Shape post : posts) {
            double radius = Level.postRadius(post);
            if (ShapeContainment.circleContains(post.x(), post.y(), radius + clearance, x, y)) {
                return true;
            }
        }
        return false;
    }
}
