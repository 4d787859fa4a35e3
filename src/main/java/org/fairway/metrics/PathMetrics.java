package org.fairway.metrics;

import org.fairway.grid.CellCoord;
import org.fairway.grid.GridCell;
import org.fairway.grid.TerrainGrid;

import java.util.List;

/**
 * Shape and terrain metrics of one fixed cell path.
 *
 * @param cellCount number of cells on the path.
 * @param turns direction changes between consecutive steps.
 * @param blockedNeighborSum blocked neighbors summed over all path cells.
 * @param corridorDensity {@code blockedNeighborSum / max(1, cellCount)}.
 * @param sandCells open sand cells on the path.
 * @param slopeCells path cells carrying a slope.
 */
public record PathMetrics(
        int cellCount,
        int turns,
        int blockedNeighborSum,
        double corridorDensity,
        int sandCells,
        int slopeCells
) {

    /**
     * Measures a path on its grid.
     */
    public static PathMetrics measure(TerrainGrid grid, List<CellCoord> path) {
        int blockedSum = 0;
        int sand = 0;
        int slope = 0;
        for (CellCoord p : path) {
            blockedSum += grid.blockedNeighborCount(p.col(), p.row());
            GridCell cell = grid.cell(p);
            if (!cell.blocked() && cell.sand()) {
                sand++;
            }
            if (cell.slopeStrength() > 0.0d) {
                slope++;
            }
        }
        return new PathMetrics(
                path.size(),
                countTurns(path),
                blockedSum,
                blockedSum / (double) Math.max(1, path.size()),
                sand,
                slope
        );
    }

    /**
     * Counts direction changes along a path.
     */
    public static int countTurns(List<CellCoord> path) {
        int turns = 0;
        for (int i = 2; i < path.size(); i++) {
            CellCoord a = path.get(i - 2);
            CellCoord b = path.get(i - 1);
            CellCoord c = path.get(i);
            if (b.col() - a.col() != c.col() - b.col() || b.row() - a.row() != c.row() - b.row()) {
                turns++;
            }
        }
        return turns;
    }

    /**
     * Fraction of the path covered by slope, relative to half its length, capped at 1.
     */
    public double slopeCoverage() {
        return Math.min(1.0d, slopeCells / (double) Math.max(1, cellCount / 2));
    }
}
