package org.fairway.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.extern.slf4j.Slf4j;
import org.fairway.grid.CellCoord;
import org.fairway.grid.GridCell;
import org.fairway.grid.TerrainGrid;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Weighted 8-connected A* over a {@link TerrainGrid}.
 *
 * <p>Execution model:</p>
 * <ul>
 * <li>Step weight is 1 (orthogonal) or √2 (diagonal) times the mean cost of both endpoint cells.</li>
 * <li>Slope steps are scaled by {@link SlopeCostModel#searchFactor} for the search priority only.</li>
 * <li>Diagonal steps are rejected when either flanking orthogonal cell is blocked.</li>
 * <li>Priority is {@code g + octile(cell, goal)}; ties pop in first-insertion order.</li>
 * <li>Banned cells from {@link SearchConstraints} are dropped when popped.</li>
 * <li>The start cell is expanded even when blocked, so it may be the one blocked cell of a
 * returned path. A blocked goal is never entered.</li>
 * </ul>
 *
 * <p>The reported path cost is recomputed from raw terrain cost, so it never carries the slope
 * bias used to rank the frontier.</p>
 */
@Slf4j
public final class GridAStarSearch {
    private static final double SQRT2 = Math.sqrt(2.0d);
    private static final int NO_PARENT = -1;

    // E, W, S, N, SE, NE, SW, NW
    private static final int[] DC = {1, -1, 0, 0, 1, 1, -1, -1};
    private static final int[] DR = {0, 0, 1, -1, 1, -1, 1, -1};

    /**
     * Searches without constraints.
     */
    public SearchResult search(TerrainGrid grid, CellCoord start, CellCoord goal) {
        return search(grid, start, goal, SearchConstraints.NONE);
    }

    /**
     * Finds a minimum-cost path from {@code start} to {@code goal}.
     *
     * <p>Out-of-range endpoints are clamped into the grid first.</p>
     *
     * @return found result with path and raw terrain cost, or an unreachable result.
     */
    public SearchResult search(TerrainGrid grid, CellCoord start, CellCoord goal, SearchConstraints constraints) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(goal, "goal");
        SearchConstraints active = constraints == null ? SearchConstraints.NONE : constraints;

        CellCoord from = clampInto(grid, start);
        CellCoord to = clampInto(grid, goal);
        int cols = grid.cols();
        int rows = grid.rows();
        int startKey = grid.key(from);
        int goalKey = grid.key(to);

        double[] gScore = new double[grid.size()];
        Arrays.fill(gScore, Double.POSITIVE_INFINITY);
        int[] parent = new int[grid.size()];
        Arrays.fill(parent, NO_PARENT);

        SearchQueue open = new SearchQueue(grid.size(), grid.size());
        gScore[startKey] = 0.0d;
        open.insert(startKey, 0.0d);

        int expanded = 0;
        while (!open.isEmpty()) {
            SearchState state = open.extractMin();
            int currentKey = state.cellKey;
            open.recycle(state);

            if (active.isBanned(currentKey)) {
                continue;
            }
            if (currentKey == goalKey) {
                List<CellCoord> path = reconstruct(grid, parent, goalKey);
                return new SearchResult(true, path, rawPathCost(grid, path), expanded);
            }
            expanded++;

            int cc = currentKey % cols;
            int cr = currentKey / cols;
            GridCell current = grid.cellAt(currentKey);
            double currentG = gScore[currentKey];

            for (int d = 0; d < DC.length; d++) {
                int dc = DC[d];
                int dr = DR[d];
                int nc = cc + dc;
                int nr = cr + dr;
                if (nc < 0 || nr < 0 || nc >= cols || nr >= rows) {
                    continue;
                }
                GridCell next = grid.cell(nc, nr);
                if (next.blocked()) {
                    continue;
                }
                if (dc != 0 && dr != 0 && (grid.cell(cc + dc, cr).blocked() || grid.cell(cc, cr + dr).blocked())) {
                    continue;
                }

                double stepWeight = dc != 0 && dr != 0 ? SQRT2 : 1.0d;
                double moveCost = stepWeight * ((next.cost() + current.cost()) * 0.5d);
                moveCost *= SlopeCostModel.searchFactor(current, next, dc, dr);

                int nextKey = nr * cols + nc;
                double tentativeG = currentG + moveCost;
                if (tentativeG < gScore[nextKey]) {
                    parent[nextKey] = currentKey;
                    gScore[nextKey] = tentativeG;
                    open.insert(nextKey, tentativeG + octile(nc, nr, to.col(), to.row()));
                }
            }
        }

        log.debug("No path from {} to {} ({} states expanded, {} banned)", from, to, expanded, active.bannedCount());
        return SearchResult.unreachable(expanded);
    }

    /**
     * Octile distance between two cells: admissible for unit orthogonal and √2 diagonal steps.
     */
    public static double octile(int c1, int r1, int c2, int r2) {
        int dc = Math.abs(c1 - c2);
        int dr = Math.abs(r1 - r2);
        int diagonal = Math.min(dc, dr);
        return (Math.max(dc, dr) - diagonal) + diagonal * SQRT2;
    }

    /**
     * Raw terrain cost of a path: sum of {@code stepWeight * arrivalCell.cost}.
     */
    public static double rawPathCost(TerrainGrid grid, List<CellCoord> path) {
        double total = 0.0d;
        for (int i = 1; i < path.size(); i++) {
            CellCoord a = path.get(i - 1);
            CellCoord b = path.get(i);
            double step = a.isDiagonalTo(b) ? SQRT2 : 1.0d;
            total += step * grid.cell(b).cost();
        }
        return total;
    }

    private static List<CellCoord> reconstruct(TerrainGrid grid, int[] parent, int goalKey) {
        IntArrayList keys = new IntArrayList();
        for (int key = goalKey; key != NO_PARENT; key = parent[key]) {
            keys.add(key);
        }
        List<CellCoord> path = new ArrayList<>(keys.size());
        for (int i = keys.size() - 1; i >= 0; i--) {
            path.add(grid.coordOf(keys.getInt(i)));
        }
        return path;
    }

    private static CellCoord clampInto(TerrainGrid grid, CellCoord cell) {
        int col = Math.max(0, Math.min(grid.cols() - 1, cell.col()));
        int row = Math.max(0, Math.min(grid.rows() - 1, cell.row()));
        if (col == cell.col() && row == cell.row()) {
            return cell;
        }
        return new CellCoord(col, row);
    }
}
