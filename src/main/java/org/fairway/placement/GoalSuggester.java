package org.fairway.placement;

import lombok.extern.slf4j.Slf4j;
import org.fairway.config.HeuristicsConfig;
import org.fairway.geometry.Fairway;
import org.fairway.geometry.Point;
import org.fairway.geometry.Shape;
import org.fairway.grid.CellCoord;
import org.fairway.grid.GridBuilder;
import org.fairway.grid.TerrainGrid;
import org.fairway.level.Level;
import org.fairway.metrics.PathMetrics;
import org.fairway.search.GridAStarSearch;
import org.fairway.search.SearchResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Scans the grid for cup placements that produce non-trivial holes.
 *
 * <p>A cell qualifies when it is open, outside the edge margin, far enough from the tee, reachable,
 * not nearly straight, has enough turns and lies in the optional candidate region. Qualifying cells
 * are scored by {@code length + turns * 2 * cellSize + blockedNeighbors * bankWeight} and picked
 * greedily, highest first, keeping a minimum spacing.</p>
 */
@Slf4j
public final class GoalSuggester {
    private final GridBuilder gridBuilder;
    private final GridAStarSearch search;

    public GoalSuggester() {
        this(new GridBuilder(), new GridAStarSearch());
    }

    public GoalSuggester(GridBuilder gridBuilder, GridAStarSearch search) {
        this.gridBuilder = Objects.requireNonNull(gridBuilder, "gridBuilder");
        this.search = Objects.requireNonNull(search, "search");
    }

    /**
     * Returns up to {@code count} cup candidates, best first.
     */
    public List<CupCandidate> suggest(Level level, Fairway fairway, double cellSize, int count, HeuristicsConfig config) {
        Objects.requireNonNull(config, "config");
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative, got " + count);
        }
        TerrainGrid grid = gridBuilder.build(level, fairway, cellSize);
        CellCoord start = grid.toCell(level.getTee());
        double edgeMargin = config.resolveEdgeMargin(cellSize);
        double minDistance = config.resolveMinDistancePx(fairway);
        double bankWeight = config.resolveGoalBankWeight(cellSize);
        Shape region = config.getCandidateRegion();

        List<CupCandidate> scored = new ArrayList<>();
        for (int r = 0; r < grid.rows(); r++) {
            for (int c = 0; c < grid.cols(); c++) {
                if (grid.cell(c, r).blocked()) {
                    continue;
                }
                Point center = grid.toWorld(c, r);
                if (fairway.isNearEdge(center.x(), center.y(), edgeMargin)) {
                    continue;
                }
                double distance = level.getTee().distanceTo(center);
                if (distance < minDistance) {
                    continue;
                }
                SearchResult result = search.search(grid, start, new CellCoord(c, r));
                if (!result.found()) {
                    continue;
                }
                double lengthPx = result.pathCost() * cellSize;
                if (lengthPx < distance * config.getMinStraightnessRatio()) {
                    continue;
                }
                PathMetrics metrics = PathMetrics.measure(grid, result.path());
                if (metrics.turns() < config.getMinTurns()) {
                    continue;
                }
                if (region != null && !region.contains(center.x(), center.y())) {
                    continue;
                }
                double score = lengthPx
                        + metrics.turns() * (cellSize * 2.0d)
                        + metrics.blockedNeighborSum() * bankWeight;
                scored.add(new CupCandidate(center, score, lengthPx, metrics.turns()));
            }
        }

        scored.sort(Comparator.comparingDouble(CupCandidate::score).reversed());
        double minSeparation = cellSize * config.getMinSeparationCells();
        List<CupCandidate> picked = new ArrayList<>();
        for (CupCandidate candidate : scored) {
            if (picked.size() >= count) {
                break;
            }
            if (tooClose(candidate, picked, minSeparation)) {
                continue;
            }
            picked.add(candidate);
        }
        log.debug("Cup suggestion kept {} of {} qualifying cells", picked.size(), scored.size());
        return picked;
    }

    private static boolean tooClose(CupCandidate candidate, List<CupCandidate> picked, double minSeparation) {
        for (CupCandidate p : picked) {
            if (p.point().distanceTo(candidate.point()) < minSeparation) {
                return true;
            }
        }
        return false;
    }
}
