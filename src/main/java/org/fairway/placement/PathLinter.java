package org.fairway.placement;

import lombok.extern.slf4j.Slf4j;
import org.fairway.config.HeuristicsConfig;
import org.fairway.geometry.Fairway;
import org.fairway.grid.GridBuilder;
import org.fairway.grid.TerrainGrid;
import org.fairway.level.Cup;
import org.fairway.level.Level;
import org.fairway.metrics.PathMetrics;
import org.fairway.search.GridAStarSearch;
import org.fairway.search.SearchResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Flags suspicious cup placements.
 *
 * <p>Warnings are independent of each other, except that an unreachable cup yields only the
 * reachability warning. Thresholds come from the {@code lint*} settings only, so tuning goal
 * suggestion never changes lint results.</p>
 */
@Slf4j
public final class PathLinter {
    public static final String WARN_UNREACHABLE = "Cup is not reachable by any path";
    public static final String WARN_BYPASS = "Cup path appears to bypass obstacles (nearly straight, low corridor contact)";
    public static final String WARN_NEAR_EDGE = "Cup is very close to fairway edge";

    static final int BYPASS_MAX_TURNS = 1;
    static final double BYPASS_MAX_CORRIDOR_DENSITY = 1.0d;

    private final GridBuilder gridBuilder;
    private final GridAStarSearch search;

    public PathLinter() {
        this(new GridBuilder(), new GridAStarSearch());
    }

    public PathLinter(GridBuilder gridBuilder, GridAStarSearch search) {
        this.gridBuilder = Objects.requireNonNull(gridBuilder, "gridBuilder");
        this.search = Objects.requireNonNull(search, "search");
    }

    /**
     * Lints the level's current cup.
     *
     * @return zero or more warnings, in a fixed order.
     */
    public List<String> lint(Level level, Fairway fairway, double cellSize, HeuristicsConfig config) {
        Objects.requireNonNull(config, "config");
        TerrainGrid grid = gridBuilder.build(level, fairway, cellSize);
        Cup cup = level.getCup();
        SearchResult result = search.search(grid, grid.toCell(level.getTee()), grid.toCell(cup.center()));

        List<String> warnings = new ArrayList<>();
        if (!result.found()) {
            warnings.add(WARN_UNREACHABLE);
            return warnings;
        }

        PathMetrics metrics = PathMetrics.measure(grid, result.path());
        double pathLengthPx = result.pathCost() * cellSize;
        double straight = level.getTee().distanceTo(cup.center());
        if (level.obstacleCount() > 0
                && metrics.turns() <= BYPASS_MAX_TURNS
                && pathLengthPx < straight * config.getLintStraightnessRatio()
                && metrics.corridorDensity() < BYPASS_MAX_CORRIDOR_DENSITY) {
            warnings.add(WARN_BYPASS);
        }

        if (fairway.isNearEdge(cup.x(), cup.y(), config.resolveLintEdgeMargin(cellSize))) {
            warnings.add(WARN_NEAR_EDGE);
        }
        if (!warnings.isEmpty()) {
            log.debug("Cup lint raised {} warning(s): {}", warnings.size(), warnings);
        }
        return warnings;
    }
}
