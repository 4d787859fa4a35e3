package org.fairway.par;

import lombok.extern.slf4j.Slf4j;
import org.fairway.config.HeuristicsConfig;
import org.fairway.geometry.Fairway;
import org.fairway.grid.CellCoord;
import org.fairway.grid.GridBuilder;
import org.fairway.grid.TerrainGrid;
import org.fairway.level.Level;
import org.fairway.metrics.PathMetrics;
import org.fairway.metrics.StrokeModel;
import org.fairway.search.GridAStarSearch;
import org.fairway.search.SearchResult;

import java.util.Locale;
import java.util.Objects;

/**
 * Single-path par estimation.
 *
 * <p>Builds the grid, searches tee to cup and converts the path into strokes through
 * {@link StrokeModel#baseStrokes}. An unreachable cup falls back to
 * {@code round(distance / 260 + obstacles * 0.3)}.</p>
 */
@Slf4j
public final class ParEstimator {
    public static final String NOTE_FALLBACK = "no path, fallback used";

    private final GridBuilder gridBuilder;
    private final GridAStarSearch search;

    public ParEstimator() {
        this(new GridBuilder(), new GridAStarSearch());
    }

    public ParEstimator(GridBuilder gridBuilder, GridAStarSearch search) {
        this.gridBuilder = Objects.requireNonNull(gridBuilder, "gridBuilder");
        this.search = Objects.requireNonNull(search, "search");
    }

    /**
     * Estimates par for the level's current cup.
     */
    public ParEstimate estimate(Level level, Fairway fairway, double cellSize, HeuristicsConfig config) {
        Objects.requireNonNull(config, "config");
        TerrainGrid grid = gridBuilder.build(level, fairway, cellSize);
        CellCoord start = grid.toCell(level.getTee());
        CellCoord goal = grid.toCell(level.getCup().center());
        SearchResult result = search.search(grid, start, goal);

        if (!result.found()) {
            return fallback(level, config);
        }

        double pathLengthPx = result.pathCost() * cellSize;
        PathMetrics metrics = PathMetrics.measure(grid, result.path());
        double strokes = StrokeModel.baseStrokes(pathLengthPx, metrics, config);
        int par = StrokeModel.parFor(strokes);

        ParEstimate.ParEstimateBuilder builder = ParEstimate.builder()
                .reachable(true)
                .suggestedPar(par)
                .pathLengthPx(pathLengthPx)
                .strokes(strokes);
        if (metrics.sandCells() > 0) {
            builder.note("sand cells ~" + metrics.sandCells());
        }
        if (metrics.slopeCells() > 0) {
            builder.note("slope cells on path ~" + metrics.slopeCells());
        }
        if (metrics.turns() > 0) {
            builder.note("turns ~" + metrics.turns());
        }
        if (metrics.corridorDensity() > 0.0d) {
            builder.note(String.format(Locale.ROOT, "corridor contact ~%.2f", metrics.corridorDensity()));
        }
        log.debug("Par {} for {}px path ({} turns, strokes={})", par, pathLengthPx, metrics.turns(), strokes);
        return builder.build();
    }

    /**
     * Distance/obstacle estimate used when the cup cannot be reached.
     */
    ParEstimate fallback(Level level, HeuristicsConfig config) {
        double distance = level.getTee().distanceTo(level.getCup().center());
        double strokes = distance / config.getFallbackShotPx() + level.obstacleCount() * config.getFallbackObstacleWeight();
        int par = HeuristicsConfig.clampPar(strokes);
        log.debug("Cup unreachable, fallback par {} (distance={}, obstacles={})", par, distance, level.obstacleCount());
        return ParEstimate.builder()
                .reachable(false)
                .suggestedPar(par)
                .pathLengthPx(distance)
                .strokes(strokes)
                .note(NOTE_FALLBACK)
                .build();
    }
}
