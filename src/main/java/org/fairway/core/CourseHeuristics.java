package org.fairway.core;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.fairway.config.HeuristicsConfig;
import org.fairway.diversity.KBestResult;
import org.fairway.diversity.PathDiversifier;
import org.fairway.geometry.Fairway;
import org.fairway.grid.GridBuilder;
import org.fairway.level.Level;
import org.fairway.par.ParEstimate;
import org.fairway.par.ParEstimator;
import org.fairway.placement.CupCandidate;
import org.fairway.placement.GoalSuggester;
import org.fairway.placement.PathLinter;
import org.fairway.preview.PathPreview;
import org.fairway.preview.PathPreviewer;
import org.fairway.search.GridAStarSearch;

import java.util.List;

/**
 * Main course analysis entry point.
 *
 * <p>The facade validates request contracts before any grid is built, then delegates to the
 * stateless estimators. It keeps no state between calls apart from its immutable configuration,
 * so one instance may serve any number of threads.</p>
 */
@Slf4j
public final class CourseHeuristics implements CourseAnalyzer {
    public static final String REASON_LEVEL_REQUIRED = "CH_LEVEL_REQUIRED";
    public static final String REASON_FAIRWAY_REQUIRED = "CH_FAIRWAY_REQUIRED";
    public static final String REASON_INVALID_FAIRWAY = "CH_INVALID_FAIRWAY";
    public static final String REASON_INVALID_CELL_SIZE = "CH_INVALID_CELL_SIZE";
    public static final String REASON_INVALID_ROUTE_COUNT = "CH_INVALID_ROUTE_COUNT";
    public static final String REASON_INVALID_GOAL_COUNT = "CH_INVALID_GOAL_COUNT";
    public static final String REASON_GRID_TOO_LARGE = "CH_GRID_TOO_LARGE";

    @Getter
    @Accessors(fluent = true)
    private final HeuristicsConfig config;

    private final ParEstimator parEstimator;
    private final PathPreviewer pathPreviewer;
    private final PathDiversifier pathDiversifier;
    private final GoalSuggester goalSuggester;
    private final PathLinter pathLinter;

    /**
     * Creates the facade.
     *
     * @param config tunables; {@code null} selects {@link HeuristicsConfig#defaults()}.
     */
    @Builder
    public CourseHeuristics(HeuristicsConfig config) {
        this.config = config == null ? HeuristicsConfig.defaults() : config;
        GridBuilder gridBuilder = new GridBuilder();
        GridAStarSearch search = new GridAStarSearch();
        this.parEstimator = new ParEstimator(gridBuilder, search);
        this.pathPreviewer = new PathPreviewer(gridBuilder, search);
        this.pathDiversifier = new PathDiversifier(gridBuilder, search);
        this.goalSuggester = new GoalSuggester(gridBuilder, search);
        this.pathLinter = new PathLinter(gridBuilder, search);
    }

    /**
     * Creates a facade with default tunables.
     */
    public CourseHeuristics() {
        this(null);
    }

    @Override
    public ParEstimate estimatePar(Level level, Fairway fairway, double cellSize) {
        validate(level, fairway, cellSize);
        return parEstimator.estimate(level, fairway, cellSize, config);
    }

    @Override
    public PathPreview previewPath(Level level, Fairway fairway, double cellSize) {
        validate(level, fairway, cellSize);
        return pathPreviewer.preview(level, fairway, cellSize);
    }

    @Override
    public KBestResult suggestK(Level level, Fairway fairway, double cellSize, int k) {
        validate(level, fairway, cellSize);
        if (k < 1) {
            throw new CourseHeuristicsException(REASON_INVALID_ROUTE_COUNT, "k must be >= 1, got " + k);
        }
        return pathDiversifier.suggest(level, fairway, cellSize, k, config);
    }

    @Override
    public List<CupCandidate> suggestGoals(Level level, Fairway fairway, double cellSize, int count) {
        validate(level, fairway, cellSize);
        if (count < 0) {
            throw new CourseHeuristicsException(REASON_INVALID_GOAL_COUNT, "count must be >= 0, got " + count);
        }
        return goalSuggester.suggest(level, fairway, cellSize, count, config);
    }

    @Override
    public List<String> lintGoal(Level level, Fairway fairway, double cellSize) {
        validate(level, fairway, cellSize);
        return pathLinter.lint(level, fairway, cellSize, config);
    }

    private static void validate(Level level, Fairway fairway, double cellSize) {
        if (level == null) {
            throw new CourseHeuristicsException(REASON_LEVEL_REQUIRED, "level must be provided");
        }
        if (fairway == null) {
            throw new CourseHeuristicsException(REASON_FAIRWAY_REQUIRED, "fairway must be provided");
        }
        if (!Double.isFinite(fairway.x()) || !Double.isFinite(fairway.y())
                || !Double.isFinite(fairway.width()) || !Double.isFinite(fairway.height())) {
            throw new CourseHeuristicsException(REASON_INVALID_FAIRWAY, "fairway bounds must be finite: " + fairway);
        }
        if (!Double.isFinite(cellSize) || cellSize <= 0.0d) {
            throw new CourseHeuristicsException(REASON_INVALID_CELL_SIZE, "cellSize must be finite and > 0, got " + cellSize);
        }
        try {
            GridBuilder.requireGridSize(fairway, cellSize);
        } catch (IllegalArgumentException ex) {
            throw new CourseHeuristicsException(REASON_GRID_TOO_LARGE, ex.getMessage(), ex);
        }
        log.trace("Analyzing level on fairway {} at cellSize {}", fairway, cellSize);
    }
}
