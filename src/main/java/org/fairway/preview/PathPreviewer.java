package org.fairway.preview;

import org.fairway.geometry.Fairway;
import org.fairway.geometry.Point;
import org.fairway.geometry.Shape;
import org.fairway.grid.CellCoord;
import org.fairway.grid.GridBuilder;
import org.fairway.grid.TerrainGrid;
import org.fairway.level.Level;
import org.fairway.level.SlopeField;
import org.fairway.search.GridAStarSearch;
import org.fairway.search.SearchResult;

import java.util.Objects;

/**
 * Computes the world-space polyline of the base path with per-point terrain tags.
 */
public final class PathPreviewer {
    private final GridBuilder gridBuilder;
    private final GridAStarSearch search;

    public PathPreviewer() {
        this(new GridBuilder(), new GridAStarSearch());
    }

    public PathPreviewer(GridBuilder gridBuilder, GridAStarSearch search) {
        this.gridBuilder = Objects.requireNonNull(gridBuilder, "gridBuilder");
        this.search = Objects.requireNonNull(search, "search");
    }

    public PathPreview preview(Level level, Fairway fairway, double cellSize) {
        TerrainGrid grid = gridBuilder.build(level, fairway, cellSize);
        SearchResult result = search.search(
                grid,
                grid.toCell(level.getTee()),
                grid.toCell(level.getCup().center())
        );

        PathPreview.PathPreviewBuilder builder = PathPreview.builder()
                .found(result.found())
                .cellSize(cellSize)
                .cols(grid.cols())
                .rows(grid.rows());
        for (CellCoord cell : result.path()) {
            Point center = grid.toWorld(cell);
            builder.point(new PreviewPoint(cell, center, inSand(level, center), onSlope(level, center)));
        }
        return builder.build();
    }

    private static boolean inSand(Level level, Point p) {
        for (Shape sand : level.getSandTraps()) {
            if (sand.contains(p.x(), p.y())) {
                return true;
            }
        }
        return false;
    }

    private static boolean onSlope(Level level, Point p) {
        for (SlopeField slope : level.getSlopes()) {
            if (slope.covers(p.x(), p.y())) {
                return true;
            }
        }
        return false;
    }
}
