package org.fairway.diversity;

import it.unimi.dsi.fastutil.ints.IntSet;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Singular;
import lombok.Value;
import org.fairway.geometry.Point;
import org.fairway.grid.CellCoord;

import java.util.List;

/**
 * One scored route between tee and cup.
 */
@Value
@Builder
public class CandidatePath {
    /** Cells from tee to cup. */
    @Singular("cell")
    List<CellCoord> path;
    /** Cell centers in world space, parallel to {@link #path}. */
    @Singular
    List<Point> worldPoints;
    /** Raw terrain length in pixels. */
    double lengthPx;
    int turns;
    /** Average blocked neighbors per path cell. */
    double corridorDensity;
    int sandCells;
    int slopeCells;
    /** Stroke estimate including slope assistance. */
    double strokes;
    /** Par in {@code [2, 7]} derived from {@link #strokes}. */
    int par;
    double downhillMomentum;
    double uphillResistance;
    int autoAssistSegments;
    /** Distinct cell keys on the path, for overlap tests. */
    @EqualsAndHashCode.Exclude
    IntSet cellKeys;

    /**
     * Shared cells divided by the smaller path's distinct cell count; 0 when either is empty.
     */
    public double overlapFraction(CandidatePath other) {
        int sizeA = cellKeys.size();
        int sizeB = other.cellKeys.size();
        if (sizeA == 0 || sizeB == 0) {
            return 0.0d;
        }
        IntSet smaller = sizeA <= sizeB ? cellKeys : other.cellKeys;
        IntSet larger = smaller == cellKeys ? other.cellKeys : cellKeys;
        int overlap = 0;
        for (int key : smaller) {
            if (larger.contains(key)) {
                overlap++;
            }
        }
        return overlap / (double) Math.min(sizeA, sizeB);
    }
}
