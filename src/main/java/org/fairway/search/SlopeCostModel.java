package org.fairway.search;

import lombok.experimental.UtilityClass;
import org.fairway.grid.GridCell;

/**
 * Directional slope terms for a single step between two adjacent cells.
 *
 * <p>The slope of a step is the average of both endpoint vectors and strengths. Alignment is the
 * dot product of that average with the unit step direction: positive runs downhill, negative
 * climbs.</p>
 */
@UtilityClass
public class SlopeCostModel {
    public static final double UPHILL_WEIGHT = 0.5d;
    public static final double DOWNHILL_WEIGHT = 0.15d;
    public static final double MIN_FACTOR = 0.75d;
    public static final double MAX_FACTOR = 1.6d;

    /**
     * Search-priority multiplier for a step, in {@code [0.75, 1.6]}; 1 without slope.
     */
    public static double searchFactor(GridCell from, GridCell to, int dc, int dr) {
        double strength = averageStrength(from, to);
        if (!(strength > 0.0d)) {
            return 1.0d;
        }
        double hx = (from.slopeX() + to.slopeX()) * 0.5d;
        double hy = (from.slopeY() + to.slopeY()) * 0.5d;
        if (hx == 0.0d && hy == 0.0d) {
            return 1.0d;
        }
        double dot = dot(hx, hy, dc, dr);
        double uphill = Math.max(0.0d, -dot);
        double downhill = Math.max(0.0d, dot);
        double factor = 1.0d + UPHILL_WEIGHT * uphill * strength - DOWNHILL_WEIGHT * downhill * strength;
        return Math.max(MIN_FACTOR, Math.min(MAX_FACTOR, factor));
    }

    /**
     * Alignment of a step with the averaged downhill vector, or {@code 0} when the step has no slope.
     */
    public static double alignment(GridCell from, GridCell to, int dc, int dr) {
        if (!(averageStrength(from, to) > 0.0d)) {
            return 0.0d;
        }
        double hx = (from.slopeX() + to.slopeX()) * 0.5d;
        double hy = (from.slopeY() + to.slopeY()) * 0.5d;
        return dot(hx, hy, dc, dr);
    }

    /**
     * Mean slope strength of the two endpoint cells.
     */
    public static double averageStrength(GridCell from, GridCell to) {
        return (from.slopeStrength() + to.slopeStrength()) * 0.5d;
    }

    /**
     * Step weight: 1 orthogonal, √2 diagonal.
     */
    public static double stepWeight(int dc, int dr) {
        return dc != 0 && dr != 0 ? Math.sqrt(2.0d) : 1.0d;
    }

    private static double dot(double hx, double hy, int dc, int dr) {
        double step = stepWeight(dc, dr);
        return hx * (dc / step) + hy * (dr / step);
    }
}
