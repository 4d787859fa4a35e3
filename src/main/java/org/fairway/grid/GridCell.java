package org.fairway.grid;

/**
 * Immutable rasterized cell.
 *
 * @param cost traversal cost, at least 1 (sand 3, slope baseline 1.25).
 * @param blocked whether the cell cannot be entered.
 * @param sand whether the cell center lies in sand.
 * @param slopeX x component of the unit downhill vector (0 when no slope).
 * @param slopeY y component of the unit downhill vector (0 when no slope).
 * @param slopeStrength downhill strength, capped at {@link #MAX_SLOPE_STRENGTH} (0 when no slope).
 */
public record GridCell(
        double cost,
        boolean blocked,
        boolean sand,
        double slopeX,
        double slopeY,
        double slopeStrength
) {
    public static final double BASE_COST = 1.0d;
    public static final double SAND_COST = 3.0d;
    public static final double SLOPE_BASE_COST = 1.25d;
    public static final double MAX_SLOPE_STRENGTH = 1.5d;

    static final GridCell OPEN = new GridCell(BASE_COST, false, false, 0.0d, 0.0d, 0.0d);
    static final GridCell BLOCKED = new GridCell(BASE_COST, true, false, 0.0d, 0.0d, 0.0d);

    /**
     * Whether this cell carries a downhill vector.
     */
    public boolean hasSlope() {
        return slopeStrength > 0.0d && (slopeX != 0.0d || slopeY != 0.0d);
    }
}
