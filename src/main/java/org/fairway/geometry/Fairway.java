package org.fairway.geometry;

/**
 * Bounding rectangle of the region that gets rasterized for analysis.
 *
 * @param x left edge in pixels.
 * @param y top edge in pixels.
 * @param width width in pixels.
 * @param height height in pixels.
 */
public record Fairway(double x, double y, double width, double height) {

    /**
     * Returns the larger of width and height.
     */
    public double largerDimension() {
        return Math.max(width, height);
    }

    /**
     * Returns whether a point lies closer than {@code margin} to any fairway edge.
     */
    public boolean isNearEdge(double px, double py, double margin) {
        return px < x + margin
                || px > x + width - margin
                || py < y + margin
                || py > y + height - margin;
    }
}
