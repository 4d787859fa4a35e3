package org.fairway.geometry;

/**
 * Immutable point in the shared pixel coordinate space.
 *
 * @param x horizontal coordinate in pixels.
 * @param y vertical coordinate in pixels (grows downward).
 */
public record Point(double x, double y) {

    /**
     * Euclidean distance to another point.
     */
    public double distanceTo(Point other) {
        return Math.hypot(other.x - x, other.y - y);
    }
}
