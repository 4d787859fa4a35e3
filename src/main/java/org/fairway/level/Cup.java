package org.fairway.level;

import org.fairway.geometry.Point;

/**
 * Goal hole placement.
 *
 * @param x center x in pixels.
 * @param y center y in pixels.
 * @param radius hole radius in pixels (informational; analysis uses the center).
 */
public record Cup(double x, double y, double radius) {

    /**
     * Creates a cup with no explicit radius.
     */
    public static Cup at(double x, double y) {
        return new Cup(x, y, 0.0d);
    }

    /**
     * Center of the cup.
     */
    public Point center() {
        return new Point(x, y);
    }
}
