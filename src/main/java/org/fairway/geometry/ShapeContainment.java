package org.fairway.geometry;

import lombok.experimental.UtilityClass;

/**
 * Point containment predicates shared by every terrain classification step.
 */
@UtilityClass
public class ShapeContainment {
    private static final double HORIZONTAL_EDGE_GUARD = 1e-6d;

    /**
     * Tests an axis-aligned rectangle, edges inclusive.
     */
    public static boolean rectContains(double x, double y, double width, double height, double px, double py) {
        return px >= x && px <= x + width && py >= y && py <= y + height;
    }

    /**
     * Even-odd ray casting test over a flat {@code [x0, y0, x1, y1, ...]} vertex array.
     *
     * <p>The polygon is treated as closed. Fewer than three vertices never contain a point.</p>
     */
    public static boolean polygonContains(double[] xy, double px, double py) {
        if (xy == null || xy.length < 6) {
            return false;
        }
        boolean inside = false;
        int n = xy.length / 2;
        for (int i = 0, j = n - 1; i < n; j = i++) {
            double xi = xy[i * 2];
            double yi = xy[i * 2 + 1];
            double xj = xy[j * 2];
            double yj = xy[j * 2 + 1];
            if ((yi > py) != (yj > py)) {
                double dy = yj - yi;
                if (dy == 0.0d) {
                    dy = HORIZONTAL_EDGE_GUARD;
                }
                if (px < (xj - xi) * (py - yi) / dy + xi) {
                    inside = !inside;
                }
            }
        }
        return inside;
    }

    /**
     * Tests a disc, boundary inclusive.
     */
    public static boolean circleContains(double cx, double cy, double radius, double px, double py) {
        return Math.hypot(px - cx, py - cy) <= radius;
    }
}
