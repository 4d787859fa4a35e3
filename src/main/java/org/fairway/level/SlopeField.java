package org.fairway.level;

import org.fairway.geometry.Shape;

import java.util.Objects;

/**
 * Rectangular slope ("hill") region pushing the ball toward {@code direction}.
 *
 * @param area rectangle covered by the slope.
 * @param direction downhill compass direction.
 * @param strength authored strength; {@code NaN} means the default of 1.
 */
public record SlopeField(Shape area, SlopeDirection direction, double strength) {
    public static final double MIN_STRENGTH = 0.2d;
    public static final double MAX_STRENGTH = 2.0d;
    public static final double DEFAULT_STRENGTH = 1.0d;

    public SlopeField {
        Objects.requireNonNull(area, "area");
        direction = direction == null ? SlopeDirection.NONE : direction;
    }

    /**
     * Creates a rectangular slope with explicit strength.
     */
    public static SlopeField of(double x, double y, double width, double height, SlopeDirection direction, double strength) {
        return new SlopeField(Shape.rect(x, y, width, height), direction, strength);
    }

    /**
     * Creates a rectangular slope with default strength.
     */
    public static SlopeField of(double x, double y, double width, double height, SlopeDirection direction) {
        return of(x, y, width, height, direction, Double.NaN);
    }

    /**
     * Strength clamped into {@code [0.2, 2]}.
     */
    public double clampedStrength() {
        double raw = Double.isNaN(strength) ? DEFAULT_STRENGTH : strength;
        return Math.max(MIN_STRENGTH, Math.min(MAX_STRENGTH, raw));
    }

    /**
     * Tests whether the slope covers a point.
     */
    public boolean covers(double px, double py) {
        return area.contains(px, py);
    }
}
