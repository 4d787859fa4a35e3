package org.fairway.level;

import java.util.Locale;

/**
 * Compass direction of a slope field, pointing downhill.
 *
 * <p>Screen coordinates: north is {@code -y}. Diagonals use {@code ±1/√2} components so every
 * direction except {@link #NONE} is a unit vector.</p>
 */
public enum SlopeDirection {
    N(0.0d, -1.0d),
    NE(Math.sqrt(0.5d), -Math.sqrt(0.5d)),
    E(1.0d, 0.0d),
    SE(Math.sqrt(0.5d), Math.sqrt(0.5d)),
    S(0.0d, 1.0d),
    SW(-Math.sqrt(0.5d), Math.sqrt(0.5d)),
    W(-1.0d, 0.0d),
    NW(-Math.sqrt(0.5d), -Math.sqrt(0.5d)),
    /** Unknown or missing direction; contributes no downhill vector. */
    NONE(0.0d, 0.0d);

    private final double dx;
    private final double dy;

    SlopeDirection(double dx, double dy) {
        this.dx = dx;
        this.dy = dy;
    }

    public double dx() {
        return dx;
    }

    public double dy() {
        return dy;
    }

    /**
     * Parses an authored compass label, case-insensitively.
     *
     * @return matching direction, or {@link #NONE} for null/blank/unknown labels.
     */
    public static SlopeDirection parse(String label) {
        if (label == null || label.isBlank()) {
            return NONE;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (SlopeDirection direction : values()) {
            if (direction != NONE && direction.name().equals(normalized)) {
                return direction;
            }
        }
        return NONE;
    }
}
