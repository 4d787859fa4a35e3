package org.fairway.geometry;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable tagged geometry variant: rectangle, polygon or circle.
 *
 * <p>All containment goes through {@link #contains(double, double)} so obstacle, water,
 * sand and bridge classification cannot diverge.</p>
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class Shape {
    private final ShapeKind kind;
    private final double x;
    private final double y;
    private final double width;
    private final double height;
    private final double radius;
    @Getter(AccessLevel.NONE)
    private final double[] vertices;

    /**
     * Creates an axis-aligned rectangle with top-left corner {@code (x, y)}.
     */
    public static Shape rect(double x, double y, double width, double height) {
        return new Shape(ShapeKind.RECT, x, y, width, height, 0.0d, null);
    }

    /**
     * Creates a polygon from flat {@code [x0, y0, x1, y1, ...]} coordinates.
     *
     * <p>Degenerate polygons (fewer than three vertices) are accepted and never contain anything.</p>
     */
    public static Shape polygon(double... xy) {
        Objects.requireNonNull(xy, "xy");
        if (xy.length % 2 != 0) {
            throw new IllegalArgumentException("polygon coordinates must come in x/y pairs, got " + xy.length);
        }
        double[] copy = xy.clone();
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (int i = 0; i + 1 < copy.length; i += 2) {
            minX = Math.min(minX, copy[i]);
            maxX = Math.max(maxX, copy[i]);
            minY = Math.min(minY, copy[i + 1]);
            maxY = Math.max(maxY, copy[i + 1]);
        }
        if (copy.length == 0) {
            minX = minY = maxX = maxY = 0.0d;
        }
        return new Shape(ShapeKind.POLYGON, minX, minY, maxX - minX, maxY - minY, 0.0d, copy);
    }

    /**
     * Creates a circle centered at {@code (cx, cy)}.
     */
    public static Shape circle(double cx, double cy, double radius) {
        return new Shape(ShapeKind.CIRCLE, cx, cy, 0.0d, 0.0d, radius, null);
    }

    /**
     * Returns a copy of the polygon vertex array (empty for other kinds).
     */
    public double[] vertices() {
        return vertices == null ? new double[0] : vertices.clone();
    }

    /**
     * Number of polygon vertices (zero for other kinds).
     */
    public int vertexCount() {
        return vertices == null ? 0 : vertices.length / 2;
    }

    /**
     * Tests whether this shape contains the given point.
     */
    public boolean contains(double px, double py) {
        return contains(px, py, 0.0d);
    }

    /**
     * Tests containment with a circle inflated by {@code margin}.
     *
     * <p>The margin only applies to circles; it models a clearance ring around posts.</p>
     */
    public boolean contains(double px, double py, double margin) {
        return switch (kind) {
            case RECT -> ShapeContainment.rectContains(x, y, width, height, px, py);
            case POLYGON -> ShapeContainment.polygonContains(vertices, px, py);
            case CIRCLE -> ShapeContainment.circleContains(x, y, radius + margin, px, py);
        };
    }

    @Override
    public String toString() {
        return switch (kind) {
            case RECT -> "Shape{rect " + x + "," + y + " " + width + "x" + height + "}";
            case CIRCLE -> "Shape{circle " + x + "," + y + " r=" + radius + "}";
            case POLYGON -> "Shape{polygon " + Arrays.toString(vertices) + "}";
        };
    }
}
