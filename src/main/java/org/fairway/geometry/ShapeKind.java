package org.fairway.geometry;

/**
 * Tag of a {@link Shape} variant.
 */
public enum ShapeKind {
    RECT,
    POLYGON,
    CIRCLE
}
