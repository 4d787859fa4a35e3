package org.fairway.level;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.fairway.geometry.Point;
import org.fairway.geometry.Shape;

import java.util.List;

/**
 * Already-resolved course geometry handed over by the editor.
 *
 * <p>Every collection is optional; an unset collection is empty. The analysis never mutates
 * a level.</p>
 */
@Value
@Builder(toBuilder = true)
public class Level {
    /** Default radius of a post authored without one. */
    public static final double DEFAULT_POST_RADIUS = 8.0d;

    /** Start point. */
    @NonNull
    Point tee;
    /** Goal hole. */
    @NonNull
    Cup cup;
    /** Solid obstacles (rectangles and polygons). */
    @Singular
    List<Shape> walls;
    /** Water hazards; solid for traversal. */
    @Singular
    List<Shape> waterHazards;
    /** Sand traps: passable, higher cost. */
    @Singular
    List<Shape> sandTraps;
    /** Slope fields. */
    @Singular
    List<SlopeField> slopes;
    /** Bridges restoring passability over anything beneath them. */
    @Singular
    List<Shape> bridges;
    /** Circular post obstacles. */
    @Singular
    List<Shape> posts;

    /**
     * Number of wall and water shapes, used by the unreachable-goal fallback.
     */
    public int obstacleCount() {
        return walls.size() + waterHazards.size();
    }

    /**
     * Effective radius of a post, substituting {@link #DEFAULT_POST_RADIUS} when none was authored.
     */
    public static double postRadius(Shape post) {
        return post.radius() > 0.0d ? post.radius() : DEFAULT_POST_RADIUS;
    }
}
