package org.fairway.placement;

import org.fairway.geometry.Point;

/**
 * Suggested alternative cup placement.
 *
 * @param point cell center in world space.
 * @param score desirability; higher means a more interesting hole.
 * @param lengthPx tee-to-candidate path length in pixels.
 * @param turns direction changes along that path.
 */
public record CupCandidate(Point point, double score, double lengthPx, int turns) {
}
