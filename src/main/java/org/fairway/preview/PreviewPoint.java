package org.fairway.preview;

import org.fairway.geometry.Point;
import org.fairway.grid.CellCoord;

/**
 * One vertex of a path overlay.
 *
 * @param cell grid cell.
 * @param point cell center in world space.
 * @param sand whether the center lies in a sand trap.
 * @param slope whether the center lies in a slope field.
 */
public record PreviewPoint(CellCoord cell, Point point, boolean sand, boolean slope) {
}
