package org.fairway.preview;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Overlay data for rendering the base tee-to-cup path.
 */
@Value
@Builder
public class PathPreview {
    boolean found;
    /** Ordered path vertices; empty when not found. */
    @Singular
    List<PreviewPoint> points;
    double cellSize;
    int cols;
    int rows;
}
