package org.fairway.par;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Suggested par for one tee/cup placement.
 *
 * <p>When {@code reachable=false}, {@code pathLengthPx} is the straight-line tee-to-cup distance
 * and the par comes from the distance/obstacle fallback.</p>
 */
@Value
@Builder
public class ParEstimate {
    /** Whether a path from tee to cup exists. */
    boolean reachable;
    /** Suggested par in {@code [2, 7]}. */
    int suggestedPar;
    /** Path length in pixels (straight-line distance when unreachable). */
    double pathLengthPx;
    /** Stroke estimate before the opening stroke was added. */
    double strokes;
    /** Diagnostic notes for display. */
    @Singular
    List<String> notes;
}
