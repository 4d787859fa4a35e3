package org.fairway.diversity;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Ranked alternative routes for one tee/cup placement.
 *
 * <p>Candidates are sorted by strokes, then by length. When the cup is unreachable the list is
 * empty, {@code bestIndex} is {@code -1} and {@code par} is the fallback estimate.</p>
 */
@Value
@Builder
public class KBestResult {
    boolean reachable;
    @Singular
    List<CandidatePath> candidates;
    /** Index of the recommended candidate, {@code -1} when there is none. */
    int bestIndex;
    /** Par of the best candidate, or the fallback par. */
    int par;

    /**
     * Returns the best candidate, or {@code null} when there is none.
     */
    public CandidatePath best() {
        return bestIndex >= 0 ? candidates.get(bestIndex) : null;
    }
}
