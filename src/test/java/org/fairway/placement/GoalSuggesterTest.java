package org.fairway.placement;

import org.fairway.config.HeuristicsConfig;
import org.fairway.geometry.Fairway;
import org.fairway.geometry.Point;
import org.fairway.geometry.Shape;
import org.fairway.level.Cup;
import org.fairway.level.Level;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Goal Suggester Tests")
class GoalSuggesterTest {
    private static final Fairway FAIRWAY = new Fairway(0, 0, 400, 300);
    private static final double CELL_SIZE = 20.0d;
    private static final Point TEE = new Point(40, 150);

    /** Wall down the middle with openings at the top and bottom rows. */
    private static final Level DIVIDED = Level.builder()
            .tee(TEE)
            .cup(Cup.at(360, 150))
            .wall(Shape.rect(180, 40, 20, 220))
            .build();

    private final GoalSuggester suggester = new GoalSuggester();

    private List<CupCandidate> suggest(int count, HeuristicsConfig config) {
        return suggester.suggest(DIVIDED, FAIRWAY, CELL_SIZE, count, config);
    }

    @Test
    @DisplayName("Finds candidates behind the wall, best first")
    void testCandidatesFound() {
        List<CupCandidate> candidates = suggest(5, HeuristicsConfig.defaults());
        assertFalse(candidates.isEmpty());
        assertTrue(candidates.size() <= 5);
        for (int i = 1; i < candidates.size(); i++) {
            assertTrue(candidates.get(i - 1).score() >= candidates.get(i).score());
        }
        for (CupCandidate candidate : candidates) {
            assertTrue(candidate.lengthPx() >= TEE.distanceTo(candidate.point()) * 1.08d);
            assertTrue(candidate.score() >= candidate.lengthPx());
        }
    }

    @Test
    @DisplayName("Candidates keep the minimum separation")
    void testSeparation() {
        List<CupCandidate> candidates = suggest(10, HeuristicsConfig.defaults());
        for (int i = 0; i < candidates.size(); i++) {
            for (int j = i + 1; j < candidates.size(); j++) {
                double gap = candidates.get(i).point().distanceTo(candidates.get(j).point());
                assertTrue(gap >= 6 * CELL_SIZE, () -> "candidates too close: " + gap);
            }
        }
    }

    @Test
    @DisplayName("Candidates respect the edge margin and the tee distance")
    void testEdgeMarginAndDistance() {
        List<CupCandidate> candidates = suggest(10, HeuristicsConfig.defaults());
        for (CupCandidate candidate : candidates) {
            Point p = candidate.point();
            assertFalse(FAIRWAY.isNearEdge(p.x(), p.y(), 40.0d), () -> "near edge: " + p);
            assertTrue(TEE.distanceTo(p) >= 100.0d);
        }

        HeuristicsConfig wideMargin = HeuristicsConfig.builder().edgeMargin(120.0d).build();
        for (CupCandidate candidate : suggest(10, wideMargin)) {
            Point p = candidate.point();
            assertFalse(FAIRWAY.isNearEdge(p.x(), p.y(), 120.0d), () -> "near edge: " + p);
        }
    }

    @Test
    @DisplayName("Candidate region filters placements")
    void testRegion() {
        HeuristicsConfig config = HeuristicsConfig.builder()
                .candidateRegion(Shape.rect(300, 0, 100, 300))
                .build();
        List<CupCandidate> candidates = suggest(5, config);
        assertFalse(candidates.isEmpty());
        assertTrue(candidates.stream().allMatch(c -> c.point().x() >= 300));
    }

    @Test
    @DisplayName("Turn requirement and straightness filter placements")
    void testFilters() {
        HeuristicsConfig manyTurns = HeuristicsConfig.builder().minTurns(50).build();
        assertTrue(suggest(5, manyTurns).isEmpty());

        HeuristicsConfig veryWinding = HeuristicsConfig.builder().minStraightnessRatio(10.0d).build();
        assertTrue(suggest(5, veryWinding).isEmpty());
    }

    @Test
    @DisplayName("Count bounds the result")
    void testCount() {
        assertTrue(suggest(0, HeuristicsConfig.defaults()).isEmpty());
        assertEquals(1, suggest(1, HeuristicsConfig.defaults()).size());
        assertThrows(IllegalArgumentException.class, () -> suggest(-1, HeuristicsConfig.defaults()));
    }

    @Test
    @DisplayName("Suggestions are deterministic")
    void testDeterminism() {
        assertEquals(suggest(5, HeuristicsConfig.defaults()), suggest(5, HeuristicsConfig.defaults()));
    }
}
