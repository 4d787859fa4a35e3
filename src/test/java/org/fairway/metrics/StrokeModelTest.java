package org.fairway.metrics;

import org.fairway.config.HeuristicsConfig;
import org.fairway.grid.CellCoord;
import org.fairway.grid.GridBuilder;
import org.fairway.grid.TerrainGrid;
import org.fairway.level.SlopeDirection;
import org.fairway.testutil.CourseFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Stroke Model Tests")
class StrokeModelTest {
    private static final double EPS = 1e-9;
    private static final HeuristicsConfig DEFAULTS = HeuristicsConfig.defaults();
    private static final PathMetrics PLAIN = new PathMetrics(20, 0, 0, 0.0d, 0, 0);

    @Nested
    @DisplayName("1. Base Strokes")
    class BaseTests {

        @Test
        @DisplayName("Plain path is length over shot distance")
        void testLengthOnly() {
            assertEquals(2.0d, StrokeModel.baseStrokes(640, PLAIN, DEFAULTS), EPS);
        }

        @Test
        @DisplayName("Penalties add up and cap independently")
        void testPenalties() {
            PathMetrics busy = new PathMetrics(20, 5, 20, 1.0d, 2, 0);
            assertEquals(2.0d + 0.02d + 0.40d + 0.12d, StrokeModel.baseStrokes(640, busy, DEFAULTS), EPS);

            PathMetrics extreme = new PathMetrics(20, 30, 200, 10.0d, 0, 0);
            assertEquals(2.0d + 1.5d + 1.0d, StrokeModel.baseStrokes(640, extreme, DEFAULTS), EPS);
        }

        @Test
        @DisplayName("Hill bump scales with slope coverage")
        void testHillBump() {
            assertEquals(2.0d + 0.15d, StrokeModel.baseStrokes(640, new PathMetrics(20, 0, 0, 0, 0, 10), DEFAULTS), EPS);
            assertEquals(2.0d + 0.12d, StrokeModel.baseStrokes(640, new PathMetrics(10, 0, 0, 0, 0, 3), DEFAULTS), EPS);
        }

        @Test
        @DisplayName("Friction scales the shot distance and the sand penalty")
        void testFriction() {
            HeuristicsConfig sticky = HeuristicsConfig.builder().frictionK(2.4d).build();
            assertEquals(160.0d, sticky.effectiveShotPx(), EPS);
            assertEquals(4.0d, StrokeModel.baseStrokes(640, PLAIN, sticky), EPS);

            HeuristicsConfig heavySand = HeuristicsConfig.builder().sandFrictionMultiplier(12.0d).build();
            PathMetrics sandy = new PathMetrics(20, 0, 0, 0.0d, 10, 0);
            assertEquals(2.0d + 0.2d, StrokeModel.baseStrokes(640, sandy, heavySand), EPS);
        }
    }

    @Nested
    @DisplayName("2. Slope Assistance")
    class AssistTests {

        @Test
        @DisplayName("No downhill momentum leaves base strokes untouched")
        void testNoMomentum() {
            TraversalAnalysis climb = new TraversalAnalysis(32, 0.0d, 12.0d, 0);
            assertEquals(
                    StrokeModel.baseStrokes(640, PLAIN, DEFAULTS),
                    StrokeModel.assistedStrokes(640, PLAIN, climb, DEFAULTS), EPS);
        }

        @Test
        @DisplayName("Momentum bonus and auto-assist bonus stack")
        void testBonuses() {
            TraversalAnalysis gentle = new TraversalAnalysis(32, 1.0d, 0.0d, 0);
            assertEquals(2.0d - 0.18d, StrokeModel.assistedStrokes(640, PLAIN, gentle, DEFAULTS), EPS);

            TraversalAnalysis strong = new TraversalAnalysis(32, 5.0d, 0.0d, 0);
            assertEquals(2.0d - 0.9d - 0.45d, StrokeModel.assistedStrokes(640, PLAIN, strong, DEFAULTS), EPS);

            TraversalAnalysis segmented = new TraversalAnalysis(32, 1.0d, 0.5d, 3);
            assertEquals(2.0d - 0.18d - 0.45d, StrokeModel.assistedStrokes(640, PLAIN, segmented, DEFAULTS), EPS);
        }

        @Test
        @DisplayName("Bonuses never push below the stroke floor")
        void testFloor() {
            TraversalAnalysis huge = new TraversalAnalysis(8, 40.0d, 0.0d, 10);
            assertEquals(0.35d, StrokeModel.assistedStrokes(160, PLAIN, huge, DEFAULTS), EPS);
        }

        @Test
        @DisplayName("Downhill replay measures momentum per step")
        void testTraversalReplay() {
            GridBuilder gridBuilder = new GridBuilder();
            List<CellCoord> straight = new ArrayList<>();
            for (int c = 3; c <= 37; c++) {
                straight.add(new CellCoord(c, 15));
            }

            TerrainGrid downhillGrid = gridBuilder.build(
                    CourseFixtures.slopedHole(SlopeDirection.E), CourseFixtures.FAIRWAY, CourseFixtures.CELL_SIZE);
            TraversalAnalysis downhill = TraversalAnalysis.analyze(downhillGrid, straight, DEFAULTS);
            assertEquals(42.5d, downhill.lengthCost(), EPS);
            assertEquals(34.0d, downhill.downhillMomentum(), EPS);
            assertEquals(0.0d, downhill.uphillResistance(), EPS);
            assertEquals(34, downhill.autoAssistSegments());

            TerrainGrid uphillGrid = gridBuilder.build(
                    CourseFixtures.slopedHole(SlopeDirection.W), CourseFixtures.FAIRWAY, CourseFixtures.CELL_SIZE);
            TraversalAnalysis uphill = TraversalAnalysis.analyze(uphillGrid, straight, DEFAULTS);
            assertEquals(0.0d, uphill.downhillMomentum(), EPS);
            assertEquals(34.0d, uphill.uphillResistance(), EPS);
            assertEquals(-34.0d, uphill.netMomentum(), EPS);

            TraversalAnalysis across = TraversalAnalysis.analyze(downhillGrid,
                    List.of(new CellCoord(5, 5), new CellCoord(5, 6), new CellCoord(5, 7)), DEFAULTS);
            assertEquals(0.0d, across.downhillMomentum(), EPS);
            assertEquals(0.0d, across.uphillResistance(), EPS);
        }

        @Test
        @DisplayName("Par adds the opening stroke and clamps")
        void testParFor() {
            assertEquals(3, StrokeModel.parFor(2.125d));
            assertEquals(2, StrokeModel.parFor(0.0d));
            assertEquals(7, StrokeModel.parFor(12.0d));
            assertEquals(4, StrokeModel.parFor(2.5d), "Half rounds up");
        }
    }
}
