package org.fairway.grid;

import org.fairway.geometry.Fairway;
import org.fairway.geometry.Point;
import org.fairway.geometry.Shape;
import org.fairway.level.Level;
import org.fairway.level.SlopeDirection;
import org.fairway.level.SlopeField;
import org.fairway.testutil.CourseFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Grid Builder Tests")
class GridBuilderTest {
    private static final double EPS = 1e-9;

    private final GridBuilder builder = new GridBuilder();

    private TerrainGrid build(Level level) {
        return builder.build(level, CourseFixtures.FAIRWAY, CourseFixtures.CELL_SIZE);
    }

    @Nested
    @DisplayName("1. Dimensions and Mapping")
    class DimensionTests {

        @Test
        @DisplayName("Cols and rows are ceil(extent / cellSize)")
        void testDimensions() {
            TerrainGrid grid = build(CourseFixtures.openHole());
            assertEquals(40, grid.cols());
            assertEquals(30, grid.rows());
            assertEquals(1200, grid.size());

            TerrainGrid ragged = builder.build(CourseFixtures.openHole(), new Fairway(0, 0, 805, 601), 20);
            assertEquals(41, ragged.cols());
            assertEquals(31, ragged.rows());
        }

        @Test
        @DisplayName("Degenerate fairways still produce one cell per axis")
        void testAtLeastOneCell() {
            TerrainGrid flat = builder.build(CourseFixtures.openHole(), new Fairway(0, 0, 0, 0), 20);
            assertEquals(1, flat.cols());
            assertEquals(1, flat.rows());

            TerrainGrid coarse = builder.build(CourseFixtures.openHole(), new Fairway(0, 0, 50, 50), 500);
            assertEquals(1, coarse.cols());
            assertEquals(1, coarse.rows());
        }

        @Test
        @DisplayName("Invalid cell sizes are rejected")
        void testInvalidCellSize() {
            Level level = CourseFixtures.openHole();
            Fairway fairway = CourseFixtures.FAIRWAY;
            assertThrows(IllegalArgumentException.class, () -> builder.build(level, fairway, 0));
            assertThrows(IllegalArgumentException.class, () -> builder.build(level, fairway, -5));
            assertThrows(IllegalArgumentException.class, () -> builder.build(level, fairway, Double.NaN));
            assertThrows(IllegalArgumentException.class, () -> builder.build(level, fairway, Double.POSITIVE_INFINITY));
        }

        @Test
        @DisplayName("Oversized grid is rejected before allocation")
        void testOversizedGrid() {
            Level level = CourseFixtures.openHole();
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                    () -> builder.build(level, new Fairway(0, 0, 100000, 100000), 1.0d));
            assertTrue(ex.getMessage().contains("100000x100000"), ex.getMessage());

            assertThrows(IllegalArgumentException.class,
                    () -> builder.build(level, new Fairway(0, 0, 1.0e9, 1.0e9), 0.01d));
            assertThrows(IllegalArgumentException.class,
                    () -> builder.build(level, new Fairway(0, 0, 2001, 2000), 1.0d));
            assertEquals(1200, GridBuilder.requireGridSize(CourseFixtures.FAIRWAY, 20.0d));
            assertEquals(GridBuilder.MAX_CELLS, GridBuilder.requireGridSize(new Fairway(0, 0, 2000, 2000), 1.0d));
        }

        @Test
        @DisplayName("toCell floors and clamps, toWorld returns the cell center")
        void testWorldMapping() {
            TerrainGrid grid = build(CourseFixtures.openHole());
            assertEquals(new CellCoord(3, 15), grid.toCell(CourseFixtures.TEE));
            assertEquals(new CellCoord(37, 15), grid.toCell(740, 300));
            assertEquals(new CellCoord(0, 0), grid.toCell(-50, -50));
            assertEquals(new CellCoord(39, 29), grid.toCell(10_000, 10_000));
            assertEquals(new Point(10, 10), grid.toWorld(0, 0));
            assertEquals(new Point(750, 310), grid.toWorld(new CellCoord(37, 15)));
        }

        @Test
        @DisplayName("Fairway origin offsets every cell center")
        void testFairwayOffset() {
            Fairway fairway = new Fairway(100, 50, 200, 100);
            Level level = CourseFixtures.straightHole().wall(Shape.rect(100, 50, 20, 20)).build();
            TerrainGrid grid = builder.build(level, fairway, 20);
            assertEquals(new Point(110, 60), grid.toWorld(0, 0));
            assertTrue(grid.cell(0, 0).blocked());
            assertFalse(grid.cell(1, 0).blocked());
            assertEquals(new CellCoord(1, 0), grid.toCell(125, 55));
        }

        @Test
        @DisplayName("Keys are row-major")
        void testKeys() {
            TerrainGrid grid = build(CourseFixtures.openHole());
            assertEquals(15 * 40 + 3, grid.key(3, 15));
            assertEquals(new CellCoord(3, 15), grid.coordOf(grid.key(3, 15)));
        }
    }

    @Nested
    @DisplayName("2. Blocking")
    class BlockingTests {

        @Test
        @DisplayName("Walls block cells whose centers they cover")
        void testWall() {
            TerrainGrid grid = build(CourseFixtures.gappedWallHole());
            for (int r = 0; r < 4; r++) {
                assertFalse(grid.cell(20, r).blocked(), "Gap row " + r + " must stay open");
            }
            for (int r = 4; r < 30; r++) {
                assertTrue(grid.cell(20, r).blocked(), "Wall row " + r + " must be blocked");
            }
            assertFalse(grid.cell(19, 15).blocked());
            assertFalse(grid.cell(21, 15).blocked());
        }

        @Test
        @DisplayName("Bridges re-open water beneath them")
        void testBridgeOverWater() {
            Level level = CourseFixtures.straightHole()
                    .waterHazard(Shape.rect(200, 200, 100, 100))
                    .bridge(Shape.rect(240, 200, 20, 100))
                    .build();
            TerrainGrid grid = build(level);
            assertTrue(grid.cell(11, 12).blocked());
            assertFalse(grid.cell(12, 12).blocked(), "Bridge column");
            assertTrue(grid.cell(13, 12).blocked());
            assertFalse(grid.cell(12, 9).blocked(), "Outside the water");
        }

        @Test
        @DisplayName("Polygon walls block by center")
        void testPolygonWall() {
            Level level = CourseFixtures.straightHole()
                    .wall(Shape.polygon(200, 200, 300, 200, 200, 300))
                    .build();
            TerrainGrid grid = build(level);
            assertTrue(grid.cell(10, 10).blocked());
            assertFalse(grid.cell(14, 14).blocked(), "Center (290,290) is beyond the hypotenuse");
        }

        @Test
        @DisplayName("Posts block their radius plus a clearance ring")
        void testPostClearance() {
            assertEquals(8.0d, GridBuilder.postClearance(20), EPS);
            assertEquals(6.0d, GridBuilder.postClearance(5), EPS);
            assertEquals(40.0d, GridBuilder.postClearance(100), EPS);

            TerrainGrid grid = build(CourseFixtures.straightHole().post(Shape.circle(100, 100, 8)).build());
            assertTrue(grid.cell(4, 4).blocked(), "Center 14px away is inside 8 + 8");
            assertTrue(grid.cell(5, 5).blocked());
            assertFalse(grid.cell(3, 4).blocked(), "Center 31px away is clear");
            assertFalse(grid.cell(3, 3).blocked());
        }

        @Test
        @DisplayName("Posts without a radius use the default radius")
        void testDefaultPostRadius() {
            TerrainGrid authored = build(CourseFixtures.straightHole().post(Shape.circle(100, 100, 8)).build());
            TerrainGrid defaulted = build(CourseFixtures.straightHole().post(Shape.circle(100, 100, 0)).build());
            for (int key = 0; key < authored.size(); key++) {
                assertEquals(authored.cellAt(key).blocked(), defaulted.cellAt(key).blocked(), "cell " + key);
            }
        }

        @Test
        @DisplayName("Blocked cells carry no terrain")
        void testBlockedIgnoresTerrain() {
            Level level = CourseFixtures.straightHole()
                    .wall(Shape.rect(200, 200, 40, 40))
                    .sandTrap(Shape.rect(200, 200, 40, 40))
                    .slope(SlopeField.of(200, 200, 40, 40, SlopeDirection.E))
                    .build();
            GridCell cell = build(level).cell(10, 10);
            assertTrue(cell.blocked());
            assertFalse(cell.sand());
            assertFalse(cell.hasSlope());
        }

        @Test
        @DisplayName("Neighbor counting treats the outside as open")
        void testBlockedNeighbors() {
            TerrainGrid grid = build(CourseFixtures.gappedWallHole());
            assertEquals(3, grid.blockedNeighborCount(19, 15));
            assertEquals(0, grid.blockedNeighborCount(10, 15));
            assertFalse(grid.isBlocked(-1, 0));
            assertFalse(grid.isBlocked(40, 29));
        }
    }

    @Nested
    @DisplayName("3. Terrain Costs")
    class TerrainTests {

        @Test
        @DisplayName("Sand costs 3 and overlapping traps do not stack")
        void testSand() {
            Level level = CourseFixtures.straightHole()
                    .sandTrap(Shape.rect(200, 200, 100, 100))
                    .sandTrap(Shape.polygon(200, 200, 300, 200, 300, 300, 200, 300))
                    .build();
            TerrainGrid grid = build(level);
            GridCell sand = grid.cell(12, 12);
            assertTrue(sand.sand());
            assertEquals(GridCell.SAND_COST, sand.cost(), EPS);
            assertEquals(GridCell.BASE_COST, grid.cell(5, 5).cost(), EPS);
            assertFalse(grid.cell(5, 5).sand());
        }

        @Test
        @DisplayName("Slope lifts the base cost to 1.25 with a unit vector")
        void testSingleSlope() {
            GridCell cell = build(CourseFixtures.slopedHole(SlopeDirection.E)).cell(10, 10);
            assertTrue(cell.hasSlope());
            assertEquals(GridCell.SLOPE_BASE_COST, cell.cost(), EPS);
            assertEquals(1.0d, cell.slopeX(), EPS);
            assertEquals(0.0d, cell.slopeY(), EPS);
            assertEquals(1.0d, cell.slopeStrength(), EPS);
        }

        @Test
        @DisplayName("Sand keeps its cost under a slope")
        void testSandUnderSlope() {
            Level level = CourseFixtures.straightHole()
                    .sandTrap(Shape.rect(200, 200, 100, 100))
                    .slope(SlopeField.of(0, 0, 800, 600, SlopeDirection.S))
                    .build();
            GridCell cell = build(level).cell(12, 12);
            assertEquals(GridCell.SAND_COST, cell.cost(), EPS);
            assertTrue(cell.hasSlope());
        }

        @Test
        @DisplayName("Strength is clamped per field and capped per cell")
        void testStrengthBounds() {
            GridCell strong = build(CourseFixtures.straightHole()
                    .slope(SlopeField.of(0, 0, 800, 600, SlopeDirection.N, 5.0))
                    .build()).cell(1, 1);
            assertEquals(GridCell.MAX_SLOPE_STRENGTH, strong.slopeStrength(), EPS);

            GridCell weak = build(CourseFixtures.straightHole()
                    .slope(SlopeField.of(0, 0, 800, 600, SlopeDirection.N, 0.01))
                    .build()).cell(1, 1);
            assertEquals(SlopeField.MIN_STRENGTH, weak.slopeStrength(), EPS);
            assertEquals(-1.0d, weak.slopeY(), EPS);
        }

        @Test
        @DisplayName("Overlapping fields sum directions and keep the strongest strength")
        void testOverlappingSlopes() {
            GridCell combined = build(CourseFixtures.straightHole()
                    .slope(SlopeField.of(0, 0, 800, 600, SlopeDirection.E, 1.0))
                    .slope(SlopeField.of(0, 0, 800, 600, SlopeDirection.S, 0.5))
                    .build()).cell(10, 10);
            double norm = Math.hypot(1.0, 0.5);
            assertEquals(1.0 / norm, combined.slopeX(), EPS);
            assertEquals(0.5 / norm, combined.slopeY(), EPS);
            assertEquals(1.0d, combined.slopeStrength(), EPS);
        }

        @Test
        @DisplayName("Opposing fields cancel into a flat cell")
        void testCancellingSlopes() {
            GridCell flat = build(CourseFixtures.straightHole()
                    .slope(SlopeField.of(0, 0, 800, 600, SlopeDirection.E, 1.0))
                    .slope(SlopeField.of(0, 0, 800, 600, SlopeDirection.W, 1.0))
                    .build()).cell(10, 10);
            assertFalse(flat.hasSlope());
            assertEquals(GridCell.BASE_COST, flat.cost(), EPS);
        }

        @Test
        @DisplayName("Unknown directions contribute nothing")
        void testUnknownDirection() {
            GridCell cell = build(CourseFixtures.straightHole()
                    .slope(SlopeField.of(0, 0, 800, 600, SlopeDirection.parse("uphill")))
                    .build()).cell(10, 10);
            assertFalse(cell.hasSlope());
            assertEquals(GridCell.BASE_COST, cell.cost(), EPS);
        }
    }
}
