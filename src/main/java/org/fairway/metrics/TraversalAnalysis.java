package org.fairway.metrics;

import org.fairway.config.HeuristicsConfig;
import org.fairway.grid.CellCoord;
import org.fairway.grid.GridCell;
import org.fairway.grid.TerrainGrid;
import org.fairway.search.SlopeCostModel;

import java.util.List;

/**
 * Step-by-step replay of a fixed path measuring how much slope helps or hinders it.
 *
 * @param lengthCost raw terrain cost of the path (same as the search's reported cost).
 * @param downhillMomentum sum of {@code alignment * strength * stepLength} over downhill steps.
 * @param uphillResistance the same sum over uphill steps, as a positive value.
 * @param autoAssistSegments downhill steps whose contribution alone reaches the assist threshold.
 */
public record TraversalAnalysis(
        double lengthCost,
        double downhillMomentum,
        double uphillResistance,
        int autoAssistSegments
) {

    /**
     * Replays {@code path} on {@code grid}.
     */
    public static TraversalAnalysis analyze(TerrainGrid grid, List<CellCoord> path, HeuristicsConfig config) {
        double deadband = config.getSlopeAlignmentDeadband();
        double segmentThreshold = config.getAutoAssistSegmentMomentum();
        double lengthCost = 0.0d;
        double downhill = 0.0d;
        double uphill = 0.0d;
        int assisted = 0;

        for (int i = 1; i < path.size(); i++) {
            CellCoord a = path.get(i - 1);
            CellCoord b = path.get(i);
            int dc = b.col() - a.col();
            int dr = b.row() - a.row();
            double step = SlopeCostModel.stepWeight(dc, dr);
            GridCell from = grid.cell(a);
            GridCell to = grid.cell(b);
            lengthCost += step * to.cost();

            double strength = SlopeCostModel.averageStrength(from, to);
            double alignment = SlopeCostModel.alignment(from, to, dc, dr);
            if (alignment > deadband) {
                double boost = alignment * strength * step;
                downhill += boost;
                if (boost >= segmentThreshold) {
                    assisted++;
                }
            } else if (alignment < -deadband) {
                uphill += -alignment * strength * step;
            }
        }
        return new TraversalAnalysis(lengthCost, downhill, uphill, assisted);
    }

    /**
     * {@code downhillMomentum - uphillResistance}.
     */
    public double netMomentum() {
        return downhillMomentum - uphillResistance;
    }
}
