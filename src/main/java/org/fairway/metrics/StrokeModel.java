package org.fairway.metrics;

import lombok.experimental.UtilityClass;
import org.fairway.config.HeuristicsConfig;

/**
 * Converts path measurements into a stroke estimate.
 *
 * <p>Base strokes are {@code lengthPx / effectiveShotPx} plus capped penalties for sand, turns,
 * corridor contact and slope coverage. The slope-assisted variant then subtracts downhill bonuses
 * and never drops below the configured floor.</p>
 */
@UtilityClass
public class StrokeModel {

    /**
     * Strokes for a path before any slope-assistance bonus.
     */
    public static double baseStrokes(double lengthPx, PathMetrics metrics, HeuristicsConfig config) {
        double strokes = lengthPx / config.effectiveShotPx();
        strokes += metrics.sandCells() * config.effectiveSandPenaltyPerCell();
        strokes += Math.min(config.getTurnPenaltyMax(), metrics.turns() * config.getTurnPenaltyPerTurn());
        strokes += Math.min(config.getBankPenaltyMax(), metrics.corridorDensity() * config.getBankWeight());
        if (metrics.slopeCells() > 0) {
            strokes += config.getHillBump() * (0.5d + 0.5d * metrics.slopeCoverage());
        }
        return strokes;
    }

    /**
     * Strokes for a path including downhill momentum and auto-assist bonuses.
     */
    public static double assistedStrokes(
            double lengthPx,
            PathMetrics metrics,
            TraversalAnalysis traversal,
            HeuristicsConfig config
    ) {
        double strokes = baseStrokes(lengthPx, metrics, config);
        double momentum = traversal.downhillMomentum();
        if (momentum > 0.0d) {
            double bonus = Math.min(config.getDownhillBonusMax(), momentum * config.getDownhillBonusFactor());
            strokes = Math.max(config.getStrokeFloor(), strokes - bonus);
            boolean autoAssisted = traversal.autoAssistSegments() >= config.getAutoAssistSegmentThreshold()
                    || traversal.netMomentum() > config.getAutoAssistMomentumThreshold();
            if (autoAssisted) {
                strokes = Math.max(config.getStrokeFloor(), strokes - config.getAutoAssistBonus());
            }
        }
        return strokes;
    }

    /**
     * Par for a stroke estimate: the estimate plus the opening stroke, rounded and clamped to {@code [2, 7]}.
     */
    public static int parFor(double strokes) {
        return HeuristicsConfig.clampPar(strokes + 1.0d);
    }
}
