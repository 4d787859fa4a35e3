package org.fairway.config;

import lombok.Builder;
import lombok.Value;
import org.fairway.geometry.Fairway;
import org.fairway.geometry.Shape;

/**
 * Tunables shared by par estimation, route diversification, goal suggestion and linting.
 *
 * <p>Every field has an independent default; callers override only what they tune. Fields typed as
 * boxed {@link Double} default to {@code null} and resolve against the cell size or fairway of the
 * call through the {@code resolve*} methods.</p>
 */
@Value
@Builder(toBuilder = true)
public class HeuristicsConfig {
    /** Lower bound applied to both friction coefficients. */
    public static final double MIN_FRICTION_K = 0.05d;
    /** Lowest and highest par ever suggested. */
    public static final int MIN_PAR = 2;
    public static final int MAX_PAR = 7;

    // --- stroke model ---

    /** Pixels covered by one typical shot at the reference friction. */
    @Builder.Default
    double baselineShotPx = 320.0d;

    /** Friction coefficient the baseline shot distance was tuned for. */
    @Builder.Default
    double referenceFrictionK = 1.2d;

    /** Live friction coefficient of the physics model; higher shortens shots. */
    @Builder.Default
    double frictionK = 1.2d;

    /** Sand friction multiplier of the physics model; scales the sand penalty relative to 6. */
    @Builder.Default
    double sandFrictionMultiplier = 6.0d;

    @Builder.Default
    double sandPenaltyPerCell = 0.01d;

    @Builder.Default
    double turnPenaltyPerTurn = 0.08d;

    @Builder.Default
    double turnPenaltyMax = 1.5d;

    /** Strokes added per blocked neighbor on average along the path. */
    @Builder.Default
    double bankWeight = 0.12d;

    @Builder.Default
    double bankPenaltyMax = 1.0d;

    /** Bump applied when a path crosses slope cells, scaled by slope coverage. */
    @Builder.Default
    double hillBump = 0.15d;

    // --- slope assistance (route diversification) ---

    @Builder.Default
    double downhillBonusFactor = 0.18d;

    @Builder.Default
    double downhillBonusMax = 1.6d;

    /** Net momentum above which a route counts as auto-assisted. */
    @Builder.Default
    double autoAssistMomentumThreshold = 1.35d;

    @Builder.Default
    double autoAssistBonus = 0.45d;

    /** Number of strongly assisted steps that also counts as auto-assisted. */
    @Builder.Default
    int autoAssistSegmentThreshold = 3;

    /** Downhill contribution of one step that marks it as strongly assisted. */
    @Builder.Default
    double autoAssistSegmentMomentum = 0.6d;

    /** Steps aligned within this band of zero count as neither downhill nor uphill. */
    @Builder.Default
    double slopeAlignmentDeadband = 0.05d;

    /** Stroke estimate never drops below this after slope bonuses. */
    @Builder.Default
    double strokeFloor = 0.35d;

    // --- unreachable fallback ---

    @Builder.Default
    double fallbackShotPx = 260.0d;

    @Builder.Default
    double fallbackObstacleWeight = 0.3d;

    // --- goal suggestion ---

    /** Distance from fairway edges a cup must keep; {@code null} means {@code max(20, round(2 * cellSize))}. */
    Double edgeMargin;

    /** Path length must reach this multiple of the straight-line distance. */
    @Builder.Default
    double minStraightnessRatio = 1.08d;

    @Builder.Default
    int minTurns = 0;

    /** Minimum tee distance of a candidate; {@code null} means 25% of the larger fairway dimension. */
    Double minDistancePx;

    /** Score per blocked neighbor along a candidate path; {@code null} means {@code cellSize * 0.5}. */
    Double goalBankWeight;

    /** Minimum spacing between returned candidates, in cells. */
    @Builder.Default
    double minSeparationCells = 6.0d;

    /** Optional region a candidate cup must lie inside. */
    Shape candidateRegion;

    // --- cup lint ---

    /** A path shorter than this multiple of the straight-line distance may bypass obstacles. */
    @Builder.Default
    double lintStraightnessRatio = 1.08d;

    /** Edge distance below which the cup is flagged; {@code null} means {@code max(20, 2 * cellSize)}. */
    Double lintEdgeMargin;

    /**
     * Returns the all-defaults configuration.
     */
    public static HeuristicsConfig defaults() {
        return HeuristicsConfig.builder().build();
    }

    /**
     * Effective pixels per stroke: {@code baselineShotPx * referenceK / frictionK}.
     */
    public double effectiveShotPx() {
        double referenceK = Math.max(MIN_FRICTION_K, referenceFrictionK);
        double liveK = Math.max(MIN_FRICTION_K, frictionK);
        return baselineShotPx * (referenceK / liveK);
    }

    /**
     * Sand penalty per path cell, scaled by the live sand friction multiplier.
     */
    public double effectiveSandPenaltyPerCell() {
        return sandPenaltyPerCell * (sandFrictionMultiplier / 6.0d);
    }

    public double resolveEdgeMargin(double cellSize) {
        return edgeMargin != null ? edgeMargin : Math.max(20.0d, Math.round(cellSize * 2.0d));
    }

    public double resolveLintEdgeMargin(double cellSize) {
        return lintEdgeMargin != null ? lintEdgeMargin : Math.max(20.0d, cellSize * 2.0d);
    }

    public double resolveMinDistancePx(Fairway fairway) {
        return minDistancePx != null ? minDistancePx : fairway.largerDimension() * 0.25d;
    }

    public double resolveGoalBankWeight(double cellSize) {
        return goalBankWeight != null ? goalBankWeight : cellSize * 0.5d;
    }

    /**
     * Clamps a rounded stroke count into {@code [2, 7]}.
     */
    public static int clampPar(double strokesIncludingTee) {
        long rounded = Math.round(strokesIncludingTee);
        return (int) Math.max(MIN_PAR, Math.min(MAX_PAR, rounded));
    }
}
