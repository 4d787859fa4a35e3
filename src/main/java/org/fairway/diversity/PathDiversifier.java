package org.fairway.diversity;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import lombok.extern.slf4j.Slf4j;
import org.fairway.config.HeuristicsConfig;
import org.fairway.geometry.Fairway;
import org.fairway.grid.CellCoord;
import org.fairway.grid.GridBuilder;
import org.fairway.grid.TerrainGrid;
import org.fairway.level.Level;
import org.fairway.metrics.PathMetrics;
import org.fairway.metrics.StrokeModel;
import org.fairway.metrics.TraversalAnalysis;
import org.fairway.par.ParEstimate;
import org.fairway.par.ParEstimator;
import org.fairway.search.GridAStarSearch;
import org.fairway.search.SearchConstraints;
import org.fairway.search.SearchResult;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * K-best route generation by constrained re-search.
 *
 * <p>Execution model:</p>
 * <ul>
 * <li>Seed the pool with the base path and one forced path per open first step from the tee.</li>
 * <li>Sample interior cells of queued paths at spaced intervals, ban one or two at a time and
 * re-run the search; new routes are queued up to {@link DiversifierBudget#maxDepth()}.</li>
 * <li>Routes sharing at least 60% of the smaller route's cells are the same route: the lower-stroke
 * variant wins unless their slope assistance differs materially, in which case both stay.</li>
 * <li>Candidates are sorted by strokes, then length, and truncated to K.</li>
 * </ul>
 */
@Slf4j
public final class PathDiversifier {
    static final double SIMILARITY_THRESHOLD = 0.6d;
    static final double MOMENTUM_GAP = 0.6d;
    static final int AUTO_ASSIST_GAP = 2;
    static final double REPLACEMENT_MARGIN = 0.05d;

    private static final int[] DC = {1, -1, 0, 0, 1, 1, -1, -1};
    private static final int[] DR = {0, 0, 1, -1, 1, -1, 1, -1};

    private static final Comparator<CandidatePath> BY_STROKES_THEN_LENGTH =
            Comparator.comparingDouble(CandidatePath::getStrokes).thenComparingDouble(CandidatePath::getLengthPx);

    private final GridBuilder gridBuilder;
    private final GridAStarSearch search;
    private final ParEstimator parEstimator;
    private final DiversifierBudget budget;

    public PathDiversifier() {
        this(new GridBuilder(), new GridAStarSearch());
    }

    public PathDiversifier(GridBuilder gridBuilder, GridAStarSearch search) {
        this(gridBuilder, search, DiversifierBudget.defaults());
    }

    PathDiversifier(GridBuilder gridBuilder, GridAStarSearch search, DiversifierBudget budget) {
        this.gridBuilder = Objects.requireNonNull(gridBuilder, "gridBuilder");
        this.search = Objects.requireNonNull(search, "search");
        this.parEstimator = new ParEstimator(gridBuilder, search);
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    /**
     * Suggests up to {@code k} materially different routes from tee to cup.
     *
     * @param k maximum number of candidates, at least 1.
     */
    public KBestResult suggest(Level level, Fairway fairway, double cellSize, int k, HeuristicsConfig config) {
        Objects.requireNonNull(config, "config");
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1, got " + k);
        }
        TerrainGrid grid = gridBuilder.build(level, fairway, cellSize);
        CellCoord start = grid.toCell(level.getTee());
        CellCoord goal = grid.toCell(level.getCup().center());

        SearchResult base = search.search(grid, start, goal);
        if (!base.found()) {
            ParEstimate fallback = parEstimator.estimate(level, fairway, cellSize, config);
            return KBestResult.builder()
                    .reachable(false)
                    .bestIndex(-1)
                    .par(fallback.getSuggestedPar())
                    .build();
        }

        Pool pool = new Pool(grid, config, budget.maxPool(k));
        Deque<QueuedPath> queue = new ArrayDeque<>();
        int queued = 0;
        if (pool.consider(base.path()) != null) {
            queue.add(new QueuedPath(base.path(), 0));
            queued++;
        }

        seedFromStartNeighbors(grid, start, goal, pool);

        while (!queue.isEmpty() && !pool.isFull()) {
            QueuedPath next = queue.poll();
            List<CellCoord> path = next.path();
            if (path.size() < 4) {
                continue;
            }
            int sampleStep = Math.max(2, (int) Math.round(path.size() / (double) Math.max(4, k * 3)));
            List<Integer> samples = sampleIndices(path.size(), sampleStep);

            for (int i : samples) {
                SearchConstraints bans = SearchConstraints.banning(grid, path.get(i));
                queued += explore(grid, start, goal, bans, pool, queue, next.depth(), queued);
            }
            if (pool.isFull()) {
                break;
            }
            if (path.size() >= 6) {
                int partnerOffset = Math.max(1, sampleStep / 2);
                for (int i : samples) {
                    CellCoord partner = path.get(Math.min(path.size() - 2, i + partnerOffset));
                    SearchConstraints bans = SearchConstraints.banning(grid, path.get(i), partner);
                    queued += explore(grid, start, goal, bans, pool, queue, next.depth(), queued);
                }
            }
        }

        List<CandidatePath> ranked = new ArrayList<>(pool.candidates());
        ranked.sort(BY_STROKES_THEN_LENGTH);
        List<CandidatePath> top = ranked.subList(0, Math.min(k, ranked.size()));
        log.debug("Diversified {} routes into {} candidates (pool {}, k={})",
                pool.considered(), ranked.size(), pool.capacity(), k);

        int par = top.isEmpty()
                ? HeuristicsConfig.clampPar(base.pathCost() * cellSize / config.effectiveShotPx() + 1.0d)
                : top.get(0).getPar();
        return KBestResult.builder()
                .reachable(true)
                .candidates(top)
                .bestIndex(top.isEmpty() ? -1 : 0)
                .par(par)
                .build();
    }

    /**
     * Scores one fixed path on a grid, including slope momentum.
     */
    public static CandidatePath score(TerrainGrid grid, List<CellCoord> path, HeuristicsConfig config) {
        TraversalAnalysis traversal = TraversalAnalysis.analyze(grid, path, config);
        PathMetrics metrics = PathMetrics.measure(grid, path);
        double lengthPx = traversal.lengthCost() * grid.cellSize();
        double strokes = StrokeModel.assistedStrokes(lengthPx, metrics, traversal, config);

        IntOpenHashSet keys = new IntOpenHashSet(path.size());
        CandidatePath.CandidatePathBuilder builder = CandidatePath.builder();
        for (CellCoord cell : path) {
            keys.add(grid.key(cell));
            builder.cell(cell);
            builder.worldPoint(grid.toWorld(cell));
        }
        return builder
                .lengthPx(lengthPx)
                .turns(metrics.turns())
                .corridorDensity(metrics.corridorDensity())
                .sandCells(metrics.sandCells())
                .slopeCells(metrics.slopeCells())
                .strokes(strokes)
                .par(StrokeModel.parFor(strokes))
                .downhillMomentum(traversal.downhillMomentum())
                .uphillResistance(traversal.uphillResistance())
                .autoAssistSegments(traversal.autoAssistSegments())
                .cellKeys(IntSets.unmodifiable(keys))
                .build();
    }

    private int explore(
            TerrainGrid grid,
            CellCoord start,
            CellCoord goal,
            SearchConstraints bans,
            Pool pool,
            Deque<QueuedPath> queue,
            int depth,
            int queued
    ) {
        SearchResult alternate = search.search(grid, start, goal, bans);
        if (!alternate.found()) {
            return 0;
        }
        CandidatePath added = pool.consider(alternate.path());
        if (added != null && depth < budget.maxDepth() && queued < pool.capacity()) {
            queue.add(new QueuedPath(alternate.path(), depth + 1));
            return 1;
        }
        return 0;
    }

    private void seedFromStartNeighbors(TerrainGrid grid, CellCoord start, CellCoord goal, Pool pool) {
        for (int d = 0; d < DC.length; d++) {
            int nc = start.col() + DC[d];
            int nr = start.row() + DR[d];
            if (!grid.inBounds(nc, nr) || grid.cell(nc, nr).blocked()) {
                continue;
            }
            if (DC[d] != 0 && DR[d] != 0
                    && (grid.isBlocked(start.col() + DC[d], start.row()) || grid.isBlocked(start.col(), start.row() + DR[d]))) {
                continue;
            }
            SearchResult forced = search.search(grid, new CellCoord(nc, nr), goal);
            if (!forced.found()) {
                continue;
            }
            List<CellCoord> seeded = new ArrayList<>(forced.path().size() + 1);
            seeded.add(start);
            seeded.addAll(forced.path());
            pool.consider(seeded);
            if (pool.isFull()) {
                break;
            }
        }
    }

    private static List<Integer> sampleIndices(int pathSize, int sampleStep) {
        List<Integer> indices = new ArrayList<>();
        for (int i = Math.max(2, sampleStep / 2); i < pathSize - 1; i += sampleStep) {
            indices.add(i);
        }
        return indices;
    }

    private record QueuedPath(List<CellCoord> path, int depth) {
    }

    /**
     * Candidate pool with route-identity deduplication.
     */
    static final class Pool {
        private final TerrainGrid grid;
        private final HeuristicsConfig config;
        private final int capacity;
        private final Set<List<CellCoord>> signatures = new HashSet<>();
        private final List<CandidatePath> candidates = new ArrayList<>();

        Pool(TerrainGrid grid, HeuristicsConfig config, int capacity) {
            this.grid = grid;
            this.config = config;
            this.capacity = capacity;
        }

        /**
         * Adds or substitutes a route.
         *
         * @return the stored candidate, or {@code null} when the route was a duplicate.
         */
        CandidatePath consider(List<CellCoord> path) {
            if (path.isEmpty() || !signatures.add(List.copyOf(path))) {
                return null;
            }
            return admit(score(grid, path, config));
        }

        /**
         * Applies the route-identity rules to an already scored candidate.
         * A route overlapping a stored one by at least {@link #SIMILARITY_THRESHOLD} is the same route
         * unless the two differ in downhill momentum or auto-assist count; a same route only
         * substitutes the stored one when it is cheaper by more than {@link #REPLACEMENT_MARGIN} strokes.
         *
         * @return the stored candidate, or {@code null} when it was dropped.
         */
        CandidatePath admit(CandidatePath candidate) {
            for (int i = 0; i < candidates.size(); i++) {
                CandidatePath existing = candidates.get(i);
                if (candidate.overlapFraction(existing) < SIMILARITY_THRESHOLD) {
                    continue;
                }
                if (playsDifferently(candidate, existing)) {
                    continue;
                }
                if (candidate.getStrokes() + REPLACEMENT_MARGIN < existing.getStrokes()) {
                    log.trace("Replacing route {} with lower-stroke variant ({} < {})",
                            i, candidate.getStrokes(), existing.getStrokes());
                    candidates.set(i, candidate);
                    return candidate;
                }
                return null;
            }
            candidates.add(candidate);
            return candidate;
        }

        boolean isFull() {
            return candidates.size() >= capacity;
        }

        int capacity() {
            return capacity;
        }

        int considered() {
            return signatures.size();
        }

        List<CandidatePath> candidates() {
            return candidates;
        }

        static boolean playsDifferently(CandidatePath a, CandidatePath b) {
            double momentumGap = Math.abs(a.getDownhillMomentum() - b.getDownhillMomentum());
            int assistGap = Math.abs(a.getAutoAssistSegments() - b.getAutoAssistSegments());
            return momentumGap >= MOMENTUM_GAP || assistGap >= AUTO_ASSIST_GAP;
        }
    }
}
