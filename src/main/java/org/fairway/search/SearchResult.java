package org.fairway.search;

import org.fairway.grid.CellCoord;

import java.util.List;

/**
 * Outcome of one grid search.
 *
 * @param found whether the goal was reached.
 * @param path cells from start to goal inclusive (empty when not found). Every cell is unblocked
 *             except possibly the first: a start placed on a blocked cell is kept as given.
 * @param pathCost sum of {@code stepWeight * arrivalCell.cost} along the path, without slope bias.
 * @param expandedStates number of cells popped and expanded.
 */
public record SearchResult(boolean found, List<CellCoord> path, double pathCost, int expandedStates) {

    public SearchResult {
        path = List.copyOf(path);
    }

    /**
     * Canonical not-found result.
     */
    static SearchResult unreachable(int expandedStates) {
        return new SearchResult(false, List.of(), 0.0d, expandedStates);
    }
}
