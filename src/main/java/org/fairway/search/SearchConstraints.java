package org.fairway.search;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import org.fairway.grid.CellCoord;
import org.fairway.grid.TerrainGrid;

import java.util.Objects;

/**
 * Optional restrictions applied to one search.
 *
 * <p>Banned cells are skipped whenever they are popped for expansion, so no returned path runs
 * through them.</p>
 */
public final class SearchConstraints {
    public static final SearchConstraints NONE = new SearchConstraints(IntSets.EMPTY_SET);

    private final IntSet bannedCells;

    private SearchConstraints(IntSet bannedCells) {
        this.bannedCells = bannedCells;
    }

    /**
     * Bans the given cells on {@code grid}.
     */
    public static SearchConstraints banning(TerrainGrid grid, CellCoord... cells) {
        Objects.requireNonNull(grid, "grid");
        IntOpenHashSet keys = new IntOpenHashSet(cells.length);
        for (CellCoord cell : cells) {
            keys.add(grid.key(cell));
        }
        return new SearchConstraints(IntSets.unmodifiable(keys));
    }

    public boolean isBanned(int cellKey) {
        return bannedCells.contains(cellKey);
    }

    public boolean hasBans() {
        return !bannedCells.isEmpty();
    }

    public int bannedCount() {
        return bannedCells.size();
    }
}
