package org.fairway.search;

/**
 * Mutable open-set entry of the grid search.
 * <p>
 * Instances are pooled by {@link SearchQueue} and re-initialized through
 * {@link #set(int, double, long)}, so one search allocates at most one state per cell.
 * </p>
 */
public class SearchState implements Comparable<SearchState> {

    /** Row-major key of the grid cell. */
    public int cellKey;

    /** Search priority {@code f = g + h}. */
    public double priority;

    /** Order of first insertion into the open set; stable tie-breaker. */
    public long sequence;

    /**
     * Default constructor used for pool pre-allocation.
     */
    public SearchState() {
        // pooled
    }

    /**
     * Re-initializes this state.
     *
     * @param cellKey grid cell key.
     * @param priority search priority.
     * @param sequence first-insertion order.
     */
    public void set(int cellKey, double priority, long sequence) {
        this.cellKey = cellKey;
        this.priority = priority;
        this.sequence = sequence;
    }

    /**
     * Orders by priority, then by first insertion (earlier wins).
     * <p>
     * Equal priorities therefore resolve exactly like a linear scan over an insertion-ordered
     * list that keeps the first minimum.
     * </p>
     */
    @Override
    public int compareTo(SearchState other) {
        int byPriority = Double.compare(this.priority, other.priority);
        if (byPriority != 0) {
            return byPriority;
        }
        return Long.compare(this.sequence, other.sequence);
    }

    @Override
    public String toString() {
        return "SearchState{" +
                "cell=" + cellKey +
                ", priority=" + priority +
                ", seq=" + sequence +
                '}';
    }
}
