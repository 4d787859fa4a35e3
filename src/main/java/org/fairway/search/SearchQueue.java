package org.fairway.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Min-priority queue over grid cells for A* expansion.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Pooled States:</strong> {@link SearchState} instances come from a pre-allocated stack and
 * are returned through {@link #recycle(SearchState)}.</li>
 * <li><strong>Decrease-Key:</strong> a cell already queued is updated in place in O(log n) through the
 * position tracking array; its first-insertion sequence is kept.</li>
 * <li><strong>Stable Ties:</strong> equal priorities pop in first-insertion order.</li>
 * </ul>
 * </p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe. Each search owns its queue.</p>
 */
public class SearchQueue {

    // 1-based binary heap
    private final SearchState[] heap;
    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    // positions[cellKey] = heap index, 0 when absent
    private final int[] positions;

    private final SearchState[] pool;
    private int poolTop;

    private long nextSequence = 0L;
    private int activeStates = 0;
    @Getter
    private int peakActiveStates = 0;

    /**
     * Initializes the queue for a grid with {@code cellCount} cells.
     *
     * @param cellCount number of addressable cell keys, must be positive.
     * @param capacity maximum simultaneously queued cells, also the pool size.
     * @throws IllegalArgumentException if either bound is not positive.
     */
    public SearchQueue(int cellCount, int capacity) {
        if (cellCount <= 0) {
            throw new IllegalArgumentException("cellCount must be positive");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.heap = new SearchState[capacity + 1];
        this.positions = new int[cellCount];
        this.pool = new SearchState[capacity];
        for (int i = 0; i < capacity; i++) {
            pool[i] = new SearchState();
        }
        poolTop = capacity - 1;
    }

    /**
     * Queues a cell, or lowers its priority when it is already queued with a higher one.
     *
     * @param cellKey grid cell key.
     * @param priority search priority.
     * @return {@code true} when the queue changed.
     * @throws IllegalArgumentException if {@code cellKey} is out of range.
     * @throws IllegalStateException if the heap or pool is exhausted.
     */
    public boolean insert(int cellKey, double priority) {
        if (cellKey < 0 || cellKey >= positions.length) {
            throw new IllegalArgumentException("cellKey " + cellKey + " out of bounds (max: " + (positions.length - 1) + ")");
        }

        int existingIdx = positions[cellKey];
        if (existingIdx > 0) {
            SearchState existing = heap[existingIdx];
            if (priority < existing.priority) {
                existing.priority = priority;
                swim(existingIdx);
                return true;
            }
            return false;
        }

        if (size >= heap.length - 1) {
            throw new IllegalStateException("Heap full. Increase capacity.");
        }
        if (poolTop < 0) {
            throw new IllegalStateException(
                    "Pool exhausted. Recycle extracted states. Active: " + activeStates + ", Capacity: " + pool.length
            );
        }

        SearchState state = pool[poolTop--];
        activeStates++;
        if (activeStates > peakActiveStates) {
            peakActiveStates = activeStates;
        }
        state.set(cellKey, priority, nextSequence++);

        size++;
        heap[size] = state;
        positions[cellKey] = size;
        swim(size);
        return true;
    }

    /**
     * Returns whether a cell is currently queued.
     */
    public boolean contains(int cellKey) {
        return cellKey >= 0 && cellKey < positions.length && positions[cellKey] > 0;
    }

    /**
     * Extracts the minimum state.
     * <p>
     * <strong>Contract:</strong> the caller returns the state through {@link #recycle(SearchState)}.
     * </p>
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public SearchState extractMin() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }

        SearchState min = heap[1];
        int lastIndex = size;
        if (lastIndex == 1) {
            heap[1] = null;
            positions[min.cellKey] = 0;
            size = 0;
            return min;
        }

        SearchState last = heap[lastIndex];
        heap[1] = last;
        heap[lastIndex] = null;
        size = lastIndex - 1;
        positions[last.cellKey] = 1;
        positions[min.cellKey] = 0;
        sink(1);
        return min;
    }

    /**
     * Returns an extracted state to the pool.
     *
     * @param state state to recycle; {@code null} is ignored.
     * @throws IllegalStateException on double-recycle.
     */
    public void recycle(SearchState state) {
        if (state == null) return;
        if (poolTop >= pool.length - 1) {
            throw new IllegalStateException("Pool overflow or double-recycle detected");
        }
        if (activeStates <= 0) {
            throw new IllegalStateException("Recycle called with no active states");
        }
        activeStates--;
        pool[++poolTop] = state;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    // --- Heap Helper Methods ---

    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && greater(j, j + 1)) j++;
            if (!greater(k, j)) break;
            swap(k, j);
            k = j;
        }
    }

    private boolean greater(int i, int j) {
        return heap[i].compareTo(heap[j]) > 0;
    }

    private void swap(int i, int j) {
        SearchState s1 = heap[i];
        SearchState s2 = heap[j];
        heap[i] = s2;
        heap[j] = s1;
        positions[s1.cellKey] = j;
        positions[s2.cellKey] = i;
    }
}
