package org.pathfinder.routing.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Indexed binary min-heap used as the A* open set.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>One entry per node:</strong> a position array maps node index to heap slot, so a
 * better path to a node already in the frontier is a decrease-key, not a duplicate entry.</li>
 * <li><strong>Pooled states:</strong> {@link SearchState} instances come from a pre-allocated
 * stack pool and are returned through {@link #recycle(SearchState)}.</li>
 * <li><strong>Deterministic order:</strong> see {@link SearchState#compareTo(SearchState)}.</li>
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

    // positions[nodeIndex] = heap slot, 0 when absent
    private final int[] positions;

    private final SearchState[] pool;
    private int poolTop;

    private int activeStates = 0;

    /**
     * Creates a queue able to hold every node of a graph at once.
     *
     * @param nodeCount number of nodes in the searched graph; must be positive.
     * @throws IllegalArgumentException if nodeCount is not positive.
     */
    public SearchQueue(int nodeCount) {
        if (nodeCount <= 0) {
            throw new IllegalArgumentException("nodeCount must be positive");
        }
        this.heap = new SearchState[nodeCount + 1];
        this.positions = new int[nodeCount];
        this.pool = new SearchState[nodeCount];
        for (int i = 0; i < nodeCount; i++) {
            pool[i] = new SearchState();
        }
        poolTop = nodeCount - 1;
    }

    /**
     * Inserts a node into the frontier or lowers its cost if the new path is better.
     *
     * @param nodeIndex   node reached.
     * @param cost        accumulated cost (g).
     * @param priority    cost plus heuristic (f).
     * @param predecessor node index the path came from.
     * @return true when the frontier changed.
     * @throws IllegalArgumentException if nodeIndex is out of bounds.
     * @throws IllegalStateException    if the pool is exhausted.
     */
    public boolean insert(int nodeIndex, double cost, double priority, int predecessor) {
        if (nodeIndex < 0 || nodeIndex >= positions.length) {
            throw new IllegalArgumentException(
                    "nodeIndex " + nodeIndex + " out of bounds (max: " + (positions.length - 1) + ")");
        }

        int existingIdx = positions[nodeIndex];
        if (existingIdx > 0) {
            SearchState existing = heap[existingIdx];
            if (cost < existing.cost) {
                existing.set(nodeIndex, cost, priority, predecessor);
                swim(existingIdx);
                return true;
            }
            return false;
        }

        if (poolTop < 0) {
            throw new IllegalStateException(
                    "Pool exhausted. Recycle extracted states. " +
                            "Active: " + activeStates + ", Capacity: " + pool.length
            );
        }

        SearchState newState = pool[poolTop--];
        activeStates++;
        newState.set(nodeIndex, cost, priority, predecessor);

        size++;
        heap[size] = newState;
        positions[nodeIndex] = size;
        swim(size);
        return true;
    }

    /**
     * Extracts the minimum state.
     * <p>
     * <strong>Contract:</strong> the caller must hand the state back via
     * {@link #recycle(SearchState)} once done with it.
     * </p>
     *
     * @throws EmptyQueueException if queue is empty.
     */
    public SearchState extractMin() {
        if (isEmpty()) {
            throw new EmptyQueueException("Queue is empty");
        }

        SearchState min = heap[1];
        int lastIndex = size;

        if (lastIndex == 1) {
            heap[1] = null;
            positions[min.nodeIndex] = 0;
            size = 0;
            return min;
        }

        SearchState last = heap[lastIndex];
        heap[1] = last;
        heap[lastIndex] = null;
        size = lastIndex - 1;

        positions[last.nodeIndex] = 1;
        positions[min.nodeIndex] = 0;

        sink(1);
        return min;
    }

    /**
     * Returns a state to the pool.
     *
     * @param state state to recycle; null is ignored.
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
        positions[s1.nodeIndex] = j;
        positions[s2.nodeIndex] = i;
    }
}
